package org.finos.legend.indent.parse.error;

/**
 * Errors inside a lambda {@code \a, b -> body}.
 */
public sealed interface ELambda extends ParseProblem {

    record Start(int line, int column) implements ELambda {
    }

    record Arrow(int line, int column) implements ELambda {
    }

    record Comma(int line, int column) implements ELambda {
    }

    record Arg(int line, int column) implements ELambda {
    }

    record Pattern(EPattern problem, int line, int column) implements ELambda {
    }

    record Body(EExpr problem, int line, int column) implements ELambda {
    }

    record Space(BadInputError problem, int line, int column) implements ELambda {
    }

    record IndentArrow(int line, int column) implements ELambda {
    }

    record IndentBody(int line, int column) implements ELambda {
    }

    record IndentArg(int line, int column) implements ELambda {
    }
}
