package org.finos.legend.indent.parse.error;

/**
 * Errors inside {@code if ... then ... else ...}.
 */
public sealed interface EIf extends ParseProblem {

    record If(int line, int column) implements EIf {
    }

    record Then(int line, int column) implements EIf {
    }

    /** An {@code if} without a terminal {@code else}. */
    record Else(int line, int column) implements EIf {
    }

    record Condition(EExpr problem, int line, int column) implements EIf {
    }

    record ThenBranch(EExpr problem, int line, int column) implements EIf {
    }

    record ElseBranch(EExpr problem, int line, int column) implements EIf {
    }

    record Space(BadInputError problem, int line, int column) implements EIf {
    }

    record IndentCondition(int line, int column) implements EIf {
    }

    record IndentThenToken(int line, int column) implements EIf {
    }

    record IndentElseToken(int line, int column) implements EIf {
    }

    record IndentThenBranch(int line, int column) implements EIf {
    }

    record IndentElseBranch(int line, int column) implements EIf {
    }
}
