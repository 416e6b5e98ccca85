package org.finos.legend.indent.parse.error;

/**
 * Pattern errors, with embedded record and parenthesized-pattern contexts.
 */
public sealed interface EPattern extends ParseProblem {

    record Start(int line, int column) implements EPattern {
    }

    record End(int line, int column) implements EPattern {
    }

    record Space(BadInputError problem, int line, int column) implements EPattern {
    }

    record InRecord(PRecord problem, int line, int column) implements EPattern {
    }

    record InParens(PInParens problem, int line, int column) implements EPattern {
    }

    record NumLiteral(ENumber problem, int line, int column) implements EPattern {
    }

    record StrLiteral(EString problem, int line, int column) implements EPattern {
    }

    record IndentStart(int line, int column) implements EPattern {
    }

    record IndentEnd(int line, int column) implements EPattern {
    }
}
