package org.finos.legend.indent.parse.error;

public sealed interface PInParens extends ParseProblem {

    record Open(int line, int column) implements PInParens {
    }

    record End(int line, int column) implements PInParens {
    }

    record Pattern(EPattern problem, int line, int column) implements PInParens {
    }

    record Space(BadInputError problem, int line, int column) implements PInParens {
    }

    record IndentOpen(int line, int column) implements PInParens {
    }

    record IndentEnd(int line, int column) implements PInParens {
    }
}
