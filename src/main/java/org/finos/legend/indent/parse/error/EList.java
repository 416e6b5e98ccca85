package org.finos.legend.indent.parse.error;

/**
 * Errors inside a list literal.
 */
public sealed interface EList extends ParseProblem {

    record Open(int line, int column) implements EList {
    }

    record End(int line, int column) implements EList {
    }

    record Expr(EExpr problem, int line, int column) implements EList {
    }

    record Space(BadInputError problem, int line, int column) implements EList {
    }

    record IndentOpen(int line, int column) implements EList {
    }

    record IndentEnd(int line, int column) implements EList {
    }
}
