package org.finos.legend.indent.parse.error;

/**
 * Errors inside a parenthesized expression.
 */
public sealed interface EInParens extends ParseProblem {

    record Open(int line, int column) implements EInParens {
    }

    record End(int line, int column) implements EInParens {
    }

    record Expr(EExpr problem, int line, int column) implements EInParens {
    }

    record Space(BadInputError problem, int line, int column) implements EInParens {
    }

    record IndentOpen(int line, int column) implements EInParens {
    }

    record IndentEnd(int line, int column) implements EInParens {
    }
}
