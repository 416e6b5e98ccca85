package org.finos.legend.indent.parse.error;

/**
 * Errors inside a record destructure pattern {@code { x, y: p, z ? 0 }}.
 */
public sealed interface PRecord extends ParseProblem {

    record Open(int line, int column) implements PRecord {
    }

    record End(int line, int column) implements PRecord {
    }

    record Field(int line, int column) implements PRecord {
    }

    record Pattern(EPattern problem, int line, int column) implements PRecord {
    }

    record Expr(EExpr problem, int line, int column) implements PRecord {
    }

    record Space(BadInputError problem, int line, int column) implements PRecord {
    }

    record IndentOpen(int line, int column) implements PRecord {
    }

    record IndentColon(int line, int column) implements PRecord {
    }

    record IndentEnd(int line, int column) implements PRecord {
    }
}
