package org.finos.legend.indent.parse.error;

/**
 * Errors inside a record literal or record update.
 */
public sealed interface ERecord extends ParseProblem {

    record Open(int line, int column) implements ERecord {
    }

    record End(int line, int column) implements ERecord {
    }

    /** The thing before {@code &} is not a plain variable. */
    record Updateable(int line, int column) implements ERecord {
    }

    record Field(int line, int column) implements ERecord {
    }

    record Colon(int line, int column) implements ERecord {
    }

    record QuestionMark(int line, int column) implements ERecord {
    }

    record Ampersand(int line, int column) implements ERecord {
    }

    record Expr(EExpr problem, int line, int column) implements ERecord {
    }

    record Space(BadInputError problem, int line, int column) implements ERecord {
    }

    record IndentOpen(int line, int column) implements ERecord {
    }

    record IndentColon(int line, int column) implements ERecord {
    }

    record IndentEnd(int line, int column) implements ERecord {
    }
}
