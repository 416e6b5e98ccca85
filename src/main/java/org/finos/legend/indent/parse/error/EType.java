package org.finos.legend.indent.parse.error;

/**
 * Errors from the type annotation grammar.
 */
public sealed interface EType extends ParseProblem {

    record Start(int line, int column) implements EType {
    }

    record Space(BadInputError problem, int line, int column) implements EType {
    }

    record Arrow(int line, int column) implements EType {
    }

    record RecordField(int line, int column) implements EType {
    }

    record RecordColon(int line, int column) implements EType {
    }

    record RecordEnd(int line, int column) implements EType {
    }

    record TagUnionEnd(int line, int column) implements EType {
    }

    record InParensEnd(int line, int column) implements EType {
    }

    record IndentStart(int line, int column) implements EType {
    }

    record IndentEnd(int line, int column) implements EType {
    }
}
