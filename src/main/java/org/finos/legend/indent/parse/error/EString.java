package org.finos.legend.indent.parse.error;

/**
 * String literal errors.
 */
public sealed interface EString extends ParseProblem {

    record Open(int line, int column) implements EString {
    }

    /** End of line or input before the closing quote. */
    record EndlessSingle(int line, int column) implements EString {
    }

    record UnknownEscape(int line, int column) implements EString {
    }

    record CodePointOpen(int line, int column) implements EString {
    }

    record CodePointEnd(int line, int column) implements EString {
    }

    record InvalidCodePoint(int line, int column) implements EString {
    }
}
