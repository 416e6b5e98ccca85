package org.finos.legend.indent.parse.error;

/**
 * Numeric literal errors.
 */
public sealed interface ENumber extends ParseProblem {

    /** A literal ran straight into letters or a second decimal point. */
    record End(int line, int column) implements ENumber {
    }
}
