package org.finos.legend.indent.parse.error;

/**
 * Common shape of every context error: the 0-based position it was raised at.
 */
public interface ParseProblem {

    int line();

    int column();
}
