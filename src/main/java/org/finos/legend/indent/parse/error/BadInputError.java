package org.finos.legend.indent.parse.error;

/**
 * Problems with raw characters found while skipping spacing.
 */
public enum BadInputError {
    HAS_TAB,
    HAS_MISPLACED_CARRIAGE_RETURN
}
