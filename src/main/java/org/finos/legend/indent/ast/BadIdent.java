package org.finos.legend.indent.ast;

/**
 * Reason an identifier-shaped run of characters is malformed.
 */
public enum BadIdent {
    UNDERSCORE,
    QUALIFIED_TAG,
    WEIRD_ACCESSOR,
    WEIRD_DOT_ACCESS,
    WEIRD_DOT_QUALIFIED,
    STRANGE_CAPS,
    BAD_PRIVATE_TAG
}
