package org.finos.legend.indent.ast;

public enum UnaryOperator {
    /** {@code -x} */
    NEGATE,
    /** {@code !x} */
    NOT
}
