package org.finos.legend.indent.ast;

/**
 * How a function application was written in the source.
 */
public enum CalledVia {
    /** Juxtaposition: {@code f a b} */
    SPACE,
    /** Desugared from an infix operator */
    BIN_OP,
    /** Desugared from a prefix operator */
    UNARY_OP
}
