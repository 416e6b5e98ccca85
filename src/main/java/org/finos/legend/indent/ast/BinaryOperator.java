package org.finos.legend.indent.ast;

/**
 * Infix operators recognized by the operator-chain engine.
 *
 * <p>{@link #ASSIGNMENT}, {@link #HAS_TYPE} and {@link #BACKPASSING} never end up
 * inside a {@link Expr.BinaryOp}: they switch the engine into definition parsing.
 */
public enum BinaryOperator {
    CARET("^"),
    STAR("*"),
    SLASH("/"),
    DOUBLE_SLASH("//"),
    PERCENT("%"),
    DOUBLE_PERCENT("%%"),
    PLUS("+"),
    MINUS("-"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_OR_EQ("<="),
    GREATER_THAN_OR_EQ(">="),
    AND("&&"),
    OR("||"),
    PIZZA("|>"),
    ASSIGNMENT("="),
    HAS_TYPE(":"),
    BACKPASSING("<-");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its exact spelling.
     *
     * @return the operator, or null if the text is not an operator
     */
    public static BinaryOperator fromSymbol(String text) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(text)) {
                return op;
            }
        }
        return null;
    }

    public boolean startsDefinition() {
        return this == ASSIGNMENT || this == HAS_TYPE || this == BACKPASSING;
    }
}
