package org.finos.legend.indent.ast;

/**
 * Radix of a non-decimal integer literal.
 */
public enum Base {
    HEX("0x", 16),
    OCTAL("0o", 8),
    BINARY("0b", 2),
    DECIMAL("", 10);

    private final String prefix;
    private final int radix;

    Base(String prefix, int radix) {
        this.prefix = prefix;
        this.radix = radix;
    }

    public String prefix() {
        return prefix;
    }

    public int radix() {
        return radix;
    }

    public boolean isDigit(char c) {
        return Character.digit(c, radix) >= 0;
    }
}
