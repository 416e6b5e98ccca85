package org.finos.legend.indent.ast;

/**
 * Output of the literal classifier. Text is the exact source slice,
 * including any sign and base prefix.
 */
public sealed interface NumLiteral permits NumLiteral.Num, NumLiteral.Float, NumLiteral.NonBase10Int {

    String text();

    record Num(String text) implements NumLiteral {
    }

    record Float(String text) implements NumLiteral {
    }

    record NonBase10Int(String text, Base base, boolean negative) implements NumLiteral {
    }
}
