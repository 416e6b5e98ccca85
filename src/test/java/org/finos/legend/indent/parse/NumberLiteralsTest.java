package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Base;
import org.finos.legend.indent.ast.NumLiteral;
import org.finos.legend.indent.parse.error.ENumber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NumberLiterals Tests")
class NumberLiteralsTest {

    private static ParseResult<NumLiteral, ENumber> signed(String source) {
        return NumberLiterals.numberLiteral().parse(State.of(source));
    }

    @ParameterizedTest
    @CsvSource({
            "42, 42",
            "1_000, 1_000",
            "-17, -17",
            "0, 0"
    })
    @DisplayName("Decimal integers keep their text")
    void testIntegers(String source, String text) {
        assertEquals(new NumLiteral.Num(text), signed(source).value());
    }

    @ParameterizedTest
    @CsvSource({
            "1.5, 1.5",
            "2e10, 2e10",
            "-0.25, -0.25",
            "6.02E-23, 6.02E-23"
    })
    @DisplayName("Floats")
    void testFloats(String source, String text) {
        assertEquals(new NumLiteral.Float(text), signed(source).value());
    }

    @Test
    @DisplayName("Non-decimal bases")
    void testBases() {
        assertEquals(new NumLiteral.NonBase10Int("0xFF", Base.HEX, false), signed("0xFF").value());
        assertEquals(new NumLiteral.NonBase10Int("0o17", Base.OCTAL, false), signed("0o17").value());
        assertEquals(new NumLiteral.NonBase10Int("-0b10", Base.BINARY, true), signed("-0b10").value());
    }

    @Test
    @DisplayName("Literal stops before an operator")
    void testStopsAtOperator() {
        ParseResult<NumLiteral, ENumber> result = signed("12+3");
        assertEquals(new NumLiteral.Num("12"), result.value());
        assertEquals(2, result.state().offset());
    }

    @Test
    @DisplayName("Minus without a digit is not a number")
    void testMinusAlone() {
        ParseResult<NumLiteral, ENumber> result = signed("-x");
        assertFalse(result.isOk());
        assertEquals(Progress.NO_PROGRESS, result.progress());
    }

    @Test
    @DisplayName("Unsigned parser leaves the minus alone")
    void testUnsigned() {
        ParseResult<NumLiteral, ENumber> result = NumberLiterals.positiveNumberLiteral().parse(State.of("-1"));
        assertFalse(result.isOk());
        assertEquals(Progress.NO_PROGRESS, result.progress());
    }

    @Test
    @DisplayName("Letters glued to digits are an error")
    void testTrailingLetters() {
        ParseResult<NumLiteral, ENumber> result = signed("12px");
        assertFalse(result.isOk());
        assertEquals(Progress.MADE_PROGRESS, result.progress());
        assertEquals(2, result.error().column());
    }

    @Test
    @DisplayName("Empty hex literal is an error")
    void testEmptyHex() {
        ParseResult<NumLiteral, ENumber> result = signed("0x");
        assertFalse(result.isOk());
        assertEquals(Progress.MADE_PROGRESS, result.progress());
    }
}
