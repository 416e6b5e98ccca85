package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Base;
import org.finos.legend.indent.ast.NumLiteral;
import org.finos.legend.indent.parse.error.ENumber;

/**
 * Literal classifier for numbers.
 *
 * <p>Recognizes decimal integers ({@code 1_000}), floats ({@code 1.5},
 * {@code 1.0E-5}) and {@code 0x}/{@code 0o}/{@code 0b} integers. The returned
 * literal keeps its exact source text, sign and prefix included.
 */
public final class NumberLiterals {

    private NumberLiterals() {
    }

    /** A number literal, optionally preceded by {@code -}. */
    public static Parser<NumLiteral, ENumber> numberLiteral() {
        return state -> parse(state, true);
    }

    /** A number literal without a sign. */
    public static Parser<NumLiteral, ENumber> positiveNumberLiteral() {
        return state -> parse(state, false);
    }

    private static ParseResult<NumLiteral, ENumber> parse(State state, boolean allowSign) {
        int index = 0;
        boolean negative = false;
        if (allowSign && state.peek() == '-' && isDigit(state.peek(1))) {
            negative = true;
            index = 1;
        }
        if (!isDigit(state.peek(index))) {
            return ParseResult.err(Progress.NO_PROGRESS, new ENumber.End(state.line(), state.column()), state);
        }

        if (state.peek(index) == '0') {
            Base base = baseFor(state.peek(index + 1));
            if (base != null) {
                return chompBase(state, index + 2, base, negative);
            }
        }
        return chompDecimal(state, index);
    }

    private static Base baseFor(char marker) {
        return switch (marker) {
            case 'x' -> Base.HEX;
            case 'o' -> Base.OCTAL;
            case 'b' -> Base.BINARY;
            default -> null;
        };
    }

    private static ParseResult<NumLiteral, ENumber> chompBase(State state, int digitsStart, Base base, boolean negative) {
        int index = digitsStart;
        while (base.isDigit(state.peek(index)) || state.peek(index) == '_') {
            index++;
        }
        if (index == digitsStart || isIdentifierChar(state.peek(index))) {
            return ParseResult.err(Progress.MADE_PROGRESS,
                    new ENumber.End(state.line(), state.column() + index), state);
        }
        State after = state.advance(index);
        return ParseResult.ok(Progress.MADE_PROGRESS,
                new NumLiteral.NonBase10Int(state.textUntil(after), base, negative), after);
    }

    private static ParseResult<NumLiteral, ENumber> chompDecimal(State state, int digitsStart) {
        int index = chompDigits(state, digitsStart);
        boolean isFloat = false;

        if (state.peek(index) == '.' && isDigit(state.peek(index + 1))) {
            isFloat = true;
            index = chompDigits(state, index + 1);
        }
        char marker = state.peek(index);
        if (marker == 'e' || marker == 'E') {
            int exponent = index + 1;
            if (state.peek(exponent) == '-' || state.peek(exponent) == '+') {
                exponent++;
            }
            if (isDigit(state.peek(exponent))) {
                isFloat = true;
                index = chompDigits(state, exponent);
            }
        }
        if (isIdentifierChar(state.peek(index)) || (state.peek(index) == '.' && isDigit(state.peek(index + 1)))) {
            return ParseResult.err(Progress.MADE_PROGRESS,
                    new ENumber.End(state.line(), state.column() + index), state);
        }

        State after = state.advance(index);
        String text = state.textUntil(after);
        NumLiteral literal = isFloat ? new NumLiteral.Float(text) : new NumLiteral.Num(text);
        return ParseResult.ok(Progress.MADE_PROGRESS, literal, after);
    }

    private static int chompDigits(State state, int from) {
        int index = from;
        while (isDigit(state.peek(index)) || state.peek(index) == '_') {
            index++;
        }
        return index;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
