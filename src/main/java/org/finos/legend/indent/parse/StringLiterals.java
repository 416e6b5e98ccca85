package org.finos.legend.indent.parse;

import org.finos.legend.indent.parse.error.EString;

/**
 * Literal classifier for single-line strings.
 *
 * <p>Supported escapes: {@code \\ \" \n \r \t} and <code>&#92;u(1F600)</code>.
 */
public final class StringLiterals {

    private StringLiterals() {
    }

    public static Parser<String, EString> stringLiteral() {
        return StringLiterals::parse;
    }

    private static ParseResult<String, EString> parse(State state) {
        if (state.isEmpty() || state.peek() != '"') {
            return ParseResult.err(Progress.NO_PROGRESS, new EString.Open(state.line(), state.column()), state);
        }

        StringBuilder sb = new StringBuilder();
        int index = 1;
        while (true) {
            if (index >= state.remaining() || state.peek(index) == '\n') {
                return endless(state, index);
            }
            char c = state.peek(index);
            if (c == '"') {
                return ParseResult.ok(Progress.MADE_PROGRESS, sb.toString(), state.advance(index + 1));
            }
            if (c != '\\') {
                sb.append(c);
                index++;
                continue;
            }

            char escaped = state.peek(index + 1);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case 'u' -> {
                    ParseResult<Integer, EString> codePoint = codePoint(state, index + 2);
                    if (!codePoint.isOk()) {
                        return codePoint.castErr();
                    }
                    sb.appendCodePoint(codePoint.value());
                    index = codePoint.state().offset() - state.offset();
                    continue;
                }
                default -> {
                    return ParseResult.err(Progress.MADE_PROGRESS,
                            new EString.UnknownEscape(state.line(), state.column() + index), state);
                }
            }
            index += 2;
        }
    }

    /**
     * Parses {@code (hex)} starting at {@code index}; the returned state sits after {@code )}.
     */
    private static ParseResult<Integer, EString> codePoint(State state, int index) {
        if (state.peek(index) != '(') {
            return ParseResult.err(Progress.MADE_PROGRESS,
                    new EString.CodePointOpen(state.line(), state.column() + index), state);
        }
        int digitsStart = index + 1;
        int end = digitsStart;
        while (Character.digit(state.peek(end), 16) >= 0) {
            end++;
        }
        if (state.peek(end) != ')') {
            return ParseResult.err(Progress.MADE_PROGRESS,
                    new EString.CodePointEnd(state.line(), state.column() + end), state);
        }
        String hex = state.source().substring(state.offset() + digitsStart, state.offset() + end);
        if (hex.isEmpty() || hex.length() > 6 || Integer.parseInt(hex, 16) > Character.MAX_CODE_POINT) {
            return ParseResult.err(Progress.MADE_PROGRESS,
                    new EString.InvalidCodePoint(state.line(), state.column() + digitsStart), state);
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, Integer.parseInt(hex, 16), state.advance(end + 1));
    }

    private static ParseResult<String, EString> endless(State state, int index) {
        return ParseResult.err(Progress.MADE_PROGRESS,
                new EString.EndlessSingle(state.line(), state.column() + index), state);
    }
}
