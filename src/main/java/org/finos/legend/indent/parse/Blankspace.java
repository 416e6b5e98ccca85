package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Spaceable;
import org.finos.legend.indent.parse.error.BadInputError;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Spacing, comments and the indentation checks built on top of them.
 *
 * <p>Spacing that crosses a line break must land at or past {@code minIndent};
 * otherwise the parser fails with the caller's indentation error, reports
 * {@link Progress#MADE_PROGRESS}, and hands back the state from before the
 * spacing so the caller can stop cleanly at the end of the previous token.
 */
public final class Blankspace {

    private Blankspace() {
    }

    /**
     * Zero or more spaces, line breaks, {@code # comments} and {@code ## doc comments}.
     */
    public static <E> Parser<List<CommentOrNewline>, E> space0(
            int minIndent, SpaceError<E> spaceProblem, PositionalError<E> indentProblem) {
        return state -> {
            String source = state.source();
            int offset = state.offset();
            int line = state.line();
            int column = state.column();
            List<CommentOrNewline> spaces = new ArrayList<>();

            scan:
            while (offset < source.length()) {
                char c = source.charAt(offset);
                switch (c) {
                    case ' ':
                        offset++;
                        column++;
                        break;
                    case '\n':
                        spaces.add(CommentOrNewline.newline());
                        offset++;
                        line++;
                        column = 0;
                        break;
                    case '\r':
                        if (offset + 1 < source.length() && source.charAt(offset + 1) == '\n') {
                            offset++;
                            break;
                        }
                        return ParseResult.err(Progress.MADE_PROGRESS,
                                spaceProblem.at(BadInputError.HAS_MISPLACED_CARRIAGE_RETURN, line, column), state);
                    case '\t':
                        return ParseResult.err(Progress.MADE_PROGRESS,
                                spaceProblem.at(BadInputError.HAS_TAB, line, column), state);
                    case '#':
                        boolean doc = offset + 1 < source.length() && source.charAt(offset + 1) == '#';
                        int textStart = offset + (doc ? 2 : 1);
                        int lineEnd = source.indexOf('\n', textStart);
                        if (lineEnd < 0) {
                            lineEnd = source.length();
                        }
                        String text = stripCarriageReturn(source.substring(textStart, lineEnd));
                        spaces.add(doc ? new CommentOrNewline.DocComment(text) : new CommentOrNewline.LineComment(text));
                        if (lineEnd < source.length()) {
                            offset = lineEnd + 1;
                            line++;
                            column = 0;
                        } else {
                            column += lineEnd - offset;
                            offset = lineEnd;
                        }
                        break;
                    default:
                        break scan;
                }
            }

            if (offset == state.offset()) {
                return ParseResult.ok(Progress.NO_PROGRESS, List.of(), state);
            }
            if (line == state.line()) {
                return ParseResult.ok(Progress.MADE_PROGRESS, List.copyOf(spaces),
                        state.moveTo(offset, line, column, state.indentColumn()));
            }
            if (column < minIndent) {
                return ParseResult.err(Progress.MADE_PROGRESS, indentProblem.at(line, column), state);
            }
            return ParseResult.ok(Progress.MADE_PROGRESS, List.copyOf(spaces), state.moveTo(offset, line, column, column));
        };
    }

    private static String stripCarriageReturn(String text) {
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    /**
     * Succeeds without consuming when the cursor sits at or past {@code minIndent}.
     */
    public static <E> Parser<Void, E> checkIndent(int minIndent, PositionalError<E> indentProblem) {
        return state -> state.column() >= minIndent
                ? ParseResult.ok(Progress.NO_PROGRESS, null, state)
                : ParseResult.err(Progress.NO_PROGRESS, indentProblem.at(state), state);
    }

    // ==================== Attaching spacing to nodes ====================

    public static <T, E> Parser<Located<T>, E> space0Before(
            Parser<Located<T>, E> parser, int minIndent,
            SpaceError<E> spaceProblem, PositionalError<E> indentProblem, Spaceable<T> spaceable) {
        return state -> {
            ParseResult<List<CommentOrNewline>, E> spaces = space0(minIndent, spaceProblem, indentProblem).parse(state);
            if (!spaces.isOk()) {
                return spaces.castErr();
            }
            ParseResult<Located<T>, E> inner = parser.parse(spaces.state());
            Progress progress = spaces.progress().or(inner.progress());
            if (!inner.isOk()) {
                return inner.withProgress(progress);
            }
            Located<T> located = inner.value();
            return ParseResult.ok(progress,
                    Located.at(located.region(), spaceable.before(located.value(), spaces.value())), inner.state());
        };
    }

    public static <T, E> Parser<Located<T>, E> space0After(
            Parser<Located<T>, E> parser, int minIndent,
            SpaceError<E> spaceProblem, PositionalError<E> indentProblem, Spaceable<T> spaceable) {
        return state -> {
            ParseResult<Located<T>, E> inner = parser.parse(state);
            if (!inner.isOk()) {
                return inner;
            }
            ParseResult<List<CommentOrNewline>, E> spaces =
                    space0(minIndent, spaceProblem, indentProblem).parse(inner.state());
            if (!spaces.isOk()) {
                return spaces.<Located<T>>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            Located<T> located = inner.value();
            return ParseResult.ok(inner.progress().or(spaces.progress()),
                    Located.at(located.region(), spaceable.after(located.value(), spaces.value())), spaces.state());
        };
    }

    public static <T, E> Parser<Located<T>, E> space0Around(
            Parser<Located<T>, E> parser, int minIndent, SpaceError<E> spaceProblem,
            PositionalError<E> indentBefore, PositionalError<E> indentAfter, Spaceable<T> spaceable) {
        return space0After(space0Before(parser, minIndent, spaceProblem, indentBefore, spaceable),
                minIndent, spaceProblem, indentAfter, spaceable);
    }

    // ==================== Collections ====================

    /**
     * Comma-separated items up to {@code close}, starting right after the opening bracket.
     * A trailing comma is allowed and the closing bracket may sit at any column.
     */
    public static <T, E> Parser<Delimited<T>, E> collectionBody(
            char close, Parser<Located<T>, E> element, int minIndent,
            PositionalError<E> closeProblem, SpaceError<E> spaceProblem, PositionalError<E> indentProblem,
            Spaceable<T> spaceable) {
        return state -> {
            ParseResult<List<CommentOrNewline>, E> leading = space0(minIndent, spaceProblem, indentProblem).parse(state);
            if (!leading.isOk()) {
                return leading.castErr();
            }

            Parser<Located<T>, E> spacedElement = space0Before(
                    optionalSpacesAfter(element, minIndent, spaceProblem, indentProblem, spaceable),
                    minIndent, spaceProblem, indentProblem, spaceable);
            ParseResult<List<Located<T>>, E> items = Parsers.trailingSepBy0(
                    Parsers.word1(',', closeProblem), spacedElement).parse(leading.state());
            if (!items.isOk()) {
                return items.<Delimited<T>>castErr().withProgress(Progress.MADE_PROGRESS);
            }

            ParseResult<List<CommentOrNewline>, E> trailing = space0(0, spaceProblem, indentProblem).parse(items.state());
            if (!trailing.isOk()) {
                return trailing.castErr();
            }
            State end = trailing.state();
            if (end.isEmpty() || end.peek() != close) {
                return ParseResult.err(Progress.MADE_PROGRESS, closeProblem.at(end), end);
            }

            List<Located<T>> elements = new ArrayList<>(items.value());
            List<CommentOrNewline> finalComments = new ArrayList<>();
            if (elements.isEmpty()) {
                finalComments.addAll(leading.value());
            } else {
                Located<T> first = elements.get(0);
                elements.set(0, Located.at(first.region(), spaceable.before(first.value(), leading.value())));
            }
            finalComments.addAll(trailing.value());
            return ParseResult.ok(Progress.MADE_PROGRESS, new Delimited<>(elements, finalComments), end.advance(1));
        };
    }

    private static <T, E> Parser<Located<T>, E> optionalSpacesAfter(
            Parser<Located<T>, E> parser, int minIndent,
            SpaceError<E> spaceProblem, PositionalError<E> indentProblem, Spaceable<T> spaceable) {
        return state -> {
            ParseResult<Located<T>, E> inner = parser.parse(state);
            if (!inner.isOk()) {
                return inner;
            }
            ParseResult<Optional<List<CommentOrNewline>>, E> spaces =
                    Parsers.optional(space0(minIndent, spaceProblem, indentProblem)).parse(inner.state());
            List<CommentOrNewline> after = spaces.value().orElse(List.of());
            Located<T> located = inner.value();
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    Located.at(located.region(), spaceable.after(located.value(), after)), spaces.state());
        };
    }
}
