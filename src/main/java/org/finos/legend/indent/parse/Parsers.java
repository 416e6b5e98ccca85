package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Region;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Generic combinators over {@link Parser}.
 *
 * <p>All of them honour the progress contract: a failure that consumed input
 * is returned as-is, only a {@link Progress#NO_PROGRESS} failure lets a caller
 * try something else. {@link #backtrackable(Parser)} and
 * {@link #optional(Parser)} are the only combinators that turn a consuming
 * failure back into a non-consuming one.
 */
public final class Parsers {

    private Parsers() {
    }

    // ==================== Tokens ====================

    public static <E> Parser<Void, E> word1(char expected, PositionalError<E> problem) {
        return state -> !state.isEmpty() && state.peek() == expected
                ? ParseResult.ok(Progress.MADE_PROGRESS, null, state.advance(1))
                : ParseResult.err(Progress.NO_PROGRESS, problem.at(state), state);
    }

    /**
     * Matches a fixed piece of text that contains no line break.
     */
    public static <E> Parser<Void, E> word(String expected, PositionalError<E> problem) {
        return state -> state.startsWith(expected)
                ? ParseResult.ok(Progress.MADE_PROGRESS, null, state.advance(expected.length()))
                : ParseResult.err(Progress.NO_PROGRESS, problem.at(state), state);
    }

    /**
     * Matches a keyword that is followed by spacing or the end of input,
     * so that {@code iffy} is not mistaken for {@code if}.
     */
    public static <E> Parser<Void, E> keyword(String keyword, PositionalError<E> problem) {
        return state -> {
            if (state.startsWith(keyword)) {
                char next = state.peek(keyword.length());
                if (next == ' ' || next == '\n' || next == '\r' || next == '#'
                        || state.remaining() == keyword.length()) {
                    return ParseResult.ok(Progress.MADE_PROGRESS, null, state.advance(keyword.length()));
                }
            }
            return ParseResult.err(Progress.NO_PROGRESS, problem.at(state), state);
        };
    }

    // ==================== Transformations ====================

    public static <T, U, E> Parser<U, E> map(Parser<T, E> parser, Function<? super T, ? extends U> mapper) {
        return state -> parser.parse(state).map(mapper);
    }

    /**
     * Wraps the parsed value with the region between the start and end state.
     */
    public static <T, E> Parser<Located<T>, E> loc(Parser<T, E> parser) {
        return state -> {
            ParseResult<T, E> result = parser.parse(state);
            if (!result.isOk()) {
                return result.castErr();
            }
            Region region = Region.between(state.position(), result.state().position());
            return ParseResult.ok(result.progress(), Located.at(region, result.value()), result.state());
        };
    }

    /**
     * Re-tags the inner parser's error as an error of the enclosing context,
     * keeping the inner error as root cause.
     */
    public static <T, I, O> Parser<T, O> specialize(Parser<T, I> parser, NestedError<I, O> wrap) {
        return state -> {
            ParseResult<T, I> result = parser.parse(state);
            State at = result.state();
            return result.mapError(inner -> wrap.wrap(inner, at.line(), at.column()));
        };
    }

    // ==================== Sequencing ====================

    public static <A, B, E> Parser<B, E> skipFirst(Parser<A, E> first, Parser<B, E> second) {
        return state -> {
            ParseResult<A, E> a = first.parse(state);
            if (!a.isOk()) {
                return a.castErr();
            }
            ParseResult<B, E> b = second.parse(a.state());
            if (!b.isOk()) {
                return ParseResult.err(a.progress().or(b.progress()), b.error(), b.state());
            }
            return ParseResult.ok(a.progress().or(b.progress()), b.value(), b.state());
        };
    }

    public static <A, B, E> Parser<A, E> skipSecond(Parser<A, E> first, Parser<B, E> second) {
        return state -> {
            ParseResult<A, E> a = first.parse(state);
            if (!a.isOk()) {
                return a;
            }
            ParseResult<B, E> b = second.parse(a.state());
            if (!b.isOk()) {
                return ParseResult.err(a.progress().or(b.progress()), b.error(), b.state());
            }
            return ParseResult.ok(a.progress().or(b.progress()), a.value(), b.state());
        };
    }

    // ==================== Choice ====================

    /**
     * Tries each parser in turn, moving on only after a non-consuming failure.
     */
    @SafeVarargs
    public static <T, E> Parser<T, E> oneOf(Parser<T, E>... parsers) {
        return state -> {
            ParseResult<T, E> last = null;
            for (Parser<T, E> parser : parsers) {
                last = parser.parse(state);
                if (last.isOk() || last.progress().made()) {
                    return last;
                }
            }
            return last;
        };
    }

    /**
     * Succeeds with {@link Optional#empty()} on any failure, rewinding to the original state.
     */
    public static <T, E> Parser<Optional<T>, E> optional(Parser<T, E> parser) {
        return state -> {
            ParseResult<T, E> result = parser.parse(state);
            if (result.isOk()) {
                return ParseResult.ok(result.progress(), Optional.ofNullable(result.value()), result.state());
            }
            return ParseResult.ok(Progress.NO_PROGRESS, Optional.empty(), state);
        };
    }

    /**
     * Turns a consuming failure into a non-consuming one at the original state.
     */
    public static <T, E> Parser<T, E> backtrackable(Parser<T, E> parser) {
        return state -> {
            ParseResult<T, E> result = parser.parse(state);
            if (result.isOk()) {
                return result;
            }
            return ParseResult.err(Progress.NO_PROGRESS, result.error(), state);
        };
    }

    // ==================== Repetition ====================

    public static <T, E> Parser<List<T>, E> zeroOrMore(Parser<T, E> parser) {
        return state -> {
            List<T> items = new ArrayList<>();
            State current = state;
            while (true) {
                ParseResult<T, E> result = parser.parse(current);
                if (!result.isOk()) {
                    if (result.progress().made()) {
                        return result.castErr();
                    }
                    return ParseResult.ok(Progress.between(state, current), items, current);
                }
                if (!result.progress().made()) {
                    // a parser that succeeds without consuming would loop forever
                    return ParseResult.ok(Progress.between(state, current), items, current);
                }
                items.add(result.value());
                current = result.state();
            }
        };
    }

    /**
     * One or more elements separated by a delimiter; no trailing delimiter.
     */
    public static <T, D, E> Parser<List<T>, E> sepBy1(Parser<D, E> delimiter, Parser<T, E> element) {
        return state -> {
            ParseResult<T, E> first = element.parse(state);
            if (!first.isOk()) {
                return first.castErr();
            }
            List<T> items = new ArrayList<>();
            items.add(first.value());
            State current = first.state();
            while (true) {
                ParseResult<D, E> delimited = delimiter.parse(current);
                if (!delimited.isOk()) {
                    if (delimited.progress().made()) {
                        return delimited.castErr();
                    }
                    return ParseResult.ok(Progress.between(state, current), items, current);
                }
                ParseResult<T, E> next = element.parse(delimited.state());
                if (!next.isOk()) {
                    return ParseResult.err(Progress.MADE_PROGRESS, next.error(), next.state());
                }
                items.add(next.value());
                current = next.state();
            }
        };
    }

    /**
     * Zero or more elements separated by a delimiter, allowing one trailing delimiter.
     */
    public static <T, D, E> Parser<List<T>, E> trailingSepBy0(Parser<D, E> delimiter, Parser<T, E> element) {
        return state -> {
            List<T> items = new ArrayList<>();
            ParseResult<T, E> first = element.parse(state);
            if (!first.isOk()) {
                if (first.progress().made()) {
                    return first.castErr();
                }
                return ParseResult.ok(Progress.NO_PROGRESS, items, state);
            }
            items.add(first.value());
            State current = first.state();
            while (true) {
                ParseResult<D, E> delimited = delimiter.parse(current);
                if (!delimited.isOk()) {
                    if (delimited.progress().made()) {
                        return delimited.castErr();
                    }
                    return ParseResult.ok(Progress.MADE_PROGRESS, items, current);
                }
                current = delimited.state();
                ParseResult<T, E> next = element.parse(current);
                if (!next.isOk()) {
                    if (next.progress().made()) {
                        return next.castErr();
                    }
                    return ParseResult.ok(Progress.MADE_PROGRESS, items, current);
                }
                items.add(next.value());
                current = next.state();
            }
        };
    }
}
