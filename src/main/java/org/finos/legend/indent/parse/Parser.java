package org.finos.legend.indent.parse;

/**
 * A parser is a function from a state to a {@link ParseResult}.
 */
@FunctionalInterface
public interface Parser<T, E> {

    ParseResult<T, E> parse(State state);
}
