package org.finos.legend.indent.parse;

/**
 * Builds a leaf error at a position; usually a record constructor reference.
 */
@FunctionalInterface
public interface PositionalError<E> {

    E at(int line, int column);

    default E at(State state) {
        return at(state.line(), state.column());
    }
}
