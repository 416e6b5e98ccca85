package org.finos.legend.indent.parse;

/**
 * Wraps an inner context's error into an outer context's error.
 */
@FunctionalInterface
public interface NestedError<I, O> {

    O wrap(I inner, int line, int column);
}
