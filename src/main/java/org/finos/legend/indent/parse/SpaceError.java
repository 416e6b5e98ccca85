package org.finos.legend.indent.parse;

import org.finos.legend.indent.parse.error.BadInputError;

/**
 * Builds a context's {@code Space} error from a bad-input reason.
 */
@FunctionalInterface
public interface SpaceError<E> {

    E at(BadInputError problem, int line, int column);
}
