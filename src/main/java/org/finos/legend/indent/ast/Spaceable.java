package org.finos.legend.indent.ast;

import java.util.List;
import java.util.function.BiFunction;

/**
 * Attaches leading or trailing spacing to a node without changing its shape.
 */
public interface Spaceable<T> {

    T before(T value, List<CommentOrNewline> spaces);

    T after(T value, List<CommentOrNewline> spaces);

    static <T> Spaceable<T> of(BiFunction<T, List<CommentOrNewline>, T> before,
            BiFunction<T, List<CommentOrNewline>, T> after) {
        return new Spaceable<>() {
            @Override
            public T before(T value, List<CommentOrNewline> spaces) {
                return spaces.isEmpty() ? value : before.apply(value, List.copyOf(spaces));
            }

            @Override
            public T after(T value, List<CommentOrNewline> spaces) {
                return spaces.isEmpty() ? value : after.apply(value, List.copyOf(spaces));
            }
        };
    }
}
