package org.finos.legend.indent.ast;

import java.util.Objects;

/**
 * A value paired with the source region it was parsed from.
 *
 * @param region The covering source span
 * @param value  The located value
 */
public record Located<T>(Region region, T value) {

    public Located {
        Objects.requireNonNull(region, "Region cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }

    public static <T> Located<T> at(Region region, T value) {
        return new Located<>(region, value);
    }
}
