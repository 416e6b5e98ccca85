package org.finos.legend.indent.ast;

/**
 * Source span from a start position (inclusive) to an end position (exclusive).
 *
 * <p>Spans compose via {@link #span(Region, Region)}: the smallest span covering both.
 */
public record Region(int startLine, int startColumn, int endLine, int endColumn) {

    public static Region zero() {
        return new Region(0, 0, 0, 0);
    }

    public static Region between(Position start, Position end) {
        return new Region(start.line(), start.column(), end.line(), end.column());
    }

    /**
     * Smallest region covering both {@code a} and {@code b}.
     */
    public static Region span(Region a, Region b) {
        Position start = a.start().isBefore(b.start()) ? a.start() : b.start();
        Position end = a.end().isBefore(b.end()) ? b.end() : a.end();
        return between(start, end);
    }

    public static Region acrossAll(Iterable<Region> regions) {
        Region result = null;
        for (Region region : regions) {
            result = result == null ? region : span(result, region);
        }
        if (result == null) {
            throw new IllegalArgumentException("acrossAll requires at least one region");
        }
        return result;
    }

    public Position start() {
        return new Position(startLine, startColumn);
    }

    public Position end() {
        return new Position(endLine, endColumn);
    }

    /**
     * Same region with the start column moved left by {@code columns}.
     */
    public Region extendStart(int columns) {
        return new Region(startLine, startColumn - columns, endLine, endColumn);
    }
}
