package org.finos.legend.indent.ast;

/**
 * A point in the source buffer. Lines and columns are 0-based.
 */
public record Position(int line, int column) implements Comparable<Position> {

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }
}
