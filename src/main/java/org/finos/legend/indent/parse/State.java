package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Position;

import java.util.Objects;

/**
 * Immutable cursor into the source buffer.
 *
 * <p>Every parse step takes a state and returns a new one; a state is never
 * changed in place, so a backtracking parser just keeps the state it started from.
 *
 * @param source       the whole buffer
 * @param offset       index of the next unread character
 * @param line         0-based line of {@code offset}
 * @param column       0-based column of {@code offset}
 * @param indentColumn column of the first non-space character on the current line
 */
public record State(String source, int offset, int line, int column, int indentColumn) {

    /** Returned by {@link #peek(int)} past the end of input. */
    public static final char EOF = '\0';

    public State {
        Objects.requireNonNull(source, "Source cannot be null");
    }

    public static State of(String source) {
        return new State(source, 0, 0, 0, 0);
    }

    public boolean isEmpty() {
        return offset >= source.length();
    }

    public int remaining() {
        return source.length() - offset;
    }

    public char peek() {
        return peek(0);
    }

    public char peek(int ahead) {
        int index = offset + ahead;
        return index < source.length() ? source.charAt(index) : EOF;
    }

    public boolean startsWith(String text) {
        return source.startsWith(text, offset);
    }

    /**
     * Moves past {@code count} characters that do not include a line break.
     */
    public State advance(int count) {
        return new State(source, offset + count, line, column + count, indentColumn);
    }

    /**
     * Moves to an explicit position, as computed by a scanner that crossed line breaks.
     */
    public State moveTo(int newOffset, int newLine, int newColumn, int newIndentColumn) {
        return new State(source, newOffset, newLine, newColumn, newIndentColumn);
    }

    public Position position() {
        return new Position(line, column);
    }

    /**
     * Text between this state and a later one.
     */
    public String textUntil(State later) {
        return source.substring(offset, later.offset);
    }

    @Override
    public String toString() {
        int end = Math.min(source.length(), offset + 20);
        return "State[" + line + ":" + column + " indent=" + indentColumn
                + " next='" + source.substring(offset, end).replace("\n", "\\n") + "']";
    }
}
