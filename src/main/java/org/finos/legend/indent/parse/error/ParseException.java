package org.finos.legend.indent.parse.error;

/**
 * Exception thrown by the string-level entry points when parsing fails.
 * Carries the typed context error so callers can inspect the root cause.
 *
 * <p>{@link #getLine()} and {@link #getColumn()} are 0-based like every other
 * position in this library; the message shows them 1-based.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;
    private final transient ParseProblem problem;

    public ParseException(ParseProblem problem) {
        super("line " + (problem.line() + 1) + ":" + (problem.column() + 1) + " " + problem);
        this.line = problem.line();
        this.column = problem.column();
        this.problem = problem;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public ParseProblem getProblem() {
        return problem;
    }
}
