package org.finos.legend.indent.parse;

/**
 * Whether a parse attempt consumed input.
 *
 * <p>Alternation only moves on to the next alternative after a
 * {@link #NO_PROGRESS} failure; a failure that consumed input is final.
 */
public enum Progress {
    MADE_PROGRESS,
    NO_PROGRESS;

    public static Progress when(boolean madeProgress) {
        return madeProgress ? MADE_PROGRESS : NO_PROGRESS;
    }

    public static Progress between(State before, State after) {
        return when(before.offset() != after.offset());
    }

    public Progress or(Progress other) {
        return when(this == MADE_PROGRESS || other == MADE_PROGRESS);
    }

    public boolean made() {
        return this == MADE_PROGRESS;
    }
}
