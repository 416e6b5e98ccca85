package org.finos.legend.indent.ast;

import java.util.List;

/**
 * One element of non-semantic spacing: a line break or a comment.
 *
 * <p>A comment element includes the line break that terminates it.
 */
public sealed interface CommentOrNewline
        permits CommentOrNewline.Newline, CommentOrNewline.LineComment, CommentOrNewline.DocComment {

    record Newline() implements CommentOrNewline {
    }

    /** {@code # text} */
    record LineComment(String text) implements CommentOrNewline {
    }

    /** {@code ## text} */
    record DocComment(String text) implements CommentOrNewline {
    }

    static CommentOrNewline newline() {
        return new Newline();
    }

    /**
     * Number of blank lines in a run of spacing that follows the end of a
     * source line. The first element only terminates that line.
     */
    static int blankLines(List<CommentOrNewline> spaces) {
        int newlines = 0;
        for (CommentOrNewline space : spaces) {
            if (space instanceof Newline) {
                newlines++;
            }
        }
        if (!spaces.isEmpty() && spaces.get(0) instanceof Newline) {
            newlines--;
        }
        return newlines;
    }
}
