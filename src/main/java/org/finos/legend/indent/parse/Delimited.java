package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Located;

import java.util.List;

/**
 * Items of a bracketed, comma-separated collection plus the comments found
 * before the closing bracket.
 */
public record Delimited<T>(List<Located<T>> items, List<CommentOrNewline> finalComments) {

    public Delimited {
        items = List.copyOf(items);
        finalComments = List.copyOf(finalComments);
    }
}
