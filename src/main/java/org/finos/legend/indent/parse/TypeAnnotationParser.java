package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.TypeAnnotation;
import org.finos.legend.indent.parse.error.EType;

/**
 * Grammar for the type on the right of {@code :}, injected into {@link ExprParser}.
 *
 * <p>Implementations parse exactly one type starting at {@code state} and must not
 * consume spacing after it, so the definition engine can still count the blank
 * lines between an annotation and the next definition.
 */
@FunctionalInterface
public interface TypeAnnotationParser {

    ParseResult<Located<TypeAnnotation>, EType> parse(int minIndent, State state);
}
