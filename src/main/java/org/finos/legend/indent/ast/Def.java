package org.finos.legend.indent.ast;

import java.util.List;
import java.util.Objects;

/**
 * A definition inside a definitions block or at the top level of a module.
 */
public sealed interface Def
        permits Def.Annotation, Def.Alias, Def.Body, Def.AnnotatedBody, Def.SpaceBefore, Def.SpaceAfter {

    Spaceable<Def> SPACES = Spaceable.of(SpaceBefore::new, SpaceAfter::new);

    default Def withoutSpaces() {
        Def current = this;
        while (true) {
            if (current instanceof SpaceBefore before) {
                current = before.def();
            } else if (current instanceof SpaceAfter after) {
                current = after.def();
            } else {
                return current;
            }
        }
    }

    /** {@code name : Type} */
    record Annotation(Located<Pattern> pattern, Located<TypeAnnotation> type) implements Def {
        public Annotation {
            Objects.requireNonNull(pattern, "Annotated pattern cannot be null");
            Objects.requireNonNull(type, "Annotation type cannot be null");
        }
    }

    /** {@code Pair a b : [ Pair a b ]} */
    record Alias(Located<String> name, List<Located<Pattern>> vars, Located<TypeAnnotation> type) implements Def {
        public Alias {
            Objects.requireNonNull(name, "Alias name cannot be null");
            vars = List.copyOf(vars);
            Objects.requireNonNull(type, "Alias type cannot be null");
        }
    }

    /** {@code pattern = expr} */
    record Body(Located<Pattern> pattern, Located<Expr> expr) implements Def {
        public Body {
            Objects.requireNonNull(pattern, "Body pattern cannot be null");
            Objects.requireNonNull(expr, "Body expression cannot be null");
        }
    }

    /**
     * An annotation fused with the body that immediately follows it.
     *
     * @param comment comment found between the annotation and the body, or null
     */
    record AnnotatedBody(
            Located<Pattern> annotationPattern,
            Located<TypeAnnotation> annotationType,
            String comment,
            Located<Pattern> bodyPattern,
            Located<Expr> bodyExpr) implements Def {
        public AnnotatedBody {
            Objects.requireNonNull(annotationPattern, "Annotation pattern cannot be null");
            Objects.requireNonNull(annotationType, "Annotation type cannot be null");
            Objects.requireNonNull(bodyPattern, "Body pattern cannot be null");
            Objects.requireNonNull(bodyExpr, "Body expression cannot be null");
        }
    }

    record SpaceBefore(Def def, List<CommentOrNewline> spaces) implements Def {
        public SpaceBefore {
            spaces = List.copyOf(spaces);
        }
    }

    record SpaceAfter(Def def, List<CommentOrNewline> spaces) implements Def {
        public SpaceAfter {
            spaces = List.copyOf(spaces);
        }
    }
}
