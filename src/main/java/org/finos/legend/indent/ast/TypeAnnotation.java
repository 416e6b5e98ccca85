package org.finos.legend.indent.ast;

import java.util.List;
import java.util.Objects;

/**
 * Type tree produced by the type annotation grammar, used on the right of {@code :}.
 */
public sealed interface TypeAnnotation
        permits TypeAnnotation.Function, TypeAnnotation.Apply, TypeAnnotation.BoundVariable,
        TypeAnnotation.RecordType, TypeAnnotation.TagUnion, TypeAnnotation.Wildcard, TypeAnnotation.Inferred,
        TypeAnnotation.SpaceBefore, TypeAnnotation.SpaceAfter, TypeAnnotation.Malformed {

    Spaceable<TypeAnnotation> SPACES = Spaceable.of(SpaceBefore::new, SpaceAfter::new);

    default TypeAnnotation withoutSpaces() {
        TypeAnnotation current = this;
        while (true) {
            if (current instanceof SpaceBefore before) {
                current = before.type();
            } else if (current instanceof SpaceAfter after) {
                current = after.type();
            } else {
                return current;
            }
        }
    }

    /** {@code a, b -> c} */
    record Function(List<Located<TypeAnnotation>> arguments, Located<TypeAnnotation> result)
            implements TypeAnnotation {
        public Function {
            arguments = List.copyOf(arguments);
            Objects.requireNonNull(result, "Function result cannot be null");
        }
    }

    /** {@code Str}, {@code List a}, {@code Dict.Dict k v} */
    record Apply(String moduleName, String name, List<Located<TypeAnnotation>> arguments)
            implements TypeAnnotation {
        public Apply {
            arguments = List.copyOf(arguments);
        }
    }

    record BoundVariable(String name) implements TypeAnnotation {
    }

    /**
     * @param extension the row variable after the closing brace, or null
     */
    record RecordType(List<Located<AssignedField<TypeAnnotation>>> fields, Located<TypeAnnotation> extension)
            implements TypeAnnotation {
        public RecordType {
            fields = List.copyOf(fields);
        }
    }

    record Tag(String name, boolean privateTag, List<Located<TypeAnnotation>> arguments) {
        public Tag {
            arguments = List.copyOf(arguments);
        }
    }

    record TagUnion(List<Located<Tag>> tags, Located<TypeAnnotation> extension) implements TypeAnnotation {
        public TagUnion {
            tags = List.copyOf(tags);
        }
    }

    /** {@code *} */
    record Wildcard() implements TypeAnnotation {
    }

    /** {@code _} */
    record Inferred() implements TypeAnnotation {
    }

    record SpaceBefore(TypeAnnotation type, List<CommentOrNewline> spaces) implements TypeAnnotation {
        public SpaceBefore {
            spaces = List.copyOf(spaces);
        }
    }

    record SpaceAfter(TypeAnnotation type, List<CommentOrNewline> spaces) implements TypeAnnotation {
        public SpaceAfter {
            spaces = List.copyOf(spaces);
        }
    }

    record Malformed(String text) implements TypeAnnotation {
    }
}
