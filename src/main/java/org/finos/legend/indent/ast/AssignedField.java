package org.finos.legend.indent.ast;

import java.util.List;

/**
 * A field inside braces, shared by record expressions and record types.
 *
 * <ul>
 *   <li>{@code name: value} is {@link RequiredValue}</li>
 *   <li>{@code name ? value} is {@link OptionalValue}</li>
 *   <li>{@code name} alone is {@link LabelOnly}</li>
 * </ul>
 *
 * @param <T> the value type, {@link Expr} or {@link TypeAnnotation}
 */
public sealed interface AssignedField<T>
        permits AssignedField.RequiredValue, AssignedField.OptionalValue, AssignedField.LabelOnly,
        AssignedField.SpaceBefore, AssignedField.SpaceAfter, AssignedField.Malformed {

    /**
     * @param spaces spacing between the label and the separator
     */
    record RequiredValue<T>(Located<String> label, List<CommentOrNewline> spaces, Located<T> value)
            implements AssignedField<T> {
        public RequiredValue {
            spaces = List.copyOf(spaces);
        }
    }

    record OptionalValue<T>(Located<String> label, List<CommentOrNewline> spaces, Located<T> value)
            implements AssignedField<T> {
        public OptionalValue {
            spaces = List.copyOf(spaces);
        }
    }

    record LabelOnly<T>(Located<String> label) implements AssignedField<T> {
    }

    record SpaceBefore<T>(AssignedField<T> field, List<CommentOrNewline> spaces) implements AssignedField<T> {
        public SpaceBefore {
            spaces = List.copyOf(spaces);
        }
    }

    record SpaceAfter<T>(AssignedField<T> field, List<CommentOrNewline> spaces) implements AssignedField<T> {
        public SpaceAfter {
            spaces = List.copyOf(spaces);
        }
    }

    record Malformed<T>(String text) implements AssignedField<T> {
    }

    static <T> Spaceable<AssignedField<T>> spaces() {
        return Spaceable.of(SpaceBefore::new, SpaceAfter::new);
    }

    default AssignedField<T> withoutSpaces() {
        AssignedField<T> current = this;
        while (true) {
            if (current instanceof SpaceBefore<T> before) {
                current = before.field();
            } else if (current instanceof SpaceAfter<T> after) {
                current = after.field();
            } else {
                return current;
            }
        }
    }
}
