package org.finos.legend.indent.ast;

import java.util.List;
import java.util.Objects;

/**
 * Pattern tree. Mirrors the shape of {@link Expr} so that an expression can be
 * reinterpreted as a pattern once a definition is discovered.
 */
public sealed interface Pattern
        permits Pattern.Identifier, Pattern.QualifiedIdentifier, Pattern.GlobalTag, Pattern.PrivateTag,
        Pattern.Apply, Pattern.RecordDestructure, Pattern.RequiredField, Pattern.OptionalField,
        Pattern.NumLiteral, Pattern.NonBase10Literal, Pattern.FloatLiteral, Pattern.StrLiteral,
        Pattern.Underscore, Pattern.SpaceBefore, Pattern.SpaceAfter, Pattern.Malformed, Pattern.MalformedIdent {

    Spaceable<Pattern> SPACES = Spaceable.of(SpaceBefore::new, SpaceAfter::new);

    default Pattern withoutSpaces() {
        Pattern current = this;
        while (true) {
            if (current instanceof SpaceBefore before) {
                current = before.pattern();
            } else if (current instanceof SpaceAfter after) {
                current = after.pattern();
            } else {
                return current;
            }
        }
    }

    /**
     * Whether two patterns bind the same names in the same shape, ignoring
     * spacing and source regions.
     */
    static boolean sameBinding(Pattern a, Pattern b) {
        Pattern left = a.withoutSpaces();
        Pattern right = b.withoutSpaces();
        if (left instanceof Apply leftApply && right instanceof Apply rightApply) {
            return sameBinding(leftApply.tag().value(), rightApply.tag().value())
                    && sameBindings(leftApply.args(), rightApply.args());
        }
        if (left instanceof RecordDestructure leftRecord && right instanceof RecordDestructure rightRecord) {
            return sameBindings(leftRecord.fields(), rightRecord.fields());
        }
        if (left instanceof RequiredField leftField && right instanceof RequiredField rightField) {
            return leftField.label().equals(rightField.label())
                    && sameBinding(leftField.pattern().value(), rightField.pattern().value());
        }
        if (left instanceof OptionalField leftField && right instanceof OptionalField rightField) {
            return leftField.label().equals(rightField.label());
        }
        return left.equals(right);
    }

    private static boolean sameBindings(List<Located<Pattern>> a, List<Located<Pattern>> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!sameBinding(a.get(i).value(), b.get(i).value())) {
                return false;
            }
        }
        return true;
    }

    record Identifier(String name) implements Pattern {
        public Identifier {
            Objects.requireNonNull(name, "Identifier cannot be null");
        }
    }

    record QualifiedIdentifier(String moduleName, String ident) implements Pattern {
    }

    record GlobalTag(String name) implements Pattern {
    }

    record PrivateTag(String name) implements Pattern {
    }

    /**
     * Tag applied to argument patterns: {@code Pair a b}.
     */
    record Apply(Located<Pattern> tag, List<Located<Pattern>> args) implements Pattern {
        public Apply {
            Objects.requireNonNull(tag, "Applied tag cannot be null");
            args = List.copyOf(args);
        }
    }

    /**
     * {@code { x, y: p, z ? 0 }}. Label-only fields are {@link Identifier}s.
     */
    record RecordDestructure(List<Located<Pattern>> fields) implements Pattern {
        public RecordDestructure {
            fields = List.copyOf(fields);
        }
    }

    record RequiredField(String label, Located<Pattern> pattern) implements Pattern {
    }

    /**
     * {@code label ? default}; the default is an expression.
     */
    record OptionalField(String label, Located<Expr> defaultValue) implements Pattern {
    }

    record NumLiteral(String text) implements Pattern {
    }

    record NonBase10Literal(String text, Base base, boolean negative) implements Pattern {
    }

    record FloatLiteral(String text) implements Pattern {
    }

    record StrLiteral(String value) implements Pattern {
    }

    /**
     * {@code _} or {@code _name}; the name is empty for a bare underscore.
     */
    record Underscore(String name) implements Pattern {
    }

    record SpaceBefore(Pattern pattern, List<CommentOrNewline> spaces) implements Pattern {
        public SpaceBefore {
            spaces = List.copyOf(spaces);
        }
    }

    record SpaceAfter(Pattern pattern, List<CommentOrNewline> spaces) implements Pattern {
        public SpaceAfter {
            spaces = List.copyOf(spaces);
        }
    }

    record Malformed(String text) implements Pattern {
    }

    record MalformedIdent(String text, BadIdent problem) implements Pattern {
    }
}
