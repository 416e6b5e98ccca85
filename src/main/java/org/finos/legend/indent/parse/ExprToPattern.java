package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.AssignedField;
import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reinterprets an already parsed expression as a pattern.
 *
 * <p>The left side of {@code =}, {@code :} and {@code <-} is first parsed as an
 * expression, because nothing tells the two apart until the operator shows up.
 * Only expressions that read the same as a pattern convert: {@code Foo a b},
 * {@code { x, y: (Pair a b) }}, {@code 42}. Anything else yields empty.
 */
public final class ExprToPattern {

    private ExprToPattern() {
    }

    public static Optional<Pattern> toPattern(Expr expr) {
        return Optional.ofNullable(convert(expr));
    }

    private static Pattern convert(Expr expr) {
        if (expr instanceof Expr.Var var) {
            return var.moduleName().isEmpty()
                    ? new Pattern.Identifier(var.ident())
                    : new Pattern.QualifiedIdentifier(var.moduleName(), var.ident());
        }
        if (expr instanceof Expr.GlobalTag tag) {
            return new Pattern.GlobalTag(tag.name());
        }
        if (expr instanceof Expr.PrivateTag tag) {
            return new Pattern.PrivateTag(tag.name());
        }
        if (expr instanceof Expr.Apply apply) {
            return convertApply(apply);
        }
        if (expr instanceof Expr.SpaceBefore before) {
            Pattern inner = convert(before.expr());
            return inner == null ? null : Pattern.SPACES.before(inner, before.spaces());
        }
        if (expr instanceof Expr.SpaceAfter after) {
            Pattern inner = convert(after.expr());
            return inner == null ? null : Pattern.SPACES.after(inner, after.spaces());
        }
        if (expr instanceof Expr.ParensAround parens) {
            return convert(parens.inner());
        }
        if (expr instanceof Expr.RecordLiteral record) {
            return record.isUpdate() ? null : convertRecord(record);
        }
        if (expr instanceof Expr.Num num) {
            return new Pattern.NumLiteral(num.text());
        }
        if (expr instanceof Expr.Float number) {
            return new Pattern.FloatLiteral(number.text());
        }
        if (expr instanceof Expr.NonBase10Int number) {
            return new Pattern.NonBase10Literal(number.text(), number.base(), number.negative());
        }
        if (expr instanceof Expr.Str str) {
            return new Pattern.StrLiteral(str.value());
        }
        if (expr instanceof Expr.MalformedIdent malformed) {
            return new Pattern.MalformedIdent(malformed.text(), malformed.problem());
        }
        return null;
    }

    private static Pattern convertApply(Expr.Apply apply) {
        Expr head = apply.function().value().withoutSpaces();
        if (!(head instanceof Expr.GlobalTag) && !(head instanceof Expr.PrivateTag)) {
            return null;
        }
        Located<Pattern> tag = Located.at(apply.function().region(), convert(head));
        List<Located<Pattern>> args = new ArrayList<>();
        for (Located<Expr> arg : apply.args()) {
            Pattern pattern = convert(arg.value());
            if (pattern == null) {
                return null;
            }
            args.add(Located.at(arg.region(), pattern));
        }
        return new Pattern.Apply(tag, args);
    }

    private static Pattern convertRecord(Expr.RecordLiteral record) {
        List<Located<Pattern>> fields = new ArrayList<>();
        for (Located<AssignedField<Expr>> field : record.fields()) {
            Pattern pattern = convertField(field.value());
            if (pattern == null) {
                return null;
            }
            fields.add(Located.at(field.region(), pattern));
        }
        return new Pattern.RecordDestructure(fields);
    }

    private static Pattern convertField(AssignedField<Expr> field) {
        if (field instanceof AssignedField.RequiredValue<Expr> required) {
            Pattern value = convert(required.value().value());
            return value == null
                    ? null
                    : new Pattern.RequiredField(required.label().value(), Located.at(required.value().region(), value));
        }
        if (field instanceof AssignedField.OptionalValue<Expr> optional) {
            return new Pattern.OptionalField(optional.label().value(), optional.value());
        }
        if (field instanceof AssignedField.LabelOnly<Expr> label) {
            return new Pattern.Identifier(label.label().value());
        }
        if (field instanceof AssignedField.SpaceBefore<Expr> before) {
            Pattern inner = convertField(before.field());
            return inner == null ? null : Pattern.SPACES.before(inner, before.spaces());
        }
        if (field instanceof AssignedField.SpaceAfter<Expr> after) {
            Pattern inner = convertField(after.field());
            return inner == null ? null : Pattern.SPACES.after(inner, after.spaces());
        }
        return null;
    }
}
