package org.finos.legend.indent.ast;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Expression tree produced by the expression parser.
 *
 * <p>Spacing and comments never become tree nodes of their own; they ride along
 * as {@link SpaceBefore} / {@link SpaceAfter} wrappers around the node they
 * were found next to.
 *
 * <p>Example: {@code f a + b} parses to
 * <pre>
 * BinaryOp(Apply(Var f, [Var a], SPACE), PLUS, Var b)
 * </pre>
 */
public sealed interface Expr
        permits Expr.Num, Expr.Float, Expr.NonBase10Int, Expr.Str,
        Expr.Access, Expr.AccessorFunction, Expr.Var, Expr.GlobalTag, Expr.PrivateTag,
        Expr.ListLiteral, Expr.RecordLiteral, Expr.Closure, Expr.Defs, Expr.Backpassing,
        Expr.Apply, Expr.BinaryOp, Expr.UnaryOp, Expr.If, Expr.When,
        Expr.SpaceBefore, Expr.SpaceAfter, Expr.ParensAround, Expr.MalformedIdent {

    Spaceable<Expr> SPACES = Spaceable.of(SpaceBefore::new, SpaceAfter::new);

    /**
     * This expression with any spacing wrappers removed.
     */
    default Expr withoutSpaces() {
        Expr current = this;
        while (true) {
            if (current instanceof SpaceBefore before) {
                current = before.expr();
            } else if (current instanceof SpaceAfter after) {
                current = after.expr();
            } else {
                return current;
            }
        }
    }

    // ==================== Literals ====================

    /**
     * Decimal integer literal. The text keeps its signs and any {@code _} separators;
     * each leading {@code -} flips the sign, so {@code --1} reads as 1.
     */
    record Num(String text) implements Expr {
        public Num {
            Objects.requireNonNull(text, "Literal text cannot be null");
        }

        public long longValue() {
            return Long.parseLong(signedDigits(text));
        }
    }

    record Float(String text) implements Expr {
        public Float {
            Objects.requireNonNull(text, "Literal text cannot be null");
        }

        public double doubleValue() {
            return Double.parseDouble(signedDigits(text));
        }
    }

    /**
     * Literal text with its leading minus signs folded into at most one.
     */
    private static String signedDigits(String text) {
        int minusSigns = 0;
        while (minusSigns < text.length() && text.charAt(minusSigns) == '-') {
            minusSigns++;
        }
        String digits = text.substring(minusSigns).replace("_", "");
        return minusSigns % 2 == 1 ? "-" + digits : digits;
    }

    /**
     * Hex, octal or binary integer literal.
     *
     * @param text     exact source text, e.g. {@code -0x1F}
     * @param negative whether the literal is negated
     */
    record NonBase10Int(String text, Base base, boolean negative) implements Expr {
        public NonBase10Int {
            Objects.requireNonNull(text, "Literal text cannot be null");
            Objects.requireNonNull(base, "Base cannot be null");
        }

        public BigInteger value() {
            int prefixAt = text.indexOf(base.prefix());
            String digits = text.substring(prefixAt + base.prefix().length()).replace("_", "");
            BigInteger magnitude = new BigInteger(digits, base.radix());
            return negative ? magnitude.negate() : magnitude;
        }
    }

    record Str(String value) implements Expr {
        public Str {
            Objects.requireNonNull(value, "String value cannot be null");
        }
    }

    // ==================== Names ====================

    /** {@code target.field} */
    record Access(Expr target, String field) implements Expr {
    }

    /** {@code .field} used as a function */
    record AccessorFunction(String field) implements Expr {
    }

    /**
     * Variable reference.
     *
     * @param moduleName dotted module qualifier, empty when unqualified
     */
    record Var(String moduleName, String ident) implements Expr {
        public Var {
            Objects.requireNonNull(moduleName, "Module name cannot be null");
            Objects.requireNonNull(ident, "Identifier cannot be null");
        }

        public static Var unqualified(String ident) {
            return new Var("", ident);
        }
    }

    record GlobalTag(String name) implements Expr {
    }

    record PrivateTag(String name) implements Expr {
    }

    record MalformedIdent(String text, BadIdent problem) implements Expr {
    }

    // ==================== Collections ====================

    record ListLiteral(List<Located<Expr>> items, List<CommentOrNewline> finalComments) implements Expr {
        public ListLiteral {
            items = List.copyOf(items);
            finalComments = List.copyOf(finalComments);
        }
    }

    /**
     * Record literal, or record update when {@code update} is present.
     *
     * @param update the record being updated ({@code { rec & a: 1 }}), or null
     */
    record RecordLiteral(
            Located<Expr> update,
            List<Located<AssignedField<Expr>>> fields,
            List<CommentOrNewline> finalComments) implements Expr {
        public RecordLiteral {
            fields = List.copyOf(fields);
            finalComments = List.copyOf(finalComments);
        }

        public boolean isUpdate() {
            return update != null;
        }
    }

    // ==================== Functions ====================

    /** {@code \a, b -> body} */
    record Closure(List<Located<Pattern>> params, Located<Expr> body) implements Expr {
        public Closure {
            params = List.copyOf(params);
            Objects.requireNonNull(body, "Closure body cannot be null");
        }
    }

    record Apply(Located<Expr> function, List<Located<Expr>> args, CalledVia calledVia) implements Expr {
        public Apply {
            Objects.requireNonNull(function, "Applied function cannot be null");
            args = List.copyOf(args);
            Objects.requireNonNull(calledVia, "CalledVia cannot be null");
        }
    }

    record BinaryOp(Located<Expr> left, Located<BinaryOperator> operator, Located<Expr> right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(left, "Left operand cannot be null");
            Objects.requireNonNull(operator, "Operator cannot be null");
            Objects.requireNonNull(right, "Right operand cannot be null");
        }
    }

    record UnaryOp(Located<Expr> operand, Located<UnaryOperator> operator) implements Expr {
    }

    // ==================== Definitions ====================

    /**
     * A block of definitions followed by the expression it evaluates to.
     */
    record Defs(List<Located<Def>> defs, Located<Expr> body) implements Expr {
        public Defs {
            defs = List.copyOf(defs);
            Objects.requireNonNull(body, "Definitions block needs a final expression");
        }
    }

    /**
     * {@code pattern <- producer} followed by the rest of the block.
     */
    record Backpassing(List<Located<Pattern>> patterns, Located<Expr> producer, Located<Expr> continuation)
            implements Expr {
        public Backpassing {
            patterns = List.copyOf(patterns);
            Objects.requireNonNull(producer, "Producer cannot be null");
            Objects.requireNonNull(continuation, "Continuation cannot be null");
        }
    }

    // ==================== Control flow ====================

    record IfBranch(Located<Expr> condition, Located<Expr> then) {
    }

    /**
     * {@code if c1 then a else if c2 then b else c}.
     */
    record If(List<IfBranch> branches, Located<Expr> finalElse) implements Expr {
        public If {
            branches = List.copyOf(branches);
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("If needs at least one branch");
            }
            Objects.requireNonNull(finalElse, "If needs an else branch");
        }
    }

    /**
     * One {@code when} branch: alternatives sharing an optional guard and a result.
     *
     * @param guard the {@code if} guard, or null
     */
    record WhenBranch(List<Located<Pattern>> patterns, Located<Expr> value, Located<Expr> guard) {
        public WhenBranch {
            patterns = List.copyOf(patterns);
            Objects.requireNonNull(value, "Branch result cannot be null");
        }
    }

    record When(Located<Expr> condition, List<WhenBranch> branches) implements Expr {
        public When {
            Objects.requireNonNull(condition, "When condition cannot be null");
            branches = List.copyOf(branches);
        }
    }

    // ==================== Spacing ====================

    record SpaceBefore(Expr expr, List<CommentOrNewline> spaces) implements Expr {
        public SpaceBefore {
            spaces = List.copyOf(spaces);
        }
    }

    record SpaceAfter(Expr expr, List<CommentOrNewline> spaces) implements Expr {
        public SpaceAfter {
            spaces = List.copyOf(spaces);
        }
    }

    record ParensAround(Expr inner) implements Expr {
    }
}
