package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.AssignedField;
import org.finos.legend.indent.ast.BinaryOperator;
import org.finos.legend.indent.ast.CalledVia;
import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Pattern;
import org.finos.legend.indent.ast.Region;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExprToPattern Tests")
class ExprToPatternTest {

    private static <T> Located<T> at(T value) {
        return Located.at(Region.zero(), value);
    }

    private static Located<String> label(String name) {
        return at(name);
    }

    private static Located<AssignedField<Expr>> field(AssignedField<Expr> field) {
        return at(field);
    }

    @Test
    @DisplayName("Variables become identifiers")
    void testVar() {
        assertEquals(Optional.of(new Pattern.Identifier("x")), ExprToPattern.toPattern(Expr.Var.unqualified("x")));
        assertEquals(Optional.of(new Pattern.QualifiedIdentifier("Str", "x")),
                ExprToPattern.toPattern(new Expr.Var("Str", "x")));
    }

    @Test
    @DisplayName("Tag application becomes a tag pattern")
    void testTagApply() {
        Expr apply = new Expr.Apply(at(new Expr.GlobalTag("Pair")),
                List.of(at(Expr.Var.unqualified("a")), at(new Expr.Num("1"))), CalledVia.SPACE);
        Pattern.Apply pattern = assertInstanceOf(Pattern.Apply.class, ExprToPattern.toPattern(apply).orElseThrow());
        assertEquals(new Pattern.GlobalTag("Pair"), pattern.tag().value());
        assertEquals(List.of(new Pattern.Identifier("a"), new Pattern.NumLiteral("1")),
                pattern.args().stream().map(Located::value).toList());
    }

    @Test
    @DisplayName("Function application does not convert")
    void testFunctionApply() {
        Expr apply = new Expr.Apply(at(Expr.Var.unqualified("f")),
                List.of(at(Expr.Var.unqualified("a"))), CalledVia.SPACE);
        assertTrue(ExprToPattern.toPattern(apply).isEmpty());
    }

    @Test
    @DisplayName("Operators do not convert")
    void testBinaryOp() {
        Expr op = new Expr.BinaryOp(at(new Expr.Num("1")), at(BinaryOperator.PLUS), at(new Expr.Num("2")));
        assertTrue(ExprToPattern.toPattern(op).isEmpty());
    }

    @Test
    @DisplayName("Record literal becomes a destructure")
    void testRecord() {
        Expr record = new Expr.RecordLiteral(null, List.of(
                field(new AssignedField.LabelOnly<Expr>(label("x"))),
                field(new AssignedField.RequiredValue<Expr>(label("y"), List.of(), at(Expr.Var.unqualified("z")))),
                field(new AssignedField.OptionalValue<Expr>(label("w"), List.of(), at(new Expr.Num("0"))))),
                List.of());
        Pattern.RecordDestructure pattern =
                assertInstanceOf(Pattern.RecordDestructure.class, ExprToPattern.toPattern(record).orElseThrow());
        assertEquals(new Pattern.Identifier("x"), pattern.fields().get(0).value());
        Pattern.RequiredField required = assertInstanceOf(Pattern.RequiredField.class, pattern.fields().get(1).value());
        assertEquals(new Pattern.Identifier("z"), required.pattern().value());
        assertInstanceOf(Pattern.OptionalField.class, pattern.fields().get(2).value());
    }

    @Test
    @DisplayName("Record update does not convert")
    void testRecordUpdate() {
        Expr record = new Expr.RecordLiteral(at(Expr.Var.unqualified("r")),
                List.of(field(new AssignedField.LabelOnly<Expr>(label("x")))), List.of());
        assertTrue(ExprToPattern.toPattern(record).isEmpty());
    }

    @Test
    @DisplayName("Record field holding an operator does not convert")
    void testRecordWithOperatorValue() {
        Expr value = new Expr.BinaryOp(at(new Expr.Num("1")), at(BinaryOperator.PLUS), at(new Expr.Num("2")));
        Expr record = new Expr.RecordLiteral(null,
                List.of(field(new AssignedField.RequiredValue<Expr>(label("y"), List.of(), at(value)))), List.of());
        assertTrue(ExprToPattern.toPattern(record).isEmpty());
    }

    @Test
    @DisplayName("Spacing and parentheses carry through")
    void testSpacingAndParens() {
        List<CommentOrNewline> spaces = List.of(CommentOrNewline.newline());
        Expr expr = new Expr.SpaceBefore(new Expr.ParensAround(Expr.Var.unqualified("x")), spaces);
        assertEquals(Optional.of(new Pattern.SpaceBefore(new Pattern.Identifier("x"), spaces)),
                ExprToPattern.toPattern(expr));
    }

    @Test
    @DisplayName("Literals convert to literal patterns")
    void testLiterals() {
        assertEquals(Optional.of(new Pattern.StrLiteral("s")), ExprToPattern.toPattern(new Expr.Str("s")));
        assertEquals(Optional.of(new Pattern.FloatLiteral("2.5")), ExprToPattern.toPattern(new Expr.Float("2.5")));
    }

    @Test
    @DisplayName("Closures do not convert")
    void testClosure() {
        Expr closure = new Expr.Closure(List.of(at(new Pattern.Identifier("a"))), at(Expr.Var.unqualified("a")));
        assertTrue(ExprToPattern.toPattern(closure).isEmpty());
    }
}
