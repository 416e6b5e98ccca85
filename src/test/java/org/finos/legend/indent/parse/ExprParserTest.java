package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.AssignedField;
import org.finos.legend.indent.ast.BinaryOperator;
import org.finos.legend.indent.ast.CalledVia;
import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Pattern;
import org.finos.legend.indent.ast.UnaryOperator;
import org.finos.legend.indent.parse.error.EExpr;
import org.finos.legend.indent.parse.error.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the operator chain, terms and the string-level entry point.
 */
@DisplayName("ExprParser Tests")
class ExprParserTest {

    private static Expr parse(String source) {
        return ExprParser.parse(source).value();
    }

    private static Expr var(String name) {
        return Expr.Var.unqualified(name);
    }

    // ==================== Literals ====================

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("Integer literal keeps its text")
        void testInteger() {
            assertEquals(new Expr.Num("42"), parse("42"));
        }

        @Test
        @DisplayName("Most negative long is read through its signed text")
        void testLongMinValue() {
            Expr.Num num = assertInstanceOf(Expr.Num.class, parse("-9223372036854775808"));
            assertEquals("-9223372036854775808", num.text());
            assertEquals(Long.MIN_VALUE, num.longValue());
        }

        @ParameterizedTest
        @ValueSource(longs = {0L, 7L, -7L, 1_000_000L, Long.MAX_VALUE, Long.MIN_VALUE})
        @DisplayName("Long values survive printing and parsing")
        void testLongValues(long value) {
            Expr.Num num = assertInstanceOf(Expr.Num.class, parse(Long.toString(value)));
            assertEquals(value, num.longValue());
        }

        @Test
        @DisplayName("Float literal")
        void testFloat() {
            Expr.Float number = assertInstanceOf(Expr.Float.class, parse("3.25"));
            assertEquals(3.25, number.doubleValue());
        }

        @ParameterizedTest
        @ValueSource(doubles = {Double.MAX_VALUE, Double.MIN_VALUE, -0.5, 1.0E10, 1.0E-5, -1.0E-300})
        @DisplayName("Double values survive printing and parsing")
        void testDoubleValues(double value) {
            Expr.Float number = assertInstanceOf(Expr.Float.class, parse(Double.toString(value)));
            assertEquals(value, number.doubleValue());
        }

        @Test
        @DisplayName("Negating a signed literal flips its sign")
        void testDoubleNegation() {
            Expr.Num num = assertInstanceOf(Expr.Num.class, parse("--1"));
            assertEquals("--1", num.text());
            assertEquals(1L, num.longValue());

            Expr.Float number = assertInstanceOf(Expr.Float.class, parse("--1.5"));
            assertEquals(1.5, number.doubleValue());

            Expr.BinaryOp op = assertInstanceOf(Expr.BinaryOp.class, parse("a + --1"));
            assertEquals(1L, assertInstanceOf(Expr.Num.class, op.right().value()).longValue());
        }

        @Test
        @DisplayName("Hex literal")
        void testHex() {
            Expr.NonBase10Int number = assertInstanceOf(Expr.NonBase10Int.class, parse("0x1F"));
            assertEquals(31, number.value().intValue());
            assertFalse(number.negative());
        }

        @Test
        @DisplayName("String literal")
        void testString() {
            assertEquals(new Expr.Str("hello"), parse("\"hello\""));
        }

        @Test
        @DisplayName("Digits glued to letters are rejected")
        void testNumberFollowedByLetters() {
            ParseException e = assertThrows(ParseException.class, () -> parse("12abc"));
            assertInstanceOf(EExpr.InNumber.class, e.getProblem());
        }
    }

    // ==================== Names ====================

    @Nested
    @DisplayName("Names")
    class Names {

        @Test
        @DisplayName("Plain variable")
        void testVar() {
            assertEquals(var("count"), parse("count"));
        }

        @Test
        @DisplayName("Qualified variable")
        void testQualified() {
            assertEquals(new Expr.Var("List", "map"), parse("List.map"));
        }

        @Test
        @DisplayName("Field access chain")
        void testAccess() {
            Expr.Access access = assertInstanceOf(Expr.Access.class, parse("rec.inner.field"));
            assertEquals("field", access.field());
            Expr.Access inner = assertInstanceOf(Expr.Access.class, access.target());
            assertEquals("inner", inner.field());
            assertEquals(var("rec"), inner.target());
        }

        @Test
        @DisplayName("Global tag")
        void testTag() {
            assertEquals(new Expr.GlobalTag("Ok"), parse("Ok"));
        }

        @Test
        @DisplayName("Accessor function")
        void testAccessorFunction() {
            assertEquals(new Expr.AccessorFunction("name"), parse(".name"));
        }
    }

    // ==================== Operator chain ====================

    @Nested
    @DisplayName("Operator chain")
    class OperatorChain {

        @Test
        @DisplayName("Application binds tighter than operators: f a + b")
        void testApplyThenOperator() {
            Expr.BinaryOp op = assertInstanceOf(Expr.BinaryOp.class, parse("f a + b"));
            assertEquals(BinaryOperator.PLUS, op.operator().value());
            Expr.Apply apply = assertInstanceOf(Expr.Apply.class, op.left().value());
            assertEquals(var("f"), apply.function().value());
            assertEquals(List.of(var("a")), apply.args().stream().map(a -> a.value()).toList());
            assertEquals(CalledVia.SPACE, apply.calledVia());
            assertEquals(var("b"), op.right().value());
        }

        @Test
        @DisplayName("Operators fold to the right in source order")
        void testRightFold() {
            Expr.BinaryOp outer = assertInstanceOf(Expr.BinaryOp.class, parse("a * b + c"));
            assertEquals(BinaryOperator.STAR, outer.operator().value());
            assertEquals(var("a"), outer.left().value());
            Expr.BinaryOp inner = assertInstanceOf(Expr.BinaryOp.class, outer.right().value());
            assertEquals(BinaryOperator.PLUS, inner.operator().value());
            assertEquals(var("b"), inner.left().value());
            assertEquals(var("c"), inner.right().value());
        }

        @Test
        @DisplayName("x -1 applies x to a negative literal")
        void testNegativeArgument() {
            Expr.Apply apply = assertInstanceOf(Expr.Apply.class, parse("x -1"));
            assertEquals(var("x"), apply.function().value());
            assertEquals(1, apply.args().size());
            assertEquals(new Expr.Num("-1"), apply.args().get(0).value());
        }

        @Test
        @DisplayName("x - 1 is a subtraction")
        void testSpacedMinus() {
            Expr.BinaryOp op = assertInstanceOf(Expr.BinaryOp.class, parse("x - 1"));
            assertEquals(BinaryOperator.MINUS, op.operator().value());
            assertEquals(new Expr.Num("1"), op.right().value());
        }

        @Test
        @DisplayName("x-1 is a subtraction")
        void testTightMinus() {
            Expr.BinaryOp op = assertInstanceOf(Expr.BinaryOp.class, parse("x-1"));
            assertEquals(BinaryOperator.MINUS, op.operator().value());
            assertEquals(var("x"), op.left().value());
            assertEquals(new Expr.Num("1"), op.right().value());
        }

        @Test
        @DisplayName("Negative literal after an operator")
        void testNegativeOperand() {
            Expr.BinaryOp op = assertInstanceOf(Expr.BinaryOp.class, parse("a + -5"));
            assertEquals(new Expr.Num("-5"), op.right().value());
        }

        @Test
        @DisplayName("Unary negate of a variable")
        void testUnaryNegate() {
            Expr.UnaryOp op = assertInstanceOf(Expr.UnaryOp.class, parse("-x"));
            assertEquals(UnaryOperator.NEGATE, op.operator().value());
            assertEquals(var("x"), op.operand().value());
        }

        @Test
        @DisplayName("Unary not")
        void testUnaryNot() {
            Expr.UnaryOp op = assertInstanceOf(Expr.UnaryOp.class, parse("!done"));
            assertEquals(UnaryOperator.NOT, op.operator().value());
            assertEquals(var("done"), op.operand().value());
        }

        @Test
        @DisplayName("Arguments continue on indented lines")
        void testMultilineApplication() {
            Expr.Apply apply = assertInstanceOf(Expr.Apply.class, parse("""
                    f
                        a
                        b"""));
            assertEquals(2, apply.args().size());
            Expr.SpaceBefore first = assertInstanceOf(Expr.SpaceBefore.class, apply.args().get(0).value());
            assertEquals(List.of(CommentOrNewline.newline()), first.spaces());
            assertEquals(var("a"), first.expr());
        }

        @Test
        @DisplayName("Parenthesized chain applied to an argument")
        void testParens() {
            Expr.Apply apply = assertInstanceOf(Expr.Apply.class, parse("(a + b) c"));
            Expr.ParensAround parens = assertInstanceOf(Expr.ParensAround.class, apply.function().value());
            assertInstanceOf(Expr.BinaryOp.class, parens.inner().withoutSpaces());
        }

        @Test
        @DisplayName("Pizza operator")
        void testPizza() {
            Expr.BinaryOp op = assertInstanceOf(Expr.BinaryOp.class, parse("xs |> List.map f"));
            assertEquals(BinaryOperator.PIZZA, op.operator().value());
            assertInstanceOf(Expr.Apply.class, op.right().value());
        }

        @Test
        @DisplayName("Region of a chain covers all of its terms")
        void testRegion() {
            var located = ExprParser.parse("f a + b");
            assertEquals(0, located.region().startColumn());
            assertEquals(7, located.region().endColumn());
        }
    }

    // ==================== Collections and closures ====================

    @Nested
    @DisplayName("Collections and closures")
    class Collections {

        @Test
        @DisplayName("List literal")
        void testList() {
            Expr.ListLiteral list = assertInstanceOf(Expr.ListLiteral.class, parse("[1, 2, 3]"));
            assertEquals(List.of(new Expr.Num("1"), new Expr.Num("2"), new Expr.Num("3")),
                    list.items().stream().map(i -> i.value().withoutSpaces()).toList());
        }

        @Test
        @DisplayName("Empty list keeps its comments")
        void testEmptyListWithComment() {
            Expr.ListLiteral list = assertInstanceOf(Expr.ListLiteral.class, parse("""
                    [
                        # nothing yet
                    ]"""));
            assertTrue(list.items().isEmpty());
            assertTrue(list.finalComments().contains(new CommentOrNewline.LineComment(" nothing yet")));
        }

        @Test
        @DisplayName("Record literal with required and label-only fields")
        void testRecord() {
            Expr.RecordLiteral record = assertInstanceOf(Expr.RecordLiteral.class, parse("{ a: 1, b }"));
            assertFalse(record.isUpdate());
            assertEquals(2, record.fields().size());
            assertInstanceOf(AssignedField.RequiredValue.class, record.fields().get(0).value().withoutSpaces());
            assertInstanceOf(AssignedField.LabelOnly.class, record.fields().get(1).value().withoutSpaces());
        }

        @Test
        @DisplayName("Record update")
        void testRecordUpdate() {
            Expr.RecordLiteral record = assertInstanceOf(Expr.RecordLiteral.class, parse("{ r & a: 1 }"));
            assertTrue(record.isUpdate());
            assertEquals(var("r"), record.update().value());
            assertEquals(1, record.fields().size());
        }

        @Test
        @DisplayName("Record update needs a plain variable")
        void testRecordUpdateOfAccess() {
            ParseException e = assertThrows(ParseException.class, () -> parse("{ r.x & a: 1 }"));
            assertInstanceOf(EExpr.InRecord.class, e.getProblem());
        }

        @Test
        @DisplayName("Closure with two parameters")
        void testClosure() {
            Expr.Closure closure = assertInstanceOf(Expr.Closure.class, parse("\\a, b -> a + b"));
            assertEquals(List.of(new Pattern.Identifier("a"), new Pattern.Identifier("b")),
                    closure.params().stream().map(p -> p.value().withoutSpaces()).toList());
            assertInstanceOf(Expr.BinaryOp.class, closure.body().value().withoutSpaces());
        }

        @Test
        @DisplayName("Closure without parameters is an error")
        void testClosureWithoutParams() {
            ParseException e = assertThrows(ParseException.class, () -> parse("\\ -> 1"));
            assertInstanceOf(EExpr.InLambda.class, e.getProblem());
        }
    }

    // ==================== Errors ====================

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Unknown operator")
        void testUnknownOperator() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a ++ b"));
            EExpr.BadOperator problem = assertInstanceOf(EExpr.BadOperator.class, e.getProblem());
            assertEquals("++", problem.operator());
            assertEquals(0, e.getLine());
            assertEquals(2, e.getColumn());
        }

        @Test
        @DisplayName("Definition operator after another operator")
        void testAssignmentAfterOperator() {
            ParseException e = assertThrows(ParseException.class, () -> parse("1 + 2 = 3"));
            EExpr.BadOperator problem = assertInstanceOf(EExpr.BadOperator.class, e.getProblem());
            assertEquals("=", problem.operator());
            assertEquals(6, problem.column());
        }

        @Test
        @DisplayName("Operator without a right operand")
        void testMissingOperand() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a +"));
            assertInstanceOf(EExpr.Start.class, e.getProblem());
        }

        @Test
        @DisplayName("Leftover input is reported at its position")
        void testTrailingInput() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a )"));
            assertInstanceOf(EExpr.BadExprEnd.class, e.getProblem());
            assertEquals(2, e.getColumn());
            assertTrue(e.getMessage().startsWith("line 1:3 "));
        }

        @Test
        @DisplayName("Tabs are not spacing")
        void testTab() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a\t+ b"));
            assertInstanceOf(EExpr.Space.class, e.getProblem());
        }

        @Test
        @DisplayName("Empty input")
        void testEmpty() {
            assertThrows(ParseException.class, () -> parse(""));
        }
    }
}
