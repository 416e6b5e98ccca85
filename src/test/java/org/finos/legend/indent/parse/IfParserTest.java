package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.parse.error.EExpr;
import org.finos.legend.indent.parse.error.EIf;
import org.finos.legend.indent.parse.error.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IfParser Tests")
class IfParserTest {

    private static Expr.If parseIf(String source) {
        return assertInstanceOf(Expr.If.class, ExprParser.parse(source).value());
    }

    @Test
    @DisplayName("Single branch on one line")
    void testSingleLine() {
        Expr.If expr = parseIf("if a then b else c");
        assertEquals(1, expr.branches().size());
        assertEquals(Expr.Var.unqualified("a"), expr.branches().get(0).condition().value().withoutSpaces());
        assertEquals(Expr.Var.unqualified("b"), expr.branches().get(0).then().value().withoutSpaces());
        assertEquals(Expr.Var.unqualified("c"), expr.finalElse().value().withoutSpaces());
    }

    @Test
    @DisplayName("Else-if chain collects branches")
    void testElseIfChain() {
        Expr.If expr = parseIf("if a then 1 else if b then 2 else if c then 3 else 4");
        assertEquals(3, expr.branches().size());
        assertEquals(Expr.Var.unqualified("c"), expr.branches().get(2).condition().value().withoutSpaces());
        assertEquals(new Expr.Num("4"), expr.finalElse().value().withoutSpaces());
    }

    @Test
    @DisplayName("Branches on their own lines")
    void testMultiline() {
        Expr.If expr = parseIf("""
                if x > 0 then
                    x
                else
                    -x""");
        assertInstanceOf(Expr.BinaryOp.class, expr.branches().get(0).condition().value().withoutSpaces());
        assertInstanceOf(Expr.UnaryOp.class, expr.finalElse().value().withoutSpaces());
    }

    @Test
    @DisplayName("Condition may be an application")
    void testApplicationCondition() {
        Expr.If expr = parseIf("if List.isEmpty xs then 0 else 1");
        assertInstanceOf(Expr.Apply.class, expr.branches().get(0).condition().value().withoutSpaces());
    }

    @Test
    @DisplayName("Missing else is an error")
    void testMissingElse() {
        ParseException e = assertThrows(ParseException.class, () -> ExprParser.parse("if c then a"));
        EExpr.InIf inIf = assertInstanceOf(EExpr.InIf.class, e.getProblem());
        assertInstanceOf(EIf.Else.class, inIf.problem());
    }

    @Test
    @DisplayName("Missing then is an error")
    void testMissingThen() {
        ParseException e = assertThrows(ParseException.class, () -> ExprParser.parse("if c else a"));
        EExpr.InIf inIf = assertInstanceOf(EExpr.InIf.class, e.getProblem());
        assertInstanceOf(EIf.Then.class, inIf.problem());
    }

    @Test
    @DisplayName("Identifier starting with if is not the keyword")
    void testIffy() {
        assertEquals(Expr.Var.unqualified("iffy"), ExprParser.parse("iffy").value());
    }
}
