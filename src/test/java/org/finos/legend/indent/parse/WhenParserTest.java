package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Pattern;
import org.finos.legend.indent.parse.error.EExpr;
import org.finos.legend.indent.parse.error.EWhen;
import org.finos.legend.indent.parse.error.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WhenParser Tests")
class WhenParserTest {

    private static Expr.When parseWhen(String source) {
        return assertInstanceOf(Expr.When.class, ExprParser.parse(source).value());
    }

    @Test
    @DisplayName("Aligned branches")
    void testBranches() {
        Expr.When when = parseWhen("""
                when x is
                    A -> 1
                    B -> 2
                    _ -> 3""");
        assertEquals(Expr.Var.unqualified("x"), when.condition().value().withoutSpaces());
        assertEquals(3, when.branches().size());
        assertEquals(new Pattern.GlobalTag("B"), when.branches().get(1).patterns().get(0).value().withoutSpaces());
        assertEquals(new Expr.Num("3"), when.branches().get(2).value().value().withoutSpaces());
        assertNull(when.branches().get(0).guard());
    }

    @Test
    @DisplayName("Alternatives share a branch")
    void testAlternatives() {
        Expr.When when = parseWhen("""
                when color is
                    Red | Green -> 1
                    Blue -> 2""");
        assertEquals(List.of(new Pattern.GlobalTag("Red"), new Pattern.GlobalTag("Green")),
                when.branches().get(0).patterns().stream().map(p -> p.value().withoutSpaces()).toList());
    }

    @Test
    @DisplayName("Guarded branch")
    void testGuard() {
        Expr.When when = parseWhen("""
                when result is
                    Ok n if n > 0 -> n
                    _ -> 0""");
        Expr.WhenBranch first = when.branches().get(0);
        assertInstanceOf(Pattern.Apply.class, first.patterns().get(0).value().withoutSpaces());
        assertNotNull(first.guard());
        assertInstanceOf(Expr.BinaryOp.class, first.guard().value().withoutSpaces());
        assertEquals(Expr.Var.unqualified("n"), first.value().value().withoutSpaces());
    }

    @Test
    @DisplayName("Branch result continues on the next line")
    void testResultOnNextLine() {
        Expr.When when = parseWhen("""
                when x is
                    A ->
                        f 1
                    B -> 2""");
        assertEquals(2, when.branches().size());
        assertInstanceOf(Expr.Apply.class, when.branches().get(0).value().value().withoutSpaces());
    }

    @Test
    @DisplayName("Branch indented less than the first one reports the offset")
    void testMisalignedBranch() {
        ParseException e = assertThrows(ParseException.class, () -> ExprParser.parse("""
                when x is
                    A -> 1
                  B -> 2"""));
        EExpr.InWhen inWhen = assertInstanceOf(EExpr.InWhen.class, e.getProblem());
        EWhen.PatternAlignment alignment = assertInstanceOf(EWhen.PatternAlignment.class, inWhen.problem());
        assertEquals(2, alignment.delta());
        assertEquals(2, alignment.line());
        assertEquals(2, alignment.column());
    }

    @Test
    @DisplayName("when on a line indented less than its definition body needs")
    void testWhenLineBelowBodyIndent() {
        ParseException e = assertThrows(ParseException.class, () -> ExprParser.parse("""
                y = when x is
                    A -> 1
                y"""));
        EExpr.InWhen inWhen = assertInstanceOf(EExpr.InWhen.class, e.getProblem());
        EWhen.PatternAlignment alignment = assertInstanceOf(EWhen.PatternAlignment.class, inWhen.problem());
        assertEquals(1, alignment.delta());
        assertEquals(0, alignment.line());
        assertEquals(13, alignment.column());
    }

    @Test
    @DisplayName("Missing arrow")
    void testMissingArrow() {
        ParseException e = assertThrows(ParseException.class, () -> ExprParser.parse("""
                when x is
                    A 1"""));
        EExpr.InWhen inWhen = assertInstanceOf(EExpr.InWhen.class, e.getProblem());
        assertInstanceOf(EWhen.Arrow.class, inWhen.problem());
    }

    @Test
    @DisplayName("when inside a definition ends at the block column")
    void testWhenInDefinition() {
        Expr.Defs defs = assertInstanceOf(Expr.Defs.class, ExprParser.parse("""
                y =
                    when x is
                        A -> 1
                        B -> 2
                y"""));
        assertEquals(Expr.Var.unqualified("y"), defs.body().value().withoutSpaces());
    }
}
