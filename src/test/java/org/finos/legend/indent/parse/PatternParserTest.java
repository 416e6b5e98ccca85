package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.BadIdent;
import org.finos.legend.indent.ast.Base;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Pattern;
import org.finos.legend.indent.parse.error.EPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PatternParser Tests")
class PatternParserTest {

    private final PatternParser patterns = new ExprParser().patterns();

    private ParseResult<Located<Pattern>, EPattern> parse(String source) {
        return patterns.locPattern(0).parse(State.of(source));
    }

    private Pattern value(String source) {
        ParseResult<Located<Pattern>, EPattern> result = parse(source);
        assertTrue(result.isOk(), () -> "expected a pattern in: " + source);
        return result.value().value();
    }

    @Nested
    @DisplayName("Simple patterns")
    class Simple {

        @Test
        @DisplayName("Identifier")
        void testIdentifier() {
            assertEquals(new Pattern.Identifier("name"), value("name"));
        }

        @Test
        @DisplayName("Qualified identifier")
        void testQualified() {
            assertEquals(new Pattern.QualifiedIdentifier("Json", "decoder"), value("Json.decoder"));
        }

        @Test
        @DisplayName("Field access is not a pattern")
        void testAccessIsMalformed() {
            assertEquals(new Pattern.Malformed("rec.field"), value("rec.field"));
        }

        @Test
        @DisplayName("Underscores")
        void testUnderscore() {
            assertEquals(new Pattern.Underscore(""), value("_"));
            assertEquals(new Pattern.Underscore("unused"), value("_unused"));
        }

        @Test
        @DisplayName("Literals")
        void testLiterals() {
            assertEquals(new Pattern.NumLiteral("-3"), value("-3"));
            assertEquals(new Pattern.FloatLiteral("1.5"), value("1.5"));
            assertEquals(new Pattern.NonBase10Literal("0b101", Base.BINARY, false), value("0b101"));
            assertEquals(new Pattern.StrLiteral("hi"), value("\"hi\""));
        }

        @Test
        @DisplayName("Identifier with underscore is malformed")
        void testMalformedIdent() {
            assertEquals(new Pattern.MalformedIdent("snake_case", BadIdent.UNDERSCORE), value("snake_case"));
        }

        @Test
        @DisplayName("Operator is not a pattern start")
        void testNoPattern() {
            ParseResult<Located<Pattern>, EPattern> result = parse("+ 1");
            assertFalse(result.isOk());
            assertEquals(Progress.NO_PROGRESS, result.progress());
        }
    }

    @Nested
    @DisplayName("Compound patterns")
    class Compound {

        @Test
        @DisplayName("Tag with arguments")
        void testTagArguments() {
            Pattern.Apply apply = assertInstanceOf(Pattern.Apply.class, value("Pair first _"));
            assertEquals(new Pattern.GlobalTag("Pair"), apply.tag().value());
            assertEquals(List.of(new Pattern.Identifier("first"), new Pattern.Underscore("")),
                    apply.args().stream().map(a -> a.value().withoutSpaces()).toList());
        }

        @Test
        @DisplayName("Nested tag arguments need parentheses")
        void testNestedTag() {
            Pattern.Apply apply = assertInstanceOf(Pattern.Apply.class, value("Ok (Just x)"));
            assertEquals(1, apply.args().size());
            assertInstanceOf(Pattern.Apply.class, apply.args().get(0).value().withoutSpaces());
        }

        @Test
        @DisplayName("Unparenthesized tag argument takes no arguments of its own")
        void testFlatTagArguments() {
            Pattern.Apply apply = assertInstanceOf(Pattern.Apply.class, value("Ok Just x"));
            assertEquals(List.of(new Pattern.GlobalTag("Just"), new Pattern.Identifier("x")),
                    apply.args().stream().map(a -> a.value().withoutSpaces()).toList());
        }

        @Test
        @DisplayName("Tag arguments on the next line must sit past the tag column")
        void testTagArgumentColumn() {
            ParseResult<Located<Pattern>, EPattern> result = parse("Ok\nx");
            assertTrue(result.isOk());
            assertEquals(new Pattern.GlobalTag("Ok"), result.value().value());
            assertEquals(0, result.state().line());

            Pattern.Apply apply = assertInstanceOf(Pattern.Apply.class, value("Ok\n  x"));
            assertEquals(1, apply.args().size());
        }

        @Test
        @DisplayName("Private tag")
        void testPrivateTag() {
            assertEquals(new Pattern.PrivateTag("@Secret"), value("@Secret"));
        }

        @Test
        @DisplayName("Record destructure with all field kinds")
        void testRecord() {
            Pattern.RecordDestructure record =
                    assertInstanceOf(Pattern.RecordDestructure.class, value("{ a, b: Just c, d ? 0 }"));
            assertEquals(3, record.fields().size());
            assertEquals(new Pattern.Identifier("a"), record.fields().get(0).value().withoutSpaces());
            Pattern.RequiredField required =
                    assertInstanceOf(Pattern.RequiredField.class, record.fields().get(1).value().withoutSpaces());
            assertEquals("b", required.label());
            Pattern.OptionalField optional =
                    assertInstanceOf(Pattern.OptionalField.class, record.fields().get(2).value().withoutSpaces());
            assertEquals("d", optional.label());
        }

        @Test
        @DisplayName("Unclosed record is a committed failure")
        void testUnclosedRecord() {
            ParseResult<Located<Pattern>, EPattern> result = parse("{ a, b");
            assertFalse(result.isOk());
            assertEquals(Progress.MADE_PROGRESS, result.progress());
            assertInstanceOf(EPattern.InRecord.class, result.error());
        }

        @Test
        @DisplayName("Same binding ignores spacing")
        void testSameBinding() {
            assertTrue(Pattern.sameBinding(value("Pair a b"), value("Pair a\n b")));
            assertFalse(Pattern.sameBinding(value("Pair a b"), value("Pair a c")));
        }
    }
}
