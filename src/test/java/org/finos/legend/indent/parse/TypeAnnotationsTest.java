package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.AssignedField;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.TypeAnnotation;
import org.finos.legend.indent.parse.error.EType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TypeAnnotations Tests")
class TypeAnnotationsTest {

    private final TypeAnnotations types = new TypeAnnotations();

    private ParseResult<Located<TypeAnnotation>, EType> parse(String source) {
        return types.parse(0, State.of(source));
    }

    private TypeAnnotation value(String source) {
        ParseResult<Located<TypeAnnotation>, EType> result = parse(source);
        assertTrue(result.isOk(), () -> "expected a type in: " + source);
        return result.value().value().withoutSpaces();
    }

    private static TypeAnnotation unspaced(Located<TypeAnnotation> type) {
        return type.value().withoutSpaces();
    }

    @Nested
    @DisplayName("Named types")
    class Named {

        @Test
        @DisplayName("Plain name")
        void testPlain() {
            assertEquals(new TypeAnnotation.Apply("", "Str", List.of()), value("Str"));
        }

        @Test
        @DisplayName("Qualified name with arguments")
        void testQualifiedWithArguments() {
            TypeAnnotation.Apply dict = assertInstanceOf(TypeAnnotation.Apply.class, value("Dict.Dict k v"));
            assertEquals("Dict", dict.moduleName());
            assertEquals("Dict", dict.name());
            assertEquals(List.of(new TypeAnnotation.BoundVariable("k"), new TypeAnnotation.BoundVariable("v")),
                    dict.arguments().stream().map(TypeAnnotationsTest::unspaced).toList());
        }

        @Test
        @DisplayName("Argument types need parentheses to take arguments")
        void testNestedArguments() {
            TypeAnnotation.Apply list = assertInstanceOf(TypeAnnotation.Apply.class, value("List (Result a e)"));
            assertEquals(1, list.arguments().size());
            assertInstanceOf(TypeAnnotation.Apply.class, unspaced(list.arguments().get(0)));
        }

        @Test
        @DisplayName("Wildcard and inferred")
        void testWildcardAndInferred() {
            assertEquals(new TypeAnnotation.Wildcard(), value("*"));
            assertEquals(new TypeAnnotation.Inferred(), value("_"));
        }

        @Test
        @DisplayName("Trailing spacing is left for the caller")
        void testNoTrailingSpacing() {
            ParseResult<Located<TypeAnnotation>, EType> result = parse("Str\n");
            assertEquals(3, result.state().offset());
        }
    }

    @Nested
    @DisplayName("Functions")
    class Functions {

        @Test
        @DisplayName("Two arguments and a result")
        void testFunction() {
            TypeAnnotation.Function function =
                    assertInstanceOf(TypeAnnotation.Function.class, value("Str, List a -> Bool"));
            assertEquals(2, function.arguments().size());
            assertEquals(new TypeAnnotation.Apply("", "Str", List.of()), unspaced(function.arguments().get(0)));
            assertEquals(new TypeAnnotation.Apply("", "Bool", List.of()), unspaced(function.result()));
        }

        @Test
        @DisplayName("Function type inside parentheses")
        void testHigherOrder() {
            TypeAnnotation.Function function =
                    assertInstanceOf(TypeAnnotation.Function.class, value("(a -> b), List a -> List b"));
            assertInstanceOf(TypeAnnotation.Function.class, unspaced(function.arguments().get(0)));
        }

        @Test
        @DisplayName("Missing result type is an error")
        void testMissingResult() {
            ParseResult<Located<TypeAnnotation>, EType> result = parse("Str ->");
            assertFalse(result.isOk());
            assertEquals(Progress.MADE_PROGRESS, result.progress());
        }
    }

    @Nested
    @DisplayName("Records and tag unions")
    class Structural {

        @Test
        @DisplayName("Record with required and optional fields")
        void testRecord() {
            TypeAnnotation.RecordType record =
                    assertInstanceOf(TypeAnnotation.RecordType.class, value("{ name : Str, age ? Num }"));
            assertEquals(2, record.fields().size());
            assertInstanceOf(AssignedField.RequiredValue.class, record.fields().get(0).value().withoutSpaces());
            assertInstanceOf(AssignedField.OptionalValue.class, record.fields().get(1).value().withoutSpaces());
            assertNull(record.extension());
        }

        @Test
        @DisplayName("Open record")
        void testRecordExtension() {
            TypeAnnotation.RecordType record =
                    assertInstanceOf(TypeAnnotation.RecordType.class, value("{ name : Str }r"));
            assertEquals(new TypeAnnotation.BoundVariable("r"), record.extension().value());
        }

        @Test
        @DisplayName("Record field without a type is an error")
        void testRecordFieldWithoutType() {
            ParseResult<Located<TypeAnnotation>, EType> result = parse("{ name }");
            assertFalse(result.isOk());
            assertInstanceOf(EType.RecordColon.class, result.error());
        }

        @Test
        @DisplayName("Tag union with payloads and a wildcard extension")
        void testTagUnion() {
            TypeAnnotation.TagUnion union =
                    assertInstanceOf(TypeAnnotation.TagUnion.class, value("[ Ok a, Err e, @Secret ]*"));
            assertEquals(3, union.tags().size());
            TypeAnnotation.Tag ok = union.tags().get(0).value();
            assertEquals("Ok", ok.name());
            assertFalse(ok.privateTag());
            assertEquals(1, ok.arguments().size());
            assertTrue(union.tags().get(2).value().privateTag());
            assertEquals(new TypeAnnotation.Wildcard(), union.extension().value());
        }

        @Test
        @DisplayName("Unclosed tag union is an error")
        void testUnclosedTagUnion() {
            ParseResult<Located<TypeAnnotation>, EType> result = parse("[ Ok a");
            assertFalse(result.isOk());
            assertInstanceOf(EType.TagUnionEnd.class, result.error());
        }
    }
}
