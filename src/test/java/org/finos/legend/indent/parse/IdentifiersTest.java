package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.BadIdent;
import org.finos.legend.indent.ast.Ident;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Identifiers Tests")
class IdentifiersTest {

    private static ParseResult<Ident, String> ident(String source) {
        return Identifiers.ident((line, column) -> "ident@" + column).parse(State.of(source));
    }

    private static Ident value(String source) {
        return ident(source).value();
    }

    @Test
    @DisplayName("Lowercase name")
    void testLowercase() {
        assertEquals(new Ident.Access("", List.of("count")), value("count"));
    }

    @Test
    @DisplayName("Module-qualified field access")
    void testQualifiedAccess() {
        assertEquals(new Ident.Access("Http.Client", List.of("config", "timeout")),
                value("Http.Client.config.timeout"));
    }

    @Test
    @DisplayName("Tags")
    void testTags() {
        assertEquals(new Ident.GlobalTag("Ok"), value("Ok"));
        assertEquals(new Ident.PrivateTag("@Hidden"), value("@Hidden"));
    }

    @Test
    @DisplayName("Accessor function")
    void testAccessor() {
        assertEquals(new Ident.AccessorFunction("name"), value(".name"));
    }

    @Test
    @DisplayName("Malformed identifiers are still consumed")
    void testMalformed() {
        assertEquals(new Ident.Malformed("snake_case", BadIdent.UNDERSCORE), value("snake_case"));
        assertEquals(new Ident.Malformed("Foo.Bar", BadIdent.QUALIFIED_TAG), value("Foo.Bar"));
        assertEquals(new Ident.Malformed(".a.b", BadIdent.WEIRD_ACCESSOR), value(".a.b"));
        assertEquals(new Ident.Malformed("@lower", BadIdent.BAD_PRIVATE_TAG), value("@lower"));
        assertEquals(new Ident.Malformed("rec.Field", BadIdent.WEIRD_DOT_QUALIFIED), value("rec.Field"));
    }

    @Test
    @DisplayName("Keywords are not identifiers")
    void testKeyword() {
        ParseResult<Ident, String> result = ident("then x");
        assertFalse(result.isOk());
        assertEquals(Progress.NO_PROGRESS, result.progress());
        assertTrue(Identifiers.isKeyword("when"));
        assertFalse(Identifiers.isKeyword("whenever"));
    }

    @Test
    @DisplayName("Identifier stops at an operator")
    void testStopsAtOperator() {
        ParseResult<Ident, String> result = ident("a+b");
        assertEquals(new Ident.Access("", List.of("a")), result.value());
        assertEquals(1, result.state().offset());
    }

    @Test
    @DisplayName("Lowercase label rejects keywords")
    void testLowercaseIdent() {
        Parser<String, String> label = Identifiers.lowercaseIdent((line, column) -> "label");
        assertEquals("name", label.parse(State.of("name: 1")).value());
        assertFalse(label.parse(State.of("is")).isOk());
        assertFalse(label.parse(State.of("Name")).isOk());
    }
}
