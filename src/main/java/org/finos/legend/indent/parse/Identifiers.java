package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.BadIdent;
import org.finos.legend.indent.ast.Ident;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Identifier classifier.
 *
 * <p>Examples:
 * <pre>
 * foo              Access("", [foo])
 * rec.a.b          Access("", [rec, a, b])
 * Str.Sub.concat   Access("Str.Sub", [concat])
 * Foo              GlobalTag(Foo)
 * &#64;Foo             PrivateTag(&#64;Foo)
 * .name            AccessorFunction(name)
 * foo_bar          Malformed(foo_bar, UNDERSCORE)
 * </pre>
 *
 * <p>Keywords are never identifiers: they fail without consuming input.
 */
public final class Identifiers {

    public static final Set<String> KEYWORDS = Set.of("if", "then", "else", "when", "is", "as");

    private Identifiers() {
    }

    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    public static <E> Parser<Ident, E> ident(PositionalError<E> notFound) {
        return state -> parseIdent(state, notFound);
    }

    /**
     * A lowercase name such as a record field label, never a keyword.
     */
    public static <E> Parser<String, E> lowercaseIdent(PositionalError<E> notFound) {
        return state -> {
            if (!Character.isLowerCase(state.peek())) {
                return ParseResult.err(Progress.NO_PROGRESS, notFound.at(state), state);
            }
            int end = chompAlphanumeric(state, 0);
            String name = state.source().substring(state.offset(), state.offset() + end);
            if (isKeyword(name)) {
                return ParseResult.err(Progress.NO_PROGRESS, notFound.at(state), state);
            }
            return ParseResult.ok(Progress.MADE_PROGRESS, name, state.advance(end));
        };
    }

    /**
     * An uppercase name such as a tag or a module segment.
     */
    public static <E> Parser<String, E> uppercaseIdent(PositionalError<E> notFound) {
        return state -> {
            if (!Character.isUpperCase(state.peek())) {
                return ParseResult.err(Progress.NO_PROGRESS, notFound.at(state), state);
            }
            int end = chompAlphanumeric(state, 0);
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    state.source().substring(state.offset(), state.offset() + end), state.advance(end));
        };
    }

    private static <E> ParseResult<Ident, E> parseIdent(State state, PositionalError<E> notFound) {
        char first = state.peek();
        if (first == '@') {
            return privateTag(state);
        }
        if (first == '.') {
            return accessorFunction(state, notFound);
        }
        if (!Character.isLetter(first)) {
            return ParseResult.err(Progress.NO_PROGRESS, notFound.at(state), state);
        }

        List<String> segments = new ArrayList<>();
        int index = 0;
        while (true) {
            int end = chompIdentifierChars(state, index);
            segments.add(state.source().substring(state.offset() + index, state.offset() + end));
            index = end;
            if (state.peek(index) == '.' && Character.isLetter(state.peek(index + 1))) {
                index++;
            } else {
                break;
            }
        }

        State after = state.advance(index);
        String text = state.textUntil(after);
        if (segments.size() == 1 && isKeyword(text)) {
            return ParseResult.err(Progress.NO_PROGRESS, notFound.at(state), state);
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, classify(text, segments), after);
    }

    private static Ident classify(String text, List<String> segments) {
        for (String segment : segments) {
            if (segment.indexOf('_') >= 0) {
                return new Ident.Malformed(text, BadIdent.UNDERSCORE);
            }
        }

        int moduleSegments = 0;
        while (moduleSegments < segments.size() && Character.isUpperCase(segments.get(moduleSegments).charAt(0))) {
            moduleSegments++;
        }
        if (moduleSegments == segments.size()) {
            return moduleSegments == 1
                    ? new Ident.GlobalTag(text)
                    : new Ident.Malformed(text, BadIdent.QUALIFIED_TAG);
        }

        List<String> parts = segments.subList(moduleSegments, segments.size());
        for (String part : parts) {
            if (Character.isUpperCase(part.charAt(0))) {
                return new Ident.Malformed(text, BadIdent.WEIRD_DOT_QUALIFIED);
            }
        }
        if (moduleSegments > 0 && isKeyword(parts.get(0))) {
            return new Ident.Malformed(text, BadIdent.WEIRD_DOT_QUALIFIED);
        }
        String moduleName = String.join(".", segments.subList(0, moduleSegments));
        return new Ident.Access(moduleName, parts);
    }

    private static <E> ParseResult<Ident, E> privateTag(State state) {
        int end = chompIdentifierChars(state, 1);
        State after = state.advance(end);
        String text = state.textUntil(after);
        if (end == 1 || !Character.isUpperCase(state.peek(1)) || text.indexOf('_') >= 0) {
            return ParseResult.ok(Progress.MADE_PROGRESS, new Ident.Malformed(text, BadIdent.BAD_PRIVATE_TAG), after);
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, new Ident.PrivateTag(text), after);
    }

    private static <E> ParseResult<Ident, E> accessorFunction(State state, PositionalError<E> notFound) {
        if (!Character.isLowerCase(state.peek(1))) {
            return ParseResult.err(Progress.NO_PROGRESS, notFound.at(state), state);
        }
        int end = chompIdentifierChars(state, 1);
        if (state.peek(end) == '.' && Character.isLetter(state.peek(end + 1))) {
            int weirdEnd = chompIdentifierChars(state, end + 1);
            State after = state.advance(weirdEnd);
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    new Ident.Malformed(state.textUntil(after), BadIdent.WEIRD_ACCESSOR), after);
        }
        State after = state.advance(end);
        String field = state.source().substring(state.offset() + 1, after.offset());
        if (field.indexOf('_') >= 0) {
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    new Ident.Malformed(state.textUntil(after), BadIdent.UNDERSCORE), after);
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, new Ident.AccessorFunction(field), after);
    }

    private static int chompIdentifierChars(State state, int from) {
        int index = from;
        while (Character.isLetterOrDigit(state.peek(index)) || state.peek(index) == '_') {
            index++;
        }
        return index;
    }

    private static int chompAlphanumeric(State state, int from) {
        int index = from;
        while (Character.isLetterOrDigit(state.peek(index))) {
            index++;
        }
        return index;
    }
}
