package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.AssignedField;
import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Region;
import org.finos.legend.indent.ast.Spaceable;
import org.finos.legend.indent.ast.TypeAnnotation;
import org.finos.legend.indent.parse.error.EType;

import java.util.ArrayList;
import java.util.List;

import static org.finos.legend.indent.parse.Parsers.backtrackable;
import static org.finos.legend.indent.parse.Parsers.loc;
import static org.finos.legend.indent.parse.Parsers.oneOf;

/**
 * Default type annotation grammar.
 *
 * <pre>
 * type     := term (, term)* -&gt; applied | applied
 * applied  := Upper(.Upper)* term* | term
 * term     := ( type ) | { fields }ext? | [ tags ]ext? | * | _ | var | Upper(.Upper)*
 * field    := label : type | label ? type
 * tag      := Upper term* | @Upper term*
 * </pre>
 */
public final class TypeAnnotations implements TypeAnnotationParser {

    private static final Spaceable<TypeAnnotation.Tag> UNSPACED_TAG =
            Spaceable.of((tag, spaces) -> tag, (tag, spaces) -> tag);

    @Override
    public ParseResult<Located<TypeAnnotation>, EType> parse(int minIndent, State state) {
        return expression(minIndent, state);
    }

    private ParseResult<Located<TypeAnnotation>, EType> expression(int minIndent, State state) {
        ParseResult<Located<TypeAnnotation>, EType> first = applied(minIndent, state);
        if (!first.isOk()) {
            return first;
        }

        List<Located<TypeAnnotation>> arguments = new ArrayList<>();
        arguments.add(first.value());
        State current = first.state();
        while (true) {
            ParseResult<List<CommentOrNewline>, EType> comma = backtrackable(
                    Parsers.skipSecond(space0(minIndent), Parsers.word1(',', EType.Arrow::new))).parse(current);
            if (!comma.isOk()) {
                break;
            }
            ParseResult<Located<TypeAnnotation>, EType> next = Blankspace.space0Before(
                    appliedParser(minIndent),
                    minIndent, EType.Space::new, EType.IndentStart::new, TypeAnnotation.SPACES).parse(comma.state());
            if (!next.isOk()) {
                return next.withProgress(Progress.MADE_PROGRESS);
            }
            attachSpacesAfterLast(arguments, comma.value());
            arguments.add(next.value());
            current = next.state();
        }

        ParseResult<List<CommentOrNewline>, EType> arrow = backtrackable(
                Parsers.skipSecond(space0(minIndent), Parsers.word("->", EType.Arrow::new))).parse(current);
        if (!arrow.isOk()) {
            // no arrow: only the first term belongs to this type
            return first;
        }
        attachSpacesAfterLast(arguments, arrow.value());
        ParseResult<Located<TypeAnnotation>, EType> result = Blankspace.space0Before(
                appliedParser(minIndent),
                minIndent, EType.Space::new, EType.IndentStart::new, TypeAnnotation.SPACES).parse(arrow.state());
        if (!result.isOk()) {
            return result.withProgress(Progress.MADE_PROGRESS);
        }
        Region region = Region.between(state.position(), result.state().position());
        return ParseResult.ok(Progress.MADE_PROGRESS,
                Located.at(region, new TypeAnnotation.Function(arguments, result.value())), result.state());
    }

    private Parser<Located<TypeAnnotation>, EType> expressionParser(int minIndent) {
        return state -> expression(minIndent, state);
    }

    private static void attachSpacesAfterLast(List<Located<TypeAnnotation>> arguments, List<CommentOrNewline> spaces) {
        int last = arguments.size() - 1;
        Located<TypeAnnotation> previous = arguments.get(last);
        arguments.set(last, Located.at(previous.region(), TypeAnnotation.SPACES.after(previous.value(), spaces)));
    }

    // ==================== Terms ====================

    /**
     * A term, where a named type may take arguments.
     */
    private ParseResult<Located<TypeAnnotation>, EType> applied(int minIndent, State state) {
        return term(minIndent, true).parse(state);
    }

    private Parser<Located<TypeAnnotation>, EType> appliedParser(int minIndent) {
        return state -> applied(minIndent, state);
    }

    private Parser<Located<TypeAnnotation>, EType> term(int minIndent, boolean withArguments) {
        return oneOf(
                state -> parenthesized(minIndent, state),
                state -> record(minIndent, state),
                state -> tagUnion(minIndent, state),
                loc(TypeAnnotations::wildcardOrInferred),
                state -> named(minIndent, withArguments, state),
                loc(Parsers.map(Identifiers.lowercaseIdent(EType.Start::new), TypeAnnotation.BoundVariable::new)));
    }

    private static ParseResult<TypeAnnotation, EType> wildcardOrInferred(State state) {
        if (state.peek() == '*') {
            return ParseResult.ok(Progress.MADE_PROGRESS, new TypeAnnotation.Wildcard(), state.advance(1));
        }
        if (state.peek() == '_' && !Character.isLetterOrDigit(state.peek(1))) {
            return ParseResult.ok(Progress.MADE_PROGRESS, new TypeAnnotation.Inferred(), state.advance(1));
        }
        return ParseResult.err(Progress.NO_PROGRESS, new EType.Start(state.line(), state.column()), state);
    }

    private ParseResult<Located<TypeAnnotation>, EType> parenthesized(int minIndent, State state) {
        if (state.peek() != '(') {
            return ParseResult.err(Progress.NO_PROGRESS, new EType.Start(state.line(), state.column()), state);
        }
        ParseResult<Located<TypeAnnotation>, EType> inner = Blankspace.space0Before(
                expressionParser(minIndent),
                minIndent, EType.Space::new, EType.IndentStart::new, TypeAnnotation.SPACES).parse(state.advance(1));
        if (!inner.isOk()) {
            return inner.withProgress(Progress.MADE_PROGRESS);
        }
        ParseResult<List<CommentOrNewline>, EType> trailing =
                Blankspace.<EType>space0(0, EType.Space::new, EType.IndentEnd::new).parse(inner.state());
        if (!trailing.isOk()) {
            return trailing.castErr();
        }
        State end = trailing.state();
        if (end.peek() != ')') {
            return ParseResult.err(Progress.MADE_PROGRESS, new EType.InParensEnd(end.line(), end.column()), end);
        }
        State after = end.advance(1);
        TypeAnnotation value = TypeAnnotation.SPACES.after(inner.value().value(), trailing.value());
        return ParseResult.ok(Progress.MADE_PROGRESS,
                Located.at(Region.between(state.position(), after.position()), value), after);
    }

    /**
     * {@code Str}, {@code Dict.Dict k v}. Arguments must sit at or past {@code minIndent}.
     */
    private ParseResult<Located<TypeAnnotation>, EType> named(int minIndent, boolean withArguments, State state) {
        ParseResult<String, EType> firstSegment = Identifiers.<EType>uppercaseIdent(EType.Start::new).parse(state);
        if (!firstSegment.isOk()) {
            return firstSegment.castErr();
        }
        List<String> segments = new ArrayList<>();
        segments.add(firstSegment.value());
        State current = firstSegment.state();
        while (current.peek() == '.' && Character.isUpperCase(current.peek(1))) {
            ParseResult<String, EType> segment = Identifiers.<EType>uppercaseIdent(EType.Start::new).parse(current.advance(1));
            segments.add(segment.value());
            current = segment.state();
        }
        String name = segments.get(segments.size() - 1);
        String moduleName = String.join(".", segments.subList(0, segments.size() - 1));

        List<Located<TypeAnnotation>> arguments = List.of();
        if (withArguments) {
            ParseResult<List<Located<TypeAnnotation>>, EType> parsed = arguments(minIndent).parse(current);
            if (!parsed.isOk()) {
                return parsed.castErr();
            }
            arguments = parsed.value();
            current = parsed.state();
        }
        Region region = Region.between(state.position(), current.position());
        return ParseResult.ok(Progress.MADE_PROGRESS,
                Located.at(region, new TypeAnnotation.Apply(moduleName, name, arguments)), current);
    }

    private Parser<List<Located<TypeAnnotation>>, EType> arguments(int minIndent) {
        return Parsers.zeroOrMore(backtrackable(Blankspace.space0Before(
                Parsers.skipFirst(Blankspace.checkIndent(minIndent, EType.IndentStart::new), term(minIndent, false)),
                minIndent, EType.Space::new, EType.IndentStart::new, TypeAnnotation.SPACES)));
    }

    // ==================== Records and tag unions ====================

    private ParseResult<Located<TypeAnnotation>, EType> record(int minIndent, State state) {
        if (state.peek() != '{') {
            return ParseResult.err(Progress.NO_PROGRESS, new EType.Start(state.line(), state.column()), state);
        }
        ParseResult<Delimited<AssignedField<TypeAnnotation>>, EType> fields = Blankspace.collectionBody(
                '}', loc(recordField(minIndent)), minIndent,
                EType.RecordEnd::new, EType.Space::new, EType.IndentEnd::new, AssignedField.spaces())
                .parse(state.advance(1));
        if (!fields.isOk()) {
            return fields.<Located<TypeAnnotation>>castErr().withProgress(Progress.MADE_PROGRESS);
        }
        ParseResult<Located<TypeAnnotation>, EType> extension = extension(minIndent, fields.state());
        if (!extension.isOk()) {
            return extension;
        }
        TypeAnnotation value = new TypeAnnotation.RecordType(fields.value().items(), extension.value());
        return ParseResult.ok(Progress.MADE_PROGRESS,
                Located.at(Region.between(state.position(), extension.state().position()), value), extension.state());
    }

    private Parser<AssignedField<TypeAnnotation>, EType> recordField(int minIndent) {
        return state -> {
            ParseResult<Located<String>, EType> label = loc(Identifiers.<EType>lowercaseIdent(EType.RecordField::new)).parse(state);
            if (!label.isOk()) {
                return label.castErr();
            }
            ParseResult<List<CommentOrNewline>, EType> spaces = space0(minIndent).parse(label.state());
            if (!spaces.isOk()) {
                return spaces.castErr();
            }
            char separator = spaces.state().peek();
            if (separator != ':' && separator != '?') {
                State at = spaces.state();
                return ParseResult.err(Progress.MADE_PROGRESS, new EType.RecordColon(at.line(), at.column()), at);
            }
            ParseResult<Located<TypeAnnotation>, EType> type = Blankspace.space0Before(
                    expressionParser(minIndent),
                    minIndent, EType.Space::new, EType.IndentStart::new, TypeAnnotation.SPACES)
                    .parse(spaces.state().advance(1));
            if (!type.isOk()) {
                return type.<AssignedField<TypeAnnotation>>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            AssignedField<TypeAnnotation> field = separator == ':'
                    ? new AssignedField.RequiredValue<>(label.value(), spaces.value(), type.value())
                    : new AssignedField.OptionalValue<>(label.value(), spaces.value(), type.value());
            return ParseResult.ok(Progress.MADE_PROGRESS, field, type.state());
        };
    }

    private ParseResult<Located<TypeAnnotation>, EType> tagUnion(int minIndent, State state) {
        if (state.peek() != '[') {
            return ParseResult.err(Progress.NO_PROGRESS, new EType.Start(state.line(), state.column()), state);
        }
        ParseResult<Delimited<TypeAnnotation.Tag>, EType> tags = Blankspace.collectionBody(
                ']', loc(tag(minIndent)), minIndent,
                EType.TagUnionEnd::new, EType.Space::new, EType.IndentEnd::new,
                UNSPACED_TAG)
                .parse(state.advance(1));
        if (!tags.isOk()) {
            return tags.<Located<TypeAnnotation>>castErr().withProgress(Progress.MADE_PROGRESS);
        }
        ParseResult<Located<TypeAnnotation>, EType> extension = extension(minIndent, tags.state());
        if (!extension.isOk()) {
            return extension;
        }
        TypeAnnotation value = new TypeAnnotation.TagUnion(tags.value().items(), extension.value());
        return ParseResult.ok(Progress.MADE_PROGRESS,
                Located.at(Region.between(state.position(), extension.state().position()), value), extension.state());
    }

    private Parser<TypeAnnotation.Tag, EType> tag(int minIndent) {
        return state -> {
            boolean privateTag = state.peek() == '@';
            State nameStart = privateTag ? state.advance(1) : state;
            ParseResult<String, EType> name = Identifiers.<EType>uppercaseIdent(EType.TagUnionEnd::new).parse(nameStart);
            if (!name.isOk()) {
                return privateTag ? name.<TypeAnnotation.Tag>castErr().withProgress(Progress.MADE_PROGRESS) : name.castErr();
            }
            ParseResult<List<Located<TypeAnnotation>>, EType> arguments = arguments(minIndent).parse(name.state());
            if (!arguments.isOk()) {
                return arguments.castErr();
            }
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    new TypeAnnotation.Tag(name.value(), privateTag, arguments.value()), arguments.state());
        };
    }

    /**
     * Row variable glued to a closing bracket, as in {@code { a : Str }r} or {@code [ Foo ]*}.
     */
    private ParseResult<Located<TypeAnnotation>, EType> extension(int minIndent, State state) {
        char next = state.peek();
        if (next != '*' && next != '_' && !Character.isLowerCase(next)) {
            return ParseResult.ok(Progress.NO_PROGRESS, null, state);
        }
        return term(minIndent, false).parse(state);
    }

    private static Parser<List<CommentOrNewline>, EType> space0(int minIndent) {
        return Blankspace.space0(minIndent, EType.Space::new, EType.IndentStart::new);
    }
}
