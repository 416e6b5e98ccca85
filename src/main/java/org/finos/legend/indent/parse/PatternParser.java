package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Ident;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.NumLiteral;
import org.finos.legend.indent.ast.Pattern;
import org.finos.legend.indent.ast.Region;
import org.finos.legend.indent.parse.error.EPattern;
import org.finos.legend.indent.parse.error.PInParens;
import org.finos.legend.indent.parse.error.PRecord;

import java.util.ArrayList;
import java.util.List;

import static org.finos.legend.indent.parse.Parsers.loc;
import static org.finos.legend.indent.parse.Parsers.map;
import static org.finos.legend.indent.parse.Parsers.oneOf;
import static org.finos.legend.indent.parse.Parsers.specialize;

/**
 * Pattern grammar used by lambda parameters, {@code when} branches and definition heads.
 *
 * <pre>
 * pattern  := Tag arg* | param
 * param    := ident | _ | _name | { fields } | ( pattern ) | number | string | Tag
 * </pre>
 */
public final class PatternParser {

    private final ExprParser exprParser;

    PatternParser(ExprParser exprParser) {
        this.exprParser = exprParser;
    }

    /**
     * A full pattern; tags may take arguments.
     */
    public Parser<Located<Pattern>, EPattern> locPattern(int minIndent) {
        return patternHelp(minIndent, true);
    }

    /**
     * A pattern that cannot take arguments unless parenthesized, as used for
     * lambda parameters and tag arguments.
     */
    public Parser<Located<Pattern>, EPattern> closureParam(int minIndent) {
        return patternHelp(minIndent, false);
    }

    private Parser<Located<Pattern>, EPattern> patternHelp(int minIndent, boolean tagsTakeArguments) {
        return oneOf(
                loc(specialize(parenthesized(minIndent), EPattern.InParens::new)),
                loc(numberPattern()),
                loc(stringPattern()),
                loc(PatternParser::underscore),
                loc(specialize(recordDestructure(minIndent), EPattern.InRecord::new)),
                state -> identPattern(minIndent, tagsTakeArguments, state));
    }

    // ==================== Literals ====================

    private static Parser<Pattern, EPattern> numberPattern() {
        return map(specialize(NumberLiterals.numberLiteral(), EPattern.NumLiteral::new), PatternParser::fromLiteral);
    }

    private static Pattern fromLiteral(NumLiteral literal) {
        if (literal instanceof NumLiteral.NonBase10Int nonBase10) {
            return new Pattern.NonBase10Literal(nonBase10.text(), nonBase10.base(), nonBase10.negative());
        }
        if (literal instanceof NumLiteral.Float) {
            return new Pattern.FloatLiteral(literal.text());
        }
        return new Pattern.NumLiteral(literal.text());
    }

    private static Parser<Pattern, EPattern> stringPattern() {
        return map(specialize(StringLiterals.stringLiteral(), EPattern.StrLiteral::new), Pattern.StrLiteral::new);
    }

    private static ParseResult<Pattern, EPattern> underscore(State state) {
        if (state.peek() != '_' || state.isEmpty()) {
            return ParseResult.err(Progress.NO_PROGRESS, new EPattern.Start(state.line(), state.column()), state);
        }
        int end = 1;
        while (Character.isLetterOrDigit(state.peek(end))) {
            end++;
        }
        State after = state.advance(end);
        return ParseResult.ok(Progress.MADE_PROGRESS, new Pattern.Underscore(state.textUntil(after).substring(1)), after);
    }

    // ==================== Compound patterns ====================

    private Parser<Pattern, PInParens> parenthesized(int minIndent) {
        return state -> {
            if (state.isEmpty() || state.peek() != '(') {
                return ParseResult.err(Progress.NO_PROGRESS, new PInParens.Open(state.line(), state.column()), state);
            }
            ParseResult<Located<Pattern>, PInParens> inner = Blankspace.<Pattern, PInParens>space0Before(
                    specialize(locPattern(minIndent), PInParens.Pattern::new),
                    minIndent, PInParens.Space::new, PInParens.IndentOpen::new, Pattern.SPACES).parse(state.advance(1));
            if (!inner.isOk()) {
                return inner.<Pattern>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            ParseResult<List<CommentOrNewline>, PInParens> after =
                    Blankspace.<PInParens>space0(0, PInParens.Space::new, PInParens.IndentEnd::new).parse(inner.state());
            if (!after.isOk()) {
                return after.castErr();
            }
            State end = after.state();
            if (end.peek() != ')') {
                return ParseResult.err(Progress.MADE_PROGRESS, new PInParens.End(end.line(), end.column()), end);
            }
            Pattern pattern = Pattern.SPACES.after(inner.value().value(), after.value());
            return ParseResult.ok(Progress.MADE_PROGRESS, pattern, end.advance(1));
        };
    }

    private Parser<Pattern, PRecord> recordDestructure(int minIndent) {
        return state -> {
            if (state.isEmpty() || state.peek() != '{') {
                return ParseResult.err(Progress.NO_PROGRESS, new PRecord.Open(state.line(), state.column()), state);
            }
            ParseResult<Delimited<Pattern>, PRecord> fields = Blankspace.collectionBody(
                    '}', loc(recordField(minIndent)), minIndent,
                    PRecord.End::new, PRecord.Space::new, PRecord.IndentEnd::new, Pattern.SPACES)
                    .parse(state.advance(1));
            if (!fields.isOk()) {
                return fields.<Pattern>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    new Pattern.RecordDestructure(fields.value().items()), fields.state());
        };
    }

    /**
     * {@code x}, {@code x: pattern} or {@code x ? default}.
     */
    private Parser<Pattern, PRecord> recordField(int minIndent) {
        return state -> {
            ParseResult<String, PRecord> label = Identifiers.<PRecord>lowercaseIdent(PRecord.Field::new).parse(state);
            if (!label.isOk()) {
                return label.castErr();
            }
            ParseResult<List<CommentOrNewline>, PRecord> spaces =
                    Blankspace.<PRecord>space0(minIndent, PRecord.Space::new, PRecord.IndentColon::new).parse(label.state());
            if (!spaces.isOk()) {
                return spaces.castErr();
            }
            State afterSpaces = spaces.state();
            if (afterSpaces.peek() == ':') {
                ParseResult<Located<Pattern>, PRecord> value = Blankspace.<Pattern, PRecord>space0Before(
                        specialize(locPattern(minIndent), PRecord.Pattern::new),
                        minIndent, PRecord.Space::new, PRecord.IndentColon::new, Pattern.SPACES)
                        .parse(afterSpaces.advance(1));
                return value.withProgress(Progress.MADE_PROGRESS)
                        .map(pattern -> new Pattern.RequiredField(label.value(), pattern));
            }
            if (afterSpaces.peek() == '?') {
                ParseResult<Located<Expr>, PRecord> value = Blankspace.<Expr, PRecord>space0Before(
                        specialize(exprParser.expr(minIndent), PRecord.Expr::new),
                        minIndent, PRecord.Space::new, PRecord.IndentColon::new, Expr.SPACES)
                        .parse(afterSpaces.advance(1));
                return value.withProgress(Progress.MADE_PROGRESS)
                        .map(defaultValue -> new Pattern.OptionalField(label.value(), defaultValue));
            }
            return ParseResult.ok(Progress.MADE_PROGRESS, new Pattern.Identifier(label.value()), label.state());
        };
    }

    // ==================== Identifiers and tags ====================

    private ParseResult<Located<Pattern>, EPattern> identPattern(int minIndent, boolean tagsTakeArguments, State state) {
        ParseResult<Located<Ident>, EPattern> parsed = loc(Identifiers.<EPattern>ident(EPattern.Start::new)).parse(state);
        if (!parsed.isOk()) {
            return parsed.castErr();
        }
        Region region = parsed.value().region();
        Ident ident = parsed.value().value();

        if (ident instanceof Ident.GlobalTag || ident instanceof Ident.PrivateTag) {
            Pattern tagPattern = ident instanceof Ident.GlobalTag global
                    ? new Pattern.GlobalTag(global.name())
                    : new Pattern.PrivateTag(((Ident.PrivateTag) ident).name());
            Located<Pattern> tag = Located.at(region, tagPattern);
            if (!tagsTakeArguments) {
                return ParseResult.ok(Progress.MADE_PROGRESS, tag, parsed.state());
            }
            return tagArguments(Math.max(minIndent, region.startColumn() + 1), tag, parsed.state());
        }

        Pattern pattern;
        if (ident instanceof Ident.Access access) {
            if (access.parts().size() > 1) {
                pattern = new Pattern.Malformed(state.textUntil(parsed.state()));
            } else if (access.moduleName().isEmpty()) {
                pattern = new Pattern.Identifier(access.parts().get(0));
            } else {
                pattern = new Pattern.QualifiedIdentifier(access.moduleName(), access.parts().get(0));
            }
        } else if (ident instanceof Ident.Malformed malformed) {
            pattern = new Pattern.MalformedIdent(malformed.text(), malformed.problem());
        } else {
            pattern = new Pattern.Malformed(state.textUntil(parsed.state()));
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, Located.at(region, pattern), parsed.state());
    }

    /**
     * Arguments of a tag pattern; each one must sit past the tag's column.
     */
    private ParseResult<Located<Pattern>, EPattern> tagArguments(int argIndent, Located<Pattern> tag, State state) {
        Parser<Located<Pattern>, EPattern> argument = Parsers.backtrackable(Blankspace.space0Before(
                Parsers.skipFirst(Blankspace.checkIndent(argIndent, EPattern.IndentStart::new), closureParam(argIndent)),
                argIndent, EPattern.Space::new, EPattern.IndentStart::new, Pattern.SPACES));

        List<Located<Pattern>> args = new ArrayList<>();
        State current = state;
        while (true) {
            ParseResult<Located<Pattern>, EPattern> next = argument.parse(current);
            if (!next.isOk()) {
                break;
            }
            args.add(next.value());
            current = next.state();
        }
        if (args.isEmpty()) {
            return ParseResult.ok(Progress.MADE_PROGRESS, tag, state);
        }
        Region region = Region.span(tag.region(), args.get(args.size() - 1).region());
        return ParseResult.ok(Progress.MADE_PROGRESS, Located.at(region, new Pattern.Apply(tag, args)), current);
    }
}
