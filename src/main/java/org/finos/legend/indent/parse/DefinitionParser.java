package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.BinaryOperator;
import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Def;
import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Pattern;
import org.finos.legend.indent.ast.Region;
import org.finos.legend.indent.ast.TypeAnnotation;
import org.finos.legend.indent.parse.error.EExpr;
import org.finos.legend.indent.parse.error.EPattern;
import org.finos.legend.indent.parse.error.EType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.finos.legend.indent.parse.Parsers.backtrackable;
import static org.finos.legend.indent.parse.Parsers.loc;
import static org.finos.legend.indent.parse.Parsers.specialize;

/**
 * Definitions and definition blocks.
 *
 * <p>A block is a run of definitions at one column followed by exactly one
 * final expression at that same column:
 * <pre>
 * name : Str
 * name = "x"
 *
 * { a, b } = pair
 * Str.concat name a
 * </pre>
 * An annotation directly followed (at most one blank line) by a body for the
 * same pattern is stored as a single {@link Def.AnnotatedBody}.
 */
final class DefinitionParser {

    private final ExprParser exprParser;
    private final TypeAnnotationParser typeParser;

    DefinitionParser(ExprParser exprParser, TypeAnnotationParser typeParser) {
        this.exprParser = exprParser;
        this.typeParser = typeParser;
    }

    // ==================== Switching from an expression ====================

    /**
     * Continues after the operator chain found {@code =}, {@code :} or {@code <-}
     * following {@code head args}. The definition column is the column of {@code head}.
     *
     * @param state the state after the operator and the spacing that follows it
     */
    ParseResult<Expr, EExpr> parseDefinitionFrom(
            Located<Expr> head, List<Located<Expr>> args, Located<BinaryOperator> operator,
            List<CommentOrNewline> spacesAfterOperator, State state) {
        int defStartCol = head.region().startColumn();
        int bodyIndent = defStartCol + 1;
        Located<Expr> call = ExprParser.toCall(head, args);
        Optional<Pattern> pattern = ExprToPattern.toPattern(call.value());
        int opLine = operator.region().startLine();
        int opColumn = operator.region().startColumn();

        if (pattern.isEmpty()) {
            if (operator.value() == BinaryOperator.ASSIGNMENT && !args.isEmpty()) {
                Region arguments = Region.acrossAll(args.stream().map(Located::region).toList());
                return ParseResult.err(Progress.MADE_PROGRESS, new EExpr.ElmStyleFunction(arguments, opLine, opColumn), state);
            }
            if (operator.value() != BinaryOperator.ASSIGNMENT && !args.isEmpty()) {
                return ParseResult.err(Progress.MADE_PROGRESS, new EExpr.MalformedPattern(opLine, opColumn), state);
            }
            return ParseResult.err(Progress.MADE_PROGRESS,
                    new EExpr.BadOperator(operator.value().symbol(), opLine, opColumn), state);
        }
        if (state.column() < bodyIndent) {
            return ParseResult.err(Progress.MADE_PROGRESS, new EExpr.IndentDefBody(state.line(), state.column()), state);
        }
        Located<Pattern> loPattern = Located.at(call.region(), pattern.get());

        switch (operator.value()) {
            case ASSIGNMENT -> {
                ParseResult<Located<Expr>, EExpr> body = exprParser.expr(bodyIndent).parse(state);
                if (!body.isOk()) {
                    return body.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
                }
                Located<Expr> bodyExpr = withSpacesBefore(body.value(), spacesAfterOperator);
                List<Located<Def>> defs = new ArrayList<>();
                defs.add(Located.at(Region.span(call.region(), bodyExpr.region()), new Def.Body(loPattern, bodyExpr)));
                return parseDefsEnd(defStartCol, defs, body.state()).map(Located::value);
            }
            case HAS_TYPE -> {
                ParseResult<Located<TypeAnnotation>, EExpr> type = typeAnnotation(bodyIndent, state);
                if (!type.isOk()) {
                    return type.castErr();
                }
                Located<TypeAnnotation> annotationType = Located.at(type.value().region(),
                        TypeAnnotation.SPACES.before(type.value().value(), spacesAfterOperator));
                Def def = annotationOrAlias(loPattern.value(), loPattern.region(), annotationType);
                if (def == null) {
                    return ParseResult.err(Progress.MADE_PROGRESS, new EExpr.MalformedPattern(opLine, opColumn), state);
                }
                List<Located<Def>> defs = new ArrayList<>();
                defs.add(Located.at(Region.span(call.region(), annotationType.region()), def));
                return parseDefsEnd(defStartCol, defs, type.state()).map(Located::value);
            }
            default -> {
                ParseResult<Located<Expr>, EExpr> backpassing =
                        backpassing(defStartCol, loPattern, spacesAfterOperator, state);
                return backpassing.map(Located::value);
            }
        }
    }

    // ==================== Definition blocks ====================

    /**
     * Parses further definitions at {@code defStartCol} and then the final expression.
     * Returns the final expression alone when no definition was collected.
     */
    ParseResult<Located<Expr>, EExpr> parseDefsEnd(int defStartCol, List<Located<Def>> initialDefs, State state) {
        List<Located<Def>> defs = new ArrayList<>(initialDefs);
        State current = state;
        while (true) {
            ParseResult<List<CommentOrNewline>, EExpr> spaces =
                    Blankspace.<EExpr>space0(defStartCol, EExpr.Space::new, EExpr.IndentStart::new).parse(current);
            if (!spaces.isOk()) {
                State at = spaces.state();
                return ParseResult.err(Progress.MADE_PROGRESS, new EExpr.DefMissingFinalExpr(at.line(), at.column()), at);
            }
            State afterSpaces = spaces.state();

            ParseResult<Located<Pattern>, EExpr> pattern = backtrackable(definitionHead(defStartCol)).parse(afterSpaces);
            if (pattern.isOk()) {
                ParseResult<Located<BinaryOperator>, EExpr> operator = loc(ExprParser.operator()).parse(pattern.state());
                if (operator.isOk() && operator.value().value().startsDefinition()) {
                    ParseResult<List<CommentOrNewline>, EExpr> spacesAfterOperator =
                            Blankspace.<EExpr>space0(defStartCol, EExpr.Space::new, EExpr.IndentDefBody::new)
                                    .parse(operator.state());
                    if (!spacesAfterOperator.isOk()) {
                        return spacesAfterOperator.castErr();
                    }
                    State bodyStart = spacesAfterOperator.state();
                    if (bodyStart.column() <= defStartCol) {
                        return ParseResult.err(Progress.MADE_PROGRESS,
                                new EExpr.IndentDefBody(bodyStart.line(), bodyStart.column()), bodyStart);
                    }
                    List<CommentOrNewline> afterOperator = spacesAfterOperator.value();

                    switch (operator.value().value()) {
                        case ASSIGNMENT -> {
                            ParseResult<Located<Expr>, EExpr> body = exprParser.expr(defStartCol + 1).parse(bodyStart);
                            if (!body.isOk()) {
                                return body.withProgress(Progress.MADE_PROGRESS);
                            }
                            appendBodyDefinition(defs, spaces.value(), pattern.value(),
                                    withSpacesBefore(body.value(), afterOperator));
                            current = body.state();
                            continue;
                        }
                        case HAS_TYPE -> {
                            ParseResult<Located<TypeAnnotation>, EExpr> type = typeAnnotation(defStartCol + 1, bodyStart);
                            if (!type.isOk()) {
                                return type.castErr();
                            }
                            Located<TypeAnnotation> annotationType = Located.at(type.value().region(),
                                    TypeAnnotation.SPACES.before(type.value().value(), afterOperator));
                            Def def = annotationOrAlias(pattern.value().value(), pattern.value().region(), annotationType);
                            if (def == null) {
                                Located<BinaryOperator> op = operator.value();
                                return ParseResult.err(Progress.MADE_PROGRESS,
                                        new EExpr.MalformedPattern(op.region().startLine(), op.region().startColumn()),
                                        bodyStart);
                            }
                            Region region = Region.span(pattern.value().region(), annotationType.region());
                            defs.add(Located.at(region, Def.SPACES.before(def, spaces.value())));
                            current = type.state();
                            continue;
                        }
                        default -> {
                            ParseResult<Located<Expr>, EExpr> backpassing =
                                    backpassing(defStartCol, pattern.value(), afterOperator, bodyStart);
                            if (!backpassing.isOk()) {
                                return backpassing;
                            }
                            Located<Expr> last = withSpacesBefore(backpassing.value(), spaces.value());
                            return ParseResult.ok(Progress.MADE_PROGRESS, finish(defs, last), backpassing.state());
                        }
                    }
                }
            }

            ParseResult<Located<Expr>, EExpr> finalExpr = exprParser.expr(defStartCol).parse(afterSpaces);
            if (!finalExpr.isOk()) {
                State at = finalExpr.state();
                return ParseResult.err(Progress.MADE_PROGRESS,
                        new EExpr.DefMissingFinalExpr2(finalExpr.error(), at.line(), at.column()), at);
            }
            Located<Expr> last = withSpacesBefore(finalExpr.value(), spaces.value());
            return ParseResult.ok(Progress.MADE_PROGRESS, finish(defs, last), finalExpr.state());
        }
    }

    private static Located<Expr> finish(List<Located<Def>> defs, Located<Expr> last) {
        if (defs.isEmpty()) {
            return last;
        }
        Region region = Region.span(defs.get(0).region(), last.region());
        return Located.at(region, new Expr.Defs(defs, last));
    }

    /**
     * {@code pattern <- producer} followed by the continuation at the definition column.
     */
    private ParseResult<Located<Expr>, EExpr> backpassing(
            int defStartCol, Located<Pattern> pattern, List<CommentOrNewline> spacesAfterOperator, State state) {
        ParseResult<Located<Expr>, EExpr> producer = exprParser.expr(defStartCol + 1).parse(state);
        if (!producer.isOk()) {
            return producer.withProgress(Progress.MADE_PROGRESS);
        }
        ParseResult<Located<Expr>, EExpr> continuation = parseDefsEnd(defStartCol, List.of(), producer.state());
        if (!continuation.isOk()) {
            return continuation;
        }
        Region region = Region.span(pattern.region(), continuation.value().region());
        Expr value = new Expr.Backpassing(List.of(pattern),
                withSpacesBefore(producer.value(), spacesAfterOperator), continuation.value());
        return ParseResult.ok(Progress.MADE_PROGRESS, Located.at(region, value), continuation.state());
    }

    /**
     * Adds a body, fusing it with a directly preceding annotation of the same pattern.
     */
    static void appendBodyDefinition(
            List<Located<Def>> defs, List<CommentOrNewline> spaces, Located<Pattern> pattern, Located<Expr> body) {
        Region region = Region.span(pattern.region(), body.region());
        if (CommentOrNewline.blankLines(spaces) <= 1 && !defs.isEmpty()) {
            int lastIndex = defs.size() - 1;
            Located<Def> last = defs.get(lastIndex);
            if (last.value().withoutSpaces() instanceof Def.Annotation annotation
                    && Pattern.sameBinding(annotation.pattern().value(), pattern.value())) {
                Def merged = new Def.AnnotatedBody(
                        annotation.pattern(), annotation.type(), firstComment(spaces), pattern, body);
                if (last.value() instanceof Def.SpaceBefore before) {
                    merged = Def.SPACES.before(merged, before.spaces());
                }
                defs.set(lastIndex, Located.at(Region.span(last.region(), region), merged));
                return;
            }
        }
        defs.add(Located.at(region, Def.SPACES.before(new Def.Body(pattern, body), spaces)));
    }

    private static String firstComment(List<CommentOrNewline> spaces) {
        for (CommentOrNewline space : spaces) {
            if (space instanceof CommentOrNewline.LineComment comment) {
                return comment.text();
            }
            if (space instanceof CommentOrNewline.DocComment comment) {
                return comment.text();
            }
        }
        return null;
    }

    // ==================== Single definitions ====================

    /**
     * One definition starting at {@code state}: {@code pattern = expr}, {@code pattern : type},
     * {@code Alias vars : type}, or an annotation directly followed by its body on the next line.
     * Fails without progress when the input does not start with a definition.
     */
    ParseResult<Located<Def>, EExpr> parseDef(int minIndent, State state) {
        ParseResult<Located<Pattern>, EExpr> pattern = backtrackable(definitionHead(minIndent)).parse(state);
        if (!pattern.isOk()) {
            return pattern.castErr();
        }
        ParseResult<Located<BinaryOperator>, EExpr> operator = loc(ExprParser.operator()).parse(pattern.state());
        if (!operator.isOk() || (operator.value().value() != BinaryOperator.ASSIGNMENT
                && operator.value().value() != BinaryOperator.HAS_TYPE)) {
            return ParseResult.err(Progress.NO_PROGRESS, new EExpr.Equals(state.line(), state.column()), state);
        }

        Located<Pattern> head = pattern.value();
        if (operator.value().value() == BinaryOperator.ASSIGNMENT) {
            ParseResult<Located<Expr>, EExpr> body = Blankspace.space0Before(
                    exprParser.expr(minIndent + 1), minIndent, EExpr.Space::new, EExpr.IndentDefBody::new, Expr.SPACES)
                    .parse(operator.state());
            if (!body.isOk()) {
                return body.<Located<Def>>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            Region region = Region.span(head.region(), body.value().region());
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    Located.at(region, new Def.Body(head, body.value())), body.state());
        }

        ParseResult<List<CommentOrNewline>, EExpr> spaces =
                Blankspace.<EExpr>space0(minIndent, EExpr.Space::new, EExpr.IndentDefBody::new).parse(operator.state());
        if (!spaces.isOk()) {
            return spaces.<Located<Def>>castErr().withProgress(Progress.MADE_PROGRESS);
        }
        ParseResult<Located<TypeAnnotation>, EExpr> type = typeAnnotation(minIndent + 1, spaces.state());
        if (!type.isOk()) {
            return type.castErr();
        }
        Located<TypeAnnotation> annotationType = Located.at(type.value().region(),
                TypeAnnotation.SPACES.before(type.value().value(), spaces.value()));
        Def annotation = annotationOrAlias(head.value(), head.region(), annotationType);
        if (annotation == null) {
            Located<BinaryOperator> op = operator.value();
            return ParseResult.err(Progress.MADE_PROGRESS,
                    new EExpr.MalformedPattern(op.region().startLine(), op.region().startColumn()), type.state());
        }
        Region annotationRegion = Region.span(head.region(), annotationType.region());

        ParseResult<Located<Def>, EExpr> annotatedBody =
                annotatedBody(minIndent, head, annotationType, annotationRegion, type.state());
        if (annotatedBody.isOk() || annotatedBody.progress().made()) {
            return annotatedBody;
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, Located.at(annotationRegion, annotation), type.state());
    }

    /**
     * The body line right after an annotation: same column, at most one blank line, same pattern.
     */
    private ParseResult<Located<Def>, EExpr> annotatedBody(int minIndent, Located<Pattern> annotationPattern,
            Located<TypeAnnotation> annotationType, Region annotationRegion, State state) {
        ParseResult<List<CommentOrNewline>, EExpr> spaces =
                Blankspace.<EExpr>space0(minIndent, EExpr.Space::new, EExpr.IndentStart::new).parse(state);
        if (!spaces.isOk() || CommentOrNewline.blankLines(spaces.value()) > 1
                || spaces.state().column() != minIndent || spaces.value().isEmpty()) {
            return ParseResult.err(Progress.NO_PROGRESS, new EExpr.Equals(state.line(), state.column()), state);
        }
        ParseResult<Located<Pattern>, EExpr> bodyPattern =
                backtrackable(definitionHead(minIndent)).parse(spaces.state());
        if (!bodyPattern.isOk() || !Pattern.sameBinding(annotationPattern.value(), bodyPattern.value().value())) {
            return ParseResult.err(Progress.NO_PROGRESS, new EExpr.Equals(state.line(), state.column()), state);
        }
        ParseResult<Located<BinaryOperator>, EExpr> operator = loc(ExprParser.operator()).parse(bodyPattern.state());
        if (!operator.isOk() || operator.value().value() != BinaryOperator.ASSIGNMENT) {
            return ParseResult.err(Progress.NO_PROGRESS, new EExpr.Equals(state.line(), state.column()), state);
        }
        ParseResult<Located<Expr>, EExpr> body = Blankspace.space0Before(
                exprParser.expr(minIndent + 1), minIndent, EExpr.Space::new, EExpr.IndentDefBody::new, Expr.SPACES)
                .parse(operator.state());
        if (!body.isOk()) {
            return body.<Located<Def>>castErr().withProgress(Progress.MADE_PROGRESS);
        }
        Def def = new Def.AnnotatedBody(annotationPattern, annotationType, firstComment(spaces.value()),
                bodyPattern.value(), body.value());
        return ParseResult.ok(Progress.MADE_PROGRESS,
                Located.at(Region.span(annotationRegion, body.value().region()), def), body.state());
    }

    // ==================== Helpers ====================

    /**
     * A pattern and the spacing after it, as found on the left of a definition operator.
     */
    private Parser<Located<Pattern>, EExpr> definitionHead(int minIndent) {
        return specialize(Blankspace.space0After(exprParser.patterns().locPattern(minIndent), minIndent,
                EPattern.Space::new, EPattern.IndentEnd::new, Pattern.SPACES), EExpr.InPattern::new);
    }

    private ParseResult<Located<TypeAnnotation>, EExpr> typeAnnotation(int minIndent, State state) {
        Parser<Located<TypeAnnotation>, EType> type = s -> typeParser.parse(minIndent, s);
        Parser<Located<TypeAnnotation>, EExpr> inType = specialize(type, EExpr.InType::new);
        return inType.parse(state).withProgress(Progress.MADE_PROGRESS);
    }

    /**
     * The definition an annotation stands for: an alias when the pattern is a tag
     * (optionally applied to type variables), an annotation for identifiers and
     * record destructures. Returns null for any other pattern.
     */
    static Def annotationOrAlias(Pattern pattern, Region patternRegion, Located<TypeAnnotation> type) {
        if (pattern instanceof Pattern.SpaceBefore before) {
            Def inner = annotationOrAlias(before.pattern(), patternRegion, type);
            return inner == null ? null : Def.SPACES.before(inner, before.spaces());
        }
        if (pattern instanceof Pattern.SpaceAfter after) {
            Def inner = annotationOrAlias(after.pattern(), patternRegion, type);
            return inner == null ? null : Def.SPACES.after(inner, after.spaces());
        }
        if (pattern instanceof Pattern.GlobalTag tag) {
            return new Def.Alias(Located.at(patternRegion, tag.name()), List.of(), type);
        }
        if (pattern instanceof Pattern.Apply apply && apply.tag().value() instanceof Pattern.GlobalTag tag) {
            for (Located<Pattern> variable : apply.args()) {
                if (!(variable.value().withoutSpaces() instanceof Pattern.Identifier)) {
                    return null;
                }
            }
            return new Def.Alias(Located.at(apply.tag().region(), tag.name()), apply.args(), type);
        }
        if (pattern instanceof Pattern.Identifier || pattern instanceof Pattern.RecordDestructure) {
            return new Def.Annotation(Located.at(patternRegion, pattern), type);
        }
        return null;
    }

    private static Located<Expr> withSpacesBefore(Located<Expr> expr, List<CommentOrNewline> spaces) {
        return Located.at(expr.region(), Expr.SPACES.before(expr.value(), spaces));
    }
}
