package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.AssignedField;
import org.finos.legend.indent.ast.BinaryOperator;
import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Ident;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.NumLiteral;
import org.finos.legend.indent.ast.Pattern;
import org.finos.legend.indent.ast.Region;
import org.finos.legend.indent.ast.Spaceable;
import org.finos.legend.indent.ast.UnaryOperator;
import org.finos.legend.indent.parse.error.EExpr;
import org.finos.legend.indent.parse.error.EInParens;
import org.finos.legend.indent.parse.error.ELambda;
import org.finos.legend.indent.parse.error.EList;
import org.finos.legend.indent.parse.error.ENumber;
import org.finos.legend.indent.parse.error.ERecord;

import java.util.ArrayList;
import java.util.List;

import static org.finos.legend.indent.parse.Parsers.loc;
import static org.finos.legend.indent.parse.Parsers.map;
import static org.finos.legend.indent.parse.Parsers.oneOf;
import static org.finos.legend.indent.parse.Parsers.specialize;

/**
 * Atomic and bracketed expressions: the units the operator chain is built from.
 *
 * <p>A term is one of
 * <ul>
 *   <li>a parenthesized expression, optionally followed by {@code .field} accesses</li>
 *   <li>a string or number literal</li>
 *   <li>a lambda {@code \a, b -> body}</li>
 *   <li>a record {@code { a: 1, b }} or record update {@code { rec & a: 1 }}</li>
 *   <li>a list {@code [ 1, 2, ]}</li>
 *   <li>an identifier, tag, or accessor function</li>
 * </ul>
 *
 * <p>When a parenthesized or record term leads an expression and is followed by
 * {@code =} or {@code :}, it is the left side of a definition and parsing
 * switches to the definition engine.
 */
public final class TermParser {

    private final ExprParser exprParser;

    TermParser(ExprParser exprParser) {
        this.exprParser = exprParser;
    }

    /**
     * A term in argument position. A leading {@code -} is never part of it.
     */
    public Parser<Located<Expr>, EExpr> term(int minIndent) {
        return termHelp(minIndent, false, false);
    }

    /**
     * A term directly after a unary operator, where a number may carry its own sign.
     */
    public Parser<Located<Expr>, EExpr> operand(int minIndent) {
        return termHelp(minIndent, false, true);
    }

    /**
     * The first term of an operator chain: allows {@code -x}, {@code -1}, {@code !x},
     * and a definition directly after a parenthesized or record term.
     */
    public Parser<Located<Expr>, EExpr> leadingTerm(int minIndent) {
        return possiblyNegativeOrNegatedTerm(minIndent, true);
    }

    /**
     * The term on the right of a binary operator.
     */
    public Parser<Located<Expr>, EExpr> operatorOperand(int minIndent) {
        return possiblyNegativeOrNegatedTerm(minIndent, false);
    }

    private Parser<Located<Expr>, EExpr> possiblyNegativeOrNegatedTerm(int minIndent, boolean leading) {
        return oneOf(
                state -> unaryNegate(minIndent, state),
                loc(map(specialize(NumberLiterals.numberLiteral(), EExpr.InNumber::new), TermParser::numberExpr)),
                state -> unaryNot(minIndent, state),
                termHelp(minIndent, leading, false));
    }

    private Parser<Located<Expr>, EExpr> termHelp(int minIndent, boolean leading, boolean signedNumbers) {
        Parser<NumLiteral, ENumber> number = signedNumbers
                ? NumberLiterals.numberLiteral()
                : NumberLiterals.positiveNumberLiteral();
        return oneOf(
                state -> parensEtc(minIndent, leading, state),
                loc(map(specialize(StringLiterals.stringLiteral(), EExpr.InString::new), Expr.Str::new)),
                loc(map(specialize(number, EExpr.InNumber::new), TermParser::numberExpr)),
                loc(specialize(closure(minIndent), EExpr.InLambda::new)),
                state -> recordLiteral(minIndent, leading, state),
                loc(specialize(listLiteral(minIndent), EExpr.InList::new)),
                loc(map(Identifiers.ident(EExpr.Start::new), TermParser::identToExpr)));
    }

    // ==================== Literals and identifiers ====================

    static Expr numberExpr(NumLiteral literal) {
        if (literal instanceof NumLiteral.NonBase10Int nonBase10) {
            return new Expr.NonBase10Int(nonBase10.text(), nonBase10.base(), nonBase10.negative());
        }
        if (literal instanceof NumLiteral.Float) {
            return new Expr.Float(literal.text());
        }
        return new Expr.Num(literal.text());
    }

    static Expr identToExpr(Ident ident) {
        if (ident instanceof Ident.GlobalTag tag) {
            return new Expr.GlobalTag(tag.name());
        }
        if (ident instanceof Ident.PrivateTag tag) {
            return new Expr.PrivateTag(tag.name());
        }
        if (ident instanceof Ident.AccessorFunction accessor) {
            return new Expr.AccessorFunction(accessor.field());
        }
        if (ident instanceof Ident.Malformed malformed) {
            return new Expr.MalformedIdent(malformed.text(), malformed.problem());
        }
        Ident.Access access = (Ident.Access) ident;
        Expr expr = new Expr.Var(access.moduleName(), access.parts().get(0));
        for (String field : access.parts().subList(1, access.parts().size())) {
            expr = new Expr.Access(expr, field);
        }
        return expr;
    }

    // ==================== Unary operators ====================

    /**
     * {@code -x}: a minus directly followed by something other than spacing or a digit.
     * Digits are left to the literal parser so {@code -9223372036854775808} stays one literal.
     */
    private ParseResult<Located<Expr>, EExpr> unaryNegate(int minIndent, State state) {
        char next = state.peek(1);
        boolean followedBySpaceOrDigit = next == ' ' || next == '\n' || next == '\r' || next == '#'
                || Character.isDigit(next) || state.remaining() < 2;
        if (state.peek() != '-' || followedBySpaceOrDigit || next == '>') {
            return ParseResult.err(Progress.NO_PROGRESS, new EExpr.UnaryNegate(state.line(), state.column()), state);
        }
        Region operatorRegion = Region.between(state.position(), state.advance(1).position());
        ParseResult<Located<Expr>, EExpr> operand = operand(minIndent).parse(state.advance(1));
        if (!operand.isOk()) {
            return operand.withProgress(Progress.MADE_PROGRESS);
        }
        Located<Expr> negated = ExprParser.numericNegateExpression(
                state, Located.at(operatorRegion, BinaryOperator.MINUS), operand.value(), List.of());
        return ParseResult.ok(Progress.MADE_PROGRESS, negated, operand.state());
    }

    private ParseResult<Located<Expr>, EExpr> unaryNot(int minIndent, State state) {
        if (state.isEmpty() || state.peek() != '!') {
            return ParseResult.err(Progress.NO_PROGRESS, new EExpr.UnaryNot(state.line(), state.column()), state);
        }
        State afterBang = state.advance(1);
        ParseResult<Located<Expr>, EExpr> operand = operand(minIndent).parse(afterBang);
        if (!operand.isOk()) {
            return operand.withProgress(Progress.MADE_PROGRESS);
        }
        Located<UnaryOperator> operator = Located.at(
                Region.between(state.position(), afterBang.position()), UnaryOperator.NOT);
        Region region = Region.span(operator.region(), operand.value().region());
        return ParseResult.ok(Progress.MADE_PROGRESS,
                Located.at(region, new Expr.UnaryOp(operand.value(), operator)), operand.state());
    }

    // ==================== Parentheses ====================

    private ParseResult<Located<Expr>, EExpr> parensEtc(int minIndent, boolean leading, State state) {
        ParseResult<Located<Expr>, EExpr> parens =
                Parsers.<Expr, EExpr>loc(specialize(inParens(minIndent), EExpr.InParens::new)).parse(state);
        if (!parens.isOk()) {
            return parens;
        }
        ParseResult<List<String>, EExpr> accesses = accessChain(parens.state());
        Located<Expr> term = withAccesses(parens.value(), accesses.value(), state, accesses.state());
        if (leading && accesses.value().isEmpty()) {
            ParseResult<Located<Expr>, EExpr> definition = definitionAfterTerm(minIndent, term, accesses.state());
            if (definition != null) {
                return definition;
            }
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, term, accesses.state());
    }

    private Parser<Expr, EInParens> inParens(int minIndent) {
        return state -> {
            if (state.isEmpty() || state.peek() != '(') {
                return ParseResult.err(Progress.NO_PROGRESS, new EInParens.Open(state.line(), state.column()), state);
            }
            ParseResult<Located<Expr>, EInParens> inner = Blankspace.<Expr, EInParens>space0Before(
                    specialize(exprParser.expr(minIndent), EInParens.Expr::new),
                    minIndent, EInParens.Space::new, EInParens.IndentOpen::new, Expr.SPACES).parse(state.advance(1));
            if (!inner.isOk()) {
                return inner.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            ParseResult<List<CommentOrNewline>, EInParens> trailing =
                    Blankspace.<EInParens>space0(0, EInParens.Space::new, EInParens.IndentEnd::new).parse(inner.state());
            if (!trailing.isOk()) {
                return trailing.castErr();
            }
            State end = trailing.state();
            if (end.peek() != ')') {
                return ParseResult.err(Progress.MADE_PROGRESS, new EInParens.End(end.line(), end.column()), end);
            }
            Expr value = Expr.SPACES.after(inner.value().value(), trailing.value());
            return ParseResult.ok(Progress.MADE_PROGRESS, new Expr.ParensAround(value), end.advance(1));
        };
    }

    /**
     * Zero or more {@code .field} directly after a closing bracket.
     */
    private static ParseResult<List<String>, EExpr> accessChain(State state) {
        List<String> fields = new ArrayList<>();
        State current = state;
        while (current.peek() == '.' && Character.isLowerCase(current.peek(1))) {
            ParseResult<String, EExpr> field = Identifiers.<EExpr>lowercaseIdent(EExpr.Start::new).parse(current.advance(1));
            if (!field.isOk()) {
                break;
            }
            fields.add(field.value());
            current = field.state();
        }
        return ParseResult.ok(Progress.between(state, current), fields, current);
    }

    private static Located<Expr> withAccesses(Located<Expr> term, List<String> fields, State start, State end) {
        if (fields.isEmpty()) {
            return term;
        }
        Expr value = term.value();
        for (String field : fields) {
            value = new Expr.Access(value, field);
        }
        return Located.at(Region.between(start.position(), end.position()), value);
    }

    /**
     * Looks past the term for {@code =} or {@code :}.
     *
     * @return the parsed definitions block, or null when the term is not followed by a definition operator
     */
    private ParseResult<Located<Expr>, EExpr> definitionAfterTerm(int minIndent, Located<Expr> term, State state) {
        ParseResult<List<CommentOrNewline>, EExpr> spaces =
                Blankspace.<EExpr>space0(minIndent, EExpr.Space::new, EExpr.IndentEquals::new).parse(state);
        if (!spaces.isOk()) {
            return null;
        }
        ParseResult<Located<BinaryOperator>, EExpr> operator = loc(ExprParser.operator()).parse(spaces.state());
        if (!operator.isOk()
                || (operator.value().value() != BinaryOperator.ASSIGNMENT
                && operator.value().value() != BinaryOperator.HAS_TYPE)) {
            return null;
        }
        ParseResult<List<CommentOrNewline>, EExpr> spacesAfterOperator =
                Blankspace.<EExpr>space0(minIndent, EExpr.Space::new, EExpr.IndentDefBody::new).parse(operator.state());
        if (!spacesAfterOperator.isOk()) {
            return spacesAfterOperator.castErr();
        }
        Located<Expr> lhs = Located.at(term.region(), Expr.SPACES.after(term.value(), spaces.value()));
        ParseResult<Expr, EExpr> definition = exprParser.definitions().parseDefinitionFrom(
                lhs, List.of(), operator.value(), spacesAfterOperator.value(), spacesAfterOperator.state());
        if (!definition.isOk()) {
            return definition.castErr();
        }
        Region region = Region.between(term.region().start(), definition.state().position());
        return ParseResult.ok(Progress.MADE_PROGRESS, Located.at(region, definition.value()), definition.state());
    }

    // ==================== Lambdas ====================

    /**
     * {@code \a, b -> body}.
     */
    public Parser<Expr, ELambda> closure(int minIndent) {
        return state -> {
            if (state.isEmpty() || state.peek() != '\\') {
                return ParseResult.err(Progress.NO_PROGRESS, new ELambda.Start(state.line(), state.column()), state);
            }
            State afterSlash = state.advance(1);
            Parser<Located<Pattern>, ELambda> param = Blankspace.space0Around(
                    specialize(exprParser.patterns().closureParam(minIndent), ELambda.Pattern::new),
                    minIndent, ELambda.Space::new, ELambda.IndentArg::new, ELambda.IndentArrow::new, Pattern.SPACES);
            ParseResult<List<Located<Pattern>>, ELambda> params =
                    Parsers.sepBy1(Parsers.word1(',', ELambda.Comma::new), param).parse(afterSlash);
            if (!params.isOk()) {
                if (!params.progress().made()) {
                    return ParseResult.err(Progress.MADE_PROGRESS,
                            new ELambda.Arg(afterSlash.line(), afterSlash.column()), afterSlash);
                }
                return params.castErr();
            }

            ParseResult<Void, ELambda> arrow = Parsers.<ELambda>word("->", ELambda.Arrow::new).parse(params.state());
            if (!arrow.isOk()) {
                return arrow.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            ParseResult<Located<Expr>, ELambda> body = Blankspace.<Expr, ELambda>space0Before(
                    specialize(exprParser.expr(minIndent), ELambda.Body::new),
                    minIndent, ELambda.Space::new, ELambda.IndentBody::new, Expr.SPACES).parse(arrow.state());
            if (!body.isOk()) {
                return body.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            return ParseResult.ok(Progress.MADE_PROGRESS, new Expr.Closure(params.value(), body.value()), body.state());
        };
    }

    // ==================== Lists ====================

    public Parser<Expr, EList> listLiteral(int minIndent) {
        return state -> {
            if (state.isEmpty() || state.peek() != '[') {
                return ParseResult.err(Progress.NO_PROGRESS, new EList.Open(state.line(), state.column()), state);
            }
            ParseResult<Delimited<Expr>, EList> items = Blankspace.<Expr, EList>collectionBody(
                    ']', specialize(exprParser.expr(minIndent), EList.Expr::new), minIndent,
                    EList.End::new, EList.Space::new, EList.IndentEnd::new, Expr.SPACES).parse(state.advance(1));
            if (!items.isOk()) {
                return items.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            Delimited<Expr> list = items.value();
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    new Expr.ListLiteral(list.items(), list.finalComments()), items.state());
        };
    }

    // ==================== Records ====================

    private ParseResult<Located<Expr>, EExpr> recordLiteral(int minIndent, boolean leading, State state) {
        ParseResult<Located<Expr>, EExpr> record =
                Parsers.<Expr, EExpr>loc(specialize(recordHelp(minIndent), EExpr.InRecord::new)).parse(state);
        if (!record.isOk()) {
            return record;
        }
        ParseResult<List<String>, EExpr> accesses = accessChain(record.state());
        Located<Expr> term = withAccesses(record.value(), accesses.value(), state, accesses.state());
        boolean update = ((Expr.RecordLiteral) record.value().value()).isUpdate();
        if (leading && !update && accesses.value().isEmpty()) {
            ParseResult<Located<Expr>, EExpr> definition = definitionAfterTerm(minIndent, term, accesses.state());
            if (definition != null) {
                return definition;
            }
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, term, accesses.state());
    }

    private Parser<Expr, ERecord> recordHelp(int minIndent) {
        return state -> {
            if (state.isEmpty() || state.peek() != '{') {
                return ParseResult.err(Progress.NO_PROGRESS, new ERecord.Open(state.line(), state.column()), state);
            }
            State afterBrace = state.advance(1);
            ParseResult<Located<Expr>, ERecord> update = recordUpdateTarget(minIndent, afterBrace);
            if (update.isOk() && update.value() == null) {
                return ParseResult.err(Progress.MADE_PROGRESS, new ERecord.Updateable(afterBrace.line(), afterBrace.column()),
                        afterBrace);
            }
            State fieldsStart = update.isOk() ? update.state() : afterBrace;

            ParseResult<Delimited<AssignedField<Expr>>, ERecord> fields = Blankspace.collectionBody(
                    '}', loc(recordField(minIndent)), minIndent,
                    ERecord.End::new, ERecord.Space::new, ERecord.IndentEnd::new, AssignedField.spaces())
                    .parse(fieldsStart);
            if (!fields.isOk()) {
                return fields.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            Located<Expr> target = update.isOk() ? update.value() : null;
            Delimited<AssignedField<Expr>> parsed = fields.value();
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    new Expr.RecordLiteral(target, parsed.items(), parsed.finalComments()), fields.state());
        };
    }

    /**
     * {@code rec &} at the start of a record. Fails when there is no {@code &};
     * succeeds with a null value when the thing before {@code &} is not a plain variable.
     */
    private ParseResult<Located<Expr>, ERecord> recordUpdateTarget(int minIndent, State state) {
        Spaceable<Ident> unspaced = Spaceable.of((ident, spaces) -> ident, (ident, spaces) -> ident);
        Parser<Located<Ident>, ERecord> target = Blankspace.space0Around(
                loc(Identifiers.ident(ERecord.Updateable::new)),
                minIndent, ERecord.Space::new, ERecord.IndentOpen::new, ERecord.IndentEnd::new, unspaced);
        ParseResult<Located<Ident>, ERecord> ident = target.parse(state);
        if (!ident.isOk() || ident.state().peek() != '&') {
            return ParseResult.err(Progress.NO_PROGRESS, new ERecord.Ampersand(state.line(), state.column()), state);
        }
        State afterAmpersand = ident.state().advance(1);
        Ident value = ident.value().value();
        if (!(value instanceof Ident.Access access) || access.parts().size() != 1) {
            return ParseResult.ok(Progress.MADE_PROGRESS, null, afterAmpersand);
        }
        Located<Expr> var = Located.at(ident.value().region(), new Expr.Var(access.moduleName(), access.parts().get(0)));
        return ParseResult.ok(Progress.MADE_PROGRESS, var, afterAmpersand);
    }

    /**
     * {@code label}, {@code label: value} or {@code label ? value}.
     */
    private Parser<AssignedField<Expr>, ERecord> recordField(int minIndent) {
        return state -> {
            ParseResult<Located<String>, ERecord> label = loc(Identifiers.<ERecord>lowercaseIdent(ERecord.Field::new)).parse(state);
            if (!label.isOk()) {
                return label.castErr();
            }
            ParseResult<List<CommentOrNewline>, ERecord> spaces =
                    Blankspace.<ERecord>space0(minIndent, ERecord.Space::new, ERecord.IndentColon::new).parse(label.state());
            if (!spaces.isOk()) {
                return spaces.castErr();
            }
            char separator = spaces.state().peek();
            if (separator != ':' && separator != '?') {
                return ParseResult.ok(Progress.MADE_PROGRESS, new AssignedField.LabelOnly<>(label.value()), label.state());
            }
            ParseResult<Located<Expr>, ERecord> value = Blankspace.<Expr, ERecord>space0Before(
                    specialize(exprParser.expr(minIndent), ERecord.Expr::new),
                    minIndent, ERecord.Space::new, ERecord.IndentColon::new, Expr.SPACES)
                    .parse(spaces.state().advance(1));
            if (!value.isOk()) {
                return value.<AssignedField<Expr>>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            AssignedField<Expr> field = separator == ':'
                    ? new AssignedField.RequiredValue<>(label.value(), spaces.value(), value.value())
                    : new AssignedField.OptionalValue<>(label.value(), spaces.value(), value.value());
            return ParseResult.ok(Progress.MADE_PROGRESS, field, value.state());
        };
    }
}
