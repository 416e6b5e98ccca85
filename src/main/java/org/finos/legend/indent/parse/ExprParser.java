package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.BinaryOperator;
import org.finos.legend.indent.ast.CalledVia;
import org.finos.legend.indent.ast.CommentOrNewline;
import org.finos.legend.indent.ast.Def;
import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Position;
import org.finos.legend.indent.ast.Region;
import org.finos.legend.indent.ast.UnaryOperator;
import org.finos.legend.indent.parse.error.EExpr;
import org.finos.legend.indent.parse.error.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.finos.legend.indent.parse.Parsers.loc;
import static org.finos.legend.indent.parse.Parsers.oneOf;
import static org.finos.legend.indent.parse.Parsers.skipFirst;
import static org.finos.legend.indent.parse.Parsers.specialize;

/**
 * Expression parser for an indentation-sensitive, expression-oriented language.
 *
 * <p>Parses source such as:
 * <pre>
 * total : List Num -&gt; Num
 * total = \items -&gt;
 *     when items is
 *         [] -&gt; 0
 *         _ -&gt; List.sum items
 *
 * total [ 1, 2, -3 ]
 * </pre>
 *
 * <p>The spine of every expression is an operator chain: a leading term, then
 * any mix of juxtaposed argument terms and infix operators. Arguments bind
 * tighter than any operator. Operators get no relative precedence here: the
 * chain is folded to the right in the order the operators appear.
 *
 * <p>When the chain reaches {@code =}, {@code :} or {@code <-} before any other
 * operator, everything to its left is reinterpreted as a pattern and parsing
 * continues as a definitions block.
 *
 * <p>Instances are immutable and may be shared across threads.
 */
public final class ExprParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExprParser.class);

    private static final String OPERATOR_CHARS = "+-/*=.<>:&|^?%!";

    private final PatternParser patterns;
    private final TermParser terms;
    private final DefinitionParser definitions;
    private final IfParser ifs;
    private final WhenParser whens;

    public ExprParser() {
        this(new TypeAnnotations());
    }

    public ExprParser(TypeAnnotationParser typeParser) {
        this.patterns = new PatternParser(this);
        this.terms = new TermParser(this);
        this.definitions = new DefinitionParser(this, typeParser);
        this.ifs = new IfParser(this);
        this.whens = new WhenParser(this);
    }

    // ==================== Entry points ====================

    /**
     * Parses a whole buffer as one expression.
     *
     * @param source the source text
     * @return the located expression
     * @throws ParseException if the text is not a single well-formed expression
     */
    public static Located<Expr> parse(String source) {
        LOGGER.debug("Parsing expression of {} characters", source.length());
        ExprParser parser = new ExprParser();
        ParseResult<Located<Expr>, EExpr> result = parser.parseExpr(0, State.of(source));
        if (!result.isOk()) {
            throw failure(result.error());
        }
        ParseResult<List<CommentOrNewline>, EExpr> rest =
                Blankspace.<EExpr>space0(0, EExpr.Space::new, EExpr.IndentEnd::new).parse(result.state());
        if (!rest.isOk()) {
            throw failure(rest.error());
        }
        State end = rest.state();
        if (!end.isEmpty()) {
            throw failure(new EExpr.BadExprEnd(end.line(), end.column()));
        }
        return result.value();
    }

    /**
     * Parses a buffer as a list of top-level definitions starting at column 0.
     *
     * @param source the source text
     * @return the definitions, each carrying the spacing found before it
     * @throws ParseException at the first definition that does not parse
     */
    public static List<Located<Def>> parseDefinitions(String source) {
        LOGGER.debug("Parsing definitions from {} characters", source.length());
        ExprParser parser = new ExprParser();
        List<Located<Def>> defs = new ArrayList<>();
        State current = State.of(source);
        while (true) {
            ParseResult<List<CommentOrNewline>, EExpr> spaces =
                    Blankspace.<EExpr>space0(0, EExpr.Space::new, EExpr.IndentStart::new).parse(current);
            if (!spaces.isOk()) {
                throw failure(spaces.error());
            }
            if (spaces.state().isEmpty()) {
                return defs;
            }
            ParseResult<Located<Def>, EExpr> def = parser.parseDef(0, spaces.state());
            if (!def.isOk()) {
                throw failure(def.error());
            }
            Located<Def> parsed = def.value();
            defs.add(Located.at(parsed.region(), Def.SPACES.before(parsed.value(), spaces.value())));
            current = def.state();
        }
    }

    private static ParseException failure(EExpr problem) {
        LOGGER.debug("Parse failed at {}:{}: {}", problem.line(), problem.column(), problem);
        return new ParseException(problem);
    }

    /**
     * Parses one expression, optionally preceded by spacing, at or past {@code minIndent}.
     */
    public ParseResult<Located<Expr>, EExpr> parseExpr(int minIndent, State state) {
        return Blankspace.space0Before(expr(minIndent), minIndent, EExpr.Space::new, EExpr.IndentStart::new, Expr.SPACES)
                .parse(state);
    }

    /**
     * Parses one definition at {@code state}. Fails without progress when the
     * input does not start with {@code pattern =} or {@code pattern :}.
     */
    public ParseResult<Located<Def>, EExpr> parseDef(int minIndent, State state) {
        return definitions.parseDef(minIndent, state);
    }

    /**
     * An expression starting exactly at the cursor: {@code if}, {@code when},
     * a lambda, or an operator chain.
     */
    public Parser<Located<Expr>, EExpr> expr(int minIndent) {
        return oneOf(
                loc(specialize(ifs.ifExpr(minIndent), EExpr.InIf::new)),
                loc(specialize(whens.whenExpr(minIndent), EExpr.InWhen::new)),
                loc(specialize(terms.closure(minIndent), EExpr.InLambda::new)),
                state -> operatorChain(minIndent, state),
                state -> ParseResult.err(Progress.NO_PROGRESS, new EExpr.Start(state.line(), state.column()), state));
    }

    PatternParser patterns() {
        return patterns;
    }

    DefinitionParser definitions() {
        return definitions;
    }

    // ==================== Operator chain ====================

    /**
     * Running state of one operator chain. Mutated only by the chain loop that owns it.
     */
    private static final class OperatorChain {

        private final List<PendingOperator> operators = new ArrayList<>();
        private List<Located<Expr>> arguments = new ArrayList<>();
        private Located<Expr> expr;
        private List<CommentOrNewline> spacesAfter;
        /** State right after the last term, where the chain ends if nothing follows. */
        private State initial;
        private Position end;

        OperatorChain(Located<Expr> expr, State afterTerm) {
            this.expr = expr;
            this.spacesAfter = List.of();
            this.initial = afterTerm;
            this.end = afterTerm.position();
        }

        /**
         * Attaches pending spacing to the last argument, or to the expression when there is none.
         */
        void consumeSpaces() {
            if (spacesAfter.isEmpty()) {
                return;
            }
            if (arguments.isEmpty()) {
                expr = Located.at(expr.region(), Expr.SPACES.after(expr.value(), spacesAfter));
            } else {
                int last = arguments.size() - 1;
                Located<Expr> argument = arguments.get(last);
                arguments.set(last, Located.at(argument.region(), Expr.SPACES.after(argument.value(), spacesAfter)));
            }
            spacesAfter = List.of();
        }

        /**
         * Applies the current arguments and folds the pending operators from the right.
         */
        Located<Expr> finish() {
            Located<Expr> result = toCall(expr, arguments);
            for (int i = operators.size() - 1; i >= 0; i--) {
                PendingOperator pending = operators.get(i);
                Region region = Region.span(pending.left().region(), result.region());
                result = Located.at(region, new Expr.BinaryOp(pending.left(), pending.operator(), result));
            }
            return result;
        }
    }

    private record PendingOperator(Located<Expr> left, Located<BinaryOperator> operator) {
    }

    /**
     * Outcome of one chain step: either the finished chain or the state to continue from.
     */
    private record ChainStep(ParseResult<Located<Expr>, EExpr> done, State next) {

        static ChainStep done(ParseResult<Located<Expr>, EExpr> result) {
            return new ChainStep(result, null);
        }

        static ChainStep next(State state) {
            return new ChainStep(null, state);
        }
    }

    private ParseResult<Located<Expr>, EExpr> operatorChain(int minIndent, State start) {
        ParseResult<Located<Expr>, EExpr> leading = terms.leadingTerm(minIndent).parse(start);
        if (!leading.isOk() || leading.value().value() instanceof Expr.Defs) {
            return leading;
        }
        ParseResult<List<CommentOrNewline>, EExpr> spaces = space0(minIndent).parse(leading.state());
        if (!spaces.isOk()) {
            return ParseResult.ok(Progress.MADE_PROGRESS, leading.value(), leading.state());
        }

        OperatorChain chain = new OperatorChain(leading.value(), leading.state());
        chain.spacesAfter = spaces.value();
        State current = spaces.state();
        while (true) {
            ChainStep step = chainStep(minIndent, chain, current);
            if (step.done() != null) {
                ParseResult<Located<Expr>, EExpr> result = step.done();
                if (!result.isOk()) {
                    return result;
                }
                Region region = Region.between(start.position(), result.state().position());
                return ParseResult.ok(Progress.MADE_PROGRESS, Located.at(region, result.value().value()), result.state());
            }
            current = step.next();
        }
    }

    /**
     * Tries an argument term, then an operator; finishes the chain when neither is there.
     */
    private ChainStep chainStep(int minIndent, OperatorChain chain, State state) {
        ParseResult<Located<Expr>, EExpr> argument = skipFirst(
                Blankspace.checkIndent(minIndent, EExpr.IndentEnd::new), terms.term(minIndent)).parse(state);
        if (argument.isOk()) {
            Located<Expr> arg = argument.value();
            if (!chain.spacesAfter.isEmpty()) {
                arg = Located.at(arg.region(), Expr.SPACES.before(arg.value(), chain.spacesAfter));
                chain.spacesAfter = List.of();
            }
            chain.initial = argument.state();
            chain.arguments.add(arg);
            chain.end = argument.state().position();
            return continueAfterTerm(minIndent, chain, argument.state());
        }
        if (argument.progress().made()) {
            return ChainStep.done(argument);
        }

        ParseResult<Located<BinaryOperator>, EExpr> operator = loc(operator()).parse(state);
        if (!operator.isOk()) {
            if (operator.progress().made()) {
                return ChainStep.done(operator.castErr());
            }
            // nothing more: drop the trailing spacing
            return ChainStep.done(ParseResult.ok(Progress.MADE_PROGRESS, chain.finish(), chain.initial));
        }
        chain.consumeSpaces();
        chain.initial = state;
        return operatorStep(minIndent, chain, operator.value(), operator.state());
    }

    private ChainStep operatorStep(int minIndent, OperatorChain chain, Located<BinaryOperator> operator, State state) {
        ParseResult<List<CommentOrNewline>, EExpr> spacesAfterOperator = space0(minIndent).parse(state);
        if (!spacesAfterOperator.isOk()) {
            return ChainStep.done(spacesAfterOperator.castErr());
        }
        State afterOperator = spacesAfterOperator.state();
        BinaryOperator op = operator.value();
        Position opStart = operator.region().start();
        Position opEnd = operator.region().end();

        if (op == BinaryOperator.MINUS && !chain.end.equals(opStart) && opEnd.equals(afterOperator.position())) {
            return negativeArgument(minIndent, chain, operator, afterOperator);
        }

        if (op.startsDefinition()) {
            if (!chain.operators.isEmpty()) {
                return ChainStep.done(ParseResult.err(Progress.MADE_PROGRESS,
                        new EExpr.BadOperator(op.symbol(), opStart.line(), opStart.column()), afterOperator));
            }
            ParseResult<Expr, EExpr> definition = definitions.parseDefinitionFrom(
                    chain.expr, chain.arguments, operator, spacesAfterOperator.value(), afterOperator);
            if (!definition.isOk()) {
                return ChainStep.done(definition.castErr());
            }
            Region region = Region.between(chain.expr.region().start(), definition.state().position());
            return ChainStep.done(ParseResult.ok(Progress.MADE_PROGRESS,
                    Located.at(region, definition.value()), definition.state()));
        }

        ParseResult<Located<Expr>, EExpr> right = terms.operatorOperand(minIndent).parse(afterOperator);
        if (!right.isOk()) {
            if (right.progress().made()) {
                return ChainStep.done(right);
            }
            return ChainStep.done(ParseResult.err(Progress.MADE_PROGRESS,
                    new EExpr.Start(afterOperator.line(), afterOperator.column()), afterOperator));
        }
        Located<Expr> rightExpr = right.value();
        if (!spacesAfterOperator.value().isEmpty()) {
            rightExpr = Located.at(rightExpr.region(), Expr.SPACES.before(rightExpr.value(), spacesAfterOperator.value()));
        }

        chain.operators.add(new PendingOperator(toCall(chain.expr, chain.arguments), operator));
        chain.arguments = new ArrayList<>();
        chain.expr = rightExpr;
        chain.end = right.state().position();
        chain.initial = right.state();
        return continueAfterTerm(minIndent, chain, right.state());
    }

    /**
     * {@code x -1}: a minus with a gap before it and none after is the sign of an argument.
     */
    private ChainStep negativeArgument(int minIndent, OperatorChain chain, Located<BinaryOperator> operator, State state) {
        ParseResult<Located<Expr>, EExpr> negated = terms.operand(minIndent).parse(state);
        if (!negated.isOk()) {
            return ChainStep.done(negated.withProgress(Progress.MADE_PROGRESS));
        }
        Located<Expr> argument = numericNegateExpression(chain.initial, operator, negated.value(), chain.spacesAfter);
        chain.spacesAfter = List.of();
        chain.arguments.add(argument);
        chain.end = negated.state().position();
        chain.initial = negated.state();
        return continueAfterTerm(minIndent, chain, negated.state());
    }

    /**
     * Reads the spacing after a term; a chain whose next line is indented too little ends here.
     */
    private ChainStep continueAfterTerm(int minIndent, OperatorChain chain, State afterTerm) {
        ParseResult<List<CommentOrNewline>, EExpr> spaces = space0(minIndent).parse(afterTerm);
        if (!spaces.isOk()) {
            chain.spacesAfter = List.of();
            return ChainStep.done(ParseResult.ok(Progress.MADE_PROGRESS, chain.finish(), afterTerm));
        }
        chain.spacesAfter = spaces.value();
        return ChainStep.next(spaces.state());
    }

    private static Parser<List<CommentOrNewline>, EExpr> space0(int minIndent) {
        return Blankspace.space0(minIndent, EExpr.Space::new, EExpr.IndentEnd::new);
    }

    /**
     * {@code f a b} as an application, or {@code f} alone when there are no arguments.
     */
    static Located<Expr> toCall(Located<Expr> function, List<Located<Expr>> arguments) {
        if (arguments.isEmpty()) {
            return function;
        }
        Region region = Region.span(function.region(), arguments.get(arguments.size() - 1).region());
        return Located.at(region, new Expr.Apply(function, arguments, CalledVia.SPACE));
    }

    /**
     * Applies a leading {@code -} to a term. Number literals absorb the sign into their
     * source text, so the most negative integer never has to exist as a positive value.
     *
     * @param atMinus state positioned on the {@code -}
     */
    static Located<Expr> numericNegateExpression(
            State atMinus, Located<BinaryOperator> operator, Located<Expr> expr, List<CommentOrNewline> spaces) {
        Region region = expr.region().extendStart(1);
        Expr value = expr.value();
        Expr negated;
        if (value instanceof Expr.Num num) {
            negated = new Expr.Num(signedText(atMinus, num.text()));
        } else if (value instanceof Expr.Float number) {
            negated = new Expr.Float(signedText(atMinus, number.text()));
        } else if (value instanceof Expr.NonBase10Int number) {
            negated = new Expr.NonBase10Int(signedText(atMinus, number.text()), number.base(), !number.negative());
        } else {
            negated = new Expr.UnaryOp(expr, Located.at(operator.region(), UnaryOperator.NEGATE));
        }
        return Located.at(region, Expr.SPACES.before(negated, spaces));
    }

    private static String signedText(State atMinus, String text) {
        return atMinus.source().substring(atMinus.offset(), atMinus.offset() + text.length() + 1);
    }

    // ==================== Operators ====================

    /**
     * An infix operator. A lone {@code .} and {@code ->} are not operators and fail
     * without progress; any other unknown run of operator characters is a
     * {@link EExpr.BadOperator}.
     */
    static Parser<BinaryOperator, EExpr> operator() {
        return state -> {
            int length = 0;
            while (OPERATOR_CHARS.indexOf(state.peek(length)) >= 0) {
                length++;
            }
            if (length == 0) {
                return ParseResult.err(Progress.NO_PROGRESS, new EExpr.Start(state.line(), state.column()), state);
            }
            String text = state.source().substring(state.offset(), state.offset() + length);
            if (text.equals(".") || text.equals("->")) {
                return ParseResult.err(Progress.NO_PROGRESS,
                        new EExpr.BadOperator(text, state.line(), state.column()), state);
            }
            BinaryOperator operator = BinaryOperator.fromSymbol(text);
            if (operator == null) {
                return ParseResult.err(Progress.MADE_PROGRESS,
                        new EExpr.BadOperator(text, state.line(), state.column()), state);
            }
            return ParseResult.ok(Progress.MADE_PROGRESS, operator, state.advance(length));
        };
    }
}
