package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.ast.Pattern;
import org.finos.legend.indent.parse.error.EWhen;

import java.util.ArrayList;
import java.util.List;

import static org.finos.legend.indent.parse.Parsers.backtrackable;
import static org.finos.legend.indent.parse.Parsers.specialize;

/**
 * {@code when cond is} followed by one or more branches
 * {@code pattern | pattern if guard -> result}.
 *
 * <p>The first pattern of the first branch fixes the branch column. Every later
 * branch must start at exactly that column, and alternatives after {@code |}
 * may not sit left of it.
 */
final class WhenParser {

    private final ExprParser exprParser;

    WhenParser(ExprParser exprParser) {
        this.exprParser = exprParser;
    }

    Parser<Expr, EWhen> whenExpr(int minIndent) {
        return state -> {
            ParseResult<Void, EWhen> whenKeyword = Parsers.<EWhen>keyword("when", EWhen.When::new).parse(state);
            if (!whenKeyword.isOk()) {
                return whenKeyword.castErr();
            }
            int caseIndent = state.indentColumn();

            ParseResult<Located<Expr>, EWhen> condition = Blankspace.<Expr, EWhen>space0Around(
                    specialize(exprParser.expr(minIndent), EWhen.Condition::new),
                    minIndent, EWhen.Space::new, EWhen.IndentCondition::new, EWhen.IndentIs::new, Expr.SPACES)
                    .parse(whenKeyword.state());
            if (!condition.isOk()) {
                return condition.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            ParseResult<Void, EWhen> is = Parsers.<EWhen>keyword("is", EWhen.Is::new).parse(condition.state());
            if (!is.isOk()) {
                return is.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }

            if (caseIndent < minIndent) {
                State afterIs = is.state();
                return ParseResult.err(Progress.MADE_PROGRESS,
                        new EWhen.PatternAlignment(minIndent - caseIndent, afterIs.line(), afterIs.column()), afterIs);
            }

            ParseResult<List<Expr.WhenBranch>, EWhen> branches = branches(caseIndent, is.state());
            if (!branches.isOk()) {
                return branches.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            return ParseResult.ok(Progress.MADE_PROGRESS,
                    new Expr.When(condition.value(), branches.value()), branches.state());
        };
    }

    private ParseResult<List<Expr.WhenBranch>, EWhen> branches(int caseIndent, State state) {
        ParseResult<Alternatives, EWhen> first = alternatives(caseIndent, -1, state);
        if (!first.isOk()) {
            return first.castErr();
        }
        int originalIndent = first.value().patterns().get(0).region().startColumn();
        ParseResult<Located<Expr>, EWhen> firstResult = branchResult(originalIndent + 1, first.state());
        if (!firstResult.isOk()) {
            return firstResult.castErr();
        }

        List<Expr.WhenBranch> branches = new ArrayList<>();
        branches.add(first.value().toBranch(firstResult.value()));
        State current = firstResult.state();
        while (true) {
            ParseResult<Alternatives, EWhen> next =
                    backtrackableStart(caseIndent).parse(current);
            if (!next.isOk()) {
                break;
            }
            ParseResult<Alternatives, EWhen> alternatives = alternatives(caseIndent, originalIndent, current);
            if (!alternatives.isOk()) {
                return alternatives.castErr();
            }
            ParseResult<Located<Expr>, EWhen> result = branchResult(originalIndent + 1, alternatives.state());
            if (!result.isOk()) {
                return result.castErr();
            }
            branches.add(alternatives.value().toBranch(result.value()));
            current = result.state();
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, branches, current);
    }

    /**
     * Succeeds when another branch starts after the spacing, without checking its column.
     */
    private Parser<Alternatives, EWhen> backtrackableStart(int caseIndent) {
        return backtrackable(state -> {
            ParseResult<Located<Pattern>, EWhen> pattern = Blankspace.<Pattern, EWhen>space0Before(
                    specialize(exprParser.patterns().locPattern(caseIndent), EWhen.Pattern::new),
                    caseIndent, EWhen.Space::new, EWhen.IndentPattern::new, Pattern.SPACES).parse(state);
            if (!pattern.isOk()) {
                return pattern.castErr();
            }
            return ParseResult.ok(Progress.MADE_PROGRESS, new Alternatives(List.of(pattern.value()), null), pattern.state());
        });
    }

    /**
     * {@code p1 | p2 if guard}, stopping before the arrow.
     *
     * @param originalIndent required column of the first pattern, or -1 for the first branch
     */
    private ParseResult<Alternatives, EWhen> alternatives(int caseIndent, int originalIndent, State state) {
        Parser<Located<Pattern>, EWhen> pattern = Blankspace.space0Around(
                specialize(exprParser.patterns().locPattern(caseIndent), EWhen.Pattern::new),
                caseIndent, EWhen.Space::new, EWhen.IndentPattern::new, EWhen.IndentArrow::new, Pattern.SPACES);

        ParseResult<List<Located<Pattern>>, EWhen> patterns =
                Parsers.sepBy1(Parsers.word1('|', EWhen.Bar::new), pattern).parse(state);
        if (!patterns.isOk()) {
            return patterns.castErr();
        }
        List<Located<Pattern>> parsed = patterns.value();
        int firstColumn = parsed.get(0).region().startColumn();
        if (originalIndent >= 0 && firstColumn != originalIndent) {
            Located<Pattern> misaligned = parsed.get(0);
            return ParseResult.err(Progress.MADE_PROGRESS,
                    new EWhen.PatternAlignment(originalIndent - firstColumn,
                            misaligned.region().startLine(), misaligned.region().startColumn()),
                    patterns.state());
        }
        int minimumColumn = originalIndent >= 0 ? originalIndent : firstColumn;
        for (Located<Pattern> alternative : parsed.subList(1, parsed.size())) {
            if (alternative.region().startColumn() < minimumColumn) {
                return ParseResult.err(Progress.MADE_PROGRESS,
                        new EWhen.IndentPattern(alternative.region().startLine(), alternative.region().startColumn()),
                        patterns.state());
            }
        }

        ParseResult<Void, EWhen> ifToken = Parsers.<EWhen>keyword("if", EWhen.IfToken::new).parse(patterns.state());
        if (!ifToken.isOk()) {
            return ParseResult.ok(Progress.MADE_PROGRESS, new Alternatives(parsed, null), patterns.state());
        }
        ParseResult<Located<Expr>, EWhen> guard = Blankspace.<Expr, EWhen>space0Around(
                specialize(exprParser.expr(caseIndent), EWhen.IfGuard::new),
                caseIndent, EWhen.Space::new, EWhen.IndentIfGuard::new, EWhen.IndentArrow::new, Expr.SPACES)
                .parse(ifToken.state());
        if (!guard.isOk()) {
            return guard.<Alternatives>castErr().withProgress(Progress.MADE_PROGRESS);
        }
        return ParseResult.ok(Progress.MADE_PROGRESS, new Alternatives(parsed, guard.value()), guard.state());
    }

    /**
     * {@code -> expr}, with the result indented past the branch column.
     */
    private ParseResult<Located<Expr>, EWhen> branchResult(int indent, State state) {
        ParseResult<Void, EWhen> arrow = Parsers.<EWhen>word("->", EWhen.Arrow::new).parse(state);
        if (!arrow.isOk()) {
            return arrow.<Located<Expr>>castErr().withProgress(Progress.MADE_PROGRESS);
        }
        ParseResult<Located<Expr>, EWhen> result = Blankspace.<Expr, EWhen>space0Before(
                specialize(exprParser.expr(indent), EWhen.Branch::new),
                indent, EWhen.Space::new, EWhen.IndentBranch::new, Expr.SPACES).parse(arrow.state());
        return result.isOk() ? result : result.withProgress(Progress.MADE_PROGRESS);
    }

    private record Alternatives(List<Located<Pattern>> patterns, Located<Expr> guard) {

        Expr.WhenBranch toBranch(Located<Expr> value) {
            return new Expr.WhenBranch(patterns, value, guard);
        }
    }
}
