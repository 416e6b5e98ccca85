package org.finos.legend.indent.parse;

import org.finos.legend.indent.ast.Expr;
import org.finos.legend.indent.ast.Located;
import org.finos.legend.indent.parse.error.EIf;

import java.util.ArrayList;
import java.util.List;

import static org.finos.legend.indent.parse.Parsers.backtrackable;
import static org.finos.legend.indent.parse.Parsers.keyword;
import static org.finos.legend.indent.parse.Parsers.skipFirst;
import static org.finos.legend.indent.parse.Parsers.specialize;

/**
 * {@code if c1 then a else if c2 then b else c}.
 *
 * <p>Each {@code else} is checked for a following {@code if}; the chain must end
 * in a plain {@code else} branch. Once the {@code if} keyword is read every
 * failure is reported as having made progress.
 */
final class IfParser {

    private final ExprParser exprParser;

    IfParser(ExprParser exprParser) {
        this.exprParser = exprParser;
    }

    Parser<Expr, EIf> ifExpr(int minIndent) {
        return state -> {
            ParseResult<Void, EIf> ifKeyword = Parsers.<EIf>keyword("if", EIf.If::new).parse(state);
            if (!ifKeyword.isOk()) {
                return ifKeyword.castErr();
            }

            List<Expr.IfBranch> branches = new ArrayList<>();
            State current = ifKeyword.state();
            while (true) {
                ParseResult<Expr.IfBranch, EIf> branch = branch(minIndent, current);
                if (!branch.isOk()) {
                    return branch.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
                }
                branches.add(branch.value());
                current = branch.state();

                ParseResult<Void, EIf> elseIf = backtrackable(skipFirst(
                        Blankspace.<EIf>space0(minIndent, EIf.Space::new, EIf.IndentCondition::new),
                        keyword("if", EIf.If::new))).parse(current);
                if (!elseIf.isOk()) {
                    break;
                }
                current = elseIf.state();
            }

            ParseResult<Located<Expr>, EIf> finalElse = Blankspace.<Expr, EIf>space0Before(
                    specialize(exprParser.expr(minIndent), EIf.ElseBranch::new),
                    minIndent, EIf.Space::new, EIf.IndentElseBranch::new, Expr.SPACES).parse(current);
            if (!finalElse.isOk()) {
                return finalElse.<Expr>castErr().withProgress(Progress.MADE_PROGRESS);
            }
            return ParseResult.ok(Progress.MADE_PROGRESS, new Expr.If(branches, finalElse.value()), finalElse.state());
        };
    }

    /**
     * {@code cond then branch else}, ending right after the {@code else} keyword.
     */
    private ParseResult<Expr.IfBranch, EIf> branch(int minIndent, State state) {
        ParseResult<Located<Expr>, EIf> condition = Blankspace.<Expr, EIf>space0Around(
                specialize(exprParser.expr(minIndent), EIf.Condition::new),
                minIndent, EIf.Space::new, EIf.IndentCondition::new, EIf.IndentThenToken::new, Expr.SPACES)
                .parse(state);
        if (!condition.isOk()) {
            return condition.castErr();
        }
        ParseResult<Void, EIf> then = Parsers.<EIf>keyword("then", EIf.Then::new).parse(condition.state());
        if (!then.isOk()) {
            return then.castErr();
        }
        ParseResult<Located<Expr>, EIf> thenBranch = Blankspace.<Expr, EIf>space0Around(
                specialize(exprParser.expr(minIndent), EIf.ThenBranch::new),
                minIndent, EIf.Space::new, EIf.IndentThenBranch::new, EIf.IndentElseToken::new, Expr.SPACES)
                .parse(then.state());
        if (!thenBranch.isOk()) {
            return thenBranch.castErr();
        }
        ParseResult<Void, EIf> elseKeyword = Parsers.<EIf>keyword("else", EIf.Else::new).parse(thenBranch.state());
        if (!elseKeyword.isOk()) {
            return elseKeyword.castErr();
        }
        return ParseResult.ok(Progress.MADE_PROGRESS,
                new Expr.IfBranch(condition.value(), thenBranch.value()), elseKeyword.state());
    }
}
