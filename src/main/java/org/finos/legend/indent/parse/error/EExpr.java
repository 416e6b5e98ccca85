package org.finos.legend.indent.parse.error;

import org.finos.legend.indent.ast.Region;

/**
 * Errors of the general expression context. Variants named {@code In*}
 * embed the error of a nested context.
 */
public sealed interface EExpr extends ParseProblem {

    record Start(int line, int column) implements EExpr {
    }

    record End(int line, int column) implements EExpr {
    }

    /** Input left over after a complete expression. */
    record BadExprEnd(int line, int column) implements EExpr {
    }

    record Space(BadInputError problem, int line, int column) implements EExpr {
    }

    /** An operator that is misplaced or does not exist, such as {@code =} after {@code +} or {@code =>}. */
    record BadOperator(String operator, int line, int column) implements EExpr {
    }

    /** Definitions that are not followed by anything. */
    record DefMissingFinalExpr(int line, int column) implements EExpr {
    }

    /** Definitions followed by something that does not parse as an expression. */
    record DefMissingFinalExpr2(EExpr problem, int line, int column) implements EExpr {
    }

    /**
     * {@code f a b = ...}: arguments on the left of {@code =}.
     *
     * @param arguments region covering the arguments
     */
    record ElmStyleFunction(Region arguments, int line, int column) implements EExpr {
    }

    /** Left side of a definition that has no pattern equivalent. */
    record MalformedPattern(int line, int column) implements EExpr {
    }

    /** Expected {@code =} or {@code :} after the left side of a definition. */
    record Equals(int line, int column) implements EExpr {
    }

    record UnaryNot(int line, int column) implements EExpr {
    }

    record UnaryNegate(int line, int column) implements EExpr {
    }

    record IndentDefBody(int line, int column) implements EExpr {
    }

    record IndentEquals(int line, int column) implements EExpr {
    }

    record IndentStart(int line, int column) implements EExpr {
    }

    record IndentEnd(int line, int column) implements EExpr {
    }

    record InType(EType problem, int line, int column) implements EExpr {
    }

    record InPattern(EPattern problem, int line, int column) implements EExpr {
    }

    record InParens(EInParens problem, int line, int column) implements EExpr {
    }

    record InLambda(ELambda problem, int line, int column) implements EExpr {
    }

    record InRecord(ERecord problem, int line, int column) implements EExpr {
    }

    record InList(EList problem, int line, int column) implements EExpr {
    }

    record InIf(EIf problem, int line, int column) implements EExpr {
    }

    record InWhen(EWhen problem, int line, int column) implements EExpr {
    }

    record InString(EString problem, int line, int column) implements EExpr {
    }

    record InNumber(ENumber problem, int line, int column) implements EExpr {
    }
}
