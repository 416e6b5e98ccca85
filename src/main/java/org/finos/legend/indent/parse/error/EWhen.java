package org.finos.legend.indent.parse.error;

/**
 * Errors inside {@code when ... is} and its branches.
 */
public sealed interface EWhen extends ParseProblem {

    record When(int line, int column) implements EWhen {
    }

    record Is(int line, int column) implements EWhen {
    }

    record Pattern(EPattern problem, int line, int column) implements EWhen {
    }

    record Arrow(int line, int column) implements EWhen {
    }

    record Bar(int line, int column) implements EWhen {
    }

    record IfToken(int line, int column) implements EWhen {
    }

    record IfGuard(EExpr problem, int line, int column) implements EWhen {
    }

    record Condition(EExpr problem, int line, int column) implements EWhen {
    }

    record Branch(EExpr problem, int line, int column) implements EWhen {
    }

    record Space(BadInputError problem, int line, int column) implements EWhen {
    }

    record IndentIs(int line, int column) implements EWhen {
    }

    record IndentCondition(int line, int column) implements EWhen {
    }

    record IndentPattern(int line, int column) implements EWhen {
    }

    record IndentArrow(int line, int column) implements EWhen {
    }

    record IndentBranch(int line, int column) implements EWhen {
    }

    record IndentIfGuard(int line, int column) implements EWhen {
    }

    /**
     * A branch whose first pattern does not line up with the first branch, or a
     * {@code when} on a line indented less than its block requires.
     *
     * @param delta first branch column minus this branch's column, or the missing
     *              indentation of the {@code when} line
     */
    record PatternAlignment(int delta, int line, int column) implements EWhen {
    }
}
