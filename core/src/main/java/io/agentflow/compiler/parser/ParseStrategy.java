package io.agentflow.compiler.parser;

/** How the {@link Parser} resolves choices in the grammar. */
public enum ParseStrategy {

    /**
     * LL(k): each decision is made from a bounded number of lookahead tokens and never revisited.
     * Linear time; rejects input the grammar cannot decide within the lookahead.
     */
    PREDICTIVE,

    /**
     * Memoizing ordered-choice parser that backtracks into later alternatives when an earlier one
     * fails. Accepts everything {@link #PREDICTIVE} accepts and builds the same tree for it.
     */
    BACKTRACKING
}
