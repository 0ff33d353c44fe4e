package io.agentflow.compiler.ast;

/** Binary operators in precedence groups, lowest first. */
public enum BinaryOperator {
    OR("or"),
    AND("and"),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LT_EQ("<="),
    GT(">"),
    GT_EQ(">="),
    /** Normalized equality, {@code ~}. */
    MATCHES("~"),
    CONTAINS("contains"),
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return ordinal() >= EQ.ordinal() && ordinal() <= CONTAINS.ordinal();
    }

    public boolean isLogical() {
        return this == OR || this == AND;
    }

    /**
     * Looks up an operator by its source spelling.
     *
     * @throws IllegalArgumentException for an unknown spelling
     */
    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: '" + symbol + "'");
    }
}
