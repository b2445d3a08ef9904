package io.kestra.plugin.groupby.expression;

public enum Operator {
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    EQ_EQ("=="),
    NOT_EQ("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    AND_AND("&&"),
    OR_OR("||");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isArithmetic() {
        return this == PLUS || this == MINUS || this == STAR || this == SLASH || this == PERCENT;
    }

    public boolean isComparison() {
        return this == EQ_EQ || this == NOT_EQ || this == GT || this == GTE || this == LT || this == LTE;
    }

    public boolean isLogical() {
        return this == AND_AND || this == OR_OR;
    }
}
