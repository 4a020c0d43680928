package com.proseparser.ast;

/**
 * The closed set of operators a tree may contain. {@link #MINUS} doubles as
 * subtraction and negation; {@link #NOT} is unary only.
 */
public enum Operator {
    AND("and"),
    OR("or"),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    GT(">"),
    LT_EQ("<="),
    GT_EQ(">="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    NOT("not");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isBinary() {
        return this != NOT;
    }

    public boolean isUnary() {
        return this == NOT || this == MINUS;
    }

    public boolean isComparison() {
        return this == EQ || this == NOT_EQ || this == LT || this == GT || this == LT_EQ || this == GT_EQ;
    }

    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
