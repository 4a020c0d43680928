package com.proseparser.ast;

import java.util.Objects;

public record BinaryOp(
    Expression left,
    Operator operator,
    Expression right
) implements Expression {

    public BinaryOp {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (operator == null || !operator.isBinary()) {
            throw new IllegalArgumentException("Not a binary operator: " + operator);
        }
    }

    @Override
    public String type() {
        return "BinaryOp";
    }
}
