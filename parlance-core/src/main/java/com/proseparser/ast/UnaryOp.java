package com.proseparser.ast;

import java.util.Objects;

public record UnaryOp(
    Operator operator,
    Expression operand
) implements Expression {

    public UnaryOp {
        Objects.requireNonNull(operand, "operand");
        if (operator == null || !operator.isUnary()) {
            throw new IllegalArgumentException("Not a unary operator: " + operator);
        }
    }

    @Override
    public String type() {
        return "UnaryOp";
    }
}
