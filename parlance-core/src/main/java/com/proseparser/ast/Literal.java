package com.proseparser.ast;

import java.math.BigInteger;

/**
 * A number, string or boolean constant.
 *
 * @param value a {@link Long} or {@link BigInteger} for integers, a {@link Double} for
 *              numbers written with a decimal point, a {@link String} or a {@link Boolean}
 */
public record Literal(Object value) implements Expression {

    public Literal {
        if (!(value instanceof Long || value instanceof BigInteger || value instanceof Double
              || value instanceof String || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported literal value: " + value);
        }
    }

    public static Literal of(long value) {
        return new Literal(value);
    }

    public static Literal of(double value) {
        return new Literal(value);
    }

    public static Literal of(String value) {
        return new Literal(value);
    }

    public static Literal of(boolean value) {
        return new Literal(value);
    }

    @Override
    public String type() {
        return "Literal";
    }
}
