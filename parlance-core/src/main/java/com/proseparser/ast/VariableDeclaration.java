package com.proseparser.ast;

import java.util.Objects;

/**
 * {@code declare a variable named x [as a string] and set it to value}.
 *
 * @param varType the cosmetic type annotation, or null when none was written
 */
public record VariableDeclaration(
    String name,
    Expression value,
    TypeTag varType
) implements Statement {

    public VariableDeclaration {
        Names.requireName(name, "variable name");
        Objects.requireNonNull(value, "value");
    }

    public VariableDeclaration(String name, Expression value) {
        this(name, value, null);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
