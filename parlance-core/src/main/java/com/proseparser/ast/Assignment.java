package com.proseparser.ast;

import java.util.Objects;

public record Assignment(
    String name,
    Expression value
) implements Statement {

    public Assignment {
        Names.requireName(name, "assignment target");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String type() {
        return "Assignment";
    }
}
