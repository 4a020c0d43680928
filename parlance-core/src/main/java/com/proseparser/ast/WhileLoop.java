package com.proseparser.ast;

import java.util.List;
import java.util.Objects;

public record WhileLoop(
    Expression condition,
    List<Statement> body
) implements Statement {

    public WhileLoop {
        Objects.requireNonNull(condition, "condition");
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "WhileLoop";
    }
}
