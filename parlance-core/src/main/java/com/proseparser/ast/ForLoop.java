package com.proseparser.ast;

import java.util.List;
import java.util.Objects;

public record ForLoop(
    String itemName,
    Expression iterable,
    List<Statement> body
) implements Statement {

    public ForLoop {
        Names.requireName(itemName, "loop variable");
        Objects.requireNonNull(iterable, "iterable");
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "ForLoop";
    }
}
