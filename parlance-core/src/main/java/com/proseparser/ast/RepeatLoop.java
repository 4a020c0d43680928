package com.proseparser.ast;

import java.util.List;
import java.util.Objects;

public record RepeatLoop(
    Expression count,
    List<Statement> body
) implements Statement {

    public RepeatLoop {
        Objects.requireNonNull(count, "count");
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "RepeatLoop";
    }
}
