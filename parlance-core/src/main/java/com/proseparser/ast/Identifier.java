package com.proseparser.ast;

public record Identifier(String name) implements Expression {

    public Identifier {
        Names.requireName(name, "identifier");
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
