package com.proseparser.ast;

import java.util.List;

public record ListLiteral(List<Expression> elements) implements Expression {

    public ListLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public String type() {
        return "ListLiteral";
    }
}
