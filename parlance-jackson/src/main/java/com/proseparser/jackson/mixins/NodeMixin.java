package com.proseparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.proseparser.ast.*;

/**
 * Polymorphic typing for the node hierarchy: each node object carries its class name in
 * a {@code "type"} member.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Program.class, name = "Program"),
    @JsonSubTypes.Type(value = VariableDeclaration.class, name = "VariableDeclaration"),
    @JsonSubTypes.Type(value = Assignment.class, name = "Assignment"),
    @JsonSubTypes.Type(value = ForLoop.class, name = "ForLoop"),
    @JsonSubTypes.Type(value = WhileLoop.class, name = "WhileLoop"),
    @JsonSubTypes.Type(value = RepeatLoop.class, name = "RepeatLoop"),
    @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = BinaryOp.class, name = "BinaryOp"),
    @JsonSubTypes.Type(value = UnaryOp.class, name = "UnaryOp"),
    @JsonSubTypes.Type(value = ListLiteral.class, name = "ListLiteral")
})
public abstract class NodeMixin {
}
