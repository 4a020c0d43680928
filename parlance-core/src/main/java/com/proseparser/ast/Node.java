package com.proseparser.ast;

/**
 * Base interface for all syntax tree nodes
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression {

    String type();
}
