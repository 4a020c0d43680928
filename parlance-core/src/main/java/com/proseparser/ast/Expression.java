package com.proseparser.ast;

public sealed interface Expression extends Node permits
    Literal,
    Identifier,
    BinaryOp,
    UnaryOp,
    ListLiteral {
}
