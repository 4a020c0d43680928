package com.proseparser.ast;

public sealed interface Statement extends Node permits
    VariableDeclaration,
    Assignment,
    ForLoop,
    WhileLoop,
    RepeatLoop {
}
