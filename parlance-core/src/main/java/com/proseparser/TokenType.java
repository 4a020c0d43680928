package com.proseparser;

public enum TokenType {
    KEYWORD,
    IDENTIFIER,
    NUMBER,
    STRING,
    OPERATOR,
    PUNCTUATION,
    PARAGRAPH_BREAK,
    EOF
}
