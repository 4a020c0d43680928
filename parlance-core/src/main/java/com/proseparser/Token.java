package com.proseparser;

import java.util.Locale;

/**
 * A classified slice of source text.
 *
 * @param type    the token class
 * @param lexeme  the source text with its original casing (string literals hold the unescaped contents)
 * @param line    1-based line of the first character
 * @param column  1-based column of the first character
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    /**
     * Case-insensitive comparison of the lexeme against a vocabulary word.
     */
    public boolean is(String word) {
        return lexeme.equalsIgnoreCase(word);
    }

    public boolean isWord() {
        return type == TokenType.KEYWORD || type == TokenType.IDENTIFIER;
    }

    public boolean isKeyword(String word) {
        return type == TokenType.KEYWORD && is(word);
    }

    public boolean isPunctuation(String symbol) {
        return type == TokenType.PUNCTUATION && lexeme.equals(symbol);
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && lexeme.equals(symbol);
    }

    public String normalized() {
        return lexeme.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' at " + line + ":" + column;
    }
}
