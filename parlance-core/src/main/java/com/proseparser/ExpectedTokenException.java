package com.proseparser;

/**
 * A required keyword or token is missing.
 */
public class ExpectedTokenException extends ParseException {

    public ExpectedTokenException(String message, Token token) {
        super("SyntaxError", token, message, null, message + ", got " + describe(token));
    }

    public ExpectedTokenException(String message, Token token, String context) {
        super("SyntaxError", token, message, context, message + " in " + context + ", got " + describe(token));
    }

    static String describe(Token token) {
        if (token == null || token.type() == TokenType.EOF) {
            return "end of input";
        }
        if (token.type() == TokenType.PARAGRAPH_BREAK) {
            return "paragraph break";
        }
        return "'" + token.lexeme() + "'";
    }
}
