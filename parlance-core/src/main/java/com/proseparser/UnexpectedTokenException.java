package com.proseparser;

/**
 * A token appeared where the grammar does not allow it.
 */
public class UnexpectedTokenException extends ParseException {

    public UnexpectedTokenException(Token token, String context) {
        super("SyntaxError", token, null, context,
              "Unexpected " + ExpectedTokenException.describe(token) + " in " + context);
    }

    public UnexpectedTokenException(Token token, String context, String reason) {
        super("SyntaxError", token, null, context, reason);
    }
}
