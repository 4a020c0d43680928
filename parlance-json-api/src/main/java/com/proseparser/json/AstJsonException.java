package com.proseparser.json;

/**
 * Thrown when a tree or token list cannot be written to, or read back from, JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
