package com.proseparser;

/**
 * Thrown when the source text cannot be split into tokens.
 */
public class LexerException extends CompilationException {

    private final String reason;

    public LexerException(String reason, int line, int column) {
        super("Lexer error at line " + line + ", column " + column + ": " + reason, line, column);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
