package com.proseparser;

/**
 * Base class for every error that aborts a compilation. Carries the 1-based source
 * position the error was reported at. An error at end of input points just past the
 * last character; line and column are 0 only when no token was available.
 */
public abstract class CompilationException extends RuntimeException {

    private final int line;
    private final int column;

    protected CompilationException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
