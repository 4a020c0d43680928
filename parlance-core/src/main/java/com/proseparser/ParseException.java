package com.proseparser;

/**
 * Thrown once a construct has been committed to and its remaining tokens do not fit.
 */
public class ParseException extends CompilationException {

    private final String errorType;
    private final Token token;
    private final String expected;
    private final String context;
    private final String reason;

    public ParseException(String errorType, Token token, String expected, String context, String reason) {
        super(buildMessage(token, reason), token != null ? token.line() : 0, token != null ? token.column() : 0);
        this.errorType = errorType;
        this.token = token;
        this.expected = expected;
        this.context = context;
        this.reason = reason;
    }

    private static String buildMessage(Token token, String reason) {
        if (token == null || token.type() == TokenType.EOF) {
            return "Parser error at end of input: " + reason;
        }
        return "Parser error at line " + token.line() + ", column " + token.column() + ": " + reason;
    }

    public String getErrorType() {
        return errorType;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    public String getContext() {
        return context;
    }

    public String getReason() {
        return reason;
    }
}
