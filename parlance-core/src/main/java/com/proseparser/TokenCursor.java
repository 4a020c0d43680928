package com.proseparser;

import java.util.List;

/**
 * Read position over an immutable token list, shared by the statement parser,
 * the expression parser and the filler classifier of one compilation.
 *
 * <p>Speculative matching saves {@link #mark()} and rolls back with {@link #reset(int)}.
 * The list must end with an {@link TokenType#EOF} token, which is never consumed.</p>
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int current = 0;

    public TokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    public Token peek() {
        return tokens.get(current);
    }

    /**
     * @return the token {@code offset} places ahead, or the EOF token past the end
     */
    public Token peek(int offset) {
        int pos = current + offset;
        if (pos >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(pos);
    }

    /**
     * @return the token {@code offset} places behind the current one, or null before the start
     */
    public Token behind(int offset) {
        int pos = current - offset;
        return pos >= 0 ? tokens.get(pos) : null;
    }

    public Token previous() {
        return behind(1);
    }

    public Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    public boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    /**
     * True when the current token is a keyword or identifier spelling {@code word}.
     */
    public boolean checkWord(String word) {
        Token token = peek();
        return token.isWord() && token.is(word);
    }

    public boolean checkKeyword(String word) {
        return peek().isKeyword(word);
    }

    public boolean matchWord(String... words) {
        for (String word : words) {
            if (checkWord(word)) {
                advance();
                return true;
            }
        }
        return false;
    }

    public boolean matchKeyword(String... words) {
        for (String word : words) {
            if (checkKeyword(word)) {
                advance();
                return true;
            }
        }
        return false;
    }

    public boolean matchPunctuation(String symbol) {
        if (peek().isPunctuation(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * True when the current token ends a block: a paragraph break or end of input.
     */
    public boolean atBoundary() {
        TokenType type = peek().type();
        return type == TokenType.PARAGRAPH_BREAK || type == TokenType.EOF;
    }

    public int mark() {
        return current;
    }

    public void reset(int mark) {
        current = mark;
    }
}
