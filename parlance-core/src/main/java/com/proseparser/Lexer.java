package com.proseparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits script text into tokens.
 *
 * <p>Whitespace is dropped except for runs holding two or more line breaks, which
 * become a single {@link TokenType#PARAGRAPH_BREAK}. {@code #} starts a comment
 * running to the end of the line. Every token records the 1-based line and column
 * of its first character, and the list always ends with {@link TokenType#EOF}.</p>
 */
public class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final int length;
    private int position = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char ch = peek();

            if (isSpace(ch)) {
                Token paragraphBreak = scanWhitespace();
                if (paragraphBreak != null) {
                    tokens.add(paragraphBreak);
                }
                continue;
            }

            if (ch == '#') {
                skipComment();
                continue;
            }

            int startLine = line;
            int startColumn = column;

            if (isDigit(ch)) {
                tokens.add(new Token(TokenType.NUMBER, scanNumber(), startLine, startColumn));
            } else if (ch == '"' || ch == '\'') {
                tokens.add(new Token(TokenType.STRING, scanString(startLine, startColumn), startLine, startColumn));
            } else if (Character.isLetter(ch) || ch == '_') {
                String word = scanWord();
                TokenType type = Keywords.isReserved(word.toLowerCase(Locale.ROOT))
                    ? TokenType.KEYWORD
                    : TokenType.IDENTIFIER;
                tokens.add(new Token(type, word, startLine, startColumn));
            } else if (isOperatorStart(ch)) {
                tokens.add(new Token(TokenType.OPERATOR, scanOperator(startLine, startColumn), startLine, startColumn));
            } else if (isPunctuation(ch)) {
                advance();
                tokens.add(new Token(TokenType.PUNCTUATION, String.valueOf(ch), startLine, startColumn));
            } else {
                throw new LexerException("Unexpected character '" + ch + "'", startLine, startColumn);
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, column));
        logger.debug("Tokenized {} characters into {} tokens", length, tokens.size());
        return tokens;
    }

    // Consumes a whitespace run; returns a paragraph break when the run spans a blank line
    private Token scanWhitespace() {
        int breakLine = 0;
        int breakColumn = 0;
        int newlines = 0;

        while (!isAtEnd() && isSpace(peek())) {
            if (peek() == '\n') {
                if (newlines == 0) {
                    breakLine = line;
                    breakColumn = column;
                }
                newlines++;
            }
            advance();
        }

        if (newlines >= 2) {
            return new Token(TokenType.PARAGRAPH_BREAK, "\n\n", breakLine, breakColumn);
        }
        return null;
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private String scanNumber() {
        int start = position;
        boolean seenDot = false;

        while (!isAtEnd()) {
            char ch = peek();
            if (isDigit(ch)) {
                advance();
            } else if (ch == '.' && !seenDot) {
                seenDot = true;
                advance();
            } else {
                break;
            }
        }
        return source.substring(start, position);
    }

    private String scanString(int startLine, int startColumn) {
        char quote = advance();
        StringBuilder value = new StringBuilder();

        while (!isAtEnd()) {
            char ch = advance();
            if (ch == quote) {
                return value.toString();
            }
            if (ch == '\\') {
                if (isAtEnd()) {
                    break;
                }
                value.append(advance());
            } else {
                value.append(ch);
            }
        }
        throw new LexerException("Unterminated string literal", startLine, startColumn);
    }

    // Letters, digits and underscores; an apostrophe between two letters belongs to the word (let's)
    private String scanWord() {
        int start = position;

        while (!isAtEnd()) {
            char ch = peek();
            if (Character.isLetterOrDigit(ch) || ch == '_') {
                advance();
            } else if (ch == '\'' && Character.isLetter(source.charAt(position - 1))
                       && position + 1 < length && Character.isLetter(source.charAt(position + 1))) {
                advance();
            } else {
                break;
            }
        }
        return source.substring(start, position);
    }

    private String scanOperator(int startLine, int startColumn) {
        char ch = peek();
        if (position + 1 < length) {
            String pair = source.substring(position, position + 2);
            if (pair.equals("==") || pair.equals("!=") || pair.equals("<=") || pair.equals(">=")) {
                advance();
                advance();
                return pair;
            }
        }
        if (ch == '!') {
            throw new LexerException("Unexpected character '!'", startLine, startColumn);
        }
        advance();
        return String.valueOf(ch);
    }

    // isWhitespace alone rejects no-break spaces (U+00A0, U+2007, U+202F)
    private static boolean isSpace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isOperatorStart(char ch) {
        return ch == '+' || ch == '-' || ch == '*' || ch == '/' || ch == '='
            || ch == '<' || ch == '>' || ch == '!';
    }

    private static boolean isPunctuation(char ch) {
        return ch == ',' || ch == '.' || ch == ';' || ch == ':'
            || ch == '(' || ch == ')' || ch == '[' || ch == ']' || ch == '{' || ch == '}';
    }

    private boolean isAtEnd() {
        return position >= length;
    }

    private char peek() {
        return source.charAt(position);
    }

    private char advance() {
        char ch = source.charAt(position++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return ch;
    }
}
