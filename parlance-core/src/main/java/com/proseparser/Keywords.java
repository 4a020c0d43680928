package com.proseparser;

import java.util.Set;

/**
 * Closed word lists shared by the lexer and the parsers. All entries are lower case.
 */
public final class Keywords {

    private Keywords() {
    }

    /** Words the lexer classifies as {@link TokenType#KEYWORD}. */
    public static final Set<String> RESERVED = Set.of(
        "declare", "variable", "named", "set", "it", "to", "and", "or", "not",
        "for", "each", "in", "do", "while", "is", "true", "false", "repeat",
        "times", "if", "then", "else", "add", "subtract", "multiply", "divide",
        "greater", "than", "less", "equal", "equals", "the", "a", "an", "of",
        "as", "type", "integer", "string", "number", "boolean", "list", "plus",
        "minus", "divided", "become", "becomes", "called", "create", "now"
    );

    /** Words that may never appear where an expression is expected. */
    public static final Set<String> STATEMENT_KEYWORDS = Set.of(
        "create", "declare", "set", "for", "while", "repeat", "if", "then", "else", "each"
    );

    /**
     * Words after {@code and}/{@code or} that mean the sentence moves on to a new
     * statement rather than continuing the boolean expression.
     */
    public static final Set<String> NARRATIVE_CONTINUATIONS = Set.of(
        "finally", "then", "next", "also", "so", "let", "us", "we",
        "create", "declare", "set", "for", "while", "repeat", "each"
    );

    /** Keywords that never stand in for an identifier inside an expression. */
    public static final Set<String> NON_OPERAND_KEYWORDS = Set.of(
        "true", "false", "and", "or", "not", "in", "is", "do", "to", "from", "by",
        "than", "equals", "plus", "minus", "times", "divided", "becomes", "called",
        "create", "now"
    );

    /** Markers that turn a preceding identifier into an assignment target. */
    public static final Set<String> ASSIGNMENT_MARKERS = Set.of("equals", "=", "becomes", "become");

    /** Verbs whose derived forms ("declaring", "creating") still introduce a declaration. */
    public static final Set<String> DECLARATION_VERBS = Set.of("declare", "create");

    public static boolean isReserved(String word) {
        return RESERVED.contains(word);
    }

    public static boolean isStatementKeyword(Token token) {
        return token.isWord() && STATEMENT_KEYWORDS.contains(token.normalized());
    }

    /**
     * True for a keyword that an expression or a name position may treat as a plain identifier
     * ({@code number}, {@code list}, {@code the}...).
     */
    public static boolean isBareIdentifierKeyword(Token token) {
        if (token.type() != TokenType.KEYWORD) {
            return false;
        }
        String word = token.normalized();
        return !NON_OPERAND_KEYWORDS.contains(word) && !STATEMENT_KEYWORDS.contains(word);
    }

    /**
     * True when the word is one of the declaration verbs or a longer word built on one.
     */
    public static boolean isDeclarationVerbForm(String word) {
        for (String verb : DECLARATION_VERBS) {
            if (word.startsWith(verb)) {
                return true;
            }
        }
        return false;
    }
}
