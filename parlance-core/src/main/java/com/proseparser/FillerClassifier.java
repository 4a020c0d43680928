package com.proseparser;

import java.util.Set;

/**
 * Decides which tokens are narrative filler and skips them.
 *
 * <p>Words fall into three vocabularies. Statement starters begin a construct and
 * are never skipped (one exception: {@code while} in "a while loop"). Statement-internal
 * keywords are required parts of a construct and halt skipping except for the
 * {@code it} and {@code do} rules. Everything in the filler vocabulary, and every
 * longer word that begins with a filler word ("adding", "let's"), is skipped unless one
 * of the context rules in {@link #classify} claims it.</p>
 *
 * <p>The ambiguous words are resolved by looking at up to five neighbouring tokens:</p>
 * <table>
 *   <caption>Context rules</caption>
 *   <tr><th>word</th><th>structural when</th></tr>
 *   <tr><td>a</td><td>followed by variable/list/string/integer/number/boolean and not preceded by a
 *       preposition or filler word</td></tr>
 *   <tr><td>while</td><td>not followed by the identifier {@code loop}</td></tr>
 *   <tr><td>it</td><td>followed by {@code to} with {@code set} in the previous 5 tokens and no other
 *       statement starter in between</td></tr>
 *   <tr><td>each</td><td>directly preceded by {@code for}</td></tr>
 *   <tr><td>now</td><td>preceded by {@code is} within 3 tokens with no statement starter in between</td></tr>
 *   <tr><td>and</td><td>followed by {@code set}</td></tr>
 *   <tr><td>do</td><td>for/while/repeat/each in the previous 5 tokens</td></tr>
 *   <tr><td>to</td><td>no filler skipped yet in this run</td></tr>
 *   <tr><td>identifier</td><td>followed by an assignment marker (or {@code is now}); any other
 *       identifier is filler once skipping has started</td></tr>
 * </table>
 */
public final class FillerClassifier {

    public enum Decision {
        SKIP,
        HALT
    }

    /** Keywords that begin a statement. */
    static final Set<String> STATEMENT_STARTERS = Set.of(
        "declare", "create", "set", "for", "while", "repeat", "if", "else"
    );

    /** Keywords that form part of a recognised construct. */
    static final Set<String> STATEMENT_INTERNAL = Set.of(
        "variable", "named", "called", "as", "it", "or", "not", "in", "do", "true", "false",
        "times", "equals", "becomes", "become", "plus", "minus", "divided", "greater", "than",
        "less", "equal"
    );

    static final Set<String> FILLER = Set.of(
        "let", "me", "start", "by", "now", "first", "then", "next", "also", "we", "want", "need",
        "will", "can", "should", "shall", "must", "after", "before", "during", "finally", "later",
        "on", "once", "this", "that", "these", "those", "so", "which", "who", "what", "when",
        "where", "why", "how", "whether", "some", "any", "every", "all", "both", "either",
        "neither", "another", "other", "such", "same", "different", "new", "old", "last", "be",
        "our", "their", "my", "your", "his", "her", "its", "us", "them", "they", "he", "she", "it",
        "i", "make", "makes", "made", "point", "way", "thing", "things", "one", "ones", "here",
        "there", "up", "down", "out", "in", "off", "over", "under", "through", "the", "track",
        "something", "active", "greet", "user", "properly", "update", "and", "list", "contains",
        "numbers", "work", "with", "do", "of", "each", "calculate", "square", "adding", "result",
        "processing", "set", "counter", "increment", "time", "loop", "specific", "times",
        "iteration", "change", "demonstrates", "assignment", "number", "variable", "called",
        "perform", "calculations", "multiply", "together", "subtraction", "division", "compare",
        "values", "larger", "similarly", "check", "equality", "combine", "operations", "logical",
        "met", "build", "program", "calculates", "statistics", "from", "hold", "running", "sum",
        "iterate", "accumulate", "added", "add", "average", "mean", "value", "task", "count",
        "conditions", "reached", "threshold", "transformation", "use"
    );

    /** Words before {@code a} that make it an article even in front of a type word. */
    static final Set<String> PREPOSITIONS = Set.of(
        "from", "to", "with", "in", "on", "at", "for", "of", "by", "about", "into", "onto", "upon"
    );

    static final Set<String> TYPE_NOUNS = Set.of("variable", "list", "string", "integer", "number", "boolean");

    static final Set<String> LOOP_WORDS = Set.of("for", "while", "repeat", "each");

    private static final int SET_IT_LOOKBEHIND = 5;
    private static final int DO_LOOKBEHIND = 5;
    private static final int IS_NOW_LOOKBEHIND = 3;
    private static final int DECLARATION_LOOKAHEAD = 4;

    private final TokenCursor cursor;

    public FillerClassifier(TokenCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Advances past filler tokens. Never crosses a paragraph break or the end of input.
     *
     * @return whether anything was skipped
     */
    public boolean skip() {
        boolean skipping = false;
        while (!cursor.atBoundary() && classify(skipping) == Decision.SKIP) {
            cursor.advance();
            skipping = true;
        }
        return skipping;
    }

    /**
     * Classifies the current token.
     *
     * @param skipping whether earlier tokens of the same run were already skipped
     */
    public Decision classify(boolean skipping) {
        Token token = cursor.peek();

        if (token.type() == TokenType.PUNCTUATION) {
            return isSeparator(token) ? Decision.SKIP : Decision.HALT;
        }
        if (!token.isWord()) {
            return Decision.HALT;
        }

        String word = token.normalized();
        boolean keyword = token.type() == TokenType.KEYWORD;

        if (keyword && word.equals("a")) {
            return classifyArticle();
        }

        if (STATEMENT_STARTERS.contains(word)) {
            if (word.equals("while") && isIdentifier(cursor.peek(1), "loop")) {
                return Decision.SKIP;
            }
            return Decision.HALT;
        }

        if (token.type() == TokenType.IDENTIFIER && isDeclarationVerbForm(word) && declarationAhead()) {
            return Decision.HALT;
        }

        if (keyword && STATEMENT_INTERNAL.contains(word)) {
            if (word.equals("it")) {
                return isSetItTo() ? Decision.HALT : Decision.SKIP;
            }
            if (word.equals("do")) {
                return loopKeywordBehind() ? Decision.HALT : Decision.SKIP;
            }
            return Decision.HALT;
        }

        if (keyword && word.equals("each")) {
            Token previous = cursor.previous();
            return previous != null && previous.is("for") ? Decision.HALT : Decision.SKIP;
        }

        if (token.type() == TokenType.IDENTIFIER && startsAssignment()) {
            return Decision.HALT;
        }

        if (word.equals("now") && followsIs()) {
            return Decision.HALT;
        }
        if (word.equals("and") && cursor.peek(1).is("set")) {
            return Decision.HALT;
        }

        if (isFillerWord(word)) {
            return Decision.SKIP;
        }
        if (keyword && word.equals("to")) {
            return skipping ? Decision.SKIP : Decision.HALT;
        }
        if (skipping && token.type() == TokenType.IDENTIFIER) {
            Token next = cursor.peek(1);
            boolean marker = Keywords.ASSIGNMENT_MARKERS.contains(next.normalized()) || next.is("is");
            return marker ? Decision.HALT : Decision.SKIP;
        }
        return Decision.HALT;
    }

    /**
     * True for a filler word or a longer word built on one. Statement starters themselves are
     * never filler.
     */
    public static boolean isFillerWord(String word) {
        if (FILLER.contains(word)) {
            return true;
        }
        if (STATEMENT_STARTERS.contains(word)) {
            return false;
        }
        for (String base : FILLER) {
            if (word.length() > base.length() && word.startsWith(base)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDeclarationVerbForm(String word) {
        return !STATEMENT_STARTERS.contains(word) && Keywords.isDeclarationVerbForm(word);
    }

    // "declaring a new variable": a verb form only counts when "variable" follows closely
    private boolean declarationAhead() {
        for (int offset = 1; offset <= DECLARATION_LOOKAHEAD; offset++) {
            Token ahead = cursor.peek(offset);
            if (ahead.type() == TokenType.PARAGRAPH_BREAK || ahead.type() == TokenType.EOF) {
                return false;
            }
            if (ahead.isKeyword("variable")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSeparator(Token token) {
        String symbol = token.lexeme();
        return symbol.equals(",") || symbol.equals(".") || symbol.equals(";") || symbol.equals(":");
    }

    private static boolean isIdentifier(Token token, String word) {
        return token.type() == TokenType.IDENTIFIER && token.is(word);
    }

    // "a" before a type noun opens a declaration unless a preposition or filler word precedes it
    private Decision classifyArticle() {
        Token next = cursor.peek(1);
        if (next.isWord() && TYPE_NOUNS.contains(next.normalized()) && !precededByNarrative()) {
            return Decision.HALT;
        }
        return Decision.SKIP;
    }

    private boolean precededByNarrative() {
        Token previous = cursor.previous();
        if (previous == null || !previous.isWord()) {
            return false;
        }
        String word = previous.normalized();
        return PREPOSITIONS.contains(word) || FILLER.contains(word);
    }

    private boolean isSetItTo() {
        if (!cursor.peek(1).is("to")) {
            return false;
        }
        for (int offset = 1; offset <= SET_IT_LOOKBEHIND; offset++) {
            Token behind = cursor.behind(offset);
            if (behind == null) {
                break;
            }
            if (!behind.isWord()) {
                continue;
            }
            String word = behind.normalized();
            if (word.equals("set")) {
                return true;
            }
            if (STATEMENT_STARTERS.contains(word)) {
                return false;
            }
        }
        return false;
    }

    private boolean loopKeywordBehind() {
        for (int offset = 1; offset <= DO_LOOKBEHIND; offset++) {
            Token behind = cursor.behind(offset);
            if (behind == null) {
                break;
            }
            if (behind.isWord() && LOOP_WORDS.contains(behind.normalized())) {
                return true;
            }
        }
        return false;
    }

    private boolean followsIs() {
        for (int offset = 1; offset <= IS_NOW_LOOKBEHIND; offset++) {
            Token behind = cursor.behind(offset);
            if (behind == null) {
                break;
            }
            if (behind.is("is")) {
                return true;
            }
            if (behind.isWord() && STATEMENT_STARTERS.contains(behind.normalized())) {
                break;
            }
        }
        return false;
    }

    // x equals / x = / x becomes / x become / x is now
    private boolean startsAssignment() {
        Token next = cursor.peek(1);
        if (Keywords.ASSIGNMENT_MARKERS.contains(next.normalized())) {
            return true;
        }
        return next.is("is") && cursor.peek(2).is("now");
    }
}
