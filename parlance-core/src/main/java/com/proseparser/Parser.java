package com.proseparser;

import com.proseparser.ast.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement-level parser. Recognises the fixed statement shapes by speculative keyword
 * matching with rollback, skipping narrative filler between the keywords.
 *
 * <p>A token that starts no recognised statement is discarded and parsing resumes at the
 * next one. Once a construct is committed (its leading keywords matched), anything
 * malformed inside it raises a {@link ParseException}.</p>
 *
 * <p>Loop bodies have no delimiter: a block runs until the next paragraph break or the
 * end of input, so a later loop in the same paragraph nests inside the earlier one.</p>
 */
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    /** Loop bodies nested deeper than this are rejected before the stack runs out. */
    public static final int MAX_BLOCK_DEPTH = 100;

    private final TokenCursor cursor;
    private final FillerClassifier filler;
    private final ExpressionParser expressions;
    private int blockDepth = 0;

    public Parser(String source) {
        this(Lexer.tokenize(source));
    }

    public Parser(List<Token> tokens) {
        this.cursor = new TokenCursor(tokens);
        this.filler = new FillerClassifier(cursor);
        this.expressions = new ExpressionParser(cursor);
    }

    public static Program parse(String source) {
        return new Parser(source).parse();
    }

    public Program parse() {
        List<Statement> statements = new ArrayList<>();

        while (!cursor.isAtEnd()) {
            skipParagraphBreaks();
            if (cursor.isAtEnd()) {
                break;
            }
            parseStatement().ifPresent(statements::add);
        }

        logger.debug("Parsed program with {} top-level statements", statements.size());
        return new Program(statements);
    }

    /**
     * Parses one statement at the current position.
     *
     * @return the statement, or empty when only filler remained before a boundary or the
     *         current token was discarded
     */
    public Optional<Statement> parseStatement() {
        do {
            filler.skip();
        } while (skipSetUpPrelude());

        if (cursor.atBoundary()) {
            return Optional.empty();
        }

        Token start = cursor.peek();

        Statement statement = tryDeclaration();
        if (statement == null && cursor.checkKeyword("set")) {
            statement = parseSetAssignment();
        }
        if (statement == null && matchSequence(false, "for", "each")) {
            statement = parseForLoop();
        }
        if (statement == null && cursor.checkKeyword("while")) {
            statement = parseWhileLoop();
        }
        if (statement == null && cursor.checkKeyword("repeat")) {
            statement = parseRepeatLoop();
        }
        if (statement == null && startsFluentAssignment()) {
            statement = parseFluentAssignment();
        }

        if (statement == null) {
            logger.debug("Discarding {}", start);
            cursor.advance();
            return Optional.empty();
        }

        logger.debug("Parsed {} at {}:{}", statement.type(), start.line(), start.column());
        return Optional.of(statement);
    }

    // ========================================================================
    // Statement forms
    // ========================================================================

    // "set up a counter" is narrative; "set x to ..." is an assignment
    private boolean skipSetUpPrelude() {
        if (!matchSequence(false, "set", "up")) {
            return false;
        }
        if (cursor.matchKeyword("a") && cursor.check(TokenType.IDENTIFIER)) {
            cursor.advance();
        }
        return true;
    }

    /**
     * (declare|create) [filler] [a] variable (named|called) NAME [as [a|an] TYPE]
     * (to EXPR | and set [it] to EXPR). Rolls back and returns null when the leading
     * words do not line up.
     */
    private VariableDeclaration tryDeclaration() {
        int mark = cursor.mark();

        if (!matchSequence(true, "declare") && !matchSequence(true, "create")) {
            return null;
        }
        filler.skip();
        cursor.matchKeyword("a");
        if (!cursor.matchKeyword("variable")) {
            cursor.reset(mark);
            return null;
        }

        if (!cursor.matchKeyword("named", "called")) {
            throw new ExpectedTokenException("Expected 'named' or 'called' after 'variable'",
                cursor.peek(), "variable declaration");
        }
        String name = expectName("Expected identifier for variable name");

        TypeTag varType = null;
        if (cursor.matchKeyword("as")) {
            cursor.matchKeyword("a", "an");
            Token typeToken = cursor.peek();
            varType = typeToken.type() == TokenType.KEYWORD ? TypeTag.fromKeyword(typeToken.normalized()) : null;
            if (varType == null) {
                throw new ExpectedTokenException("Expected a type (integer, number, string, boolean, list) after 'as'",
                    typeToken, "variable declaration");
            }
            cursor.advance();
        }

        filler.skip();
        if (cursor.matchKeyword("and")) {
            filler.skip();
        }
        if (cursor.matchKeyword("set")) {
            cursor.matchKeyword("it");
        }
        expectKeyword("to", "Expected 'to' before the initial value", "variable declaration");

        Expression value = expressions.parseExpression();
        return new VariableDeclaration(name, value, varType);
    }

    private Assignment parseSetAssignment() {
        cursor.advance(); // consume 'set'

        Token target = cursor.peek();
        if (target.type() != TokenType.IDENTIFIER && !target.isKeyword("it")
                && !Keywords.isBareIdentifierKeyword(target)) {
            throw new ExpectedTokenException("Expected identifier for variable name after 'set'", target, "assignment");
        }
        cursor.advance();

        expectKeyword("to", "Expected 'to' after '" + target.lexeme() + "'", "assignment");
        return new Assignment(target.lexeme(), expressions.parseExpression());
    }

    private boolean startsFluentAssignment() {
        if (!cursor.check(TokenType.IDENTIFIER)) {
            return false;
        }
        Token next = cursor.peek(1);
        if (Keywords.ASSIGNMENT_MARKERS.contains(next.normalized())) {
            return true;
        }
        return next.isKeyword("is") && cursor.peek(2).isKeyword("now");
    }

    /** x equals|=|becomes|become EXPR, or x is now EXPR. */
    private Assignment parseFluentAssignment() {
        Token name = cursor.advance();

        if (cursor.matchKeyword("is")) {
            expectKeyword("now", "Expected 'now' after 'is'", "assignment");
        } else {
            cursor.advance(); // assignment marker
        }
        return new Assignment(name.lexeme(), expressions.parseExpression());
    }

    // 'for each' already consumed
    private ForLoop parseForLoop() {
        String itemName = expectName("Expected identifier for loop variable");
        expectKeyword("in", "Expected 'in' after loop variable", "for each loop");
        Expression iterable = expressions.parseExpression();

        return new ForLoop(itemName, iterable, parseLoopBody());
    }

    private WhileLoop parseWhileLoop() {
        cursor.advance(); // while

        Expression condition = expressions.parseExpression();
        matchSequence(false, "is", "true");

        return new WhileLoop(condition, parseLoopBody());
    }

    private RepeatLoop parseRepeatLoop() {
        cursor.advance(); // repeat

        Expression count = expressions.parsePrimary();
        expectKeyword("times", "Expected 'times' after repeat count", "repeat loop");

        return new RepeatLoop(count, parseLoopBody());
    }

    // [,] [filler] [do] block
    private List<Statement> parseLoopBody() {
        cursor.matchPunctuation(",");
        filler.skip();
        cursor.matchKeyword("do");
        return parseBlock();
    }

    /**
     * Statements up to the next paragraph break or the end of input. A break directly after
     * the loop header leaves the body empty.
     */
    private List<Statement> parseBlock() {
        List<Statement> body = new ArrayList<>();

        blockDepth++;
        try {
            if (blockDepth > MAX_BLOCK_DEPTH) {
                throw new ParseException("SyntaxError", cursor.peek(), null, "loop body",
                    "Loops nested more than " + MAX_BLOCK_DEPTH + " deep");
            }
            while (!cursor.atBoundary()) {
                int before = cursor.mark();
                parseStatement().ifPresent(body::add);
                if (cursor.mark() == before) {
                    break;
                }
            }
        } finally {
            blockDepth--;
        }
        return body;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Speculatively matches an ordered word sequence. The first word may also match a
     * longer derived form ("declaring") when {@code allowVerbForm} is set and the word is a
     * declaration verb. Consumes the sequence on success, restores the cursor on failure.
     */
    private boolean matchSequence(boolean allowVerbForm, String... words) {
        int mark = cursor.mark();

        for (int i = 0; i < words.length; i++) {
            Token token = cursor.peek();
            if (token.isWord() && token.is(words[i])) {
                cursor.advance();
                continue;
            }
            if (i == 0 && allowVerbForm && isVerbForm(token, words[0])) {
                cursor.advance();
                continue;
            }
            cursor.reset(mark);
            return false;
        }
        return true;
    }

    private static boolean isVerbForm(Token token, String verb) {
        if (token.type() != TokenType.IDENTIFIER || !Keywords.DECLARATION_VERBS.contains(verb)) {
            return false;
        }
        String word = token.normalized();
        return word.length() > verb.length() && word.startsWith(verb);
    }

    private String expectName(String message) {
        Token token = cursor.peek();
        if (token.type() == TokenType.IDENTIFIER || Keywords.isBareIdentifierKeyword(token)) {
            cursor.advance();
            return token.lexeme();
        }
        throw new ExpectedTokenException(message, token);
    }

    private void expectKeyword(String word, String message, String context) {
        if (!cursor.matchKeyword(word)) {
            throw new ExpectedTokenException(message, cursor.peek(), context);
        }
    }

    private void skipParagraphBreaks() {
        while (cursor.check(TokenType.PARAGRAPH_BREAK)) {
            cursor.advance();
        }
    }
}
