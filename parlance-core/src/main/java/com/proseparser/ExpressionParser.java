package com.proseparser;

import com.proseparser.ast.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Precedence-climbing expression parser. Each level accepts the symbolic operator
 * and its English spelling; all binary levels are left-associative.
 *
 * <pre>
 * expression     := logicalOr
 * logicalOr      := logicalAnd ( "or" logicalAnd )*
 * logicalAnd     := comparison ( "and" comparison )*
 * comparison     := additive ( compareOp additive )*
 * additive       := multiplicative ( addOp multiplicative )*
 * multiplicative := unary ( mulOp unary )*
 * unary          := ( "not" | "-" ) unary | primary
 * </pre>
 *
 * <p>{@code and}/{@code or} are left alone when the next word begins a new statement
 * or continues the narrative ("... and then declare ..."), so the caller sees them.</p>
 */
public final class ExpressionParser {

    /** Deepest nesting of parentheses, lists and prefix operators accepted. */
    public static final int MAX_NESTING_DEPTH = 100;

    private final TokenCursor cursor;
    private int depth = 0;

    public ExpressionParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    public Expression parseExpression() {
        Token token = cursor.peek();
        if (Keywords.isStatementKeyword(token)) {
            throw new UnexpectedTokenException(token, "expression",
                "Unexpected statement keyword '" + token.lexeme() + "' in expression");
        }
        return parseLogicalOr();
    }

    private Expression parseLogicalOr() {
        Expression left = parseLogicalAnd();

        while (cursor.checkKeyword("or") && !endsExpression(cursor.peek(1))) {
            cursor.advance();
            Expression right = parseLogicalAnd();
            left = new BinaryOp(left, Operator.OR, right);
        }
        return left;
    }

    private Expression parseLogicalAnd() {
        Expression left = parseComparison();

        while (cursor.checkKeyword("and") && !endsExpression(cursor.peek(1))) {
            cursor.advance();
            Expression right = parseComparison();
            left = new BinaryOp(left, Operator.AND, right);
        }
        return left;
    }

    // The word after and/or starts a statement or narrative continuation
    private static boolean endsExpression(Token next) {
        if (!next.isWord()) {
            return false;
        }
        String word = next.normalized();
        return Keywords.STATEMENT_KEYWORDS.contains(word) || Keywords.NARRATIVE_CONTINUATIONS.contains(word);
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();

        while (true) {
            Token token = cursor.peek();
            Operator op;

            if (token.isKeyword("is")) {
                int mark = cursor.mark();
                cursor.advance();
                op = verboseComparison(true);
                if (op == null) {
                    // "x is true", "x is now": not a comparison
                    cursor.reset(mark);
                    break;
                }
            } else if (token.type() == TokenType.KEYWORD) {
                op = verboseComparison(false);
                if (op == null) {
                    break;
                }
            } else if (token.type() == TokenType.OPERATOR && isComparisonSymbol(token.lexeme())) {
                cursor.advance();
                op = Operator.fromSymbol(token.lexeme());
            } else {
                break;
            }

            Expression right = parseAdditive();
            left = new BinaryOp(left, op, right);
        }
        return left;
    }

    /**
     * Consumes greater than / less than / equal [to] (and, after "is", not equal [to]).
     *
     * @return the operator, or null with nothing consumed when no verbose comparison starts here
     */
    private Operator verboseComparison(boolean afterIs) {
        Token token = cursor.peek();
        String context = afterIs ? "'is " + token.lexeme() + "'" : "'" + token.lexeme() + "'";

        if (token.isKeyword("greater")) {
            cursor.advance();
            expectKeyword("than", "Expected 'than' after " + context);
            return Operator.GT;
        }
        if (token.isKeyword("less")) {
            cursor.advance();
            expectKeyword("than", "Expected 'than' after " + context);
            return Operator.LT;
        }
        if (token.isKeyword("equal")) {
            cursor.advance();
            cursor.matchKeyword("to");
            return Operator.EQ;
        }
        if (afterIs && token.isKeyword("not") && cursor.peek(1).isKeyword("equal")) {
            cursor.advance();
            cursor.advance();
            cursor.matchKeyword("to");
            return Operator.NOT_EQ;
        }
        return null;
    }

    private static boolean isComparisonSymbol(String symbol) {
        return switch (symbol) {
            case "==", "!=", "<", ">", "<=", ">=" -> true;
            default -> false;
        };
    }

    private Expression parseAdditive() {
        Expression left = cursor.checkKeyword("add") || cursor.checkKeyword("subtract")
            ? parseVerbPhrase()
            : parseMultiplicative();

        while (true) {
            Token token = cursor.peek();
            Operator op;

            if (token.isKeyword("add")) {
                cursor.advance();
                cursor.matchKeyword("to");
                op = Operator.PLUS;
            } else if (token.isKeyword("plus")) {
                cursor.advance();
                op = Operator.PLUS;
            } else if (token.isKeyword("subtract")) {
                cursor.advance();
                cursor.matchWord("from");
                op = Operator.MINUS;
            } else if (token.isKeyword("minus")) {
                cursor.advance();
                op = Operator.MINUS;
            } else if (token.isOperator("+") || token.isOperator("-")) {
                cursor.advance();
                op = Operator.fromSymbol(token.lexeme());
            } else {
                break;
            }

            Expression right = parseMultiplicative();
            left = new BinaryOp(left, op, right);
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = cursor.checkKeyword("multiply") || cursor.checkKeyword("divide")
            ? parseVerbPhrase()
            : parseUnary();

        while (true) {
            Token token = cursor.peek();
            Operator op;

            if (token.isKeyword("multiply")) {
                cursor.advance();
                cursor.matchWord("by");
                op = Operator.STAR;
            } else if (token.isKeyword("times")) {
                cursor.advance();
                op = Operator.STAR;
            } else if (token.isKeyword("divide") || token.isKeyword("divided")) {
                cursor.advance();
                cursor.matchWord("by");
                op = Operator.SLASH;
            } else if (token.isOperator("*") || token.isOperator("/")) {
                cursor.advance();
                op = Operator.fromSymbol(token.lexeme());
            } else {
                break;
            }

            Expression right = parseUnary();
            left = new BinaryOp(left, op, right);
        }
        return left;
    }

    /**
     * add A to B, subtract A from B, multiply A by B, divide A by B. The tree keeps
     * token order: {@code BinaryOp(A, op, B)}.
     */
    private Expression parseVerbPhrase() {
        Token verb = cursor.advance();
        String word = verb.normalized();

        return switch (word) {
            case "add" -> {
                Expression first = parseMultiplicative();
                expectWord("to", "Expected 'to' after the operand of 'add'");
                yield new BinaryOp(first, Operator.PLUS, parseMultiplicative());
            }
            case "subtract" -> {
                Expression first = parseMultiplicative();
                expectWord("from", "Expected 'from' after the operand of 'subtract'");
                yield new BinaryOp(first, Operator.MINUS, parseMultiplicative());
            }
            case "multiply" -> {
                Expression first = parseUnary();
                expectWord("by", "Expected 'by' after the operand of 'multiply'");
                yield new BinaryOp(first, Operator.STAR, parseUnary());
            }
            case "divide" -> {
                Expression first = parseUnary();
                expectWord("by", "Expected 'by' after the operand of 'divide'");
                yield new BinaryOp(first, Operator.SLASH, parseUnary());
            }
            default -> throw new UnexpectedTokenException(verb, "expression");
        };
    }

    // every nested operand passes through here, so this is where depth is counted
    private Expression parseUnary() {
        depth++;
        try {
            if (depth > MAX_NESTING_DEPTH) {
                throw new ParseException("SyntaxError", cursor.peek(), null, "expression",
                    "Expression nested more than " + MAX_NESTING_DEPTH + " levels deep");
            }
            if (cursor.matchKeyword("not")) {
                return new UnaryOp(Operator.NOT, parseUnary());
            }
            if (cursor.peek().isOperator("-")) {
                cursor.advance();
                return new UnaryOp(Operator.MINUS, parseUnary());
            }
            return parsePrimary();
        } finally {
            depth--;
        }
    }

    /**
     * Literals, identifiers, list literals, parenthesised expressions, and keywords that
     * can stand for a name ({@code number}, {@code list}).
     */
    public Expression parsePrimary() {
        Token token = cursor.peek();

        if (token.type() == TokenType.EOF) {
            throw new ExpectedTokenException("Expected an expression", token);
        }
        if (Keywords.isStatementKeyword(token)) {
            throw new UnexpectedTokenException(token, "expression",
                "Unexpected statement keyword '" + token.lexeme() + "' in expression");
        }

        switch (token.type()) {
            case NUMBER:
                cursor.advance();
                return numberLiteral(token);
            case STRING:
                cursor.advance();
                return new Literal(token.lexeme());
            case IDENTIFIER:
                cursor.advance();
                return new Identifier(token.lexeme());
            case KEYWORD:
                if (token.is("true") || token.is("false")) {
                    cursor.advance();
                    return new Literal(token.is("true"));
                }
                if (Keywords.isBareIdentifierKeyword(token)) {
                    cursor.advance();
                    return new Identifier(token.lexeme());
                }
                break;
            case PUNCTUATION:
                if (token.isPunctuation("[")) {
                    return parseListLiteral();
                }
                if (token.isPunctuation("(")) {
                    cursor.advance();
                    Expression inner = parseExpression();
                    expectPunctuation(")", "Expected ')' after expression");
                    return inner;
                }
                break;
            default:
                break;
        }
        throw new UnexpectedTokenException(token, "expression",
            "Unexpected token in expression: " + ExpectedTokenException.describe(token));
    }

    private Expression parseListLiteral() {
        cursor.advance(); // consume '['

        List<Expression> elements = new ArrayList<>();
        if (cursor.matchPunctuation("]")) {
            return new ListLiteral(elements);
        }

        elements.add(parseExpression());
        while (cursor.matchPunctuation(",")) {
            elements.add(parseExpression());
        }
        expectPunctuation("]", "Expected ']' after list elements");
        return new ListLiteral(elements);
    }

    private static Literal numberLiteral(Token token) {
        String text = token.lexeme();
        if (text.indexOf('.') >= 0) {
            return new Literal(Double.parseDouble(text));
        }
        try {
            return new Literal(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return new Literal(new BigInteger(text));
        }
    }

    private void expectKeyword(String word, String message) {
        if (!cursor.matchKeyword(word)) {
            throw new ExpectedTokenException(message, cursor.peek());
        }
    }

    private void expectWord(String word, String message) {
        if (!cursor.matchWord(word)) {
            throw new ExpectedTokenException(message, cursor.peek());
        }
    }

    private void expectPunctuation(String symbol, String message) {
        if (!cursor.matchPunctuation(symbol)) {
            throw new ExpectedTokenException(message, cursor.peek());
        }
    }
}
