package com.proseparser;

import com.proseparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    private static Literal num(long value) {
        return Literal.of(value);
    }

    private static Statement single(String source) {
        Program program = Parser.parse(source);
        assertEquals(1, program.statements().size(), () -> "statements of: " + source + " -> " + program);
        return program.statements().get(0);
    }

    // ========== End-to-end scenarios ==========

    @Test
    void testDeclareAndSet() {
        assertEquals(new Program(List.of(new VariableDeclaration("x", num(5)))),
            Parser.parse("declare a variable named x and set it to 5"));
    }

    @Test
    void testFluentAssignmentAfterDeclaration() {
        Program program = Parser.parse("declare a variable named x and set it to 5\nx becomes 10");

        assertEquals(2, program.statements().size());
        assertEquals(new Assignment("x", num(10)), program.statements().get(1));
    }

    @Test
    void testForEachLoop() {
        Statement expected = new ForLoop("number",
            new ListLiteral(List.of(num(1), num(2), num(3))),
            List.of(new Assignment("total", new BinaryOp(id("total"), Operator.PLUS, id("number")))));

        assertEquals(expected, single("for each number in [1,2,3] do set total to total plus number"));
    }

    @Test
    void testRepeatLoop() {
        Statement expected = new RepeatLoop(num(3),
            List.of(new Assignment("counter", new BinaryOp(id("counter"), Operator.PLUS, num(1)))));

        assertEquals(expected, single("repeat 3 times do set counter to counter plus 1"));
    }

    @Test
    void testWhileLoop() {
        Statement expected = new WhileLoop(new BinaryOp(id("count"), Operator.LT, num(10)),
            List.of(new Assignment("count", new BinaryOp(id("count"), Operator.PLUS, num(1)))));

        assertEquals(expected, single("while count is less than 10 do set count to count plus 1"));
    }

    // ========== Filler handling ==========

    @Test
    @DisplayName("Narrative filler does not change the tree")
    void testFillerInvariance() {
        Program plain = Parser.parse("declare a variable named x and set it to 5");

        assertEquals(plain, Parser.parse("let's now declare a variable named x and finally set it to 5"));
        assertEquals(plain, Parser.parse("First, we declare a variable named x and then set it to 5"));
        assertEquals(plain, Parser.parse("So let us declare a new variable named x, and set it to 5"));
    }

    @Test
    void testWhileLoopNarrativeIsNotALoop() {
        assertEquals(new Program(List.of()), Parser.parse("use a while loop to count"));
    }

    @Test
    void testWhileLoopAfterNarrative() {
        Statement expected = new WhileLoop(id("x"), List.of(new Assignment("x", Literal.of(false))));

        assertEquals(expected, single("We use a while loop. while x is true do set x to false"));
    }

    @Test
    void testOnlyFillerGivesEmptyProgram() {
        assertTrue(Parser.parse("this is just some narrative with nothing to do").statements().isEmpty());
    }

    @Test
    void testUnrecognisedTokensAreDiscarded() {
        assertTrue(Parser.parse("x y z + ( ] 42").statements().isEmpty());
        assertEquals(new Assignment("x", num(1)), single("zebra stripes ) set x to 1"));
    }

    @Test
    void testDeterministic() {
        String source = "Create a variable called total as an integer and set it to 0\n"
            + "for each n in [1, 2] do total becomes total plus n";
        assertEquals(Parser.parse(source), Parser.parse(source));
    }

    // ========== Declarations ==========

    @Test
    void testCreateCalledWithType() {
        assertEquals(new VariableDeclaration("greeting", Literal.of("Hello"), TypeTag.STRING),
            single("create a variable called greeting as a string and set it to \"Hello\""));
    }

    @Test
    void testDeclarationWithDirectTo() {
        assertEquals(new VariableDeclaration("x", num(5)), single("declare a variable named x to 5"));
    }

    @Test
    void testDeclarationVerbForm() {
        assertEquals(new VariableDeclaration("total", num(0), TypeTag.INTEGER),
            single("Let's start by declaring a variable named total as an integer and set it to 0"));
    }

    @Test
    void testDeclarationWithoutArticle() {
        assertEquals(new VariableDeclaration("flag", Literal.of(true)),
            single("declare variable named flag and set it to true"));
    }

    @Test
    void testKeywordAsVariableName() {
        assertEquals(new VariableDeclaration("list", new ListLiteral(List.of())),
            single("declare a variable named list and set it to []"));
    }

    @Test
    void testTrailingDotMakesFloat() {
        assertEquals(new VariableDeclaration("x", Literal.of(5.0)),
            single("declare a variable named x and set it to 5."));
    }

    @Test
    void testDeclareWithoutVariableIsNotADeclaration() {
        // "declare" is dropped, then the rest is narrative
        assertTrue(Parser.parse("declare victory").statements().isEmpty());
    }

    // ========== Assignments ==========

    @Test
    void testSetIt() {
        assertEquals(new Assignment("it", num(5)), single("set it to 5"));
    }

    @Test
    void testFluentForms() {
        assertEquals(new Assignment("x", num(3)), single("x = 3"));
        assertEquals(new Assignment("x", num(3)), single("x equals 3"));
        assertEquals(new Assignment("x", num(3)), single("x become 3"));
        assertEquals(new Assignment("x", num(3)), single("x is now 3"));
    }

    @Test
    void testSetUpPreludeIsSkipped() {
        assertEquals(new Assignment("counter", num(0)), single("Set up a counter, then set counter to 0"));
    }

    @Test
    void testConsecutiveSetUpPreludes() {
        assertEquals(new Assignment("counter", num(0)),
            single("Set up a counter, set up a total, then set counter to 0"));
    }

    @Test
    void testStatementsInOneParagraph() {
        Program program = Parser.parse("set a to 1 set b to a plus 1. Then c is now b");

        assertEquals(List.of(
            new Assignment("a", num(1)),
            new Assignment("b", new BinaryOp(id("a"), Operator.PLUS, num(1))),
            new Assignment("c", id("b"))), program.statements());
    }

    @Test
    void testAndThenEndsExpression() {
        Program program = Parser.parse("set done to x and then set y to 2");

        assertEquals(List.of(new Assignment("done", id("x")), new Assignment("y", num(2))), program.statements());
    }

    // ========== Errors ==========

    @Test
    void testMissingNamedIsHardError() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parse("declare a variable x to 5"));

        assertEquals(1, e.getLine());
        assertEquals(20, e.getColumn());
        assertTrue(e.getMessage().startsWith("Parser error at line 1, column 20: Expected 'named' or 'called'"),
            e.getMessage());
        assertEquals("SyntaxError", e.getErrorType());
        assertEquals("x", e.getToken().lexeme());
        assertEquals("Expected 'named' or 'called' after 'variable'", e.getExpected());
        assertEquals("variable declaration", e.getContext());
    }

    @Test
    void testMissingNameAtEndOfInput() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("declare a variable named"));
        assertTrue(e.getMessage().startsWith("Parser error at end of input"), e.getMessage());
    }

    @Test
    void testBadTypeName() {
        assertThrows(ExpectedTokenException.class,
            () -> Parser.parse("declare a variable named x as a widget and set it to 1"));
    }

    @Test
    void testStatementKeywordInExpression() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class,
            () -> Parser.parse("set x to repeat"));
        assertTrue(e.getMessage().contains("Unexpected statement keyword 'repeat'"), e.getMessage());
        assertEquals("repeat", e.getToken().lexeme());
        assertEquals("expression", e.getContext());
        assertNull(e.getExpected());
    }

    @Test
    void testMissingThan() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parse("set x to y is greater 5"));
        assertTrue(e.getMessage().contains("Expected 'than'"), e.getMessage());
    }

    @Test
    void testMissingValueReportsEndPosition() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> Parser.parse("set x to"));

        // end of input points just past the last character
        assertEquals(TokenType.EOF, e.getToken().type());
        assertEquals(1, e.getLine());
        assertEquals(9, e.getColumn());
        assertEquals("Expected an expression", e.getExpected());
        assertTrue(e.getMessage().startsWith("Parser error at end of input"), e.getMessage());
    }

    @Test
    void testSetWithoutTo() {
        assertThrows(ExpectedTokenException.class, () -> Parser.parse("set x 5"));
    }

    @Test
    void testRepeatWithoutTimes() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parse("repeat 3 do set x to 1"));
        assertEquals("repeat loop", e.getContext());
        assertEquals("do", e.getToken().lexeme());
    }

    @Test
    void testForEachWithoutIn() {
        assertThrows(ExpectedTokenException.class, () -> Parser.parse("for each n of numbers do set x to n"));
    }

    @Test
    void testLoopNestingIsBounded() {
        String nested = "repeat 2 times do ".repeat(Parser.MAX_BLOCK_DEPTH) + "set x to 1";
        assertEquals(1, Parser.parse(nested).statements().size());

        ParseException e = assertThrows(ParseException.class,
            () -> Parser.parse("repeat 2 times do ".repeat(3000) + "set x to 1"));
        assertEquals("loop body", e.getContext());
        assertTrue(e.getMessage().contains("nested more than " + Parser.MAX_BLOCK_DEPTH), e.getMessage());
    }

    @Test
    void testExpressionNestingIsBounded() {
        int limit = ExpressionParser.MAX_NESTING_DEPTH;
        assertEquals(new Assignment("x", num(1)),
            single("set x to " + "(".repeat(limit - 1) + "1" + ")".repeat(limit - 1)));

        ParseException parens = assertThrows(ParseException.class,
            () -> Parser.parse("set x to " + "(".repeat(3000) + "1" + ")".repeat(3000)));
        assertEquals("expression", parens.getContext());

        assertThrows(ParseException.class, () -> Parser.parse("set x to " + "not ".repeat(3000) + "done"));
        assertThrows(ParseException.class, () -> Parser.parse("set x to " + "[".repeat(3000)));
    }

    @Test
    void testLexerErrorsSurfaceFromParse() {
        assertThrows(LexerException.class, () -> Parser.parse("set x to \"open"));
    }
}
