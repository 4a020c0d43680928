package com.proseparser;

import com.proseparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loop bodies have no closing delimiter. A body runs to the next blank line or the end of
 * input, so every later statement of the same paragraph, loops included, lands inside it.
 */
public class BlockTerminationTest {

    private static Assignment set(String name, long value) {
        return new Assignment(name, Literal.of(value));
    }

    private static Assignment increment(String name, long by) {
        return new Assignment(name, new BinaryOp(new Identifier(name), Operator.PLUS, Literal.of(by)));
    }

    @Test
    void testBodyRunsToEndOfParagraph() {
        Program program = Parser.parse("repeat 2 times do set x to x plus 1 set y to 2");

        assertEquals(List.of(new RepeatLoop(Literal.of(2), List.of(increment("x", 1), set("y", 2)))),
            program.statements());
    }

    @Test
    void testParagraphBreakClosesBody() {
        Program program = Parser.parse("repeat 2 times do set x to x plus 1\n\nset y to 2");

        assertEquals(List.of(
            new RepeatLoop(Literal.of(2), List.of(increment("x", 1))),
            set("y", 2)), program.statements());
    }

    @Test
    void testSequentialLoopsInOneParagraphNest() {
        Program program = Parser.parse(
            "repeat 2 times do set a to 1 while a is less than 3 do set a to a plus 1");

        WhileLoop inner = new WhileLoop(
            new BinaryOp(new Identifier("a"), Operator.LT, Literal.of(3)),
            List.of(increment("a", 1)));
        assertEquals(List.of(new RepeatLoop(Literal.of(2), List.of(set("a", 1), inner))), program.statements());
    }

    @Test
    void testSequentialLoopsInSeparateParagraphs() {
        Program program = Parser.parse(
            "repeat 2 times do set a to 1\n\nwhile a is less than 3 do set a to a plus 1");

        assertEquals(2, program.statements().size());
        assertInstanceOf(RepeatLoop.class, program.statements().get(0));
        assertInstanceOf(WhileLoop.class, program.statements().get(1));
    }

    @Test
    void testNestedLoops() {
        Program program = Parser.parse("for each n in nums do repeat 2 times do set t to t plus n");

        Statement inner = new RepeatLoop(Literal.of(2), List.of(
            new Assignment("t", new BinaryOp(new Identifier("t"), Operator.PLUS, new Identifier("n")))));
        assertEquals(List.of(new ForLoop("n", new Identifier("nums"), List.of(inner))), program.statements());
    }

    @Test
    void testBlankLineAfterHeaderLeavesBodyEmpty() {
        Program program = Parser.parse("repeat 3 times\n\nset x to 1");

        assertEquals(List.of(new RepeatLoop(Literal.of(3), List.of()), set("x", 1)), program.statements());
    }

    @Test
    void testSingleNewlineDoesNotCloseBody() {
        Program program = Parser.parse("repeat 2 times do set x to 1\nset y to 2");

        assertEquals(1, program.statements().size());
        assertEquals(2, ((RepeatLoop) program.statements().get(0)).body().size());
    }

    @Test
    void testFillerBetweenBodyStatements() {
        Program program = Parser.parse("repeat 2 times, do set x to 1, and after that set y to 2");

        assertEquals(List.of(new RepeatLoop(Literal.of(2), List.of(set("x", 1), set("y", 2)))),
            program.statements());
    }
}
