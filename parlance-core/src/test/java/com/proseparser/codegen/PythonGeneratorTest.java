package com.proseparser.codegen;

import com.proseparser.ast.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PythonGeneratorTest {

    private final PythonGenerator generator = new PythonGenerator();

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    private static BinaryOp op(Expression left, Operator operator, Expression right) {
        return new BinaryOp(left, operator, right);
    }

    private String expr(Expression expression) {
        return generator.generateExpression(expression);
    }

    @Test
    void testDeclarations() {
        Program program = new Program(List.of(
            new VariableDeclaration("x", Literal.of(5)),
            new VariableDeclaration("name", Literal.of("Ada"), TypeTag.STRING),
            new VariableDeclaration("items", new ListLiteral(List.of()), TypeTag.LIST)));

        assertEquals("x = 5\nname: str = 'Ada'\nitems: list = []", generator.generate(program));
    }

    @Test
    void testTypeHints() {
        assertEquals("int", PythonGenerator.typeHint(TypeTag.INTEGER));
        assertEquals("float", PythonGenerator.typeHint(TypeTag.NUMBER));
        assertEquals("str", PythonGenerator.typeHint(TypeTag.STRING));
        assertEquals("bool", PythonGenerator.typeHint(TypeTag.BOOLEAN));
        assertEquals("list", PythonGenerator.typeHint(TypeTag.LIST));
    }

    @Test
    void testLoops() {
        Program program = new Program(List.of(
            new ForLoop("n", id("numbers"), List.of(
                new RepeatLoop(Literal.of(2), List.of(
                    new Assignment("total", op(id("total"), Operator.PLUS, id("n"))))))),
            new WhileLoop(op(id("total"), Operator.GT, Literal.of(0)), List.of(
                new Assignment("total", op(id("total"), Operator.MINUS, Literal.of(1)))))));

        String expected = String.join("\n",
            "for n in numbers:",
            "    for _ in range(2):",
            "        total = total + n",
            "while total > 0:",
            "    total = total - 1");
        assertEquals(expected, generator.generate(program));
    }

    @Test
    void testEmptyBodyEmitsPass() {
        Program program = new Program(List.of(new RepeatLoop(Literal.of(3), List.of())));
        assertEquals("for _ in range(3):\n    pass", generator.generate(program));
    }

    @Test
    void testCustomIndent() {
        Program program = new Program(List.of(
            new WhileLoop(Literal.of(true), List.of(new Assignment("x", Literal.of(1))))));
        assertEquals("while True:\n  x = 1", new PythonGenerator("  ").generate(program));
    }

    @Test
    void testEmptyProgram() {
        assertEquals("", generator.generate(new Program(List.of())));
    }

    @Test
    void testLiterals() {
        assertEquals("True", expr(Literal.of(true)));
        assertEquals("False", expr(Literal.of(false)));
        assertEquals("42", expr(Literal.of(42)));
        assertEquals("99999999999999999999", expr(new Literal(new BigInteger("99999999999999999999"))));
        assertEquals("5.0", expr(Literal.of(5.0)));
        assertEquals("2.5", expr(Literal.of(2.5)));
        assertEquals("100000000000000000000.0", expr(Literal.of(1e20)));
        assertEquals("0.00001", expr(Literal.of(0.00001)));
    }

    @Test
    void testStringQuoting() {
        assertEquals("'plain'", expr(Literal.of("plain")));
        assertEquals("\"it's\"", expr(Literal.of("it's")));
        assertEquals("'say \"hi\"'", expr(Literal.of("say \"hi\"")));
        assertEquals("'both \\' and \"'", expr(Literal.of("both ' and \"")));
        assertEquals("'a\\nb\\tc\\\\'", expr(Literal.of("a\nb\tc\\")));
    }

    @Test
    void testListsAndUnary() {
        assertEquals("[1, 'a', x]", expr(new ListLiteral(List.of(Literal.of(1), Literal.of("a"), id("x")))));
        assertEquals("not done", expr(new UnaryOp(Operator.NOT, id("done"))));
        assertEquals("-x", expr(new UnaryOp(Operator.MINUS, id("x"))));
    }

    @Test
    void testParenthesesFollowPythonPrecedence() {
        Expression sum = op(id("a"), Operator.PLUS, id("b"));

        assertEquals("a + b * c", expr(op(id("a"), Operator.PLUS, op(id("b"), Operator.STAR, id("c")))));
        assertEquals("(a + b) * c", expr(op(sum, Operator.STAR, id("c"))));
        assertEquals("a - (b - c)", expr(op(id("a"), Operator.MINUS, op(id("b"), Operator.MINUS, id("c")))));
        assertEquals("a - b - c", expr(op(op(id("a"), Operator.MINUS, id("b")), Operator.MINUS, id("c"))));
        assertEquals("-(a + b)", expr(new UnaryOp(Operator.MINUS, sum)));
        assertEquals("not (a or b)", expr(new UnaryOp(Operator.NOT, op(id("a"), Operator.OR, id("b")))));
        assertEquals("not a == b", expr(new UnaryOp(Operator.NOT, op(id("a"), Operator.EQ, id("b")))));
        assertEquals("(a or b) and c", expr(op(op(id("a"), Operator.OR, id("b")), Operator.AND, id("c"))));
        assertEquals("a + b > c", expr(op(sum, Operator.GT, id("c"))));
    }

    @Test
    void testNestedComparisonsAreParenthesised() {
        Expression lt = op(id("a"), Operator.LT, id("b"));

        assertEquals("(a < b) == c", expr(op(lt, Operator.EQ, id("c"))));
        assertEquals("c == (a < b)", expr(op(id("c"), Operator.EQ, lt)));
    }
}
