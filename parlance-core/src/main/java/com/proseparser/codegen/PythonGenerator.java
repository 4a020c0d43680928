package com.proseparser.codegen;

import com.proseparser.ast.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a program tree as Python source, one statement per line.
 *
 * <p>Operands are parenthesised only where Python's precedence would otherwise regroup
 * them. Comparisons nested in comparisons are always parenthesised, since Python would
 * chain {@code a < b < c} instead of comparing a boolean.</p>
 */
public class PythonGenerator {

    public static final String DEFAULT_INDENT = "    ";

    // Python binding strength, loosest first
    private static final int PREC_OR = 1;
    private static final int PREC_AND = 2;
    private static final int PREC_NOT = 3;
    private static final int PREC_COMPARISON = 4;
    private static final int PREC_ADDITIVE = 5;
    private static final int PREC_MULTIPLICATIVE = 6;
    private static final int PREC_NEGATE = 7;
    private static final int PREC_ATOM = 8;

    private final String indentUnit;

    public PythonGenerator() {
        this(DEFAULT_INDENT);
    }

    public PythonGenerator(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public String generate(Program program) {
        List<String> lines = new ArrayList<>();
        for (Statement statement : program.statements()) {
            emitStatement(statement, 0, lines);
        }
        return String.join("\n", lines);
    }

    private void emitStatement(Statement statement, int depth, List<String> lines) {
        String indent = indentUnit.repeat(depth);

        if (statement instanceof VariableDeclaration decl) {
            String hint = decl.varType() != null ? ": " + typeHint(decl.varType()) : "";
            lines.add(indent + decl.name() + hint + " = " + generateExpression(decl.value()));
        } else if (statement instanceof Assignment assign) {
            lines.add(indent + assign.name() + " = " + generateExpression(assign.value()));
        } else if (statement instanceof ForLoop loop) {
            lines.add(indent + "for " + loop.itemName() + " in " + generateExpression(loop.iterable()) + ":");
            emitBody(loop.body(), depth + 1, lines);
        } else if (statement instanceof WhileLoop loop) {
            lines.add(indent + "while " + generateExpression(loop.condition()) + ":");
            emitBody(loop.body(), depth + 1, lines);
        } else if (statement instanceof RepeatLoop loop) {
            lines.add(indent + "for _ in range(" + generateExpression(loop.count()) + "):");
            emitBody(loop.body(), depth + 1, lines);
        } else {
            throw new IllegalArgumentException("Unknown statement: " + statement.type());
        }
    }

    private void emitBody(List<Statement> body, int depth, List<String> lines) {
        if (body.isEmpty()) {
            lines.add(indentUnit.repeat(depth) + "pass");
            return;
        }
        for (Statement statement : body) {
            emitStatement(statement, depth, lines);
        }
    }

    public String generateExpression(Expression expression) {
        if (expression instanceof Literal literal) {
            return literal(literal.value());
        }
        if (expression instanceof Identifier identifier) {
            return identifier.name();
        }
        if (expression instanceof ListLiteral list) {
            List<String> elements = new ArrayList<>();
            for (Expression element : list.elements()) {
                elements.add(generateExpression(element));
            }
            return "[" + String.join(", ", elements) + "]";
        }
        if (expression instanceof UnaryOp unary) {
            int prec = precedence(unary);
            String operand = wrap(unary.operand(), precedence(unary.operand()) < prec);
            return unary.operator() == Operator.NOT ? "not " + operand : "-" + operand;
        }
        if (expression instanceof BinaryOp binary) {
            int prec = precedence(binary);
            boolean comparison = binary.operator().isComparison();

            int leftPrec = precedence(binary.left());
            boolean wrapLeft = leftPrec < prec || (comparison && leftPrec == prec);
            String left = wrap(binary.left(), wrapLeft);
            String right = wrap(binary.right(), precedence(binary.right()) <= prec);

            return left + " " + binary.operator().symbol() + " " + right;
        }
        throw new IllegalArgumentException("Unknown expression: " + expression.type());
    }

    private String wrap(Expression expression, boolean parenthesise) {
        String code = generateExpression(expression);
        return parenthesise ? "(" + code + ")" : code;
    }

    private static int precedence(Expression expression) {
        if (expression instanceof BinaryOp binary) {
            switch (binary.operator()) {
                case OR:
                    return PREC_OR;
                case AND:
                    return PREC_AND;
                case PLUS:
                case MINUS:
                    return PREC_ADDITIVE;
                case STAR:
                case SLASH:
                    return PREC_MULTIPLICATIVE;
                default:
                    return PREC_COMPARISON;
            }
        }
        if (expression instanceof UnaryOp unary) {
            return unary.operator() == Operator.NOT ? PREC_NOT : PREC_NEGATE;
        }
        return PREC_ATOM;
    }

    static String literal(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        if (value instanceof String text) {
            return pythonRepr(text);
        }
        if (value instanceof Double number) {
            return pythonFloat(number);
        }
        return value.toString();
    }

    private static String pythonFloat(double value) {
        if (Double.isNaN(value)) {
            return "float('nan')";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "float('inf')" : "-float('inf')";
        }
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }

    /**
     * Quotes a string the way Python's {@code repr} does.
     */
    static String pythonRepr(String text) {
        char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';

        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append(quote).toString();
    }

    public static String typeHint(TypeTag tag) {
        return switch (tag) {
            case INTEGER -> "int";
            case NUMBER -> "float";
            case STRING -> "str";
            case BOOLEAN -> "bool";
            case LIST -> "list";
        };
    }
}
