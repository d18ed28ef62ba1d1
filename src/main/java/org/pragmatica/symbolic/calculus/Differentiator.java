package org.pragmatica.symbolic.calculus;

import org.pragmatica.symbolic.parser.ParserConfig;
import org.pragmatica.symbolic.simplify.Simplifier;
import org.pragmatica.symbolic.tree.Node;
import org.pragmatica.symbolic.tree.Operator;

import static org.pragmatica.symbolic.tree.Node.ONE;
import static org.pragmatica.symbolic.tree.Node.TWO;
import static org.pragmatica.symbolic.tree.Node.ZERO;

/**
 * Structural differentiation with respect to a single variable. Every rule's output is
 * simplified before it is returned, so derivatives of subtrees are already reduced when the
 * enclosing rule combines them.
 *
 * <p>{@code sign} has derivative 0 everywhere, including at its jump.
 */
public final class Differentiator {
    public static final Differentiator DEFAULT = create(ParserConfig.DEFAULT);

    private final ParserConfig config;
    private final Simplifier simplifier;

    private Differentiator(ParserConfig config) {
        this.config = config;
        this.simplifier = Simplifier.create(config);
    }

    public static Differentiator create(ParserConfig config) {
        return new Differentiator(config);
    }

    public Node derivative(Node node, String variable) {
        return derive(node, variable, 1);
    }

    private Node derive(Node node, String variable, int depth) {
        config.checkTreeDepth(depth);

        if (node instanceof Node.Number) {
            return ZERO;
        }
        if (node instanceof Node.Variable reference) {
            return reference.name().equals(variable) ? ONE : ZERO;
        }
        var operation = (Node.Operation) node;
        var x = operation.child(0);
        var dx = derive(x, variable, depth + 1);

        var result = operation.operator().category() == Operator.Category.BINARY
                     ? binaryRule(operation, dx, derive(operation.right(), variable, depth + 1), variable, depth)
                     : unaryRule(operation.operator(), x, dx);
        return simplifier.simplify(result);
    }

    private Node binaryRule(Node.Operation operation, Node dx, Node dy, String variable, int depth) {
        var x = operation.left();
        var y = operation.right();
        return switch (operation.operator()) {
            case ADD -> add(dx, dy);
            case SUBTRACT -> subtract(dx, dy);
            case MULTIPLY -> add(multiply(dx, y), multiply(dy, x));
            case DIVIDE -> divide(subtract(multiply(dx, y), multiply(dy, x)), power(y, TWO));
            case POWER -> powerRule(operation, dx, dy, variable, depth);
            default -> throw new IllegalStateException("Not a binary operator: " + operation.operator());
        };
    }

    // d(x^y) = x^y * (y'*ln(x) + x'*y/x); the two cheaper forms agree with it wherever it is defined.
    private Node powerRule(Node.Operation node, Node dx, Node dy, String variable, int depth) {
        var x = node.left();
        var y = node.right();
        if (!mentions(y, variable, depth + 1)) {
            return multiply(multiply(y, power(x, subtract(y, ONE))), dx);
        }
        if (!mentions(x, variable, depth + 1)) {
            return multiply(multiply(node, apply(Operator.LN, x)), dy);
        }
        return multiply(node, add(multiply(dy, apply(Operator.LN, x)), divide(multiply(dx, y), x)));
    }

    private static Node unaryRule(Operator operator, Node x, Node dx) {
        return switch (operator) {
            case NEGATE -> negate(dx);
            case SIN -> multiply(apply(Operator.COS, x), dx);
            case COS -> multiply(negate(apply(Operator.SIN, x)), dx);
            case TAN -> multiply(power(apply(Operator.SEC, x), TWO), dx);
            case SEC -> multiply(multiply(apply(Operator.SEC, x), apply(Operator.TAN, x)), dx);
            case COT -> multiply(negate(power(apply(Operator.CSC, x), TWO)), dx);
            case CSC -> multiply(multiply(negate(apply(Operator.CSC, x)), apply(Operator.COT, x)), dx);
            case LN -> divide(dx, x);
            case SQRT -> multiply(divide(ONE, multiply(TWO, apply(Operator.SQRT, x))), dx);
            case ABS -> multiply(apply(Operator.SIGN, x), dx);
            case SIGN -> ZERO;
            case ARCSIN -> multiply(divide(ONE, apply(Operator.SQRT, subtract(ONE, power(x, TWO)))), dx);
            default -> throw new IllegalStateException("Not a unary operator: " + operator);
        };
    }

    private boolean mentions(Node node, String variable, int depth) {
        config.checkTreeDepth(depth);

        if (node instanceof Node.Variable reference) {
            return reference.name().equals(variable);
        }
        for (var child : node.children()) {
            if (mentions(child, variable, depth + 1)) {
                return true;
            }
        }
        return false;
    }

    private static Node apply(Operator operator, Node... children) {
        return Node.Operation.of(operator, children);
    }

    private static Node add(Node x, Node y) {
        return apply(Operator.ADD, x, y);
    }

    private static Node subtract(Node x, Node y) {
        return apply(Operator.SUBTRACT, x, y);
    }

    private static Node multiply(Node x, Node y) {
        return apply(Operator.MULTIPLY, x, y);
    }

    private static Node divide(Node x, Node y) {
        return apply(Operator.DIVIDE, x, y);
    }

    private static Node power(Node x, Node y) {
        return apply(Operator.POWER, x, y);
    }

    private static Node negate(Node x) {
        return apply(Operator.NEGATE, x);
    }
}
