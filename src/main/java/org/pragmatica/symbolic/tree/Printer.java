package org.pragmatica.symbolic.tree;

import org.pragmatica.symbolic.parser.ParserConfig;

import java.math.BigDecimal;

/**
 * Renders trees back to text. The infix form inserts only the parentheses the parser needs to
 * rebuild the same tree. Both forms refuse trees deeper than the configured tree depth.
 */
public final class Printer {
    private static final double ATOM = Double.POSITIVE_INFINITY;

    private final ParserConfig config;

    private Printer(ParserConfig config) {
        this.config = config;
    }

    public static String infix(Node node) {
        return infix(node, ParserConfig.DEFAULT);
    }

    public static String infix(Node node, ParserConfig config) {
        var sb = new StringBuilder();
        new Printer(config).appendInfix(sb, node, 1);
        return sb.toString();
    }

    public static String debug(Node node) {
        return debug(node, ParserConfig.DEFAULT);
    }

    public static String debug(Node node, ParserConfig config) {
        var sb = new StringBuilder();
        new Printer(config).appendDebug(sb, node, 1);
        return sb.toString();
    }

    /**
     * Plain decimal form without exponent or trailing zeros, so the lexer can read it back.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value)
                         .stripTrailingZeros()
                         .toPlainString();
    }

    private void appendDebug(StringBuilder sb, Node node, int depth) {
        config.checkTreeDepth(depth);

        if (node instanceof Node.Number number) {
            sb.append("Number(").append(formatNumber(number.value())).append(')');
        } else if (node instanceof Node.Variable variable) {
            sb.append("Variable(").append(variable.name()).append(')');
        } else {
            var operation = (Node.Operation) node;
            sb.append(operation.operator().displayName()).append("([");
            var children = operation.children();
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                appendDebug(sb, children.get(i), depth + 1);
            }
            sb.append("])");
        }
    }

    private void appendInfix(StringBuilder sb, Node node, int depth) {
        config.checkTreeDepth(depth);

        if (node instanceof Node.Number number) {
            sb.append(formatNumber(number.value()));
        } else if (node instanceof Node.Variable variable) {
            sb.append(variable.name());
        } else {
            appendOperation(sb, (Node.Operation) node, depth);
        }
    }

    private void appendOperation(StringBuilder sb, Node.Operation operation, int depth) {
        var operator = operation.operator();
        switch (operator.category()) {
            case FUNCTION -> {
                sb.append(operator.symbol()).append('(');
                appendInfix(sb, operation.child(0), depth + 1);
                sb.append(')');
            }
            case PREFIX -> {
                sb.append(operator.symbol());
                var operand = operation.child(0);
                appendChild(sb, operand, precedenceOf(operand) < operator.precedence(), depth + 1);
            }
            case BINARY -> {
                var left = operation.left();
                var right = operation.right();
                appendChild(sb, left, needsParentheses(operator, left, true), depth + 1);
                if (operator == Operator.ADD || operator == Operator.SUBTRACT) {
                    sb.append(' ').append(operator.symbol()).append(' ');
                } else {
                    sb.append(operator.symbol());
                }
                appendChild(sb, right, needsParentheses(operator, right, false), depth + 1);
            }
        }
    }

    private void appendChild(StringBuilder sb, Node child, boolean parenthesize, int depth) {
        if (parenthesize) {
            sb.append('(');
            appendInfix(sb, child, depth);
            sb.append(')');
        } else {
            appendInfix(sb, child, depth);
        }
    }

    // Equal precedence on the left regroups unless the parent chains leftwards; on the right
    // only an exclusively right-associative child chains without parentheses.
    private static boolean needsParentheses(Operator parent, Node child, boolean leftSide) {
        var childPrecedence = precedenceOf(child);
        if (childPrecedence != parent.precedence()) {
            return childPrecedence < parent.precedence();
        }
        if (leftSide) {
            return !parent.leftAssociative();
        }
        return !(child instanceof Node.Operation operation && operation.operator().exclusivelyRightAssociative());
    }

    private static double precedenceOf(Node node) {
        if (node instanceof Node.Operation operation && operation.operator().isOperator()) {
            return operation.operator().precedence();
        }
        if (node instanceof Node.Number number && number.isNegative()) {
            return Operator.NEGATE.precedence();
        }
        return ATOM;
    }
}
