package org.pragmatica.symbolic.eval;

import org.pragmatica.symbolic.error.ExpressionError;
import org.pragmatica.symbolic.error.ExpressionException;
import org.pragmatica.symbolic.parser.ParserConfig;
import org.pragmatica.symbolic.tree.Bindings;
import org.pragmatica.symbolic.tree.Node;
import org.pragmatica.symbolic.tree.Operator;

/**
 * Post-order numeric reduction of a tree. Arithmetic follows IEEE doubles: division by zero
 * gives an infinity and out-of-domain function arguments give NaN.
 */
public final class Evaluator {
    public static final Evaluator DEFAULT = create(ParserConfig.DEFAULT);

    private final ParserConfig config;

    private Evaluator(ParserConfig config) {
        this.config = config;
    }

    public static Evaluator create(ParserConfig config) {
        return new Evaluator(config);
    }

    public double evaluate(Node node, Bindings bindings) {
        return evaluate(node, bindings, 1);
    }

    private double evaluate(Node node, Bindings bindings, int depth) {
        config.checkTreeDepth(depth);

        if (node instanceof Node.Number number) {
            return number.value();
        }
        if (node instanceof Node.Variable variable) {
            return bindings.lookup(variable.name())
                           .orElseThrow(() -> new ExpressionException(new ExpressionError.UnboundVariable(variable.name())));
        }
        var operation = (Node.Operation) node;
        var children = operation.children();
        var arguments = new double[children.size()];
        for (int i = 0; i < arguments.length; i++) {
            arguments[i] = evaluate(children.get(i), bindings, depth + 1);
        }
        return apply(operation.operator(), arguments);
    }

    /**
     * Numeric rule of a single operator applied to already evaluated arguments.
     */
    public static double apply(Operator operator, double... arguments) {
        var x = arguments[0];
        return switch (operator) {
            case ADD -> x + arguments[1];
            case SUBTRACT -> x - arguments[1];
            case MULTIPLY -> x * arguments[1];
            case DIVIDE -> x / arguments[1];
            case POWER -> Math.pow(x, arguments[1]);
            case NEGATE -> -x;
            case SIN -> Math.sin(x);
            case COS -> Math.cos(x);
            case TAN -> Math.tan(x);
            case SEC -> 1 / Math.cos(x);
            case COT -> 1 / Math.tan(x);
            case CSC -> 1 / Math.sin(x);
            case LN -> Math.log(x);
            case SQRT -> Math.sqrt(x);
            case ABS -> Math.abs(x);
            case SIGN -> Math.signum(x);
            case ARCSIN -> Math.asin(x);
        };
    }
}
