package org.pragmatica.symbolic.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.symbolic.calculus.Differentiator;
import org.pragmatica.symbolic.error.ExpressionError;
import org.pragmatica.symbolic.error.ExpressionException;
import org.pragmatica.symbolic.eval.Evaluator;
import org.pragmatica.symbolic.simplify.Simplifier;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Expression tree node. Nodes are immutable; equality is structural (same variant, same
 * operator or value, pairwise equal children in order) and says nothing about mathematical
 * equivalence.
 */
public sealed interface Node {
    Number ZERO = new Number(0);
    Number ONE = new Number(1);
    Number TWO = new Number(2);
    Variable E = new Variable("E");

    List<Node> children();

    default double evaluate() {
        return evaluate(Bindings.empty());
    }

    default double evaluate(Map<String, Double> bindings) {
        return evaluate(Bindings.of(bindings));
    }

    /**
     * Numeric value of this tree with the given variables bound.
     *
     * @throws ExpressionException with {@link ExpressionError.UnboundVariable} when a
     *                             variable is neither bound nor a built-in constant
     */
    default double evaluate(Bindings bindings) {
        return Evaluator.DEFAULT.evaluate(this, bindings);
    }

    /**
     * Simplified derivative of this tree with respect to {@code variable}.
     */
    default Node derivative(String variable) {
        return Differentiator.DEFAULT.derivative(this, variable);
    }

    default Node simplify() {
        return Simplifier.DEFAULT.simplify(this);
    }

    /**
     * Structural rendering, e.g. {@code Add([Number(2), Variable(x)])}.
     */
    default String describe() {
        return Printer.debug(this);
    }

    /**
     * Numeric literal. Negative zero is stored as zero.
     */
    record Number(double value) implements Node {
        public Number {
            if (value == 0.0) {
                value = 0.0;
            }
        }

        public static Number of(double value) {
            return new Number(value);
        }

        public boolean isNegative() {
            return value < 0;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return Printer.infix(this);
        }
    }

    record Variable(String name) implements Node {
        public Variable {
            checkNotNull(name, "name");
        }

        public static Variable of(String name) {
            return new Variable(name);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return Printer.infix(this);
        }
    }

    /**
     * Operator or function application. The child count is checked against the operator's
     * arity range on construction.
     */
    record Operation(Operator operator, List<Node> children) implements Node {
        public Operation {
            checkNotNull(operator, "operator");
            children = ImmutableList.copyOf(children);

            if (children.size() < operator.minArgs() || children.size() > operator.maxArgs()) {
                throw new ExpressionException(new ExpressionError.ArityMismatch(operator.symbol(),
                                                                                 operator.minArgs(),
                                                                                 operator.maxArgs(),
                                                                                 children.size()));
            }
        }

        public static Operation of(Operator operator, Node... children) {
            return new Operation(operator, List.of(children));
        }

        public Node child(int index) {
            return children.get(index);
        }

        public Node left() {
            return children.get(0);
        }

        public Node right() {
            return children.get(1);
        }

        // Child comparisons run directly, one stack frame per tree level.
        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Operation other) || operator != other.operator
                || children.size() != other.children.size()) {
                return false;
            }
            for (int i = 0; i < children.size(); i++) {
                if (!children.get(i).equals(other.children.get(i))) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public int hashCode() {
            int hash = operator.hashCode();
            for (var child : children) {
                hash = 31 * hash + child.hashCode();
            }
            return hash;
        }

        @Override
        public String toString() {
            return Printer.infix(this);
        }
    }
}
