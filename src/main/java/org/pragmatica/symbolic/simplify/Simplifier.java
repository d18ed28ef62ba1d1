package org.pragmatica.symbolic.simplify;

import com.google.common.collect.ImmutableList;
import org.pragmatica.symbolic.eval.Evaluator;
import org.pragmatica.symbolic.parser.ParserConfig;
import org.pragmatica.symbolic.tree.Node;
import org.pragmatica.symbolic.tree.Operator;

import java.util.Optional;

import static org.pragmatica.symbolic.tree.Node.E;
import static org.pragmatica.symbolic.tree.Node.ONE;
import static org.pragmatica.symbolic.tree.Node.ZERO;

/**
 * Post-order algebraic rewriting. Children are simplified first; a node whose children are all
 * numbers is folded to a number, otherwise the identity rules of its operator are applied.
 * Identity checks are structural: {@code x/x} cancels, {@code x/(2*x/2)} does not. The result
 * is a fixed point, simplifying it again returns an equal tree.
 */
public final class Simplifier {
    public static final Simplifier DEFAULT = create(ParserConfig.DEFAULT);

    private final ParserConfig config;

    private Simplifier(ParserConfig config) {
        this.config = config;
    }

    public static Simplifier create(ParserConfig config) {
        return new Simplifier(config);
    }

    public Node simplify(Node node) {
        return simplify(node, 1);
    }

    private Node simplify(Node node, int depth) {
        config.checkTreeDepth(depth);

        if (!(node instanceof Node.Operation operation)) {
            return node;
        }
        var children = ImmutableList.<Node>builderWithExpectedSize(operation.children().size());
        boolean allNumbers = true;
        for (var child : operation.children()) {
            var simplified = simplify(child, depth + 1);
            allNumbers &= simplified instanceof Node.Number;
            children.add(simplified);
        }
        var simplified = new Node.Operation(operation.operator(), children.build());

        if (allNumbers) {
            // a fold that would leave the reals (1/0, ln(0), sqrt(-1)) keeps the node as written
            return fold(simplified).orElse(simplified);
        }
        return rewrite(simplified);
    }

    private static Optional<Node> fold(Node.Operation operation) {
        var arguments = operation.children()
                                 .stream()
                                 .mapToDouble(child -> ((Node.Number) child).value())
                                 .toArray();
        var value = Evaluator.apply(operation.operator(), arguments);
        return Double.isFinite(value)
               ? Optional.of(Node.Number.of(value))
               : Optional.empty();
    }

    private static Node rewrite(Node.Operation operation) {
        var x = operation.child(0);
        return switch (operation.operator()) {
            case ADD -> {
                var y = operation.right();
                if (ZERO.equals(x)) {
                    yield y;
                }
                yield ZERO.equals(y) ? x : operation;
            }
            case SUBTRACT -> {
                var y = operation.right();
                if (ZERO.equals(x)) {
                    yield rewrite(Node.Operation.of(Operator.NEGATE, y));
                }
                yield ZERO.equals(y) ? x : operation;
            }
            case MULTIPLY -> {
                var y = operation.right();
                if (ZERO.equals(x) || ZERO.equals(y)) {
                    yield ZERO;
                }
                if (ONE.equals(x)) {
                    yield y;
                }
                yield ONE.equals(y) ? x : operation;
            }
            case DIVIDE -> {
                var y = operation.right();
                if (ZERO.equals(x)) {
                    yield ZERO;
                }
                if (ONE.equals(y)) {
                    yield x;
                }
                yield x.equals(y) ? ONE : operation;
            }
            case POWER -> {
                var y = operation.right();
                if (ZERO.equals(x) && !ZERO.equals(y)) {
                    yield ZERO;
                }
                if (ZERO.equals(y) && !ZERO.equals(x)) {
                    yield ONE;
                }
                if (ONE.equals(x)) {
                    yield ONE;
                }
                yield ONE.equals(y) ? x : operation;
            }
            case LN -> {
                if (ONE.equals(x)) {
                    yield ZERO;
                }
                yield E.equals(x) ? ONE : operation;
            }
            case NEGATE -> {
                if (x instanceof Node.Operation inner && inner.operator() == Operator.NEGATE) {
                    yield inner.child(0);
                }
                yield ZERO.equals(x) ? ZERO : operation;
            }
            default -> operation;
        };
    }
}
