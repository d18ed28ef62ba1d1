package org.pragmatica.symbolic.parser;

import org.pragmatica.symbolic.error.ExpressionError;
import org.pragmatica.symbolic.error.ExpressionException;
import org.pragmatica.symbolic.lexer.Token;
import org.pragmatica.symbolic.tree.Node;
import org.pragmatica.symbolic.tree.Operator;

import java.util.List;

/**
 * Precedence-climbing parser.
 *
 * <p>Each call of {@link #parseAt} carries a limiting precedence: it keeps extending the current
 * node to the right while the next operator binds tighter than the limit, or binds equally and is
 * exclusively right-associative. Two operands with no operator between them ({@code 2x},
 * {@code (a)(b)}) are joined by an implicit multiplication.
 */
public final class ExpressionParser {
    private static final double LOWEST_PRECEDENCE = 0;

    private final List<Token> tokens;
    private final int maxDepth;
    private final int maxTreeDepth;
    private int depth;

    private ExpressionParser(List<Token> tokens, ParserConfig config) {
        this.tokens = List.copyOf(tokens);
        this.maxDepth = config.maxDepth();
        this.maxTreeDepth = config.maxTreeDepth();
        this.depth = 0;
    }

    public static Node parse(List<Token> tokens) {
        return parse(tokens, ParserConfig.DEFAULT);
    }

    public static Node parse(List<Token> tokens, ParserConfig config) {
        return new ExpressionParser(tokens, config).parseAll();
    }

    /**
     * Parsed node, the height of its tree and the index of the first unconsumed token.
     */
    private record Step(Node node, int height, int next) {}

    /**
     * Binary operator joining two operands. An implicit multiplication consumes no token, so its
     * right operand starts where the operator would have been.
     */
    private record Infix(Operator operator, int rightStart) {}

    private Node parseAll() {
        if (tokens.isEmpty()) {
            throw failure(new ExpressionError.UnexpectedEnd());
        }
        Step previous = null;
        int index = 0;
        while (index < tokens.size()) {
            previous = parseAt(index, LOWEST_PRECEDENCE, previous);
            index = previous.next();
        }
        return previous.node();
    }

    private Step parseAt(int index, double limit, Step previous) {
        if (++depth > maxDepth) {
            throw failure(new ExpressionError.NestingTooDeep(maxDepth));
        }
        try{
            return parseChain(index, limit, previous);
        } finally{
            depth-- ;
        }
    }

    // Left-chaining continues in a loop, so only real nesting counts towards the depth limit.
    private Step parseChain(int index, double limit, Step previous) {
        var step = parsePrimitive(index, previous);
        while (true) {
            var next = step.next();

            if (next >= tokens.size() || tokens.get(next).is(")")) {
                return step;
            }
            var infix = nextInfix(next);
            if (!extendsRight(infix.operator(), limit)) {
                return step;
            }
            step = parseBinary(infix, step);
        }
    }

    private static boolean extendsRight(Operator operator, double limit) {
        return operator.precedence() > limit
               || (operator.precedence() == limit && operator.exclusivelyRightAssociative());
    }

    private Step parsePrimitive(int index, Step previous) {
        if (index >= tokens.size()) {
            throw failure(new ExpressionError.UnexpectedEnd());
        }
        var token = tokens.get(index);

        if (token.is("(")) {
            var inner = parseAt(index + 1, LOWEST_PRECEDENCE, null);
            expectClosing(inner.next(), token);
            return new Step(inner.node(), inner.height(), inner.next() + 1);
        }
        if (token.is(")")) {
            throw failure(new ExpressionError.MismatchedParentheses(token.position()));
        }

        var primitive = Classifier.classify(token, previous != null);
        if (primitive instanceof Primitive.Literal literal) {
            return new Step(literal.node(), 1, index + 1);
        }
        if (primitive instanceof Primitive.Reference reference) {
            return new Step(reference.node(), 1, index + 1);
        }
        var operator = ((Primitive.OperatorRef) primitive).operator();
        return switch (operator.category()) {
            case FUNCTION -> parseCall(operator, token, index + 1);
            case PREFIX -> {
                var operand = parseAt(index + 1, operator.precedence(), null);
                yield apply(operator, operand.next(), operand);
            }
            case BINARY -> {
                if (previous == null) {
                    throw failure(new ExpressionError.MissingLeftOperand(operator.symbol(), token.position()));
                }
                yield parseBinary(new Infix(operator, index + 1), previous);
            }
        };
    }

    private Step parseBinary(Infix infix, Step left) {
        var right = parseAt(infix.rightStart(), infix.operator().precedence(), null);
        return apply(infix.operator(), right.next(), left, right);
    }

    private Step parseCall(Operator function, Token name, int index) {
        if (index >= tokens.size() || !tokens.get(index).is("(")) {
            throw failure(new ExpressionError.MissingCallParentheses(function.symbol(), name.position()));
        }
        var open = tokens.get(index);
        var argument = parseAt(index + 1, LOWEST_PRECEDENCE, null);
        expectClosing(argument.next(), open);
        return apply(function, argument.next() + 1, argument);
    }

    private void expectClosing(int index, Token open) {
        if (index >= tokens.size() || !tokens.get(index).is(")")) {
            throw failure(new ExpressionError.MismatchedParentheses(open.position()));
        }
    }

    /**
     * Operator that follows the node ending before {@code index}. Anything other than a binary
     * operator is read as an implicit {@code *} in front of it.
     */
    private Infix nextInfix(int index) {
        var token = tokens.get(index);
        if (!token.is("(")
            && Classifier.classify(token, true) instanceof Primitive.OperatorRef ref
            && ref.operator().category() == Operator.Category.BINARY) {
            return new Infix(ref.operator(), index + 1);
        }
        return new Infix(Operator.MULTIPLY, index);
    }

    // Flat chains such as 1+1+...+1 nest only through their left operand, so tree height is
    // bounded here rather than by the parser's own nesting.
    private Step apply(Operator operator, int next, Step... operands) {
        int height = 0;
        var children = new Node[operands.length];
        for (int i = 0; i < operands.length; i++) {
            height = Math.max(height, operands[i].height());
            children[i] = operands[i].node();
        }
        if (height + 1 > maxTreeDepth) {
            throw failure(new ExpressionError.NestingTooDeep(maxTreeDepth));
        }
        return new Step(Node.Operation.of(operator, children), height + 1, next);
    }

    private static ExpressionException failure(ExpressionError error) {
        return new ExpressionException(error);
    }
}
