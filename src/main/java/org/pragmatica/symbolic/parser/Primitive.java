package org.pragmatica.symbolic.parser;

import org.pragmatica.symbolic.tree.Node;
import org.pragmatica.symbolic.tree.Operator;

/**
 * Grammatical role the classifier assigns to a single token.
 */
public sealed interface Primitive {

    /**
     * Number literal, already converted to a leaf.
     */
    record Literal(Node.Number node) implements Primitive {}

    /**
     * Bare name that is not a function.
     */
    record Reference(Node.Variable node) implements Primitive {}

    /**
     * Prefix operator, binary operator or function name.
     */
    record OperatorRef(Operator operator) implements Primitive {}
}
