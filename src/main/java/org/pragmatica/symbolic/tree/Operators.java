package org.pragmatica.symbolic.tree;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.Optional;

/**
 * Symbol lookup tables used by the classifier. Built once, never modified.
 */
public final class Operators {
    private static final ImmutableMap<String, Operator> BINARY = index(Operator.Category.BINARY);
    private static final ImmutableMap<String, Operator> PREFIX = index(Operator.Category.PREFIX);
    private static final ImmutableMap<String, Operator> FUNCTIONS = index(Operator.Category.FUNCTION);

    private Operators() {}

    public static Optional<Operator> binary(String symbol) {
        return Optional.ofNullable(BINARY.get(symbol));
    }

    public static Optional<Operator> prefix(String symbol) {
        return Optional.ofNullable(PREFIX.get(symbol));
    }

    public static Optional<Operator> function(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name));
    }

    private static ImmutableMap<String, Operator> index(Operator.Category category) {
        return Maps.uniqueIndex(Arrays.stream(Operator.values())
                                      .filter(operator -> operator.category() == category)
                                      .iterator(),
                                Operator::symbol);
    }
}
