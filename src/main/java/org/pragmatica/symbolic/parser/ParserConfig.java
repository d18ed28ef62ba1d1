package org.pragmatica.symbolic.parser;

import org.pragmatica.symbolic.error.ExpressionError;
import org.pragmatica.symbolic.error.ExpressionException;

/**
 * Limits and lexing options shared by the parser and the tree algorithms.
 *
 * @param maxDepth     deepest parenthesis/operand nesting the parser accepts
 * @param maxTreeDepth tallest tree the parser builds and the tree walks and printer accept
 * @param strictLexing reject characters that match no token pattern instead of skipping them
 */
public record ParserConfig(
    int maxDepth,
    int maxTreeDepth,
    boolean strictLexing
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        256,
        2048,
        false
    );

    public ParserConfig {
        if (maxDepth < 1 || maxTreeDepth < 1) {
            throw new IllegalArgumentException("Depth limits must be positive, got " + maxDepth + " and " + maxTreeDepth);
        }
    }

    public ParserConfig withMaxDepth(int maxDepth) {
        return new ParserConfig(maxDepth, maxTreeDepth, strictLexing);
    }

    public ParserConfig withMaxTreeDepth(int maxTreeDepth) {
        return new ParserConfig(maxDepth, maxTreeDepth, strictLexing);
    }

    public ParserConfig withStrictLexing(boolean strictLexing) {
        return new ParserConfig(maxDepth, maxTreeDepth, strictLexing);
    }

    /**
     * Fails once a tree walk goes deeper than {@link #maxTreeDepth}.
     */
    public void checkTreeDepth(int depth) {
        if (depth > maxTreeDepth) {
            throw new ExpressionException(new ExpressionError.NestingTooDeep(maxTreeDepth));
        }
    }
}
