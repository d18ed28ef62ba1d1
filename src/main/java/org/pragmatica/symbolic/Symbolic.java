package org.pragmatica.symbolic;

import org.pragmatica.symbolic.lexer.Lexer;
import org.pragmatica.symbolic.lexer.Token;
import org.pragmatica.symbolic.parser.ExpressionParser;
import org.pragmatica.symbolic.parser.ParserConfig;
import org.pragmatica.symbolic.tree.Node;

import java.util.List;

/**
 * Entry point for turning expression text into trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var tree = Symbolic.parse("x^2 + sin(x)");
 *
 * tree.evaluate(Map.of("x", 2.0));     // 4.909...
 * tree.derivative("x").toString();     // "2*x + cos(x)"
 * }</pre>
 *
 * <p>All operations fail with {@link org.pragmatica.symbolic.error.ExpressionException}.
 */
public final class Symbolic {
    private Symbolic() {}

    public static List<Token> tokenize(String text) {
        return Lexer.tokenize(text, ParserConfig.DEFAULT);
    }

    public static List<Token> tokenize(String text, ParserConfig config) {
        return Lexer.tokenize(text, config);
    }

    public static Node parse(List<Token> tokens) {
        return ExpressionParser.parse(tokens, ParserConfig.DEFAULT);
    }

    public static Node parse(List<Token> tokens, ParserConfig config) {
        return ExpressionParser.parse(tokens, config);
    }

    /**
     * Tokenize and parse in one step.
     */
    public static Node parse(String text) {
        return parse(text, ParserConfig.DEFAULT);
    }

    public static Node parse(String text, ParserConfig config) {
        return ExpressionParser.parse(Lexer.tokenize(text, config), config);
    }
}
