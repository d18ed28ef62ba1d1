package org.pragmatica.symbolic.parser;

import org.pragmatica.symbolic.error.ExpressionError;
import org.pragmatica.symbolic.error.ExpressionException;
import org.pragmatica.symbolic.lexer.Token;
import org.pragmatica.symbolic.tree.Node;
import org.pragmatica.symbolic.tree.Operators;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides what a token means given whether a left operand is already available. The order of
 * checks is what separates unary minus (no left operand yet) from subtraction.
 */
public final class Classifier {
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d*)?|\\.\\d+");
    private static final Pattern NAME = Pattern.compile("[A-Za-z]+");

    private Classifier() {}

    public static Primitive classify(Token token, boolean hasPreviousOperand) {
        return tryClassify(token, hasPreviousOperand)
            .orElseThrow(() -> new ExpressionException(new ExpressionError.UnrecognizedToken(token.text(),
                                                                                            token.position())));
    }

    /**
     * Same as {@link #classify} but reports an unrecognized token as empty.
     */
    public static Optional<Primitive> tryClassify(Token token, boolean hasPreviousOperand) {
        var text = token.text();

        if (NUMBER.matcher(text).matches()) {
            return parseNumber(text);
        }
        if (!hasPreviousOperand) {
            var prefix = Operators.prefix(text);
            if (prefix.isPresent()) {
                return prefix.<Primitive>map(Primitive.OperatorRef::new);
            }
        }
        var binary = Operators.binary(text);
        if (binary.isPresent()) {
            return binary.<Primitive>map(Primitive.OperatorRef::new);
        }
        if (hasPreviousOperand) {
            var prefix = Operators.prefix(text);
            if (prefix.isPresent()) {
                return prefix.<Primitive>map(Primitive.OperatorRef::new);
            }
        }
        if (NAME.matcher(text).matches()) {
            return Optional.of(Operators.function(text)
                                        .<Primitive>map(Primitive.OperatorRef::new)
                                        .orElseGet(() -> new Primitive.Reference(Node.Variable.of(text))));
        }
        return Optional.empty();
    }

    // Integers beyond the long range fall back to the nearest double; literals past the double
    // range have no finite value and are not numbers.
    private static Optional<Primitive> parseNumber(String text) {
        var value = parseValue(text);
        return Double.isFinite(value)
               ? Optional.of(new Primitive.Literal(Node.Number.of(value)))
               : Optional.empty();
    }

    private static double parseValue(String text) {
        if (text.indexOf('.') < 0) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return Double.parseDouble(text);
            }
        }
        return Double.parseDouble(text);
    }
}
