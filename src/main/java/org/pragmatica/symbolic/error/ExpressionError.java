package org.pragmatica.symbolic.error;

/**
 * Failure raised while tokenizing, parsing, constructing or evaluating an expression.
 * Positions are 0-based character offsets into the source text, or -1 when unknown.
 */
public sealed interface ExpressionError {
    String message();

    /**
     * Character that matches no token pattern (strict lexing only).
     */
    record UnrecognizedCharacter(int position, char character) implements ExpressionError {
        @Override
        public String message() {
            return "Unrecognized character '" + character + "'" + ExpressionError.at(position);
        }
    }

    /**
     * Node constructed with a child count outside its operator's range.
     */
    record ArityMismatch(String symbol, int min, int max, int actual) implements ExpressionError {
        @Override
        public String message() {
            return symbol + " expected between " + min + " and " + max + " arguments, got " + actual;
        }
    }

    /**
     * Missing or stray parenthesis.
     */
    record MismatchedParentheses(int position) implements ExpressionError {
        @Override
        public String message() {
            return "Mismatched parentheses" + ExpressionError.at(position);
        }
    }

    /**
     * Function name not followed by an opening parenthesis.
     */
    record MissingCallParentheses(String function, int position) implements ExpressionError {
        @Override
        public String message() {
            return "Call of '" + function + "' requires parentheses" + ExpressionError.at(position);
        }
    }

    /**
     * Binary operator with nothing on its left.
     */
    record MissingLeftOperand(String symbol, int position) implements ExpressionError {
        @Override
        public String message() {
            return "Binary operator '" + symbol + "' is missing its left operand" + ExpressionError.at(position);
        }
    }

    record UnrecognizedToken(String token, int position) implements ExpressionError {
        @Override
        public String message() {
            return "Unrecognized token '" + token + "'" + ExpressionError.at(position);
        }
    }

    /**
     * Input ended where an operand was expected.
     */
    record UnexpectedEnd() implements ExpressionError {
        @Override
        public String message() {
            return "Unexpected end of expression";
        }
    }

    /**
     * Source text longer than the lexer accepts.
     */
    record InputTooLarge(int limit) implements ExpressionError {
        @Override
        public String message() {
            return "Expression input exceeds maximum size of " + limit + " characters";
        }
    }

    record NestingTooDeep(int limit) implements ExpressionError {
        @Override
        public String message() {
            return "Expression nesting exceeds the limit of " + limit;
        }
    }

    record UnboundVariable(String name) implements ExpressionError {
        @Override
        public String message() {
            return "Cannot evaluate unbound variable '" + name + "'";
        }
    }

    private static String at(int position) {
        return position < 0
               ? ""
               : " at " + position;
    }
}
