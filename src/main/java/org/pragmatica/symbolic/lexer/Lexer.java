package org.pragmatica.symbolic.lexer;

import org.pragmatica.symbolic.error.ExpressionError;
import org.pragmatica.symbolic.error.ExpressionException;
import org.pragmatica.symbolic.parser.ParserConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens. Recognized, in order: a number ({@code 12}, {@code 1.5},
 * {@code 1.}, {@code .5}), one of {@code ( ) + - / * ^}, or a run of ASCII letters. Whitespace
 * is dropped; other characters are dropped too unless lexing is strict.
 */
public final class Lexer {
    public static final int MAX_INPUT_SIZE = 1_000_000;
    private static final String SINGLE_CHARACTER_TOKENS = "()+-/*^";

    private final String input;
    private final boolean strict;
    private int pos;

    private Lexer(String input, boolean strict) {
        this.input = input;
        this.strict = strict;
        this.pos = 0;
    }

    public static List<Token> tokenize(String input) {
        return tokenize(input, ParserConfig.DEFAULT);
    }

    public static List<Token> tokenize(String input, ParserConfig config) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new ExpressionException(new ExpressionError.InputTooLarge(MAX_INPUT_SIZE));
        }
        return new Lexer(input, config.strictLexing()).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (!isAtEnd()) {
            char c = peek();
            if (isDigit(c) || (c == '.' && isDigitAt(pos + 1))) {
                tokens.add(scanNumber());
            } else if (SINGLE_CHARACTER_TOKENS.indexOf(c) >= 0) {
                tokens.add(Token.at(String.valueOf(c), pos));
                pos++ ;
            } else if (isLetter(c)) {
                tokens.add(scanName());
            } else {
                skipUnrecognized(c);
            }
        }
        return tokens;
    }

    private Token scanNumber() {
        int start = pos;
        while (!isAtEnd() && isDigit(peek())) {
            pos++ ;
        }
        if (!isAtEnd() && peek() == '.') {
            pos++ ;
            while (!isAtEnd() && isDigit(peek())) {
                pos++ ;
            }
        }
        return Token.at(input.substring(start, pos), start);
    }

    private Token scanName() {
        int start = pos;
        while (!isAtEnd() && isLetter(peek())) {
            pos++ ;
        }
        return Token.at(input.substring(start, pos), start);
    }

    private void skipUnrecognized(char c) {
        if (strict && !Character.isWhitespace(c)) {
            throw new ExpressionException(new ExpressionError.UnrecognizedCharacter(pos, c));
        }
        pos++ ;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isDigitAt(int index) {
        return index < input.length() && isDigit(input.charAt(index));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
