package org.pragmatica.symbolic.lexer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lexical token: a number literal, a name, or a single operator/parenthesis character.
 *
 * @param text     token text
 * @param position 0-based offset in the source, or -1 for synthesized tokens
 */
public record Token(String text, int position) {
    public static final int SYNTHETIC = -1;

    public Token {
        checkNotNull(text, "text");
    }

    public static Token of(String text) {
        return new Token(text, SYNTHETIC);
    }

    public static Token at(String text, int position) {
        return new Token(text, position);
    }

    public boolean is(String expected) {
        return text.equals(expected);
    }

    @Override
    public String toString() {
        return text;
    }
}
