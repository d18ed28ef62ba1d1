package org.pragmatica.symbolic.repl;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Optional;

/**
 * What a {@link Repl} does with each line it reads.
 */
public enum ReplMode {
    /** Print the value of the expression. */
    EVALUATE("evl> "),
    /** Print the derivative with respect to {@code x}. */
    DIFFERENTIATE("ddx> "),
    /** Print every intermediate form: tokens, tree, text, simplified, derivative. */
    DEBUG("> ");

    private static final ImmutableMap<String, ReplMode> ALIASES = ImmutableMap.of(
        "eval", EVALUATE,
        "evl", EVALUATE,
        "ddx", DIFFERENTIATE
    );

    private final String prompt;

    ReplMode(String prompt) {
        this.prompt = prompt;
    }

    public String prompt() {
        return prompt;
    }

    /**
     * Mode by its name or a short alias, ignoring case.
     */
    public static Optional<ReplMode> byName(String name) {
        var key = name.trim().toLowerCase(Locale.ROOT);
        if (ALIASES.containsKey(key)) {
            return Optional.of(ALIASES.get(key));
        }
        for (var mode : values()) {
            if (mode.name().toLowerCase(Locale.ROOT).equals(key)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
