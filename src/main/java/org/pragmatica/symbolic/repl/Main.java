package org.pragmatica.symbolic.repl;

import org.pragmatica.symbolic.parser.ParserConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Command line launcher: {@code java -jar symbolic.jar [evaluate|differentiate|debug] [--strict]}.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) throws IOException {
        var mode = ReplMode.EVALUATE;
        var config = ParserConfig.DEFAULT;

        for (var arg : args) {
            if (arg.equals("--strict")) {
                config = config.withStrictLexing(true);
                continue;
            }
            var selected = ReplMode.byName(arg);
            if (selected.isEmpty()) {
                System.err.println("Unknown mode '" + arg + "', expected one of evaluate, differentiate, debug");
                System.exit(2);
            }
            mode = selected.get();
        }

        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new Repl(mode, config, in, System.out).run();
    }
}
