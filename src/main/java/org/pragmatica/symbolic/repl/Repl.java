package org.pragmatica.symbolic.repl;

import org.pragmatica.symbolic.Symbolic;
import org.pragmatica.symbolic.calculus.Differentiator;
import org.pragmatica.symbolic.error.ExpressionException;
import org.pragmatica.symbolic.eval.Evaluator;
import org.pragmatica.symbolic.parser.ParserConfig;
import org.pragmatica.symbolic.simplify.Simplifier;
import org.pragmatica.symbolic.tree.Bindings;
import org.pragmatica.symbolic.tree.Printer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Line-oriented read-eval-print loop over the expression engine. A failing line is reported and
 * the loop moves on; {@code exit()} or end of input stops it.
 */
public final class Repl {
    public static final String EXIT_COMMAND = "exit()";
    public static final String DIFFERENTIATION_VARIABLE = "x";

    private final ReplMode mode;
    private final ParserConfig config;
    private final BufferedReader in;
    private final PrintStream out;
    private final Evaluator evaluator;
    private final Differentiator differentiator;
    private final Simplifier simplifier;

    public Repl(ReplMode mode, ParserConfig config, BufferedReader in, PrintStream out) {
        this.mode = mode;
        this.config = config;
        this.in = in;
        this.out = out;
        this.evaluator = Evaluator.create(config);
        this.differentiator = Differentiator.create(config);
        this.simplifier = Simplifier.create(config);
    }

    public void run() throws IOException {
        while (true) {
            out.print(mode.prompt());
            out.flush();

            var line = in.readLine();
            if (line == null || line.trim().equals(EXIT_COMMAND)) {
                return;
            }
            if (line.isBlank()) {
                continue;
            }
            try{
                handle(line);
            } catch (ExpressionException e) {
                out.println("error: " + e.error().message());
            }
        }
    }

    private void handle(String line) {
        var tokens = Symbolic.tokenize(line, config);
        switch (mode) {
            case EVALUATE -> {
                var tree = Symbolic.parse(tokens, config);
                out.println(">>> " + Printer.formatNumber(evaluator.evaluate(tree, Bindings.empty())));
            }
            case DIFFERENTIATE -> {
                var tree = Symbolic.parse(tokens, config);
                out.println(">>> " + Printer.infix(differentiator.derivative(tree, DIFFERENTIATION_VARIABLE), config));
            }
            case DEBUG -> {
                out.println("tok >> " + tokens);
                var tree = Symbolic.parse(tokens, config);
                out.println("prs >> " + Printer.debug(tree, config));
                out.println("str >> " + Printer.infix(tree, config));
                out.println("smp >> " + Printer.infix(simplifier.simplify(tree), config));
                out.println("ddx >> " + Printer.infix(differentiator.derivative(tree, DIFFERENTIATION_VARIABLE), config));
            }
        }
    }
}
