package com.exprtree.console;

import com.exprtree.ast.ASTNode;
import com.exprtree.ast.ExpressionException;
import com.exprtree.ast.NumberNode;
import com.exprtree.json.AstJsonCodec;
import com.exprtree.parser.Parser;
import com.exprtree.util.LoggingUtil;
import com.exprtree.util.ParserConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented front end: an interactive prompt, or a one-shot run over a list of
 * sample expressions. Each expression is parsed, evaluated and printed; errors are
 * reported and the session carries on.
 *
 * Usage: {@code ExpressionConsole [--config <file>] [--json] [--demo | --file <expressions.json>]}
 */
public class ExpressionConsole {

    static final List<String> DEMO_EXPRESSIONS = List.of(
            "10 + 5",
            "(1 + 2) * 3",
            "3 + 4 * 2 / (1 - 5) + 7",
            "(2 + 3) < (4 - 1)",
            "1.5 * 4 = 6",
            "10 / 0",
            "(1 + 2",
            "1 + $");

    private final ParserConfig config;
    private final PrintStream out;
    private final AstJsonCodec jsonCodec;

    public ExpressionConsole(ParserConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
        this.jsonCodec = new AstJsonCodec(config.isPrettyPrint());
    }

    public static void main(String[] args) {
        String configPath = null;
        String expressionsFile = null;
        boolean demo = false;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                    configPath = requireValue(args, ++i, "--config");
                    break;
                case "--file":
                    expressionsFile = requireValue(args, ++i, "--file");
                    break;
                case "--demo":
                    demo = true;
                    break;
                case "--json":
                    json = true;
                    break;
                default:
                    System.err.println("Unknown argument: " + args[i]);
                    System.err.println("Usage: ExpressionConsole [--config <file>] [--json] [--demo | --file <expressions.json>]");
                    System.exit(1);
            }
        }

        ParserConfig config = new ParserConfig();
        try {
            if (configPath != null) {
                config.loadFromFile(configPath);
            } else {
                config.loadFromResource("exprtree.json");
            }
        } catch (IOException e) {
            System.err.println("Failed to load configuration: " + e.getMessage());
            System.exit(2);
        }
        if (json) {
            config.setShowJson(true);
        }
        LoggingUtil.initialize(config);
        LoggingUtil.debug("Loaded " + config);

        ExpressionConsole console = new ExpressionConsole(config, System.out);
        try {
            if (expressionsFile != null) {
                console.runAll(loadExpressions(new File(expressionsFile)));
            } else if (demo) {
                console.runAll(DEMO_EXPRESSIONS);
            } else {
                console.runInteractive(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
            }
        } catch (IOException e) {
            LoggingUtil.error("Console terminated: " + e.getMessage(), e);
            System.exit(3);
        }
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            System.err.println("Missing value for " + flag);
            System.exit(1);
        }
        return args[index];
    }

    /**
     * Read lines until "exit" or end of input.
     */
    public void runInteractive(BufferedReader in) throws IOException {
        out.println("Arithmetic Expression Parser & Evaluator");
        out.println("Type an expression and press Enter (e.g., 3 + 4 * (2 - 1)).");
        out.println("Type 'exit' to quit.");
        out.println();

        String line;
        out.print(config.getPrompt());
        out.flush();
        while ((line = in.readLine()) != null) {
            String input = line.trim();
            if (input.equalsIgnoreCase("exit")) {
                break;
            }
            if (!input.isEmpty()) {
                evaluateLine(input);
            }
            out.print(config.getPrompt());
            out.flush();
        }

        out.println();
        out.println("Goodbye!");
    }

    /**
     * Evaluate each expression in turn, echoing it first.
     */
    public void runAll(List<String> expressions) {
        for (String expr : expressions) {
            out.println(config.getPrompt() + expr);
            evaluateLine(expr);
        }
    }

    /**
     * Parse, evaluate and print one expression.
     *
     * @return true if the expression evaluated, false if an error was reported
     */
    public boolean evaluateLine(String input) {
        try {
            ASTNode ast = Parser.parse(input);
            Object result = ast.evaluate();
            out.println("Result: " + formatResult(result));
            if (config.isShowAst()) {
                out.println("AST (print): " + ast.print());
            }
            if (config.isShowJson()) {
                out.println("AST (json): " + jsonCodec.toJson(ast));
            }
            return true;
        } catch (ExpressionException e) {
            out.println("Error: " + e.getMessage());
            LoggingUtil.debug("Rejected '" + input + "' (" + e.getKind() + ")");
            return false;
        } catch (IOException e) {
            out.println("Error: " + e.getMessage());
            LoggingUtil.warn("JSON rendering failed for '" + input + "'", e);
            return false;
        }
    }

    static String formatResult(Object result) {
        if (result instanceof Double d) {
            return NumberNode.format(d);
        }
        return String.valueOf(result);
    }

    /**
     * Load expressions from a JSON file holding either an array of strings
     * or an object with an "expressions" array.
     */
    static List<String> loadExpressions(File file) throws IOException {
        if (!file.exists()) {
            throw new IOException("Expressions file not found: " + file.getPath());
        }

        JsonNode root = new ObjectMapper().readTree(file);
        JsonNode list = root.isArray() ? root : root.path("expressions");
        if (!list.isArray()) {
            throw new IOException("Expected an array of expressions in " + file.getPath());
        }

        List<String> expressions = new ArrayList<>();
        for (JsonNode node : list) {
            expressions.add(node.asText());
        }
        return expressions;
    }
}
