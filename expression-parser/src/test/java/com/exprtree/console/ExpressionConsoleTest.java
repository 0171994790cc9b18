package com.exprtree.console;

import com.exprtree.util.ParserConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionConsoleTest {

    private ByteArrayOutputStream buffer;
    private ParserConfig config;

    @BeforeEach
    public void setup() {
        buffer = new ByteArrayOutputStream();
        config = new ParserConfig();
    }

    private ExpressionConsole console() {
        return new ExpressionConsole(config, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testEvaluateLine() {
        assertTrue(console().evaluateLine("10 + 5"));

        String out = output();
        assertTrue(out.contains("Result: 15"), out);
        assertTrue(out.contains("AST (print): (10 + 5)"), out);
        assertFalse(out.contains("AST (json)"), out);
    }

    @Test
    public void testErrorsAreReported() {
        assertFalse(console().evaluateLine("10 / 0"));
        assertTrue(output().contains("Error: Division by zero"));
    }

    @Test
    public void testInteractiveSessionContinuesAfterError() throws IOException {
        BufferedReader in = new BufferedReader(new StringReader("1 + $\n\n(2 + 3) < (4 - 1)\nEXIT\n10 + 5\n"));
        console().runInteractive(in);

        String out = output();
        assertTrue(out.contains("Error: Unexpected token '$' at position 2"), out);
        assertTrue(out.contains("Result: false"), out);
        assertTrue(out.contains("Goodbye!"), out);
        // nothing after exit is evaluated
        assertFalse(out.contains("Result: 15"), out);
    }

    @Test
    public void testInteractiveSessionEndsAtEndOfInput() throws IOException {
        config.setPrompt("calc> ");
        console().runInteractive(new BufferedReader(new StringReader("2 * 3")));

        String out = output();
        assertTrue(out.contains("calc> "), out);
        assertTrue(out.contains("Result: 6"), out);
        assertTrue(out.contains("Goodbye!"), out);
    }

    @Test
    public void testJsonOutput() {
        config.setShowJson(true);
        config.setShowAst(false);
        console().evaluateLine("1 + 2");

        String out = output();
        assertTrue(out.contains("Result: 3"), out);
        assertFalse(out.contains("AST (print)"), out);
        assertTrue(out.contains("AST (json): {\"type\":\"BinaryOperationNode\",\"operator\":\"+\""), out);
    }

    @Test
    public void testDemoRun() {
        console().runAll(ExpressionConsole.DEMO_EXPRESSIONS);

        String out = output();
        assertTrue(out.contains("Result: 8"), out);
        assertTrue(out.contains("Result: true"), out);
        assertTrue(out.contains("Error: Division by zero"), out);
        assertTrue(out.contains("Error: Invalid or mismatched parentheses"), out);
        assertTrue(out.contains("> 3 + 4 * 2 / (1 - 5) + 7"), out);
    }

    @Test
    public void testLoadExpressions() throws Exception {
        File file = new File(getClass().getClassLoader().getResource("config/expressions.json").toURI());
        List<String> expressions = ExpressionConsole.loadExpressions(file);

        assertEquals(List.of("10 + 5", "(2 + 3) < (4 - 1)", "10 / 0"), expressions);
    }

    @Test
    public void testLoadExpressionsMissingFile() {
        assertThrows(IOException.class, () -> ExpressionConsole.loadExpressions(new File("no/such/file.json")));
    }

    @Test
    public void testFormatResult() {
        assertEquals("15", ExpressionConsole.formatResult(15.0));
        assertEquals("-1.5", ExpressionConsole.formatResult(-1.5));
        assertEquals("true", ExpressionConsole.formatResult(true));
    }
}
