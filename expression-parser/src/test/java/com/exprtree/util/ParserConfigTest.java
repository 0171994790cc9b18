package com.exprtree.util;

import org.junit.jupiter.api.Test;

import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

public class ParserConfigTest {

    private static String resourcePath(String name) throws Exception {
        return new File(ParserConfigTest.class.getClassLoader().getResource(name).toURI()).getPath();
    }

    @Test
    public void testDefaults() {
        ParserConfig config = new ParserConfig();

        assertEquals("INFO", config.getLoggingLevel());
        assertTrue(config.isConsoleLoggingEnabled());
        assertFalse(config.isFileLoggingEnabled());
        assertEquals(ParserConfig.DEFAULT_LOG_FILE, config.getLogFileName());
        assertEquals("> ", config.getPrompt());
        assertTrue(config.isShowAst());
        assertFalse(config.isShowJson());
        assertFalse(config.isPrettyPrint());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        ParserConfig config = new ParserConfig(resourcePath("config/test_config.json"));

        assertEquals("DEBUG", config.getLoggingLevel());
        assertFalse(config.isConsoleLoggingEnabled());
        assertEquals("calc> ", config.getPrompt());
        assertTrue(config.isShowJson());
        assertTrue(config.isPrettyPrint());
        // absent keys keep defaults
        assertFalse(config.isFileLoggingEnabled());
        assertTrue(config.isShowAst());
    }

    @Test
    public void testPartialConfigKeepsDefaults() throws Exception {
        ParserConfig config = new ParserConfig();
        config.loadFromResource("config/partial_config.json");

        assertEquals("WARNING", config.getLoggingLevel());
        assertEquals("> ", config.getPrompt());
        assertFalse(config.isPrettyPrint());
    }

    @Test
    public void testMissingFileKeepsDefaults() throws Exception {
        ParserConfig config = new ParserConfig("does/not/exist.json");

        assertEquals("INFO", config.getLoggingLevel());
        assertEquals("> ", config.getPrompt());
    }

    @Test
    public void testBundledDefaultsResource() throws Exception {
        ParserConfig config = new ParserConfig();
        config.loadFromResource("exprtree.json");

        assertEquals("INFO", config.getLoggingLevel());
        assertTrue(config.isShowAst());
    }
}
