package com.exprtree.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Settings for logging, the console front end and JSON output.
 *
 * Loaded from a JSON file of the form
 * <pre>
 * {
 *   "logging": { "level": "INFO", "console": true, "file": false, "fileName": "exprtree.log" },
 *   "console": { "prompt": "> ", "showAst": true, "showJson": false },
 *   "output":  { "pretty": false }
 * }
 * </pre>
 * Sections or keys that are absent keep their defaults.
 */
public class ParserConfig {

    public static final String DEFAULT_LOG_FILE = "exprtree.log";

    // Logging
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private boolean fileLoggingEnabled = false;
    private String logFileName = DEFAULT_LOG_FILE;

    // Console
    private String prompt = "> ";
    private boolean showAst = true;
    private boolean showJson = false;

    // Output
    private boolean prettyPrint = false;

    public ParserConfig() {
    }

    public ParserConfig(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    /**
     * Load settings from a JSON file. A missing file leaves the defaults in place.
     */
    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Parser config file not found: " + configFilePath);
            LoggingUtil.info("Using default parser configuration");
            return;
        }

        apply(new ObjectMapper().readTree(configFile));
    }

    /**
     * Load settings from a classpath resource. A missing resource leaves the defaults in place.
     */
    public void loadFromResource(String resourceName) throws IOException {
        try (InputStream in = ParserConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                LoggingUtil.warn("Parser config resource not found: " + resourceName);
                return;
            }
            apply(new ObjectMapper().readTree(in));
        }
    }

    private void apply(JsonNode configJson) {
        if (configJson.has("logging")) {
            JsonNode loggingNode = configJson.get("logging");

            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }
            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }
            if (loggingNode.has("file")) {
                fileLoggingEnabled = loggingNode.get("file").asBoolean();
            }
            if (loggingNode.has("fileName")) {
                logFileName = loggingNode.get("fileName").asText();
            }
        }

        if (configJson.has("console")) {
            JsonNode consoleNode = configJson.get("console");

            if (consoleNode.has("prompt")) {
                prompt = consoleNode.get("prompt").asText();
            }
            if (consoleNode.has("showAst")) {
                showAst = consoleNode.get("showAst").asBoolean();
            }
            if (consoleNode.has("showJson")) {
                showJson = consoleNode.get("showJson").asBoolean();
            }
        }

        if (configJson.has("output")) {
            JsonNode outputNode = configJson.get("output");

            if (outputNode.has("pretty")) {
                prettyPrint = outputNode.get("pretty").asBoolean();
            }
        }
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public void setFileLoggingEnabled(boolean fileLoggingEnabled) {
        this.fileLoggingEnabled = fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public boolean isShowAst() {
        return showAst;
    }

    public void setShowAst(boolean showAst) {
        this.showAst = showAst;
    }

    public boolean isShowJson() {
        return showJson;
    }

    public void setShowJson(boolean showJson) {
        this.showJson = showJson;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public void setPrettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    @Override
    public String toString() {
        return "ParserConfig{level=" + loggingLevel +
                ", console=" + consoleLoggingEnabled +
                ", file=" + (fileLoggingEnabled ? logFileName : "disabled") +
                ", prompt='" + prompt + "'" +
                ", showAst=" + showAst +
                ", showJson=" + showJson +
                ", pretty=" + prettyPrint + "}";
    }
}
