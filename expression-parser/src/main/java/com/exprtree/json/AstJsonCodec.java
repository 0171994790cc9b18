package com.exprtree.json;

import com.exprtree.ast.ASTNode;
import com.exprtree.ast.SerializedASTNode;
import com.exprtree.parser.Parser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;

/**
 * Reads and writes expression trees as JSON.
 *
 * The JSON shape is exactly the serialized form:
 * <pre>
 * {"type":"BinaryOperationNode","operator":"+",
 *  "left":{"type":"NumberNode","value":10.0},
 *  "right":{"type":"NumberNode","value":5.0}}
 * </pre>
 */
public class AstJsonCodec {

    private final ObjectMapper objectMapper;

    /**
     * Create a codec producing compact JSON.
     */
    public AstJsonCodec() {
        this(false);
    }

    /**
     * @param prettyPrint whether to indent the JSON output
     */
    public AstJsonCodec(boolean prettyPrint) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        if (prettyPrint) {
            this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public String toJson(ASTNode node) throws IOException {
        return toJson(node.serialize());
    }

    public String toJson(SerializedASTNode serial) throws IOException {
        return objectMapper.writeValueAsString(serial);
    }

    /**
     * Parse JSON into the serialized form without rebuilding the tree.
     *
     * @throws IOException if the text is not valid JSON for a serialized node
     */
    public SerializedASTNode fromJson(String json) throws IOException {
        return objectMapper.readValue(json, SerializedASTNode.class);
    }

    /**
     * Parse JSON and rebuild the expression tree.
     */
    public ASTNode readNode(String json) throws IOException {
        return Parser.deserialize(fromJson(json));
    }

    /**
     * Write a tree to a JSON file, creating parent directories as needed.
     */
    public void writeToFile(ASTNode node, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        objectMapper.writeValue(file, node.serialize());
    }

    public ASTNode readFromFile(File file) throws IOException {
        if (!file.exists()) {
            throw new IOException("Expression file not found: " + file.getPath());
        }
        return Parser.deserialize(objectMapper.readValue(file, SerializedASTNode.class));
    }
}
