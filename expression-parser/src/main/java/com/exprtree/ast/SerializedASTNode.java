package com.exprtree.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Structural projection of an {@link ASTNode}, used for storage and transmission.
 *
 * Exactly one of two shapes is populated, selected by {@link #getType()}:
 * <ul>
 *   <li>{@code NumberNode}: {@code value}</li>
 *   <li>{@code BinaryOperationNode}: {@code operator}, {@code left}, {@code right}</li>
 * </ul>
 * The operator is carried as its one-character symbol so the JSON form reads
 * {@code {"type":"BinaryOperationNode","operator":"+",...}}.
 * <p>
 * JSON has no literal for NaN or the infinities, so such values travel as the strings
 * {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"} (Jackson's default) and are
 * read back into the same double. Every finite value is a JSON number.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "value", "operator", "left", "right"})
public final class SerializedASTNode {

    public static final String NUMBER_NODE = "NumberNode";
    public static final String BINARY_OPERATION_NODE = "BinaryOperationNode";

    private final String type;
    private final Double value;
    private final String operator;
    private final SerializedASTNode left;
    private final SerializedASTNode right;

    @JsonCreator
    public SerializedASTNode(@JsonProperty("type") String type,
                             @JsonProperty("value") Double value,
                             @JsonProperty("operator") String operator,
                             @JsonProperty("left") SerializedASTNode left,
                             @JsonProperty("right") SerializedASTNode right) {
        this.type = type;
        this.value = value;
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public static SerializedASTNode number(double value) {
        return new SerializedASTNode(NUMBER_NODE, value, null, null, null);
    }

    public static SerializedASTNode binary(Operator operator, SerializedASTNode left, SerializedASTNode right) {
        return new SerializedASTNode(BINARY_OPERATION_NODE, null, operator.getSymbol(), left, right);
    }

    public String getType() {
        return type;
    }

    public Double getValue() {
        return value;
    }

    public String getOperator() {
        return operator;
    }

    public SerializedASTNode getLeft() {
        return left;
    }

    public SerializedASTNode getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        SerializedASTNode that = (SerializedASTNode) o;
        return Objects.equals(type, that.type)
                && Objects.equals(value, that.value)
                && Objects.equals(operator, that.operator)
                && Objects.equals(left, that.left)
                && Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, operator, left, right);
    }

    @Override
    public String toString() {
        if (NUMBER_NODE.equals(type)) {
            return "{type=" + type + ", value=" + value + "}";
        }
        return "{type=" + type + ", operator=" + operator + ", left=" + left + ", right=" + right + "}";
    }
}
