package com.exprtree.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumberNodeTest {

    @Test
    public void testEvaluateReturnsStoredValue() {
        assertEquals(42.0, new NumberNode(42).evaluate());
        assertEquals(-2.5, new NumberNode(-2.5).evaluate());
    }

    @Test
    public void testPrintDropsTrailingZero() {
        assertEquals("15", new NumberNode(15).print());
        assertEquals("1.2", new NumberNode(1.2).print());
        assertEquals("-2.5", new NumberNode(-2.5).print());
        assertEquals("0", new NumberNode(-0.0).print());
    }

    @Test
    public void testFormatUsesPlainShortestDecimal() {
        assertEquals("0.30000000000000004", NumberNode.format(0.1 + 0.2));
        assertEquals("0.0001", NumberNode.format(0.0001));
        assertEquals("1000000000000000000000", NumberNode.format(1e21));
        assertEquals("NaN", NumberNode.format(Double.NaN));
        assertEquals("Infinity", NumberNode.format(Double.POSITIVE_INFINITY));
        assertEquals("-Infinity", NumberNode.format(Double.NEGATIVE_INFINITY));
    }

    @Test
    public void testSerialize() {
        SerializedASTNode serial = new NumberNode(42).serialize();

        assertEquals(SerializedASTNode.NUMBER_NODE, serial.getType());
        assertEquals(42.0, serial.getValue());
        assertNull(serial.getOperator());
        assertNull(serial.getLeft());
        assertNull(serial.getRight());
        assertEquals(SerializedASTNode.number(42), serial);
    }
}
