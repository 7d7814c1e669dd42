package com.tdtl.value;

import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class NodeTest {

    private static final Node BOOL = new Node.BoolNode(true);
    private static final Node INT = new Node.IntNode(42);
    private static final Node FLOAT = new Node.FloatNode(2.5);
    private static final Node STRING = new Node.StringNode("12");
    private static final Node ARRAY = new Node.ArrayNode("[1,2]");
    private static final Node JSON = new Node.JsonNode("{\"a\":1}");

    // ============================================================
    // Coercion table
    // ============================================================

    static Stream<Arguments> coercions() {
        Node u = Node.UNDEFINED;
        return Stream.of(
            // Bool
            Arguments.of(BOOL, Type.BOOL, BOOL),
            Arguments.of(BOOL, Type.STRING, new Node.StringNode("true")),
            Arguments.of(BOOL, Type.INT, u),
            Arguments.of(BOOL, Type.FLOAT, u),
            Arguments.of(BOOL, Type.NUMBER, u),
            Arguments.of(BOOL, Type.JSON, u),
            Arguments.of(BOOL, Type.ARRAY, u),
            // Int
            Arguments.of(INT, Type.INT, INT),
            Arguments.of(INT, Type.FLOAT, new Node.FloatNode(42.0)),
            Arguments.of(INT, Type.NUMBER, INT),
            Arguments.of(INT, Type.STRING, new Node.StringNode("42")),
            Arguments.of(INT, Type.BOOL, u),
            Arguments.of(INT, Type.JSON, u),
            Arguments.of(INT, Type.ARRAY, u),
            // Float
            Arguments.of(FLOAT, Type.FLOAT, FLOAT),
            Arguments.of(FLOAT, Type.INT, new Node.IntNode(2)),
            Arguments.of(FLOAT, Type.NUMBER, FLOAT),
            Arguments.of(FLOAT, Type.STRING, new Node.StringNode("2.500000")),
            Arguments.of(FLOAT, Type.BOOL, u),
            Arguments.of(FLOAT, Type.JSON, u),
            Arguments.of(FLOAT, Type.ARRAY, u),
            // String
            Arguments.of(STRING, Type.STRING, STRING),
            Arguments.of(STRING, Type.INT, new Node.IntNode(12)),
            Arguments.of(STRING, Type.FLOAT, new Node.FloatNode(12.0)),
            Arguments.of(STRING, Type.NUMBER, new Node.IntNode(12)),
            Arguments.of(STRING, Type.BOOL, u),
            Arguments.of(STRING, Type.JSON, u),
            Arguments.of(STRING, Type.ARRAY, u),
            // Null
            Arguments.of(Node.NULL, Type.JSON, new Node.JsonNode("{}")),
            Arguments.of(Node.NULL, Type.ARRAY, new Node.ArrayNode("[]")),
            Arguments.of(Node.NULL, Type.BOOL, u),
            Arguments.of(Node.NULL, Type.INT, u),
            Arguments.of(Node.NULL, Type.FLOAT, u),
            Arguments.of(Node.NULL, Type.NUMBER, u),
            Arguments.of(Node.NULL, Type.STRING, u),
            // Array
            Arguments.of(ARRAY, Type.STRING, new Node.StringNode("[1,2]")),
            Arguments.of(ARRAY, Type.JSON, new Node.JsonNode("[1,2]")),
            Arguments.of(ARRAY, Type.ARRAY, ARRAY),
            Arguments.of(ARRAY, Type.BOOL, u),
            Arguments.of(ARRAY, Type.INT, u),
            Arguments.of(ARRAY, Type.FLOAT, u),
            Arguments.of(ARRAY, Type.NUMBER, u),
            // JSON
            Arguments.of(JSON, Type.BOOL, u),
            Arguments.of(JSON, Type.INT, u),
            Arguments.of(JSON, Type.FLOAT, u),
            Arguments.of(JSON, Type.NUMBER, u),
            Arguments.of(JSON, Type.STRING, u),
            Arguments.of(JSON, Type.ARRAY, u)
        );
    }

    @ParameterizedTest
    @MethodSource("coercions")
    public void testCoercionTable(Node source, Type target, Node expected) {
        assertEquals(expected, source.to(target));
    }

    static Stream<Node> allVariants() {
        return Stream.of(Node.UNDEFINED, Node.NULL, BOOL, INT, FLOAT, STRING, ARRAY, JSON,
            new Node.StringNode("not a number"), new Node.JsonNode("broken"));
    }

    static Stream<Arguments> everyVariantAndTarget() {
        return allVariants().flatMap(node -> Stream.of(Type.values()).map(type -> Arguments.of(node, type)));
    }

    @ParameterizedTest
    @MethodSource("everyVariantAndTarget")
    public void testCoercionIsTotal(Node source, Type target) {
        Node result = assertDoesNotThrow(() -> source.to(target));
        assertNotNull(result);
        if (result.type() != Type.UNDEFINED) {
            if (target == Type.NUMBER) {
                assertTrue(result.type() == Type.INT || result.type() == Type.FLOAT);
            } else {
                assertEquals(target, result.type());
            }
        }
    }

    @ParameterizedTest
    @MethodSource("allVariants")
    public void testIdentityCoercion(Node node) {
        assertEquals(node, node.to(node.type()));
    }

    @ParameterizedTest
    @EnumSource(Type.class)
    public void testUndefinedStaysUndefined(Type target) {
        assertSame(Node.UNDEFINED, Node.UNDEFINED.to(target));
    }

    @Test
    public void testNoNodeReportsNumber() {
        allVariants().forEach(node -> assertNotEquals(Type.NUMBER, node.type()));
        assertTrue(Type.NUMBER.isNumeric());
        assertFalse(Type.STRING.isNumeric());
    }

    // ============================================================
    // Sentinels
    // ============================================================

    @Test
    public void testUndefinedAndNullAreDistinct() {
        assertNotEquals(Node.UNDEFINED, Node.NULL);
        assertEquals(Node.UNDEFINED, new Node.UndefinedNode());
        assertEquals(Node.NULL, new Node.NullNode());
        assertEquals(Type.UNDEFINED, Node.UNDEFINED.type());
        assertEquals(Type.NULL, Node.NULL.type());
    }

    @Test
    public void testSentinelText() {
        assertEquals("", Node.UNDEFINED.toString());
        assertEquals("null", Node.NULL.toString());
        assertNull(Node.UNDEFINED.value());
        assertNull(Node.NULL.value());
    }

    @Test
    public void testFailedCoercionIsNotNull() {
        Node failed = new Node.StringNode("abc").to(Type.INT);
        assertEquals(Node.UNDEFINED, failed);
        assertNotEquals(Node.NULL, failed);
    }

    // ============================================================
    // Canonical text
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "3.14159265, 3.141593",
        "1, 1.000000",
        "-0.5, -0.500000",
        "0, 0.000000",
        "1234567.125, 1234567.125000",
        "1e-7, 0.000000"
    })
    public void testFloatTextHasSixDigits(double value, String expected) {
        assertEquals(expected, new Node.FloatNode(value).toString());
    }

    @Test
    public void testScalarText() {
        assertEquals("true", new Node.BoolNode(true).toString());
        assertEquals("false", new Node.BoolNode(false).toString());
        assertEquals("-7", new Node.IntNode(-7).toString());
        assertEquals("raw \"text\"", new Node.StringNode("raw \"text\"").toString());
    }

    @Test
    public void testRawTextIsVerbatim() {
        String spaced = "[ 1 ,  2 ]";
        assertEquals(spaced, new Node.ArrayNode(spaced).toString());
        String object = "{ \"b\" : 1,\n \"a\": 2 }";
        assertEquals(object, new Node.JsonNode(object).toString());
    }

    // ============================================================
    // Round trips
    // ============================================================

    @ParameterizedTest
    @ValueSource(longs = {Long.MIN_VALUE, -1, 0, 42, 1_000_000_007L, Long.MAX_VALUE})
    public void testIntStringRoundTrip(long value) {
        Node node = new Node.IntNode(value);
        assertEquals(node, node.to(Type.STRING).to(Type.INT));
    }

    @ParameterizedTest
    @ValueSource(doubles = {3.14159265, -2500.75, 1e-7, 0.0, 123456.654321})
    public void testFloatStringRoundTripWithinPrecision(double value) {
        Node back = new Node.FloatNode(value).to(Type.STRING).to(Type.FLOAT);
        assertEquals(Type.FLOAT, back.type());
        assertEquals(value, ((Node.FloatNode) back).number(), 1e-6);
    }

    @ParameterizedTest
    @CsvSource({"2.7, 2", "-2.7, -2", "0.999, 0"})
    public void testFloatToIntTruncates(double value, long expected) {
        assertEquals(new Node.IntNode(expected), new Node.FloatNode(value).to(Type.INT));
    }

    // ============================================================
    // String parsing
    // ============================================================

    @Test
    public void testStringToNumberDispatchesOnDecimalPoint() {
        assertEquals(new Node.IntNode(3), new Node.StringNode("3").to(Type.NUMBER));
        assertEquals(new Node.FloatNode(3.0), new Node.StringNode("3.0").to(Type.NUMBER));
        assertEquals(new Node.FloatNode(3.0), new Node.StringNode("3.").to(Type.NUMBER));
        // no '.', so the int parser runs and rejects the exponent
        assertEquals(Node.UNDEFINED, new Node.StringNode("1e3").to(Type.NUMBER));
        assertEquals(Node.UNDEFINED, new Node.StringNode("1.2.3").to(Type.NUMBER));
        assertEquals(Node.UNDEFINED, new Node.StringNode("abc").to(Type.NUMBER));
    }

    @ParameterizedTest
    @CsvSource({
        "1, true", "t, true", "T, true", "true, true", "TRUE, true", "True, true",
        "0, false", "f, false", "F, false", "false, false", "FALSE, false", "False, false"
    })
    public void testStringToBoolAccepted(String text, boolean expected) {
        assertEquals(new Node.BoolNode(expected), new Node.StringNode(text).to(Type.BOOL));
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "tRUE", " true", "", "2", "on"})
    public void testStringToBoolRejected(String text) {
        assertEquals(Node.UNDEFINED, new Node.StringNode(text).to(Type.BOOL));
    }

    @ParameterizedTest
    @CsvSource({"+5, 5", "-0, 0", "007, 7", "-9223372036854775808, -9223372036854775808"})
    public void testStringToIntAccepted(String text, long expected) {
        assertEquals(new Node.IntNode(expected), new Node.StringNode(text).to(Type.INT));
    }

    @ParameterizedTest
    @ValueSource(strings = {" 5", "5 ", "9223372036854775808", "12abc", "1.0", "", "+", "٣", "0x10"})
    public void testStringToIntRejected(String text) {
        assertEquals(Node.UNDEFINED, new Node.StringNode(text).to(Type.INT));
    }

    @ParameterizedTest
    @CsvSource({"1e3, 1000", "-2.5, -2.5", ".5, 0.5", "0x1p-2, 0.25", "+1.5E2, 150"})
    public void testStringToFloatAccepted(String text, double expected) {
        assertEquals(new Node.FloatNode(expected), new Node.StringNode(text).to(Type.FLOAT));
    }

    @Test
    public void testStringToFloatSpecialValues() {
        assertEquals(new Node.FloatNode(Double.POSITIVE_INFINITY), new Node.StringNode("inf").to(Type.FLOAT));
        assertEquals(new Node.FloatNode(Double.NEGATIVE_INFINITY), new Node.StringNode("-Infinity").to(Type.FLOAT));
        assertEquals(new Node.FloatNode(Double.NaN), new Node.StringNode("NaN").to(Type.FLOAT));
    }

    @Test
    public void testSpecialFloatText() {
        assertEquals("+Inf", new Node.FloatNode(Double.POSITIVE_INFINITY).toString());
        assertEquals("-Inf", new Node.FloatNode(Double.NEGATIVE_INFINITY).toString());
        assertEquals("NaN", new Node.FloatNode(Double.NaN).toString());
        assertEquals(new Node.StringNode("-Inf"), new Node.FloatNode(Double.NEGATIVE_INFINITY).to(Type.STRING));

        Node text = new Node.FloatNode(Double.POSITIVE_INFINITY).to(Type.STRING);
        assertEquals(new Node.FloatNode(Double.POSITIVE_INFINITY), text.to(Type.FLOAT));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1e400", "1.5f", "2d", " 1.5", "1.5 ", "", "abc", "1,5", "0x1.8"})
    public void testStringToFloatRejected(String text) {
        assertEquals(Node.UNDEFINED, new Node.StringNode(text).to(Type.FLOAT));
    }

    // ============================================================
    // Decoded values
    // ============================================================

    @Test
    public void testScalarValues() {
        assertEquals(Boolean.TRUE, BOOL.value());
        assertEquals(42L, INT.value());
        assertEquals(2.5, FLOAT.value());
        assertEquals("12", STRING.value());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testJsonValueDecodes() {
        Object decoded = new Node.JsonNode("{\"a\":[1,2.5,\"x\",true,null]}").value();

        assertTrue(decoded instanceof Map);
        Object a = ((Map<String, Object>) decoded).get("a");
        assertTrue(a instanceof MutableList);
        MutableList<Object> list = (MutableList<Object>) a;
        assertEquals(5, list.size());
        assertEquals(1L, list.get(0));
        assertEquals(2.5, list.get(1));
        assertEquals("x", list.get(2));
        assertEquals(Boolean.TRUE, list.get(3));
        assertNull(list.get(4));
    }

    @Test
    public void testArrayValueDecodes() {
        Object decoded = ARRAY.value();
        assertTrue(decoded instanceof MutableList);
        assertEquals(2, ((MutableList<?>) decoded).size());
    }

    @Test
    public void testMalformedJsonValueIsNull() {
        assertNull(new Node.JsonNode("{\"a\":").value());
        assertNull(new Node.ArrayNode("[1,").value());
        assertNull(new Node.JsonNode("").value());
    }

    // ============================================================
    // Array payload
    // ============================================================

    @Test
    public void testArrayNodeIsImmutableAndComparesByContent() {
        byte[] bytes = "[1]".getBytes(StandardCharsets.UTF_8);
        Node.ArrayNode node = new Node.ArrayNode(bytes);
        bytes[1] = '9';
        assertEquals("[1]", node.toString());

        node.raw()[1] = '9';
        assertEquals("[1]", node.toString());

        assertEquals(new Node.ArrayNode("[1]"), node);
        assertEquals(new Node.ArrayNode("[1]").hashCode(), node.hashCode());
        assertNotEquals(new Node.ArrayNode("[2]"), node);
    }
}
