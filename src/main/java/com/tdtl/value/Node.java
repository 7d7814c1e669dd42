package com.tdtl.value;

import com.tdtl.json.JsonPatcher;
import com.tdtl.json.JsonUpdateException;
import com.tdtl.json.JsonValueParser;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * A dynamically typed value flowing through a query.
 *
 * <p>Conversions are total: {@link #to(Type)} never throws and answers
 * {@link #UNDEFINED} when the value cannot be represented in the requested type.
 * Callers detect failure by checking {@code type() == Type.UNDEFINED}.
 *
 * <p>All variants are immutable and safe to share between threads.
 */
public sealed interface Node {

    UndefinedNode UNDEFINED = new UndefinedNode();
    NullNode NULL = new NullNode();

    Type type();

    /** Coerces this value to {@code target}, or returns {@link #UNDEFINED}. */
    Node to(Type target);

    /** Generic decoded form: {@code Boolean}, {@code Long}, {@code Double}, {@code String}, collections or {@code null}. */
    Object value();

    /**
     * Canonical text of the value. Downstream JSON assembly depends on this form, so
     * floats always carry six fractional digits and raw JSON is returned verbatim.
     */
    @Override
    String toString();

    record UndefinedNode() implements Node {
        @Override
        public Type type() {
            return Type.UNDEFINED;
        }

        @Override
        public Node to(Type target) {
            return this;
        }

        @Override
        public Object value() {
            return null;
        }

        @Override
        public String toString() {
            return "";
        }
    }

    record NullNode() implements Node {
        @Override
        public Type type() {
            return Type.NULL;
        }

        @Override
        public Node to(Type target) {
            return switch (target) {
                case NULL -> this;
                case JSON -> new JsonNode("{}");
                case ARRAY -> new ArrayNode("[]");
                default -> UNDEFINED;
            };
        }

        @Override
        public Object value() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BoolNode(boolean bool) implements Node {
        @Override
        public Type type() {
            return Type.BOOL;
        }

        @Override
        public Node to(Type target) {
            return switch (target) {
                case BOOL -> this;
                case STRING -> new StringNode(toString());
                default -> UNDEFINED;
            };
        }

        @Override
        public Object value() {
            return bool;
        }

        @Override
        public String toString() {
            return Boolean.toString(bool);
        }
    }

    record IntNode(long number) implements Node {
        @Override
        public Type type() {
            return Type.INT;
        }

        @Override
        public Node to(Type target) {
            return switch (target) {
                case NUMBER, INT -> this;
                case FLOAT -> new FloatNode(number);
                case STRING -> new StringNode(toString());
                default -> UNDEFINED;
            };
        }

        @Override
        public Object value() {
            return number;
        }

        @Override
        public String toString() {
            return Long.toString(number);
        }
    }

    record FloatNode(double number) implements Node {
        @Override
        public Type type() {
            return Type.FLOAT;
        }

        @Override
        public Node to(Type target) {
            return switch (target) {
                case NUMBER, FLOAT -> this;
                // truncates toward zero
                case INT -> new IntNode((long) number);
                case STRING -> new StringNode(toString());
                default -> UNDEFINED;
            };
        }

        @Override
        public Object value() {
            return number;
        }

        /** Six fractional digits; infinities print as {@code +Inf} and {@code -Inf}. */
        @Override
        public String toString() {
            if (Double.isInfinite(number)) {
                return number > 0 ? "+Inf" : "-Inf";
            }
            return String.format(Locale.ROOT, "%f", number);
        }
    }

    record StringNode(String text) implements Node {
        public StringNode {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public Type type() {
            return Type.STRING;
        }

        /**
         * Parses the text into the target type. {@link Type#NUMBER} looks only at the
         * text: with a {@code '.'} it is parsed as a float, otherwise as an int, so
         * {@code "1e3"} fails rather than becoming a float.
         */
        @Override
        public Node to(Type target) {
            return switch (target) {
                case STRING -> this;
                case BOOL -> {
                    Boolean parsed = Parsing.parseBool(text);
                    yield parsed == null ? UNDEFINED : new BoolNode(parsed);
                }
                case NUMBER -> text.indexOf('.') < 0 ? to(Type.INT) : to(Type.FLOAT);
                case INT -> {
                    Long parsed = Parsing.parseInt(text);
                    yield parsed == null ? UNDEFINED : new IntNode(parsed);
                }
                case FLOAT -> {
                    Double parsed = Parsing.parseFloat(text);
                    yield parsed == null ? UNDEFINED : new FloatNode(parsed);
                }
                default -> UNDEFINED;
            };
        }

        @Override
        public Object value() {
            return text;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /** A JSON array kept in serialized form. */
    record ArrayNode(byte[] raw) implements Node {
        public ArrayNode {
            raw = Objects.requireNonNull(raw, "raw").clone();
        }

        public ArrayNode(String raw) {
            this(raw.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public byte[] raw() {
            return raw.clone();
        }

        @Override
        public Type type() {
            return Type.ARRAY;
        }

        @Override
        public Node to(Type target) {
            return switch (target) {
                case STRING -> new StringNode(toString());
                case ARRAY -> this;
                case JSON -> new JsonNode(toString());
                default -> UNDEFINED;
            };
        }

        @Override
        public Object value() {
            return JsonValueParser.decodeOrNull(toString());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ArrayNode other && Arrays.equals(raw, other.raw);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(raw);
        }

        @Override
        public String toString() {
            return new String(raw, StandardCharsets.UTF_8);
        }
    }

    /** An arbitrary JSON object or array carried as text. */
    record JsonNode(String raw) implements Node {
        public JsonNode {
            Objects.requireNonNull(raw, "raw");
        }

        @Override
        public Type type() {
            return Type.JSON;
        }

        @Override
        public Node to(Type target) {
            return target == Type.JSON ? this : UNDEFINED;
        }

        @Override
        public Object value() {
            return JsonValueParser.decodeOrNull(raw);
        }

        /**
         * Returns a copy of this document with the value under {@code key} replaced.
         *
         * @see JsonPatcher#update(String, String, Node)
         */
        public String update(String key, Node replacement) throws JsonUpdateException {
            return JsonPatcher.update(raw, key, replacement);
        }

        @Override
        public String toString() {
            return raw;
        }
    }
}
