package com.tdtl.value;

import com.tdtl.json.JsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds {@link Node}s from values produced by a generic deserializer.
 */
public final class Nodes {

    private static final Logger LOG = LoggerFactory.getLogger(Nodes.class);

    // Maps are written with sorted keys so equal maps always produce equal text.
    private static final JsonWriter WRITER = new JsonWriter(false, true);

    private Nodes() {}

    /**
     * Converts an arbitrary value into the matching node. Unsupported shapes,
     * including collections holding unsupported elements, yield {@link Node#UNDEFINED};
     * this method never throws.
     */
    public static Node of(Object value) {
        if (value == null) {
            return Node.NULL;
        }
        if (value instanceof Node node) {
            return node;
        }
        if (value instanceof Double || value instanceof Float) {
            return new Node.FloatNode(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return new Node.FloatNode(decimal.doubleValue());
        }
        if (isIntegral(value)) {
            // through decimal text so every width ends up on the same int64 parse
            return new Node.StringNode(value.toString()).to(Type.INT);
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return new Node.StringNode(value.toString());
        }
        if (value instanceof byte[] bytes) {
            return new Node.JsonNode(new String(bytes, StandardCharsets.UTF_8));
        }
        if (value instanceof Boolean bool) {
            return new Node.BoolNode(bool);
        }
        if (value instanceof Map<?, ?>) {
            return serialize(value);
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? of(optional.get()) : Node.NULL;
        }
        if (value instanceof Iterable<?> || value.getClass().isArray()) {
            return serialize(value);
        }
        LOG.debug("No node representation for {}", value.getClass().getName());
        return Node.UNDEFINED;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long
            || value instanceof Integer
            || value instanceof Short
            || value instanceof Byte
            || value instanceof BigInteger
            || value instanceof AtomicLong
            || value instanceof AtomicInteger;
    }

    private static Node serialize(Object value) {
        try {
            return new Node.JsonNode(WRITER.write(value));
        } catch (IllegalArgumentException e) {
            LOG.debug("Cannot serialize {} as JSON: {}", value.getClass().getName(), e.getMessage());
            return Node.UNDEFINED;
        }
    }
}
