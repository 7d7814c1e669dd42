package com.tdtl.json;

import com.tdtl.value.Node;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.AbstractMap;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes generic Java values (maps, iterables, arrays, strings, numbers, booleans,
 * {@code null} and {@link Node}s) as JSON text.
 *
 * <p>Raw {@link Node.JsonNode} and {@link Node.ArrayNode} values are embedded verbatim.
 * Values with no JSON form raise {@link IllegalArgumentException}.
 */
public class JsonWriter {
    private final boolean prettyPrint;
    private final boolean sortKeys;

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public JsonWriter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public JsonWriter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String write(Object value) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        writeValue(value, 0, sb);

        return sb.toString();
    }

    private void writeValue(Object value, int indent, StringBuilder sb) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Node node) {
            writeNode(node, indent, sb);
        } else if (value instanceof CharSequence || value instanceof Character) {
            writeString(value.toString(), sb);
        } else if (value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Number number) {
            writeNumber(number, sb);
        } else if (value instanceof Map<?, ?> map) {
            writeObject(map, indent, sb);
        } else if (value instanceof Optional<?> optional) {
            writeValue(optional.orElse(null), indent, sb);
        } else if (value instanceof byte[] bytes) {
            writeString(Base64.getEncoder().encodeToString(bytes), sb);
        } else if (value instanceof Iterable<?> iterable) {
            MutableList<Object> elements = Lists.mutable.empty();
            iterable.forEach(elements::add);
            writeArray(elements, indent, sb);
        } else if (value instanceof Object[] array) {
            writeArray(Lists.mutable.with(array), indent, sb);
        } else if (value.getClass().isArray()) {
            writeArray(primitiveElements(value), indent, sb);
        } else {
            throw new IllegalArgumentException("unsupported type " + value.getClass().getName());
        }
    }

    private static MutableList<Object> primitiveElements(Object array) {
        MutableList<Object> elements = Lists.mutable.empty();
        if (array instanceof int[] ints) {
            for (int v : ints) {
                elements.add(v);
            }
        } else if (array instanceof long[] longs) {
            for (long v : longs) {
                elements.add(v);
            }
        } else if (array instanceof short[] shorts) {
            for (short v : shorts) {
                elements.add(v);
            }
        } else if (array instanceof double[] doubles) {
            for (double v : doubles) {
                elements.add(v);
            }
        } else if (array instanceof float[] floats) {
            for (float v : floats) {
                elements.add(v);
            }
        } else if (array instanceof boolean[] booleans) {
            for (boolean v : booleans) {
                elements.add(v);
            }
        } else if (array instanceof char[] chars) {
            for (char v : chars) {
                elements.add(v);
            }
        } else {
            throw new IllegalArgumentException("unsupported array type " + array.getClass().getName());
        }
        return elements;
    }

    private void writeNode(Node node, int indent, StringBuilder sb) {
        switch (node.type()) {
            case JSON, ARRAY -> sb.append(node);
            case UNDEFINED -> throw new IllegalArgumentException("undefined value");
            default -> writeValue(node.value(), indent, sb);
        }
    }

    private void writeNumber(Number number, StringBuilder sb) {
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("unsupported value " + value);
            }
            // Fast path for whole numbers
            if (value == (long) value) {
                sb.append((long) value);
            } else {
                sb.append(value);
            }
        } else if (number instanceof BigDecimal decimal) {
            sb.append(decimal.toPlainString());
        } else if (number instanceof Long || number instanceof Integer || number instanceof Short
            || number instanceof Byte || number instanceof BigInteger
            || number instanceof AtomicLong || number instanceof AtomicInteger) {
            sb.append(number);
        } else {
            throw new IllegalArgumentException("unsupported number type " + number.getClass().getName());
        }
    }

    private void writeObject(Map<?, ?> map, int indent, StringBuilder sb) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }

        MutableList<Map.Entry<String, Object>> entries = Lists.mutable.empty();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("null object key");
            }
            entries.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey().toString(), entry.getValue()));
        }
        if (sortKeys) {
            entries.sortThisBy(Map.Entry::getKey);
        }

        String indentStr = " ".repeat(indent);
        sb.append(prettyPrint ? "{\n" : "{");

        boolean first = true;
        for (Map.Entry<String, Object> entry : entries) {
            if (!first) {
                sb.append(prettyPrint ? ",\n" : ",");
            }
            first = false;

            if (prettyPrint) {
                sb.append(indentStr).append("  ");
            }
            writeString(entry.getKey(), sb);
            sb.append(prettyPrint ? ": " : ":");
            writeValue(entry.getValue(), indent + 2, sb);
        }

        if (prettyPrint) {
            sb.append("\n").append(indentStr);
        }
        sb.append("}");
    }

    private void writeArray(MutableList<Object> elements, int indent, StringBuilder sb) {
        if (elements.isEmpty()) {
            sb.append("[]");
            return;
        }

        String indentStr = " ".repeat(indent);
        sb.append(prettyPrint ? "[\n" : "[");

        boolean first = true;
        for (Object element : elements) {
            if (!first) {
                sb.append(prettyPrint ? ",\n" : ",");
            }
            first = false;

            if (prettyPrint) {
                sb.append(indentStr).append("  ");
            }
            writeValue(element, indent + 2, sb);
        }

        if (prettyPrint) {
            sb.append("\n").append(indentStr);
        }
        sb.append("]");
    }

    static void writeString(String s, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default   -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    /** Returns {@code s} as a quoted, escaped JSON string literal. */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        writeString(s, sb);
        return sb.toString();
    }
}
