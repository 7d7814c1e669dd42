package com.tdtl.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;

/**
 * Decodes JSON text into generic Java values: insertion-ordered {@link MutableMap}s,
 * {@link MutableList}s, {@code String}, {@code Long} (or {@code BigInteger} beyond
 * int64), {@code Double}, {@code Boolean} and {@code null}.
 */
public class JsonValueParser {
    private static final Logger LOG = LoggerFactory.getLogger(JsonValueParser.class);

    private static final JsonValueParser SHARED = new JsonValueParser();

    private final JsonFactory factory = new JsonFactory();

    public Object parse(String input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseDocument(parser);
        }
    }

    public Object parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseDocument(parser);
        }
    }

    /**
     * Decodes {@code input}, or returns {@code null} when it is not a single well-formed
     * JSON value.
     */
    public static Object decodeOrNull(String input) {
        try {
            return SHARED.parse(input);
        } catch (IOException e) {
            LOG.debug("Discarding undecodable JSON: {}", e.getMessage());
            return null;
        }
    }

    private Object parseDocument(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == null) {
            throw new IOException("Empty JSON input");
        }
        Object value = parseValue(parser, token);
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw new IOException("Unexpected trailing JSON token: " + trailing);
        }
        return value;
    }

    private Object parseValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                ? parser.getBigIntegerValue()
                : (Object) parser.getLongValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private MutableMap<String, Object> parseObject(JsonParser parser) throws IOException {
        MutableMap<String, Object> fields = MapAdapter.adapt(new LinkedHashMap<>());

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return fields;
    }

    private MutableList<Object> parseArray(JsonParser parser) throws IOException {
        MutableList<Object> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return elements;
    }
}
