package com.tdtl.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.tdtl.value.Node;
import com.tdtl.value.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Replaces the value of one top-level key inside raw JSON object text.
 *
 * <p>The patch is textual: the value span of the key is located with jackson's
 * streaming parser and the replacement is spliced in, so every other member keeps its order, spacing
 * and number formatting byte for byte. Input text is never modified; each call returns
 * a new string, so one document can be patched concurrently by many callers.
 *
 * <p>Replacement encoding:
 * <ul>
 * <li>Int, Float and Bool nodes: their canonical text, unquoted</li>
 * <li>String nodes: the text wrapped in double quotes, without escaping</li>
 * <li>JSON nodes: the raw text; with an empty key the whole document is replaced</li>
 * </ul>
 * Any other node is rejected.
 */
public final class JsonPatcher {

    private static final Logger LOG = LoggerFactory.getLogger(JsonPatcher.class);

    private static final JsonFactory FACTORY = new JsonFactory();

    private JsonPatcher() {}

    /**
     * Returns {@code document} with the value of {@code key} replaced by {@code value}.
     *
     * @throws JsonUpdateException if the value kind is unsupported, the document is not
     *         an object, or the key does not occur at the top level
     */
    public static String update(String document, String key, Node value) throws JsonUpdateException {
        return patch(document, key, value, false);
    }

    /**
     * Like {@link #update(String, String, Node)}, but a missing key is appended as the
     * last member of the object instead of failing.
     */
    public static String upsert(String document, String key, Node value) throws JsonUpdateException {
        return patch(document, key, value, true);
    }

    /**
     * Serializes a node for embedding into a larger JSON structure: JSON passes through
     * raw, strings are quote-wrapped, everything else uses its canonical text.
     */
    public static byte[] toBytes(Node value) {
        if (value == null) {
            return new byte[0];
        }
        return switch (value.type()) {
            case STRING -> ("\"" + value + "\"").getBytes(StandardCharsets.UTF_8);
            default -> value.toString().getBytes(StandardCharsets.UTF_8);
        };
    }

    private static String patch(String document, String key, Node value, boolean insertMissing)
        throws JsonUpdateException {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(key, "key");

        String replacement = inlineText(value);
        if (key.isEmpty()) {
            if (value instanceof Node.JsonNode json) {
                return json.raw();
            }
            throw new JsonUpdateException("Empty key needs a JSON replacement, got " + value.type());
        }

        Member member = locate(document, key);
        if (member.found()) {
            return document.substring(0, member.start()) + replacement + document.substring(member.end());
        }
        if (!insertMissing) {
            throw new JsonUpdateException("Key not found: " + key);
        }

        LOG.debug("Appending missing key {}", key);
        String separator = member.emptyObject() ? "" : ",";
        return document.substring(0, member.start())
            + separator + JsonWriter.quote(key) + ":" + replacement
            + document.substring(member.start());
    }

    private static String inlineText(Node value) throws JsonUpdateException {
        if (value == null) {
            throw new JsonUpdateException("Unsupported replacement value: null");
        }
        return switch (value.type()) {
            case FLOAT, INT, BOOL -> value.to(Type.STRING).toString();
            case STRING -> "\"" + value + "\"";
            case JSON -> value.toString();
            default -> throw new JsonUpdateException("Unsupported replacement value type: " + value.type());
        };
    }

    /**
     * Where a key's value lies in the document. When the key is missing, {@code start}
     * is the offset of the object's closing brace.
     */
    private record Member(boolean found, int start, int end, boolean emptyObject) {
        static Member at(int start, int end) {
            return new Member(true, start, end, false);
        }

        static Member missing(int closingBrace, boolean emptyObject) {
            return new Member(false, closingBrace, closingBrace, emptyObject);
        }
    }

    /**
     * Walks the top-level members of a document with a streaming parser, recording the
     * character span of the first member named {@code key}. The whole document is read,
     * so malformed text after the target value is rejected as well.
     */
    private static Member locate(String document, String key) throws JsonUpdateException {
        try (JsonParser parser = FACTORY.createParser(document)) {
            JsonToken first = parser.nextToken();
            if (first != JsonToken.START_OBJECT) {
                JsonLocation where = first == null ? parser.currentLocation() : parser.getTokenLocation();
                throw new JsonUpdateException("Document is not a JSON object", offset(where));
            }

            Member member = null;
            boolean empty = true;
            JsonToken token;
            while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
                empty = false;
                String name = parser.currentName();
                JsonToken value = parser.nextToken();
                int start = offset(parser.getTokenLocation());
                if (value.isStructStart()) {
                    parser.skipChildren();
                } else {
                    parser.finishToken();
                }
                if (member == null && name.equals(key)) {
                    member = Member.at(start, offset(parser.currentLocation()));
                }
            }
            if (token != JsonToken.END_OBJECT) {
                throw new JsonUpdateException("Expected object member, got " + token,
                    offset(parser.getTokenLocation()));
            }
            if (member == null) {
                // the parser stands just past the closing brace
                member = Member.missing(offset(parser.currentLocation()) - 1, empty);
            }

            JsonToken trailing = parser.nextToken();
            if (trailing != null) {
                throw new JsonUpdateException("Unexpected content after the object",
                    offset(parser.getTokenLocation()));
            }
            return member;
        } catch (JsonProcessingException e) {
            throw new JsonUpdateException(e.getOriginalMessage(), offset(e.getLocation()));
        } catch (IOException e) {
            throw new JsonUpdateException(e.getMessage());
        }
    }

    private static int offset(JsonLocation location) {
        return location == null ? -1 : (int) location.getCharOffset();
    }
}
