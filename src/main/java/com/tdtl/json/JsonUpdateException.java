package com.tdtl.json;

/**
 * Thrown when a JSON document cannot be patched: the replacement value has no
 * inline JSON form, the document is not a well-formed object, or the key is missing.
 */
public class JsonUpdateException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public JsonUpdateException(String message) {
        this(message, -1);
    }

    public JsonUpdateException(String message, int offset) {
        super(offset < 0 ? message : message + " at offset " + offset);
        this.offset = offset;
    }

    /** Character offset in the document where scanning stopped, or {@code -1} if not positional. */
    public int offset() {
        return offset;
    }
}
