package com.tdtl.value;

/**
 * Type tag of a {@link Node}. {@link #NUMBER} is a coercion target only: no node
 * reports it from {@link Node#type()}, it stands for "Int or Float, whichever fits".
 */
public enum Type {
    /** Not a value. Only representable in JSON by omitting it. */
    UNDEFINED,
    NULL,
    BOOL,
    NUMBER,
    INT,
    FLOAT,
    STRING,
    ARRAY,
    /** A raw block of JSON, object or array. */
    JSON;

    public boolean isNumeric() {
        return this == NUMBER || this == INT || this == FLOAT;
    }
}
