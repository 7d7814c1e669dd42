package com.tdtl.query;

/**
 * Streaming window kinds of a {@code WINDOW(...)} clause.
 */
public enum WindowType {
    /** No windowing, every record is evaluated on its own. */
    NONE,
    /** Fixed, non-overlapping windows; the interval equals the length. */
    TUMBLING,
    /** Fixed windows advancing by an interval shorter than their length, so they overlap. */
    HOPPING,
    /** A window of the given length re-evaluated on every event. */
    SLIDING,
    /** Closed after an inactivity gap given by the interval. */
    SESSION
}
