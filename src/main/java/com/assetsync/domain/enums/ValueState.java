package com.assetsync.domain.enums;

/**
 * Tag of a normalized {@link com.assetsync.domain.model.FieldValue}.
 *
 * <p>INVALID marks a non-empty value that could not be normalized (unparseable date,
 * pattern mismatch, structured JSON). It compares as EMPTY but is reported separately so
 * it is never mistaken for "no value entered".
 */
public enum ValueState {
    EMPTY,
    TEXT,
    DATE,
    INVALID
}
