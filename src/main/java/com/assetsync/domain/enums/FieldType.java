package com.assetsync.domain.enums;

/**
 * How a comparable field's raw values are normalized and compared.
 *
 * <p>TEXT values are trimmed strings compared case-sensitively. DATE values are parsed
 * against the known input patterns and compared by calendar date only.
 */
public enum FieldType {
    TEXT,
    DATE
}
