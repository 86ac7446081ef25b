package com.assetsync.domain.enums;

/**
 * Destination-specific rendering of a normalized value.
 *
 * <p>LOCAL renders dates as {@code yyyy-MM-dd} for the workbook and the report.
 * REMOTE renders dates as a UTC midnight timestamp for Lansweeper updates.
 */
public enum Representation {
    LOCAL,
    REMOTE
}
