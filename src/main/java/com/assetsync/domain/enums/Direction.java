package com.assetsync.domain.enums;

/**
 * Decision returned by a {@link com.assetsync.resolver.ConflictResolver} for a conflicting field.
 *
 * <p>ADOPT_LOCAL pushes the workbook value to Lansweeper. ADOPT_REMOTE copies the Lansweeper
 * value into the workbook. SKIP leaves both untouched. ABORT stops the run after the current field.
 */
public enum Direction {
    ADOPT_LOCAL,
    ADOPT_REMOTE,
    SKIP,
    ABORT
}
