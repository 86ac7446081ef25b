package com.assetsync.domain.enums;

/**
 * Result of reconciling one comparable field for one asset.
 */
public enum OutcomeType {
    BOTH_EMPTY,
    FILL_LOCAL,
    FILL_REMOTE,
    MATCH,
    CONFLICT_RESOLVED,
    SKIPPED,
    INVALID;

    /** True if this outcome wrote a value into the local row. */
    public boolean isLocalMutation(Direction direction) {
        return this == FILL_LOCAL || (this == CONFLICT_RESOLVED && direction == Direction.ADOPT_REMOTE);
    }
}
