package com.assetsync.domain.model;

import com.assetsync.domain.enums.Direction;
import com.assetsync.domain.enums.OutcomeType;
import com.assetsync.exception.ErrorCode;
import lombok.Builder;
import lombok.Data;

/**
 * What happened to one comparable field of one asset.
 *
 * <p>{@code localValue} and {@code remoteValue} are the original values rendered for display.
 * {@code value} is the value that was written (FILL_LOCAL, FILL_REMOTE, CONFLICT_RESOLVED);
 * {@code direction} is only set for CONFLICT_RESOLVED. {@code reason} explains INVALID and
 * aborted SKIPPED outcomes; INVALID outcomes also carry {@code VALUE_UNPARSEABLE}.
 */
@Data
@Builder
public class FieldOutcome {

    private String serialNumber;
    private String localField;
    private String remoteField;
    private OutcomeType type;
    private Direction direction;
    private String value;
    private String localValue;
    private String remoteValue;
    private String reason;
    private ErrorCode errorCode;

    public boolean isLocalMutation() {
        return type != null && type.isLocalMutation(direction);
    }
}
