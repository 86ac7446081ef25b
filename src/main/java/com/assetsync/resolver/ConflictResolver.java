package com.assetsync.resolver;

import com.assetsync.domain.enums.Direction;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.vo.AssetIdentity;

/**
 * Decides which side wins when the workbook and Lansweeper hold different non-empty values
 * for the same field. Called at most once per conflicting field.
 *
 * <p>Three implementations exist:
 * <ul>
 *   <li>{@link SkipConflictResolver}: always SKIP, report only (default)</li>
 *   <li>{@link PolicyConflictResolver}: fixed direction per remote field</li>
 *   <li>{@link ConsoleConflictResolver}: asks the operator on the terminal</li>
 * </ul>
 */
public interface ConflictResolver {

    /**
     * @param identity    the asset being reconciled
     * @param field       the conflicting field
     * @param localValue  workbook value, rendered for display
     * @param remoteValue Lansweeper value, rendered for display
     * @return the direction to apply; ABORT cancels the rest of the run
     */
    Direction resolve(AssetIdentity identity, ComparableField field, String localValue, String remoteValue);
}
