package com.assetsync.resolver;

import com.assetsync.domain.enums.Direction;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.vo.AssetIdentity;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves conflicts from a per-field table, e.g. "the workbook is authoritative for barcodes".
 * ABORT is accepted in the table and stops the run at the first conflict on that field.
 */
public class PolicyConflictResolver implements ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(PolicyConflictResolver.class);

    private final Map<String, Direction> policy;
    private final Direction defaultDirection;

    public PolicyConflictResolver(Map<String, Direction> policy, Direction defaultDirection) {
        this.policy = Map.copyOf(policy);
        this.defaultDirection = defaultDirection != null ? defaultDirection : Direction.SKIP;
    }

    @Override
    public Direction resolve(AssetIdentity identity, ComparableField field, String localValue, String remoteValue) {
        Direction direction = policy.getOrDefault(field.getRemoteName(), defaultDirection);
        log.debug("Policy for {} on {}: {}", field.getRemoteName(), identity, direction);
        return direction;
    }
}
