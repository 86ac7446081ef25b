package com.assetsync.resolver;

import com.assetsync.domain.enums.Direction;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.vo.AssetIdentity;

public class SkipConflictResolver implements ConflictResolver {

    @Override
    public Direction resolve(AssetIdentity identity, ComparableField field, String localValue, String remoteValue) {
        return Direction.SKIP;
    }
}
