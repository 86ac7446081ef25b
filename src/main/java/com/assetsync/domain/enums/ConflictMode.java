package com.assetsync.domain.enums;

/**
 * Selects the {@link com.assetsync.resolver.ConflictResolver} implementation.
 */
public enum ConflictMode {
    SKIP,
    POLICY,
    INTERACTIVE
}
