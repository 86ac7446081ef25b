package com.assetsync.domain.enums;

/**
 * Selects the {@link com.assetsync.dispatch.ContinuationGate} implementation.
 * ACCEPT is for unattended runs and never pauses.
 */
public enum GateMode {
    INTERACTIVE,
    ACCEPT
}
