package com.assetsync.reconciliation;

/**
 * Cooperative cancellation for one reconciliation run.
 *
 * <p>Cancelled by an ABORT conflict decision or a declined continuation gate. The engine checks
 * it before each asset and before each field; an update call already issued always completes.
 * The first reason given is kept.
 */
public class CancellationToken {

    private volatile boolean cancelled;
    private volatile String reason;

    public void cancel(String reason) {
        if (!cancelled) {
            this.reason = reason;
            this.cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String getReason() {
        return reason;
    }
}
