package com.assetsync.dispatch;

/**
 * Advisory pause presented every N remote requests so the operator can stay under the
 * Lansweeper rate limit. Declining cancels the run; nothing is throttled automatically.
 */
public interface ContinuationGate {

    /**
     * @param requestsIssued remote requests issued so far in this run
     * @return true to keep going, false to stop the run
     */
    boolean shouldContinue(long requestsIssued);
}
