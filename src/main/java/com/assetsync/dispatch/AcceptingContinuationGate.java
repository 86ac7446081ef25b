package com.assetsync.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate for unattended runs: logs the checkpoint and always continues.
 */
public class AcceptingContinuationGate implements ContinuationGate {

    private static final Logger log = LoggerFactory.getLogger(AcceptingContinuationGate.class);

    @Override
    public boolean shouldContinue(long requestsIssued) {
        log.info("{} requests issued, continuing without confirmation", requestsIssued);
        return true;
    }
}
