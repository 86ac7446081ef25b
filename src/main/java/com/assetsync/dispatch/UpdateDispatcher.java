package com.assetsync.dispatch;

import com.assetsync.config.AssetSyncProperties;
import com.assetsync.domain.model.DispatchResult;
import com.assetsync.domain.model.LookupResult;
import com.assetsync.domain.model.RemoteRecord;
import com.assetsync.domain.model.SerialMatches;
import com.assetsync.domain.model.UpdateBatch;
import com.assetsync.domain.vo.AssetIdentity;
import com.assetsync.exception.RemoteServiceException;
import com.assetsync.observability.ReconciliationMetrics;
import com.assetsync.reconciliation.CancellationToken;
import com.assetsync.remote.AssetServiceGateway;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single funnel for every outbound Lansweeper request: serial-number lookups and batched
 * asset updates.
 *
 * <p>Owns the run's request counter. Once {@code gateThreshold} requests have been issued,
 * and again after every further {@code gateThreshold}, the {@link ContinuationGate} is asked
 * before the next request goes out. A declined gate cancels the token and the pending request
 * is not sent. Once the token is cancelled, for whatever reason, no further request is sent.
 *
 * <p>One update call carries every staged field of an asset. Failures are returned, never
 * retried: the gate is the only backpressure.
 */
@Service
public class UpdateDispatcher {

    private static final Logger log = LoggerFactory.getLogger(UpdateDispatcher.class);

    private final AssetServiceGateway assetServiceGateway;
    private final ContinuationGate continuationGate;
    private final ReconciliationMetrics reconciliationMetrics;
    private final int gateThreshold;

    private long requestCount;

    public UpdateDispatcher(
            AssetServiceGateway assetServiceGateway,
            ContinuationGate continuationGate,
            AssetSyncProperties assetSyncProperties,
            ReconciliationMetrics reconciliationMetrics) {
        this.assetServiceGateway = assetServiceGateway;
        this.continuationGate = continuationGate;
        this.reconciliationMetrics = reconciliationMetrics;
        this.gateThreshold = assetSyncProperties.getDispatch().getGateThreshold();
    }

    /**
     * Looks up the asset(s) carrying the serial number.
     *
     * @return FOUND with the single record, NOT_FOUND, AMBIGUOUS when the service reports two
     *     or more matches,
     *     FAILED on a transport or service error, CANCELLED if the run is cancelled
     */
    public LookupResult lookup(AssetIdentity identity, CancellationToken cancellationToken) {
        if (!admit(cancellationToken)) {
            return LookupResult.cancelled();
        }
        try {
            SerialMatches matches = assetServiceGateway.findBySerial(identity.getSerialNumber());
            if (matches.isEmpty()) {
                log.warn("No asset found with serial number: {}", identity);
                return LookupResult.notFound();
            }
            if (!matches.isUnique()) {
                log.warn("{} assets found with serial number {}, skipping", matches.getTotal(), identity);
                return LookupResult.ambiguous(matches.getTotal());
            }
            return LookupResult.found(matches.getRecords().get(0));
        } catch (RemoteServiceException e) {
            log.error("Lookup failed for serial {}: {}", identity, e.getMessage());
            return LookupResult.failed(e.getMessage(), e.getErrorCode());
        }
    }

    /**
     * Sends all staged fields of one asset in a single update call. An empty batch issues
     * no request.
     */
    public DispatchResult dispatch(
            AssetIdentity identity, RemoteRecord remoteRecord, UpdateBatch batch, CancellationToken cancellationToken) {
        Map<String, String> attempted = batch.toValueMap();
        if (batch.isEmpty()) {
            return DispatchResult.success(attempted);
        }
        if (!admit(cancellationToken)) {
            log.warn("Update for serial {} not sent, run cancelled: {}", identity, attempted);
            reconciliationMetrics.recordDispatchFailure();
            return DispatchResult.failure(
                    attempted, "not sent, run cancelled (" + cancellationToken.getReason() + ")", null);
        }
        try {
            assetServiceGateway.updateAsset(remoteRecord.getKey(), batch);
            log.info("Successfully updated asset {} (serial {}): {}", remoteRecord.getKey(), identity, attempted);
            return DispatchResult.success(attempted);
        } catch (RemoteServiceException e) {
            log.error("Update failed for asset {} (serial {}): {}", remoteRecord.getKey(), identity, e.getMessage());
            reconciliationMetrics.recordDispatchFailure();
            return DispatchResult.failure(attempted, e.getMessage(), e.getErrorCode());
        }
    }

    /** Remote requests issued so far. */
    public long getRequestCount() {
        return requestCount;
    }

    private boolean admit(CancellationToken cancellationToken) {
        if (cancellationToken.isCancelled()) {
            return false;
        }
        if (requestCount > 0 && requestCount % gateThreshold == 0) {
            log.info("Reached {} requests, asking whether to continue", requestCount);
            if (!continuationGate.shouldContinue(requestCount)) {
                cancellationToken.cancel("declined at continuation gate after " + requestCount + " requests");
                return false;
            }
        }
        requestCount++;
        reconciliationMetrics.recordRequest();
        return true;
    }
}
