package com.assetsync.observability;

import com.assetsync.domain.enums.OutcomeType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for a reconciliation run:
 * <ul>
 *   <li><b>assetsync.requests</b>: remote requests issued (lookups and updates)</li>
 *   <li><b>assetsync.identities.processed</b>: assets whose fields were reconciled</li>
 *   <li><b>assetsync.outcomes</b>: field outcomes, tagged by {@code type}</li>
 *   <li><b>assetsync.dispatch.failures</b>: update batches that were not applied</li>
 * </ul>
 */
@Service
public class ReconciliationMetrics {

    private final Counter requestCounter;
    private final Counter identitiesProcessedCounter;
    private final Counter dispatchFailureCounter;
    private final Map<OutcomeType, Counter> outcomeCounters = new EnumMap<>(OutcomeType.class);

    public ReconciliationMetrics(MeterRegistry meterRegistry) {
        this.requestCounter = Counter.builder("assetsync.requests")
                .description("Remote requests issued to Lansweeper")
                .register(meterRegistry);

        this.identitiesProcessedCounter = Counter.builder("assetsync.identities.processed")
                .description("Assets whose fields were reconciled")
                .register(meterRegistry);

        this.dispatchFailureCounter = Counter.builder("assetsync.dispatch.failures")
                .description("Update batches rejected or not sent")
                .register(meterRegistry);

        for (OutcomeType type : OutcomeType.values()) {
            outcomeCounters.put(type, Counter.builder("assetsync.outcomes")
                    .description("Field outcomes by type")
                    .tag("type", type.name())
                    .register(meterRegistry));
        }
    }

    public void recordRequest() {
        requestCounter.increment();
    }

    public void recordIdentityProcessed() {
        identitiesProcessedCounter.increment();
    }

    public void recordOutcome(OutcomeType type) {
        outcomeCounters.get(type).increment();
    }

    public void recordDispatchFailure() {
        dispatchFailureCounter.increment();
    }

    /** One-line rendering of the non-zero outcome counters, for the end-of-run log. */
    public String describeOutcomes() {
        return outcomeCounters.entrySet().stream()
                .filter(e -> e.getValue().count() > 0)
                .map(e -> e.getKey() + "=" + (long) e.getValue().count())
                .collect(Collectors.joining(", "));
    }

    public double getRequestCount() {
        return requestCounter.count();
    }

    public double getDispatchFailureCount() {
        return dispatchFailureCounter.count();
    }
}
