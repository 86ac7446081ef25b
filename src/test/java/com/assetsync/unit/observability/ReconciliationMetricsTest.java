package com.assetsync.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.assetsync.domain.enums.OutcomeType;
import com.assetsync.observability.ReconciliationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReconciliationMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private ReconciliationMetrics reconciliationMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reconciliationMetrics = new ReconciliationMetrics(meterRegistry);
    }

    @Test
    @DisplayName("Outcome counters are tagged by type")
    void outcomeCounters() {
        reconciliationMetrics.recordOutcome(OutcomeType.FILL_LOCAL);
        reconciliationMetrics.recordOutcome(OutcomeType.FILL_LOCAL);
        reconciliationMetrics.recordOutcome(OutcomeType.MATCH);

        assertThat(meterRegistry.get("assetsync.outcomes").tag("type", "FILL_LOCAL").counter().count())
                .isEqualTo(2.0);
        assertThat(reconciliationMetrics.describeOutcomes()).isEqualTo("FILL_LOCAL=2, MATCH=1");
    }

    @Test
    @DisplayName("Request and failure counters increment")
    void requestCounters() {
        reconciliationMetrics.recordRequest();
        reconciliationMetrics.recordRequest();
        reconciliationMetrics.recordDispatchFailure();
        reconciliationMetrics.recordIdentityProcessed();

        assertThat(reconciliationMetrics.getRequestCount()).isEqualTo(2.0);
        assertThat(reconciliationMetrics.getDispatchFailureCount()).isEqualTo(1.0);
        assertThat(meterRegistry.get("assetsync.identities.processed").counter().count()).isEqualTo(1.0);
    }
}
