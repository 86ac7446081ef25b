package com.assetsync.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import com.assetsync.domain.enums.LedgerCategory;
import com.assetsync.domain.enums.OutcomeType;
import com.assetsync.domain.model.FieldOutcome;
import com.assetsync.domain.model.LookupResult;
import com.assetsync.domain.model.ReconciliationResult;
import com.assetsync.domain.vo.AssetIdentity;
import com.assetsync.ledger.ChangeLedger;
import com.assetsync.ledger.ReportRenderer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReportRendererTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-11-08T10:15:30Z"), ZoneOffset.UTC);

    private ReportRenderer reportRenderer;
    private ChangeLedger changeLedger;

    @BeforeEach
    void setUp() {
        reportRenderer = new ReportRenderer(CLOCK);
        changeLedger = new ChangeLedger(CLOCK);
    }

    @Test
    @DisplayName("Report has a banner, every section in order and the summary")
    void layout() {
        changeLedger.recordIdentityIssue(AssetIdentity.of("SN9"), LookupResult.notFound());
        changeLedger.recordOutcome(FieldOutcome.builder()
                .serialNumber("SN1")
                .localField("Barcode Number")
                .remoteField("barCode")
                .type(OutcomeType.SKIPPED)
                .localValue("BC123")
                .remoteValue("BC124")
                .build());
        ReconciliationResult result = ReconciliationResult.builder()
                .requestsIssued(2)
                .identitiesProcessed(1)
                .notFound(1)
                .build();

        String report = reportRenderer.render(changeLedger, result);

        assertThat(report).contains("Asset Discrepancy Report - Generated: 2024-11-08 10:15:30");
        assertThat(report).contains("  NOT_FOUND: Serial SN9 - no asset with this serial number");
        assertThat(report).contains(
                "  CONFLICT_SKIPPED: Serial SN1 [Barcode Number] Spreadsheet='BC123' vs Lansweeper='BC124' - skipped");
        assertThat(report).contains("  Requests issued:        2");
        assertThat(report).doesNotContain("cancelled");

        int previous = -1;
        for (LedgerCategory category : LedgerCategory.values()) {
            int index = report.indexOf(category.getTitle());
            assertThat(index).isGreaterThan(previous);
            previous = index;
        }
        assertThat(report.indexOf("Summary")).isGreaterThan(previous);
    }

    @Test
    @DisplayName("Empty sections say (none) and carry their count")
    void emptySection() {
        String report = reportRenderer.render(changeLedger, ReconciliationResult.builder().build());

        assertThat(report).contains("Fields Empty In Both Sources (0) - Generated: 2024-11-08 10:15:30\n"
                + "-".repeat(80) + "\n  (none)\n");
    }

    @Test
    @DisplayName("A cancelled run is flagged in the summary")
    void cancelled() {
        String report = reportRenderer.render(changeLedger, ReconciliationResult.builder().cancelled(true).build());

        assertThat(report).contains("Run was cancelled");
    }
}
