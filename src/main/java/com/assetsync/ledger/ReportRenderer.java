package com.assetsync.ledger;

import com.assetsync.domain.enums.LedgerCategory;
import com.assetsync.domain.model.LedgerEntry;
import com.assetsync.domain.model.ReconciliationResult;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders a run's ledger as the plain-text discrepancy report.
 *
 * <p>Layout: a banner with the generation time, one section per {@link LedgerCategory} in
 * declaration order (each with its own header and timestamp, "(none)" when empty), then the
 * run summary. The output is meant to be appended to the report file after earlier runs.
 */
@Component
public class ReportRenderer {

    static final String RULE = "=".repeat(80);
    static final String SECTION_RULE = "-".repeat(80);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public ReportRenderer() {
        this(Clock.systemDefaultZone());
    }

    public ReportRenderer(Clock clock) {
        this.clock = clock;
    }

    public String render(ChangeLedger changeLedger, ReconciliationResult reconciliationResult) {
        String generatedAt = TIMESTAMP.format(LocalDateTime.now(clock));
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(RULE).append('\n');
        sb.append("Asset Discrepancy Report - Generated: ").append(generatedAt).append('\n');
        sb.append(RULE).append("\n\n");

        for (LedgerCategory category : LedgerCategory.values()) {
            renderSection(sb, category, changeLedger.getEntries(category), generatedAt);
        }
        renderSummary(sb, reconciliationResult);
        return sb.toString();
    }

    private void renderSection(
            StringBuilder sb, LedgerCategory category, List<LedgerEntry> entries, String generatedAt) {
        sb.append(category.getTitle()).append(" (").append(entries.size()).append(") - Generated: ")
                .append(generatedAt).append('\n');
        sb.append(SECTION_RULE).append('\n');
        if (entries.isEmpty()) {
            sb.append("  (none)\n");
        }
        for (LedgerEntry entry : entries) {
            sb.append(renderEntry(entry)).append('\n');
        }
        sb.append('\n');
    }

    String renderEntry(LedgerEntry entry) {
        StringBuilder line = new StringBuilder("  ").append(entry.getType()).append(": Serial ")
                .append(entry.getSerialNumber());
        if (entry.getField() != null) {
            line.append(" [").append(entry.getField()).append(']');
        }
        if (entry.getLocalValue() != null || entry.getRemoteValue() != null) {
            line.append(" Spreadsheet='").append(nullToEmpty(entry.getLocalValue()))
                    .append("' vs Lansweeper='").append(nullToEmpty(entry.getRemoteValue())).append('\'');
        }
        if (entry.getDetail() != null) {
            line.append(" - ").append(entry.getDetail());
        }
        return line.toString();
    }

    private void renderSummary(StringBuilder sb, ReconciliationResult result) {
        sb.append("Summary\n").append(SECTION_RULE).append('\n');
        sb.append("  Requests issued:        ").append(result.getRequestsIssued()).append('\n');
        sb.append("  Identities processed:   ").append(result.getIdentitiesProcessed()).append('\n');
        sb.append("  Not found:              ").append(result.getNotFound()).append('\n');
        sb.append("  Ambiguous:              ").append(result.getAmbiguous()).append('\n');
        sb.append("  Lookup failures:        ").append(result.getLookupFailures()).append('\n');
        sb.append("  Rows without serial:    ").append(result.getRowsWithoutIdentity()).append('\n');
        sb.append("  Local fields updated:   ").append(result.getLocalMutations()).append('\n');
        sb.append("  Remote updates applied: ").append(result.getDispatchSuccesses()).append('\n');
        sb.append("  Remote updates failed:  ").append(result.getDispatchFailures()).append('\n');
        if (result.isCancelled()) {
            sb.append("  Run was cancelled before all rows were processed\n");
        }
        sb.append('\n');
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
