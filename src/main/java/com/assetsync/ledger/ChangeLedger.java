package com.assetsync.ledger;

import com.assetsync.domain.enums.LedgerCategory;
import com.assetsync.domain.enums.LedgerEntryType;
import com.assetsync.domain.model.DispatchResult;
import com.assetsync.domain.model.FieldOutcome;
import com.assetsync.domain.model.LedgerEntry;
import com.assetsync.domain.model.LookupResult;
import com.assetsync.domain.vo.AssetIdentity;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Append-only record of everything a run changed, skipped or could not do.
 *
 * <p>Entries are kept per {@link LedgerCategory} and in global processing order. MATCH and
 * FILL_REMOTE outcomes add no entry of their own: matches change nothing, and staged remote
 * values are recorded once per asset by {@link #recordDispatch}. The ledger never touches the
 * workbook or Lansweeper.
 *
 * <p>One instance per run, not thread-safe.
 */
public class ChangeLedger {

    private final Clock clock;
    private final Map<LedgerCategory, List<LedgerEntry>> entries = new EnumMap<>(LedgerCategory.class);
    private long sequence;

    public ChangeLedger() {
        this(Clock.systemDefaultZone());
    }

    public ChangeLedger(Clock clock) {
        this.clock = clock;
        for (LedgerCategory category : LedgerCategory.values()) {
            entries.put(category, new ArrayList<>());
        }
    }

    public void recordIdentityIssue(AssetIdentity identity, LookupResult lookupResult) {
        LedgerEntryType type = switch (lookupResult.getStatus()) {
            case NOT_FOUND -> LedgerEntryType.NOT_FOUND;
            case AMBIGUOUS -> LedgerEntryType.AMBIGUOUS;
            case FAILED -> LedgerEntryType.LOOKUP_FAILED;
            case FOUND, CANCELLED -> null;
        };
        if (type == null) {
            return;
        }
        append(LedgerCategory.IDENTITY_ISSUE, LedgerEntry.builder()
                .type(type)
                .serialNumber(identity.getSerialNumber())
                .detail(lookupResult.getReason()));
    }

    public void recordOutcome(FieldOutcome outcome) {
        switch (outcome.getType()) {
            case BOTH_EMPTY -> append(LedgerCategory.MISSING_DATA, fieldEntry(outcome, LedgerEntryType.BOTH_EMPTY)
                    .detail("no value in either source"));
            case FILL_LOCAL -> append(LedgerCategory.LOCAL_MUTATION, fieldEntry(outcome, LedgerEntryType.LOCAL_UPDATED)
                    .detail("filled from Lansweeper: " + outcome.getValue()));
            case CONFLICT_RESOLVED -> {
                append(LedgerCategory.CONFLICT, fieldEntry(outcome, LedgerEntryType.CONFLICT_RESOLVED)
                        .detail(outcome.getDirection() + " -> " + outcome.getValue()));
                if (outcome.isLocalMutation()) {
                    append(LedgerCategory.LOCAL_MUTATION, fieldEntry(outcome, LedgerEntryType.LOCAL_UPDATED)
                            .detail("overwritten with Lansweeper value: " + outcome.getValue()));
                }
            }
            case SKIPPED -> append(LedgerCategory.CONFLICT, fieldEntry(outcome, LedgerEntryType.CONFLICT_SKIPPED)
                    .detail(outcome.getReason() != null ? "skipped (" + outcome.getReason() + ")" : "skipped"));
            case INVALID -> {
                String code = outcome.getErrorCode() != null ? outcome.getErrorCode().getCode() + ": " : "";
                append(LedgerCategory.CONFLICT, fieldEntry(outcome, LedgerEntryType.FORMAT_CONFLICT)
                        .detail(code + outcome.getReason()));
            }
            case MATCH, FILL_REMOTE -> {
                // recorded by the dispatch entry, or nothing to record
            }
        }
    }

    public void recordDispatch(AssetIdentity identity, String assetKey, DispatchResult dispatchResult) {
        String fields = dispatchResult.getAttempted().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        LedgerEntry.LedgerEntryBuilder builder = LedgerEntry.builder()
                .serialNumber(identity.getSerialNumber())
                .field(fields);
        if (dispatchResult.isSuccess()) {
            builder.type(LedgerEntryType.REMOTE_UPDATED).detail("asset " + assetKey + " updated");
        } else {
            String code = dispatchResult.getErrorCode() != null ? dispatchResult.getErrorCode().getCode() + ": " : "";
            builder.type(LedgerEntryType.REMOTE_UPDATE_FAILED)
                    .detail("asset " + assetKey + " NOT updated, " + code + dispatchResult.getReason());
        }
        append(LedgerCategory.REMOTE_MUTATION, builder);
    }

    public List<LedgerEntry> getEntries(LedgerCategory category) {
        return Collections.unmodifiableList(entries.get(category));
    }

    /** All entries across categories in processing order. */
    public List<LedgerEntry> getAllEntries() {
        return entries.values().stream()
                .flatMap(List::stream)
                .sorted((a, b) -> Long.compare(a.getSequence(), b.getSequence()))
                .toList();
    }

    public long count(LedgerEntryType type) {
        return entries.values().stream()
                .flatMap(List::stream)
                .filter(e -> e.getType() == type)
                .count();
    }

    public boolean isEmpty() {
        return sequence == 0;
    }

    private LedgerEntry.LedgerEntryBuilder fieldEntry(FieldOutcome outcome, LedgerEntryType type) {
        return LedgerEntry.builder()
                .type(type)
                .serialNumber(outcome.getSerialNumber())
                .field(outcome.getLocalField())
                .localValue(outcome.getLocalValue())
                .remoteValue(outcome.getRemoteValue());
    }

    private void append(LedgerCategory category, LedgerEntry.LedgerEntryBuilder builder) {
        entries.get(category).add(builder.sequence(++sequence)
                .timestamp(LocalDateTime.now(clock))
                .category(category)
                .build());
    }
}
