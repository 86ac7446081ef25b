package com.assetsync.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Summary of one reconciliation run over the workbook.
 *
 * <p>{@code outcomes} holds one entry per comparable field per processed asset, in processing
 * order. Assets skipped as not found, ambiguous or failed lookups contribute no outcomes.
 */
@Data
@Builder
public class ReconciliationResult {

    private LocalDateTime startedAt;

    @Builder.Default
    private List<FieldOutcome> outcomes = new ArrayList<>();

    private long requestsIssued;
    private int identitiesProcessed;
    private int notFound;
    private int ambiguous;
    private int lookupFailures;
    private int dispatchSuccesses;
    private int dispatchFailures;
    private int rowsWithoutIdentity;
    private int localMutations;
    private boolean cancelled;
    private long durationMs;

    public int getIdentitiesSkipped() {
        return notFound + ambiguous + lookupFailures;
    }

    public boolean hasLocalMutations() {
        return localMutations > 0;
    }
}
