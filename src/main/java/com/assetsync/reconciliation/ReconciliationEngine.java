package com.assetsync.reconciliation;

import com.assetsync.domain.enums.Direction;
import com.assetsync.domain.enums.FieldType;
import com.assetsync.domain.enums.OutcomeType;
import com.assetsync.domain.enums.Representation;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.model.DispatchResult;
import com.assetsync.domain.model.FieldOutcome;
import com.assetsync.domain.model.LocalDataset;
import com.assetsync.domain.model.LocalRow;
import com.assetsync.domain.model.LookupResult;
import com.assetsync.domain.model.ReconciliationResult;
import com.assetsync.domain.model.RemoteRecord;
import com.assetsync.domain.model.UpdateBatch;
import com.assetsync.domain.vo.AssetIdentity;
import com.assetsync.domain.vo.FieldValue;
import com.assetsync.dispatch.UpdateDispatcher;
import com.assetsync.exception.ErrorCode;
import com.assetsync.ledger.ChangeLedger;
import com.assetsync.normalize.FieldComparator;
import com.assetsync.normalize.ValueNormalizer;
import com.assetsync.observability.ReconciliationMetrics;
import com.assetsync.resolver.ConflictResolver;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconciles every workbook row against its Lansweeper asset, one asset at a time.
 *
 * <p>Per asset: look up the serial number (skip the asset if it is not found, ambiguous or the
 * lookup fails), reconcile each comparable field, then send all staged remote changes in one
 * update call. Per field:
 * <ul>
 *   <li>both empty -> BOTH_EMPTY</li>
 *   <li>only Lansweeper has a value -> copy it into the row, FILL_LOCAL</li>
 *   <li>only the workbook has a value -> stage it for Lansweeper, FILL_REMOTE</li>
 *   <li>equal values -> MATCH</li>
 *   <li>different values -> ask the {@link ConflictResolver}</li>
 *   <li>an unparseable or malformed value on either side -> INVALID, nothing is written</li>
 * </ul>
 *
 * <p>The {@link CancellationToken} is checked before each asset and before each field. After an
 * ABORT the field being evaluated is recorded as SKIPPED and nothing else is processed; updates
 * already staged for that asset are recorded as not sent.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ValueNormalizer valueNormalizer;
    private final FieldComparator fieldComparator;
    private final ConflictResolver conflictResolver;
    private final UpdateDispatcher updateDispatcher;
    private final ReconciliationMetrics reconciliationMetrics;

    public ReconciliationEngine(
            ValueNormalizer valueNormalizer,
            FieldComparator fieldComparator,
            ConflictResolver conflictResolver,
            UpdateDispatcher updateDispatcher,
            ReconciliationMetrics reconciliationMetrics) {
        this.valueNormalizer = valueNormalizer;
        this.fieldComparator = fieldComparator;
        this.conflictResolver = conflictResolver;
        this.updateDispatcher = updateDispatcher;
        this.reconciliationMetrics = reconciliationMetrics;
    }

    /**
     * Runs one pass over the dataset in row order. Rows are mutated in place; the caller decides
     * whether to persist them.
     */
    public ReconciliationResult reconcile(
            LocalDataset dataset,
            String identityColumn,
            List<ComparableField> fields,
            ChangeLedger changeLedger,
            CancellationToken cancellationToken) {
        long startTime = System.currentTimeMillis();
        long requestsBefore = updateDispatcher.getRequestCount();
        ReconciliationResult result = ReconciliationResult.builder()
                .startedAt(LocalDateTime.now())
                .build();
        log.info("Reconciliation started: {} rows, fields {}", dataset.getRows().size(),
                fields.stream().map(ComparableField::getLocalName).toList());

        for (LocalRow row : dataset.getRows()) {
            if (cancellationToken.isCancelled()) {
                break;
            }
            Object rawSerial = row.get(identityColumn);
            if (ValueNormalizer.isEmpty(rawSerial)) {
                log.warn("Skipping row {}: No serial number", row.getRowNumber() + 1);
                result.setRowsWithoutIdentity(result.getRowsWithoutIdentity() + 1);
                continue;
            }
            AssetIdentity identity = AssetIdentity.of(
                    valueNormalizer.render(valueNormalizer.normalize(rawSerial, FieldType.TEXT), Representation.LOCAL));
            reconcileIdentity(identity, row, fields, changeLedger, cancellationToken, result);
        }

        result.setRequestsIssued(updateDispatcher.getRequestCount() - requestsBefore);
        result.setCancelled(cancellationToken.isCancelled());
        result.setDurationMs(System.currentTimeMillis() - startTime);

        if (result.isCancelled()) {
            log.warn("Reconciliation cancelled: {}", cancellationToken.getReason());
        }
        log.info(
                "Reconciliation complete: processed={}, notFound={}, ambiguous={}, lookupFailures={}, "
                        + "localMutations={}, updates={}, updateFailures={}, requests={}, duration={}ms",
                result.getIdentitiesProcessed(),
                result.getNotFound(),
                result.getAmbiguous(),
                result.getLookupFailures(),
                result.getLocalMutations(),
                result.getDispatchSuccesses(),
                result.getDispatchFailures(),
                result.getRequestsIssued(),
                result.getDurationMs());
        return result;
    }

    private void reconcileIdentity(
            AssetIdentity identity,
            LocalRow row,
            List<ComparableField> fields,
            ChangeLedger changeLedger,
            CancellationToken cancellationToken,
            ReconciliationResult result) {
        log.info("Processing serial number: {}", identity);

        LookupResult lookupResult = updateDispatcher.lookup(identity, cancellationToken);
        switch (lookupResult.getStatus()) {
            case CANCELLED -> {
                return;
            }
            case NOT_FOUND -> result.setNotFound(result.getNotFound() + 1);
            case AMBIGUOUS -> result.setAmbiguous(result.getAmbiguous() + 1);
            case FAILED -> result.setLookupFailures(result.getLookupFailures() + 1);
            case FOUND -> {
                // reconciled below
            }
        }
        if (!lookupResult.isFound()) {
            changeLedger.recordIdentityIssue(identity, lookupResult);
            return;
        }

        RemoteRecord remoteRecord = lookupResult.getRecord();
        log.info("Retrieved asset for serial {}: {}", identity, remoteRecord.getName());
        result.setIdentitiesProcessed(result.getIdentitiesProcessed() + 1);
        reconciliationMetrics.recordIdentityProcessed();

        UpdateBatch batch = new UpdateBatch();
        for (ComparableField field : fields) {
            if (cancellationToken.isCancelled()) {
                break;
            }
            FieldOutcome outcome = reconcileField(identity, row, remoteRecord, field, batch, cancellationToken);
            result.getOutcomes().add(outcome);
            changeLedger.recordOutcome(outcome);
            reconciliationMetrics.recordOutcome(outcome.getType());
            if (outcome.isLocalMutation()) {
                result.setLocalMutations(result.getLocalMutations() + 1);
            }
        }

        if (!batch.isEmpty()) {
            DispatchResult dispatchResult = updateDispatcher.dispatch(identity, remoteRecord, batch, cancellationToken);
            changeLedger.recordDispatch(identity, remoteRecord.getKey(), dispatchResult);
            if (dispatchResult.isSuccess()) {
                result.setDispatchSuccesses(result.getDispatchSuccesses() + 1);
            } else {
                result.setDispatchFailures(result.getDispatchFailures() + 1);
            }
        }
    }

    FieldOutcome reconcileField(
            AssetIdentity identity,
            LocalRow row,
            RemoteRecord remoteRecord,
            ComparableField field,
            UpdateBatch batch,
            CancellationToken cancellationToken) {
        FieldValue local = valueNormalizer.normalize(row.get(field.getLocalName()), field);
        FieldValue remote = valueNormalizer.normalize(remoteRecord.get(field.getRemoteName()), field);

        FieldOutcome.FieldOutcomeBuilder outcome = FieldOutcome.builder()
                .serialNumber(identity.getSerialNumber())
                .localField(field.getLocalName())
                .remoteField(field.getRemoteName())
                .localValue(valueNormalizer.render(local, Representation.LOCAL))
                .remoteValue(valueNormalizer.render(remote, Representation.LOCAL));

        if (local.isInvalid() || remote.isInvalid()) {
            String reason = local.isInvalid()
                    ? "spreadsheet value " + local.getReason()
                    : "Lansweeper value " + remote.getReason();
            log.warn("Format conflict for {} on serial {}: {}", field.getLocalName(), identity, reason);
            return outcome.type(OutcomeType.INVALID).reason(reason).errorCode(ErrorCode.VALUE_UNPARSEABLE).build();
        }

        if (local.isEmpty() && remote.isEmpty()) {
            return outcome.type(OutcomeType.BOTH_EMPTY).build();
        }

        if (local.isEmpty()) {
            String value = valueNormalizer.render(remote, Representation.LOCAL);
            row.set(field.getLocalName(), value);
            log.info("Filled {} for {} from Lansweeper: {}", field.getLocalName(), identity, value);
            return outcome.type(OutcomeType.FILL_LOCAL).value(value).build();
        }

        if (remote.isEmpty()) {
            String value = valueNormalizer.render(local, Representation.REMOTE);
            batch.stage(field.getRemoteName(), field.getType(), value);
            log.info("Will update {} for {}: {}", field.getRemoteName(), identity, value);
            return outcome.type(OutcomeType.FILL_REMOTE).value(value).build();
        }

        if (fieldComparator.equal(local, remote, field.getType())) {
            return outcome.type(OutcomeType.MATCH).build();
        }

        Direction direction = conflictResolver.resolve(
                identity, field, valueNormalizer.render(local, Representation.LOCAL),
                valueNormalizer.render(remote, Representation.LOCAL));
        log.info("Conflict on {} for {}: spreadsheet='{}' Lansweeper='{}', decision={}", field.getLocalName(),
                identity, valueNormalizer.render(local, Representation.LOCAL),
                valueNormalizer.render(remote, Representation.LOCAL), direction);

        return switch (direction) {
            case ADOPT_LOCAL -> {
                String value = valueNormalizer.render(local, Representation.REMOTE);
                batch.stage(field.getRemoteName(), field.getType(), value);
                yield outcome.type(OutcomeType.CONFLICT_RESOLVED).direction(direction).value(value).build();
            }
            case ADOPT_REMOTE -> {
                String value = valueNormalizer.render(remote, Representation.LOCAL);
                row.set(field.getLocalName(), value);
                yield outcome.type(OutcomeType.CONFLICT_RESOLVED).direction(direction).value(value).build();
            }
            case SKIP -> outcome.type(OutcomeType.SKIPPED).build();
            case ABORT -> {
                cancellationToken.cancel("aborted at conflict on " + field.getLocalName() + " for serial " + identity);
                yield outcome.type(OutcomeType.SKIPPED).reason("aborted").build();
            }
        };
    }
}
