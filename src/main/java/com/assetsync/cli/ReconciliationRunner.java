package com.assetsync.cli;

import com.assetsync.config.AssetSyncProperties;
import com.assetsync.config.LansweeperConfig;
import com.assetsync.domain.enums.LedgerEntryType;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.model.LocalDataset;
import com.assetsync.domain.model.ReconciliationResult;
import com.assetsync.exception.PreconditionFailedException;
import com.assetsync.ledger.ChangeLedger;
import com.assetsync.ledger.ReportRenderer;
import com.assetsync.ledger.ReportWriter;
import com.assetsync.local.LocalDatasetStore;
import com.assetsync.observability.ReconciliationMetrics;
import com.assetsync.reconciliation.CancellationToken;
import com.assetsync.reconciliation.ReconciliationEngine;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one reconciliation pass when the application starts.
 *
 * <p>Sequence: verify Lansweeper credentials, load the workbook and check its columns, reconcile,
 * append the discrepancy report, and write the workbook back only if a row was changed. A
 * precondition failure stops the run before any remote request is made. A cancelled run still
 * reports and persists whatever was done before the cancellation.
 */
@Component
public class ReconciliationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationRunner.class);

    private final AssetSyncProperties assetSyncProperties;
    private final LansweeperConfig lansweeperConfig;
    private final LocalDatasetStore localDatasetStore;
    private final ReconciliationEngine reconciliationEngine;
    private final ReportRenderer reportRenderer;
    private final ReportWriter reportWriter;
    private final ReconciliationMetrics reconciliationMetrics;

    public ReconciliationRunner(
            AssetSyncProperties assetSyncProperties,
            LansweeperConfig lansweeperConfig,
            LocalDatasetStore localDatasetStore,
            ReconciliationEngine reconciliationEngine,
            ReportRenderer reportRenderer,
            ReportWriter reportWriter,
            ReconciliationMetrics reconciliationMetrics) {
        this.assetSyncProperties = assetSyncProperties;
        this.lansweeperConfig = lansweeperConfig;
        this.localDatasetStore = localDatasetStore;
        this.reconciliationEngine = reconciliationEngine;
        this.reportRenderer = reportRenderer;
        this.reportWriter = reportWriter;
        this.reconciliationMetrics = reconciliationMetrics;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            reconcile();
        } catch (PreconditionFailedException e) {
            if (e.getDetails().isEmpty()) {
                log.error("Cannot start reconciliation: {}", e.getMessage());
            } else {
                log.error("Cannot start reconciliation: {} {}", e.getMessage(), e.getDetails());
            }
            throw e;
        }
    }

    /** Runs the full pass and returns its result. */
    public ReconciliationResult reconcile() {
        checkCredentials();

        Path datasetPath = Path.of(assetSyncProperties.getDatasetPath());
        List<ComparableField> fields = assetSyncProperties.getFields();
        String identityColumn = assetSyncProperties.getIdentityColumn();

        LocalDataset dataset = localDatasetStore.load(datasetPath);
        List<String> requiredColumns = new ArrayList<>();
        requiredColumns.add(identityColumn);
        fields.forEach(field -> requiredColumns.add(field.getLocalName()));
        localDatasetStore.requireColumns(dataset, requiredColumns);
        log.info("Loaded {} rows from {}", dataset.getRows().size(), datasetPath);

        ChangeLedger changeLedger = new ChangeLedger();
        ReconciliationResult result = reconciliationEngine.reconcile(
                dataset, identityColumn, fields, changeLedger, new CancellationToken());

        changeLedger.getAllEntries().forEach(entry -> log.debug("Ledger: {}", entry));
        if (changeLedger.isEmpty()) {
            log.info("No discrepancies recorded");
        }
        long failedUpdates = changeLedger.count(LedgerEntryType.REMOTE_UPDATE_FAILED);
        if (failedUpdates > 0) {
            log.warn("{} Lansweeper updates were not applied, see the report for the field values", failedUpdates);
        }

        Path reportPath = Path.of(assetSyncProperties.getReportFile());
        reportWriter.append(reportPath, reportRenderer.render(changeLedger, result));
        log.info("Discrepancy report written to {}", reportPath);

        if (dataset.isModified()) {
            localDatasetStore.save(dataset);
            log.info("Saved {} updated rows to {}", dataset.getModifiedRowCount(), datasetPath);
        } else {
            log.info("No spreadsheet changes to save");
        }

        log.info("Requests issued: {}, failed updates: {}",
                (long) reconciliationMetrics.getRequestCount(), (long) reconciliationMetrics.getDispatchFailureCount());
        log.info("Outcome counts: {}", reconciliationMetrics.describeOutcomes());
        return result;
    }

    private void checkCredentials() {
        if (isBlank(lansweeperConfig.getSiteId())) {
            throw new PreconditionFailedException("LANSWEEPER_SITE_ID environment variable is not set");
        }
        if (isBlank(lansweeperConfig.getToken())) {
            throw new PreconditionFailedException("LANSWEEPER_PAT_TOKEN environment variable is not set");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
