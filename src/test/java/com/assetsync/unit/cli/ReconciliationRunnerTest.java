package com.assetsync.unit.cli;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.assetsync.cli.ReconciliationRunner;
import com.assetsync.config.AssetSyncProperties;
import com.assetsync.config.LansweeperConfig;
import com.assetsync.domain.model.LocalDataset;
import com.assetsync.domain.model.LocalRow;
import com.assetsync.domain.model.ReconciliationResult;
import com.assetsync.exception.PreconditionFailedException;
import com.assetsync.ledger.ReportRenderer;
import com.assetsync.ledger.ReportWriter;
import com.assetsync.local.LocalDatasetStore;
import com.assetsync.observability.ReconciliationMetrics;
import com.assetsync.reconciliation.ReconciliationEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

/**
 * Tests for ReconciliationRunner covering credential and column preconditions, report output,
 * and saving the workbook only when a row changed.
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationRunnerTest {

    @Mock
    private LocalDatasetStore localDatasetStore;

    @Mock
    private ReconciliationEngine reconciliationEngine;

    @Mock
    private ReportRenderer reportRenderer;

    @Mock
    private ReportWriter reportWriter;

    private AssetSyncProperties assetSyncProperties;
    private LansweeperConfig lansweeperConfig;
    private ReconciliationRunner reconciliationRunner;
    private LocalDataset dataset;

    @BeforeEach
    void setUp() {
        assetSyncProperties = new AssetSyncProperties();
        assetSyncProperties.setDatasetPath("assets.xlsx");
        assetSyncProperties.setReportFile("discrepancies.txt");
        lansweeperConfig = new LansweeperConfig();
        lansweeperConfig.setSiteId("site-1");
        lansweeperConfig.setToken("secret");
        reconciliationRunner = new ReconciliationRunner(
                assetSyncProperties,
                lansweeperConfig,
                localDatasetStore,
                reconciliationEngine,
                reportRenderer,
                reportWriter,
                new ReconciliationMetrics(new SimpleMeterRegistry()));

        Map<String, Object> values = new HashMap<>();
        values.put("Serial Number", "SN1");
        dataset = LocalDataset.builder()
                .path(Path.of("assets.xlsx"))
                .sheetName("Assets")
                .columns(List.of("Serial Number", "Barcode Number", "Invoice Date", "Extended Warranty"))
                .rows(List.of(new LocalRow(1, values)))
                .build();
    }

    private void stubRun() {
        when(localDatasetStore.load(Path.of("assets.xlsx"))).thenReturn(dataset);
        when(reconciliationEngine.reconcile(eq(dataset), eq("Serial Number"), anyList(), any(), any()))
                .thenReturn(ReconciliationResult.builder().build());
        when(reportRenderer.render(any(), any())).thenReturn("report");
    }

    @Test
    @DisplayName("Requires the identity column and every configured field column")
    void requiredColumns() {
        stubRun();

        reconciliationRunner.run(new DefaultApplicationArguments());

        verify(localDatasetStore)
                .requireColumns(
                        dataset, List.of("Serial Number", "Barcode Number", "Invoice Date", "Extended Warranty"));
    }

    @Test
    @DisplayName("Report is appended and an unchanged workbook is not saved")
    void noLocalChanges() {
        stubRun();

        reconciliationRunner.run(new DefaultApplicationArguments());

        verify(reportWriter).append(Path.of("discrepancies.txt"), "report");
        verify(localDatasetStore, never()).save(any());
    }

    @Test
    @DisplayName("A changed workbook is saved exactly once")
    void savesOnce() {
        stubRun();
        dataset.getRows().get(0).set("Barcode Number", "BC124");

        reconciliationRunner.run(new DefaultApplicationArguments());

        verify(localDatasetStore, times(1)).save(dataset);
    }

    @Test
    @DisplayName("Missing site id stops the run before the workbook is read")
    void missingSiteId() {
        lansweeperConfig.setSiteId(" ");

        assertThatThrownBy(() -> reconciliationRunner.run(new DefaultApplicationArguments()))
                .isInstanceOf(PreconditionFailedException.class)
                .hasMessageContaining("LANSWEEPER_SITE_ID");
        verifyNoInteractions(localDatasetStore, reconciliationEngine);
    }

    @Test
    @DisplayName("Missing token stops the run before the workbook is read")
    void missingToken() {
        lansweeperConfig.setToken(null);

        assertThatThrownBy(() -> reconciliationRunner.run(new DefaultApplicationArguments()))
                .isInstanceOf(PreconditionFailedException.class)
                .hasMessageContaining("LANSWEEPER_PAT_TOKEN");
        verifyNoInteractions(localDatasetStore, reconciliationEngine);
    }

    @Test
    @DisplayName("Missing columns stop the run before any reconciliation")
    void missingColumns() {
        when(localDatasetStore.load(any())).thenReturn(dataset);
        doThrow(new PreconditionFailedException("Missing required columns: [Invoice Date]"))
                .when(localDatasetStore)
                .requireColumns(any(), anyList());

        assertThatThrownBy(() -> reconciliationRunner.run(new DefaultApplicationArguments()))
                .isInstanceOf(PreconditionFailedException.class);
        verifyNoInteractions(reconciliationEngine, reportWriter);
        verify(localDatasetStore, never()).save(any());
    }

    @Test
    @DisplayName("Report file path comes from configuration")
    void reportPath() {
        assetSyncProperties.setReportFile("out/report.txt");
        stubRun();

        reconciliationRunner.run(new DefaultApplicationArguments());

        verify(reportWriter).append(eq(Path.of("out/report.txt")), anyString());
    }
}
