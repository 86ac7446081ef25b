package com.assetsync.domain.model;

import java.nio.file.Path;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * The loaded workbook: header columns in sheet order and the data rows in sheet order.
 * Row order is the processing order of a reconciliation run.
 */
@Getter
@Builder
public class LocalDataset {

    private final Path path;
    private final String sheetName;
    private final List<String> columns;
    private final List<LocalRow> rows;

    public boolean isModified() {
        return rows.stream().anyMatch(LocalRow::isModified);
    }

    public long getModifiedRowCount() {
        return rows.stream().filter(LocalRow::isModified).count();
    }
}
