package com.assetsync.local;

import com.assetsync.domain.model.LocalDataset;
import com.assetsync.domain.model.LocalRow;
import com.assetsync.exception.PreconditionFailedException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Apache POI implementation of {@link LocalDatasetStore} for .xlsx and .xls workbooks.
 *
 * <p>Reads the first sheet. Row 0 holds the column headers (trimmed); every later row that has
 * at least one non-blank cell becomes a {@link LocalRow}. Cell values map to:
 * <ul>
 *   <li>string cells: String</li>
 *   <li>date-formatted numeric cells: LocalDateTime</li>
 *   <li>other numeric cells: Double</li>
 *   <li>boolean cells: Boolean</li>
 *   <li>formula cells: the cached result, by the same rules</li>
 *   <li>blank or error cells: null</li>
 * </ul>
 *
 * <p>{@link #save} reopens the file, rewrites only the modified cells as text, writes the
 * workbook to a temporary file next to the original and moves it into place. A failure before
 * the move leaves the original untouched.
 */
@Component
public class ExcelDatasetStore implements LocalDatasetStore {

    private static final Logger log = LoggerFactory.getLogger(ExcelDatasetStore.class);

    @Override
    public LocalDataset load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PreconditionFailedException("Spreadsheet file not found: " + path);
        }
        log.info("Reading spreadsheet: {}", path);

        try (InputStream in = Files.newInputStream(path);
                Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new PreconditionFailedException("Spreadsheet has no header row: " + path);
            }

            Map<Integer, String> columnsByIndex = new LinkedHashMap<>();
            for (Cell cell : headerRow) {
                Object header = readCell(cell);
                if (header != null && !header.toString().isBlank()) {
                    columnsByIndex.put(cell.getColumnIndex(), header.toString().trim());
                }
            }

            List<LocalRow> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                Map<String, Object> values = new LinkedHashMap<>();
                boolean hasValue = false;
                for (Map.Entry<Integer, String> column : columnsByIndex.entrySet()) {
                    Object value = readCell(row.getCell(column.getKey()));
                    values.put(column.getValue(), value);
                    hasValue |= value != null && !value.toString().isBlank();
                }
                if (hasValue) {
                    rows.add(new LocalRow(r, values));
                }
            }

            log.info("Loaded {} rows with columns {} from sheet '{}'", rows.size(), columnsByIndex.values(),
                    sheet.getSheetName());
            return LocalDataset.builder()
                    .path(path)
                    .sheetName(sheet.getSheetName())
                    .columns(List.copyOf(columnsByIndex.values()))
                    .rows(rows)
                    .build();
        } catch (IOException e) {
            throw new PreconditionFailedException("Failed to read spreadsheet " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void requireColumns(LocalDataset dataset, Collection<String> requiredColumns) {
        List<String> missing = requiredColumns.stream()
                .filter(column -> !dataset.getColumns().contains(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new PreconditionFailedException(
                    "Missing required columns: " + missing, Map.of("missingColumns", missing));
        }
    }

    @Override
    public void save(LocalDataset dataset) {
        Path path = dataset.getPath();
        Path tempFile = null;
        try (InputStream in = Files.newInputStream(path);
                Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheet(dataset.getSheetName());
            Map<String, Integer> columnIndexes = headerIndexes(sheet);

            int cellsWritten = 0;
            for (LocalRow localRow : dataset.getRows()) {
                if (!localRow.isModified()) {
                    continue;
                }
                Row row = sheet.getRow(localRow.getRowNumber());
                if (row == null) {
                    row = sheet.createRow(localRow.getRowNumber());
                }
                for (String column : localRow.getModifiedColumns()) {
                    Integer columnIndex = columnIndexes.get(column);
                    if (columnIndex == null) {
                        log.warn("Column '{}' not found when saving row {}, value not written", column,
                                localRow.getRowNumber() + 1);
                        continue;
                    }
                    Cell cell = row.getCell(columnIndex, Row.MissingCellPolicy.CREATE_NULL_AS_BLANK);
                    Object value = localRow.get(column);
                    cell.setBlank();
                    cell.setCellValue(value != null ? value.toString() : "");
                    cellsWritten++;
                }
            }

            tempFile = Files.createTempFile(path.toAbsolutePath().getParent(), ".assetsync-", ".tmp");
            try (OutputStream out = Files.newOutputStream(tempFile)) {
                workbook.write(out);
            }
            Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
            log.info("Saved {} updated cells in {} rows to {}", cellsWritten, dataset.getModifiedRowCount(), path);
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new UncheckedIOException("Failed to save spreadsheet " + path, e);
        }
    }

    private Map<String, Integer> headerIndexes(Sheet sheet) {
        Map<String, Integer> indexes = new LinkedHashMap<>();
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        for (Cell cell : headerRow) {
            Object header = readCell(cell);
            if (header != null && !header.toString().isBlank()) {
                indexes.put(header.toString().trim(), cell.getColumnIndex());
            }
        }
        return indexes;
    }

    static Object readCell(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue()
                    : (Object) cell.getNumericCellValue();
            case BOOLEAN -> cell.getBooleanCellValue();
            case BLANK, ERROR, FORMULA, _NONE -> null;
        };
    }

    private static void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", tempFile, e.getMessage());
        }
    }
}
