package com.assetsync.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One workbook row keyed by column header.
 *
 * <p>{@code rowNumber} is the zero-based sheet row the values were read from, so the store
 * can write modified cells back in place. Writes through {@link #set} are tracked per column.
 */
public class LocalRow {

    private final int rowNumber;
    private final Map<String, Object> values;
    private final Set<String> modifiedColumns = new LinkedHashSet<>();

    public LocalRow(int rowNumber, Map<String, Object> values) {
        this.rowNumber = rowNumber;
        this.values = new LinkedHashMap<>(values);
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public void set(String column, Object value) {
        values.put(column, value);
        modifiedColumns.add(column);
    }

    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Set<String> getModifiedColumns() {
        return Collections.unmodifiableSet(modifiedColumns);
    }

    public boolean isModified() {
        return !modifiedColumns.isEmpty();
    }
}
