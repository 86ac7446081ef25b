package com.assetsync.domain.model;

import java.util.List;
import lombok.Value;

/**
 * Assets returned for one serial-number lookup. {@code total} is the number of assets the
 * service reports as matching, which can exceed the records returned in the page.
 */
@Value
public class SerialMatches {

    List<RemoteRecord> records;
    int total;

    public static SerialMatches of(RemoteRecord... records) {
        return of(List.of(records), records.length);
    }

    public static SerialMatches of(List<RemoteRecord> records, int total) {
        return new SerialMatches(List.copyOf(records), Math.max(total, records.size()));
    }

    public boolean isEmpty() {
        return total == 0;
    }

    public boolean isUnique() {
        return total == 1;
    }
}
