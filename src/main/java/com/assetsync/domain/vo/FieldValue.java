package com.assetsync.domain.vo;

import com.assetsync.domain.enums.ValueState;
import java.time.LocalDate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Normalized cell or field value: EMPTY, TEXT, DATE or INVALID.
 *
 * <p>Exactly one payload is set per state: {@code text} for TEXT, {@code date} for DATE,
 * {@code raw} and {@code reason} for INVALID. Built only through the static factories.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldValue {

    private static final FieldValue EMPTY = new FieldValue(ValueState.EMPTY, null, null, null, null);

    ValueState state;
    String text;
    LocalDate date;
    String raw;
    String reason;

    public static FieldValue empty() {
        return EMPTY;
    }

    public static FieldValue text(String text) {
        return new FieldValue(ValueState.TEXT, text, null, null, null);
    }

    public static FieldValue date(LocalDate date) {
        return new FieldValue(ValueState.DATE, null, date, null, null);
    }

    public static FieldValue invalid(String raw, String reason) {
        return new FieldValue(ValueState.INVALID, null, null, raw, reason);
    }

    public boolean isEmpty() {
        return state == ValueState.EMPTY;
    }

    public boolean isInvalid() {
        return state == ValueState.INVALID;
    }

    /** EMPTY and INVALID both count as "no comparable value". */
    public boolean isBlankForComparison() {
        return state == ValueState.EMPTY || state == ValueState.INVALID;
    }
}
