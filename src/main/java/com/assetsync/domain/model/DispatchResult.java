package com.assetsync.domain.model;

import com.assetsync.exception.ErrorCode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one batched update call. {@code attempted} keeps the field set that was sent
 * (or would have been sent), in staging order, so failures can be followed up by hand.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DispatchResult {

    boolean success;
    Map<String, String> attempted;
    String reason;
    ErrorCode errorCode;

    public static DispatchResult success(Map<String, String> attempted) {
        return new DispatchResult(true, copy(attempted), null, null);
    }

    public static DispatchResult failure(Map<String, String> attempted, String reason, ErrorCode errorCode) {
        return new DispatchResult(false, copy(attempted), reason, errorCode);
    }

    private static Map<String, String> copy(Map<String, String> attempted) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attempted));
    }
}
