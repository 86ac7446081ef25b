package com.assetsync.domain.model;

import com.assetsync.domain.enums.LookupStatus;
import com.assetsync.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LookupResult {

    LookupStatus status;
    RemoteRecord record;
    int matchCount;
    String reason;
    ErrorCode errorCode;

    public static LookupResult found(RemoteRecord record) {
        return new LookupResult(LookupStatus.FOUND, record, 1, null, null);
    }

    public static LookupResult notFound() {
        return new LookupResult(LookupStatus.NOT_FOUND, null, 0, "no asset with this serial number",
                ErrorCode.LOOKUP_NOT_FOUND);
    }

    public static LookupResult ambiguous(int matchCount) {
        return new LookupResult(LookupStatus.AMBIGUOUS, null, matchCount,
                matchCount + " assets share this serial number", ErrorCode.LOOKUP_AMBIGUOUS);
    }

    public static LookupResult failed(String reason, ErrorCode errorCode) {
        return new LookupResult(LookupStatus.FAILED, null, 0, reason, errorCode);
    }

    public static LookupResult cancelled() {
        return new LookupResult(LookupStatus.CANCELLED, null, 0, "run cancelled", null);
    }

    public boolean isFound() {
        return status == LookupStatus.FOUND;
    }
}
