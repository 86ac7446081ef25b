package com.assetsync.domain.enums;

public enum LedgerEntryType {
    NOT_FOUND,
    AMBIGUOUS,
    LOOKUP_FAILED,
    BOTH_EMPTY,
    LOCAL_UPDATED,
    REMOTE_UPDATED,
    REMOTE_UPDATE_FAILED,
    CONFLICT_RESOLVED,
    CONFLICT_SKIPPED,
    FORMAT_CONFLICT
}
