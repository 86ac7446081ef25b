package com.assetsync.domain.enums;

public enum LookupStatus {
    FOUND,
    NOT_FOUND,
    AMBIGUOUS,
    FAILED,
    CANCELLED
}
