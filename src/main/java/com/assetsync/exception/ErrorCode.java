package com.assetsync.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    LOOKUP_NOT_FOUND("LOOKUP_NOT_FOUND"),
    LOOKUP_AMBIGUOUS("LOOKUP_AMBIGUOUS"),
    VALUE_UNPARSEABLE("VALUE_UNPARSEABLE"),
    TRANSPORT_FAILURE("TRANSPORT_FAILURE"),
    SERVICE_REJECTED("SERVICE_REJECTED"),
    PRECONDITION_FAILED("PRECONDITION_FAILED");

    private final String code;
}
