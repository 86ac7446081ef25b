package com.assetsync.exception;

import java.util.Map;

/**
 * Missing configuration, missing dataset file, or missing required columns.
 * Always fatal: raised before any row is processed.
 */
public class PreconditionFailedException extends BaseException {

    public PreconditionFailedException(String message) {
        super(ErrorCode.PRECONDITION_FAILED, message);
    }

    public PreconditionFailedException(String message, Map<String, Object> details) {
        super(ErrorCode.PRECONDITION_FAILED, message, details);
    }

    public PreconditionFailedException(String message, Throwable cause) {
        super(ErrorCode.PRECONDITION_FAILED, message, cause);
    }
}
