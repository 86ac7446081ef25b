package com.assetsync.exception;

/**
 * A Lansweeper call that could not complete ({@link ErrorCode#TRANSPORT_FAILURE}) or that
 * completed with an application error payload ({@link ErrorCode#SERVICE_REJECTED}).
 * Never retried; the caller records it and moves on to the next asset.
 */
public class RemoteServiceException extends BaseException {

    public RemoteServiceException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public RemoteServiceException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static RemoteServiceException transport(String message, Throwable cause) {
        return new RemoteServiceException(ErrorCode.TRANSPORT_FAILURE, message, cause);
    }

    public static RemoteServiceException rejected(String message) {
        return new RemoteServiceException(ErrorCode.SERVICE_REJECTED, message);
    }
}
