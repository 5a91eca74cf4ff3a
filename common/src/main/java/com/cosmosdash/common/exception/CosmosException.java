package com.cosmosdash.common.exception;

/**
 * Base exception for all synchronization core failures.
 */
public class CosmosException extends RuntimeException {

    private final String errorCode;

    public CosmosException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CosmosException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
