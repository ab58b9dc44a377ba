package com.precojusto.cronbatch.exception;

import lombok.Getter;

/**
 * Base of all engine exceptions. The error code decides both the HTTP mapping
 * and whether a failing item may be retried.
 */
@Getter
public abstract class BatchEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BatchEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected BatchEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Whether the item that raised this exception may be attempted again.
     */
    public boolean isRetryable() {
        return false;
    }
}
