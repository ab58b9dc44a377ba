package com.precojusto.cronbatch.exception;

/**
 * Raised by a step function when the item can never succeed, for example because
 * the business entity it refers to no longer exists.
 */
public class NonRetryableStepException extends BatchEngineException {

    public NonRetryableStepException(String message) {
        super(ErrorCode.STEP_FAILED_PERMANENTLY, message);
    }

    public NonRetryableStepException(String message, Throwable cause) {
        super(ErrorCode.STEP_FAILED_PERMANENTLY, message, cause);
    }
}
