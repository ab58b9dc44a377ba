package com.precojusto.cronbatch.exception;

/**
 * Collaborator failure (rate limit, overload, empty upstream response) that may
 * succeed on a later attempt.
 */
public class TransientStepException extends BatchEngineException {

    public TransientStepException(String message) {
        super(ErrorCode.STEP_FAILED, message);
    }

    public TransientStepException(String message, Throwable cause) {
        super(ErrorCode.STEP_FAILED, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
