package com.precojusto.cronbatch.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    VALIDATION_ERROR(400, "Validation failed"),
    BAD_REQUEST(400, "Bad request"),
    UNKNOWN_JOB(400, "Unknown job"),
    UNAUTHORIZED(401, "Unauthorized"),
    NOT_FOUND(404, "Resource not found"),
    INVALID_STATE_TRANSITION(409, "Invalid state transition"),
    MISSING_CHECKPOINT(500, "Dependency checkpoint missing"),
    STEP_FAILED(500, "Step failed"),
    STEP_FAILED_PERMANENTLY(500, "Step failed permanently"),
    INTERNAL_ERROR(500, "Internal error");

    private final int httpStatus;
    private final String defaultMessage;

    ErrorCode(int httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }
}
