package com.precojusto.cronbatch.exception;

public class CronUnauthorizedException extends BatchEngineException {

    public CronUnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
