package com.precojusto.cronbatch.exception;

public class UnknownJobException extends BatchEngineException {

    public UnknownJobException(String message) {
        super(ErrorCode.UNKNOWN_JOB, message);
    }
}
