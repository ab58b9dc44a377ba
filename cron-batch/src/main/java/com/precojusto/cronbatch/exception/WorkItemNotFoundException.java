package com.precojusto.cronbatch.exception;

public class WorkItemNotFoundException extends BatchEngineException {

    public WorkItemNotFoundException(Long itemId) {
        super(ErrorCode.NOT_FOUND, "Work item not found: " + itemId);
    }
}
