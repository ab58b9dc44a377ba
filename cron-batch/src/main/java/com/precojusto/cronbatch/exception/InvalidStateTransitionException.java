package com.precojusto.cronbatch.exception;

import com.precojusto.cronbatch.domain.ItemStatus;

public class InvalidStateTransitionException extends BatchEngineException {

    public InvalidStateTransitionException(Long itemId, ItemStatus from, ItemStatus to) {
        super(ErrorCode.INVALID_STATE_TRANSITION,
                "Work item " + itemId + " cannot move from " + from + " to " + to);
    }
}
