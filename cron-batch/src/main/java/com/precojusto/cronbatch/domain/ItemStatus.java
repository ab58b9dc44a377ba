package com.precojusto.cronbatch.domain;

/**
 * Status enum for work item lifecycle.
 */
public enum ItemStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
