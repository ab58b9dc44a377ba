package com.precojusto.cronbatch.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What happened to one item during an invocation.
 */
@Getter
@AllArgsConstructor
public class ItemResult {

    public enum Outcome {
        /** Finalized in this pass. */
        COMPLETED,
        /** Already COMPLETED when finalization was attempted. */
        ALREADY_COMPLETED,
        /** Failed this attempt; will be retried by a later invocation. */
        RETRY,
        /** Moved to FAILED. */
        FAILED,
        /** Stopped by the time budget; not an error. */
        INTERRUPTED
    }

    private final Long itemId;
    private final Outcome outcome;
    private final boolean counted;
    private final String error;

    public static ItemResult completed(Long itemId, boolean counted) {
        return new ItemResult(itemId, Outcome.COMPLETED, counted, null);
    }

    public static ItemResult alreadyCompleted(Long itemId) {
        return new ItemResult(itemId, Outcome.ALREADY_COMPLETED, false, null);
    }

    public static ItemResult retry(Long itemId, String error) {
        return new ItemResult(itemId, Outcome.RETRY, false, error);
    }

    public static ItemResult failed(Long itemId, String error) {
        return new ItemResult(itemId, Outcome.FAILED, false, error);
    }

    public static ItemResult interrupted(Long itemId) {
        return new ItemResult(itemId, Outcome.INTERRUPTED, false, null);
    }

    /**
     * Whether this pass ended the item's work for the business day.
     */
    public boolean isProcessed() {
        return outcome != Outcome.INTERRUPTED;
    }

    public boolean hasError() {
        return error != null;
    }
}
