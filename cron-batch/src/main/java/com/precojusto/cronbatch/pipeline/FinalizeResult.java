package com.precojusto.cronbatch.pipeline;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of the terminal side effects of an item.
 */
@Data
@AllArgsConstructor
public class FinalizeResult {

    /**
     * Identifier of the produced result entity, if any.
     */
    private String resultId;

    /**
     * Whether the item counts toward the job's counter in the run response.
     */
    private boolean counted;

    public static FinalizeResult counted(String resultId) {
        return new FinalizeResult(resultId, true);
    }

    public static FinalizeResult notCounted(String resultId) {
        return new FinalizeResult(resultId, false);
    }
}
