package com.precojusto.cronbatch.jobs.flag;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Final verdict on a flag. A null newReason keeps the current reason.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlagEvaluation {

    private boolean shouldKeepActive;
    private String newReason;
    private String analysisSummary;
}
