package com.precojusto.cronbatch.jobs.aireport;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fundamental reading of the trigger. Custom trigger reports carry no analysis.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisOutput {

    private boolean required;
    private boolean fundamentalLoss;
    private String conclusion;

    /**
     * Overall assessment of current fundamentals, e.g. SOLIDO, MODERADO, FRACO.
     */
    private String assessment;

    public static AnalysisOutput notRequired() {
        return AnalysisOutput.builder().required(false).build();
    }
}
