package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.domain.JobType;

/**
 * Binds a job type to its step pipeline and terminal side effects.
 */
public interface JobHandler {

    JobType getJobType();

    StepPipeline getPipeline();

    /**
     * Perform the terminal side effects of an item whose steps are all checkpointed.
     */
    FinalizeResult finalizeItem(FinalizeContext context);

    /**
     * Name of the job-specific counter in the run response, e.g. {@code reportsGenerated}.
     */
    String getCounterName();

    int getDefaultBatchSize();

    /**
     * Whether the collaborators this handler needs are present.
     */
    boolean isAvailable();
}
