package com.precojusto.cronbatch.exception;

import com.precojusto.cronbatch.domain.JobType;

/**
 * A step's declared dependency has no checkpoint. Ordered execution makes this
 * impossible unless stored state is corrupted, so the item is failed.
 */
public class MissingCheckpointException extends BatchEngineException {

    public MissingCheckpointException(JobType jobType, String scopeId, String step, String dependency) {
        super(ErrorCode.MISSING_CHECKPOINT,
                "Checkpoint " + dependency + " not found for step " + step
                        + " (" + jobType + "/" + scopeId + ")");
    }
}
