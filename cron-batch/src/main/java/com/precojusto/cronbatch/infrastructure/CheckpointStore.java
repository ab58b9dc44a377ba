package com.precojusto.cronbatch.infrastructure;

import com.precojusto.cronbatch.domain.BatchProgress;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.StepCheckpoint;

import java.util.Optional;
import java.util.Set;

/**
 * Durable checkpoint persistence keyed by (jobType, scopeId, step).
 */
public interface CheckpointStore {

    /**
     * Upsert the output of a step. Calling twice with the same arguments leaves
     * the store as one call would.
     *
     * @param jobType  the job type
     * @param scopeId  the item scope
     * @param step     the step name
     * @param dataJson the step output as JSON
     */
    void save(JobType jobType, String scopeId, String step, String dataJson);

    /**
     * Load a step checkpoint.
     *
     * @return the checkpoint, or empty if the step has not completed
     */
    Optional<StepCheckpoint> load(JobType jobType, String scopeId, String step);

    /**
     * Names of all steps checkpointed for a scope.
     */
    Set<String> completedSteps(JobType jobType, String scopeId);

    /**
     * Remove every step checkpoint of a scope together with its sub-task cursor.
     */
    void clear(JobType jobType, String scopeId);

    /**
     * Load the progress cursor of a scope (global or sub-task).
     */
    Optional<BatchProgress> loadProgress(JobType jobType, String scopeId);

    /**
     * Upsert a progress cursor. The store sets completedAt when processedCount
     * equals a positive totalCount, and clears it otherwise.
     *
     * @return the progress as stored
     */
    BatchProgress saveProgress(BatchProgress progress);

    /**
     * Remove the progress cursor of a scope.
     */
    void clearProgress(JobType jobType, String scopeId);

    /**
     * Item scopes that currently own a sub-task cursor.
     */
    Set<String> scopesWithProgress(JobType jobType);

    /**
     * Compact legacy NULL-scope progress rows into the global sentinel scope.
     *
     * @return number of legacy rows removed
     */
    int migrateLegacyGlobalScope(JobType jobType);
}
