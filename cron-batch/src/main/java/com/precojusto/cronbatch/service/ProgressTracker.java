package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.BatchProgress;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import com.precojusto.cronbatch.infrastructure.WorkItemSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Global progress of one invocation. Every recorded item is written through to
 * the checkpoint store; writes are serialized so slots of the worker pool can
 * share one tracker.
 */
@Slf4j
class ProgressTracker {

    private final CheckpointStore checkpointStore;
    private final WorkItemSource workItemSource;
    private final JobType jobType;

    private BatchProgress progress;
    private int processedThisRun;
    private int countedThisRun;
    private final List<String> errorsThisRun = new ArrayList<>();

    ProgressTracker(CheckpointStore checkpointStore, WorkItemSource workItemSource, BatchProgress initial) {
        this.checkpointStore = checkpointStore;
        this.workItemSource = workItemSource;
        this.jobType = initial.getJobType();
        this.progress = initial;
    }

    synchronized void record(ItemResult result) {
        BatchProgress.BatchProgressBuilder next = progress.toBuilder();

        if (result.isProcessed()) {
            processedThisRun++;
            next.processedCount(progress.getProcessedCount() + 1)
                    .lastProcessedScopeId(String.valueOf(result.getItemId()));
        }
        if (result.isCounted()) {
            countedThisRun++;
        }
        if (result.hasError()) {
            String entry = result.getItemId() + ": " + result.getError();
            errorsThisRun.add(entry);
            List<String> errors = new ArrayList<>(progress.getErrors());
            errors.add(entry);
            next.errors(errors);
        }

        progress = next.build();
        save();
    }

    /**
     * Persist the progress with totalCount recomputed as processed plus outstanding.
     */
    synchronized BatchProgress save() {
        long outstanding = workItemSource.countOutstanding(jobType);
        progress = checkpointStore.saveProgress(progress.toBuilder()
                .totalCount(progress.getProcessedCount() + (int) outstanding)
                .build());
        log.debug("Progress {}: {}/{}", jobType, progress.getProcessedCount(), progress.getTotalCount());
        return progress;
    }

    synchronized BatchProgress getProgress() {
        return progress;
    }

    synchronized int getProcessedThisRun() {
        return processedThisRun;
    }

    synchronized int getCountedThisRun() {
        return countedThisRun;
    }

    synchronized List<String> getErrorsThisRun() {
        return Collections.unmodifiableList(new ArrayList<>(errorsThisRun));
    }
}
