package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.domain.BatchProgress;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.exception.StepInterruptedException;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Drives a step that decomposes into many ordered sub-units, keeping a cursor
 * scoped to the owning item.
 *
 * <p>The caller recomputes the outstanding list on every call. Units at or before
 * the stored marker are skipped, so unit identifiers must sort in processing order
 * (ISO dates do).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubTaskRunner {

    private final CheckpointStore checkpointStore;

    public int run(JobType jobType, String scopeId, String step, List<String> outstandingUnits,
            Consumer<String> unitWork, TimeBudget budget) {

        Optional<BatchProgress> cursor = checkpointStore.loadProgress(jobType, scopeId);
        String marker = cursor.map(BatchProgress::getLastProcessedScopeId).orElse(null);

        List<String> remaining = outstandingUnits.stream()
                .filter(unit -> marker == null || unit.compareTo(marker) > 0)
                .collect(Collectors.toList());

        if (remaining.isEmpty()) {
            if (cursor.isPresent()) {
                checkpointStore.clearProgress(jobType, scopeId);
                log.info("Nothing left for {} of {}/{}, sub-task cursor cleared", step, jobType, scopeId);
            }
            return 0;
        }

        int done = marker != null ? cursor.get().getProcessedCount() : 0;
        int total = done + remaining.size();
        BatchProgress progress = cursor.orElseGet(() -> BatchProgress.empty(jobType, scopeId)).toBuilder()
                .processedCount(done)
                .totalCount(total)
                .build();

        if (marker != null) {
            log.info("Resuming {} for {}/{} after {} ({}/{} sub-units done)", step, jobType, scopeId, marker, done,
                    total);
        } else {
            log.info("Starting {} for {}/{}: {} sub-units", step, jobType, scopeId, total);
        }

        int processed = 0;
        for (String unit : remaining) {
            if (budget.isExhausted()) {
                checkpointStore.saveProgress(progress);
                log.info("Time budget exhausted during {} for {}/{} at {}/{}", step, jobType, scopeId,
                        progress.getProcessedCount(), total);
                throw new StepInterruptedException(step, progress.getProcessedCount(), total);
            }

            unitWork.accept(unit);
            processed++;

            progress = progress.toBuilder()
                    .lastProcessedScopeId(unit)
                    .processedCount(progress.getProcessedCount() + 1)
                    .build();
            checkpointStore.saveProgress(progress);
            log.debug("{} sub-unit {} done for {}/{}", step, unit, jobType, scopeId);
        }

        checkpointStore.clearProgress(jobType, scopeId);
        log.info("{} finished all {} sub-units for {}/{}", step, total, jobType, scopeId);
        return processed;
    }
}
