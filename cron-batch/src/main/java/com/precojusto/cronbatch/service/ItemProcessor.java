package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.exception.BatchEngineException;
import com.precojusto.cronbatch.exception.StepInterruptedException;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import com.precojusto.cronbatch.pipeline.FinalizeResult;
import com.precojusto.cronbatch.pipeline.JobHandler;
import com.precojusto.cronbatch.pipeline.StepDefinition;
import com.precojusto.cronbatch.pipeline.StepRunner;
import com.precojusto.cronbatch.pipeline.TimeBudget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Advances one item through as many steps as the time budget allows and
 * finalizes it once every step is checkpointed. Errors are caught here and
 * turned into an {@link ItemResult}, never propagated to the batch loop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ItemProcessor {

    private final WorkItemService workItemService;
    private final CheckpointStore checkpointStore;
    private final StepRunner stepRunner;
    private final Finalizer finalizer;
    private final JobSettings jobSettings;
    private final BatchMetricsService metricsService;

    public ItemResult process(JobHandler handler, WorkItem item, TimeBudget budget) {
        // a sequential run already carries jobType; restore it afterwards
        String runJobType = MDC.get("jobType");
        MDC.put("jobType", handler.getJobType().getKey());
        MDC.put("itemId", String.valueOf(item.getId()));

        try {
            WorkItem current = workItemService.beginPass(item);
            log.info("Processing item {} - Target: {}, Status: {}, RetryCount: {}",
                    current.getId(), current.getTargetKey(), current.getStatus(), current.getRetryCount());

            boolean firstStep = true;
            while (true) {
                Optional<StepDefinition<?>> next = handler.getPipeline()
                        .nextStep(checkpointStore.completedSteps(handler.getJobType(), current.scopeId()));
                if (next.isEmpty()) {
                    break;
                }
                if (!firstStep && budget.isExhausted()) {
                    log.info("Time budget exhausted before step {} of item {}", next.get().getName(),
                            current.getId());
                    return ItemResult.interrupted(current.getId());
                }
                if (stepRunner.run(handler.getPipeline(), next.get(), current, budget)) {
                    metricsService.recordStepCompleted(handler.getJobType());
                }
                firstStep = false;
            }

            if (!firstStep && budget.isExhausted()) {
                log.info("Time budget exhausted before finalizing item {}", current.getId());
                return ItemResult.interrupted(current.getId());
            }

            Optional<FinalizeResult> result = finalizer.finalizeItem(handler, current);
            return result
                    .map(r -> ItemResult.completed(item.getId(), r.isCounted()))
                    .orElseGet(() -> ItemResult.alreadyCompleted(item.getId()));

        } catch (StepInterruptedException e) {
            log.info("Item {} interrupted: {}", item.getId(), e.getMessage());
            return ItemResult.interrupted(item.getId());
        } catch (BatchEngineException e) {
            if (e.isRetryable()) {
                return handleRetryable(item, e);
            }
            log.error("Item {} failed permanently [{}]: {}", item.getId(), e.getErrorCode(), e.getMessage(), e);
            return failItem(item, e);
        } catch (RuntimeException e) {
            return handleRetryable(item, e);
        } finally {
            if (runJobType != null) {
                MDC.put("jobType", runJobType);
            } else {
                MDC.remove("jobType");
            }
            MDC.remove("itemId");
        }
    }

    private ItemResult handleRetryable(WorkItem item, RuntimeException error) {
        String message = messageOf(error);
        log.warn("Item {} failed with a retryable error: {}", item.getId(), message, error);
        WorkItem updated = workItemService.recordRetryableFailure(item.getId(), message, jobSettings.getMaxAttempts());
        return updated.getStatus().isTerminal()
                ? ItemResult.failed(item.getId(), message)
                : ItemResult.retry(item.getId(), message);
    }

    private ItemResult failItem(WorkItem item, RuntimeException error) {
        String message = messageOf(error);
        workItemService.fail(item.getId(), message);
        return ItemResult.failed(item.getId(), message);
    }

    private String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
