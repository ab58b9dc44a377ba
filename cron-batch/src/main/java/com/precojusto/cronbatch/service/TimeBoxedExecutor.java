package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.BatchProgress;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.PriorityClass;
import com.precojusto.cronbatch.domain.ProgressCheckpoint;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.infrastructure.BoundedWorkerPool;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import com.precojusto.cronbatch.infrastructure.JobLease;
import com.precojusto.cronbatch.infrastructure.WorkItemSource;
import com.precojusto.cronbatch.pipeline.CheckpointCodec;
import com.precojusto.cronbatch.pipeline.DailySweepJobHandler;
import com.precojusto.cronbatch.pipeline.JobHandler;
import com.precojusto.cronbatch.pipeline.JobHandlerRegistry;
import com.precojusto.cronbatch.pipeline.SweepPayload;
import com.precojusto.cronbatch.pipeline.TimeBudget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Driver loop of one invocation. Pulls a batch from the work selector and resumes
 * each item from its first unfinished step until the batch is done or the time
 * budget runs out, persisting global progress after every item.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeBoxedExecutor {

    private final JobHandlerRegistry handlerRegistry;
    private final WorkSelector workSelector;
    private final ItemProcessor itemProcessor;
    private final WorkItemService workItemService;
    private final WorkItemSource workItemSource;
    private final CheckpointStore checkpointStore;
    private final BoundedWorkerPool workerPool;
    private final JobLease jobLease;
    private final TradingCalendar tradingCalendar;
    private final JobSettings jobSettings;
    private final CheckpointCodec codec;
    private final BatchMetricsService metricsService;
    private final Clock clock;

    /**
     * Budget of one trigger call. Jobs run by the same call share it.
     */
    public TimeBudget startBudget() {
        return TimeBudget.start(clock, jobSettings.getMaxExecutionTime());
    }

    public BatchRunResult run(JobType jobType) {
        return run(jobType, startBudget());
    }

    /**
     * Run one pass of a job within what is left of {@code budget}.
     */
    public BatchRunResult run(JobType jobType, TimeBudget budget) {
        JobHandler handler = handlerRegistry.require(jobType);
        MDC.put("jobType", jobType.getKey());

        try {
            if (budget.isExhausted()) {
                log.info("Time budget exhausted ({}ms) before {} started", budget.elapsed().toMillis(), jobType);
                return BatchRunResult.builder()
                        .jobType(jobType)
                        .counterName(handler.getCounterName())
                        .timedOut(true)
                        .hasMore(true)
                        .message("Time budget exhausted before start")
                        .build();
            }

            Optional<String> lease = jobLease.tryAcquire(jobType);
            if (lease.isEmpty()) {
                return skipped(handler, "Another invocation of " + jobType.getKey() + " is running", 0);
            }
            try {
                return execute(handler, budget);
            } finally {
                jobLease.release(jobType, lease.get());
            }
        } finally {
            MDC.remove("jobType");
        }
    }

    private BatchRunResult execute(JobHandler handler, TimeBudget budget) {
        JobType jobType = handler.getJobType();
        Instant runStart = clock.instant();
        log.info("Starting {} run ({}ms of {} budget used)", jobType, budget.elapsed().toMillis(),
                budget.getLimit());

        checkpointStore.migrateLegacyGlobalScope(jobType);

        LocalDate today = tradingCalendar.today();
        boolean sweep = handler instanceof DailySweepJobHandler;
        if (sweep && !tradingCalendar.isTradingDay(today)) {
            log.info("{} skipped: {} is not a trading day", jobType, today);
            return skipped(handler, "Skipped: " + today + " is not a trading day", millisSince(runStart));
        }

        Optional<BatchProgress> stored = checkpointStore.loadProgress(jobType, ProgressCheckpoint.GLOBAL_SCOPE);
        boolean newBusinessDay = stored.isEmpty();
        BatchProgress progress = stored.orElseGet(() -> BatchProgress.empty(jobType, ProgressCheckpoint.GLOBAL_SCOPE));

        if (stored.isPresent() && isStale(stored.get())) {
            log.info("{} progress from {} is stale ({}/{}), resetting for {}", jobType,
                    tradingCalendar.businessDate(lastDayOf(stored.get())),
                    stored.get().getProcessedCount(), stored.get().getTotalCount(), today);
            checkpointStore.clearProgress(jobType, ProgressCheckpoint.GLOBAL_SCOPE);
            progress = BatchProgress.empty(jobType, ProgressCheckpoint.GLOBAL_SCOPE);
            newBusinessDay = true;
        }

        if (sweep && newBusinessDay) {
            enroll((DailySweepJobHandler) handler, today);
        }

        long outstanding = workItemSource.countOutstanding(jobType);
        if (sweep && !newBusinessDay && progress.isComplete() && outstanding == 0) {
            log.info("{} already completed today ({} processed), nothing to do", jobType,
                    progress.getProcessedCount());
            return skipped(handler, "Already completed today", millisSince(runStart));
        }

        ProgressTracker tracker = new ProgressTracker(checkpointStore, workItemSource, progress);
        if (newBusinessDay) {
            tracker.save();
        }

        int batchSize = jobSettings.batchSize(jobType, handler.getDefaultBatchSize());
        List<WorkItem> batch = workSelector.select(jobType, batchSize);

        int parallelism = jobSettings.parallelism(jobType);
        boolean timedOut = parallelism > 1
                ? runParallel(handler, batch, parallelism, budget, tracker)
                : runSequential(handler, batch, budget, tracker);

        BatchProgress saved = tracker.save();
        long remaining = workItemSource.countOutstanding(jobType);
        long durationMs = millisSince(runStart);
        metricsService.recordRun(jobType, durationMs, timedOut);

        log.info("{} run finished: {} processed, {} {}, {} error(s), {} outstanding, progress {}/{} ({}ms{})",
                jobType, tracker.getProcessedThisRun(), tracker.getCountedThisRun(), handler.getCounterName(),
                tracker.getErrorsThisRun().size(), remaining, saved.getProcessedCount(), saved.getTotalCount(),
                durationMs, timedOut ? ", timed out" : "");

        return BatchRunResult.builder()
                .jobType(jobType)
                .counterName(handler.getCounterName())
                .processed(tracker.getProcessedThisRun())
                .counted(tracker.getCountedThisRun())
                .errors(tracker.getErrorsThisRun())
                .durationMs(durationMs)
                .timedOut(timedOut)
                .hasMore(timedOut || remaining > 0)
                .message(timedOut ? "Time budget exhausted, " + remaining + " item(s) outstanding" : null)
                .build();
    }

    private boolean runSequential(JobHandler handler, List<WorkItem> batch, TimeBudget budget,
            ProgressTracker tracker) {
        for (WorkItem item : batch) {
            if (budget.isExhausted()) {
                log.info("Time budget exhausted ({}ms), stopping before item {}", budget.elapsed().toMillis(),
                        item.getId());
                return true;
            }

            ItemResult result = processSafely(handler, item, budget);
            tracker.record(result);

            if (result.getOutcome() == ItemResult.Outcome.INTERRUPTED) {
                return true;
            }
        }
        return false;
    }

    private boolean runParallel(JobHandler handler, List<WorkItem> batch, int parallelism, TimeBudget budget,
            ProgressTracker tracker) {
        log.info("Processing {} item(s) with {} concurrent slots", batch.size(), parallelism);

        List<BoundedWorkerPool.Outcome<WorkItem, ItemResult>> outcomes = workerPool.runAll(
                batch, parallelism, () -> !budget.isExhausted(),
                item -> {
                    ItemResult result = itemProcessor.process(handler, item, budget);
                    tracker.record(result);
                    return result;
                });

        boolean interrupted = false;
        for (BoundedWorkerPool.Outcome<WorkItem, ItemResult> outcome : outcomes) {
            if (!outcome.isSuccess()) {
                tracker.record(ItemResult.retry(outcome.getItem().getId(), messageOf(outcome.getError())));
            } else if (outcome.getResult().getOutcome() == ItemResult.Outcome.INTERRUPTED) {
                interrupted = true;
            }
        }
        return interrupted || outcomes.size() < batch.size();
    }

    private ItemResult processSafely(JobHandler handler, WorkItem item, TimeBudget budget) {
        try {
            return itemProcessor.process(handler, item, budget);
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing item {}: {}", item.getId(), e.getMessage(), e);
            return ItemResult.retry(item.getId(), messageOf(e));
        }
    }

    private void enroll(DailySweepJobHandler handler, LocalDate businessDate) {
        List<String> targets = handler.targets(businessDate);
        int created = 0;
        for (String target : targets) {
            String payload = codec.encode(new SweepPayload(target, businessDate), "sweep payload");
            EnqueueResult result = workItemService.enqueue(handler.getJobType(),
                    SweepPayload.targetKey(target, businessDate), PriorityClass.STANDARD, payload);
            if (!result.isExisting()) {
                created++;
            }
        }
        log.info("Enrolled {} {} target(s) for {} ({} new)", targets.size(), handler.getJobType(), businessDate,
                created);
    }

    /**
     * Progress belongs to the business day it was started or completed on.
     */
    private boolean isStale(BatchProgress progress) {
        return !tradingCalendar.isToday(lastDayOf(progress));
    }

    private Instant lastDayOf(BatchProgress progress) {
        return progress.getCompletedAt() != null ? progress.getCompletedAt() : progress.getCreatedAt();
    }

    private BatchRunResult skipped(JobHandler handler, String message, long durationMs) {
        return BatchRunResult.builder()
                .jobType(handler.getJobType())
                .counterName(handler.getCounterName())
                .durationMs(durationMs)
                .hasMore(false)
                .message(message)
                .build();
    }

    private long millisSince(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }

    private String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
