package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.BatchProgress;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.ProgressCheckpoint;
import com.precojusto.cronbatch.exception.UnknownJobException;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import com.precojusto.cronbatch.pipeline.TimeBudget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Maps trigger endpoints to job types and runs them through the executor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CronJobService {

    public static final String AI_REPORTS = "generate-ai-reports";
    public static final String FLAG_REEVALUATIONS = "process-flag-reevaluations";
    public static final String UPDATE_INDICES = "update-indices";

    static final String VARIANT_BOTH = "both";

    private final TimeBoxedExecutor executor;
    private final CheckpointStore checkpointStore;

    /**
     * Resolve a trigger endpoint and its optional variant to the job types it runs, in order.
     *
     * @throws UnknownJobException when the endpoint or the variant is not known
     */
    public List<JobType> resolve(String job, String variant) {
        switch (job) {
            case AI_REPORTS:
                requireNoVariant(job, variant);
                return List.of(JobType.AI_REPORT);
            case FLAG_REEVALUATIONS:
                requireNoVariant(job, variant);
                return List.of(JobType.FLAG_REEVALUATION);
            case UPDATE_INDICES:
                return resolveIndexVariant(variant);
            default:
                throw new UnknownJobException("Unknown job: " + job);
        }
    }

    /**
     * Run every job type behind an endpoint, in order, within one time budget.
     */
    public CronRunSummary trigger(String job, String variant) {
        List<JobType> jobTypes = resolve(job, variant);
        log.info("Cron trigger {} -> {}", job, jobTypes);

        TimeBudget budget = executor.startBudget();
        List<BatchRunResult> results = new ArrayList<>();
        for (JobType jobType : jobTypes) {
            results.add(executor.run(jobType, budget));
        }
        return merge(job, results);
    }

    /**
     * Global progress of every job type behind an endpoint. A job type that has
     * not run yet reports empty progress.
     */
    public List<BatchProgress> status(String job, String variant) {
        return resolve(job, variant).stream()
                .map(jobType -> checkpointStore.loadProgress(jobType, ProgressCheckpoint.GLOBAL_SCOPE)
                        .orElseGet(() -> BatchProgress.empty(jobType, ProgressCheckpoint.GLOBAL_SCOPE)))
                .collect(Collectors.toList());
    }

    CronRunSummary merge(String job, List<BatchRunResult> results) {
        CronRunSummary summary = CronRunSummary.builder().job(job).build();
        List<String> messages = new ArrayList<>();

        for (BatchRunResult result : results) {
            summary.setProcessed(summary.getProcessed() + result.getProcessed());
            summary.getCounters().merge(result.getCounterName(), result.getCounted(), Integer::sum);
            summary.getErrors().addAll(result.getErrors());
            summary.setDurationMs(summary.getDurationMs() + result.getDurationMs());
            summary.setHasMore(summary.isHasMore() || result.isHasMore());
            if (result.getMessage() != null) {
                messages.add(results.size() > 1
                        ? result.getJobType().getKey() + ": " + result.getMessage()
                        : result.getMessage());
            }
        }

        if (!messages.isEmpty()) {
            summary.setMessage(String.join("; ", messages));
        }
        return summary;
    }

    private List<JobType> resolveIndexVariant(String variant) {
        String normalized = variant == null || variant.isBlank()
                ? JobType.INDEX_MARK_TO_MARKET.getKey()
                : variant.trim().toLowerCase(Locale.ROOT);

        if (VARIANT_BOTH.equals(normalized)) {
            return List.of(JobType.INDEX_MARK_TO_MARKET, JobType.INDEX_SCREENING);
        }
        if (JobType.INDEX_MARK_TO_MARKET.getKey().equals(normalized)) {
            return List.of(JobType.INDEX_MARK_TO_MARKET);
        }
        if (JobType.INDEX_SCREENING.getKey().equals(normalized)) {
            return List.of(JobType.INDEX_SCREENING);
        }
        throw new UnknownJobException("Unknown " + UPDATE_INDICES + " variant: " + variant
                + " (expected mark-to-market, screening or both)");
    }

    private void requireNoVariant(String job, String variant) {
        if (variant != null && !variant.isBlank()) {
            throw new UnknownJobException("Job " + job + " takes no variant");
        }
    }
}
