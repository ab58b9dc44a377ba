package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.JobType;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Executor settings. Per-job values are read from {@code batch.jobs.<key>.*}.
 */
@Component
public class JobSettings {

    private final Environment environment;

    @Getter
    private final Duration maxExecutionTime;

    @Getter
    private final Duration recencyWindow;

    @Getter
    private final int maxAttempts;

    @Getter
    private final int maxParallelism;

    public JobSettings(Environment environment,
            @Value("${batch.max-execution-time:50s}") Duration maxExecutionTime,
            @Value("${batch.recency-window:24h}") Duration recencyWindow,
            @Value("${batch.item.max-attempts:3}") int maxAttempts,
            @Value("${batch.worker.max-parallelism:10}") int maxParallelism) {
        this.environment = environment;
        this.maxExecutionTime = maxExecutionTime;
        this.recencyWindow = recencyWindow;
        this.maxAttempts = maxAttempts;
        this.maxParallelism = maxParallelism;
    }

    public int batchSize(JobType jobType, int defaultBatchSize) {
        Integer value = environment.getProperty("batch.jobs." + jobType.getKey() + ".batch-size", Integer.class);
        return value != null && value > 0 ? value : defaultBatchSize;
    }

    /**
     * Concurrent slots for a job, capped by the worker pool size. 1 means sequential.
     */
    public int parallelism(JobType jobType) {
        Integer value = environment.getProperty("batch.jobs." + jobType.getKey() + ".parallelism", Integer.class);
        int requested = value != null && value > 0 ? value : 1;
        return Math.min(requested, maxParallelism);
    }
}
