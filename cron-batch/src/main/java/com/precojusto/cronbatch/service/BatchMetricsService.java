package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.JobType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking batch engine metrics, tagged by job type.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BatchMetricsService {

    private final MeterRegistry meterRegistry;

    public BatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("BatchMetricsService initialized with Micrometer metrics");
    }

    public void recordItemEnqueued(JobType jobType) {
        counter("batch.items.enqueued", "Total number of work items enqueued", jobType).increment();
    }

    public void recordStepCompleted(JobType jobType) {
        counter("batch.steps.completed", "Total number of step checkpoints written", jobType).increment();
    }

    public void recordItemCompleted(JobType jobType) {
        counter("batch.items.completed", "Total number of work items finalized", jobType).increment();
    }

    public void recordItemFailed(JobType jobType) {
        counter("batch.items.failed", "Total number of work items failed permanently", jobType).increment();
    }

    public void recordItemRetried(JobType jobType) {
        counter("batch.items.retried", "Total number of retryable work item failures", jobType).increment();
    }

    /**
     * Record a finished invocation with its wall-clock duration.
     */
    public void recordRun(JobType jobType, long durationMs, boolean timedOut) {
        Timer.builder("batch.run.duration")
                .description("Duration of one executor invocation")
                .tag("job", jobType.getKey())
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        if (timedOut) {
            counter("batch.runs.timed-out", "Invocations stopped by the time budget", jobType).increment();
        }
    }

    private Counter counter(String name, String description, JobType jobType) {
        return Counter.builder(name)
                .description(description)
                .tag("job", jobType.getKey())
                .register(meterRegistry);
    }
}
