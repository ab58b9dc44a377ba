package com.precojusto.cronbatch.pipeline;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.exception.UnknownJobException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handlers whose collaborators are present, keyed by job type.
 */
@Component
@Slf4j
public class JobHandlerRegistry {

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    public JobHandlerRegistry(List<JobHandler> candidates) {
        for (JobHandler handler : candidates) {
            if (!handler.isAvailable()) {
                log.info("Job {} not registered: collaborators missing", handler.getJobType());
                continue;
            }
            JobHandler previous = handlers.putIfAbsent(handler.getJobType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + handler.getJobType() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
            log.info("Registered job {} ({} steps)", handler.getJobType(), handler.getPipeline().getSteps().size());
        }
    }

    public Optional<JobHandler> find(JobType jobType) {
        return Optional.ofNullable(handlers.get(jobType));
    }

    public JobHandler require(JobType jobType) {
        return find(jobType)
                .orElseThrow(() -> new UnknownJobException("Job " + jobType.getKey() + " is not available"));
    }

    public Set<JobType> availableTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
