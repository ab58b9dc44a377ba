package com.precojusto.cronbatch.infrastructure;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.WorkItem;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read/write access to work items in the surrounding business schema.
 */
public interface WorkItemSource {

    /**
     * Items in PENDING or PROCESSING, ordered by priority rank, oldest
     * lastProcessedAt first (never processed first), then creation.
     *
     * @param jobType the job type
     * @param limit   maximum number of items
     * @return ordered outstanding items
     */
    List<WorkItem> findOutstanding(JobType jobType, int limit);

    /**
     * Non-terminal items created after the given instant.
     */
    List<WorkItem> findActiveCreatedAfter(JobType jobType, Instant createdAfter);

    /**
     * The oldest non-terminal item for a target created after the given instant.
     */
    Optional<WorkItem> findActiveForTarget(JobType jobType, String targetKey, Instant createdAfter);

    Optional<WorkItem> findById(Long itemId);

    WorkItem save(WorkItem item);

    /**
     * Number of items in PENDING or PROCESSING.
     */
    long countOutstanding(JobType jobType);
}
