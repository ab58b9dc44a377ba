package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.PriorityClass;
import com.precojusto.cronbatch.domain.WorkItem;

/**
 * Service interface for work item lifecycle: upstream enqueue, the executor's
 * status transitions and operator recovery.
 */
public interface WorkItemService {

    /**
     * Enqueue work for a business target. An active item for the same target
     * created inside the recency window is returned instead of a new one.
     *
     * @param jobType     the job type
     * @param targetKey   logical business entity the work is about
     * @param priority    priority class, STANDARD when null
     * @param payloadJson trigger context as JSON, may be null
     * @return the new or existing item
     */
    EnqueueResult enqueue(JobType jobType, String targetKey, PriorityClass priority, String payloadJson);

    WorkItem get(Long itemId);

    /**
     * Claim an item for the current pass: PENDING becomes PROCESSING, and
     * lastProcessedAt is stamped.
     */
    WorkItem beginPass(WorkItem item);

    /**
     * Mark a PROCESSING item COMPLETED and clear its checkpoints in one transaction.
     * Completing an already COMPLETED item is a no-op.
     */
    WorkItem complete(Long itemId, String resultId);

    /**
     * Move an item to FAILED with the error recorded.
     */
    WorkItem fail(Long itemId, String errorMessage);

    /**
     * Record a failed attempt. The item stays PROCESSING until attempts are
     * exhausted, then becomes FAILED.
     */
    WorkItem recordRetryableFailure(Long itemId, String errorMessage, int maxAttempts);

    /**
     * Operator recovery: FAILED back to PENDING with checkpoints and attempts cleared.
     */
    WorkItem reset(Long itemId);
}
