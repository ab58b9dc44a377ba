package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.PriorityClass;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.exception.InvalidStateTransitionException;
import com.precojusto.cronbatch.exception.WorkItemNotFoundException;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import com.precojusto.cronbatch.infrastructure.WorkItemSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Implementation of WorkItemService over the work item source and checkpoint store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkItemServiceImpl implements WorkItemService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final WorkItemSource workItemSource;
    private final CheckpointStore checkpointStore;
    private final JobSettings jobSettings;
    private final BatchMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public EnqueueResult enqueue(JobType jobType, String targetKey, PriorityClass priority, String payloadJson) {
        Instant now = clock.instant();
        Instant windowStart = now.minus(jobSettings.getRecencyWindow());

        Optional<WorkItem> active = workItemSource.findActiveForTarget(jobType, targetKey, windowStart);
        if (active.isPresent()) {
            WorkItem item = active.get();
            log.info("Active {} item {} already exists for target {} with status {}",
                    jobType, item.getId(), targetKey, item.getStatus());
            return new EnqueueResult(item, true);
        }

        WorkItem item = workItemSource.save(WorkItem.builder()
                .jobType(jobType)
                .targetKey(targetKey)
                .priority(priority != null ? priority : PriorityClass.STANDARD)
                .payloadJson(payloadJson)
                .status(ItemStatus.PENDING)
                .retryCount(0)
                .createdAt(now)
                .build());

        metricsService.recordItemEnqueued(jobType);
        log.info("Enqueued {} item {} for target {} ({})", jobType, item.getId(), targetKey, item.getPriority());
        return new EnqueueResult(item, false);
    }

    @Override
    @Transactional(readOnly = true)
    public WorkItem get(Long itemId) {
        return workItemSource.findById(itemId)
                .orElseThrow(() -> new WorkItemNotFoundException(itemId));
    }

    @Override
    @Transactional
    public WorkItem beginPass(WorkItem item) {
        if (item.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException(item.getId(), item.getStatus(), ItemStatus.PROCESSING);
        }
        if (item.getStatus() == ItemStatus.PENDING) {
            log.info("Item {} PENDING -> PROCESSING", item.getId());
            item.setStatus(ItemStatus.PROCESSING);
        }
        item.setLastProcessedAt(clock.instant());
        return workItemSource.save(item);
    }

    @Override
    @Transactional
    public WorkItem complete(Long itemId, String resultId) {
        WorkItem item = get(itemId);

        if (item.getStatus() == ItemStatus.COMPLETED) {
            log.warn("Item {} is already COMPLETED. Skipping duplicate completion.", itemId);
            return item;
        }
        if (item.getStatus() != ItemStatus.PROCESSING) {
            throw new InvalidStateTransitionException(itemId, item.getStatus(), ItemStatus.COMPLETED);
        }

        Instant now = clock.instant();
        item.setStatus(ItemStatus.COMPLETED);
        item.setResultId(resultId);
        item.setCompletedAt(now);
        item.setLastError(null);
        WorkItem saved = workItemSource.save(item);

        checkpointStore.clear(item.getJobType(), item.scopeId());

        metricsService.recordItemCompleted(item.getJobType());
        log.info("Item {} PROCESSING -> COMPLETED (result {})", itemId, resultId);
        return saved;
    }

    @Override
    @Transactional
    public WorkItem fail(Long itemId, String errorMessage) {
        WorkItem item = get(itemId);

        if (item.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException(itemId, item.getStatus(), ItemStatus.FAILED);
        }

        ItemStatus previous = item.getStatus();
        item.setStatus(ItemStatus.FAILED);
        item.setLastError(truncate(errorMessage));
        WorkItem saved = workItemSource.save(item);

        // an abandoned step keeps no sub-task cursor
        checkpointStore.clearProgress(item.getJobType(), item.scopeId());

        metricsService.recordItemFailed(item.getJobType());
        log.error("Item {} {} -> FAILED: {}", itemId, previous, saved.getLastError());
        return saved;
    }

    @Override
    @Transactional
    public WorkItem recordRetryableFailure(Long itemId, String errorMessage, int maxAttempts) {
        WorkItem item = get(itemId);

        int attempts = item.getRetryCount() + 1;
        if (attempts >= maxAttempts) {
            log.error("Item {} exhausted {} attempt(s)", itemId, attempts);
            item.setRetryCount(attempts);
            workItemSource.save(item);
            return fail(itemId, errorMessage);
        }

        item.setRetryCount(attempts);
        item.setLastError(truncate(errorMessage));
        WorkItem saved = workItemSource.save(item);

        metricsService.recordItemRetried(item.getJobType());
        log.warn("Item {} failed attempt {}/{}, will retry on a later invocation: {}",
                itemId, attempts, maxAttempts, saved.getLastError());
        return saved;
    }

    @Override
    @Transactional
    public WorkItem reset(Long itemId) {
        WorkItem item = get(itemId);

        if (item.getStatus() != ItemStatus.FAILED) {
            throw new InvalidStateTransitionException(itemId, item.getStatus(), ItemStatus.PENDING);
        }

        checkpointStore.clear(item.getJobType(), item.scopeId());

        item.setStatus(ItemStatus.PENDING);
        item.setRetryCount(0);
        item.setLastError(null);
        item.setLastProcessedAt(null);
        WorkItem saved = workItemSource.save(item);

        log.info("Item {} FAILED -> PENDING (operator reset)", itemId);
        return saved;
    }

    private String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH - 3) + "..." : message;
    }
}
