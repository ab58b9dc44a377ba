package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.infrastructure.CheckpointStore;
import com.precojusto.cronbatch.infrastructure.WorkItemSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chooses the next batch of work items for a job type. Read-only.
 *
 * <p>Order: priority class, oldest lastProcessedAt (never processed first),
 * creation time, id. Items owning a pending sub-task cursor go first. A PENDING
 * item is left out while another active item for the same target, created inside
 * the recency window, is PROCESSING or comes earlier in that order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkSelector {

    // extra candidates fetched so exclusions do not shrink the batch
    private static final int CANDIDATE_FACTOR = 4;

    static final Comparator<WorkItem> SELECTION_ORDER = Comparator
            .comparingInt((WorkItem item) -> item.getPriority().getRank())
            .thenComparing(WorkItem::getLastProcessedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WorkItem::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(WorkItem::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final WorkItemSource workItemSource;
    private final CheckpointStore checkpointStore;
    private final JobSettings jobSettings;
    private final Clock clock;

    public List<WorkItem> select(JobType jobType, int batchSize) {
        if (batchSize <= 0) {
            return List.of();
        }

        Map<Long, WorkItem> candidates = new LinkedHashMap<>();
        for (WorkItem item : workItemSource.findOutstanding(jobType, batchSize * CANDIDATE_FACTOR)) {
            candidates.put(item.getId(), item);
        }

        Set<String> pendingSubTaskScopes = checkpointStore.scopesWithProgress(jobType);
        for (String scopeId : pendingSubTaskScopes) {
            parseId(scopeId)
                    .filter(id -> !candidates.containsKey(id))
                    .flatMap(workItemSource::findById)
                    .filter(item -> item.getJobType() == jobType && !item.getStatus().isTerminal())
                    .ifPresent(item -> candidates.put(item.getId(), item));
        }

        Instant windowStart = clock.instant().minus(jobSettings.getRecencyWindow());
        Map<String, List<WorkItem>> activeByTarget = workItemSource.findActiveCreatedAfter(jobType, windowStart)
                .stream()
                .collect(Collectors.groupingBy(WorkItem::getTargetKey));

        List<WorkItem> ordered = new ArrayList<>(candidates.values());
        ordered.sort(SELECTION_ORDER);

        List<WorkItem> withCursor = new ArrayList<>();
        List<WorkItem> others = new ArrayList<>();
        for (WorkItem item : ordered) {
            if (isDuplicate(item, activeByTarget.getOrDefault(item.getTargetKey(), List.of()))) {
                log.debug("Skipping item {}: another active item exists for target {}",
                        item.getId(), item.getTargetKey());
                continue;
            }
            if (pendingSubTaskScopes.contains(item.scopeId())) {
                withCursor.add(item);
            } else {
                others.add(item);
            }
        }

        List<WorkItem> batch = new ArrayList<>(withCursor);
        batch.addAll(others);
        List<WorkItem> selected = batch.size() > batchSize ? new ArrayList<>(batch.subList(0, batchSize)) : batch;

        log.info("Selected {} {} item(s) ({} with pending sub-tasks) from {} candidate(s)",
                selected.size(), jobType, withCursor.size(), candidates.size());
        return selected;
    }

    private boolean isDuplicate(WorkItem item, List<WorkItem> sameTarget) {
        if (item.getStatus() != ItemStatus.PENDING) {
            return false;
        }
        return sameTarget.stream()
                .filter(other -> !Objects.equals(other.getId(), item.getId()))
                .anyMatch(other -> other.getStatus() == ItemStatus.PROCESSING
                        || SELECTION_ORDER.compare(other, item) < 0);
    }

    private Optional<Long> parseId(String scopeId) {
        try {
            return Optional.of(Long.valueOf(scopeId));
        } catch (NumberFormatException e) {
            log.warn("Ignoring sub-task cursor with non-item scope {}", scopeId);
            return Optional.empty();
        }
    }
}
