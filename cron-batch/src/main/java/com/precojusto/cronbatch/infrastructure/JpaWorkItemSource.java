package com.precojusto.cronbatch.infrastructure;

import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.repository.WorkItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * WorkItemSource backed by the work_items table.
 */
@Service
@RequiredArgsConstructor
public class JpaWorkItemSource implements WorkItemSource {

    private static final Set<ItemStatus> OUTSTANDING = EnumSet.of(ItemStatus.PENDING, ItemStatus.PROCESSING);

    private final WorkItemRepository workItemRepository;

    @Override
    public List<WorkItem> findOutstanding(JobType jobType, int limit) {
        return workItemRepository.findOutstanding(jobType, OUTSTANDING, PageRequest.of(0, Math.max(limit, 1)));
    }

    @Override
    public List<WorkItem> findActiveCreatedAfter(JobType jobType, Instant createdAfter) {
        return workItemRepository.findByJobTypeAndStatusInAndCreatedAtAfter(jobType, OUTSTANDING, createdAfter);
    }

    @Override
    public Optional<WorkItem> findActiveForTarget(JobType jobType, String targetKey, Instant createdAfter) {
        return workItemRepository
                .findFirstByJobTypeAndTargetKeyAndStatusInAndCreatedAtAfterOrderByCreatedAtAsc(
                        jobType, targetKey, OUTSTANDING, createdAfter);
    }

    @Override
    public Optional<WorkItem> findById(Long itemId) {
        return workItemRepository.findById(itemId);
    }

    @Override
    public WorkItem save(WorkItem item) {
        return workItemRepository.save(item);
    }

    @Override
    public long countOutstanding(JobType jobType) {
        return workItemRepository.countByJobTypeAndStatusIn(jobType, OUTSTANDING);
    }
}
