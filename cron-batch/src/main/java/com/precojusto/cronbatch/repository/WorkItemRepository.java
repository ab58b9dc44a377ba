package com.precojusto.cronbatch.repository;

import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.WorkItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for WorkItem entity.
 */
@Repository
public interface WorkItemRepository extends JpaRepository<WorkItem, Long> {

    /**
     * Find items needing processing, ordered by priority class, staleness and creation.
     * Priority is stored by name, so the rank order is spelled out here.
     *
     * @param jobType  the job type
     * @param statuses statuses considered outstanding
     * @param pageable page limiting the batch size
     * @return ordered candidate items
     */
    @Query("SELECT w FROM WorkItem w WHERE w.jobType = :jobType AND w.status IN :statuses " +
            "ORDER BY CASE w.priority " +
            "WHEN com.precojusto.cronbatch.domain.PriorityClass.PREMIUM THEN 0 " +
            "WHEN com.precojusto.cronbatch.domain.PriorityClass.STANDARD THEN 1 ELSE 2 END ASC, " +
            "w.lastProcessedAt ASC NULLS FIRST, w.createdAt ASC, w.id ASC")
    List<WorkItem> findOutstanding(
            @Param("jobType") JobType jobType,
            @Param("statuses") Collection<ItemStatus> statuses,
            Pageable pageable);

    /**
     * Find non-terminal items for a job type created after a given instant.
     */
    List<WorkItem> findByJobTypeAndStatusInAndCreatedAtAfter(
            JobType jobType, Collection<ItemStatus> statuses, Instant createdAfter);

    /**
     * Find the oldest non-terminal item for a logical target created after a given instant.
     */
    Optional<WorkItem> findFirstByJobTypeAndTargetKeyAndStatusInAndCreatedAtAfterOrderByCreatedAtAsc(
            JobType jobType, String targetKey, Collection<ItemStatus> statuses, Instant createdAfter);

    /**
     * Count items in any of the given statuses.
     */
    long countByJobTypeAndStatusIn(JobType jobType, Collection<ItemStatus> statuses);
}
