package com.precojusto.cronbatch.repository;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.ProgressCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for global batch progress and sub-task cursors.
 */
@Repository
public interface ProgressCheckpointRepository extends JpaRepository<ProgressCheckpoint, Long> {

    Optional<ProgressCheckpoint> findByJobTypeAndScopeId(JobType jobType, String scopeId);

    /**
     * Scoped rows other than the given sentinel, i.e. pending sub-task cursors.
     */
    List<ProgressCheckpoint> findByJobTypeAndScopeIdNot(JobType jobType, String scopeId);

    /**
     * Legacy rows written with a NULL scope, most recently updated first.
     */
    List<ProgressCheckpoint> findByJobTypeAndScopeIdIsNullOrderByUpdatedAtDesc(JobType jobType);

    @Modifying
    @Query("DELETE FROM ProgressCheckpoint p WHERE p.jobType = :jobType AND p.scopeId IS NULL")
    int deleteLegacyScope(@Param("jobType") JobType jobType);

    @Modifying
    @Query("DELETE FROM ProgressCheckpoint p WHERE p.jobType = :jobType AND p.scopeId = :scopeId")
    int deleteByScope(@Param("jobType") JobType jobType, @Param("scopeId") String scopeId);
}
