package com.precojusto.cronbatch.repository;

import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.StepCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for per-step checkpoints.
 */
@Repository
public interface StepCheckpointRepository extends JpaRepository<StepCheckpoint, Long> {

    Optional<StepCheckpoint> findByJobTypeAndScopeIdAndStep(JobType jobType, String scopeId, String step);

    List<StepCheckpoint> findByJobTypeAndScopeId(JobType jobType, String scopeId);

    @Modifying
    @Query("DELETE FROM StepCheckpoint c WHERE c.jobType = :jobType AND c.scopeId = :scopeId")
    int deleteByScope(@Param("jobType") JobType jobType, @Param("scopeId") String scopeId);
}
