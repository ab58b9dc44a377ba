package com.precojusto.cronbatch.infrastructure;

import com.precojusto.cronbatch.domain.JobType;

import java.util.Optional;

/**
 * Exclusive per-job-type lease held for the duration of one invocation.
 */
public interface JobLease {

    /**
     * Try to acquire the lease.
     *
     * @param jobType the job type
     * @return the lease token, or empty if another invocation holds it
     */
    Optional<String> tryAcquire(JobType jobType);

    /**
     * Release a lease previously acquired with the given token. Releasing an
     * expired or foreign lease is a no-op.
     */
    void release(JobType jobType, String token);
}
