package com.precojusto.cronbatch.infrastructure;

import com.precojusto.cronbatch.domain.JobType;

import java.util.Optional;

/**
 * Lease that always succeeds. Used when the scheduler is trusted never to
 * overlap invocations of the same job type.
 */
public class NoOpJobLease implements JobLease {

    private static final String TOKEN = "no-op";

    @Override
    public Optional<String> tryAcquire(JobType jobType) {
        return Optional.of(TOKEN);
    }

    @Override
    public void release(JobType jobType, String token) {
        // nothing held
    }
}
