package com.precojusto.cronbatch.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Progress of a job type (global scope) or of a step's sub-units (item scope),
 * as read from and written to the checkpoint store.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class BatchProgress {

    private JobType jobType;
    private String scopeId;
    private String lastProcessedScopeId;

    @Builder.Default
    private int processedCount = 0;

    @Builder.Default
    private int totalCount = 0;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Set by the store on save, only when processedCount equals totalCount.
     */
    private Instant completedAt;

    public static BatchProgress empty(JobType jobType, String scopeId) {
        return BatchProgress.builder()
                .jobType(jobType)
                .scopeId(scopeId)
                .build();
    }

    public boolean isComplete() {
        return totalCount > 0 && processedCount == totalCount;
    }
}
