package com.precojusto.cronbatch.controller.dto;

import com.precojusto.cronbatch.domain.BatchProgress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobProgressResponse {

    private String jobType;
    private int processedCount;
    private int totalCount;
    private boolean complete;
    private String lastProcessedScopeId;
    private List<String> errors;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public static JobProgressResponse from(BatchProgress progress) {
        return JobProgressResponse.builder()
                .jobType(progress.getJobType().getKey())
                .processedCount(progress.getProcessedCount())
                .totalCount(progress.getTotalCount())
                .complete(progress.isComplete())
                .lastProcessedScopeId(progress.getLastProcessedScopeId())
                .errors(progress.getErrors())
                .createdAt(progress.getCreatedAt())
                .updatedAt(progress.getUpdatedAt())
                .completedAt(progress.getCompletedAt())
                .build();
    }
}
