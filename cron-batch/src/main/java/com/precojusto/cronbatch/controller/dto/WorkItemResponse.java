package com.precojusto.cronbatch.controller.dto;

import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.PriorityClass;
import com.precojusto.cronbatch.domain.WorkItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkItemResponse {

    private Long id;
    private String jobType;
    private String targetKey;
    private PriorityClass priority;
    private ItemStatus status;
    private Integer retryCount;
    private String lastError;
    private String resultId;
    private Instant createdAt;
    private Instant lastProcessedAt;
    private Instant completedAt;

    public static WorkItemResponse from(WorkItem item) {
        return WorkItemResponse.builder()
                .id(item.getId())
                .jobType(item.getJobType().getKey())
                .targetKey(item.getTargetKey())
                .priority(item.getPriority())
                .status(item.getStatus())
                .retryCount(item.getRetryCount())
                .lastError(item.getLastError())
                .resultId(item.getResultId())
                .createdAt(item.getCreatedAt())
                .lastProcessedAt(item.getLastProcessedAt())
                .completedAt(item.getCompletedAt())
                .build();
    }
}
