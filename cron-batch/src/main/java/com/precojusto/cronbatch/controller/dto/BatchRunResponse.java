package com.precojusto.cronbatch.controller.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.precojusto.cronbatch.service.CronRunSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response of a cron trigger. Job counters are written as top level fields.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "job", "processed"})
public class BatchRunResponse {

    private boolean success;
    private String job;
    private int processed;
    private List<String> errors;
    private String duration;
    private boolean hasMore;
    private Instant timestamp;
    private String message;

    @Builder.Default
    private Map<String, Integer> counters = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Integer> getCounters() {
        return counters;
    }

    public static BatchRunResponse from(CronRunSummary summary, Instant timestamp) {
        return BatchRunResponse.builder()
                .success(true)
                .job(summary.getJob())
                .processed(summary.getProcessed())
                .counters(new LinkedHashMap<>(summary.getCounters()))
                .errors(summary.getErrors().isEmpty() ? null : summary.getErrors())
                .duration(summary.getDurationMs() + "ms")
                .hasMore(summary.isHasMore())
                .timestamp(timestamp)
                .message(summary.getMessage())
                .build();
    }
}
