package com.precojusto.cronbatch.service;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one trigger call, merged over the job types it ran.
 */
@Data
@Builder
public class CronRunSummary {

    private String job;
    private int processed;

    /**
     * Job specific counters keyed by counter name, e.g. {@code reportsGenerated}.
     */
    @Builder.Default
    private Map<String, Integer> counters = new LinkedHashMap<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private long durationMs;
    private boolean hasMore;
    private String message;
}
