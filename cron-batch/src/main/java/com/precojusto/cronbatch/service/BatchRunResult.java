package com.precojusto.cronbatch.service;

import com.precojusto.cronbatch.domain.JobType;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one executor invocation for one job type.
 */
@Data
@Builder
public class BatchRunResult {

    private JobType jobType;
    private String counterName;
    private int processed;
    private int counted;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private long durationMs;
    private boolean hasMore;
    private boolean timedOut;
    private String message;
}
