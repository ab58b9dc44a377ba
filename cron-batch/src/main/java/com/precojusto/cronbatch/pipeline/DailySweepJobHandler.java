package com.precojusto.cronbatch.pipeline;

import java.time.LocalDate;
import java.util.List;

/**
 * Handler of a job that processes every target once per trading day. The
 * executor enrolls one work item per target at the start of each business day.
 */
public interface DailySweepJobHandler extends JobHandler {

    /**
     * Target keys to enroll for the given business date.
     */
    List<String> targets(LocalDate businessDate);
}
