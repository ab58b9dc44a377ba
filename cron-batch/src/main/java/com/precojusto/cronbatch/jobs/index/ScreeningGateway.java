package com.precojusto.cronbatch.jobs.index;

import java.time.LocalDate;
import java.util.List;

/**
 * Rule engine collaborators of the daily screening and rebalancing job.
 */
public interface ScreeningGateway {

    List<String> activeIndexIds();

    /**
     * Whether a screening or rebalance log already exists for the date.
     */
    boolean screenedOn(String indexId, LocalDate date);

    /**
     * Run the index rules and the optional quality filter.
     */
    ScreeningOutput screen(String indexId, LocalDate businessDate);

    /**
     * Compare the screened composition with the current one against the
     * index's rebalance threshold.
     */
    RebalanceDecision decide(String indexId, ScreeningOutput screening);

    /**
     * Replace the composition, keeping history points intact.
     *
     * @return id of the rebalance log entry
     */
    String applyRebalance(String indexId, RebalanceDecision decision, String idempotencyKey);

    /**
     * Record that screening ran without changing the composition. At most one
     * such entry is written per index and day.
     */
    void logScreening(String indexId, LocalDate date, String message);
}
