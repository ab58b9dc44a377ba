package com.precojusto.cronbatch.jobs.index;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Index history collaborators of the daily mark-to-market job.
 */
public interface MarkToMarketGateway {

    /**
     * Ids of the indices to update, in creation order.
     */
    List<String> activeIndexIds();

    boolean hasPointFor(String indexId, LocalDate date);

    /**
     * Trading days before {@code businessDate} that have no history point, oldest first.
     */
    List<LocalDate> missingHistoryDates(String indexId, LocalDate businessDate);

    /**
     * Write the history point of one past trading day.
     */
    void fillHistory(String indexId, LocalDate date);

    /**
     * Compute and store the index points of the business date.
     *
     * @return the new index level
     */
    BigDecimal updatePoints(String indexId, LocalDate businessDate);
}
