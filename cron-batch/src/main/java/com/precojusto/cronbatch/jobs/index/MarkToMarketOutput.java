package com.precojusto.cronbatch.jobs.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarkToMarketOutput {

    private String indexId;
    private LocalDate businessDate;
    private boolean alreadyUpToDate;
    private int filledDays;
    private BigDecimal points;
}
