package com.precojusto.cronbatch.jobs.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScreeningOutput {

    private String indexId;
    private LocalDate businessDate;
    private boolean alreadyScreened;

    /**
     * Tickers of the ideal composition that passed the quality filter.
     */
    @Builder.Default
    private List<String> candidates = new ArrayList<>();

    @Builder.Default
    private List<String> qualityRejected = new ArrayList<>();
}
