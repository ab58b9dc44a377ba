package com.precojusto.cronbatch.jobs.flag;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlagAnalysis {

    private boolean stillRelevant;
    private String rationale;
    private Instant analyzedAt;
}
