package com.precojusto.cronbatch.jobs.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RebalanceDecision {

    private boolean rebalance;

    @Builder.Default
    private List<String> changes = new ArrayList<>();

    private String reason;

    public static RebalanceDecision keep(String reason) {
        return RebalanceDecision.builder().rebalance(false).reason(reason).build();
    }
}
