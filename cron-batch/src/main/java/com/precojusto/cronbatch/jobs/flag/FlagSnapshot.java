package com.precojusto.cronbatch.jobs.flag;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current state of a company flag as seen by the reevaluation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlagSnapshot {

    private String flagId;
    private Long companyId;
    private String ticker;
    private String companyName;
    private String flagType;
    private String reason;
}
