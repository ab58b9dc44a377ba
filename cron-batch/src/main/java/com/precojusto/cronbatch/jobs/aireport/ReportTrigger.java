package com.precojusto.cronbatch.jobs.aireport;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Payload of an AI report item: the company and why the report was requested.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportTrigger {

    private Long companyId;
    private String ticker;
    private String companyName;
    private ReportType reportType;

    /**
     * Trigger details, e.g. variation window and prices, or the custom trigger config.
     */
    @Builder.Default
    private Map<String, Object> triggerReason = new HashMap<>();
}
