package com.precojusto.cronbatch.jobs.aireport;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompiledReport {

    private String content;
    private boolean fundamentalLoss;
    private String conclusion;
    private String assessment;
}
