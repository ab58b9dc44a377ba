package com.precojusto.cronbatch.jobs.aireport;

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
public class ResearchOutput {

    private boolean required;
    private String summary;

    @Builder.Default
    private List<String> sources = new ArrayList<>();

    public static ResearchOutput notRequired() {
        return ResearchOutput.builder().required(false).build();
    }
}
