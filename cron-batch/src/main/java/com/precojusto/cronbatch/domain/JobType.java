package com.precojusto.cronbatch.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Job types driven by the batch engine. The key is used in configuration
 * property names ({@code batch.jobs.<key>.*}).
 */
public enum JobType {
    AI_REPORT("ai-report"),
    FLAG_REEVALUATION("flag-reevaluation"),
    INDEX_MARK_TO_MARKET("mark-to-market"),
    INDEX_SCREENING("screening");

    private final String key;

    JobType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<JobType> fromKey(String key) {
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(key))
                .findFirst();
    }
}
