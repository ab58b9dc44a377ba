package com.precojusto.cronbatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Single time source for time budgets, business dates and audit columns.
 */
@Configuration
public class ClockConfig {

    @Value("${batch.timezone:America/Sao_Paulo}")
    private String timezone;

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(timezone));
    }

    @Bean
    public DateTimeProvider auditingDateTimeProvider(Clock clock) {
        return () -> Optional.of(clock.instant());
    }
}
