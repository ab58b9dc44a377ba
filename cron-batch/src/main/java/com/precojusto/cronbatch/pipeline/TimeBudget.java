package com.precojusto.cronbatch.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget of one invocation, kept below the host's hard limit so the
 * response can still be written.
 */
public class TimeBudget {

    private final Clock clock;
    private final Instant start;
    private final Duration limit;

    private TimeBudget(Clock clock, Duration limit) {
        this.clock = clock;
        this.start = clock.instant();
        this.limit = limit;
    }

    public static TimeBudget start(Clock clock, Duration limit) {
        return new TimeBudget(clock, limit);
    }

    public Duration elapsed() {
        return Duration.between(start, clock.instant());
    }

    public boolean isExhausted() {
        return elapsed().compareTo(limit) >= 0;
    }

    public Duration getLimit() {
        return limit;
    }

    public Instant getStart() {
        return start;
    }
}
