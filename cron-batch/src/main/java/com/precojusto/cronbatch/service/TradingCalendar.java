package com.precojusto.cronbatch.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Business dates in the exchange timezone. Trading days are weekdays that are
 * not configured holidays.
 */
@Component
@Slf4j
public class TradingCalendar {

    private final Clock clock;
    private final ZoneId zone;
    private final Set<LocalDate> holidays;

    public TradingCalendar(Clock clock,
            @Value("${batch.timezone:America/Sao_Paulo}") String timezone,
            @Value("${batch.calendar.holidays:}") List<String> holidays) {
        this.clock = clock;
        this.zone = ZoneId.of(timezone);
        this.holidays = holidays.stream()
                .map(String::trim)
                .filter(date -> !date.isEmpty())
                .map(LocalDate::parse)
                .collect(Collectors.toSet());
        log.info("Trading calendar in {} with {} configured holiday(s)", zone, this.holidays.size());
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zone);
    }

    public LocalDate businessDate(Instant instant) {
        return LocalDate.ofInstant(instant, zone);
    }

    public boolean isToday(Instant instant) {
        return instant != null && businessDate(instant).equals(today());
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY && !holidays.contains(date);
    }

    public ZoneId getZone() {
        return zone;
    }
}
