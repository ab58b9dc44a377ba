package com.precojusto.cronbatch.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradingCalendarTest {

    // 2024-03-06 01:30 UTC is still Tuesday 2024-03-05 in Sao Paulo
    private static final Instant LATE_TUESDAY = Instant.parse("2024-03-06T01:30:00Z");

    private final TradingCalendar calendar = new TradingCalendar(Clock.fixed(LATE_TUESDAY, ZoneOffset.UTC),
            "America/Sao_Paulo", List.of("2024-02-12", " 2024-02-13 ", ""));

    @Test
    void testToday_UsesExchangeTimezone() {
        assertEquals(LocalDate.of(2024, 3, 5), calendar.today());
    }

    @Test
    void testIsToday() {
        assertTrue(calendar.isToday(Instant.parse("2024-03-05T03:00:00Z")));
        assertFalse(calendar.isToday(Instant.parse("2024-03-05T02:59:59Z")));
        assertFalse(calendar.isToday(null));
    }

    @Test
    void testIsTradingDay_Weekdays() {
        assertTrue(calendar.isTradingDay(LocalDate.of(2024, 3, 4)));
        assertTrue(calendar.isTradingDay(LocalDate.of(2024, 3, 8)));
    }

    @Test
    void testIsTradingDay_Weekend() {
        assertFalse(calendar.isTradingDay(LocalDate.of(2024, 3, 9)));
        assertFalse(calendar.isTradingDay(LocalDate.of(2024, 3, 10)));
    }

    @Test
    void testIsTradingDay_ConfiguredHolidays() {
        assertFalse(calendar.isTradingDay(LocalDate.of(2024, 2, 12)));
        assertFalse(calendar.isTradingDay(LocalDate.of(2024, 2, 13)));
        assertTrue(calendar.isTradingDay(LocalDate.of(2024, 2, 14)));
    }
}
