package me.golemcore.costexporter.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class BillingPeriodTest {

    @Test
    void shouldStartAtFirstOfMonthUtc() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T12:30:00Z"), ZoneOffset.UTC);

        BillingPeriod period = BillingPeriod.monthToDate(clock);

        assertEquals(Instant.parse("2026-03-01T00:00:00Z"), period.start());
        assertEquals(Instant.parse("2026-03-15T12:30:00Z"), period.end());
        assertEquals(LocalDate.of(2026, 3, 1), period.startDate());
        assertEquals(LocalDate.of(2026, 3, 16), period.endDateExclusive());
    }

    @Test
    void shouldIgnoreClockZone() {
        // 23:30 on the last day of February in UTC-5 is already March in UTC
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T04:30:00Z"), ZoneOffset.ofHours(-5));

        BillingPeriod period = BillingPeriod.monthToDate(clock);

        assertEquals(LocalDate.of(2026, 3, 1), period.startDate());
    }

    @Test
    void shouldCrossYearBoundaryForEndDate() {
        Clock clock = Clock.fixed(Instant.parse("2026-12-31T10:00:00Z"), ZoneOffset.UTC);

        BillingPeriod period = BillingPeriod.monthToDate(clock);

        assertEquals(LocalDate.of(2026, 12, 1), period.startDate());
        assertEquals(LocalDate.of(2027, 1, 1), period.endDateExclusive());
    }
}
