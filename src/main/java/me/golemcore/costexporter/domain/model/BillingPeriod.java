package me.golemcore.costexporter.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Time window every provider reports usage for: the current calendar month in
 * UTC, up to now.
 */
public record BillingPeriod(Instant start, Instant end) {

    public static BillingPeriod monthToDate(Clock clock) {
        Instant now = clock.instant();
        LocalDate firstOfMonth = LocalDate.ofInstant(now, ZoneOffset.UTC).withDayOfMonth(1);
        return new BillingPeriod(firstOfMonth.atStartOfDay(ZoneOffset.UTC).toInstant(), now);
    }

    public LocalDate startDate() {
        return LocalDate.ofInstant(start, ZoneOffset.UTC);
    }

    /**
     * Exclusive end date, i.e. the day after {@link #end()}.
     */
    public LocalDate endDateExclusive() {
        return LocalDate.ofInstant(end, ZoneOffset.UTC).plusDays(1);
    }
}
