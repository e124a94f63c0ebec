package dev.mars.autoflow.core;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * Period lengths for persisted analytics rollups. Periods are aligned in UTC.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public enum RollupGranularity {
    DAILY,
    WEEKLY,
    MONTHLY;

    public Instant periodStart(Instant instant) {
        LocalDate date = instant.atZone(ZoneOffset.UTC).toLocalDate();
        switch (this) {
            case WEEKLY:
                date = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                break;
            case MONTHLY:
                date = date.withDayOfMonth(1);
                break;
            default:
                break;
        }
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public Instant periodEnd(Instant periodStart) {
        LocalDate date = periodStart.atZone(ZoneOffset.UTC).toLocalDate();
        switch (this) {
            case WEEKLY:
                return date.plusWeeks(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            case MONTHLY:
                return date.plusMonths(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            default:
                return date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
    }
}
