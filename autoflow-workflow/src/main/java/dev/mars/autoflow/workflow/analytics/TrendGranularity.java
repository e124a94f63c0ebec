package dev.mars.autoflow.workflow.analytics;

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
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Bucket size of a trend series. Buckets are aligned in UTC; weeks start on Monday.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public enum TrendGranularity {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    public Instant bucketStart(Instant instant) {
        ZonedDateTime time = instant.atZone(ZoneOffset.UTC);
        switch (this) {
            case HOUR:
                return time.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAY:
                return time.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEK:
                return time.truncatedTo(ChronoUnit.DAYS)
                        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toInstant();
            case MONTH:
                return time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).toInstant();
            default:
                throw new IllegalStateException("Unhandled granularity " + this);
        }
    }

    public Instant nextBucket(Instant bucketStart) {
        ZonedDateTime time = bucketStart.atZone(ZoneOffset.UTC);
        switch (this) {
            case HOUR:
                return time.plusHours(1).toInstant();
            case DAY:
                return time.plusDays(1).toInstant();
            case WEEK:
                return time.plusWeeks(1).toInstant();
            case MONTH:
                return time.plusMonths(1).toInstant();
            default:
                throw new IllegalStateException("Unhandled granularity " + this);
        }
    }

    /**
     * Accepts {@code hour}, {@code day}, {@code week}, {@code month} in any case; null means DAY.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static TrendGranularity fromString(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
