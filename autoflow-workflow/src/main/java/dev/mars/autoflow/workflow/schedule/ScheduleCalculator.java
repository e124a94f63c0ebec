package dev.mars.autoflow.workflow.schedule;

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

import dev.mars.autoflow.core.ScheduleSpec;
import dev.mars.autoflow.workflow.validation.ValidationResult;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Computes fire times for schedules given either as cron expressions or as frequencies.
 *
 * <p>A frequency is one of {@code hourly}, {@code daily}, {@code weekly}, {@code monthly},
 * or an ISO-8601 period or duration such as {@code P1D} or {@code PT15M}. Frequency
 * schedules fire at {@code startAt} plus whole multiples of the frequency; without a
 * {@code startAt} they fire one interval after the reference time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public final class ScheduleCalculator {

    private ScheduleCalculator() {
    }

    /**
     * Validates the schedule fields, recording problems in {@code result}.
     */
    public static void validate(ScheduleSpec spec, ValidationResult result) {
        boolean hasCron = spec.cron() != null && !spec.cron().isBlank();
        boolean hasFrequency = spec.frequency() != null && !spec.frequency().isBlank();
        if (hasCron == hasFrequency) {
            result.addError("cron", "exactly one of cron or frequency must be set");
        }
        if (hasCron) {
            try {
                CronExpression.parse(spec.cron());
            } catch (IllegalArgumentException e) {
                result.addError("cron", e.getMessage());
            }
        }
        if (hasFrequency && parseFrequency(spec.frequency()).isEmpty()) {
            result.addError("frequency", "unknown frequency '" + spec.frequency() + "'");
        }
        try {
            ZoneId.of(spec.timezone());
        } catch (DateTimeException e) {
            result.addError("timezone", "unknown timezone '" + spec.timezone() + "'");
        }
        if (spec.startAt() != null && spec.endAt() != null && !spec.endAt().isAfter(spec.startAt())) {
            result.addError("endAt", "must be after startAt");
        }
    }

    /**
     * The first fire time strictly after {@code after}, or empty once the schedule has ended.
     */
    public static Optional<Instant> nextFireTime(ScheduleSpec spec, Instant after) {
        ZoneId zone = ZoneId.of(spec.timezone());
        Instant from = after;
        if (spec.startAt() != null && spec.startAt().isAfter(after)) {
            // the start itself is a valid fire time for frequencies, so search from just before it
            from = spec.startAt().minusMillis(1);
        }

        Optional<Instant> next;
        if (spec.isCron()) {
            next = CronExpression.parse(spec.cron()).next(from.atZone(zone)).map(ZonedDateTime::toInstant);
        } else {
            Frequency frequency = parseFrequency(spec.frequency())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown frequency '" + spec.frequency() + "'"));
            next = Optional.of(nextByFrequency(frequency, spec.startAt(), from, zone));
        }
        return next.filter(instant -> spec.endAt() == null || !instant.isAfter(spec.endAt()));
    }

    private static Instant nextByFrequency(Frequency frequency, Instant anchor, Instant after, ZoneId zone) {
        if (anchor == null) {
            return frequency.addTo(after.atZone(zone)).toInstant();
        }
        ZonedDateTime candidate = anchor.atZone(zone);
        if (candidate.toInstant().isAfter(after)) {
            return candidate.toInstant();
        }
        // jump close to the target for fixed-length durations, then step
        if (frequency.duration != null && !frequency.duration.isZero()) {
            long steps = Duration.between(anchor, after).toMillis() / frequency.duration.toMillis();
            candidate = candidate.plus(frequency.duration.multipliedBy(Math.max(0, steps - 1)));
        }
        while (!candidate.toInstant().isAfter(after)) {
            candidate = frequency.addTo(candidate);
        }
        return candidate.toInstant();
    }

    static Optional<Frequency> parseFrequency(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "hourly":
                return Optional.of(new Frequency(Duration.ofHours(1), null));
            case "daily":
                return Optional.of(new Frequency(null, Period.ofDays(1)));
            case "weekly":
                return Optional.of(new Frequency(null, Period.ofWeeks(1)));
            case "monthly":
                return Optional.of(new Frequency(null, Period.ofMonths(1)));
            default:
                break;
        }
        String iso = text.trim().toUpperCase(Locale.ROOT);
        try {
            Duration duration = Duration.parse(iso);
            return duration.isNegative() || duration.isZero() ? Optional.empty()
                    : Optional.of(new Frequency(duration, null));
        } catch (DateTimeParseException e) {
            try {
                Period period = Period.parse(iso);
                return period.isNegative() || period.isZero() ? Optional.empty()
                        : Optional.of(new Frequency(null, period));
            } catch (DateTimeParseException notAPeriod) {
                return Optional.empty();
            }
        }
    }

    /**
     * Either a fixed duration or a calendar period, applied in the schedule's zone.
     */
    static final class Frequency {
        private final Duration duration;
        private final Period period;

        Frequency(Duration duration, Period period) {
            this.duration = duration;
            this.period = period;
        }

        ZonedDateTime addTo(ZonedDateTime time) {
            return duration != null ? time.plus(duration) : time.plus(period);
        }
    }
}
