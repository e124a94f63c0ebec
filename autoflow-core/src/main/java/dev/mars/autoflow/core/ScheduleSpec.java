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

import java.time.Instant;

/**
 * When a schedule fires: exactly one of a 5-field cron expression or a frequency
 * ({@code hourly}, {@code daily}, {@code weekly}, {@code monthly} or an ISO-8601
 * duration), evaluated in {@code timezone} and bounded by {@code startAt}/{@code endAt}.
 */
public record ScheduleSpec(String cron, String frequency, String timezone, Instant startAt, Instant endAt) {

    public ScheduleSpec {
        timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone;
    }

    public static ScheduleSpec cron(String cron, String timezone) {
        return new ScheduleSpec(cron, null, timezone, null, null);
    }

    public static ScheduleSpec every(String frequency) {
        return new ScheduleSpec(null, frequency, null, null, null);
    }

    public boolean isCron() {
        return cron != null && !cron.isBlank();
    }
}
