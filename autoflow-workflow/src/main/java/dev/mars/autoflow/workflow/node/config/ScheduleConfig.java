package dev.mars.autoflow.workflow.node.config;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.autoflow.core.ScheduleSpec;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of a SCHEDULE node: exactly one of {@code cron} or {@code frequency}.
 */
public final class ScheduleConfig {

    private final ScheduleSpec schedule;
    private final boolean active;
    private final String resultKey;
    private final Map<String, Object> metadata;

    @JsonCreator
    public ScheduleConfig(@JsonProperty("cron") String cron,
                          @JsonProperty("frequency") String frequency,
                          @JsonProperty("timezone") String timezone,
                          @JsonProperty("startAt") Instant startAt,
                          @JsonProperty("endAt") Instant endAt,
                          @JsonProperty("isActive") Boolean active,
                          @JsonProperty("resultKey") String resultKey,
                          @JsonProperty("metadata") Map<String, Object> metadata) {
        this.schedule = new ScheduleSpec(cron, frequency, timezone, startAt, endAt);
        this.active = active == null || active;
        this.resultKey = resultKey;
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ScheduleSpec getSchedule() {
        return schedule;
    }

    public boolean isActive() {
        return active;
    }

    public String getResultKey() {
        return resultKey;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
