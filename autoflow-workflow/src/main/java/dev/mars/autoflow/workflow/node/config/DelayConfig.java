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

import java.time.Duration;

public final class DelayConfig {

    public static final long DEFAULT_DELAY_MS = 1000;
    public static final long MAX_DELAY_MS = Duration.ofDays(7).toMillis();

    private final long delayMs;

    @JsonCreator
    public DelayConfig(@JsonProperty("delayMs") Long delayMs) {
        this.delayMs = delayMs != null ? delayMs : DEFAULT_DELAY_MS;
    }

    public long getDelayMs() {
        return delayMs;
    }
}
