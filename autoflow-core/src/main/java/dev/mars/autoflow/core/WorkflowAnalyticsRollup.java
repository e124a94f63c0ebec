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
import java.util.List;
import java.util.Objects;

/**
 * Persisted aggregate of one workflow over one period. Unique by
 * (workflowId, periodStart, granularity); recomputing a period replaces it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public record WorkflowAnalyticsRollup(String workflowId, Instant periodStart, Instant periodEnd,
                                      RollupGranularity granularity, long totalExecutions,
                                      long successfulExecutions, long failedExecutions,
                                      long cancelledExecutions, Double averageDurationMs,
                                      Long minDurationMs, Long maxDurationMs, Long p95DurationMs,
                                      double errorRate, List<String> commonErrors, Instant computedAt) {

    public WorkflowAnalyticsRollup {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(periodStart, "periodStart");
        Objects.requireNonNull(granularity, "granularity");
        commonErrors = commonErrors == null ? List.of() : List.copyOf(commonErrors);
    }
}
