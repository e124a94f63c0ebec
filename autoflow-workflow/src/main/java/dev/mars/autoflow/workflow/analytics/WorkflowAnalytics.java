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

import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.workflow.analytics.ErrorNormalizer.ErrorCount;

import java.util.List;
import java.util.Map;

/**
 * Execution statistics of one workflow over a date range.
 *
 * @param statusCounts    executions per status, every status present
 * @param successRate     completed / total, in percent with 2 decimals
 * @param durations       aggregates over executions with a known duration
 * @param topErrors       most frequent normalized error messages of failed executions
 * @param trends          one point per bucket of the requested granularity, oldest first
 */
public record WorkflowAnalytics(String workflowId, String workflowName, DateRange range,
                                TrendGranularity granularity, long totalExecutions,
                                Map<ExecutionStatus, Long> statusCounts, double successRate,
                                DurationStats durations, List<ErrorCount> topErrors, List<TrendPoint> trends) {

    public long count(ExecutionStatus status) {
        return statusCounts.getOrDefault(status, 0L);
    }
}
