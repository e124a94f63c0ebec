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

import dev.mars.autoflow.core.NodeExecutionStatus;
import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.workflow.analytics.ErrorNormalizer.ErrorCount;

import java.util.List;
import java.util.Map;

/**
 * Statistics of one node across the executions of a date range. The success rate is
 * completed over the executions in which the node settled as COMPLETED or FAILED.
 */
public record NodeAnalytics(String nodeId, NodeType nodeType, String name, long totalExecutions,
                            Map<NodeExecutionStatus, Long> statusCounts, double successRate,
                            DurationStats durations, List<ErrorCount> topErrors) {

    public long count(NodeExecutionStatus status) {
        return statusCounts.getOrDefault(status, 0L);
    }
}
