package dev.mars.autoflow.storage.memory;

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

import dev.mars.autoflow.core.RollupGranularity;
import dev.mars.autoflow.core.WorkflowAnalyticsRollup;
import dev.mars.autoflow.storage.AnalyticsRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAnalyticsRepository implements AnalyticsRepository {

    private final Map<String, WorkflowAnalyticsRollup> rollups = new ConcurrentHashMap<>();

    @Override
    public WorkflowAnalyticsRollup upsertRollup(WorkflowAnalyticsRollup rollup) {
        rollups.put(key(rollup.workflowId(), rollup.periodStart(), rollup.granularity()), rollup);
        return rollup;
    }

    @Override
    public List<WorkflowAnalyticsRollup> findRollups(String workflowId, RollupGranularity granularity,
                                                     Instant from, Instant to) {
        return rollups.values().stream()
                .filter(rollup -> rollup.workflowId().equals(workflowId))
                .filter(rollup -> rollup.granularity() == granularity)
                .filter(rollup -> !rollup.periodStart().isBefore(from) && rollup.periodStart().isBefore(to))
                .sorted(Comparator.comparing(WorkflowAnalyticsRollup::periodStart))
                .toList();
    }

    private static String key(String workflowId, Instant periodStart, RollupGranularity granularity) {
        return workflowId + '|' + periodStart.toEpochMilli() + '|' + granularity;
    }
}
