package dev.mars.autoflow.storage;

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

import java.time.Instant;
import java.util.List;

/**
 * Storage of precomputed analytics rollups.
 */
public interface AnalyticsRepository {

    /**
     * Inserts the rollup or replaces the one with the same workflow, period start and granularity.
     */
    WorkflowAnalyticsRollup upsertRollup(WorkflowAnalyticsRollup rollup);

    /**
     * Rollups whose period starts within [from, to), ordered by period start.
     */
    List<WorkflowAnalyticsRollup> findRollups(String workflowId, RollupGranularity granularity,
                                              Instant from, Instant to);
}
