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

import dev.mars.autoflow.core.condition.ConditionGroup;

import java.time.Instant;
import java.util.Objects;

/**
 * Binds a workflow to the events or schedule that start it.
 *
 * <p>For EVENT triggers a null or blank {@code module}, {@code eventType} or
 * {@code entityType} matches any value. SCHEDULE triggers carry a {@link ScheduleSpec}
 * and the ticker's bookkeeping in {@code lastFiredAt}/{@code nextFireAt}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public record WorkflowTrigger(String id, String workflowId, String nodeId, TriggerType type,
                              String module, String eventType, String entityType,
                              ConditionGroup conditions, long delayMs, boolean active,
                              ScheduleSpec schedule, Instant lastFiredAt, Instant nextFireAt) {

    public WorkflowTrigger {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(type, "type");
        conditions = conditions == null ? ConditionGroup.EMPTY : conditions;
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative");
        }
        if (type == TriggerType.SCHEDULE && schedule == null) {
            throw new IllegalArgumentException("SCHEDULE trigger requires a schedule");
        }
    }

    public static WorkflowTrigger onEvent(String id, String workflowId, String module, String eventType,
                                          String entityType, ConditionGroup conditions) {
        return new WorkflowTrigger(id, workflowId, null, TriggerType.EVENT, module, eventType, entityType,
                conditions, 0, true, null, null, null);
    }

    public static WorkflowTrigger onSchedule(String id, String workflowId, ScheduleSpec schedule) {
        return new WorkflowTrigger(id, workflowId, null, TriggerType.SCHEDULE, null, null, null,
                null, 0, true, schedule, null, null);
    }

    public WorkflowTrigger withActive(boolean newActive) {
        return new WorkflowTrigger(id, workflowId, nodeId, type, module, eventType, entityType,
                conditions, delayMs, newActive, schedule, lastFiredAt, nextFireAt);
    }

    public WorkflowTrigger withDelayMs(long newDelayMs) {
        return new WorkflowTrigger(id, workflowId, nodeId, type, module, eventType, entityType,
                conditions, newDelayMs, active, schedule, lastFiredAt, nextFireAt);
    }

    public WorkflowTrigger withFiring(Instant firedAt, Instant next) {
        return new WorkflowTrigger(id, workflowId, nodeId, type, module, eventType, entityType,
                conditions, delayMs, active, schedule, firedAt, next);
    }
}
