package dev.mars.autoflow.workflow.definition;

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

import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.Position;
import dev.mars.autoflow.core.ScheduleSpec;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.WorkflowTrigger;
import dev.mars.autoflow.core.condition.ConditionGroup;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A portable workflow: its graph and triggers without storage ids. Materialized into
 * nodes, connections and triggers of a concrete workflow on import.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-12
 * @version 1.0
 */
public record WorkflowDefinition(String name, String description, List<NodeDefinition> nodes,
                                 List<ConnectionDefinition> connections, List<TriggerDefinition> triggers) {

    public WorkflowDefinition {
        Objects.requireNonNull(name, "Workflow name cannot be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }

    public record NodeDefinition(String nodeId, NodeType type, String name, Position position,
                                 Map<String, Object> config, int executionOrder, boolean optional,
                                 int retryLimit, Duration timeout) {

        public WorkflowNode toNode(String id, String workflowId) {
            return new WorkflowNode(id, workflowId, nodeId, type, name, position, config,
                    executionOrder, optional, retryLimit, timeout);
        }
    }

    public record ConnectionDefinition(String edgeId, String source, String target, String sourceHandle,
                                       String targetHandle, String label, ConditionGroup conditions,
                                       int executionOrder) {

        public WorkflowConnection toConnection(String id, String workflowId) {
            return new WorkflowConnection(id, workflowId, edgeId, source, target, sourceHandle,
                    targetHandle, label, conditions, executionOrder);
        }
    }

    public record TriggerDefinition(TriggerType type, String nodeId, String module, String eventType,
                                    String entityType, ConditionGroup conditions, long delayMs,
                                    boolean active, ScheduleSpec schedule) {

        public WorkflowTrigger toTrigger(String id, String workflowId) {
            return new WorkflowTrigger(id, workflowId, nodeId, type, module, eventType, entityType,
                    conditions, delayMs, active, schedule, null, null);
        }
    }
}
