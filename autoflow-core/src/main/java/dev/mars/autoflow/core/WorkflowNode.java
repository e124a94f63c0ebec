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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed vertex of a workflow graph.
 *
 * <p>{@code nodeId} is the identifier used by the graph editor and by connections;
 * together with {@code workflowId} it is the natural key of the node.
 *
 * @param id             storage identifier
 * @param workflowId     owning workflow
 * @param nodeId         graph identifier, unique within the workflow
 * @param type           node type, selects the handler
 * @param name           display name
 * @param position       editor coordinates
 * @param config         raw type-specific configuration
 * @param executionOrder tie-breaker between nodes that become ready together
 * @param optional       a failure of this node does not fail the execution
 * @param retryLimit     additional attempts after the first failure
 * @param timeout        per-attempt timeout, null for the configured default
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public record WorkflowNode(String id, String workflowId, String nodeId, NodeType type, String name,
                           Position position, Map<String, Object> config, int executionOrder,
                           boolean optional, int retryLimit, Duration timeout) {

    public WorkflowNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(type, "type");
        position = position == null ? Position.ORIGIN : position;
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        if (retryLimit < 0) {
            throw new IllegalArgumentException("retryLimit cannot be negative");
        }
    }

    public WorkflowNode withId(String newId) {
        return new WorkflowNode(newId, workflowId, nodeId, type, name, position, config,
                executionOrder, optional, retryLimit, timeout);
    }

    public WorkflowNode withConfig(Map<String, Object> newConfig) {
        return new WorkflowNode(id, workflowId, nodeId, type, name, position, newConfig,
                executionOrder, optional, retryLimit, timeout);
    }

    public String displayName() {
        return name == null || name.isBlank() ? nodeId : name;
    }
}
