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

import java.util.Objects;

/**
 * A directed edge between two nodes of the same workflow, addressed by their graph
 * {@code nodeId}s. {@code sourceHandle} names the output port of the source node;
 * branching nodes use it to select which edges are followed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public record WorkflowConnection(String id, String workflowId, String edgeId, String sourceNodeId,
                                 String targetNodeId, String sourceHandle, String targetHandle,
                                 String label, ConditionGroup conditions, int executionOrder) {

    public WorkflowConnection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(edgeId, "edgeId");
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        conditions = conditions == null ? ConditionGroup.EMPTY : conditions;
    }

    public static WorkflowConnection between(String workflowId, String sourceNodeId, String targetNodeId,
                                             String sourceHandle) {
        String edgeId = sourceNodeId + "->" + targetNodeId + (sourceHandle == null ? "" : ":" + sourceHandle);
        return new WorkflowConnection(edgeId, workflowId, edgeId, sourceNodeId, targetNodeId,
                sourceHandle, null, null, null, 0);
    }

    public WorkflowConnection withId(String newId) {
        return new WorkflowConnection(newId, workflowId, edgeId, sourceNodeId, targetNodeId,
                sourceHandle, targetHandle, label, conditions, executionOrder);
    }

    public boolean hasHandle(String handle) {
        return sourceHandle != null && sourceHandle.equalsIgnoreCase(handle);
    }
}
