package dev.mars.autoflow.workflow.service;

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

import dev.mars.autoflow.core.ExecutionLogEntry;
import dev.mars.autoflow.core.ExecutionVariable;
import dev.mars.autoflow.core.NodeExecution;
import dev.mars.autoflow.core.WorkflowExecution;

import java.util.List;
import java.util.Optional;

/**
 * An execution with its node executions, variables and log, as returned to callers.
 */
public record ExecutionDetails(WorkflowExecution execution, List<NodeExecution> nodeExecutions,
                               List<ExecutionVariable> variables, List<ExecutionLogEntry> logs) {

    public ExecutionDetails {
        nodeExecutions = List.copyOf(nodeExecutions);
        variables = List.copyOf(variables);
        logs = List.copyOf(logs);
    }

    public Optional<NodeExecution> node(String nodeId) {
        return nodeExecutions.stream().filter(node -> node.getNodeId().equals(nodeId)).findFirst();
    }
}
