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

import dev.mars.autoflow.core.ExecutionLogEntry;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.ExecutionVariable;
import dev.mars.autoflow.core.NodeExecution;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.storage.ExecutionRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory {@link ExecutionRepository}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, NodeExecution> nodeExecutions = new ConcurrentHashMap<>();
    private final Map<String, Map<String, ExecutionVariable>> variables = new ConcurrentHashMap<>();
    private final Map<String, List<ExecutionLogEntry>> logs = new ConcurrentHashMap<>();

    @Override
    public WorkflowExecution save(WorkflowExecution execution) {
        Objects.requireNonNull(execution, "Execution cannot be null");
        executions.put(execution.getId(), execution);
        return execution;
    }

    @Override
    public Optional<WorkflowExecution> findById(String id) {
        return Optional.ofNullable(executions.get(id));
    }

    @Override
    public List<WorkflowExecution> findByWorkflow(String workflowId) {
        return executions.values().stream()
                .filter(execution -> execution.getWorkflowId().equals(workflowId))
                .sorted(Comparator.comparing(WorkflowExecution::getCreatedAt))
                .toList();
    }

    @Override
    public List<WorkflowExecution> findByWorkflowBetween(String workflowId, Instant from, Instant to) {
        return executions.values().stream()
                .filter(execution -> execution.getWorkflowId().equals(workflowId))
                .filter(execution -> !execution.getCreatedAt().isBefore(from) && execution.getCreatedAt().isBefore(to))
                .sorted(Comparator.comparing(WorkflowExecution::getCreatedAt))
                .toList();
    }

    @Override
    public List<WorkflowExecution> findByStatus(Set<ExecutionStatus> statuses) {
        return executions.values().stream()
                .filter(execution -> statuses.contains(execution.getStatus()))
                .sorted(Comparator.comparing(WorkflowExecution::getCreatedAt))
                .toList();
    }

    @Override
    public NodeExecution saveNodeExecution(NodeExecution nodeExecution) {
        nodeExecutions.put(nodeExecution.getId(), nodeExecution);
        return nodeExecution;
    }

    @Override
    public Optional<NodeExecution> findNodeExecution(String nodeExecutionId) {
        return Optional.ofNullable(nodeExecutions.get(nodeExecutionId));
    }

    @Override
    public List<NodeExecution> findNodeExecutions(String executionId) {
        return nodeExecutions.values().stream()
                .filter(nodeExecution -> nodeExecution.getExecutionId().equals(executionId))
                .sorted(Comparator.comparingInt(NodeExecution::getExecutionOrder)
                        .thenComparing(NodeExecution::getNodeId))
                .toList();
    }

    @Override
    public ExecutionVariable saveVariable(String executionId, ExecutionVariable variable) {
        variables.computeIfAbsent(executionId, id -> new ConcurrentHashMap<>()).put(variable.name(), variable);
        return variable;
    }

    @Override
    public Map<String, ExecutionVariable> findVariables(String executionId) {
        return new LinkedHashMap<>(variables.getOrDefault(executionId, Map.of()));
    }

    @Override
    public void appendLog(ExecutionLogEntry entry) {
        logs.computeIfAbsent(entry.executionId(), id -> new CopyOnWriteArrayList<>()).add(entry);
    }

    @Override
    public List<ExecutionLogEntry> findLogs(String executionId) {
        return List.copyOf(logs.getOrDefault(executionId, List.of()));
    }
}
