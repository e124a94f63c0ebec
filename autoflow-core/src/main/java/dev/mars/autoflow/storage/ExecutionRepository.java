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

import dev.mars.autoflow.core.ExecutionLogEntry;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.ExecutionVariable;
import dev.mars.autoflow.core.NodeExecution;
import dev.mars.autoflow.core.WorkflowExecution;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage of executions and everything scoped to them: node executions,
 * variables and the execution log.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface ExecutionRepository {

    WorkflowExecution save(WorkflowExecution execution);

    Optional<WorkflowExecution> findById(String id);

    List<WorkflowExecution> findByWorkflow(String workflowId);

    /**
     * Executions of a workflow created within [from, to).
     */
    List<WorkflowExecution> findByWorkflowBetween(String workflowId, Instant from, Instant to);

    List<WorkflowExecution> findByStatus(Set<ExecutionStatus> statuses);

    NodeExecution saveNodeExecution(NodeExecution nodeExecution);

    Optional<NodeExecution> findNodeExecution(String nodeExecutionId);

    /**
     * @return node executions of the execution ordered by execution order, then node id
     */
    List<NodeExecution> findNodeExecutions(String executionId);

    ExecutionVariable saveVariable(String executionId, ExecutionVariable variable);

    Map<String, ExecutionVariable> findVariables(String executionId);

    void appendLog(ExecutionLogEntry entry);

    List<ExecutionLogEntry> findLogs(String executionId);
}
