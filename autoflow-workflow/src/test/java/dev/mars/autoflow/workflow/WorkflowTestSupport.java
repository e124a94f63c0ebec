package dev.mars.autoflow.workflow;

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

import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.NodeExecution;
import dev.mars.autoflow.core.NodeExecutionStatus;
import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.condition.ConditionGroup;
import dev.mars.autoflow.storage.memory.InMemoryDeliveryLedger;
import dev.mars.autoflow.storage.memory.InMemoryExecutionRepository;
import dev.mars.autoflow.workflow.action.DeliveryAdapter;
import dev.mars.autoflow.workflow.action.InMemoryTemplateResolver;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeHandlerRegistry;
import dev.mars.autoflow.workflow.node.handlers.ActionNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.ConditionNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.DelayNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.FilterNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.LoopNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.QueryNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.ScheduleNodeHandler;
import dev.mars.autoflow.workflow.query.InMemoryRecordQueryService;
import dev.mars.autoflow.workflow.variable.ExecutionVariables;
import dev.mars.autoflow.workflow.variable.VariableScope;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Builders for graph fixtures shared by the workflow tests.
 */
public final class WorkflowTestSupport {

    public static final String WORKFLOW_ID = "wf-1";
    public static final String EXECUTION_ID = "exec-1";
    public static final String ORGANIZATION_ID = "org-1";
    public static final Instant NOW = Instant.parse("2025-11-10T09:00:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private WorkflowTestSupport() {
    }

    /**
     * A registry with every built-in handler backed by in-memory collaborators.
     */
    public static NodeHandlerRegistry registry(DeliveryAdapter... adapters) {
        return new NodeHandlerRegistry(List.of(
                new ActionNodeHandler(new InMemoryTemplateResolver(), new InMemoryDeliveryLedger(), List.of(adapters)),
                new QueryNodeHandler(new InMemoryRecordQueryService()),
                new LoopNodeHandler(4),
                new FilterNodeHandler(),
                new ConditionNodeHandler(),
                new DelayNodeHandler(),
                new ScheduleNodeHandler()));
    }

    public static WorkflowNode node(String nodeId, NodeType type, Map<String, Object> config) {
        return new WorkflowNode("id-" + nodeId, WORKFLOW_ID, nodeId, type, nodeId, null, config, 0, false, 0, null);
    }

    public static WorkflowNode trigger(String nodeId) {
        return node(nodeId, NodeType.TRIGGER, Map.of());
    }

    public static WorkflowNode delay(String nodeId, long delayMs) {
        return node(nodeId, NodeType.DELAY, Map.of("delayMs", delayMs));
    }

    public static WorkflowConnection edge(String source, String target) {
        return WorkflowConnection.between(WORKFLOW_ID, source, target, null);
    }

    public static WorkflowConnection edge(String source, String target, String handle) {
        return WorkflowConnection.between(WORKFLOW_ID, source, target, handle);
    }

    public static WorkflowConnection conditionalEdge(String source, String target, ConditionGroup conditions) {
        String edgeId = source + "->" + target;
        return new WorkflowConnection(edgeId, WORKFLOW_ID, edgeId, source, target, null, null, null, conditions, 0);
    }

    /**
     * Variables of a fresh execution, stored in memory.
     */
    public static VariableScope variables(Map<String, Object> initial) {
        VariableScope variables = new ExecutionVariables(EXECUTION_ID, new InMemoryExecutionRepository(), FIXED_CLOCK);
        initial.forEach((name, value) -> variables.set(name, value, "test"));
        return variables;
    }

    /**
     * A context for invoking a handler directly, outside the orchestrator.
     */
    public static NodeContext.Builder contextFor(WorkflowNode node, VariableScope variables,
                                                 List<WorkflowConnection> outgoing) {
        WorkflowExecution execution = WorkflowExecution.builder()
                .id(EXECUTION_ID)
                .workflowId(WORKFLOW_ID)
                .organizationId(ORGANIZATION_ID)
                .status(ExecutionStatus.RUNNING)
                .createdAt(NOW)
                .build();
        NodeExecution nodeExecution = NodeExecution.builder()
                .id("nx-" + node.nodeId())
                .executionId(EXECUTION_ID)
                .nodeId(node.nodeId())
                .nodeType(node.type())
                .status(NodeExecutionStatus.RUNNING)
                .build();
        return NodeContext.builder()
                .execution(execution)
                .nodeExecution(nodeExecution)
                .node(node)
                .variables(variables)
                .outgoing(outgoing)
                .clock(FIXED_CLOCK);
    }
}
