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

import dev.mars.autoflow.core.BulkExecutionAction;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.GraphSnapshot;
import dev.mars.autoflow.core.RollupGranularity;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.Workflow;
import dev.mars.autoflow.core.WorkflowAnalyticsRollup;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.WorkflowStatus;
import dev.mars.autoflow.core.WorkflowTrigger;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.ConflictException;
import dev.mars.autoflow.core.exceptions.NotFoundException;
import dev.mars.autoflow.core.exceptions.ValidationException;
import dev.mars.autoflow.storage.ExecutionRepository;
import dev.mars.autoflow.storage.WorkflowRepository;
import dev.mars.autoflow.tenant.model.AccessContext;
import dev.mars.autoflow.tenant.service.PermissionChecker;
import dev.mars.autoflow.workflow.analytics.DateRange;
import dev.mars.autoflow.workflow.analytics.NodeAnalytics;
import dev.mars.autoflow.workflow.analytics.TrendGranularity;
import dev.mars.autoflow.workflow.analytics.WorkflowAnalytics;
import dev.mars.autoflow.workflow.analytics.WorkflowAnalyticsService;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.ConnectionDefinition;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.NodeDefinition;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.TriggerDefinition;
import dev.mars.autoflow.workflow.definition.YamlWorkflowDefinitionParser;
import dev.mars.autoflow.workflow.execution.BulkActionResult;
import dev.mars.autoflow.workflow.execution.ExecutionOrchestrator;
import dev.mars.autoflow.workflow.execution.ExecutionRequest;
import dev.mars.autoflow.workflow.execution.VariableInput;
import dev.mars.autoflow.workflow.schedule.ScheduleCalculator;
import dev.mars.autoflow.workflow.validation.NodeConfigValidator;
import dev.mars.autoflow.workflow.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Tenant-scoped entry point for managing workflows and their executions.
 *
 * <p>Every operation resolves the caller's role in the organization that owns the
 * workflow or execution. Resources of another organization are reported as not found.
 * Reads need membership; changes need a role that may manage workflows.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-12
 * @version 1.0
 */
public class WorkflowAutomationService {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowAutomationService.class);

    private final WorkflowRepository workflows;
    private final ExecutionRepository executions;
    private final ExecutionOrchestrator orchestrator;
    private final WorkflowAnalyticsService analytics;
    private final NodeConfigValidator validator;
    private final PermissionChecker permissions;
    private final YamlWorkflowDefinitionParser definitionParser = new YamlWorkflowDefinitionParser();
    private final Clock clock;

    public WorkflowAutomationService(WorkflowRepository workflows, ExecutionRepository executions,
                                     ExecutionOrchestrator orchestrator, WorkflowAnalyticsService analytics,
                                     NodeConfigValidator validator, PermissionChecker permissions, Clock clock) {
        this.workflows = Objects.requireNonNull(workflows, "Workflow repository cannot be null");
        this.executions = Objects.requireNonNull(executions, "Execution repository cannot be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "Orchestrator cannot be null");
        this.analytics = Objects.requireNonNull(analytics, "Analytics service cannot be null");
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
        this.permissions = Objects.requireNonNull(permissions, "Permission checker cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    // ---------------------------------------------------------------- workflows

    public Workflow createWorkflow(AccessContext ctx, String name, String description) throws AutoflowException {
        permissions.requireManagePermission(ctx, ctx.organizationId());
        if (name == null || name.isBlank()) {
            throw new ValidationException("Workflow name is required");
        }
        Instant now = clock.instant();
        Workflow workflow = workflows.saveWorkflow(Workflow.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(ctx.organizationId())
                .name(name.trim())
                .description(description)
                .status(WorkflowStatus.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build());
        logger.info("Created workflow {} '{}' for organization {}", workflow.getId(), workflow.getName(),
                ctx.organizationId());
        return workflow;
    }

    public Workflow getWorkflow(AccessContext ctx, String workflowId) throws AutoflowException {
        return readableWorkflow(ctx, workflowId);
    }

    /**
     * Validates the workflow's graph and node configuration and makes it accept executions.
     *
     * @throws ValidationException listing every problem if the workflow is invalid
     */
    public Workflow activateWorkflow(AccessContext ctx, String workflowId) throws AutoflowException {
        Workflow workflow = manageableWorkflow(ctx, workflowId);
        GraphSnapshot graph = workflows.findGraph(workflowId);
        if (graph.nodes().isEmpty()) {
            throw new ValidationException("Workflow '" + workflowId + "' has no nodes");
        }
        validator.requireValid(graph.nodes(), graph.connections());
        return setStatus(workflow, WorkflowStatus.ACTIVE);
    }

    public Workflow updateWorkflowStatus(AccessContext ctx, String workflowId, WorkflowStatus status)
            throws AutoflowException {
        if (status == WorkflowStatus.ACTIVE) {
            return activateWorkflow(ctx, workflowId);
        }
        return setStatus(manageableWorkflow(ctx, workflowId), status);
    }

    private Workflow setStatus(Workflow workflow, WorkflowStatus status) throws NotFoundException {
        Instant now = clock.instant();
        Workflow updated = workflows.updateWorkflow(workflow.getId(),
                        current -> current.toBuilder().status(status).updatedAt(now).build())
                .orElseThrow(() -> new NotFoundException("Workflow", workflow.getId()));
        logger.info("Workflow {} is now {}", workflow.getId(), status);
        return updated;
    }

    /**
     * Recounts the workflow's execution counters from its stored executions.
     */
    public Workflow recomputeCounters(AccessContext ctx, String workflowId) throws AutoflowException {
        manageableWorkflow(ctx, workflowId);
        List<WorkflowExecution> history = executions.findByWorkflow(workflowId);
        long successful = history.stream().filter(e -> e.getStatus() == ExecutionStatus.COMPLETED).count();
        long failed = history.stream().filter(e -> e.getStatus() == ExecutionStatus.FAILED).count();
        Instant lastExecutedAt = history.stream()
                .map(WorkflowExecution::getCreatedAt)
                .max(Instant::compareTo)
                .orElse(null);
        return workflows.updateWorkflow(workflowId, current -> current.toBuilder()
                        .totalExecutions(history.size())
                        .successfulExecutions(successful)
                        .failedExecutions(failed)
                        .lastExecutedAt(lastExecutedAt)
                        .build())
                .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    /**
     * Creates a DRAFT workflow from a YAML definition. Nothing is stored unless the whole
     * definition is valid.
     */
    public Workflow importWorkflow(AccessContext ctx, String yaml) throws AutoflowException {
        permissions.requireManagePermission(ctx, ctx.organizationId());
        WorkflowDefinition definition = definitionParser.parseFromString(yaml);

        String workflowId = UUID.randomUUID().toString();
        List<WorkflowNode> nodes = materializeNodes(workflowId, definition.nodes(), Map.of());
        List<WorkflowConnection> connections = materializeConnections(workflowId, definition.connections(), nodes, Map.of());
        validator.requireValid(nodes, connections);
        List<WorkflowTrigger> triggers = new ArrayList<>();
        for (int i = 0; i < definition.triggers().size(); i++) {
            triggers.add(prepareTrigger(workflowId, definition.triggers().get(i), nodes, "triggers[" + i + "]"));
        }

        Instant now = clock.instant();
        Workflow workflow = workflows.saveWorkflow(Workflow.builder()
                .id(workflowId)
                .organizationId(ctx.organizationId())
                .name(definition.name())
                .description(definition.description())
                .status(WorkflowStatus.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build());
        workflows.replaceGraph(workflowId, new GraphSnapshot(nodes, connections));
        triggers.forEach(workflows::saveTrigger);
        logger.info("Imported workflow {} '{}' with {} nodes, {} connections and {} triggers",
                workflowId, definition.name(), nodes.size(), connections.size(), triggers.size());
        return workflow;
    }

    // ---------------------------------------------------------------- nodes

    public List<WorkflowNode> getNodes(AccessContext ctx, String workflowId) throws AutoflowException {
        readableWorkflow(ctx, workflowId);
        return workflows.findNodes(workflowId);
    }

    /**
     * @throws ConflictException   if the workflow already has a node with the same node id
     * @throws ValidationException if the node configuration is invalid
     */
    public WorkflowNode createNode(AccessContext ctx, String workflowId, NodeDefinition definition)
            throws AutoflowException {
        editableWorkflow(ctx, workflowId);
        if (workflows.findNode(workflowId, definition.nodeId()).isPresent()) {
            throw new ConflictException(String.format("Node '%s' already exists in workflow '%s'",
                    definition.nodeId(), workflowId));
        }
        WorkflowNode node = prepareNode(workflowId, UUID.randomUUID().toString(), definition);
        return workflows.saveNode(node);
    }

    public WorkflowNode updateNode(AccessContext ctx, String workflowId, NodeDefinition definition)
            throws AutoflowException {
        editableWorkflow(ctx, workflowId);
        WorkflowNode existing = workflows.findNode(workflowId, definition.nodeId())
                .orElseThrow(() -> new NotFoundException("Node", definition.nodeId()));
        return workflows.saveNode(prepareNode(workflowId, existing.id(), definition));
    }

    /**
     * Deletes the node and every connection attached to it.
     */
    public void deleteNode(AccessContext ctx, String workflowId, String nodeId) throws AutoflowException {
        editableWorkflow(ctx, workflowId);
        if (!workflows.deleteNode(workflowId, nodeId)) {
            throw new NotFoundException("Node", nodeId);
        }
    }

    /**
     * Replaces all nodes of the workflow. Nodes are matched to existing ones by node id
     * and keep their storage ids; connections to nodes no longer present are removed.
     *
     * @throws ConflictException if the same node id appears twice
     */
    public List<WorkflowNode> syncNodes(AccessContext ctx, String workflowId, List<NodeDefinition> definitions)
            throws AutoflowException {
        editableWorkflow(ctx, workflowId);
        Map<String, String> existingIds = new LinkedHashMap<>();
        for (WorkflowNode node : workflows.findNodes(workflowId)) {
            existingIds.put(node.nodeId(), node.id());
        }
        List<WorkflowNode> nodes = materializeNodes(workflowId, definitions, existingIds);

        Set<String> present = new HashSet<>();
        nodes.forEach(node -> present.add(node.nodeId()));
        List<WorkflowConnection> kept = new ArrayList<>();
        for (WorkflowConnection connection : workflows.findConnections(workflowId)) {
            if (present.contains(connection.sourceNodeId()) && present.contains(connection.targetNodeId())) {
                kept.add(connection);
            }
        }
        workflows.replaceGraph(workflowId, new GraphSnapshot(nodes, kept));
        logger.debug("Synced {} nodes of workflow {}", nodes.size(), workflowId);
        return workflows.findNodes(workflowId);
    }

    // ---------------------------------------------------------------- connections

    public List<WorkflowConnection> getConnections(AccessContext ctx, String workflowId) throws AutoflowException {
        readableWorkflow(ctx, workflowId);
        return workflows.findConnections(workflowId);
    }

    public WorkflowConnection createConnection(AccessContext ctx, String workflowId, ConnectionDefinition definition)
            throws AutoflowException {
        editableWorkflow(ctx, workflowId);
        if (workflows.findConnection(workflowId, definition.edgeId()).isPresent()) {
            throw new ConflictException(String.format("Connection '%s' already exists in workflow '%s'",
                    definition.edgeId(), workflowId));
        }
        List<WorkflowNode> nodes = workflows.findNodes(workflowId);
        WorkflowConnection connection = materializeConnections(workflowId, List.of(definition), nodes, Map.of()).get(0);
        return workflows.saveConnection(connection);
    }

    public void deleteConnection(AccessContext ctx, String workflowId, String edgeId) throws AutoflowException {
        editableWorkflow(ctx, workflowId);
        if (!workflows.deleteConnection(workflowId, edgeId)) {
            throw new NotFoundException("Connection", edgeId);
        }
    }

    /**
     * Replaces all connections of the workflow, matched to existing ones by edge id.
     *
     * @throws ConflictException   if the same edge id appears twice
     * @throws ValidationException if a connection references a node the workflow does not have
     */
    public List<WorkflowConnection> syncConnections(AccessContext ctx, String workflowId,
                                                    List<ConnectionDefinition> definitions) throws AutoflowException {
        editableWorkflow(ctx, workflowId);
        Map<String, String> existingIds = new LinkedHashMap<>();
        for (WorkflowConnection connection : workflows.findConnections(workflowId)) {
            existingIds.put(connection.edgeId(), connection.id());
        }
        List<WorkflowConnection> connections = materializeConnections(workflowId, definitions,
                workflows.findNodes(workflowId), existingIds);
        workflows.replaceConnections(workflowId, connections);
        logger.debug("Synced {} connections of workflow {}", connections.size(), workflowId);
        return workflows.findConnections(workflowId);
    }

    // ---------------------------------------------------------------- triggers

    public List<WorkflowTrigger> getTriggers(AccessContext ctx, String workflowId) throws AutoflowException {
        readableWorkflow(ctx, workflowId);
        return workflows.findTriggers(workflowId);
    }

    public WorkflowTrigger createTrigger(AccessContext ctx, String workflowId, TriggerDefinition definition)
            throws AutoflowException {
        manageableWorkflow(ctx, workflowId);
        WorkflowTrigger trigger = prepareTrigger(workflowId, definition, workflows.findNodes(workflowId), "trigger");
        return workflows.saveTrigger(trigger);
    }

    public WorkflowTrigger toggleTrigger(AccessContext ctx, String triggerId, boolean active) throws AutoflowException {
        WorkflowTrigger trigger = workflows.findTrigger(triggerId)
                .orElseThrow(() -> new NotFoundException("Trigger", triggerId));
        manageableWorkflow(ctx, trigger.workflowId());
        WorkflowTrigger updated = trigger.withActive(active);
        if (active && trigger.type() == TriggerType.SCHEDULE) {
            updated = updated.withFiring(trigger.lastFiredAt(),
                    ScheduleCalculator.nextFireTime(trigger.schedule(), clock.instant()).orElse(null));
        }
        logger.info("Trigger {} {}", triggerId, active ? "enabled" : "disabled");
        return workflows.saveTrigger(updated);
    }

    // ---------------------------------------------------------------- executions

    /**
     * Queues an execution of the workflow.
     *
     * @param triggerId   optional trigger to attribute the execution to; must belong to the workflow
     * @param triggerData bound as the {@code trigger} variable and as one variable per top-level field
     * @param variables   caller variables, bound with source {@code input}
     */
    public TriggeredExecution triggerExecution(AccessContext ctx, String workflowId, String triggerId,
                                               Map<String, Object> triggerData, List<VariableInput> variables)
            throws AutoflowException {
        manageableWorkflow(ctx, workflowId);
        if (triggerId != null) {
            Optional<WorkflowTrigger> trigger = workflows.findTrigger(triggerId);
            if (trigger.isEmpty() || !trigger.get().workflowId().equals(workflowId)) {
                throw new NotFoundException("Trigger", triggerId);
            }
        }
        WorkflowExecution execution = orchestrator.start(ExecutionRequest.builder(workflowId)
                .triggerId(triggerId)
                .triggerData(triggerData)
                .variables(variables)
                .build());
        return TriggeredExecution.of(execution);
    }

    public ExecutionDetails getExecution(AccessContext ctx, String executionId) throws AutoflowException {
        WorkflowExecution execution = ownedExecution(ctx, executionId, false);
        return new ExecutionDetails(execution,
                executions.findNodeExecutions(executionId),
                new ArrayList<>(executions.findVariables(executionId).values()),
                executions.findLogs(executionId));
    }

    public List<WorkflowExecution> getExecutions(AccessContext ctx, String workflowId) throws AutoflowException {
        readableWorkflow(ctx, workflowId);
        return executions.findByWorkflow(workflowId);
    }

    public WorkflowExecution cancelExecution(AccessContext ctx, String executionId) throws AutoflowException {
        ownedExecution(ctx, executionId, true);
        return orchestrator.cancel(executionId);
    }

    public WorkflowExecution retryExecution(AccessContext ctx, String executionId) throws AutoflowException {
        ownedExecution(ctx, executionId, true);
        return orchestrator.retry(executionId);
    }

    public WorkflowExecution pauseExecution(AccessContext ctx, String executionId) throws AutoflowException {
        ownedExecution(ctx, executionId, true);
        return orchestrator.pause(executionId);
    }

    public WorkflowExecution resumeExecution(AccessContext ctx, String executionId) throws AutoflowException {
        ownedExecution(ctx, executionId, true);
        return orchestrator.resume(executionId);
    }

    /**
     * Cancels, pauses or resumes each execution on its own. Executions the caller cannot
     * see are reported as not found rather than failing the whole request.
     */
    public List<BulkActionResult> bulkUpdateExecutions(AccessContext ctx, Collection<String> executionIds,
                                                       BulkExecutionAction action) throws AutoflowException {
        permissions.requireManagePermission(ctx, ctx.organizationId());
        List<String> owned = new ArrayList<>();
        List<BulkActionResult> rejected = new ArrayList<>();
        for (String executionId : executionIds) {
            Optional<WorkflowExecution> execution = executions.findById(executionId);
            if (execution.isPresent() && execution.get().getOrganizationId().equals(ctx.organizationId())) {
                owned.add(executionId);
            } else {
                rejected.add(BulkActionResult.rejected(executionId, action, null, "Execution not found"));
            }
        }
        List<BulkActionResult> results = new ArrayList<>(orchestrator.bulkUpdate(owned, action));
        results.addAll(rejected);
        return results;
    }

    // ---------------------------------------------------------------- analytics

    public WorkflowAnalytics getWorkflowAnalytics(AccessContext ctx, String workflowId, DateRange range,
                                                  TrendGranularity granularity) throws AutoflowException {
        readableWorkflow(ctx, workflowId);
        return analytics.getWorkflowAnalytics(workflowId, range, granularity);
    }

    public List<NodeAnalytics> getNodeAnalytics(AccessContext ctx, String workflowId, DateRange range)
            throws AutoflowException {
        readableWorkflow(ctx, workflowId);
        return analytics.getNodeAnalytics(workflowId, range);
    }

    /**
     * Recomputes and stores the rollups of every period overlapping the range
     * (the configured default range when null).
     */
    public List<WorkflowAnalyticsRollup> rollupAnalytics(AccessContext ctx, String workflowId,
                                                         RollupGranularity granularity, DateRange range)
            throws AutoflowException {
        manageableWorkflow(ctx, workflowId);
        return analytics.rollupRange(workflowId, granularity, range != null ? range : analytics.defaultRange());
    }

    public List<WorkflowAnalyticsRollup> getStoredAnalytics(AccessContext ctx, String workflowId,
                                                            RollupGranularity granularity, DateRange range)
            throws AutoflowException {
        readableWorkflow(ctx, workflowId);
        return analytics.getStoredAnalytics(workflowId, granularity, range);
    }

    // ---------------------------------------------------------------- access

    private Workflow readableWorkflow(AccessContext ctx, String workflowId) throws AutoflowException {
        Workflow workflow = ownedWorkflow(ctx, workflowId);
        permissions.requirePermission(ctx, workflow.getOrganizationId());
        return workflow;
    }

    private Workflow manageableWorkflow(AccessContext ctx, String workflowId) throws AutoflowException {
        Workflow workflow = ownedWorkflow(ctx, workflowId);
        permissions.requireManagePermission(ctx, workflow.getOrganizationId());
        return workflow;
    }

    private Workflow editableWorkflow(AccessContext ctx, String workflowId) throws AutoflowException {
        Workflow workflow = manageableWorkflow(ctx, workflowId);
        if (!workflow.getStatus().isEditable()) {
            throw new ValidationException("Workflow '" + workflowId + "' is " + workflow.getStatus()
                    + " and cannot be edited");
        }
        return workflow;
    }

    private Workflow ownedWorkflow(AccessContext ctx, String workflowId) throws NotFoundException {
        Workflow workflow = workflows.findWorkflow(workflowId)
                .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        if (!workflow.getOrganizationId().equals(ctx.organizationId())) {
            throw new NotFoundException("Workflow", workflowId);
        }
        return workflow;
    }

    private WorkflowExecution ownedExecution(AccessContext ctx, String executionId, boolean manage)
            throws AutoflowException {
        WorkflowExecution execution = executions.findById(executionId)
                .orElseThrow(() -> new NotFoundException("Execution", executionId));
        if (!execution.getOrganizationId().equals(ctx.organizationId())) {
            throw new NotFoundException("Execution", executionId);
        }
        if (manage) {
            permissions.requireManagePermission(ctx, execution.getOrganizationId());
        } else {
            permissions.requirePermission(ctx, execution.getOrganizationId());
        }
        return execution;
    }

    // ---------------------------------------------------------------- materializing

    private WorkflowNode prepareNode(String workflowId, String id, NodeDefinition definition)
            throws ValidationException {
        WorkflowNode node = definition.toNode(id, workflowId).withConfig(ConfigSanitizer.sanitize(definition.config()));
        validator.validateNode(node).throwIfInvalid("Invalid configuration for node '" + node.nodeId() + "'");
        return node;
    }

    private List<WorkflowNode> materializeNodes(String workflowId, List<NodeDefinition> definitions,
                                                Map<String, String> existingIds) throws AutoflowException {
        Set<String> seen = new HashSet<>();
        List<WorkflowNode> nodes = new ArrayList<>();
        for (NodeDefinition definition : definitions) {
            if (!seen.add(definition.nodeId())) {
                throw new ConflictException("Duplicate node id '" + definition.nodeId() + "'");
            }
            String id = existingIds.getOrDefault(definition.nodeId(), UUID.randomUUID().toString());
            nodes.add(prepareNode(workflowId, id, definition));
        }
        return nodes;
    }

    private List<WorkflowConnection> materializeConnections(String workflowId, List<ConnectionDefinition> definitions,
                                                            List<WorkflowNode> nodes, Map<String, String> existingIds)
            throws AutoflowException {
        Set<String> nodeIds = new HashSet<>();
        nodes.forEach(node -> nodeIds.add(node.nodeId()));
        Set<String> seen = new HashSet<>();
        ValidationResult result = new ValidationResult();
        List<WorkflowConnection> connections = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            ConnectionDefinition definition = definitions.get(i);
            if (!seen.add(definition.edgeId())) {
                throw new ConflictException("Duplicate edge id '" + definition.edgeId() + "'");
            }
            String path = "connections[" + definition.edgeId() + "]";
            if (!nodeIds.contains(definition.source())) {
                result.addError(path, "unknown source node '" + definition.source() + "'");
            }
            if (!nodeIds.contains(definition.target())) {
                result.addError(path, "unknown target node '" + definition.target() + "'");
            }
            String id = existingIds.getOrDefault(definition.edgeId(), UUID.randomUUID().toString());
            connections.add(definition.toConnection(id, workflowId));
        }
        result.throwIfInvalid("Invalid connections");
        return connections;
    }

    private WorkflowTrigger prepareTrigger(String workflowId, TriggerDefinition definition, List<WorkflowNode> nodes,
                                           String path) throws ValidationException {
        ValidationResult result = new ValidationResult();
        if (definition.type() == null) {
            result.addError(path + ".type", "is required");
        }
        if (definition.type() == TriggerType.EVENT && (definition.eventType() == null || definition.eventType().isBlank())) {
            result.addError(path + ".eventType", "is required for event triggers");
        }
        if (definition.type() == TriggerType.SCHEDULE) {
            if (definition.schedule() == null) {
                result.addError(path + ".schedule", "is required for schedule triggers");
            } else {
                ScheduleCalculator.validate(definition.schedule(), result);
            }
        }
        if (definition.delayMs() < 0) {
            result.addError(path + ".delayMs", "cannot be negative");
        }
        if (definition.nodeId() != null && nodes.stream().noneMatch(node -> node.nodeId().equals(definition.nodeId()))) {
            result.addError(path + ".nodeId", "unknown node '" + definition.nodeId() + "'");
        }
        result.throwIfInvalid("Invalid trigger");

        WorkflowTrigger trigger = definition.toTrigger(UUID.randomUUID().toString(), workflowId);
        if (trigger.type() == TriggerType.SCHEDULE && trigger.active()) {
            trigger = trigger.withFiring(null,
                    ScheduleCalculator.nextFireTime(trigger.schedule(), clock.instant()).orElse(null));
        }
        return trigger;
    }
}
