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

import dev.mars.autoflow.core.GraphSnapshot;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.Workflow;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.WorkflowTrigger;
import dev.mars.autoflow.storage.WorkflowRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Thread-safe in-memory {@link WorkflowRepository}. Nodes and connections are held
 * per workflow; every change to a workflow's graph, and every whole-graph read, holds
 * that workflow's graph lock.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private static final Comparator<WorkflowNode> NODE_ORDER =
            Comparator.comparingInt(WorkflowNode::executionOrder).thenComparing(WorkflowNode::nodeId);

    private static final Comparator<WorkflowConnection> CONNECTION_ORDER =
            Comparator.comparingInt(WorkflowConnection::executionOrder).thenComparing(WorkflowConnection::edgeId);

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();
    private final Map<String, Map<String, WorkflowNode>> nodes = new ConcurrentHashMap<>();
    private final Map<String, Map<String, WorkflowConnection>> connections = new ConcurrentHashMap<>();
    private final Map<String, WorkflowTrigger> triggers = new ConcurrentHashMap<>();
    private final Map<String, Object> graphLocks = new ConcurrentHashMap<>();

    @Override
    public Workflow saveWorkflow(Workflow workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        workflows.put(workflow.getId(), workflow);
        return workflow;
    }

    @Override
    public Optional<Workflow> findWorkflow(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public List<Workflow> findWorkflowsByOrganization(String organizationId) {
        return workflows.values().stream()
                .filter(workflow -> workflow.getOrganizationId().equals(organizationId))
                .sorted(Comparator.comparing(Workflow::getCreatedAt))
                .toList();
    }

    @Override
    public Optional<Workflow> updateWorkflow(String workflowId, UnaryOperator<Workflow> update) {
        return Optional.ofNullable(workflows.computeIfPresent(workflowId, (id, current) -> update.apply(current)));
    }

    @Override
    public WorkflowNode saveNode(WorkflowNode node) {
        synchronized (graphLock(node.workflowId())) {
            nodesOf(node.workflowId()).put(node.nodeId(), node);
        }
        return node;
    }

    @Override
    public Optional<WorkflowNode> findNode(String workflowId, String nodeId) {
        return Optional.ofNullable(nodesOf(workflowId).get(nodeId));
    }

    @Override
    public List<WorkflowNode> findNodes(String workflowId) {
        return nodesOf(workflowId).values().stream().sorted(NODE_ORDER).toList();
    }

    @Override
    public boolean deleteNode(String workflowId, String nodeId) {
        synchronized (graphLock(workflowId)) {
            if (nodesOf(workflowId).remove(nodeId) == null) {
                return false;
            }
            connectionsOf(workflowId).values().removeIf(connection ->
                    connection.sourceNodeId().equals(nodeId) || connection.targetNodeId().equals(nodeId));
            return true;
        }
    }

    @Override
    public void replaceNodes(String workflowId, List<WorkflowNode> replacement) {
        synchronized (graphLock(workflowId)) {
            nodes.put(workflowId, indexNodes(replacement));
        }
    }

    @Override
    public WorkflowConnection saveConnection(WorkflowConnection connection) {
        synchronized (graphLock(connection.workflowId())) {
            connectionsOf(connection.workflowId()).put(connection.edgeId(), connection);
        }
        return connection;
    }

    @Override
    public Optional<WorkflowConnection> findConnection(String workflowId, String edgeId) {
        return Optional.ofNullable(connectionsOf(workflowId).get(edgeId));
    }

    @Override
    public List<WorkflowConnection> findConnections(String workflowId) {
        return connectionsOf(workflowId).values().stream().sorted(CONNECTION_ORDER).toList();
    }

    @Override
    public boolean deleteConnection(String workflowId, String edgeId) {
        synchronized (graphLock(workflowId)) {
            return connectionsOf(workflowId).remove(edgeId) != null;
        }
    }

    @Override
    public void replaceConnections(String workflowId, List<WorkflowConnection> replacement) {
        synchronized (graphLock(workflowId)) {
            connections.put(workflowId, indexConnections(replacement));
        }
    }

    @Override
    public void replaceGraph(String workflowId, GraphSnapshot graph) {
        Map<String, WorkflowNode> byNodeId = indexNodes(graph.nodes());
        Map<String, WorkflowConnection> byEdgeId = indexConnections(graph.connections());
        synchronized (graphLock(workflowId)) {
            nodes.put(workflowId, byNodeId);
            connections.put(workflowId, byEdgeId);
        }
    }

    @Override
    public GraphSnapshot findGraph(String workflowId) {
        synchronized (graphLock(workflowId)) {
            return new GraphSnapshot(findNodes(workflowId), findConnections(workflowId));
        }
    }

    @Override
    public WorkflowTrigger saveTrigger(WorkflowTrigger trigger) {
        triggers.put(trigger.id(), trigger);
        return trigger;
    }

    @Override
    public Optional<WorkflowTrigger> findTrigger(String triggerId) {
        return Optional.ofNullable(triggers.get(triggerId));
    }

    @Override
    public List<WorkflowTrigger> findTriggers(String workflowId) {
        return triggers.values().stream()
                .filter(trigger -> trigger.workflowId().equals(workflowId))
                .sorted(Comparator.comparing(WorkflowTrigger::id))
                .toList();
    }

    @Override
    public List<WorkflowTrigger> findActiveTriggers(TriggerType type) {
        List<WorkflowTrigger> active = new ArrayList<>();
        for (WorkflowTrigger trigger : triggers.values()) {
            if (trigger.active() && trigger.type() == type) {
                active.add(trigger);
            }
        }
        active.sort(Comparator.comparing(WorkflowTrigger::id));
        return active;
    }

    @Override
    public boolean deleteTrigger(String triggerId) {
        return triggers.remove(triggerId) != null;
    }

    private Object graphLock(String workflowId) {
        return graphLocks.computeIfAbsent(workflowId, id -> new Object());
    }

    private static Map<String, WorkflowNode> indexNodes(List<WorkflowNode> replacement) {
        Map<String, WorkflowNode> byNodeId = new ConcurrentHashMap<>();
        for (WorkflowNode node : replacement) {
            byNodeId.put(node.nodeId(), node);
        }
        return byNodeId;
    }

    private static Map<String, WorkflowConnection> indexConnections(List<WorkflowConnection> replacement) {
        Map<String, WorkflowConnection> byEdgeId = new ConcurrentHashMap<>();
        for (WorkflowConnection connection : replacement) {
            byEdgeId.put(connection.edgeId(), connection);
        }
        return byEdgeId;
    }

    private Map<String, WorkflowNode> nodesOf(String workflowId) {
        return nodes.computeIfAbsent(workflowId, id -> new ConcurrentHashMap<>());
    }

    private Map<String, WorkflowConnection> connectionsOf(String workflowId) {
        return connections.computeIfAbsent(workflowId, id -> new ConcurrentHashMap<>());
    }
}
