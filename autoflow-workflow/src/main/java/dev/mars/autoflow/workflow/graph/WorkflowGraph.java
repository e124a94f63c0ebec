package dev.mars.autoflow.workflow.graph;

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
import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.exceptions.ValidationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Immutable directed acyclic view over a workflow's nodes and connections.
 *
 * <p>Construction rejects duplicate node ids, connections to unknown nodes and cycles.
 * A LOOP node's body is the set of nodes reachable through its {@code loop} (or
 * {@code body}) handle edges that are not also reachable through its other edges;
 * body nodes run once per iteration under the loop's control.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class WorkflowGraph {

    public static final String LOOP_HANDLE = "loop";
    public static final String BODY_HANDLE = "body";

    private final Map<String, WorkflowNode> nodes;
    private final Map<String, List<WorkflowConnection>> outgoing;
    private final Map<String, List<WorkflowConnection>> incoming;
    private final List<String> topologicalOrder;
    private final Map<String, Set<String>> loopBodies;

    private WorkflowGraph(Map<String, WorkflowNode> nodes, List<WorkflowConnection> connections) throws ValidationException {
        this.nodes = nodes;
        this.outgoing = new HashMap<>();
        this.incoming = new HashMap<>();
        for (String nodeId : nodes.keySet()) {
            outgoing.put(nodeId, new ArrayList<>());
            incoming.put(nodeId, new ArrayList<>());
        }
        for (WorkflowConnection connection : connections) {
            outgoing.get(connection.sourceNodeId()).add(connection);
            incoming.get(connection.targetNodeId()).add(connection);
        }
        this.topologicalOrder = topologicalSort();
        this.loopBodies = computeLoopBodies();
    }

    /**
     * Builds and validates a graph.
     *
     * @throws ValidationException on duplicate node ids, dangling connections or cycles
     */
    public static WorkflowGraph of(GraphSnapshot snapshot) throws ValidationException {
        return of(snapshot.nodes(), snapshot.connections());
    }

    public static WorkflowGraph of(Collection<WorkflowNode> nodes, Collection<WorkflowConnection> connections)
            throws ValidationException {
        Map<String, WorkflowNode> byId = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (WorkflowNode node : nodes) {
            if (byId.putIfAbsent(node.nodeId(), node) != null) {
                errors.add("Duplicate node id '" + node.nodeId() + "'");
            }
        }
        for (WorkflowConnection connection : connections) {
            if (!byId.containsKey(connection.sourceNodeId())) {
                errors.add("Connection '" + connection.edgeId() + "' references unknown source node '"
                        + connection.sourceNodeId() + "'");
            }
            if (!byId.containsKey(connection.targetNodeId())) {
                errors.add("Connection '" + connection.edgeId() + "' references unknown target node '"
                        + connection.targetNodeId() + "'");
            }
            if (connection.sourceNodeId().equals(connection.targetNodeId())) {
                errors.add("Connection '" + connection.edgeId() + "' connects node '"
                        + connection.sourceNodeId() + "' to itself");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid workflow graph", errors);
        }
        return new WorkflowGraph(byId, List.copyOf(connections));
    }

    public Collection<WorkflowNode> nodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    public WorkflowNode node(String nodeId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node '" + nodeId + "'");
        }
        return node;
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public List<WorkflowConnection> outgoing(String nodeId) {
        return List.copyOf(outgoing.getOrDefault(nodeId, List.of()));
    }

    public List<WorkflowConnection> incoming(String nodeId) {
        return List.copyOf(incoming.getOrDefault(nodeId, List.of()));
    }

    /**
     * Node ids in dependency order. Nodes that become ready together are ordered by
     * execution order, then node id.
     */
    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    /**
     * All nodes from which the given node can be reached.
     */
    public Set<String> ancestors(String nodeId) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            for (WorkflowConnection edge : incoming.getOrDefault(queue.poll(), List.of())) {
                if (visited.add(edge.sourceNodeId())) {
                    queue.add(edge.sourceNodeId());
                }
            }
        }
        return visited;
    }

    /**
     * Body node ids of a LOOP node, empty for any other node.
     */
    public Set<String> loopBody(String loopNodeId) {
        return loopBodies.getOrDefault(loopNodeId, Set.of());
    }

    /**
     * Body node ids of a loop in dependency order, excluding nodes that belong to a loop nested inside it.
     */
    public List<String> loopBodyOrder(String loopNodeId) {
        Set<String> body = loopBody(loopNodeId);
        List<String> order = new ArrayList<>();
        for (String nodeId : topologicalOrder) {
            if (body.contains(nodeId) && enclosingLoop(nodeId).map(loopNodeId::equals).orElse(false)) {
                order.add(nodeId);
            }
        }
        return order;
    }

    /**
     * The innermost LOOP whose body contains the node, if any.
     */
    public Optional<String> enclosingLoop(String nodeId) {
        String innermost = null;
        for (Map.Entry<String, Set<String>> entry : loopBodies.entrySet()) {
            if (entry.getValue().contains(nodeId)
                    && (innermost == null || entry.getValue().size() < loopBodies.get(innermost).size())) {
                innermost = entry.getKey();
            }
        }
        return Optional.ofNullable(innermost);
    }

    public static boolean isBodyEdge(WorkflowConnection connection) {
        return connection.hasHandle(LOOP_HANDLE) || connection.hasHandle(BODY_HANDLE);
    }

    private List<String> topologicalSort() throws ValidationException {
        // Kahn's algorithm with a stable tie-break
        Comparator<String> readyOrder = Comparator
                .comparingInt((String id) -> nodes.get(id).executionOrder())
                .thenComparing(Comparator.naturalOrder());
        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>(readyOrder);
        for (String nodeId : nodes.keySet()) {
            inDegree.put(nodeId, incoming.get(nodeId).size());
            if (incoming.get(nodeId).isEmpty()) {
                ready.add(nodeId);
            }
        }

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (WorkflowConnection edge : outgoing.get(current)) {
                int remaining = inDegree.merge(edge.targetNodeId(), -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(edge.targetNodeId());
                }
            }
        }

        if (order.size() != nodes.size()) {
            List<String> remaining = nodes.keySet().stream()
                    .filter(nodeId -> !order.contains(nodeId))
                    .sorted()
                    .toList();
            throw new ValidationException("Workflow graph contains a cycle involving nodes " + remaining);
        }
        return List.copyOf(order);
    }

    private Map<String, Set<String>> computeLoopBodies() {
        Map<String, Set<String>> bodies = new HashMap<>();
        for (WorkflowNode node : nodes.values()) {
            if (node.type() != NodeType.LOOP) {
                continue;
            }
            List<String> bodyStarts = new ArrayList<>();
            List<String> exitStarts = new ArrayList<>();
            for (WorkflowConnection edge : outgoing.get(node.nodeId())) {
                (isBodyEdge(edge) ? bodyStarts : exitStarts).add(edge.targetNodeId());
            }
            Set<String> body = reachableFrom(bodyStarts);
            body.removeAll(reachableFrom(exitStarts));
            body.remove(node.nodeId());
            bodies.put(node.nodeId(), Set.copyOf(body));
        }
        return bodies;
    }

    private Set<String> reachableFrom(List<String> starts) {
        Set<String> visited = new LinkedHashSet<>(starts);
        Deque<String> queue = new ArrayDeque<>(starts);
        while (!queue.isEmpty()) {
            for (WorkflowConnection edge : outgoing.get(queue.poll())) {
                if (visited.add(edge.targetNodeId())) {
                    queue.add(edge.targetNodeId());
                }
            }
        }
        return visited;
    }
}
