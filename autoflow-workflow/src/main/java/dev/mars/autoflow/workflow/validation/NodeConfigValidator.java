package dev.mars.autoflow.workflow.validation;

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
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.exceptions.ValidationException;
import dev.mars.autoflow.workflow.condition.FieldPaths;
import dev.mars.autoflow.workflow.graph.WorkflowGraph;
import dev.mars.autoflow.workflow.node.NodeHandlerRegistry;
import dev.mars.autoflow.workflow.node.config.ConditionConfig;
import dev.mars.autoflow.workflow.node.config.FilterConfig;
import dev.mars.autoflow.workflow.node.config.LoopConfig;
import dev.mars.autoflow.workflow.node.config.QueryConfig;
import dev.mars.autoflow.workflow.variable.TemplateInterpolator;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validates node configuration, alone or together with the workflow graph it belongs to.
 *
 * <p>Workflow-level checks, on top of each node's own configuration rules:
 * <ul>
 *   <li>the graph is well formed and acyclic</li>
 *   <li>DELAY and SCHEDULE nodes do not sit inside a loop body</li>
 *   <li>a variable read by a node is not produced only by nodes downstream of, or
 *       parallel to, the reader; such a reference can never resolve</li>
 * </ul>
 * References to variables no node produces are left alone: they may come from the
 * trigger payload or from caller input.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class NodeConfigValidator {

    private final NodeHandlerRegistry registry;

    public NodeConfigValidator(NodeHandlerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Handler registry cannot be null");
    }

    /**
     * Checks the configuration of a single node.
     */
    public ValidationResult validateNode(WorkflowNode node) {
        ValidationResult result = new ValidationResult();
        result.merge(path(node), registry.validate(node.type(), node.config()));
        return result;
    }

    /**
     * Checks every node and the graph they form.
     */
    public ValidationResult validateWorkflow(Collection<WorkflowNode> nodes, Collection<WorkflowConnection> connections) {
        ValidationResult result = new ValidationResult();
        for (WorkflowNode node : nodes) {
            result.merge(path(node), registry.validate(node.type(), node.config()));
        }

        WorkflowGraph graph;
        try {
            graph = WorkflowGraph.of(nodes, connections);
        } catch (ValidationException e) {
            List<String> errors = e.getErrors().isEmpty() ? List.of(e.getMessage()) : e.getErrors();
            errors.forEach(error -> result.addError("connections", error));
            return result;
        }

        if (nodes.stream().noneMatch(node -> node.type() == NodeType.TRIGGER)) {
            result.addWarning("nodes", "workflow has no TRIGGER node; every root node starts the execution");
        }
        validateLoopBodies(graph, result);
        validateReferences(graph, result);
        return result;
    }

    /**
     * @throws ValidationException listing every problem found by {@link #validateWorkflow}
     */
    public void requireValid(Collection<WorkflowNode> nodes, Collection<WorkflowConnection> connections)
            throws ValidationException {
        validateWorkflow(nodes, connections).throwIfInvalid("Workflow is invalid");
    }

    private void validateLoopBodies(WorkflowGraph graph, ValidationResult result) {
        for (WorkflowNode node : graph.nodes()) {
            Optional<String> loop = graph.enclosingLoop(node.nodeId());
            if (loop.isPresent() && node.type().canSuspend()) {
                result.addError(path(node), String.format("%s node cannot run inside the body of loop '%s'",
                        node.type(), loop.get()));
            }
        }
    }

    private void validateReferences(WorkflowGraph graph, ValidationResult result) {
        Map<String, Set<String>> producers = producers(graph);
        for (WorkflowNode reader : graph.nodes()) {
            Set<String> upstream = graph.ancestors(reader.nodeId());
            for (String reference : references(reader)) {
                String variable = FieldPaths.head(reference);
                Set<String> sources = producers.getOrDefault(variable, Set.of());
                if (sources.isEmpty() || sources.stream().anyMatch(upstream::contains)) {
                    continue;
                }
                Set<String> others = new TreeSet<>(sources);
                others.remove(reader.nodeId());
                result.addError(path(reader), String.format(
                        "variable '%s' is only produced by nodes that do not run before this node: %s",
                        variable, others.isEmpty() ? "[" + reader.nodeId() + "]" : others));
            }
        }
    }

    /**
     * Variable name to the ids of the nodes that may write it.
     */
    private static Map<String, Set<String>> producers(WorkflowGraph graph) {
        Map<String, Set<String>> producers = new LinkedHashMap<>();
        for (WorkflowNode node : graph.nodes()) {
            for (String key : producedKeys(node)) {
                producers.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(node.nodeId());
            }
        }
        return producers;
    }

    private static Set<String> producedKeys(WorkflowNode node) {
        Map<String, Object> config = node.config();
        Set<String> keys = new LinkedHashSet<>();
        String resultKey = text(config.get("resultKey"));
        switch (node.type()) {
            case QUERY:
                keys.add(resultKey != null ? resultKey : QueryConfig.DEFAULT_RESULT_KEY);
                break;
            case FILTER:
                keys.add(resultKey != null ? resultKey : FilterConfig.DEFAULT_RESULT_KEY);
                break;
            case CONDITION:
                keys.add(resultKey != null ? resultKey : ConditionConfig.DEFAULT_RESULT_KEY);
                break;
            case LOOP:
                keys.add(resultKey != null ? resultKey : LoopConfig.DEFAULT_RESULT_KEY);
                break;
            case ACTION:
            case SCHEDULE:
                if (resultKey != null) {
                    keys.add(resultKey);
                }
                break;
            case TRIGGER:
            case DELAY:
                break;
            default:
                throw new IllegalStateException("Unhandled node type " + node.type());
        }
        String fallbackKey = text(config.get("fallbackKey"));
        if (fallbackKey != null) {
            keys.add(fallbackKey);
        }
        return keys;
    }

    /**
     * Variable paths a node reads: explicit source keys and {@code {{...}}} references.
     */
    private static Set<String> references(WorkflowNode node) {
        Set<String> references = new LinkedHashSet<>();
        Map<String, Object> config = node.config();
        if (node.type() == NodeType.FILTER || node.type() == NodeType.LOOP) {
            addReference(references, config.get("sourceKey"));
            if (!(config.get("dataSource") instanceof Collection<?>)) {
                addReference(references, config.get("dataSource"));
            }
        }
        collectTemplates(config, references);
        return references;
    }

    private static void addReference(Set<String> references, Object raw) {
        String reference = text(raw);
        if (reference != null) {
            references.add(TemplateInterpolator.unwrapReference(reference));
        }
    }

    private static void collectTemplates(Object value, Set<String> references) {
        if (value instanceof String text) {
            references.addAll(TemplateInterpolator.extractReferences(text));
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(child -> collectTemplates(child, references));
        } else if (value instanceof Collection<?> collection) {
            collection.forEach(child -> collectTemplates(child, references));
        }
    }

    private static String text(Object value) {
        return value == null || value.toString().isBlank() ? null : value.toString().trim();
    }

    private static String path(WorkflowNode node) {
        return "nodes[" + node.nodeId() + "]";
    }
}
