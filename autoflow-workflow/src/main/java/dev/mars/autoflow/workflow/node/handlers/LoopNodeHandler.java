package dev.mars.autoflow.workflow.node.handlers;

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
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.NodeExecutionException;
import dev.mars.autoflow.workflow.graph.WorkflowGraph;
import dev.mars.autoflow.workflow.node.AbstractNodeHandler;
import dev.mars.autoflow.workflow.node.ConfigFields;
import dev.mars.autoflow.workflow.node.LoopBodyRunner;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.node.config.LoopConfig;
import dev.mars.autoflow.workflow.node.config.LoopConfig.FailurePolicy;
import dev.mars.autoflow.workflow.variable.TemplateInterpolator;
import dev.mars.autoflow.workflow.variable.VariableScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Iterates an array and runs the loop body once per element.
 *
 * <p>The body itself is run by the {@link LoopBodyRunner} the orchestrator supplies;
 * each iteration sees the element and its index as local variables. With
 * {@code concurrency > 1} iterations run in windows of that size on the parallel
 * executor. Results are always reported in index order.
 *
 * <p>Each element of the result array has the shape
 * {@code {index, item, status, outputs, error}}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class LoopNodeHandler extends AbstractNodeHandler<LoopConfig> {

    private static final Logger logger = LoggerFactory.getLogger(LoopNodeHandler.class);

    private final int maxConcurrency;

    public LoopNodeHandler(int maxConcurrency) {
        super(NodeType.LOOP, LoopConfig.class);
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("Max concurrency must be at least 1");
        }
        this.maxConcurrency = maxConcurrency;
    }

    @Override
    protected void validateFields(ConfigFields fields) {
        fields.exclusive(true, "dataSource", "sourceKey");
        Object dataSource = fields.raw().get("dataSource");
        if (dataSource != null && !(dataSource instanceof Collection<?>)) {
            fields.string("dataSource");
        }
        fields.string("sourceKey");
        fields.string("itemVariable");
        fields.string("indexVariable");
        fields.number("maxIterations", 1, LoopConfig.MAX_ITERATIONS);
        fields.string("resultKey");
        fields.number("concurrency", 1, maxConcurrency);
        String policy = fields.string("failurePolicy");
        if (policy != null) {
            try {
                FailurePolicy.fromString(policy);
            } catch (IllegalArgumentException e) {
                fields.error("failurePolicy", "must be FAIL_FAST or CONTINUE");
            }
        }
    }

    @Override
    public NodeResult execute(LoopConfig config, NodeContext context) throws AutoflowException {
        String nodeId = context.getNodeId();
        LoopBodyRunner runner = context.getLoopBodyRunner();
        if (runner == null) {
            throw new NodeExecutionException(nodeId, "Loop body runner is not available", false);
        }

        List<Object> items = items(config, context);
        int iterations = Math.min(items.size(), config.getMaxIterations());
        boolean truncated = iterations < items.size();
        if (truncated) {
            logger.info("Loop {} truncated to {} of {} items", nodeId, iterations, items.size());
        }

        List<Map<String, Object>> results = new ArrayList<>(iterations);
        int window = context.getParallelExecutor() == null ? 1 : config.getConcurrency();
        for (int start = 0; start < iterations; start += window) {
            int end = Math.min(start + window, iterations);
            List<IterationOutcome> outcomes = window == 1
                    ? List.of(runOne(runner, config, context, start, items.get(start)))
                    : runWindow(runner, config, context, items, start, end);
            for (IterationOutcome outcome : outcomes) {
                results.add(outcome.toResult());
                if (outcome.failure != null && config.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
                    throw new NodeExecutionException(nodeId, String.format("Loop iteration %d failed: %s",
                            outcome.index, outcome.failure.getMessage()), outcome.failure);
                }
            }
        }

        long failed = results.stream().filter(result -> "FAILED".equals(result.get("status"))).count();
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("iterations", iterations);
        output.put("totalItems", items.size());
        output.put("succeeded", iterations - failed);
        output.put("failed", failed);
        output.put("truncated", truncated);
        return NodeResult.completed(output, config.getResultKey(), results)
                .withActiveEdges(exitEdges(context.getOutgoing()));
    }

    private List<Object> items(LoopConfig config, NodeContext context) throws AutoflowException {
        if (config.hasLiteralItems()) {
            Object resolved = TemplateInterpolator.interpolateValue(config.getLiteralItems(), context.getVariables());
            return VariableScope.toList(resolved);
        }
        return context.getVariables().requireList(context.getNodeId(),
                TemplateInterpolator.unwrapReference(config.getSourceReference()));
    }

    private List<IterationOutcome> runWindow(LoopBodyRunner runner, LoopConfig config, NodeContext context,
                                             List<Object> items, int start, int end) throws NodeExecutionException {
        Executor executor = context.getParallelExecutor();
        List<CompletableFuture<IterationOutcome>> futures = new ArrayList<>();
        for (int index = start; index < end; index++) {
            int current = index;
            futures.add(CompletableFuture.supplyAsync(
                    () -> runOne(runner, config, context, current, items.get(current)), executor));
        }
        List<IterationOutcome> outcomes = new ArrayList<>();
        try {
            for (CompletableFuture<IterationOutcome> future : futures) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new NodeExecutionException(context.getNodeId(), "Loop interrupted", e);
        } catch (ExecutionException e) {
            throw new NodeExecutionException(context.getNodeId(), "Loop iteration crashed: " + e.getCause(), e.getCause());
        }
        return outcomes;
    }

    private IterationOutcome runOne(LoopBodyRunner runner, LoopConfig config, NodeContext context,
                                    int index, Object item) {
        Map<String, Object> locals = new LinkedHashMap<>();
        locals.put(config.getItemVariable(), item);
        locals.put(config.getIndexVariable(), index);
        VariableScope scope = context.getVariables().child(locals);
        try {
            return new IterationOutcome(index, item, runner.runIteration(index, scope), null);
        } catch (AutoflowException e) {
            logger.debug("Loop {} iteration {} failed: {}", context.getNodeId(), index, e.getMessage());
            return new IterationOutcome(index, item, Map.of(), e);
        }
    }

    private static Set<String> exitEdges(List<WorkflowConnection> outgoing) {
        Set<String> exits = new LinkedHashSet<>();
        for (WorkflowConnection connection : outgoing) {
            if (!WorkflowGraph.isBodyEdge(connection)) {
                exits.add(connection.edgeId());
            }
        }
        return exits;
    }

    private static final class IterationOutcome {
        private final int index;
        private final Object item;
        private final Map<String, Object> outputs;
        private final AutoflowException failure;

        private IterationOutcome(int index, Object item, Map<String, Object> outputs, AutoflowException failure) {
            this.index = index;
            this.item = item;
            this.outputs = outputs;
            this.failure = failure;
        }

        private Map<String, Object> toResult() {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("index", index);
            result.put("item", item);
            result.put("status", failure == null ? "COMPLETED" : "FAILED");
            result.put("outputs", outputs);
            result.put("error", failure == null ? null : failure.getMessage());
            return result;
        }
    }
}
