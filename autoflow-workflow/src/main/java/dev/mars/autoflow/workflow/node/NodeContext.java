package dev.mars.autoflow.workflow.node;

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

import dev.mars.autoflow.core.NodeExecution;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.workflow.variable.VariableScope;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Everything a handler may see while executing one node.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class NodeContext {

    private final WorkflowExecution execution;
    private final NodeExecution nodeExecution;
    private final WorkflowNode node;
    private final VariableScope variables;
    private final List<WorkflowConnection> outgoing;
    private final Clock clock;
    private final List<Integer> iterationPath;
    private final LoopBodyRunner loopBodyRunner;
    private final Executor parallelExecutor;

    private NodeContext(Builder builder) {
        this.execution = Objects.requireNonNull(builder.execution, "Execution cannot be null");
        this.nodeExecution = Objects.requireNonNull(builder.nodeExecution, "Node execution cannot be null");
        this.node = Objects.requireNonNull(builder.node, "Node cannot be null");
        this.variables = Objects.requireNonNull(builder.variables, "Variables cannot be null");
        this.outgoing = builder.outgoing == null ? List.of() : List.copyOf(builder.outgoing);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.iterationPath = builder.iterationPath == null ? List.of() : List.copyOf(builder.iterationPath);
        this.loopBodyRunner = builder.loopBodyRunner;
        this.parallelExecutor = builder.parallelExecutor;
    }

    public WorkflowExecution getExecution() {
        return execution;
    }

    public NodeExecution getNodeExecution() {
        return nodeExecution;
    }

    public WorkflowNode getNode() {
        return node;
    }

    public String getNodeId() {
        return node.nodeId();
    }

    public String getOrganizationId() {
        return execution.getOrganizationId();
    }

    public VariableScope getVariables() {
        return variables;
    }

    public List<WorkflowConnection> getOutgoing() {
        return outgoing;
    }

    public Instant now() {
        return clock.instant();
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * The innermost loop iteration this node runs in, or null outside loop bodies.
     */
    public Integer getIteration() {
        return iterationPath.isEmpty() ? null : iterationPath.get(iterationPath.size() - 1);
    }

    /**
     * Iteration indexes of every enclosing loop, outermost first. Empty outside loop bodies.
     */
    public List<Integer> getIterationPath() {
        return iterationPath;
    }

    /**
     * Key under which a side effect of this invocation is recorded. Stable across
     * re-invocations of the same node execution and loop iteration.
     */
    public String idempotencyKey() {
        StringBuilder key = new StringBuilder(nodeExecution.getId());
        for (Integer index : iterationPath) {
            key.append(':').append(index);
        }
        return key.toString();
    }

    public LoopBodyRunner getLoopBodyRunner() {
        return loopBodyRunner;
    }

    public Executor getParallelExecutor() {
        return parallelExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private WorkflowExecution execution;
        private NodeExecution nodeExecution;
        private WorkflowNode node;
        private VariableScope variables;
        private List<WorkflowConnection> outgoing;
        private Clock clock;
        private List<Integer> iterationPath;
        private LoopBodyRunner loopBodyRunner;
        private Executor parallelExecutor;

        public Builder execution(WorkflowExecution execution) {
            this.execution = execution;
            return this;
        }

        public Builder nodeExecution(NodeExecution nodeExecution) {
            this.nodeExecution = nodeExecution;
            return this;
        }

        public Builder node(WorkflowNode node) {
            this.node = node;
            return this;
        }

        public Builder variables(VariableScope variables) {
            this.variables = variables;
            return this;
        }

        public Builder outgoing(List<WorkflowConnection> outgoing) {
            this.outgoing = outgoing;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder iterationPath(List<Integer> iterationPath) {
            this.iterationPath = iterationPath;
            return this;
        }

        public Builder loopBodyRunner(LoopBodyRunner loopBodyRunner) {
            this.loopBodyRunner = loopBodyRunner;
            return this;
        }

        public Builder parallelExecutor(Executor parallelExecutor) {
            this.parallelExecutor = parallelExecutor;
            return this;
        }

        public NodeContext build() {
            return new NodeContext(this);
        }
    }
}
