package dev.mars.autoflow.core;

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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The state of one node within one execution.
 *
 * <p>{@code activeEdges} holds the edge ids a branching node chose to follow once it
 * completed; null means every outgoing edge is followed. It is stored so that a
 * retried execution takes the same branches without re-running completed nodes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class NodeExecution {

    private final String id;
    private final String executionId;
    private final String nodeId;
    private final NodeType nodeType;
    private final int executionOrder;
    private final NodeExecutionStatus status;
    private final int retryCount;
    private final int maxRetries;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant resumeAt;
    private final Long durationMs;
    private final Map<String, Object> input;
    private final Map<String, Object> output;
    private final String error;
    private final Set<String> activeEdges;

    private NodeExecution(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node execution ID cannot be null");
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.nodeId = Objects.requireNonNull(builder.nodeId, "Node ID cannot be null");
        this.nodeType = Objects.requireNonNull(builder.nodeType, "Node type cannot be null");
        this.executionOrder = builder.executionOrder;
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.retryCount = Math.max(0, builder.retryCount);
        this.maxRetries = Math.max(0, builder.maxRetries);
        if (this.retryCount > this.maxRetries) {
            throw new IllegalArgumentException("retryCount " + retryCount + " exceeds maxRetries " + maxRetries);
        }
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.resumeAt = builder.resumeAt;
        this.durationMs = builder.durationMs;
        this.input = copyOf(builder.input);
        this.output = copyOf(builder.output);
        this.error = builder.error;
        this.activeEdges = builder.activeEdges == null ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(builder.activeEdges));
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public String getId() {
        return id;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public int getExecutionOrder() {
        return executionOrder;
    }

    public NodeExecutionStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getResumeAt() {
        return resumeAt;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public String getError() {
        return error;
    }

    public Set<String> getActiveEdges() {
        return activeEdges;
    }

    /**
     * Whether the edge with the given id is followed after this node completed.
     */
    public boolean follows(String edgeId) {
        return activeEdges == null || activeEdges.contains(edgeId);
    }

    public boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .executionId(executionId)
                .nodeId(nodeId)
                .nodeType(nodeType)
                .executionOrder(executionOrder)
                .status(status)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .resumeAt(resumeAt)
                .durationMs(durationMs)
                .input(input)
                .output(output)
                .error(error)
                .activeEdges(activeEdges);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeExecution that = (NodeExecution) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "NodeExecution{" +
                "nodeId='" + nodeId + '\'' +
                ", nodeType=" + nodeType +
                ", status=" + status +
                ", retryCount=" + retryCount +
                '}';
    }

    public static class Builder {
        private String id;
        private String executionId;
        private String nodeId;
        private NodeType nodeType;
        private int executionOrder;
        private NodeExecutionStatus status = NodeExecutionStatus.PENDING;
        private int retryCount;
        private int maxRetries;
        private Instant startedAt;
        private Instant completedAt;
        private Instant resumeAt;
        private Long durationMs;
        private Map<String, Object> input;
        private Map<String, Object> output;
        private String error;
        private Set<String> activeEdges;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder nodeType(NodeType nodeType) {
            this.nodeType = nodeType;
            return this;
        }

        public Builder executionOrder(int executionOrder) {
            this.executionOrder = executionOrder;
            return this;
        }

        public Builder status(NodeExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder resumeAt(Instant resumeAt) {
            this.resumeAt = resumeAt;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder input(Map<String, Object> input) {
            this.input = input;
            return this;
        }

        public Builder output(Map<String, Object> output) {
            this.output = output;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder activeEdges(Set<String> activeEdges) {
            this.activeEdges = activeEdges;
            return this;
        }

        public NodeExecution build() {
            return new NodeExecution(this);
        }
    }
}
