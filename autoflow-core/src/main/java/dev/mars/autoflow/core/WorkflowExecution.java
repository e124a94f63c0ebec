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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One run of a workflow. Immutable; state changes produce a new instance through
 * {@link #toBuilder()} and are persisted by the execution repository.
 *
 * <p>{@code id} is the storage key; {@code executionId} is the human-readable
 * identifier shown in logs and returned to callers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class WorkflowExecution {

    private final String id;
    private final String executionId;
    private final String workflowId;
    private final String organizationId;
    private final String triggerId;
    private final ExecutionStatus status;
    private final ExecutionPriority priority;
    private final Map<String, Object> triggerData;
    private final String currentNodeId;
    private final double progress;
    private final int retryCount;
    private final int maxRetries;
    private final Long durationMs;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant failedAt;
    private final String error;
    private final Map<String, Object> errorDetails;
    private final GraphSnapshot snapshot;

    private WorkflowExecution(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Execution ID cannot be null");
        this.executionId = builder.executionId != null ? builder.executionId : builder.id;
        this.workflowId = Objects.requireNonNull(builder.workflowId, "Workflow ID cannot be null");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "Organization ID cannot be null");
        this.triggerId = builder.triggerId;
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.priority = builder.priority != null ? builder.priority : ExecutionPriority.NORMAL;
        this.triggerData = copyOf(builder.triggerData);
        this.currentNodeId = builder.currentNodeId;
        this.progress = Math.max(0.0, Math.min(100.0, builder.progress));
        this.retryCount = Math.max(0, builder.retryCount);
        this.maxRetries = Math.max(0, builder.maxRetries);
        if (this.retryCount > this.maxRetries) {
            throw new IllegalArgumentException("retryCount " + retryCount + " exceeds maxRetries " + maxRetries);
        }
        this.durationMs = builder.durationMs;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "Created timestamp cannot be null");
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.failedAt = builder.failedAt;
        this.error = builder.error;
        this.errorDetails = copyOf(builder.errorDetails);
        this.snapshot = builder.snapshot != null ? builder.snapshot : new GraphSnapshot(null, null);
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

    public String getWorkflowId() {
        return workflowId;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getTriggerId() {
        return triggerId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public ExecutionPriority getPriority() {
        return priority;
    }

    public Map<String, Object> getTriggerData() {
        return triggerData;
    }

    public String getCurrentNodeId() {
        return currentNodeId;
    }

    /**
     * Percentage of nodes completed or skipped, between 0 and 100.
     */
    public double getProgress() {
        return progress;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public String getError() {
        return error;
    }

    public Map<String, Object> getErrorDetails() {
        return errorDetails;
    }

    public GraphSnapshot getSnapshot() {
        return snapshot;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canRetry() {
        return status == ExecutionStatus.FAILED && retryCount < maxRetries;
    }

    /**
     * Elapsed time between start and the given end, or null if the execution never started.
     */
    public Long elapsedMs(Instant end) {
        if (startedAt == null || end == null) {
            return null;
        }
        return Duration.between(startedAt, end).toMillis();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .executionId(executionId)
                .workflowId(workflowId)
                .organizationId(organizationId)
                .triggerId(triggerId)
                .status(status)
                .priority(priority)
                .triggerData(triggerData)
                .currentNodeId(currentNodeId)
                .progress(progress)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .durationMs(durationMs)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .failedAt(failedAt)
                .error(error)
                .errorDetails(errorDetails)
                .snapshot(snapshot);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowExecution that = (WorkflowExecution) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
                "executionId='" + executionId + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", status=" + status +
                ", progress=" + progress +
                ", retryCount=" + retryCount +
                '}';
    }

    public static class Builder {
        private String id;
        private String executionId;
        private String workflowId;
        private String organizationId;
        private String triggerId;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private ExecutionPriority priority = ExecutionPriority.NORMAL;
        private Map<String, Object> triggerData;
        private String currentNodeId;
        private double progress;
        private int retryCount;
        private int maxRetries;
        private Long durationMs;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant failedAt;
        private String error;
        private Map<String, Object> errorDetails;
        private GraphSnapshot snapshot;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder triggerId(String triggerId) {
            this.triggerId = triggerId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(ExecutionPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder triggerData(Map<String, Object> triggerData) {
            this.triggerData = triggerData;
            return this;
        }

        public Builder currentNodeId(String currentNodeId) {
            this.currentNodeId = currentNodeId;
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
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

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
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

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder errorDetails(Map<String, Object> errorDetails) {
            this.errorDetails = errorDetails;
            return this;
        }

        public Builder snapshot(GraphSnapshot snapshot) {
            this.snapshot = snapshot;
            return this;
        }

        public WorkflowExecution build() {
            return new WorkflowExecution(this);
        }
    }
}
