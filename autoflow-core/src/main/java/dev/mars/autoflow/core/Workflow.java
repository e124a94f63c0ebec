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
import java.util.Objects;

/**
 * A named automation owned by one organization. The graph itself (nodes,
 * connections and triggers) is stored separately and addressed by {@link #getId()}.
 *
 * <p>The execution counters are only ever incremented, when an execution starts and
 * when it reaches a terminal outcome; an explicit recompute may rebuild them from execution history.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class Workflow {

    private final String id;
    private final String organizationId;
    private final String name;
    private final String description;
    private final WorkflowStatus status;
    private final long totalExecutions;
    private final long successfulExecutions;
    private final long failedExecutions;
    private final Instant lastExecutedAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Workflow(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow ID cannot be null");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "Organization ID cannot be null");
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.description = builder.description;
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.totalExecutions = Math.max(0, builder.totalExecutions);
        this.successfulExecutions = Math.max(0, builder.successfulExecutions);
        this.failedExecutions = Math.max(0, builder.failedExecutions);
        this.lastExecutedAt = builder.lastExecutedAt;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public long getTotalExecutions() {
        return totalExecutions;
    }

    public long getSuccessfulExecutions() {
        return successfulExecutions;
    }

    public long getFailedExecutions() {
        return failedExecutions;
    }

    public Instant getLastExecutedAt() {
        return lastExecutedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Returns a copy counting one more started execution.
     */
    public Workflow recordStart(Instant at) {
        return toBuilder()
                .totalExecutions(totalExecutions + 1)
                .lastExecutedAt(at)
                .updatedAt(at)
                .build();
    }

    /**
     * Returns a copy with the outcome counters advanced for a terminal execution.
     * Cancelled executions only count as started.
     */
    public Workflow recordOutcome(ExecutionStatus outcome, Instant at) {
        Builder builder = toBuilder().updatedAt(at);
        if (outcome == ExecutionStatus.COMPLETED) {
            builder.successfulExecutions(successfulExecutions + 1);
        } else if (outcome == ExecutionStatus.FAILED) {
            builder.failedExecutions(failedExecutions + 1);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .organizationId(organizationId)
                .name(name)
                .description(description)
                .status(status)
                .totalExecutions(totalExecutions)
                .successfulExecutions(successfulExecutions)
                .failedExecutions(failedExecutions)
                .lastExecutedAt(lastExecutedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Workflow workflow = (Workflow) o;
        return Objects.equals(id, workflow.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Workflow{" +
                "id='" + id + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", name='" + name + '\'' +
                ", status=" + status +
                ", totalExecutions=" + totalExecutions +
                '}';
    }

    public static class Builder {
        private String id;
        private String organizationId;
        private String name;
        private String description;
        private WorkflowStatus status = WorkflowStatus.DRAFT;
        private long totalExecutions;
        private long successfulExecutions;
        private long failedExecutions;
        private Instant lastExecutedAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder totalExecutions(long totalExecutions) {
            this.totalExecutions = totalExecutions;
            return this;
        }

        public Builder successfulExecutions(long successfulExecutions) {
            this.successfulExecutions = successfulExecutions;
            return this;
        }

        public Builder failedExecutions(long failedExecutions) {
            this.failedExecutions = failedExecutions;
            return this;
        }

        public Builder lastExecutedAt(Instant lastExecutedAt) {
            this.lastExecutedAt = lastExecutedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Workflow build() {
            return new Workflow(this);
        }
    }
}
