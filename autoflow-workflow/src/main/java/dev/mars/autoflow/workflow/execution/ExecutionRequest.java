package dev.mars.autoflow.workflow.execution;

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

import dev.mars.autoflow.core.ExecutionPriority;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What to start: a workflow, the data that triggered it and any caller variables.
 */
public final class ExecutionRequest {

    private final String workflowId;
    private final String triggerId;
    private final Map<String, Object> triggerData;
    private final List<VariableInput> variables;
    private final ExecutionPriority priority;
    private final Duration startDelay;

    private ExecutionRequest(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "Workflow ID cannot be null");
        this.triggerId = builder.triggerId;
        this.triggerData = builder.triggerData == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.triggerData));
        this.variables = builder.variables == null ? List.of() : List.copyOf(builder.variables);
        this.priority = builder.priority != null ? builder.priority : ExecutionPriority.NORMAL;
        this.startDelay = builder.startDelay != null ? builder.startDelay : Duration.ZERO;
        if (startDelay.isNegative()) {
            throw new IllegalArgumentException("Start delay cannot be negative");
        }
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getTriggerId() {
        return triggerId;
    }

    public Map<String, Object> getTriggerData() {
        return triggerData;
    }

    public List<VariableInput> getVariables() {
        return variables;
    }

    public ExecutionPriority getPriority() {
        return priority;
    }

    public Duration getStartDelay() {
        return startDelay;
    }

    public static Builder builder(String workflowId) {
        return new Builder().workflowId(workflowId);
    }

    public static class Builder {
        private String workflowId;
        private String triggerId;
        private Map<String, Object> triggerData;
        private List<VariableInput> variables;
        private ExecutionPriority priority;
        private Duration startDelay;

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder triggerId(String triggerId) {
            this.triggerId = triggerId;
            return this;
        }

        public Builder triggerData(Map<String, Object> triggerData) {
            this.triggerData = triggerData;
            return this;
        }

        public Builder variables(List<VariableInput> variables) {
            this.variables = variables;
            return this;
        }

        public Builder priority(ExecutionPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder startDelay(Duration startDelay) {
            this.startDelay = startDelay;
            return this;
        }

        public ExecutionRequest build() {
            return new ExecutionRequest(this);
        }
    }
}
