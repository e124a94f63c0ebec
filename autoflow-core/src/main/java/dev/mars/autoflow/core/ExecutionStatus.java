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

/**
 * Lifecycle status of a workflow execution.
 *
 * The typical flow is:
 * PENDING -> RUNNING -> COMPLETED
 *
 * Alternative flows:
 * RUNNING -> FAILED (a required node exhausted its retries)
 * PENDING/RUNNING/PAUSED -> CANCELLED (manual cancellation)
 * RUNNING <-> PAUSED (bulk pause and resume)
 * FAILED -> PENDING (explicit retry)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum ExecutionStatus {

    PENDING("Execution queued", false, false),

    RUNNING("Execution in progress", false, false),

    PAUSED("Execution paused", false, false),

    COMPLETED("Execution completed successfully", true, true),

    /**
     * Terminal unless the execution is explicitly retried.
     */
    FAILED("Execution failed", true, false),

    CANCELLED("Execution cancelled", true, false);

    private final String description;
    private final boolean terminal;
    private final boolean successful;

    ExecutionStatus(String description, boolean terminal, boolean successful) {
        this.description = description;
        this.terminal = terminal;
        this.successful = successful;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public boolean isActive() {
        return this == PENDING || this == RUNNING || this == PAUSED;
    }

    /**
     * Check if transition from this status to the target status is valid.
     *
     * @param target the target status to transition to
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        switch (this) {
            case PENDING:
                return target == RUNNING || target == CANCELLED;
            case RUNNING:
                return target == COMPLETED || target == FAILED
                        || target == CANCELLED || target == PAUSED;
            case PAUSED:
                return target == RUNNING || target == CANCELLED;
            case FAILED:
                return target == PENDING;
            default:
                return false;
        }
    }

    /**
     * Get all valid transition targets from this status.
     *
     * @return array of valid target statuses
     */
    public ExecutionStatus[] getValidTransitions() {
        switch (this) {
            case PENDING:
                return new ExecutionStatus[]{RUNNING, CANCELLED};
            case RUNNING:
                return new ExecutionStatus[]{COMPLETED, FAILED, CANCELLED, PAUSED};
            case PAUSED:
                return new ExecutionStatus[]{RUNNING, CANCELLED};
            case FAILED:
                return new ExecutionStatus[]{PENDING};
            default:
                return new ExecutionStatus[0];
        }
    }
}
