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
 * Status of a single node within an execution.
 *
 * <p>{@link #WAITING} marks a node that has suspended the execution until its
 * {@code resumeAt} time has passed (DELAY and SCHEDULE nodes).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum NodeExecutionStatus {
    PENDING,
    RUNNING,
    WAITING,
    COMPLETED,
    FAILED,
    SKIPPED,
    CANCELLED;

    /**
     * A settled node is never invoked again during the current run of its execution.
     */
    public boolean isSettled() {
        return this == COMPLETED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * Counted towards execution progress.
     */
    public boolean countsAsProgress() {
        return this == COMPLETED || this == SKIPPED;
    }

    public boolean canTransitionTo(NodeExecutionStatus target) {
        switch (this) {
            case PENDING:
                return target == RUNNING || target == SKIPPED || target == CANCELLED
                        || target == COMPLETED;
            case RUNNING:
                return target == COMPLETED || target == FAILED || target == WAITING
                        || target == PENDING || target == CANCELLED;
            case WAITING:
                return target == COMPLETED || target == CANCELLED || target == FAILED;
            case FAILED:
            case CANCELLED:
            case SKIPPED:
                // execution retry re-arms everything that did not complete
                return target == PENDING;
            default:
                return false;
        }
    }
}
