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

import dev.mars.autoflow.core.BulkExecutionAction;
import dev.mars.autoflow.core.ExecutionStatus;

/**
 * Outcome of a bulk action for one execution.
 *
 * @param executionId the execution acted on
 * @param action      the requested action
 * @param success     true if the action was applied
 * @param status      status after the attempt, null if the execution does not exist
 * @param error       why the action was rejected, null on success
 */
public record BulkActionResult(String executionId, BulkExecutionAction action, boolean success,
                               ExecutionStatus status, String error) {

    public static BulkActionResult applied(String executionId, BulkExecutionAction action, ExecutionStatus status) {
        return new BulkActionResult(executionId, action, true, status, null);
    }

    public static BulkActionResult rejected(String executionId, BulkExecutionAction action, ExecutionStatus status,
                                            String error) {
        return new BulkActionResult(executionId, action, false, status, error);
    }
}
