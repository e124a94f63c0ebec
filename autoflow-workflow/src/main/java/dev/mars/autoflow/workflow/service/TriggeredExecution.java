package dev.mars.autoflow.workflow.service;

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

import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.WorkflowExecution;

/**
 * Handle returned when an execution is queued.
 *
 * @param id          storage id, used by every other execution operation
 * @param executionId short display id
 * @param status      status at the time of the call, normally PENDING
 */
public record TriggeredExecution(String id, String executionId, ExecutionStatus status) {

    static TriggeredExecution of(WorkflowExecution execution) {
        return new TriggeredExecution(execution.getId(), execution.getExecutionId(), execution.getStatus());
    }
}
