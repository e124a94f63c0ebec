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
 * Lifecycle status of a workflow definition.
 *
 * <p>Only {@link #ACTIVE} workflows accept new executions from triggers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum WorkflowStatus {
    DRAFT,
    INACTIVE,
    ACTIVE,
    PAUSED,
    ARCHIVED,
    ERROR;

    public boolean acceptsExecutions() {
        return this == ACTIVE;
    }

    public boolean isEditable() {
        return this != ARCHIVED;
    }
}
