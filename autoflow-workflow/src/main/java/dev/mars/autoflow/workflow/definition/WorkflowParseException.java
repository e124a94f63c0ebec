package dev.mars.autoflow.workflow.definition;

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

import dev.mars.autoflow.core.exceptions.AutoflowException;

/**
 * Exception thrown when a workflow definition cannot be read.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-12
 * @version 1.0
 */
public class WorkflowParseException extends AutoflowException {

    private final String fieldPath;

    public WorkflowParseException(String message) {
        super(message);
        this.fieldPath = null;
    }

    public WorkflowParseException(String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = null;
    }

    public WorkflowParseException(String fieldPath, String message) {
        super(fieldPath + ": " + message);
        this.fieldPath = fieldPath;
    }

    public WorkflowParseException(String fieldPath, String message, Throwable cause) {
        super(fieldPath + ": " + message, cause);
        this.fieldPath = fieldPath;
    }

    /**
     * Location of the offending value, e.g. {@code nodes[2].type}; null for syntax errors.
     */
    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getErrorCode() {
        return "WORKFLOW_PARSE_ERROR";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
