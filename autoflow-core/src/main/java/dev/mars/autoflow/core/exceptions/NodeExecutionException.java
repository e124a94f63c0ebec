package dev.mars.autoflow.core.exceptions;

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
 * Runtime failure of a node handler, such as a missing variable, a value of the
 * wrong type or an unavailable collaborator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class NodeExecutionException extends AutoflowException {

    private final String nodeId;
    private final boolean retryable;

    public NodeExecutionException(String nodeId, String message) {
        this(nodeId, message, true);
    }

    public NodeExecutionException(String nodeId, String message, boolean retryable) {
        super(message);
        this.nodeId = nodeId;
        this.retryable = retryable;
    }

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.retryable = !(cause instanceof AutoflowException) || ((AutoflowException) cause).isRetryable();
    }

    public String getNodeId() {
        return nodeId;
    }

    @Override
    public String getErrorCode() {
        return "NODE_EXECUTION_FAILED";
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
