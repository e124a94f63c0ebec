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

import java.time.Duration;

/**
 * Thrown when a single node attempt runs longer than the node's timeout.
 * The attempt counts against the node's own retry budget.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class ExecutionTimeoutException extends AutoflowException {

    private final String nodeId;
    private final Duration timeout;

    public ExecutionTimeoutException(String nodeId, Duration timeout) {
        super(String.format("Node '%s' timed out after %d ms", nodeId, timeout.toMillis()));
        this.nodeId = nodeId;
        this.timeout = timeout;
    }

    public String getNodeId() {
        return nodeId;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String getErrorCode() {
        return "EXECUTION_TIMEOUT";
    }
}
