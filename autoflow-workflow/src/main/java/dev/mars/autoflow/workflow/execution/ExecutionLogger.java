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

import dev.mars.autoflow.core.ExecutionLogEntry;
import dev.mars.autoflow.core.LogLevel;
import dev.mars.autoflow.storage.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Writes execution-scoped events both to the execution's stored log and to SLF4J.
 */
public class ExecutionLogger {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionLogger.class);

    static final String SOURCE = "orchestrator";

    private final ExecutionRepository repository;
    private final Clock clock;

    public ExecutionLogger(ExecutionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void execution(String executionId, LogLevel level, String message, Map<String, Object> details) {
        append(executionId, null, level, message, details, "execution");
    }

    public void node(String executionId, String nodeId, LogLevel level, String message, Map<String, Object> details) {
        append(executionId, nodeId, level, message, details, "node");
    }

    private void append(String executionId, String nodeId, LogLevel level, String message,
                        Map<String, Object> details, String category) {
        repository.appendLog(new ExecutionLogEntry(UUID.randomUUID().toString(), executionId, nodeId, level,
                message, details, SOURCE, category, clock.instant()));
        String prefix = nodeId == null ? "[" + executionId + "] " : "[" + executionId + "/" + nodeId + "] ";
        switch (level) {
            case DEBUG:
                logger.debug("{}{}", prefix, message);
                break;
            case INFO:
                logger.info("{}{}", prefix, message);
                break;
            case WARN:
                logger.warn("{}{}", prefix, message);
                break;
            case ERROR:
            case FATAL:
                logger.error("{}{}", prefix, message);
                break;
            default:
                throw new IllegalStateException("Unhandled log level " + level);
        }
    }
}
