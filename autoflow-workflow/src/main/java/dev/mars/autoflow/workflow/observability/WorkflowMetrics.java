package dev.mars.autoflow.workflow.observability;

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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OpenTelemetry metrics for the execution engine.
 *
 * Provides:
 * - autoflow.execution.active (gauge) - Executions currently RUNNING or PAUSED
 * - autoflow.execution.started (counter) - Executions that started running
 * - autoflow.execution.completed (counter) - Executions that completed
 * - autoflow.execution.failed (counter) - Executions that failed
 * - autoflow.execution.cancelled (counter) - Executions that were cancelled
 * - autoflow.node.executed (counter) - Node attempts, by node type
 * - autoflow.node.failed (counter) - Failed node attempts, by node type
 * - autoflow.execution.duration.seconds (histogram) - Execution duration distribution
 *
 * Without an installed SDK the global no-op meter is used.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "autoflow-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter executionsStarted;
    private final LongCounter executionsCompleted;
    private final LongCounter executionsFailed;
    private final LongCounter executionsCancelled;
    private final LongCounter nodesExecuted;
    private final LongCounter nodesFailed;
    private final DoubleHistogram executionDuration;

    private final Set<String> activeExecutions = ConcurrentHashMap.newKeySet();

    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> NODE_TYPE_KEY = AttributeKey.stringKey("node.type");
    private static final AttributeKey<String> ERROR_CODE_KEY = AttributeKey.stringKey("error.code");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        executionsStarted = meter.counterBuilder("autoflow.execution.started")
                .setDescription("Number of executions that started running")
                .setUnit("1")
                .build();

        executionsCompleted = meter.counterBuilder("autoflow.execution.completed")
                .setDescription("Number of completed executions")
                .setUnit("1")
                .build();

        executionsFailed = meter.counterBuilder("autoflow.execution.failed")
                .setDescription("Number of failed executions")
                .setUnit("1")
                .build();

        executionsCancelled = meter.counterBuilder("autoflow.execution.cancelled")
                .setDescription("Number of cancelled executions")
                .setUnit("1")
                .build();

        nodesExecuted = meter.counterBuilder("autoflow.node.executed")
                .setDescription("Number of node attempts")
                .setUnit("1")
                .build();

        nodesFailed = meter.counterBuilder("autoflow.node.failed")
                .setDescription("Number of failed node attempts")
                .setUnit("1")
                .build();

        executionDuration = meter.histogramBuilder("autoflow.execution.duration.seconds")
                .setDescription("Execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("autoflow.execution.active")
                .setDescription("Number of executions currently running or paused")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeExecutions.size()));

        logger.info("WorkflowMetrics initialized");
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    /**
     * Records an execution entering RUNNING. Repeated calls for the same execution,
     * as after a resume, count once while it stays active.
     */
    public void recordExecutionStarted(String workflowId, String executionId) {
        if (activeExecutions.add(executionId)) {
            executionsStarted.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
        }
    }

    public void recordExecutionCompleted(String workflowId, String executionId, Long durationMs) {
        activeExecutions.remove(executionId);
        Attributes attrs = Attributes.of(WORKFLOW_ID_KEY, workflowId);
        executionsCompleted.add(1, attrs);
        if (durationMs != null) {
            executionDuration.record(durationMs / 1000.0, attrs);
        }
    }

    public void recordExecutionFailed(String workflowId, String executionId, String errorCode) {
        activeExecutions.remove(executionId);
        executionsFailed.add(1, Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(ERROR_CODE_KEY, errorCode != null ? errorCode : "unknown")
                .build());
    }

    public void recordExecutionCancelled(String workflowId, String executionId) {
        activeExecutions.remove(executionId);
        executionsCancelled.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
    }

    public void recordNodeExecuted(String workflowId, String nodeType) {
        nodesExecuted.add(1, Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(NODE_TYPE_KEY, nodeType)
                .build());
    }

    public void recordNodeFailed(String workflowId, String nodeType, String errorCode) {
        nodesFailed.add(1, Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(NODE_TYPE_KEY, nodeType)
                .put(ERROR_CODE_KEY, errorCode != null ? errorCode : "unknown")
                .build());
    }

    public long getActiveExecutions() {
        return activeExecutions.size();
    }
}
