package dev.mars.autoflow.workflow.analytics;

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

import dev.mars.autoflow.config.AutoflowConfiguration;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.NodeExecution;
import dev.mars.autoflow.core.NodeExecutionStatus;
import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.RollupGranularity;
import dev.mars.autoflow.core.Workflow;
import dev.mars.autoflow.core.WorkflowAnalyticsRollup;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowStatus;
import dev.mars.autoflow.core.exceptions.NotFoundException;
import dev.mars.autoflow.storage.memory.InMemoryAnalyticsRepository;
import dev.mars.autoflow.storage.memory.InMemoryExecutionRepository;
import dev.mars.autoflow.storage.memory.InMemoryWorkflowRepository;
import dev.mars.autoflow.workflow.analytics.ErrorNormalizer.ErrorCount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static dev.mars.autoflow.workflow.WorkflowTestSupport.FIXED_CLOCK;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.ORGANIZATION_ID;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.WORKFLOW_ID;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.node;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowAnalyticsServiceTest {

    private static final DateRange THREE_DAYS = new DateRange(
            Instant.parse("2025-11-08T00:00:00Z"), Instant.parse("2025-11-11T00:00:00Z"));

    private InMemoryWorkflowRepository workflows;
    private InMemoryExecutionRepository executions;
    private InMemoryAnalyticsRepository rollups;
    private WorkflowAnalyticsService service;

    @BeforeEach
    void setUp() {
        workflows = new InMemoryWorkflowRepository();
        executions = new InMemoryExecutionRepository();
        rollups = new InMemoryAnalyticsRepository();
        service = new WorkflowAnalyticsService(workflows, executions, rollups, new AutoflowConfiguration(), FIXED_CLOCK);

        workflows.saveWorkflow(Workflow.builder()
                .id(WORKFLOW_ID)
                .organizationId(ORGANIZATION_ID)
                .name("Welcome series")
                .status(WorkflowStatus.ACTIVE)
                .build());
        workflows.saveNode(trigger("start"));
        workflows.saveNode(node("send", NodeType.ACTION, Map.of()));

        execution("e0", "2025-11-01T12:00:00Z", ExecutionStatus.COMPLETED, 999L, null);
        execution("e1", "2025-11-08T10:00:00Z", ExecutionStatus.COMPLETED, 10L, null);
        execution("e2", "2025-11-09T10:00:00Z", ExecutionStatus.COMPLETED, 20L, null);
        execution("e3", "2025-11-10T08:00:00Z", ExecutionStatus.FAILED, 30L, "Timeout after 3000 ms");
        execution("e4", "2025-11-10T08:30:00Z", ExecutionStatus.RUNNING, null, null);
        execution("e5", "2025-11-10T08:45:00Z", ExecutionStatus.FAILED, 40L, "Timeout after 5000 ms");
    }

    @Test
    void workflowAnalyticsCountsEveryExecutionInRange() throws Exception {
        WorkflowAnalytics analytics = service.getWorkflowAnalytics(WORKFLOW_ID, THREE_DAYS, TrendGranularity.DAY);

        assertThat(analytics.workflowName()).isEqualTo("Welcome series");
        assertThat(analytics.totalExecutions()).isEqualTo(5);
        assertThat(analytics.count(ExecutionStatus.COMPLETED)).isEqualTo(2);
        assertThat(analytics.count(ExecutionStatus.FAILED)).isEqualTo(2);
        assertThat(analytics.count(ExecutionStatus.RUNNING)).isEqualTo(1);
        assertThat(analytics.count(ExecutionStatus.CANCELLED)).isZero();
        assertThat(analytics.successRate()).isEqualTo(40.0);
    }

    @Test
    void durationsSkipExecutionsStillRunning() throws Exception {
        DurationStats durations = service.getWorkflowAnalytics(WORKFLOW_ID, THREE_DAYS, null).durations();

        assertThat(durations.count()).isEqualTo(4);
        assertThat(durations.averageMs()).isEqualTo(25.0);
        assertThat(durations.minMs()).isEqualTo(10L);
        assertThat(durations.maxMs()).isEqualTo(40L);
        assertThat(durations.p95Ms()).isEqualTo(40L);
    }

    @Test
    void similarErrorsAreGrouped() throws Exception {
        List<ErrorCount> errors = service.getWorkflowAnalytics(WORKFLOW_ID, THREE_DAYS, null).topErrors();

        assertThat(errors).containsExactly(new ErrorCount("Timeout after <n> ms", 2));
    }

    @Test
    void dailyTrendHasABucketForEveryDay() throws Exception {
        List<TrendPoint> trends = service.getWorkflowAnalytics(WORKFLOW_ID, THREE_DAYS, TrendGranularity.DAY).trends();

        assertThat(trends).containsExactly(
                new TrendPoint(Instant.parse("2025-11-08T00:00:00Z"), 1, 1, 0, 0, 100.0),
                new TrendPoint(Instant.parse("2025-11-09T00:00:00Z"), 1, 1, 0, 0, 100.0),
                new TrendPoint(Instant.parse("2025-11-10T00:00:00Z"), 3, 0, 2, 0, 0.0));
    }

    @Test
    void emptyRangeHasZeroCountsAndEmptyBuckets() throws Exception {
        DateRange quiet = new DateRange(Instant.parse("2025-10-01T00:00:00Z"), Instant.parse("2025-10-01T03:00:00Z"));

        WorkflowAnalytics analytics = service.getWorkflowAnalytics(WORKFLOW_ID, quiet, TrendGranularity.HOUR);

        assertThat(analytics.totalExecutions()).isZero();
        assertThat(analytics.successRate()).isZero();
        assertThat(analytics.durations()).isEqualTo(DurationStats.EMPTY);
        assertThat(analytics.topErrors()).isEmpty();
        assertThat(analytics.trends()).hasSize(3).allSatisfy(point -> assertThat(point.total()).isZero());
    }

    @Test
    void defaultRangeEndsNow() throws Exception {
        WorkflowAnalytics analytics = service.getWorkflowAnalytics(WORKFLOW_ID, null, null);

        assertThat(analytics.range().to()).isEqualTo(FIXED_CLOCK.instant());
        assertThat(analytics.granularity()).isEqualTo(TrendGranularity.DAY);
        assertThat(analytics.totalExecutions()).isEqualTo(6);
    }

    @Test
    void nodeAnalyticsFollowWorkflowOrderWithRemovedNodesLast() throws Exception {
        nodeRun("e1", "start", NodeType.TRIGGER, NodeExecutionStatus.COMPLETED, 1L, null);
        nodeRun("e1", "send", NodeType.ACTION, NodeExecutionStatus.COMPLETED, 5L, null);
        nodeRun("e2", "send", NodeType.ACTION, NodeExecutionStatus.SKIPPED, null, null);
        nodeRun("e2", "legacy", NodeType.DELAY, NodeExecutionStatus.COMPLETED, 2L, null);
        nodeRun("e3", "send", NodeType.ACTION, NodeExecutionStatus.FAILED, 15L, "SMTP server unavailable");

        List<NodeAnalytics> nodes = service.getNodeAnalytics(WORKFLOW_ID, THREE_DAYS);

        assertThat(nodes).extracting(NodeAnalytics::nodeId).containsExactly("send", "start", "legacy");
        NodeAnalytics send = nodes.get(0);
        assertThat(send.totalExecutions()).isEqualTo(3);
        assertThat(send.statusCounts()).containsEntry(NodeExecutionStatus.SKIPPED, 1L);
        assertThat(send.successRate()).isEqualTo(50.0);
        assertThat(send.durations().averageMs()).isEqualTo(10.0);
        assertThat(send.topErrors()).extracting(ErrorCount::message).containsExactly("SMTP server unavailable");
        assertThat(nodes.get(2).nodeType()).isEqualTo(NodeType.DELAY);
        assertThat(nodes.get(2).name()).isEqualTo("legacy");
    }

    @Test
    void dailyRollupIsStored() throws Exception {
        WorkflowAnalyticsRollup rollup = service.rollup(WORKFLOW_ID, RollupGranularity.DAILY,
                Instant.parse("2025-11-10T15:00:00Z"));

        assertThat(rollup.periodStart()).isEqualTo(Instant.parse("2025-11-10T00:00:00Z"));
        assertThat(rollup.periodEnd()).isEqualTo(Instant.parse("2025-11-11T00:00:00Z"));
        assertThat(rollup.totalExecutions()).isEqualTo(3);
        assertThat(rollup.successfulExecutions()).isZero();
        assertThat(rollup.failedExecutions()).isEqualTo(2);
        assertThat(rollup.errorRate()).isEqualTo(66.67);
        assertThat(rollup.averageDurationMs()).isEqualTo(35.0);
        assertThat(rollup.commonErrors()).containsExactly("Timeout after <n> ms");
        assertThat(rollup.computedAt()).isEqualTo(FIXED_CLOCK.instant());
    }

    @Test
    void rollupIsReplacedWhenRecomputed() throws Exception {
        Instant monday = Instant.parse("2025-11-10T00:00:00Z");
        service.rollup(WORKFLOW_ID, RollupGranularity.DAILY, monday);
        execution("e6", "2025-11-10T08:50:00Z", ExecutionStatus.CANCELLED, 5L, null);
        service.rollup(WORKFLOW_ID, RollupGranularity.DAILY, monday);

        List<WorkflowAnalyticsRollup> stored = service.getStoredAnalytics(WORKFLOW_ID, RollupGranularity.DAILY, THREE_DAYS);

        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).totalExecutions()).isEqualTo(4);
        assertThat(stored.get(0).cancelledExecutions()).isEqualTo(1);
    }

    @Test
    void weeklyRollupsCoverEveryOverlappingWeek() throws Exception {
        DateRange range = new DateRange(Instant.parse("2025-11-01T00:00:00Z"), Instant.parse("2025-11-11T00:00:00Z"));

        List<WorkflowAnalyticsRollup> weeks = service.rollupRange(WORKFLOW_ID, RollupGranularity.WEEKLY, range);

        assertThat(weeks).extracting(WorkflowAnalyticsRollup::periodStart).containsExactly(
                Instant.parse("2025-10-27T00:00:00Z"),
                Instant.parse("2025-11-03T00:00:00Z"),
                Instant.parse("2025-11-10T00:00:00Z"));
        assertThat(weeks).extracting(WorkflowAnalyticsRollup::totalExecutions).containsExactly(1L, 2L, 3L);
        assertThat(service.getStoredAnalytics(WORKFLOW_ID, RollupGranularity.WEEKLY,
                new DateRange(Instant.parse("2025-11-03T00:00:00Z"), Instant.parse("2025-11-11T00:00:00Z"))))
                .hasSize(2);
    }

    @Test
    void unknownWorkflowIsNotFound() {
        assertThatThrownBy(() -> service.getWorkflowAnalytics("missing", THREE_DAYS, null))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.rollup("missing", RollupGranularity.DAILY, Instant.EPOCH))
                .isInstanceOf(NotFoundException.class);
    }

    private void execution(String id, String createdAt, ExecutionStatus status, Long durationMs, String error) {
        executions.save(WorkflowExecution.builder()
                .id(id)
                .workflowId(WORKFLOW_ID)
                .organizationId(ORGANIZATION_ID)
                .status(status)
                .createdAt(Instant.parse(createdAt))
                .durationMs(durationMs)
                .error(error)
                .build());
    }

    private void nodeRun(String executionId, String nodeId, NodeType type, NodeExecutionStatus status,
                         Long durationMs, String error) {
        executions.saveNodeExecution(NodeExecution.builder()
                .id(executionId + ":" + nodeId)
                .executionId(executionId)
                .nodeId(nodeId)
                .nodeType(type)
                .status(status)
                .durationMs(durationMs)
                .error(error)
                .build());
    }
}
