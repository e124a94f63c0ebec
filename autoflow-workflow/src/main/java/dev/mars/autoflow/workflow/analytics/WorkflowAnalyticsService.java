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
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.exceptions.NotFoundException;
import dev.mars.autoflow.storage.AnalyticsRepository;
import dev.mars.autoflow.storage.ExecutionRepository;
import dev.mars.autoflow.storage.WorkflowRepository;
import dev.mars.autoflow.workflow.analytics.ErrorNormalizer.ErrorCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes execution and node statistics from execution history and maintains the
 * persisted daily, weekly and monthly rollups.
 *
 * <p>A range left null defaults to the configured number of days up to now. Null
 * durations are left out of the duration aggregates but still count towards the status
 * totals. An empty range yields zero counts and empty aggregates.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public class WorkflowAnalyticsService {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowAnalyticsService.class);

    private final WorkflowRepository workflows;
    private final ExecutionRepository executions;
    private final AnalyticsRepository rollups;
    private final Clock clock;
    private final int defaultRangeDays;
    private final int topErrors;

    public WorkflowAnalyticsService(WorkflowRepository workflows, ExecutionRepository executions,
                                    AnalyticsRepository rollups, AutoflowConfiguration config, Clock clock) {
        this.workflows = Objects.requireNonNull(workflows, "Workflow repository cannot be null");
        this.executions = Objects.requireNonNull(executions, "Execution repository cannot be null");
        this.rollups = Objects.requireNonNull(rollups, "Analytics repository cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.defaultRangeDays = config.getAnalyticsDefaultRangeDays();
        this.topErrors = config.getAnalyticsTopErrors();
    }

    public DateRange defaultRange() {
        return DateRange.lastDays(clock, defaultRangeDays);
    }

    /**
     * @throws NotFoundException if the workflow does not exist
     */
    public WorkflowAnalytics getWorkflowAnalytics(String workflowId, DateRange range, TrendGranularity granularity)
            throws NotFoundException {
        Workflow workflow = requireWorkflow(workflowId);
        DateRange effectiveRange = range != null ? range : defaultRange();
        TrendGranularity effectiveGranularity = granularity != null ? granularity : TrendGranularity.DAY;
        List<WorkflowExecution> inRange = executions.findByWorkflowBetween(
                workflowId, effectiveRange.from(), effectiveRange.to());

        Map<ExecutionStatus, Long> counts = countByStatus(inRange);
        List<Long> durations = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (WorkflowExecution execution : inRange) {
            durations.add(execution.getDurationMs());
            if (execution.getStatus() == ExecutionStatus.FAILED) {
                errors.add(execution.getError());
            }
        }

        return new WorkflowAnalytics(workflowId, workflow.getName(), effectiveRange, effectiveGranularity,
                inRange.size(), counts,
                Percentages.of(counts.get(ExecutionStatus.COMPLETED), inRange.size()),
                DurationStats.of(durations),
                ErrorNormalizer.topErrors(errors, topErrors),
                trends(inRange, effectiveRange, effectiveGranularity));
    }

    /**
     * Per-node statistics over the node executions of every execution in the range,
     * ordered like the workflow's nodes. Nodes no longer in the workflow are listed last.
     */
    public List<NodeAnalytics> getNodeAnalytics(String workflowId, DateRange range) throws NotFoundException {
        requireWorkflow(workflowId);
        DateRange effectiveRange = range != null ? range : defaultRange();

        Map<String, List<NodeExecution>> byNode = new LinkedHashMap<>();
        for (WorkflowNode node : workflows.findNodes(workflowId)) {
            byNode.put(node.nodeId(), new ArrayList<>());
        }
        for (WorkflowExecution execution : executions.findByWorkflowBetween(
                workflowId, effectiveRange.from(), effectiveRange.to())) {
            for (NodeExecution nodeExecution : executions.findNodeExecutions(execution.getId())) {
                byNode.computeIfAbsent(nodeExecution.getNodeId(), id -> new ArrayList<>()).add(nodeExecution);
            }
        }

        List<NodeAnalytics> result = new ArrayList<>();
        for (Map.Entry<String, List<NodeExecution>> entry : byNode.entrySet()) {
            result.add(nodeAnalytics(workflowId, entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private NodeAnalytics nodeAnalytics(String workflowId, String nodeId, List<NodeExecution> runs) {
        WorkflowNode node = workflows.findNode(workflowId, nodeId).orElse(null);
        NodeType type = node != null ? node.type() : runs.get(0).getNodeType();

        Map<NodeExecutionStatus, Long> counts = new EnumMap<>(NodeExecutionStatus.class);
        for (NodeExecutionStatus status : NodeExecutionStatus.values()) {
            counts.put(status, 0L);
        }
        List<Long> durations = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (NodeExecution run : runs) {
            counts.merge(run.getStatus(), 1L, Long::sum);
            durations.add(run.getDurationMs());
            if (run.getStatus() == NodeExecutionStatus.FAILED) {
                errors.add(run.getError());
            }
        }
        long completed = counts.get(NodeExecutionStatus.COMPLETED);
        long attempted = completed + counts.get(NodeExecutionStatus.FAILED);
        return new NodeAnalytics(nodeId, type, node != null ? node.displayName() : nodeId, runs.size(),
                Collections.unmodifiableMap(counts), Percentages.of(completed, attempted),
                DurationStats.of(durations), ErrorNormalizer.topErrors(errors, topErrors));
    }

    // ---------------------------------------------------------------- rollups

    /**
     * Recomputes and stores the rollup of the period containing {@code at}.
     */
    public WorkflowAnalyticsRollup rollup(String workflowId, RollupGranularity granularity, Instant at)
            throws NotFoundException {
        requireWorkflow(workflowId);
        Instant periodStart = granularity.periodStart(at);
        Instant periodEnd = granularity.periodEnd(periodStart);
        List<WorkflowExecution> inPeriod = executions.findByWorkflowBetween(workflowId, periodStart, periodEnd);

        Map<ExecutionStatus, Long> counts = countByStatus(inPeriod);
        List<Long> durations = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (WorkflowExecution execution : inPeriod) {
            durations.add(execution.getDurationMs());
            if (execution.getStatus() == ExecutionStatus.FAILED) {
                errors.add(execution.getError());
            }
        }
        DurationStats stats = DurationStats.of(durations);
        List<String> commonErrors = new ArrayList<>();
        for (ErrorCount error : ErrorNormalizer.topErrors(errors, topErrors)) {
            commonErrors.add(error.message());
        }

        WorkflowAnalyticsRollup rollup = rollups.upsertRollup(new WorkflowAnalyticsRollup(workflowId,
                periodStart, periodEnd, granularity, inPeriod.size(),
                counts.get(ExecutionStatus.COMPLETED), counts.get(ExecutionStatus.FAILED),
                counts.get(ExecutionStatus.CANCELLED), stats.averageMs(), stats.minMs(), stats.maxMs(),
                stats.p95Ms(), Percentages.of(counts.get(ExecutionStatus.FAILED), inPeriod.size()),
                commonErrors, clock.instant()));
        logger.debug("Rolled up {} {} from {}: {} executions", workflowId, granularity, periodStart, inPeriod.size());
        return rollup;
    }

    /**
     * Recomputes every period of the granularity that overlaps the range.
     */
    public List<WorkflowAnalyticsRollup> rollupRange(String workflowId, RollupGranularity granularity, DateRange range)
            throws NotFoundException {
        List<WorkflowAnalyticsRollup> result = new ArrayList<>();
        Instant periodStart = granularity.periodStart(range.from());
        while (periodStart.isBefore(range.to())) {
            result.add(rollup(workflowId, granularity, periodStart));
            periodStart = granularity.periodEnd(periodStart);
        }
        return result;
    }

    /**
     * Stored rollups whose period starts within the range; nothing is recomputed.
     */
    public List<WorkflowAnalyticsRollup> getStoredAnalytics(String workflowId, RollupGranularity granularity,
                                                            DateRange range) throws NotFoundException {
        requireWorkflow(workflowId);
        DateRange effectiveRange = range != null ? range : defaultRange();
        return rollups.findRollups(workflowId, granularity, effectiveRange.from(), effectiveRange.to());
    }

    // ---------------------------------------------------------------- helpers

    private Workflow requireWorkflow(String workflowId) throws NotFoundException {
        return workflows.findWorkflow(workflowId).orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    private static Map<ExecutionStatus, Long> countByStatus(List<WorkflowExecution> list) {
        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        for (ExecutionStatus status : ExecutionStatus.values()) {
            counts.put(status, 0L);
        }
        for (WorkflowExecution execution : list) {
            counts.merge(execution.getStatus(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    private static List<TrendPoint> trends(List<WorkflowExecution> list, DateRange range, TrendGranularity granularity) {
        Map<Instant, long[]> buckets = new LinkedHashMap<>();
        Instant bucket = granularity.bucketStart(range.from());
        while (bucket.isBefore(range.to())) {
            buckets.put(bucket, new long[4]);
            bucket = granularity.nextBucket(bucket);
        }
        for (WorkflowExecution execution : list) {
            long[] counts = buckets.computeIfAbsent(granularity.bucketStart(execution.getCreatedAt()), b -> new long[4]);
            counts[0]++;
            switch (execution.getStatus()) {
                case COMPLETED:
                    counts[1]++;
                    break;
                case FAILED:
                    counts[2]++;
                    break;
                case CANCELLED:
                    counts[3]++;
                    break;
                default:
                    break;
            }
        }
        List<TrendPoint> points = new ArrayList<>();
        buckets.forEach((start, counts) -> points.add(
                new TrendPoint(start, counts[0], counts[1], counts[2], counts[3], Percentages.of(counts[1], counts[0]))));
        return points;
    }
}
