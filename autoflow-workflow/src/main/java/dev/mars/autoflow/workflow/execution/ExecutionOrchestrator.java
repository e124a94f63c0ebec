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

import dev.mars.autoflow.config.AutoflowConfiguration;
import dev.mars.autoflow.core.BulkExecutionAction;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.GraphSnapshot;
import dev.mars.autoflow.core.LogLevel;
import dev.mars.autoflow.core.NodeExecution;
import dev.mars.autoflow.core.NodeExecutionStatus;
import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.Workflow;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.ExecutionTimeoutException;
import dev.mars.autoflow.core.exceptions.InvalidTransitionException;
import dev.mars.autoflow.core.exceptions.NodeExecutionException;
import dev.mars.autoflow.core.exceptions.NotFoundException;
import dev.mars.autoflow.core.exceptions.RetryLimitExceededException;
import dev.mars.autoflow.core.exceptions.ValidationException;
import dev.mars.autoflow.storage.ExecutionRepository;
import dev.mars.autoflow.storage.WorkflowRepository;
import dev.mars.autoflow.workflow.condition.ConditionEvaluator;
import dev.mars.autoflow.workflow.graph.WorkflowGraph;
import dev.mars.autoflow.workflow.node.LoopBodyRunner;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeHandlerRegistry;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.observability.WorkflowMetrics;
import dev.mars.autoflow.workflow.validation.NodeConfigValidator;
import dev.mars.autoflow.workflow.variable.ExecutionVariables;
import dev.mars.autoflow.workflow.variable.VariableScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives executions through their state machine.
 *
 * <p>Creating an execution only persists it (PENDING, with one PENDING node execution
 * per node) and queues it; workers advance it asynchronously. A worker walks the
 * execution's graph snapshot in topological order and runs one node at a time:
 * <ul>
 *   <li>a node runs once every predecessor is settled and at least one incoming edge
 *       is active; a node without an active incoming edge is SKIPPED</li>
 *   <li>an edge is active when its source COMPLETED (or failed while optional), the
 *       source selected it, and the edge's own conditions hold</li>
 *   <li>a WAITING node, or a node waiting out its retry backoff, releases the worker
 *       and a wake-up is scheduled for its due time</li>
 *   <li>loop body nodes are run by their LOOP node, once per iteration, and settled
 *       together when the loop settles</li>
 * </ul>
 * Only one worker advances a given execution at a time. Every state change happens
 * under the execution's lock after re-reading the stored execution, so cancel, pause
 * and resume requests from other threads are seen between node steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ExecutionOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    private final WorkflowRepository workflows;
    private final ExecutionRepository executions;
    private final NodeHandlerRegistry handlers;
    private final NodeConfigValidator validator;
    private final AutoflowConfiguration config;
    private final Clock clock;
    private final ExecutionLogger executionLog;
    private final WorkflowMetrics metrics;
    private final ExecutionWorkerPool pool;

    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    // execution id -> another advance was requested while a worker held the execution
    private final Map<String, Boolean> advancing = new HashMap<>();

    public ExecutionOrchestrator(WorkflowRepository workflows, ExecutionRepository executions,
                                 NodeHandlerRegistry handlers, AutoflowConfiguration config, Clock clock) {
        this.workflows = Objects.requireNonNull(workflows, "Workflow repository cannot be null");
        this.executions = Objects.requireNonNull(executions, "Execution repository cannot be null");
        this.handlers = Objects.requireNonNull(handlers, "Handler registry cannot be null");
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.validator = new NodeConfigValidator(handlers);
        this.executionLog = new ExecutionLogger(executions, clock);
        this.metrics = config.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
        this.pool = new ExecutionWorkerPool(config, clock, this::advance);
    }

    // ---------------------------------------------------------------- creation

    /**
     * Creates a PENDING execution of the workflow and queues it.
     *
     * @throws NotFoundException   if the workflow does not exist
     * @throws ValidationException if the workflow does not accept executions, its graph or
     *                             node configuration is invalid, or a variable has the wrong type
     */
    public WorkflowExecution start(ExecutionRequest request) throws AutoflowException {
        Workflow workflow = workflows.findWorkflow(request.getWorkflowId())
                .orElseThrow(() -> new NotFoundException("Workflow", request.getWorkflowId()));
        if (!workflow.getStatus().acceptsExecutions()) {
            throw new ValidationException(String.format("Workflow '%s' is %s and does not accept executions",
                    workflow.getId(), workflow.getStatus()));
        }

        GraphSnapshot graph = workflows.findGraph(workflow.getId());
        List<WorkflowNode> nodes = graph.nodes();
        List<WorkflowConnection> connections = graph.connections();
        if (nodes.isEmpty()) {
            throw new ValidationException("Workflow '" + workflow.getId() + "' has no nodes");
        }
        validator.requireValid(nodes, connections);
        List<String> inputErrors = validateInputs(request.getVariables());
        if (!inputErrors.isEmpty()) {
            throw new ValidationException("Invalid execution variables", inputErrors);
        }

        Instant now = clock.instant();
        String id = UUID.randomUUID().toString();
        WorkflowExecution execution = executions.save(WorkflowExecution.builder()
                .id(id)
                .executionId("exec-" + id.substring(0, 8))
                .workflowId(workflow.getId())
                .organizationId(workflow.getOrganizationId())
                .triggerId(request.getTriggerId())
                .status(ExecutionStatus.PENDING)
                .priority(request.getPriority())
                .triggerData(request.getTriggerData())
                .maxRetries(config.getExecutionMaxRetries())
                .createdAt(now)
                .snapshot(graph)
                .build());
        for (WorkflowNode node : nodes) {
            executions.saveNodeExecution(NodeExecution.builder()
                    .id(UUID.randomUUID().toString())
                    .executionId(id)
                    .nodeId(node.nodeId())
                    .nodeType(node.type())
                    .executionOrder(node.executionOrder())
                    .status(NodeExecutionStatus.PENDING)
                    .maxRetries(node.retryLimit())
                    .build());
        }
        bindVariables(execution, request);
        workflows.updateWorkflow(workflow.getId(), current -> current.recordStart(now));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("workflowId", workflow.getId());
        details.put("triggerId", request.getTriggerId());
        details.put("nodes", nodes.size());
        executionLog.execution(id, LogLevel.INFO, "Execution created", details);

        if (request.getStartDelay().isZero()) {
            pool.submit(id);
        } else {
            pool.schedule(id, request.getStartDelay());
        }
        return execution;
    }

    private static List<String> validateInputs(List<VariableInput> inputs) {
        List<String> errors = new ArrayList<>();
        for (VariableInput input : inputs) {
            if (input.name().isBlank()) {
                errors.add("variable name cannot be blank");
            } else if (input.dataType() != null && !input.dataType().accepts(input.value())) {
                errors.add(String.format("variable '%s' is not a valid %s", input.name(), input.dataType()));
            }
        }
        return errors;
    }

    private void bindVariables(WorkflowExecution execution, ExecutionRequest request) {
        VariableScope variables = variables(execution.getId());
        if (!request.getTriggerData().isEmpty()) {
            variables.set("trigger", request.getTriggerData(), "trigger");
            request.getTriggerData().forEach((name, value) -> variables.set(name, value, "trigger"));
        }
        for (VariableInput input : request.getVariables()) {
            if (input.dataType() == null) {
                variables.set(input.name(), input.value(), "input");
            } else {
                variables.set(input.name(), input.value(), input.dataType(), "input");
            }
        }
    }

    // ---------------------------------------------------------------- control

    public Optional<WorkflowExecution> findExecution(String executionId) {
        return executions.findById(executionId);
    }

    /**
     * Cancels an execution that has not reached a terminal state. Nodes that have not
     * settled are marked CANCELLED; a node that is running finishes, but its result is discarded.
     */
    public WorkflowExecution cancel(String executionId) throws NotFoundException, InvalidTransitionException {
        WorkflowExecution cancelled;
        synchronized (lock(executionId)) {
            WorkflowExecution execution = load(executionId);
            requireTransition(execution, ExecutionStatus.CANCELLED);
            Instant now = clock.instant();
            cancelUnsettledNodes(executionId, now);
            cancelled = executions.save(execution.toBuilder()
                    .status(ExecutionStatus.CANCELLED)
                    .completedAt(now)
                    .durationMs(execution.elapsedMs(now))
                    .currentNodeId(null)
                    .build());
        }
        pool.cancelWakeup(executionId);
        if (metrics != null) {
            metrics.recordExecutionCancelled(cancelled.getWorkflowId(), executionId);
        }
        executionLog.execution(executionId, LogLevel.INFO, "Execution cancelled", null);
        return cancelled;
    }

    /**
     * Stops a running execution after its current node step.
     */
    public WorkflowExecution pause(String executionId) throws NotFoundException, InvalidTransitionException {
        WorkflowExecution paused;
        synchronized (lock(executionId)) {
            WorkflowExecution execution = load(executionId);
            requireTransition(execution, ExecutionStatus.PAUSED);
            paused = executions.save(execution.toBuilder().status(ExecutionStatus.PAUSED).build());
        }
        executionLog.execution(executionId, LogLevel.INFO, "Execution paused", null);
        return paused;
    }

    public WorkflowExecution resume(String executionId) throws NotFoundException, InvalidTransitionException {
        WorkflowExecution resumed;
        synchronized (lock(executionId)) {
            WorkflowExecution execution = load(executionId);
            if (execution.getStatus() != ExecutionStatus.PAUSED) {
                throw new InvalidTransitionException(executionId, execution.getStatus(), ExecutionStatus.RUNNING,
                        execution.getStatus().getValidTransitions());
            }
            resumed = executions.save(execution.toBuilder().status(ExecutionStatus.RUNNING).build());
        }
        executionLog.execution(executionId, LogLevel.INFO, "Execution resumed", null);
        pool.submit(executionId);
        return resumed;
    }

    /**
     * Re-queues a FAILED execution. Completed nodes keep their results and are not run
     * again; every other node is reset to PENDING with a fresh retry budget.
     *
     * @throws InvalidTransitionException  unless the execution is FAILED
     * @throws RetryLimitExceededException if the execution has used all its retries
     */
    public WorkflowExecution retry(String executionId) throws AutoflowException {
        WorkflowExecution retried;
        synchronized (lock(executionId)) {
            WorkflowExecution execution = load(executionId);
            requireTransition(execution, ExecutionStatus.PENDING);
            if (!execution.canRetry()) {
                throw new RetryLimitExceededException(executionId, execution.getRetryCount(), execution.getMaxRetries());
            }
            for (NodeExecution state : executions.findNodeExecutions(executionId)) {
                if (state.getStatus() != NodeExecutionStatus.COMPLETED && state.getStatus() != NodeExecutionStatus.PENDING) {
                    executions.saveNodeExecution(transition(state, NodeExecutionStatus.PENDING)
                            .retryCount(0)
                            .startedAt(null)
                            .completedAt(null)
                            .resumeAt(null)
                            .durationMs(null)
                            .output(null)
                            .error(null)
                            .activeEdges(null)
                            .build());
                }
            }
            retried = executions.save(execution.toBuilder()
                    .status(ExecutionStatus.PENDING)
                    .retryCount(execution.getRetryCount() + 1)
                    .progress(0)
                    .error(null)
                    .errorDetails(null)
                    .failedAt(null)
                    .completedAt(null)
                    .durationMs(null)
                    .currentNodeId(null)
                    .build());
        }
        executionLog.execution(executionId, LogLevel.INFO,
                "Execution retry " + retried.getRetryCount() + " of " + retried.getMaxRetries(), null);
        pool.submit(executionId);
        return retried;
    }

    /**
     * Applies an action to each execution independently and reports the outcome per id.
     */
    public List<BulkActionResult> bulkUpdate(Collection<String> executionIds, BulkExecutionAction action) {
        List<BulkActionResult> results = new ArrayList<>();
        for (String executionId : executionIds) {
            try {
                WorkflowExecution updated;
                switch (action) {
                    case CANCEL:
                        updated = cancel(executionId);
                        break;
                    case PAUSE:
                        updated = pause(executionId);
                        break;
                    case RESUME:
                        updated = resume(executionId);
                        break;
                    default:
                        throw new IllegalStateException("Unhandled bulk action " + action);
                }
                results.add(BulkActionResult.applied(executionId, action, updated.getStatus()));
            } catch (AutoflowException e) {
                ExecutionStatus current = executions.findById(executionId).map(WorkflowExecution::getStatus).orElse(null);
                results.add(BulkActionResult.rejected(executionId, action, current, e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Re-queues executions left PENDING or RUNNING, for example by a restart. Their
     * WAITING nodes re-arm their wake-ups when the execution is advanced.
     *
     * @return the number of executions queued
     */
    public int recover() {
        List<WorkflowExecution> unfinished = executions.findByStatus(
                EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING));
        unfinished.forEach(execution -> pool.submit(execution.getId()));
        logger.info("Recovered {} unfinished executions", unfinished.size());
        return unfinished.size();
    }

    @Override
    public void close() {
        pool.close();
    }

    // ---------------------------------------------------------------- advancing

    /**
     * Entry point of the worker pool. A call for an execution another worker is
     * advancing is folded into that worker's run.
     */
    void advance(String executionId) {
        synchronized (advancing) {
            if (advancing.containsKey(executionId)) {
                advancing.put(executionId, Boolean.TRUE);
                return;
            }
            advancing.put(executionId, Boolean.FALSE);
        }
        boolean again;
        do {
            try {
                drive(executionId);
            } catch (RuntimeException e) {
                logger.error("Unexpected error advancing execution {}", executionId, e);
                failExecution(executionId, null, "INTERNAL_ERROR", "Unexpected error: " + e.getMessage());
            }
            synchronized (advancing) {
                again = advancing.get(executionId);
                if (again) {
                    advancing.put(executionId, Boolean.FALSE);
                } else {
                    advancing.remove(executionId);
                }
            }
        } while (again);
    }

    private void drive(String executionId) {
        WorkflowExecution execution = begin(executionId);
        if (execution == null) {
            return;
        }
        WorkflowGraph graph;
        try {
            graph = WorkflowGraph.of(execution.getSnapshot());
        } catch (ValidationException e) {
            failExecution(executionId, null, e.getErrorCode(), e.getMessage());
            return;
        }
        VariableScope variables = variables(executionId);

        while (isRunning(executionId)) {
            Map<String, NodeExecution> states = nodeStates(executionId);
            Step step = nextStep(graph, states, variables);
            switch (step.kind) {
                case RUN:
                    runNode(executionId, graph, graph.node(step.nodeId), variables);
                    break;
                case SETTLE:
                    settle(executionId, states.get(step.nodeId), step.status);
                    break;
                case WAIT:
                    pool.scheduleAt(executionId, step.dueAt);
                    return;
                case FAIL:
                    NodeExecution failed = states.get(step.nodeId);
                    failExecution(executionId, graph.node(step.nodeId), "NODE_EXECUTION_FAILED", failed.getError());
                    return;
                case STALLED:
                    failExecution(executionId, null, "INTERNAL_ERROR",
                            "Execution cannot make progress; unsettled nodes: " + step.nodeId);
                    return;
                case DONE:
                    completeExecution(executionId);
                    return;
                default:
                    throw new IllegalStateException("Unhandled step " + step.kind);
            }
        }
    }

    /**
     * Moves a PENDING execution to RUNNING.
     *
     * @return the running execution, or null if there is nothing to advance
     */
    private WorkflowExecution begin(String executionId) {
        WorkflowExecution started;
        synchronized (lock(executionId)) {
            Optional<WorkflowExecution> found = executions.findById(executionId);
            if (found.isEmpty()) {
                logger.warn("Execution {} no longer exists", executionId);
                return null;
            }
            WorkflowExecution execution = found.get();
            if (execution.getStatus() == ExecutionStatus.RUNNING) {
                return execution;
            }
            if (execution.getStatus() != ExecutionStatus.PENDING) {
                logger.debug("Execution {} is {}, nothing to advance", executionId, execution.getStatus());
                return null;
            }
            started = executions.save(execution.toBuilder()
                    .status(ExecutionStatus.RUNNING)
                    .startedAt(clock.instant())
                    .build());
        }
        if (metrics != null) {
            metrics.recordExecutionStarted(started.getWorkflowId(), executionId);
        }
        executionLog.execution(executionId, LogLevel.INFO, "Execution started", null);
        return started;
    }

    private Step nextStep(WorkflowGraph graph, Map<String, NodeExecution> states, VariableScope variables) {
        Instant now = clock.instant();
        Instant earliest = null;
        List<String> blocked = new ArrayList<>();
        for (String nodeId : graph.topologicalOrder()) {
            NodeExecution state = states.get(nodeId);
            NodeExecutionStatus status = state.getStatus();
            if (status == NodeExecutionStatus.FAILED && !graph.node(nodeId).optional()) {
                return Step.of(StepKind.FAIL, nodeId);
            }
            if (status.isSettled()) {
                continue;
            }

            Optional<String> loop = graph.enclosingLoop(nodeId);
            if (loop.isPresent()) {
                NodeExecution loopState = states.get(loop.get());
                if (loopState.getStatus().isSettled()) {
                    return Step.settle(nodeId, bodyOutcome(loopState));
                }
                blocked.add(nodeId);
                continue;
            }

            boolean suspended = status == NodeExecutionStatus.WAITING
                    || (status == NodeExecutionStatus.PENDING && state.getResumeAt() != null);
            if (suspended) {
                Instant dueAt = state.getResumeAt() != null ? state.getResumeAt() : now;
                if (!dueAt.isAfter(now)) {
                    return status == NodeExecutionStatus.WAITING
                            ? Step.settle(nodeId, NodeExecutionStatus.COMPLETED)
                            : Step.of(StepKind.RUN, nodeId);
                }
                earliest = earliest == null || dueAt.isBefore(earliest) ? dueAt : earliest;
                continue;
            }

            Readiness readiness = readiness(graph, nodeId, states, variables);
            if (readiness == Readiness.ACTIVE) {
                return Step.of(StepKind.RUN, nodeId);
            }
            if (readiness == Readiness.INACTIVE) {
                return Step.settle(nodeId, NodeExecutionStatus.SKIPPED);
            }
            blocked.add(nodeId);
        }
        if (earliest != null) {
            return Step.waitUntil(earliest);
        }
        return blocked.isEmpty() ? Step.of(StepKind.DONE, null) : Step.of(StepKind.STALLED, blocked.toString());
    }

    private static NodeExecutionStatus bodyOutcome(NodeExecution loopState) {
        Object iterations = loopState.getOutput().get("iterations");
        boolean ran = loopState.getStatus() == NodeExecutionStatus.COMPLETED
                && iterations instanceof Number count && count.intValue() > 0;
        return ran ? NodeExecutionStatus.COMPLETED : NodeExecutionStatus.SKIPPED;
    }

    private Readiness readiness(WorkflowGraph graph, String nodeId, Map<String, NodeExecution> states,
                                VariableScope variables) {
        List<WorkflowConnection> incoming = graph.incoming(nodeId);
        if (incoming.isEmpty()) {
            return Readiness.ACTIVE;
        }
        boolean active = false;
        for (WorkflowConnection edge : incoming) {
            NodeExecution source = states.get(edge.sourceNodeId());
            if (!source.getStatus().isSettled()) {
                return Readiness.NOT_READY;
            }
            if (edgeActive(graph, edge, source, variables)) {
                active = true;
            }
        }
        return active ? Readiness.ACTIVE : Readiness.INACTIVE;
    }

    private static boolean edgeActive(WorkflowGraph graph, WorkflowConnection edge, NodeExecution source,
                                      VariableScope variables) {
        boolean sourcePassed = source.getStatus() == NodeExecutionStatus.COMPLETED
                || (source.getStatus() == NodeExecutionStatus.FAILED && graph.node(edge.sourceNodeId()).optional());
        return sourcePassed && source.follows(edge.edgeId())
                && ConditionEvaluator.evaluate(edge.conditions(), variables::resolve);
    }

    // ---------------------------------------------------------------- node steps

    private void runNode(String executionId, WorkflowGraph graph, WorkflowNode node, VariableScope variables) {
        while (true) {
            NodeExecution attempt = markRunning(executionId, node);
            if (attempt == null) {
                return;
            }
            WorkflowExecution execution = executions.findById(executionId).orElse(null);
            if (execution == null) {
                return;
            }
            if (metrics != null) {
                metrics.recordNodeExecuted(execution.getWorkflowId(), node.type().name());
            }

            NodeResult result;
            try {
                result = invoke(execution, graph, node, attempt, variables, List.of());
            } catch (AutoflowException e) {
                if (metrics != null) {
                    metrics.recordNodeFailed(execution.getWorkflowId(), node.type().name(), e.getErrorCode());
                }
                if (handleNodeFailure(executionId, node, e)) {
                    continue;
                }
                return;
            }
            recordResult(executionId, node, result, variables);
            return;
        }
    }

    private NodeExecution markRunning(String executionId, WorkflowNode node) {
        synchronized (lock(executionId)) {
            Optional<WorkflowExecution> execution = executions.findById(executionId);
            if (execution.isEmpty() || execution.get().getStatus() != ExecutionStatus.RUNNING) {
                return null;
            }
            NodeExecution state = nodeState(executionId, node.nodeId());
            NodeExecution running = executions.saveNodeExecution(transition(state, NodeExecutionStatus.RUNNING)
                    .startedAt(state.getStartedAt() != null ? state.getStartedAt() : clock.instant())
                    .resumeAt(null)
                    .input(node.config())
                    .build());
            executions.save(execution.get().toBuilder().currentNodeId(node.nodeId()).build());
            executionLog.node(executionId, node.nodeId(), LogLevel.DEBUG,
                    "Node " + node.displayName() + " started, attempt " + (running.getRetryCount() + 1), null);
            return running;
        }
    }

    /**
     * Runs a handler on the handler pool, bounded by the node's timeout.
     */
    private NodeResult invoke(WorkflowExecution execution, WorkflowGraph graph, WorkflowNode node,
                              NodeExecution nodeExecution, VariableScope scope, List<Integer> iterationPath)
            throws AutoflowException {
        NodeContext context = NodeContext.builder()
                .execution(execution)
                .nodeExecution(nodeExecution)
                .node(node)
                .variables(scope)
                .outgoing(graph.outgoing(node.nodeId()))
                .clock(clock)
                .iterationPath(iterationPath)
                .loopBodyRunner(node.type() == NodeType.LOOP ? bodyRunner(execution, graph, node, iterationPath) : null)
                .parallelExecutor(pool.loopExecutor())
                .build();
        Duration timeout = node.timeout() != null ? node.timeout() : config.getDefaultNodeTimeout();

        AtomicBoolean started = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        Future<NodeResult> future = pool.handlerExecutor().submit(() -> {
            started.set(true);
            try {
                return handlers.execute(context);
            } finally {
                finished.countDown();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            awaitAbandonedAttempt(execution.getId(), node, started, finished);
            throw new ExecutionTimeoutException(node.nodeId(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new NodeExecutionException(node.nodeId(), "Interrupted while waiting for the node", false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AutoflowException failure) {
                throw failure;
            }
            throw new NodeExecutionException(node.nodeId(), "Node handler failed: " + cause, cause);
        }
    }

    /**
     * Waits for a timed-out handler to return before another attempt can start. Handlers that
     * ignore interruption are given the configured grace period; the next attempt then relies on
     * the delivery ledger claim to avoid a second side effect.
     */
    private void awaitAbandonedAttempt(String executionId, WorkflowNode node, AtomicBoolean started,
                                       CountDownLatch finished) throws NodeExecutionException {
        if (!started.get()) {
            return;
        }
        Duration grace = config.getNodeTimeoutGrace();
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Node {} of execution {} is still running {} ms after its timeout",
                        node.nodeId(), executionId, grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeExecutionException(node.nodeId(), "Interrupted while waiting for the node", false);
        }
    }

    /**
     * Runs the body of a LOOP node for one iteration. Body nodes follow the same edge
     * rules as the main graph, but their results live only in the iteration's scope.
     * Retryable failures are retried at once, up to the node's retry limit.
     */
    private LoopBodyRunner bodyRunner(WorkflowExecution execution, WorkflowGraph graph, WorkflowNode loop,
                                      List<Integer> parentPath) {
        List<String> order = graph.loopBodyOrder(loop.nodeId());
        Set<String> body = graph.loopBody(loop.nodeId());
        Map<String, NodeExecution> states = nodeStates(execution.getId());
        return (index, scope) -> {
            List<Integer> path = new ArrayList<>(parentPath);
            path.add(index);
            Map<String, Object> outputs = new LinkedHashMap<>();
            Map<String, NodeResult> results = new HashMap<>();
            Set<String> failedOptional = new HashSet<>();
            for (String bodyId : order) {
                boolean active = false;
                for (WorkflowConnection edge : graph.incoming(bodyId)) {
                    String sourceId = edge.sourceNodeId();
                    boolean passed;
                    if (sourceId.equals(loop.nodeId())) {
                        passed = WorkflowGraph.isBodyEdge(edge);
                    } else if (body.contains(sourceId)) {
                        NodeResult sourceResult = results.get(sourceId);
                        passed = failedOptional.contains(sourceId) || (sourceResult != null
                                && (sourceResult.getActiveEdges() == null
                                || sourceResult.getActiveEdges().contains(edge.edgeId())));
                    } else {
                        passed = edgeActive(graph, edge, states.get(sourceId), scope);
                    }
                    if (passed && ConditionEvaluator.evaluate(edge.conditions(), scope::resolve)) {
                        active = true;
                    }
                }
                if (!active) {
                    continue;
                }

                WorkflowNode bodyNode = graph.node(bodyId);
                try {
                    NodeResult result = invokeWithRetries(execution, graph, bodyNode, states.get(bodyId), scope, path);
                    if (result.isWaiting()) {
                        throw new NodeExecutionException(bodyId,
                                bodyNode.type() + " node cannot suspend inside a loop", false);
                    }
                    result.getVariables().forEach((name, value) -> scope.set(name, value, bodyId));
                    results.put(bodyId, result);
                    outputs.put(bodyId, result.getOutput());
                } catch (AutoflowException e) {
                    if (!bodyNode.optional()) {
                        throw e;
                    }
                    failedOptional.add(bodyId);
                    executionLog.node(execution.getId(), bodyId, LogLevel.WARN,
                            "Optional node failed in iteration " + path + ": " + e.getMessage(), null);
                }
            }
            return outputs;
        };
    }

    private NodeResult invokeWithRetries(WorkflowExecution execution, WorkflowGraph graph, WorkflowNode node,
                                         NodeExecution nodeExecution, VariableScope scope, List<Integer> path)
            throws AutoflowException {
        int attempt = 0;
        while (true) {
            try {
                return invoke(execution, graph, node, nodeExecution, scope, path);
            } catch (AutoflowException e) {
                if (!e.isRetryable() || attempt >= node.retryLimit()) {
                    throw e;
                }
                attempt++;
                logger.debug("Retrying node {} in iteration {} after: {}", node.nodeId(), path, e.getMessage());
            }
        }
    }

    /**
     * Records a failed attempt.
     *
     * @return true if the node should be attempted again right away
     */
    private boolean handleNodeFailure(String executionId, WorkflowNode node, AutoflowException error) {
        Instant now = clock.instant();
        synchronized (lock(executionId)) {
            WorkflowExecution execution = executions.findById(executionId).orElse(null);
            if (execution == null || execution.isTerminal()) {
                return false;
            }
            NodeExecution state = nodeState(executionId, node.nodeId());
            if (error.isRetryable() && state.hasRetriesLeft()) {
                Duration backoff = config.getNodeRetryBackoff();
                executions.saveNodeExecution(transition(state, NodeExecutionStatus.PENDING)
                        .retryCount(state.getRetryCount() + 1)
                        .error(error.getMessage())
                        .resumeAt(backoff.isZero() ? null : now.plus(backoff))
                        .build());
                executionLog.node(executionId, node.nodeId(), LogLevel.WARN, String.format(
                        "Attempt %d failed, retrying: %s", state.getRetryCount() + 1, error.getMessage()), null);
                return backoff.isZero() && execution.getStatus() == ExecutionStatus.RUNNING;
            }
            executions.saveNodeExecution(transition(state, NodeExecutionStatus.FAILED)
                    .error(error.getMessage())
                    .completedAt(now)
                    .durationMs(state.getStartedAt() == null ? null
                            : Duration.between(state.getStartedAt(), now).toMillis())
                    .build());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("errorCode", error.getErrorCode());
            details.put("retryable", error.isRetryable());
            details.put("attempts", state.getRetryCount() + 1);
            executionLog.node(executionId, node.nodeId(), node.optional() ? LogLevel.WARN : LogLevel.ERROR,
                    "Node failed: " + error.getMessage(), details);
        }
        if (!node.optional()) {
            failExecution(executionId, node, error.getErrorCode(), error.getMessage());
        }
        return false;
    }

    private void recordResult(String executionId, WorkflowNode node, NodeResult result, VariableScope variables) {
        synchronized (lock(executionId)) {
            WorkflowExecution execution = executions.findById(executionId).orElse(null);
            if (execution == null || execution.isTerminal()) {
                logger.debug("Discarding result of node {}: execution {} already ended", node.nodeId(), executionId);
                return;
            }
            result.getVariables().forEach((name, value) -> variables.set(name, value, node.nodeId()));

            Instant now = clock.instant();
            NodeExecution state = nodeState(executionId, node.nodeId());
            if (result.isWaiting()) {
                executions.saveNodeExecution(transition(state, NodeExecutionStatus.WAITING)
                        .resumeAt(result.getResumeAt())
                        .output(result.getOutput())
                        .activeEdges(result.getActiveEdges())
                        .build());
                executionLog.node(executionId, node.nodeId(), LogLevel.INFO,
                        "Node waiting until " + result.getResumeAt(), null);
            } else {
                executions.saveNodeExecution(transition(state, NodeExecutionStatus.COMPLETED)
                        .completedAt(now)
                        .durationMs(state.getStartedAt() == null ? null
                                : Duration.between(state.getStartedAt(), now).toMillis())
                        .output(result.getOutput())
                        .activeEdges(result.getActiveEdges())
                        .error(null)
                        .build());
                executionLog.node(executionId, node.nodeId(), LogLevel.INFO, "Node completed", null);
            }
            updateProgress(executionId);
        }
    }

    /**
     * Settles a node without running it: a due WAITING node completes, a node with no
     * active incoming edge is skipped, a loop body node follows its loop.
     */
    private void settle(String executionId, NodeExecution state, NodeExecutionStatus target) {
        synchronized (lock(executionId)) {
            WorkflowExecution execution = executions.findById(executionId).orElse(null);
            if (execution == null || execution.getStatus() != ExecutionStatus.RUNNING) {
                return;
            }
            NodeExecution current = nodeState(executionId, state.getNodeId());
            if (current.getStatus().isSettled()) {
                return;
            }
            Instant now = clock.instant();
            executions.saveNodeExecution(transition(current, target)
                    .completedAt(now)
                    .durationMs(current.getStartedAt() == null ? null
                            : Duration.between(current.getStartedAt(), now).toMillis())
                    .build());
            executionLog.node(executionId, current.getNodeId(), LogLevel.DEBUG, "Node " + target.name().toLowerCase(), null);
            updateProgress(executionId);
        }
    }

    private void updateProgress(String executionId) {
        List<NodeExecution> states = executions.findNodeExecutions(executionId);
        if (states.isEmpty()) {
            return;
        }
        long done = states.stream().filter(state -> state.getStatus().countsAsProgress()).count();
        double progress = done * 100.0 / states.size();
        WorkflowExecution execution = load(executionId, null);
        if (execution != null && progress > execution.getProgress()) {
            executions.save(execution.toBuilder().progress(progress).build());
        }
    }

    // ---------------------------------------------------------------- terminal states

    private void completeExecution(String executionId) {
        WorkflowExecution completed;
        Instant now = clock.instant();
        synchronized (lock(executionId)) {
            WorkflowExecution execution = load(executionId, null);
            if (execution == null || execution.getStatus() != ExecutionStatus.RUNNING) {
                return;
            }
            completed = executions.save(execution.toBuilder()
                    .status(ExecutionStatus.COMPLETED)
                    .progress(100)
                    .completedAt(now)
                    .durationMs(execution.elapsedMs(now))
                    .currentNodeId(null)
                    .build());
        }
        workflows.updateWorkflow(completed.getWorkflowId(), workflow -> workflow.recordOutcome(ExecutionStatus.COMPLETED, now));
        pool.cancelWakeup(executionId);
        if (metrics != null) {
            metrics.recordExecutionCompleted(completed.getWorkflowId(), executionId, completed.getDurationMs());
        }
        executionLog.execution(executionId, LogLevel.INFO, "Execution completed in " + completed.getDurationMs() + " ms", null);
    }

    /**
     * Fails a running execution and cancels every node that has not settled. An
     * execution paused meanwhile stays paused and fails when it is resumed.
     */
    private void failExecution(String executionId, WorkflowNode node, String errorCode, String message) {
        WorkflowExecution failed;
        Instant now = clock.instant();
        synchronized (lock(executionId)) {
            WorkflowExecution execution = load(executionId, null);
            if (execution == null || !execution.getStatus().canTransitionTo(ExecutionStatus.FAILED)) {
                return;
            }
            cancelUnsettledNodes(executionId, now);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("errorCode", errorCode);
            if (node != null) {
                details.put("nodeId", node.nodeId());
                details.put("nodeType", node.type().name());
                details.put("nodeName", node.displayName());
            }
            String error = node == null ? message : String.format("Node '%s' failed: %s", node.nodeId(), message);
            failed = executions.save(execution.toBuilder()
                    .status(ExecutionStatus.FAILED)
                    .failedAt(now)
                    .completedAt(now)
                    .durationMs(execution.elapsedMs(now))
                    .error(error)
                    .errorDetails(details)
                    .build());
        }
        workflows.updateWorkflow(failed.getWorkflowId(), workflow -> workflow.recordOutcome(ExecutionStatus.FAILED, now));
        pool.cancelWakeup(executionId);
        if (metrics != null) {
            metrics.recordExecutionFailed(failed.getWorkflowId(), executionId, errorCode);
        }
        executionLog.execution(executionId, LogLevel.ERROR, "Execution failed: " + failed.getError(), failed.getErrorDetails());
    }

    private void cancelUnsettledNodes(String executionId, Instant now) {
        for (NodeExecution state : executions.findNodeExecutions(executionId)) {
            if (!state.getStatus().isSettled()) {
                executions.saveNodeExecution(transition(state, NodeExecutionStatus.CANCELLED)
                        .completedAt(now)
                        .build());
            }
        }
    }

    // ---------------------------------------------------------------- helpers

    private Object lock(String executionId) {
        return locks.computeIfAbsent(executionId, id -> new Object());
    }

    private WorkflowExecution load(String executionId) throws NotFoundException {
        return executions.findById(executionId).orElseThrow(() -> new NotFoundException("Execution", executionId));
    }

    private WorkflowExecution load(String executionId, WorkflowExecution fallback) {
        return executions.findById(executionId).orElse(fallback);
    }

    private boolean isRunning(String executionId) {
        return executions.findById(executionId)
                .map(execution -> execution.getStatus() == ExecutionStatus.RUNNING)
                .orElse(false);
    }

    private static void requireTransition(WorkflowExecution execution, ExecutionStatus target)
            throws InvalidTransitionException {
        if (!execution.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException(execution.getId(), execution.getStatus(), target,
                    execution.getStatus().getValidTransitions());
        }
    }

    private static NodeExecution.Builder transition(NodeExecution state, NodeExecutionStatus target) {
        if (state.getStatus() != target && !state.getStatus().canTransitionTo(target)) {
            throw new IllegalStateException(String.format("Node execution %s cannot move from %s to %s",
                    state.getId(), state.getStatus(), target));
        }
        return state.toBuilder().status(target);
    }

    private Map<String, NodeExecution> nodeStates(String executionId) {
        Map<String, NodeExecution> states = new LinkedHashMap<>();
        for (NodeExecution state : executions.findNodeExecutions(executionId)) {
            states.put(state.getNodeId(), state);
        }
        return states;
    }

    private NodeExecution nodeState(String executionId, String nodeId) {
        return nodeStates(executionId).get(nodeId);
    }

    private VariableScope variables(String executionId) {
        return new ExecutionVariables(executionId, executions, clock);
    }

    private enum Readiness {
        ACTIVE,
        INACTIVE,
        NOT_READY
    }

    private enum StepKind {
        RUN,
        SETTLE,
        WAIT,
        FAIL,
        STALLED,
        DONE
    }

    private static final class Step {
        private final StepKind kind;
        private final String nodeId;
        private final NodeExecutionStatus status;
        private final Instant dueAt;

        private Step(StepKind kind, String nodeId, NodeExecutionStatus status, Instant dueAt) {
            this.kind = kind;
            this.nodeId = nodeId;
            this.status = status;
            this.dueAt = dueAt;
        }

        static Step of(StepKind kind, String nodeId) {
            return new Step(kind, nodeId, null, null);
        }

        static Step settle(String nodeId, NodeExecutionStatus status) {
            return new Step(StepKind.SETTLE, nodeId, status, null);
        }

        static Step waitUntil(Instant dueAt) {
            return new Step(StepKind.WAIT, null, null, dueAt);
        }
    }
}
