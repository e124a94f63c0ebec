package dev.mars.autoflow.workflow.trigger;

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

import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.Workflow;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowStatus;
import dev.mars.autoflow.core.WorkflowTrigger;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.storage.WorkflowRepository;
import dev.mars.autoflow.workflow.condition.ConditionEvaluator;
import dev.mars.autoflow.workflow.execution.ExecutionOrchestrator;
import dev.mars.autoflow.workflow.execution.ExecutionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Starts executions for domain events and schedule firings.
 *
 * <p>An event matches an active EVENT trigger when module, event type and entity type
 * agree ignoring case (a blank trigger field matches anything) and the trigger's
 * conditions hold against the event payload. Each match on an ACTIVE workflow of the
 * event's organization starts exactly one execution. Events that match nothing, or only
 * match workflows that are not active, are dropped and logged.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class TriggerEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(TriggerEvaluator.class);

    private final WorkflowRepository workflows;
    private final ExecutionOrchestrator orchestrator;

    public TriggerEvaluator(WorkflowRepository workflows, ExecutionOrchestrator orchestrator) {
        this.workflows = Objects.requireNonNull(workflows, "Workflow repository cannot be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "Orchestrator cannot be null");
    }

    /**
     * Evaluates an event against every active EVENT trigger.
     *
     * @return the executions started, possibly none
     */
    public List<WorkflowExecution> onEvent(DomainEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        List<WorkflowExecution> started = new ArrayList<>();
        for (WorkflowTrigger trigger : workflows.findActiveTriggers(TriggerType.EVENT)) {
            if (!matches(trigger, event)) {
                continue;
            }
            Optional<Workflow> workflow = workflows.findWorkflow(trigger.workflowId());
            if (workflow.isEmpty() || !event.organizationId().equals(workflow.get().getOrganizationId())) {
                continue;
            }
            if (workflow.get().getStatus() != WorkflowStatus.ACTIVE) {
                logger.debug("Trigger {} matched event {} but workflow {} is {}",
                        trigger.id(), event.eventType(), trigger.workflowId(), workflow.get().getStatus());
                continue;
            }
            start(trigger, event.payload()).ifPresent(started::add);
        }
        if (started.isEmpty()) {
            logger.debug("Event {}/{}/{} for organization {} started no executions",
                    event.module(), event.eventType(), event.entityType(), event.organizationId());
        } else {
            logger.info("Event {}/{} started {} executions", event.module(), event.eventType(), started.size());
        }
        return started;
    }

    /**
     * Starts the trigger's workflow for one schedule firing.
     */
    public Optional<WorkflowExecution> fireSchedule(WorkflowTrigger trigger, Instant scheduledFor) {
        Optional<Workflow> workflow = workflows.findWorkflow(trigger.workflowId());
        if (workflow.isEmpty() || workflow.get().getStatus() != WorkflowStatus.ACTIVE) {
            logger.debug("Skipping schedule trigger {}: workflow {} is not active", trigger.id(), trigger.workflowId());
            return Optional.empty();
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("triggerId", trigger.id());
        data.put("scheduledFor", scheduledFor.toString());
        return start(trigger, data);
    }

    static boolean matches(WorkflowTrigger trigger, DomainEvent event) {
        return trigger.active()
                && fieldMatches(trigger.module(), event.module())
                && fieldMatches(trigger.eventType(), event.eventType())
                && fieldMatches(trigger.entityType(), event.entityType())
                && ConditionEvaluator.evaluate(trigger.conditions(), event.payload());
    }

    private static boolean fieldMatches(String expected, String actual) {
        if (expected == null || expected.isBlank()) {
            return true;
        }
        return actual != null && expected.trim().toLowerCase(Locale.ROOT).equals(actual.trim().toLowerCase(Locale.ROOT));
    }

    private Optional<WorkflowExecution> start(WorkflowTrigger trigger, Map<String, Object> triggerData) {
        ExecutionRequest request = ExecutionRequest.builder(trigger.workflowId())
                .triggerId(trigger.id())
                .triggerData(triggerData)
                .startDelay(Duration.ofMillis(trigger.delayMs()))
                .build();
        try {
            return Optional.of(orchestrator.start(request));
        } catch (AutoflowException e) {
            logger.warn("Trigger {} could not start workflow {}: {}", trigger.id(), trigger.workflowId(), e.getMessage());
            return Optional.empty();
        }
    }
}
