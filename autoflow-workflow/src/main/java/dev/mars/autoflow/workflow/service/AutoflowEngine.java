package dev.mars.autoflow.workflow.service;

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
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.storage.AnalyticsRepository;
import dev.mars.autoflow.storage.DeliveryLedger;
import dev.mars.autoflow.storage.ExecutionRepository;
import dev.mars.autoflow.storage.WorkflowRepository;
import dev.mars.autoflow.storage.memory.InMemoryAnalyticsRepository;
import dev.mars.autoflow.storage.memory.InMemoryDeliveryLedger;
import dev.mars.autoflow.storage.memory.InMemoryExecutionRepository;
import dev.mars.autoflow.storage.memory.InMemoryWorkflowRepository;
import dev.mars.autoflow.tenant.service.PermissionChecker;
import dev.mars.autoflow.tenant.service.SimplePermissionChecker;
import dev.mars.autoflow.workflow.action.DeliveryAdapter;
import dev.mars.autoflow.workflow.action.InMemoryTemplateResolver;
import dev.mars.autoflow.workflow.action.TemplateResolver;
import dev.mars.autoflow.workflow.analytics.WorkflowAnalyticsService;
import dev.mars.autoflow.workflow.execution.ExecutionOrchestrator;
import dev.mars.autoflow.workflow.node.NodeHandler;
import dev.mars.autoflow.workflow.node.NodeHandlerRegistry;
import dev.mars.autoflow.workflow.node.handlers.ActionNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.ConditionNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.DelayNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.FilterNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.LoopNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.QueryNodeHandler;
import dev.mars.autoflow.workflow.node.handlers.ScheduleNodeHandler;
import dev.mars.autoflow.workflow.query.InMemoryRecordQueryService;
import dev.mars.autoflow.workflow.query.RecordQueryService;
import dev.mars.autoflow.workflow.trigger.DomainEvent;
import dev.mars.autoflow.workflow.trigger.ScheduleTicker;
import dev.mars.autoflow.workflow.trigger.TriggerEvaluator;
import dev.mars.autoflow.workflow.validation.NodeConfigValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wires repositories, node handlers, the orchestrator, triggers and analytics into one
 * running engine. Collaborators that are not supplied fall back to in-memory implementations.
 *
 * <pre>
 * try (AutoflowEngine engine = AutoflowEngine.builder()
 *         .deliveryAdapter(emailAdapter)
 *         .build()) {
 *     engine.start();
 *     engine.getService().createWorkflow(ctx, "Welcome", null);
 * }
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-12
 * @version 1.0
 */
public class AutoflowEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AutoflowEngine.class);

    private final WorkflowRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final ExecutionOrchestrator orchestrator;
    private final TriggerEvaluator triggerEvaluator;
    private final ScheduleTicker scheduleTicker;
    private final WorkflowAnalyticsService analyticsService;
    private final WorkflowAutomationService service;

    private AutoflowEngine(Builder builder) {
        AutoflowConfiguration config = builder.configuration != null ? builder.configuration : new AutoflowConfiguration();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.workflowRepository = builder.workflowRepository != null ? builder.workflowRepository : new InMemoryWorkflowRepository();
        this.executionRepository = builder.executionRepository != null ? builder.executionRepository : new InMemoryExecutionRepository();
        AnalyticsRepository analyticsRepository = builder.analyticsRepository != null
                ? builder.analyticsRepository : new InMemoryAnalyticsRepository();
        DeliveryLedger ledger = builder.deliveryLedger != null ? builder.deliveryLedger : new InMemoryDeliveryLedger();
        RecordQueryService queryService = builder.recordQueryService != null
                ? builder.recordQueryService : new InMemoryRecordQueryService();
        TemplateResolver templateResolver = builder.templateResolver != null
                ? builder.templateResolver : new InMemoryTemplateResolver();
        PermissionChecker permissions = builder.permissionChecker != null
                ? builder.permissionChecker : new SimplePermissionChecker();

        List<NodeHandler<?>> handlers = new ArrayList<>();
        handlers.add(new ActionNodeHandler(templateResolver, ledger, builder.deliveryAdapters));
        handlers.add(new QueryNodeHandler(queryService));
        handlers.add(new LoopNodeHandler(config.getLoopMaxConcurrency()));
        handlers.add(new FilterNodeHandler());
        handlers.add(new ConditionNodeHandler());
        handlers.add(new DelayNodeHandler());
        handlers.add(new ScheduleNodeHandler());
        handlers.addAll(builder.extraHandlers);
        NodeHandlerRegistry registry = new NodeHandlerRegistry(handlers);

        this.orchestrator = new ExecutionOrchestrator(workflowRepository, executionRepository, registry, config, clock);
        this.triggerEvaluator = new TriggerEvaluator(workflowRepository, orchestrator);
        this.scheduleTicker = new ScheduleTicker(workflowRepository, triggerEvaluator, config, clock);
        this.analyticsService = new WorkflowAnalyticsService(workflowRepository, executionRepository,
                analyticsRepository, config, clock);
        this.service = new WorkflowAutomationService(workflowRepository, executionRepository, orchestrator,
                analyticsService, new NodeConfigValidator(registry), permissions, clock);
        logger.debug("Autoflow engine created with {} node handlers and {} delivery adapters",
                handlers.size(), builder.deliveryAdapters.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resumes executions left unfinished by a previous run and starts the schedule ticker.
     */
    public void start() {
        int recovered = orchestrator.recover();
        scheduleTicker.start();
        logger.info("Autoflow engine started, {} executions recovered", recovered);
    }

    /**
     * Starts every workflow with an event trigger matching the event.
     */
    public List<WorkflowExecution> publishEvent(DomainEvent event) {
        return triggerEvaluator.onEvent(event);
    }

    public WorkflowAutomationService getService() {
        return service;
    }

    public ExecutionOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public TriggerEvaluator getTriggerEvaluator() {
        return triggerEvaluator;
    }

    public ScheduleTicker getScheduleTicker() {
        return scheduleTicker;
    }

    public WorkflowAnalyticsService getAnalyticsService() {
        return analyticsService;
    }

    public WorkflowRepository getWorkflowRepository() {
        return workflowRepository;
    }

    public ExecutionRepository getExecutionRepository() {
        return executionRepository;
    }

    @Override
    public void close() {
        scheduleTicker.close();
        orchestrator.close();
        logger.info("Autoflow engine stopped");
    }

    public static class Builder {
        private AutoflowConfiguration configuration;
        private Clock clock;
        private WorkflowRepository workflowRepository;
        private ExecutionRepository executionRepository;
        private AnalyticsRepository analyticsRepository;
        private DeliveryLedger deliveryLedger;
        private RecordQueryService recordQueryService;
        private TemplateResolver templateResolver;
        private PermissionChecker permissionChecker;
        private final List<DeliveryAdapter> deliveryAdapters = new ArrayList<>();
        private final List<NodeHandler<?>> extraHandlers = new ArrayList<>();

        public Builder configuration(AutoflowConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder workflowRepository(WorkflowRepository workflowRepository) {
            this.workflowRepository = workflowRepository;
            return this;
        }

        public Builder executionRepository(ExecutionRepository executionRepository) {
            this.executionRepository = executionRepository;
            return this;
        }

        public Builder analyticsRepository(AnalyticsRepository analyticsRepository) {
            this.analyticsRepository = analyticsRepository;
            return this;
        }

        public Builder deliveryLedger(DeliveryLedger deliveryLedger) {
            this.deliveryLedger = deliveryLedger;
            return this;
        }

        public Builder recordQueryService(RecordQueryService recordQueryService) {
            this.recordQueryService = recordQueryService;
            return this;
        }

        public Builder templateResolver(TemplateResolver templateResolver) {
            this.templateResolver = templateResolver;
            return this;
        }

        public Builder permissionChecker(PermissionChecker permissionChecker) {
            this.permissionChecker = permissionChecker;
            return this;
        }

        public Builder deliveryAdapter(DeliveryAdapter adapter) {
            this.deliveryAdapters.add(Objects.requireNonNull(adapter, "Delivery adapter cannot be null"));
            return this;
        }

        /**
         * Registers a handler; it replaces the built-in handler of the same node type.
         */
        public Builder nodeHandler(NodeHandler<?> handler) {
            this.extraHandlers.add(Objects.requireNonNull(handler, "Node handler cannot be null"));
            return this;
        }

        public AutoflowEngine build() {
            return new AutoflowEngine(this);
        }
    }
}
