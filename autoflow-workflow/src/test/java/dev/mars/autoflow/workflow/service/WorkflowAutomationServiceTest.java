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

import dev.mars.autoflow.core.ActionType;
import dev.mars.autoflow.core.BulkExecutionAction;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.NodeExecutionStatus;
import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.ScheduleSpec;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.Workflow;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.WorkflowStatus;
import dev.mars.autoflow.core.WorkflowTrigger;
import dev.mars.autoflow.core.exceptions.ConflictException;
import dev.mars.autoflow.core.exceptions.NotFoundException;
import dev.mars.autoflow.core.exceptions.ValidationException;
import dev.mars.autoflow.tenant.model.AccessContext;
import dev.mars.autoflow.tenant.model.OrganizationRole;
import dev.mars.autoflow.tenant.service.PermissionChecker.ForbiddenException;
import dev.mars.autoflow.tenant.service.SimplePermissionChecker;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.ConnectionDefinition;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.NodeDefinition;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.TriggerDefinition;
import dev.mars.autoflow.workflow.execution.BulkActionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;

class WorkflowAutomationServiceTest {

    private static final AccessContext ALICE = new AccessContext("alice", "org-1");
    private static final AccessContext VICTOR = new AccessContext("victor", "org-1");
    private static final AccessContext BOB = new AccessContext("bob", "org-2");

    private RecordingDeliveryAdapter email;
    private AutoflowEngine engine;
    private WorkflowAutomationService service;

    @BeforeEach
    void setUp() {
        SimplePermissionChecker permissions = new SimplePermissionChecker();
        permissions.grant("org-1", "alice", OrganizationRole.ADMIN);
        permissions.grant("org-1", "victor", OrganizationRole.VIEWER);
        permissions.grant("org-2", "bob", OrganizationRole.OWNER);

        email = new RecordingDeliveryAdapter(ActionType.EMAIL);
        engine = AutoflowEngine.builder()
                .permissionChecker(permissions)
                .deliveryAdapter(email)
                .build();
        service = engine.getService();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static NodeDefinition nodeDef(String nodeId, NodeType type, Map<String, Object> config) {
        return new NodeDefinition(nodeId, type, null, null, config, 0, false, 0, null);
    }

    private static ConnectionDefinition edgeDef(String source, String target) {
        return new ConnectionDefinition(source + "->" + target, source, target, null, null, null, null, 0);
    }

    private static Map<String, Object> emailTo(String recipient) {
        return Map.of("actionType", "EMAIL", "recipients", List.of(recipient), "subject", "Hello", "body", "Hi");
    }

    /**
     * start -> wait (long delay) -> after, owned by org-1.
     */
    private Workflow waitingWorkflow() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Nurture", null);
        service.syncNodes(ALICE, workflow.getId(), List.of(
                nodeDef("start", NodeType.TRIGGER, Map.of()),
                nodeDef("wait", NodeType.DELAY, Map.of("delayMs", 3_600_000)),
                nodeDef("after", NodeType.DELAY, Map.of("delayMs", 0))));
        service.syncConnections(ALICE, workflow.getId(), List.of(edgeDef("start", "wait"), edgeDef("wait", "after")));
        return service.activateWorkflow(ALICE, workflow.getId());
    }

    private ExecutionStatus status(String executionId) {
        return engine.getExecutionRepository().findById(executionId).map(WorkflowExecution::getStatus).orElse(null);
    }

    @Test
    void createdWorkflowsStartAsDraftInTheCallersOrganization() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "  Onboarding  ", "New customers");

        assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.DRAFT);
        assertThat(workflow.getOrganizationId()).isEqualTo("org-1");
        assertThat(workflow.getName()).isEqualTo("Onboarding");
        assertThatThrownBy(() -> service.createWorkflow(ALICE, " ", null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void viewersCanReadButNotChange() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Onboarding", null);

        assertThat(service.getWorkflow(VICTOR, workflow.getId()).getName()).isEqualTo("Onboarding");
        assertThatThrownBy(() -> service.createNode(VICTOR, workflow.getId(),
                nodeDef("start", NodeType.TRIGGER, Map.of())))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> service.createWorkflow(VICTOR, "Mine", null)).isInstanceOf(ForbiddenException.class);
    }

    @Test
    void otherOrganizationsSeeNothing() throws Exception {
        Workflow workflow = waitingWorkflow();
        String executionId = service.triggerExecution(ALICE, workflow.getId(), null, Map.of(), List.of()).id();

        assertThatThrownBy(() -> service.getWorkflow(BOB, workflow.getId())).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.getNodes(BOB, workflow.getId())).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.getExecution(BOB, executionId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.cancelExecution(BOB, executionId)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void nodesAreValidatedAndUniquePerWorkflow() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Onboarding", null);
        service.createNode(ALICE, workflow.getId(), nodeDef("start", NodeType.TRIGGER, Map.of()));

        assertThatThrownBy(() -> service.createNode(ALICE, workflow.getId(),
                nodeDef("start", NodeType.TRIGGER, Map.of())))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> service.createNode(ALICE, workflow.getId(),
                nodeDef("wait", NodeType.DELAY, Map.of("delayMs", -5))))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.updateNode(ALICE, workflow.getId(),
                nodeDef("ghost", NodeType.DELAY, Map.of("delayMs", 5))))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void nodeConfigurationIsTrimmed() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Onboarding", null);

        WorkflowNode node = service.createNode(ALICE, workflow.getId(), nodeDef("send", NodeType.ACTION,
                Map.of(" actionType ", "EMAIL ", "recipients", List.of("  ann@example.com "), "subject", "  Hello ")));

        assertThat(node.config())
                .containsEntry("actionType", "EMAIL")
                .containsEntry("recipients", List.of("ann@example.com"))
                .containsEntry("subject", "Hello");
    }

    @Test
    void syncKeepsStorageIdsAndDropsDanglingConnections() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Onboarding", null);
        String workflowId = workflow.getId();
        List<WorkflowNode> first = service.syncNodes(ALICE, workflowId, List.of(
                nodeDef("start", NodeType.TRIGGER, Map.of()),
                nodeDef("a", NodeType.DELAY, Map.of("delayMs", 0)),
                nodeDef("b", NodeType.DELAY, Map.of("delayMs", 0))));
        service.syncConnections(ALICE, workflowId, List.of(edgeDef("start", "a"), edgeDef("a", "b")));
        String startId = first.stream().filter(node -> node.nodeId().equals("start")).findFirst().orElseThrow().id();

        List<WorkflowNode> second = service.syncNodes(ALICE, workflowId, List.of(
                nodeDef("start", NodeType.TRIGGER, Map.of()),
                nodeDef("a", NodeType.DELAY, Map.of("delayMs", 10))));

        assertThat(second).extracting(WorkflowNode::nodeId).containsExactlyInAnyOrder("start", "a");
        assertThat(second).filteredOn(node -> node.nodeId().equals("start"))
                .extracting(WorkflowNode::id).containsExactly(startId);
        assertThat(service.getConnections(ALICE, workflowId))
                .extracting(WorkflowConnection::edgeId).containsExactly("start->a");
    }

    @Test
    void syncRejectsDuplicatesAndUnknownNodes() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Onboarding", null);
        String workflowId = workflow.getId();
        service.syncNodes(ALICE, workflowId, List.of(nodeDef("start", NodeType.TRIGGER, Map.of())));

        assertThatThrownBy(() -> service.syncNodes(ALICE, workflowId, List.of(
                nodeDef("x", NodeType.TRIGGER, Map.of()), nodeDef("x", NodeType.TRIGGER, Map.of()))))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> service.syncConnections(ALICE, workflowId, List.of(edgeDef("start", "nowhere"))))
                .isInstanceOf(ValidationException.class);
        assertThat(service.getNodes(ALICE, workflowId)).extracting(WorkflowNode::nodeId).containsExactly("start");
    }

    @Test
    void deletingANodeRemovesItsConnections() throws Exception {
        Workflow workflow = waitingWorkflow();
        service.updateWorkflowStatus(ALICE, workflow.getId(), WorkflowStatus.INACTIVE);

        service.deleteNode(ALICE, workflow.getId(), "wait");

        assertThat(service.getConnections(ALICE, workflow.getId())).isEmpty();
        assertThatThrownBy(() -> service.deleteNode(ALICE, workflow.getId(), "wait"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void archivedWorkflowsCannotBeEdited() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Onboarding", null);
        service.updateWorkflowStatus(ALICE, workflow.getId(), WorkflowStatus.ARCHIVED);

        assertThatThrownBy(() -> service.createNode(ALICE, workflow.getId(),
                nodeDef("start", NodeType.TRIGGER, Map.of())))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("ARCHIVED");
    }

    @Test
    void activationRequiresAValidGraph() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Onboarding", null);
        String workflowId = workflow.getId();

        assertThatThrownBy(() -> service.activateWorkflow(ALICE, workflowId)).isInstanceOf(ValidationException.class);

        service.syncNodes(ALICE, workflowId, List.of(
                nodeDef("start", NodeType.TRIGGER, Map.of()),
                nodeDef("a", NodeType.DELAY, Map.of("delayMs", 0)),
                nodeDef("b", NodeType.DELAY, Map.of("delayMs", 0))));
        service.syncConnections(ALICE, workflowId, List.of(edgeDef("start", "a"), edgeDef("a", "b"), edgeDef("b", "a")));

        assertThatThrownBy(() -> service.activateWorkflow(ALICE, workflowId)).isInstanceOf(ValidationException.class);
        assertThat(service.getWorkflow(ALICE, workflowId).getStatus()).isEqualTo(WorkflowStatus.DRAFT);
    }

    @Test
    void importStoresNothingWhenTheDefinitionIsInvalid() {
        String yaml = """
                name: Broken
                nodes:
                  - id: start
                    type: TRIGGER
                  - id: wait
                    type: DELAY
                    config: { delayMs: 1000 }
                connections:
                  - source: start
                    target: missing
                """;

        assertThatThrownBy(() -> service.importWorkflow(ALICE, yaml)).isInstanceOf(ValidationException.class);
        assertThat(engine.getWorkflowRepository().findWorkflowsByOrganization("org-1")).isEmpty();
    }

    @Test
    void importArmsScheduleTriggers() throws Exception {
        String yaml = """
                name: Hourly sync
                nodes:
                  - id: start
                    type: TRIGGER
                triggers:
                  - type: SCHEDULE
                    frequency: hourly
                """;

        Workflow workflow = service.importWorkflow(ALICE, yaml);

        assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.DRAFT);
        assertThat(service.getNodes(ALICE, workflow.getId())).hasSize(1);
        WorkflowTrigger trigger = service.getTriggers(ALICE, workflow.getId()).get(0);
        assertThat(trigger.nextFireAt()).isAfter(Instant.now().minusSeconds(1));
    }

    @Test
    void togglingAScheduleTriggerRearmsIt() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Digest", null);
        WorkflowTrigger trigger = service.createTrigger(ALICE, workflow.getId(), new TriggerDefinition(
                TriggerType.SCHEDULE, null, null, null, null, null, 0, false, ScheduleSpec.every("daily")));
        assertThat(trigger.nextFireAt()).isNull();

        WorkflowTrigger enabled = service.toggleTrigger(ALICE, trigger.id(), true);

        assertThat(enabled.active()).isTrue();
        assertThat(enabled.nextFireAt()).isNotNull();
        assertThat(service.toggleTrigger(ALICE, trigger.id(), false).active()).isFalse();
        assertThatThrownBy(() -> service.toggleTrigger(BOB, trigger.id(), true)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void eventTriggersNeedAnEventType() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Digest", null);

        assertThatThrownBy(() -> service.createTrigger(ALICE, workflow.getId(), new TriggerDefinition(
                TriggerType.EVENT, null, "crm", null, null, null, 0, true, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void triggeredExecutionRunsToCompletion() throws Exception {
        Workflow workflow = service.createWorkflow(ALICE, "Welcome", null);
        service.syncNodes(ALICE, workflow.getId(), List.of(
                nodeDef("start", NodeType.TRIGGER, Map.of()),
                nodeDef("send", NodeType.ACTION, emailTo("{{email}}"))));
        service.syncConnections(ALICE, workflow.getId(), List.of(edgeDef("start", "send")));
        service.activateWorkflow(ALICE, workflow.getId());

        TriggeredExecution triggered = service.triggerExecution(ALICE, workflow.getId(), null,
                Map.of("email", "ann@example.com"), List.of());
        await().atMost(5, SECONDS).until(() -> status(triggered.id()) == ExecutionStatus.COMPLETED);

        ExecutionDetails details = service.getExecution(VICTOR, triggered.id());
        assertThat(details.node("send")).hasValueSatisfying(
                node -> assertThat(node.getStatus()).isEqualTo(NodeExecutionStatus.COMPLETED));
        assertThat(email.sent()).singleElement()
                .satisfies(payload -> assertThat(payload.recipients()).containsExactly("ann@example.com"));
        assertThat(service.getExecutions(ALICE, workflow.getId())).hasSize(1);
        assertThat(service.recomputeCounters(ALICE, workflow.getId()).getSuccessfulExecutions()).isEqualTo(1);
    }

    @Test
    void triggerMustBelongToTheWorkflow() throws Exception {
        Workflow workflow = waitingWorkflow();
        Workflow other = service.createWorkflow(ALICE, "Other", null);
        WorkflowTrigger foreign = service.createTrigger(ALICE, other.getId(), new TriggerDefinition(
                TriggerType.MANUAL, null, null, null, null, null, 0, true, null));

        assertThatThrownBy(() -> service.triggerExecution(ALICE, workflow.getId(), foreign.id(), Map.of(), List.of()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void executionsCanBePausedResumedAndCancelled() throws Exception {
        Workflow workflow = waitingWorkflow();
        String id = service.triggerExecution(ALICE, workflow.getId(), null, Map.of(), List.of()).id();
        await().atMost(5, SECONDS).until(() -> service.getExecution(ALICE, id).node("wait")
                .map(node -> node.getStatus() == NodeExecutionStatus.WAITING).orElse(false));

        assertThat(service.pauseExecution(ALICE, id).getStatus()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(service.resumeExecution(ALICE, id).getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThatThrownBy(() -> service.cancelExecution(VICTOR, id)).isInstanceOf(ForbiddenException.class);
        assertThat(service.cancelExecution(ALICE, id).getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
    }

    @Test
    void bulkUpdateOnlyTouchesTheCallersExecutions() throws Exception {
        Workflow mine = waitingWorkflow();
        String ownId = service.triggerExecution(ALICE, mine.getId(), null, Map.of(), List.of()).id();

        Workflow theirs = service.createWorkflow(BOB, "Theirs", null);
        service.syncNodes(BOB, theirs.getId(), List.of(
                nodeDef("start", NodeType.TRIGGER, Map.of()),
                nodeDef("wait", NodeType.DELAY, Map.of("delayMs", 3_600_000))));
        service.syncConnections(BOB, theirs.getId(), List.of(edgeDef("start", "wait")));
        service.activateWorkflow(BOB, theirs.getId());
        String theirId = service.triggerExecution(BOB, theirs.getId(), null, Map.of(), List.of()).id();

        List<BulkActionResult> results = service.bulkUpdateExecutions(ALICE, List.of(ownId, theirId),
                BulkExecutionAction.CANCEL);

        assertThat(results).extracting(BulkActionResult::executionId, BulkActionResult::success)
                .containsExactlyInAnyOrder(
                        tuple(ownId, true),
                        tuple(theirId, false));
        assertThat(status(ownId)).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(status(theirId)).isNotEqualTo(ExecutionStatus.CANCELLED);
    }
}
