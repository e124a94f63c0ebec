package dev.mars.autoflow.workflow.node.handlers;

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
import dev.mars.autoflow.core.DeliveryReceipt;
import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.exceptions.DeliveryException;
import dev.mars.autoflow.core.exceptions.NodeExecutionException;
import dev.mars.autoflow.storage.memory.InMemoryDeliveryLedger;
import dev.mars.autoflow.workflow.action.ActionPayload;
import dev.mars.autoflow.workflow.action.DeliveryAdapter;
import dev.mars.autoflow.workflow.action.InMemoryTemplateResolver;
import dev.mars.autoflow.workflow.action.MessageTemplate;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.validation.ValidationResult.ValidationIssue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.mars.autoflow.workflow.WorkflowTestSupport.NOW;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.contextFor;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.node;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.variables;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionNodeHandlerTest {

    private final List<ActionPayload> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger failures = new AtomicInteger();
    private InMemoryTemplateResolver templates;
    private InMemoryDeliveryLedger ledger;
    private ActionNodeHandler handler;

    private final Map<String, Object> welcomeEmail = Map.of(
            "actionType", "EMAIL",
            "recipients", List.of("{{contact.email}}"),
            "subject", "Welcome {{contact.name}}",
            "body", "Hi {{contact.name}}, thanks for joining.");

    @BeforeEach
    void setUp() {
        templates = new InMemoryTemplateResolver();
        DeliveryAdapter email = new DeliveryAdapter() {
            @Override
            public ActionType getActionType() {
                return ActionType.EMAIL;
            }

            @Override
            public DeliveryReceipt send(ActionPayload payload) throws DeliveryException {
                if (failures.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
                    throw new DeliveryException("Mailbox unavailable", true);
                }
                sent.add(payload);
                return new DeliveryReceipt(payload.idempotencyKey(), ActionType.EMAIL, "msg-" + sent.size(), null);
            }
        };
        ledger = new InMemoryDeliveryLedger();
        handler = new ActionNodeHandler(templates, ledger, List.of(email));
    }

    private NodeContext context(WorkflowNode node) {
        return contextFor(node, variables(Map.of("contact", Map.of("name", "Ann", "email", "ann@example.com"))),
                List.of()).build();
    }

    @Test
    void interpolatesContentAndRecipients() throws Exception {
        WorkflowNode node = node("welcome", NodeType.ACTION, welcomeEmail);

        NodeResult result = handler.execute(handler.parseConfig(welcomeEmail), context(node));

        assertThat(sent).singleElement().satisfies(payload -> {
            assertEquals(List.of("ann@example.com"), payload.recipients());
            assertEquals("Welcome Ann", payload.subject());
            assertEquals("Hi Ann, thanks for joining.", payload.body());
            assertEquals("nx-welcome", payload.idempotencyKey());
        });
        assertEquals("msg-1", result.getOutput().get("providerId"));
        assertEquals(false, result.getOutput().get("duplicate"));
        assertEquals(NOW.toString(), result.getOutput().get("deliveredAt"));
    }

    @Test
    void secondInvocationWithTheSameKeyIsNotResent() throws Exception {
        WorkflowNode node = node("welcome", NodeType.ACTION, welcomeEmail);
        NodeContext context = context(node);

        handler.execute(handler.parseConfig(welcomeEmail), context);
        NodeResult again = handler.execute(handler.parseConfig(welcomeEmail), context);

        assertThat(sent).hasSize(1);
        assertEquals(true, again.getOutput().get("duplicate"));
        assertEquals("msg-1", again.getOutput().get("providerId"));
    }

    @Test
    void attemptOverlappingAnInFlightDeliveryDoesNotSend() {
        WorkflowNode node = node("welcome", NodeType.ACTION, welcomeEmail);
        ledger.reserve("nx-welcome");

        assertThatThrownBy(() -> handler.execute(handler.parseConfig(welcomeEmail), context(node)))
                .isInstanceOfSatisfying(NodeExecutionException.class, e -> assertTrue(e.isRetryable()))
                .hasMessageContaining("still in progress");
        assertThat(sent).isEmpty();
    }

    @Test
    void failedDeliveryReleasesItsKey() throws Exception {
        WorkflowNode node = node("welcome", NodeType.ACTION, welcomeEmail);
        failures.set(1);

        assertThatThrownBy(() -> handler.execute(handler.parseConfig(welcomeEmail), context(node)))
                .isInstanceOf(DeliveryException.class);
        NodeResult retried = handler.execute(handler.parseConfig(welcomeEmail), context(node));

        assertThat(sent).hasSize(1);
        assertEquals(false, retried.getOutput().get("duplicate"));
    }

    @Test
    void loopIterationsHaveTheirOwnKeys() throws Exception {
        WorkflowNode node = node("welcome", NodeType.ACTION, welcomeEmail);
        for (int i = 0; i < 2; i++) {
            NodeContext context = contextFor(node, variables(Map.of("contact", Map.of("name", "N", "email", "n@x.io"))),
                    List.of()).iterationPath(List.of(0, i)).build();
            handler.execute(handler.parseConfig(welcomeEmail), context);
        }

        assertThat(sent).extracting(ActionPayload::idempotencyKey).containsExactly("nx-welcome:0:0", "nx-welcome:0:1");
    }

    @Test
    void lockedTemplateIgnoresInlineOverrides() throws Exception {
        templates.register(new MessageTemplate("tpl-1", null, "Welcome", "Hello {{contact.name}}",
                "Template body", true));
        Map<String, Object> config = Map.of("actionType", "EMAIL", "contentMode", "TEMPLATE", "templateId", "tpl-1",
                "recipients", List.of("{{contact.email}}"), "subject", "Ignored");

        handler.execute(handler.parseConfig(config), context(node("welcome", NodeType.ACTION, config)));

        assertThat(sent).singleElement().satisfies(payload -> {
            assertEquals("Hello Ann", payload.subject());
            assertEquals("tpl-1", payload.templateId());
        });
    }

    @Test
    void templateOfAnotherOrganizationIsNotVisible() {
        templates.register(new MessageTemplate("tpl-2", "org-2", "Private", "s", "b", false));
        Map<String, Object> config = Map.of("actionType", "EMAIL", "contentMode", "TEMPLATE", "templateId", "tpl-2",
                "recipients", List.of("a@b.c"));

        assertThatThrownBy(() -> handler.execute(handler.parseConfig(config),
                context(node("welcome", NodeType.ACTION, config))))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("Cannot resolve content");
        assertThat(sent).isEmpty();
    }

    @Test
    void missingAdapterIsNotRetryable() {
        Map<String, Object> config = Map.of("actionType", "SMS", "recipients", List.of("+15550100"), "body", "Hi");

        assertThatThrownBy(() -> handler.execute(handler.parseConfig(config),
                context(node("text", NodeType.ACTION, config))))
                .isInstanceOfSatisfying(NodeExecutionException.class, e -> assertFalse(e.isRetryable()));
    }

    @Test
    void validationDependsOnActionType() {
        assertThat(handler.validate(Map.of("actionType", "EMAIL", "body", "x")).getErrors())
                .extracting(ValidationIssue::getFieldPath).containsExactly("recipients");
        assertThat(handler.validate(Map.of("actionType", "SLACK", "body", "x")).getErrors())
                .extracting(ValidationIssue::getFieldPath).containsExactly("channel");
        assertThat(handler.validate(Map.of("actionType", "EMAIL", "recipients", List.of("a@b.c"))).getErrors())
                .extracting(ValidationIssue::getFieldPath).containsExactly("body");
        assertThat(handler.validate(Map.of("actionType", "EMAIL", "contentMode", "TEMPLATE",
                "recipients", List.of("a@b.c"))).getErrors())
                .extracting(ValidationIssue::getFieldPath).containsExactly("templateId");
        assertThat(handler.validate(Map.of("actionType", "FAX", "body", "x")).getErrors())
                .extracting(ValidationIssue::getFieldPath).containsExactly("actionType");
    }
}
