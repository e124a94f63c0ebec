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
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.NodeExecutionException;
import dev.mars.autoflow.storage.DeliveryLedger;
import dev.mars.autoflow.workflow.action.ActionPayload;
import dev.mars.autoflow.workflow.action.ContentMode;
import dev.mars.autoflow.workflow.action.DeliveryAdapter;
import dev.mars.autoflow.workflow.action.ResolvedContent;
import dev.mars.autoflow.workflow.action.TemplateResolver;
import dev.mars.autoflow.workflow.node.AbstractNodeHandler;
import dev.mars.autoflow.workflow.node.ConfigFields;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.node.config.ActionConfig;
import dev.mars.autoflow.workflow.variable.TemplateInterpolator;
import dev.mars.autoflow.workflow.variable.VariableScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Performs a side effect through the {@link DeliveryAdapter} registered for the action type.
 *
 * <p>Before calling the adapter the handler consults the {@link DeliveryLedger} under the
 * context's idempotency key; a key that already has a receipt completes without
 * sending again. The key is claimed for the duration of the adapter call, so an attempt
 * that overlaps a slower one for the same key fails as retryable instead of sending twice.
 * A successful delivery is recorded under the same key; a failed one releases the claim.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class ActionNodeHandler extends AbstractNodeHandler<ActionConfig> {

    private static final Logger logger = LoggerFactory.getLogger(ActionNodeHandler.class);

    private final TemplateResolver templateResolver;
    private final DeliveryLedger ledger;
    private final Map<ActionType, DeliveryAdapter> adapters = new EnumMap<>(ActionType.class);

    public ActionNodeHandler(TemplateResolver templateResolver, DeliveryLedger ledger,
                             Collection<? extends DeliveryAdapter> adapters) {
        super(NodeType.ACTION, ActionConfig.class);
        this.templateResolver = Objects.requireNonNull(templateResolver, "Template resolver cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Delivery ledger cannot be null");
        for (DeliveryAdapter adapter : adapters) {
            this.adapters.put(adapter.getActionType(), adapter);
        }
    }

    @Override
    protected void validateFields(ConfigFields fields) {
        ActionType actionType = null;
        String type = fields.requiredString("actionType");
        if (type != null) {
            try {
                actionType = ActionType.fromString(type);
            } catch (IllegalArgumentException e) {
                fields.error("actionType", "unknown action type '" + type + "'");
            }
        }

        ContentMode mode = null;
        String contentMode = fields.string("contentMode");
        try {
            mode = ContentMode.fromString(contentMode);
        } catch (IllegalArgumentException e) {
            fields.error("contentMode", "must be TEMPLATE or CUSTOM");
        }
        if (mode == ContentMode.TEMPLATE) {
            fields.requiredString("templateId");
        } else if (mode == ContentMode.CUSTOM && !fields.has("subject") && !fields.has("body")) {
            fields.error("body", "subject or body is required when contentMode is CUSTOM");
        }
        fields.string("subject");
        fields.string("body");
        fields.map("attributes");
        fields.string("resultKey");

        Object recipients = fields.raw().get("recipients");
        if (recipients instanceof Collection<?> list) {
            if (list.isEmpty() && actionType != null && actionType.isRecipientsRequired()) {
                fields.error("recipients", "at least one recipient is required for " + actionType);
            }
        } else if (recipients != null) {
            fields.string("recipients");
        } else if (actionType != null && actionType.isRecipientsRequired()) {
            fields.error("recipients", "at least one recipient is required for " + actionType);
        }
        if (actionType == ActionType.SLACK) {
            fields.requiredString("channel");
        }
    }

    @Override
    public NodeResult execute(ActionConfig config, NodeContext context) throws AutoflowException {
        String nodeId = context.getNodeId();
        String key = context.idempotencyKey();

        Optional<DeliveryReceipt> existing = ledger.find(key);
        if (existing.isPresent()) {
            logger.info("Action {} already delivered under key {}, not sending again", nodeId, key);
            return result(config, existing.get(), List.of(), true);
        }

        DeliveryAdapter adapter = adapters.get(config.getActionType());
        if (adapter == null) {
            throw new NodeExecutionException(nodeId,
                    "No delivery adapter registered for " + config.getActionType(), false);
        }

        ResolvedContent content;
        try {
            content = templateResolver.resolve(config.getContentMode(), config.getTemplateId(),
                    context.getOrganizationId(), ResolvedContent.inline(config.getSubject(), config.getBody()));
        } catch (AutoflowException e) {
            throw new NodeExecutionException(nodeId, "Cannot resolve content: " + e.getMessage(), e);
        }

        VariableScope variables = context.getVariables();
        List<String> recipients = recipients(config, variables);
        if (recipients.isEmpty() && config.getActionType().isRecipientsRequired()) {
            throw new NodeExecutionException(nodeId, "No recipients resolved for " + config.getActionType(), false);
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        Object resolvedAttributes = TemplateInterpolator.interpolateValue(config.getAttributes(), variables);
        if (resolvedAttributes instanceof Map<?, ?> map) {
            map.forEach((name, value) -> attributes.put(String.valueOf(name), value));
        }
        if (config.getChannel() != null) {
            attributes.put("channel", TemplateInterpolator.interpolate(config.getChannel(), variables));
        }

        ActionPayload payload = new ActionPayload(key, config.getActionType(), context.getOrganizationId(),
                context.getExecution().getId(), nodeId, recipients,
                TemplateInterpolator.interpolate(content.subject(), variables),
                TemplateInterpolator.interpolate(content.body(), variables),
                content.templateId(), attributes);

        if (!ledger.reserve(key)) {
            Optional<DeliveryReceipt> concurrent = ledger.find(key);
            if (concurrent.isPresent()) {
                return result(config, concurrent.get(), List.of(), true);
            }
            throw new NodeExecutionException(nodeId, "Delivery under key " + key + " is still in progress");
        }
        DeliveryReceipt receipt;
        boolean sent = false;
        try {
            DeliveryReceipt delivered = adapter.send(payload);
            receipt = new DeliveryReceipt(key, config.getActionType(),
                    delivered == null ? null : delivered.providerId(),
                    delivered == null || delivered.deliveredAt() == null ? context.now() : delivered.deliveredAt());
            sent = true;
            if (!ledger.record(receipt)) {
                logger.warn("Delivery receipt for key {} was already recorded", key);
            }
        } finally {
            if (!sent) {
                ledger.release(key);
            }
        }
        logger.info("Action {} delivered {} to {} recipients", nodeId, config.getActionType(), recipients.size());
        return result(config, receipt, recipients, false);
    }

    private static List<String> recipients(ActionConfig config, VariableScope variables) throws AutoflowException {
        List<String> recipients = new ArrayList<>();
        for (String recipient : config.getRecipients()) {
            Object resolved = TemplateInterpolator.interpolateValue(recipient, variables);
            if (resolved instanceof Collection<?> many) {
                many.stream().filter(Objects::nonNull).map(Object::toString).forEach(recipients::add);
            } else if (resolved != null && !resolved.toString().isBlank()) {
                recipients.add(resolved.toString().trim());
            }
        }
        return recipients;
    }

    private static NodeResult result(ActionConfig config, DeliveryReceipt receipt, List<String> recipients,
                                     boolean duplicate) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("actionType", config.getActionType().name());
        output.put("delivered", true);
        output.put("duplicate", duplicate);
        output.put("providerId", receipt.providerId());
        output.put("recipients", recipients);
        output.put("deliveredAt", receipt.deliveredAt() == null ? null : receipt.deliveredAt().toString());
        return NodeResult.completed(output, config.getResultKey(), output);
    }
}
