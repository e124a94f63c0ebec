package dev.mars.autoflow.workflow.action;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic description of one side effect, fully interpolated.
 *
 * @param idempotencyKey key adapters may pass on to providers that deduplicate
 * @param actionType     what kind of delivery this is
 * @param organizationId tenant the delivery is made for
 * @param executionId    execution that requested it
 * @param nodeId         ACTION node that requested it
 * @param recipients     addresses, numbers or user ids
 * @param subject        subject line, may be null
 * @param body           message text
 * @param templateId     template the content came from, may be null
 * @param attributes     action-specific extras such as a Slack channel or calendar times
 */
public record ActionPayload(String idempotencyKey, ActionType actionType, String organizationId, String executionId,
                            String nodeId, List<String> recipients, String subject, String body, String templateId,
                            Map<String, Object> attributes) {

    public ActionPayload {
        Objects.requireNonNull(idempotencyKey, "Idempotency key cannot be null");
        Objects.requireNonNull(actionType, "Action type cannot be null");
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
