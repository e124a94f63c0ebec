package dev.mars.autoflow.workflow.node.config;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.autoflow.core.ActionType;
import dev.mars.autoflow.workflow.action.ContentMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of an ACTION node.
 *
 * <p>With {@link ContentMode#TEMPLATE} the subject and body come from a stored template,
 * falling back to the inline {@code subject}/{@code body}; with {@link ContentMode#CUSTOM}
 * the inline content is used directly. Every string may reference variables.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class ActionConfig {

    private final ActionType actionType;
    private final ContentMode contentMode;
    private final String templateId;
    private final List<String> recipients;
    private final String subject;
    private final String body;
    private final String channel;
    private final Map<String, Object> attributes;
    private final String resultKey;

    @JsonCreator
    public ActionConfig(@JsonProperty("actionType") String actionType,
                        @JsonProperty("contentMode") String contentMode,
                        @JsonProperty("templateId") String templateId,
                        @JsonProperty("recipients") List<String> recipients,
                        @JsonProperty("subject") String subject,
                        @JsonProperty("body") String body,
                        @JsonProperty("channel") String channel,
                        @JsonProperty("attributes") Map<String, Object> attributes,
                        @JsonProperty("resultKey") String resultKey) {
        this.actionType = ActionType.fromString(actionType);
        this.contentMode = ContentMode.fromString(contentMode);
        this.templateId = templateId;
        this.recipients = recipients == null ? List.of() : List.copyOf(recipients);
        this.subject = subject;
        this.body = body;
        this.channel = channel;
        this.attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.resultKey = resultKey;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public ContentMode getContentMode() {
        return contentMode;
    }

    public String getTemplateId() {
        return templateId;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    public String getChannel() {
        return channel;
    }

    /**
     * Action-specific extras, such as start and end time of a calendar event.
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public String getResultKey() {
        return resultKey;
    }
}
