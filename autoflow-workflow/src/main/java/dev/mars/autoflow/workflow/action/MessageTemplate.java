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

import java.util.Objects;

/**
 * Stored message template.
 *
 * @param id             template id
 * @param organizationId owning organization, null for a template shared with every organization
 * @param name           display name
 * @param subject        subject line
 * @param body           message text with {@code {{variable}}} references
 * @param locked         true if inline content may not override the template
 */
public record MessageTemplate(String id, String organizationId, String name, String subject, String body,
                              boolean locked) {

    public MessageTemplate {
        Objects.requireNonNull(id, "Template ID cannot be null");
    }

    public boolean isVisibleTo(String organizationId) {
        return this.organizationId == null || this.organizationId.equals(organizationId);
    }
}
