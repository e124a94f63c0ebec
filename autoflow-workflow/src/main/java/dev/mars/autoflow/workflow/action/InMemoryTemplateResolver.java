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

import dev.mars.autoflow.core.exceptions.NotFoundException;
import dev.mars.autoflow.core.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Template resolver over templates registered in memory.
 */
public class InMemoryTemplateResolver implements TemplateResolver {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTemplateResolver.class);

    private final Map<String, MessageTemplate> templates = new ConcurrentHashMap<>();

    public void register(MessageTemplate template) {
        templates.put(template.id(), template);
        logger.debug("Registered message template {} for organization {}", template.id(), template.organizationId());
    }

    @Override
    public ResolvedContent resolve(ContentMode mode, String templateId, String organizationId, ResolvedContent fallback)
            throws NotFoundException, ValidationException {
        ResolvedContent inline = fallback == null ? ResolvedContent.inline(null, null) : fallback;
        if (mode == ContentMode.CUSTOM) {
            if (inline.isEmpty()) {
                throw new ValidationException("Content is required in CUSTOM mode",
                        List.of("subject or body must be set"));
            }
            return inline;
        }

        if (templateId == null || templateId.isBlank()) {
            throw new ValidationException("Template is required in TEMPLATE mode", List.of("templateId is required"));
        }
        MessageTemplate template = templates.get(templateId);
        if (template == null || !template.isVisibleTo(organizationId)) {
            throw new NotFoundException("Template", templateId);
        }
        if (template.locked()) {
            return new ResolvedContent(template.subject(), template.body(), template.id());
        }
        return new ResolvedContent(
                inline.subject() != null ? inline.subject() : template.subject(),
                inline.body() != null ? inline.body() : template.body(),
                template.id());
    }
}
