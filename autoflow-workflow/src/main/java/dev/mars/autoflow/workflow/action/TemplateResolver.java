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

import dev.mars.autoflow.core.exceptions.AutoflowException;

/**
 * Resolves the content an ACTION node sends.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface TemplateResolver {

    /**
     * @param mode           where content comes from
     * @param templateId     template to use in {@link ContentMode#TEMPLATE} mode
     * @param organizationId organization the template must be visible to
     * @param fallback       inline content; overrides unlocked templates field by field
     * @throws AutoflowException if the template is missing or the resolved content is empty
     */
    ResolvedContent resolve(ContentMode mode, String templateId, String organizationId, ResolvedContent fallback)
            throws AutoflowException;
}
