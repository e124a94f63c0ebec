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

/**
 * Message content after template resolution and before variable interpolation.
 *
 * @param subject    subject line, may be null for channels without one
 * @param body       message text
 * @param templateId the template the content came from, null for inline content
 */
public record ResolvedContent(String subject, String body, String templateId) {

    public static ResolvedContent inline(String subject, String body) {
        return new ResolvedContent(subject, body, null);
    }

    public boolean isEmpty() {
        return (subject == null || subject.isBlank()) && (body == null || body.isBlank());
    }
}
