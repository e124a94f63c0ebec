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

import java.util.Locale;

/**
 * Where an ACTION node takes its message content from.
 */
public enum ContentMode {
    /** A stored template, optionally overridden by inline content unless the template is locked. */
    TEMPLATE,
    /** Inline subject and body only. */
    CUSTOM;

    public static ContentMode fromString(String value) {
        return value == null || value.isBlank() ? CUSTOM : ContentMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
