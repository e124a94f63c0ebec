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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes node configuration submitted by editors: strings are trimmed at any depth.
 */
final class ConfigSanitizer {

    private ConfigSanitizer() {
    }

    static Map<String, Object> sanitize(Map<String, Object> config) {
        if (config == null) {
            return Map.of();
        }
        Map<String, Object> sanitized = new LinkedHashMap<>();
        config.forEach((key, value) -> sanitized.put(key.trim(), sanitizeValue(value)));
        return sanitized;
    }

    @SuppressWarnings("unchecked")
    private static Object sanitizeValue(Object value) {
        if (value instanceof String) {
            return ((String) value).trim();
        }
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<Object, Object>) value).forEach((key, entry) -> nested.put(String.valueOf(key).trim(), sanitizeValue(entry)));
            return nested;
        }
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                items.add(sanitizeValue(item));
            }
            return items;
        }
        return value;
    }
}
