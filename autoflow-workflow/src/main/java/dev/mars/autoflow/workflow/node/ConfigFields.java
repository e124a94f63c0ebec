package dev.mars.autoflow.workflow.node;

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

import dev.mars.autoflow.workflow.condition.ConditionParser;
import dev.mars.autoflow.workflow.validation.ValidationResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Map;

/**
 * Typed, validating reads over a raw configuration map. Each accessor records a
 * problem in the shared {@link ValidationResult} instead of throwing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class ConfigFields {

    private final Map<String, Object> raw;
    private final ValidationResult result;

    public ConfigFields(Map<String, Object> raw, ValidationResult result) {
        this.raw = raw;
        this.result = result;
    }

    public Map<String, Object> raw() {
        return raw;
    }

    public ValidationResult result() {
        return result;
    }

    public boolean has(String key) {
        Object value = raw.get(key);
        return value != null && !(value instanceof CharSequence text && text.toString().isBlank());
    }

    public void error(String key, String message) {
        result.addError(key, message);
    }

    public String string(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof CharSequence) && !(value instanceof Number) && !(value instanceof Boolean)) {
            result.addError(key, "must be a string");
            return null;
        }
        return value.toString();
    }

    public String requiredString(String key) {
        if (!has(key)) {
            result.addError(key, "is required");
            return null;
        }
        return string(key);
    }

    /**
     * Reads an integral number within [min, max].
     */
    public Long number(String key, long min, long max) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        BigDecimal number;
        try {
            number = value instanceof Number n ? new BigDecimal(n.toString()) : new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            result.addError(key, "must be a number");
            return null;
        }
        if (number.stripTrailingZeros().scale() > 0) {
            result.addError(key, "must be a whole number");
            return null;
        }
        if (number.compareTo(BigDecimal.valueOf(min)) < 0 || number.compareTo(BigDecimal.valueOf(max)) > 0) {
            result.addError(key, String.format("must be between %d and %d", min, max));
            return null;
        }
        return number.longValue();
    }

    public Boolean bool(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        result.addError(key, "must be true or false");
        return null;
    }

    public Collection<?> list(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Collection<?> collection)) {
            result.addError(key, "must be a list");
            return null;
        }
        return collection;
    }

    public Map<?, ?> map(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            result.addError(key, "must be an object");
            return null;
        }
        return map;
    }

    public Instant instant(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        try {
            return Instant.parse(value.toString().trim());
        } catch (DateTimeParseException e) {
            result.addError(key, "must be an ISO-8601 instant");
            return null;
        }
    }

    /**
     * Validates a predicate under {@code key} combined by the sibling {@code logicalOperator}.
     */
    public void conditions(String key, boolean required) {
        Object value = raw.get(key);
        if (value == null || (value instanceof Collection<?> collection && collection.isEmpty())) {
            if (required) {
                result.addError(key, "at least one condition is required");
            }
            return;
        }
        Object logicalOperator = raw.get("logicalOperator");
        ConditionParser.validate(value, logicalOperator == null ? null : logicalOperator.toString(), key, result);
    }

    /**
     * Validates that at most one of the keys is set, and exactly one when {@code required}.
     */
    public void exclusive(boolean required, String... keys) {
        int present = 0;
        for (String key : keys) {
            if (has(key)) {
                present++;
            }
        }
        if (present > 1 || (required && present == 0)) {
            result.addError(keys[0], (required ? "exactly" : "at most") + " one of "
                    + String.join(", ", keys) + " must be set");
        }
    }
}
