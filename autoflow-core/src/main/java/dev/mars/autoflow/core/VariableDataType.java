package dev.mars.autoflow.core;

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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Declared type of an execution variable. Values are checked against the
 * declared type when a node reads them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum VariableDataType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    DATETIME,
    EMAIL,
    PHONE,
    URL,
    JSON,
    ARRAY;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?[0-9 ()\\-]{6,20}$");
    private static final Pattern URL_PATTERN = Pattern.compile("^https?://\\S+$", Pattern.CASE_INSENSITIVE);

    /**
     * Infers the most specific structural type of a value. String values are
     * always reported as {@link #STRING}; the semantic string types must be declared.
     */
    public static VariableDataType infer(Object value) {
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Collection || (value != null && value.getClass().isArray())) {
            return ARRAY;
        }
        if (value instanceof Map) {
            return JSON;
        }
        if (value instanceof LocalDate) {
            return DATE;
        }
        if (value instanceof TemporalAccessor) {
            return DATETIME;
        }
        return value == null ? JSON : STRING;
    }

    /**
     * Check if the value is acceptable for this type. Null is acceptable for every type.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        switch (this) {
            case NUMBER:
                return value instanceof Number || isNumeric(value);
            case BOOLEAN:
                return value instanceof Boolean
                        || "true".equalsIgnoreCase(value.toString())
                        || "false".equalsIgnoreCase(value.toString());
            case ARRAY:
                return value instanceof Collection || value.getClass().isArray();
            case JSON:
                return value instanceof Map || value instanceof Collection;
            case DATE:
                return value instanceof LocalDate || parsesAsDate(value.toString());
            case DATETIME:
                return value instanceof TemporalAccessor || parsesAsDateTime(value.toString());
            case EMAIL:
                return EMAIL_PATTERN.matcher(value.toString()).matches();
            case PHONE:
                return PHONE_PATTERN.matcher(value.toString()).matches();
            case URL:
                return URL_PATTERN.matcher(value.toString()).matches();
            default:
                return value instanceof CharSequence || value instanceof Number || value instanceof Boolean;
        }
    }

    private static boolean isNumeric(Object value) {
        if (!(value instanceof CharSequence)) {
            return false;
        }
        try {
            Double.parseDouble(value.toString().trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean parsesAsDate(String text) {
        try {
            LocalDate.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean parsesAsDateTime(String text) {
        try {
            OffsetDateTime.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            try {
                ZonedDateTime.parse(text);
                return true;
            } catch (DateTimeParseException ignored) {
                try {
                    LocalDateTime.parse(text);
                    return true;
                } catch (DateTimeParseException notLocal) {
                    return false;
                }
            }
        }
    }
}
