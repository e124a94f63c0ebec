package dev.mars.autoflow.core.condition;

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
import java.util.Optional;

/**
 * Comparison operators usable in trigger, CONDITION, FILTER and QUERY predicates.
 * Each operator has a lower-case wire name used in node configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER_THAN("gt"),
    GREATER_THAN_OR_EQUAL("gte"),
    LESS_THAN("lt"),
    LESS_THAN_OR_EQUAL("lte"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    IN("in"),
    NOT_IN("not_in"),
    BETWEEN("between"),
    IS_EMPTY("is_empty"),
    IS_NOT_EMPTY("is_not_empty");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /** Operators that compare against a list in {@code values}. */
    public boolean requiresValues() {
        return this == IN || this == NOT_IN;
    }

    /** Operators that need no comparison value at all. */
    public boolean isUnary() {
        return this == IS_EMPTY || this == IS_NOT_EMPTY;
    }

    /**
     * Looks an operator up by wire name, also accepting the enum constant name and
     * the symbolic aliases {@code ==, !=, >, >=, <, <=}.
     */
    public static Optional<ConditionOperator> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "==":
            case "eq":
                return Optional.of(EQUALS);
            case "!=":
            case "ne":
                return Optional.of(NOT_EQUALS);
            case ">":
                return Optional.of(GREATER_THAN);
            case ">=":
                return Optional.of(GREATER_THAN_OR_EQUAL);
            case "<":
                return Optional.of(LESS_THAN);
            case "<=":
                return Optional.of(LESS_THAN_OR_EQUAL);
            default:
                break;
        }
        for (ConditionOperator operator : values()) {
            if (operator.wireName.equals(normalized) || operator.name().equalsIgnoreCase(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
