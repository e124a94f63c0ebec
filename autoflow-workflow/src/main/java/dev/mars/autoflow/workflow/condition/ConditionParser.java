package dev.mars.autoflow.workflow.condition;

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

import dev.mars.autoflow.core.condition.Condition;
import dev.mars.autoflow.core.condition.ConditionGroup;
import dev.mars.autoflow.core.condition.ConditionNode;
import dev.mars.autoflow.core.condition.ConditionOperator;
import dev.mars.autoflow.core.condition.LogicalOperator;
import dev.mars.autoflow.workflow.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds predicate trees from raw configuration.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>a list of conditions, combined with the sibling {@code logicalOperator}</li>
 *   <li>a map with {@code conditions} and optional {@code logicalOperator}, which may nest</li>
 *   <li>a single condition map with {@code field} (or {@code path}), {@code operator},
 *       {@code value}, {@code valueTo}, {@code values} and {@code negate}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class ConditionParser {

    private ConditionParser() {
    }

    /**
     * Validates a raw predicate, recording every problem in {@code result}.
     */
    public static void validate(Object raw, String logicalOperator, String fieldPath, ValidationResult result) {
        if (logicalOperator != null) {
            try {
                LogicalOperator.fromString(logicalOperator);
            } catch (IllegalArgumentException e) {
                result.addError("logicalOperator", "must be AND or OR, was '" + logicalOperator + "'");
            }
        }
        parseNode(raw, logicalOperator, fieldPath, result);
    }

    /**
     * Parses a predicate that has already been validated.
     *
     * @throws IllegalArgumentException if the predicate is malformed
     */
    public static ConditionGroup parse(Object raw, String logicalOperator) {
        ValidationResult result = new ValidationResult();
        ConditionNode node = parseNode(raw, logicalOperator, "conditions", result);
        if (!result.isValid()) {
            throw new IllegalArgumentException("Invalid conditions: " + result.getErrors());
        }
        if (node instanceof ConditionGroup group) {
            return group;
        }
        return new ConditionGroup(LogicalOperator.AND, List.of(node));
    }

    private static ConditionNode parseNode(Object raw, String logicalOperator, String path, ValidationResult result) {
        if (raw == null) {
            return ConditionGroup.EMPTY;
        }
        if (raw instanceof Collection<?> items) {
            List<ConditionNode> children = new ArrayList<>();
            int index = 0;
            for (Object item : items) {
                children.add(parseNode(item, null, path + "[" + index++ + "]", result));
            }
            return new ConditionGroup(safeOperator(logicalOperator), children);
        }
        if (raw instanceof Map<?, ?> map) {
            if (map.containsKey("conditions")) {
                Object operator = map.get("logicalOperator");
                return parseNode(map.get("conditions"), operator == null ? null : operator.toString(),
                        path + ".conditions", result);
            }
            return parseCondition(map, path, result);
        }
        result.addError(path, "must be a list or an object, was " + raw.getClass().getSimpleName());
        return ConditionGroup.EMPTY;
    }

    private static ConditionNode parseCondition(Map<?, ?> map, String path, ValidationResult result) {
        Object field = map.get("field") != null ? map.get("field") : map.get("path");
        if (field == null || field.toString().isBlank()) {
            result.addError(path + ".field", "is required");
        }
        Object operatorValue = map.get("operator");
        ConditionOperator operator = operatorValue == null ? ConditionOperator.EQUALS
                : ConditionOperator.fromValue(operatorValue.toString()).orElse(null);
        if (operator == null) {
            result.addError(path + ".operator", "unknown operator '" + operatorValue + "'");
            return ConditionGroup.EMPTY;
        }

        Object value = map.get("value");
        Object valueTo = map.get("valueTo");
        List<Object> values = null;
        if (map.get("values") instanceof Collection<?> listed) {
            values = new ArrayList<>(listed);
        } else if (operator.requiresValues() && value instanceof Collection<?> inline) {
            values = new ArrayList<>(inline);
        }

        if (operator.requiresValues() && values == null) {
            result.addError(path + ".values", "operator " + operator.getWireName() + " requires a list of values");
        }
        if (operator == ConditionOperator.BETWEEN && (value == null || valueTo == null)) {
            result.addError(path, "operator between requires value and valueTo");
        }
        if (field == null || field.toString().isBlank()) {
            return ConditionGroup.EMPTY;
        }
        return new Condition(field.toString().trim(), operator, value, valueTo, values, isTrue(map.get("negate")));
    }

    private static LogicalOperator safeOperator(String logicalOperator) {
        try {
            return LogicalOperator.fromString(logicalOperator);
        } catch (IllegalArgumentException e) {
            return LogicalOperator.AND;
        }
    }

    private static boolean isTrue(Object value) {
        return value instanceof Boolean bool ? bool : value != null && "true".equals(value.toString().toLowerCase(Locale.ROOT));
    }
}
