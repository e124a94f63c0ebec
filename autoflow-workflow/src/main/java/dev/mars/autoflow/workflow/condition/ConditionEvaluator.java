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
import dev.mars.autoflow.core.condition.LogicalOperator;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Evaluates predicate trees.
 *
 * <p>Comparison rules: numbers (and numeric strings) compare numerically, ISO dates and
 * timestamps compare chronologically, everything else compares as text. Text
 * containment and prefix/suffix checks ignore case. A missing value never satisfies a
 * comparison other than {@code not_equals}, {@code not_contains}, {@code not_in} and
 * {@code is_empty}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class ConditionEvaluator {

    private static final int UNCOMPARABLE = Integer.MIN_VALUE;

    private ConditionEvaluator() {
    }

    /**
     * Evaluates against a document, resolving each condition's field as a dot path.
     */
    public static boolean evaluate(ConditionNode node, Object document) {
        return evaluate(node, path -> FieldPaths.resolve(document, path));
    }

    public static boolean evaluate(ConditionNode node, Function<String, Object> lookup) {
        if (node instanceof ConditionGroup group) {
            return evaluateGroup(group, lookup);
        }
        Condition condition = (Condition) node;
        boolean outcome = test(condition, lookup.apply(condition.field()));
        return condition.negate() != outcome;
    }

    private static boolean evaluateGroup(ConditionGroup group, Function<String, Object> lookup) {
        if (group.isEmpty()) {
            return true;
        }
        if (group.operator() == LogicalOperator.AND) {
            for (ConditionNode child : group.conditions()) {
                if (!evaluate(child, lookup)) {
                    return false;
                }
            }
            return true;
        }
        for (ConditionNode child : group.conditions()) {
            if (evaluate(child, lookup)) {
                return true;
            }
        }
        return false;
    }

    static boolean test(Condition condition, Object actual) {
        Object expected = condition.value();
        switch (condition.operator()) {
            case EQUALS:
                return valuesEqual(actual, expected);
            case NOT_EQUALS:
                return !valuesEqual(actual, expected);
            case GREATER_THAN:
                return isComparable(compare(actual, expected)) && compare(actual, expected) > 0;
            case GREATER_THAN_OR_EQUAL:
                return isComparable(compare(actual, expected)) && compare(actual, expected) >= 0;
            case LESS_THAN:
                return isComparable(compare(actual, expected)) && compare(actual, expected) < 0;
            case LESS_THAN_OR_EQUAL:
                return isComparable(compare(actual, expected)) && compare(actual, expected) <= 0;
            case CONTAINS:
                return contains(actual, expected);
            case NOT_CONTAINS:
                return !contains(actual, expected);
            case STARTS_WITH:
                return actual != null && expected != null
                        && lower(actual).startsWith(lower(expected));
            case ENDS_WITH:
                return actual != null && expected != null
                        && lower(actual).endsWith(lower(expected));
            case IN:
                return in(actual, condition.values());
            case NOT_IN:
                return !in(actual, condition.values());
            case BETWEEN:
                return actual != null
                        && isComparable(compare(actual, expected)) && compare(actual, expected) >= 0
                        && isComparable(compare(actual, condition.valueTo())) && compare(actual, condition.valueTo()) <= 0;
            case IS_EMPTY:
                return isEmpty(actual);
            case IS_NOT_EMPTY:
                return !isEmpty(actual);
            default:
                throw new IllegalStateException("Unhandled operator " + condition.operator());
        }
    }

    private static boolean isComparable(int comparison) {
        return comparison != UNCOMPARABLE;
    }

    /**
     * @return negative, zero or positive, or {@link #UNCOMPARABLE} when either side is null
     */
    static int compare(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return UNCOMPARABLE;
        }
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        Instant leftTime = toInstant(actual);
        Instant rightTime = toInstant(expected);
        if (leftTime != null && rightTime != null) {
            return leftTime.compareTo(rightTime);
        }
        return actual.toString().compareTo(expected.toString());
    }

    /**
     * Ordering used when sorting records: same rules as comparisons, nulls last.
     */
    public static int compareForSort(Object left, Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : 1) : -1;
        }
        return compare(left, right);
    }

    static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == null && expected == null;
        }
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return actual.toString().equalsIgnoreCase(expected.toString());
        }
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(actual.toString(), expected.toString());
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(element -> valuesEqual(element, expected));
        }
        if (actual.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(actual); i++) {
                if (valuesEqual(Array.get(actual, i), expected)) {
                    return true;
                }
            }
            return false;
        }
        if (actual instanceof Map<?, ?> map) {
            return expected != null && map.containsKey(expected.toString());
        }
        return expected != null && lower(actual).contains(lower(expected));
    }

    private static boolean in(Object actual, List<Object> candidates) {
        for (Object candidate : candidates) {
            if (valuesEqual(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }

    private static String lower(Object value) {
        return value.toString().toLowerCase(Locale.ROOT);
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof TemporalAccessor temporal) {
            try {
                return Instant.from(temporal);
            } catch (DateTimeException e) {
                return null;
            }
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            try {
                return OffsetDateTime.parse(trimmed).toInstant();
            } catch (DateTimeParseException e) {
                try {
                    return LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException notADate) {
                    return null;
                }
            }
        }
        return null;
    }
}
