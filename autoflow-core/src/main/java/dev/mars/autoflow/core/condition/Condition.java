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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single comparison of the value at {@code field} (a dot path) against a constant.
 *
 * @param field    dot path of the value under test
 * @param operator comparison operator
 * @param value    comparison value, unused by unary operators
 * @param valueTo  upper bound for {@link ConditionOperator#BETWEEN}
 * @param values   candidate list for {@link ConditionOperator#IN} and {@link ConditionOperator#NOT_IN}
 * @param negate   invert the outcome
 */
public record Condition(String field, ConditionOperator operator, Object value, Object valueTo,
                        List<Object> values, boolean negate) implements ConditionNode {

    public Condition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Condition of(String field, ConditionOperator operator, Object value) {
        return new Condition(field, operator, value, null, null, false);
    }
}
