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

import java.util.List;
import java.util.Objects;

/**
 * Children combined with AND or OR. An empty group is always true.
 */
public record ConditionGroup(LogicalOperator operator, List<ConditionNode> conditions) implements ConditionNode {

    public static final ConditionGroup EMPTY = new ConditionGroup(LogicalOperator.AND, List.of());

    public ConditionGroup {
        Objects.requireNonNull(operator, "operator");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static ConditionGroup allOf(ConditionNode... conditions) {
        return new ConditionGroup(LogicalOperator.AND, List.of(conditions));
    }

    public static ConditionGroup anyOf(ConditionNode... conditions) {
        return new ConditionGroup(LogicalOperator.OR, List.of(conditions));
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }
}
