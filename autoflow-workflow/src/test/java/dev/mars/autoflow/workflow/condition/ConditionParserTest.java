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
import dev.mars.autoflow.core.condition.ConditionOperator;
import dev.mars.autoflow.core.condition.LogicalOperator;
import dev.mars.autoflow.workflow.validation.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionParserTest {

    @Test
    void nullParsesToTheEmptyGroup() {
        assertThat(ConditionParser.parse(null, null).isEmpty()).isTrue();
    }

    @Test
    void listOfConditionsUsesTheGivenOperator() {
        ConditionGroup group = ConditionParser.parse(List.of(
                Map.of("field", "stage", "operator", "==", "value", "won"),
                Map.of("field", "amount", "operator", "gt", "value", 100)), "or");

        assertThat(group.operator()).isEqualTo(LogicalOperator.OR);
        assertThat(group.conditions()).hasSize(2);
        Condition first = (Condition) group.conditions().get(0);
        assertThat(first.operator()).isEqualTo(ConditionOperator.EQUALS);
    }

    @Test
    void nestedGroupsKeepTheirOwnOperator() {
        ConditionGroup group = ConditionParser.parse(List.of(
                Map.of("field", "stage", "value", "won"),
                Map.of("logicalOperator", "OR", "conditions", List.of(
                        Map.of("field", "amount", "operator", "gte", "value", 1000),
                        Map.of("path", "priority", "operator", "equals", "value", true)))), null);

        assertThat(group.operator()).isEqualTo(LogicalOperator.AND);
        ConditionGroup nested = (ConditionGroup) group.conditions().get(1);
        assertThat(nested.operator()).isEqualTo(LogicalOperator.OR);
        assertThat(((Condition) nested.conditions().get(1)).field()).isEqualTo("priority");
    }

    @Test
    void inlineListIsAcceptedForIn() {
        ConditionGroup group = ConditionParser.parse(
                Map.of("field", "stage", "operator", "in", "value", List.of("won", "lost")), null);

        Condition condition = (Condition) group.conditions().get(0);
        assertThat(condition.values()).containsExactly("won", "lost");
    }

    @Test
    void everyProblemIsReported() {
        ValidationResult result = new ValidationResult();
        ConditionParser.validate(List.of(
                Map.of("operator", "equals", "value", 1),
                Map.of("field", "stage", "operator", "roughly", "value", 1),
                Map.of("field", "amount", "operator", "between", "value", 1),
                Map.of("field", "stage", "operator", "not_in")), "XOR", "conditions", result);

        assertThat(result.getErrors())
                .extracting(ValidationResult.ValidationIssue::getFieldPath)
                .containsExactly("logicalOperator", "conditions[0].field", "conditions[1].operator",
                        "conditions[2]", "conditions[3].values");
    }

    @Test
    void malformedPredicateCannotBeParsed() {
        assertThatThrownBy(() -> ConditionParser.parse("stage == won", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
