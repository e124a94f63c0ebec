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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private final Map<String, Object> deal = Map.of(
            "stage", "won",
            "amount", 1500,
            "owner", Map.of("email", "Alice@Example.com"),
            "tags", List.of("priority", "renewal"),
            "closedOn", "2025-10-15",
            "notes", "");

    private static boolean eval(Condition condition, Object document) {
        return ConditionEvaluator.evaluate(condition, document);
    }

    @Test
    void emptyGroupAlwaysPasses() {
        assertTrue(ConditionEvaluator.evaluate(ConditionGroup.EMPTY, deal));
    }

    @Test
    void numbersCompareByValueAcrossTypes() {
        assertTrue(eval(Condition.of("amount", ConditionOperator.EQUALS, "1500.0"), deal));
        assertTrue(eval(Condition.of("amount", ConditionOperator.GREATER_THAN, 1000L), deal));
        assertFalse(eval(Condition.of("amount", ConditionOperator.LESS_THAN_OR_EQUAL, 1499), deal));
    }

    @Test
    void missingFieldNeverSatisfiesOrderingComparisons() {
        assertFalse(eval(Condition.of("discount", ConditionOperator.GREATER_THAN, 0), deal));
        assertFalse(eval(Condition.of("discount", ConditionOperator.LESS_THAN, 0), deal));
        assertTrue(eval(Condition.of("discount", ConditionOperator.IS_EMPTY, null), deal));
    }

    @Test
    void textMatchingIgnoresCase() {
        assertTrue(eval(Condition.of("owner.email", ConditionOperator.ENDS_WITH, "@example.COM"), deal));
        assertTrue(eval(Condition.of("owner.email", ConditionOperator.STARTS_WITH, "alice"), deal));
        assertTrue(eval(Condition.of("owner.email", ConditionOperator.CONTAINS, "EXAMPLE"), deal));
    }

    @Test
    void containsChecksListMembership() {
        assertTrue(eval(Condition.of("tags", ConditionOperator.CONTAINS, "renewal"), deal));
        assertTrue(eval(Condition.of("tags", ConditionOperator.NOT_CONTAINS, "churn"), deal));
    }

    @Test
    void inAndNotInUseTheValuesList() {
        Condition in = new Condition("stage", ConditionOperator.IN, null, null, List.of("won", "lost"), false);
        Condition notIn = new Condition("stage", ConditionOperator.NOT_IN, null, null, List.of("open"), false);

        assertTrue(eval(in, deal));
        assertTrue(eval(notIn, deal));
    }

    @Test
    void betweenIsInclusiveAndComparesDates() {
        Condition amount = new Condition("amount", ConditionOperator.BETWEEN, 1500, 2000, null, false);
        Condition closed = new Condition("closedOn", ConditionOperator.BETWEEN, "2025-10-01", "2025-10-31", null, false);

        assertTrue(eval(amount, deal));
        assertTrue(eval(closed, deal));
    }

    @Test
    void blankTextIsEmpty() {
        assertTrue(eval(Condition.of("notes", ConditionOperator.IS_EMPTY, null), deal));
        assertTrue(eval(Condition.of("tags", ConditionOperator.IS_NOT_EMPTY, null), deal));
    }

    @Test
    void negateInvertsTheOutcome() {
        Condition notWon = new Condition("stage", ConditionOperator.EQUALS, "won", null, null, true);
        assertFalse(eval(notWon, deal));
    }

    @Test
    void groupsCombineWithTheirOperator() {
        Condition won = Condition.of("stage", ConditionOperator.EQUALS, "won");
        Condition small = Condition.of("amount", ConditionOperator.LESS_THAN, 100);

        assertFalse(ConditionEvaluator.evaluate(ConditionGroup.allOf(won, small), deal));
        assertTrue(ConditionEvaluator.evaluate(ConditionGroup.anyOf(won, small), deal));
        assertTrue(ConditionEvaluator.evaluate(ConditionGroup.anyOf(small, ConditionGroup.allOf(won)), deal));
    }

    @Test
    void sortOrderPutsNullsLast() {
        assertTrue(ConditionEvaluator.compareForSort(null, 5) > 0);
        assertTrue(ConditionEvaluator.compareForSort(5, null) < 0);
        assertTrue(ConditionEvaluator.compareForSort(2, 10) < 0);
    }
}
