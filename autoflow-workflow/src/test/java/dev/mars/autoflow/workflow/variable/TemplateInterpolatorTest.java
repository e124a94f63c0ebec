package dev.mars.autoflow.workflow.variable;

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

import dev.mars.autoflow.core.VariableDataType;
import dev.mars.autoflow.core.condition.Condition;
import dev.mars.autoflow.core.condition.ConditionGroup;
import dev.mars.autoflow.core.condition.ConditionOperator;
import dev.mars.autoflow.storage.memory.InMemoryExecutionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TemplateInterpolatorTest {

    private ExecutionVariables variables;

    @BeforeEach
    void setUp() {
        variables = new ExecutionVariables("exec-1", new InMemoryExecutionRepository(), Clock.systemUTC());
        variables.set("contact", Map.of("firstName", "Ada", "emails", List.of("ada@example.com")), "trigger");
        variables.set("count", 3, "input");
        variables.set("deals", List.of(Map.of("id", "d1"), Map.of("id", "d2")), "query");
    }

    @Test
    void testStringTemplateResolution() throws Exception {
        assertEquals("Hi Ada, you have 3 deals",
                TemplateInterpolator.interpolate("Hi {{contact.firstName}}, you have {{ count }} deals", variables));
    }

    @Test
    void testWholeReferenceKeepsItsType() throws Exception {
        Object resolved = TemplateInterpolator.interpolateValue("{{deals}}", variables);
        assertInstanceOf(List.class, resolved);
        assertEquals(2, ((List<?>) resolved).size());
        assertEquals("ada@example.com", TemplateInterpolator.interpolateValue("{{contact.emails[0]}}", variables));
    }

    @Test
    void testNestedValuesAreResolved() throws Exception {
        Object resolved = TemplateInterpolator.interpolateValue(
                Map.of("to", List.of("{{contact.emails.0}}"), "count", "{{count}}"), variables);
        assertEquals(Map.of("to", List.of("ada@example.com"), "count", 3), resolved);
    }

    @Test
    void testMissingVariableFails() {
        VariableResolutionException exception = assertThrows(VariableResolutionException.class,
                () -> TemplateInterpolator.interpolate("Hello {{contact.lastName}}", variables));
        assertTrue(exception.getMessage().contains("contact.lastName"));
        assertFalse(exception.isRetryable());
    }

    @Test
    void testReferencesAreExtracted() {
        assertEquals(Set.of("a", "b.c"), TemplateInterpolator.extractReferences("{{a}} and {{ b.c }} and {{a}}"));
        assertTrue(TemplateInterpolator.hasVariables("x {{y}}"));
        assertFalse(TemplateInterpolator.hasVariables("plain"));
        assertEquals("deals", TemplateInterpolator.unwrapReference(" {{ deals }} "));
        assertEquals("deals", TemplateInterpolator.unwrapReference("deals"));
    }

    @Test
    void testConditionValuesAreInterpolatedButFieldsAreNot() throws Exception {
        ConditionGroup group = ConditionGroup.allOf(Condition.of("{{count}}", ConditionOperator.EQUALS, "{{count}}"));
        ConditionGroup resolved = (ConditionGroup) TemplateInterpolator.interpolateConditions(group, variables);
        Condition condition = (Condition) resolved.conditions().get(0);
        assertEquals("{{count}}", condition.field());
        assertEquals(3, condition.value());
    }

    @Test
    void testChildScopeShadowsWithoutWritingThrough() {
        VariableScope child = variables.child(Map.of("count", 10, "item", "x"));
        child.set("extra", true, "local");

        assertEquals(10, child.resolve("count"));
        assertEquals("Ada", child.resolve("contact.firstName"));
        assertEquals(3, variables.resolve("count"));
        assertFalse(variables.contains("extra"));
    }

    @Test
    void testTypedWriteRejectsMismatchedValue() {
        assertThrows(IllegalArgumentException.class,
                () -> variables.set("when", "not a number", VariableDataType.NUMBER, "input"));
    }
}
