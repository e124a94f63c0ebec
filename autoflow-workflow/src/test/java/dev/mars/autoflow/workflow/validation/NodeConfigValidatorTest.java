package dev.mars.autoflow.workflow.validation;

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

import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.exceptions.ValidationException;
import dev.mars.autoflow.workflow.graph.WorkflowGraph;
import dev.mars.autoflow.workflow.validation.ValidationResult.ValidationIssue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dev.mars.autoflow.workflow.WorkflowTestSupport.delay;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.edge;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.node;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.registry;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeConfigValidatorTest {

    private NodeConfigValidator validator;

    private final WorkflowNode query = node("q", NodeType.QUERY, Map.of("model", "deals", "resultKey", "deals"));
    private final WorkflowNode filter = node("f", NodeType.FILTER, Map.of(
            "sourceKey", "{{deals}}",
            "conditions", List.of(Map.of("field", "stage", "operator", "equals", "value", "won"))));

    @BeforeEach
    void setUp() {
        validator = new NodeConfigValidator(registry());
    }

    @Test
    @DisplayName("A connected workflow whose references are produced upstream is valid")
    void validWorkflow() {
        ValidationResult result = validator.validateWorkflow(
                List.of(trigger("start"), query, filter),
                List.of(edge("start", "q"), edge("q", "f")));

        assertThat(result.isValid()).as(result.getErrors().toString()).isTrue();
        assertThat(result.hasWarnings()).isFalse();
    }

    @Test
    @DisplayName("Node configuration errors are reported under the node's path")
    void configErrorsArePrefixed() {
        ValidationResult result = validator.validateNode(node("f", NodeType.FILTER, Map.of("resultKey", "x")));

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getFieldPath)
                .containsExactly("nodes[f].sourceKey", "nodes[f].conditions");
    }

    @Test
    void delayRangeIsChecked() {
        assertThat(validator.validateNode(delay("wait", -1)).isValid()).isFalse();
        assertThat(validator.validateNode(node("wait", NodeType.DELAY, Map.of("delayMs", 1.5))).isValid()).isFalse();
        assertThat(validator.validateNode(delay("wait", 60_000)).isValid()).isTrue();
    }

    @Test
    @DisplayName("Reading a variable produced only downstream is an error")
    void referenceToDownstreamProducer() {
        ValidationResult result = validator.validateWorkflow(
                List.of(trigger("start"), filter, query),
                List.of(edge("start", "f"), edge("f", "q")));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).anySatisfy(issue -> {
            assertThat(issue.getFieldPath()).isEqualTo("nodes[f]");
            assertThat(issue.getMessage()).contains("'deals'").contains("[q]");
        });
    }

    @Test
    @DisplayName("References nobody produces are left to trigger data")
    void unknownReferenceIsAllowed() {
        WorkflowNode reader = node("f", NodeType.FILTER, Map.of(
                "sourceKey", "contacts",
                "conditions", List.of(Map.of("field", "email", "operator", "is_not_empty"))));

        assertThat(validator.validateWorkflow(List.of(trigger("start"), reader), List.of(edge("start", "f"))).isValid())
                .isTrue();
    }

    @Test
    void suspendingNodeInsideLoopBodyIsRejected() {
        WorkflowNode loop = node("each", NodeType.LOOP, Map.of("dataSource", List.of(1, 2)));

        ValidationResult result = validator.validateWorkflow(
                List.of(trigger("start"), loop, delay("wait", 1000)),
                List.of(edge("start", "each"), edge("each", "wait", WorkflowGraph.LOOP_HANDLE)));

        assertThat(result.getErrors()).singleElement().satisfies(issue -> {
            assertThat(issue.getFieldPath()).isEqualTo("nodes[wait]");
            assertThat(issue.getMessage()).contains("inside the body of loop 'each'");
        });
    }

    @Test
    void missingTriggerNodeIsOnlyAWarning() {
        ValidationResult result = validator.validateWorkflow(List.of(delay("wait", 0)), List.of());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).hasSize(1);
    }

    @Test
    void requireValidListsEveryError() {
        assertThatThrownBy(() -> validator.requireValid(
                List.of(trigger("start"), delay("a", -5), delay("b", 0)),
                List.of(edge("start", "a"), edge("a", "b"), edge("b", "a"))))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(2)
                        .anySatisfy(error -> assertThat(error).contains("delayMs"))
                        .anySatisfy(error -> assertThat(error).contains("cycle")));
    }
}
