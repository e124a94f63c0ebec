package dev.mars.autoflow.workflow.graph;

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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dev.mars.autoflow.workflow.WorkflowTestSupport.delay;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.edge;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.node;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowGraphTest {

    private static WorkflowNode loop(String nodeId) {
        return node(nodeId, NodeType.LOOP, Map.of("sourceKey", "items"));
    }

    @Test
    void topologicalOrderRespectsEdgesAndBreaksTiesByExecutionOrder() throws Exception {
        WorkflowNode start = trigger("start");
        WorkflowNode late = new WorkflowNode("id-late", "wf-1", "late", NodeType.DELAY, null, null,
                Map.of("delayMs", 0), 2, false, 0, null);
        WorkflowNode early = new WorkflowNode("id-early", "wf-1", "early", NodeType.DELAY, null, null,
                Map.of("delayMs", 0), 1, false, 0, null);
        WorkflowNode end = delay("end", 0);

        WorkflowGraph graph = WorkflowGraph.of(List.of(end, late, early, start), List.of(
                edge("start", "late"), edge("start", "early"), edge("late", "end"), edge("early", "end")));

        assertThat(graph.topologicalOrder()).containsExactly("start", "early", "late", "end");
        assertThat(graph.ancestors("end")).containsExactlyInAnyOrder("start", "early", "late");
    }

    @Test
    void cyclesAreRejected() {
        assertThatThrownBy(() -> WorkflowGraph.of(
                List.of(trigger("start"), delay("a", 0), delay("b", 0)),
                List.of(edge("start", "a"), edge("a", "b"), edge("b", "a"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cycle")
                .hasMessageContaining("[a, b]");
    }

    @Test
    void danglingAndSelfConnectionsAreReportedTogether() {
        assertThatThrownBy(() -> WorkflowGraph.of(
                List.of(trigger("start"), delay("a", 0)),
                List.of(edge("start", "ghost"), edge("a", "a"))))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(2)
                        .anySatisfy(error -> assertThat(error).contains("unknown target node 'ghost'"))
                        .anySatisfy(error -> assertThat(error).contains("to itself")));
    }

    @Test
    void loopBodyExcludesNodesReachableFromTheExit() throws Exception {
        WorkflowGraph graph = WorkflowGraph.of(
                List.of(trigger("start"), loop("each"), delay("send", 0), delay("log", 0), delay("done", 0)),
                List.of(edge("start", "each"),
                        edge("each", "send", WorkflowGraph.LOOP_HANDLE),
                        edge("send", "log"),
                        edge("each", "done")));

        assertThat(graph.loopBody("each")).containsExactlyInAnyOrder("send", "log");
        assertThat(graph.loopBodyOrder("each")).containsExactly("send", "log");
        assertThat(graph.enclosingLoop("log")).contains("each");
        assertThat(graph.enclosingLoop("done")).isEmpty();
        assertThat(graph.loopBody("send")).isEmpty();
    }

    @Test
    void nestedLoopNodesBelongToTheInnermostLoop() throws Exception {
        WorkflowGraph graph = WorkflowGraph.of(
                List.of(trigger("start"), loop("outer"), loop("inner"), delay("leaf", 0)),
                List.of(edge("start", "outer"),
                        edge("outer", "inner", WorkflowGraph.BODY_HANDLE),
                        edge("inner", "leaf", WorkflowGraph.LOOP_HANDLE)));

        assertThat(graph.enclosingLoop("leaf")).contains("inner");
        assertThat(graph.enclosingLoop("inner")).contains("outer");
        assertThat(graph.loopBodyOrder("outer")).containsExactly("inner");
    }
}
