package dev.mars.autoflow.workflow.node;

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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one successful handler invocation.
 *
 * <p>A {@link Status#WAITING} result suspends the execution until {@code resumeAt};
 * the node completes with the same output when the execution is resumed.
 * {@code activeEdges} lists the outgoing edge ids to follow; null follows every edge.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class NodeResult {

    public enum Status {
        COMPLETED,
        WAITING
    }

    private final Status status;
    private final Map<String, Object> output;
    private final Map<String, Object> variables;
    private final Set<String> activeEdges;
    private final Instant resumeAt;

    private NodeResult(Status status, Map<String, Object> output, Map<String, Object> variables,
                       Set<String> activeEdges, Instant resumeAt) {
        this.status = status;
        this.output = output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output));
        this.variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.activeEdges = activeEdges == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(activeEdges));
        this.resumeAt = resumeAt;
    }

    public static NodeResult completed(Map<String, Object> output) {
        return new NodeResult(Status.COMPLETED, output, null, null, null);
    }

    /**
     * Completed, writing {@code value} to the variable {@code resultKey} when the key is set.
     */
    public static NodeResult completed(Map<String, Object> output, String resultKey, Object value) {
        Map<String, Object> variables = new LinkedHashMap<>();
        if (resultKey != null && !resultKey.isBlank()) {
            variables.put(resultKey, value);
        }
        return new NodeResult(Status.COMPLETED, output, variables, null, null);
    }

    public static NodeResult waiting(Instant resumeAt, Map<String, Object> output) {
        Objects.requireNonNull(resumeAt, "resumeAt");
        return new NodeResult(Status.WAITING, output, null, null, resumeAt);
    }

    public NodeResult withActiveEdges(Set<String> edges) {
        return new NodeResult(status, output, variables, edges, resumeAt);
    }

    public NodeResult withVariable(String name, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(variables);
        updated.put(name, value);
        return new NodeResult(status, output, updated, activeEdges, resumeAt);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isWaiting() {
        return status == Status.WAITING;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public Set<String> getActiveEdges() {
        return activeEdges;
    }

    public Instant getResumeAt() {
        return resumeAt;
    }

    @Override
    public String toString() {
        return "NodeResult{status=" + status + ", output=" + output.keySet()
                + ", activeEdges=" + activeEdges + ", resumeAt=" + resumeAt + '}';
    }
}
