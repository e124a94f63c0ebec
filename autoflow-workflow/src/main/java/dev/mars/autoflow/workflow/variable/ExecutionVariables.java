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

import dev.mars.autoflow.core.ExecutionVariable;
import dev.mars.autoflow.core.VariableDataType;
import dev.mars.autoflow.storage.ExecutionRepository;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The root variable scope of an execution, persisted through the execution repository
 * so that values survive suspension, retry and recovery.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class ExecutionVariables implements VariableScope {

    private final String executionId;
    private final ExecutionRepository repository;
    private final Clock clock;

    public ExecutionVariables(String executionId, ExecutionRepository repository, Clock clock) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public Optional<ExecutionVariable> find(String name) {
        return Optional.ofNullable(repository.findVariables(executionId).get(name));
    }

    @Override
    public void set(String name, Object value, String source) {
        repository.saveVariable(executionId,
                new ExecutionVariable(name, value, VariableDataType.infer(value), source, clock.instant()));
    }

    @Override
    public void set(String name, Object value, VariableDataType dataType, String source) {
        if (!dataType.accepts(value)) {
            throw new IllegalArgumentException(String.format("Value for '%s' is not a valid %s", name, dataType));
        }
        repository.saveVariable(executionId, new ExecutionVariable(name, value, dataType, source, clock.instant()));
    }

    @Override
    public Map<String, Object> values() {
        Map<String, Object> values = new LinkedHashMap<>();
        repository.findVariables(executionId).forEach((name, variable) -> values.put(name, variable.value()));
        return values;
    }
}
