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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory scope layered over a parent, used for LOOP iterations. Reads fall through
 * to the parent; writes never reach it.
 */
public class LocalVariableScope implements VariableScope {

    private static final String LOCAL_SOURCE = "local";

    private final VariableScope parent;
    private final Map<String, ExecutionVariable> locals = new ConcurrentHashMap<>();

    public LocalVariableScope(VariableScope parent, Map<String, Object> initial) {
        this.parent = parent;
        if (initial != null) {
            initial.forEach((name, value) -> set(name, value, LOCAL_SOURCE));
        }
    }

    @Override
    public Optional<ExecutionVariable> find(String name) {
        ExecutionVariable local = locals.get(name);
        return local != null ? Optional.of(local) : parent.find(name);
    }

    @Override
    public void set(String name, Object value, String source) {
        // ConcurrentHashMap rejects null values, so a null is stored through the variable wrapper
        locals.put(name, new ExecutionVariable(name, value, VariableDataType.infer(value), source, null));
    }

    @Override
    public void set(String name, Object value, VariableDataType dataType, String source) {
        if (!dataType.accepts(value)) {
            throw new IllegalArgumentException(String.format("Value for '%s' is not a valid %s", name, dataType));
        }
        locals.put(name, new ExecutionVariable(name, value, dataType, source, null));
    }

    @Override
    public Map<String, Object> values() {
        Map<String, Object> values = new LinkedHashMap<>(parent.values());
        locals.forEach((name, variable) -> values.put(name, variable.value()));
        return values;
    }
}
