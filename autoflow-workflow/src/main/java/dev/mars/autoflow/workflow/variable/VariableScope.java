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
import dev.mars.autoflow.core.exceptions.NodeExecutionException;
import dev.mars.autoflow.workflow.condition.FieldPaths;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named values visible to a node while it runs.
 *
 * <p>References are dot paths whose first segment names a variable, for example
 * {@code deals.0.amount}. A path that is itself a variable name resolves to that
 * variable even if it contains dots.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface VariableScope {

    Optional<ExecutionVariable> find(String name);

    /**
     * Writes a variable, inferring its type from the value.
     *
     * @param source who produced the value: a node id, {@code trigger} or {@code input}
     */
    void set(String name, Object value, String source);

    /**
     * Writes a variable with a declared type.
     *
     * @throws IllegalArgumentException if the value does not conform to the type
     */
    void set(String name, Object value, VariableDataType dataType, String source);

    /**
     * All visible variables as plain values, inner scopes shadowing outer ones.
     */
    Map<String, Object> values();

    /**
     * A scope layered over this one. Writes to the child stay local to it.
     */
    default VariableScope child(Map<String, Object> locals) {
        return new LocalVariableScope(this, locals);
    }

    default boolean contains(String path) {
        Optional<ExecutionVariable> whole = find(path);
        if (whole.isPresent()) {
            return true;
        }
        Optional<ExecutionVariable> head = find(FieldPaths.head(path));
        return head.isPresent() && FieldPaths.exists(head.get().value(), FieldPaths.tail(path));
    }

    /**
     * @return the value at the path, or null if it is missing
     */
    default Object resolve(String path) {
        Optional<ExecutionVariable> whole = find(path);
        if (whole.isPresent()) {
            return whole.get().value();
        }
        return find(FieldPaths.head(path))
                .map(variable -> FieldPaths.resolve(variable.value(), FieldPaths.tail(path)))
                .orElse(null);
    }

    /**
     * Type-checked read used by node handlers.
     *
     * @throws NodeExecutionException if the reference is missing or holds a value of another type
     */
    default Object require(String nodeId, String path, VariableDataType expected) throws NodeExecutionException {
        if (path == null || path.isBlank()) {
            throw new NodeExecutionException(nodeId, "Variable reference is blank", false);
        }
        if (!contains(path)) {
            throw new NodeExecutionException(nodeId, "Variable '" + path + "' is not defined", false);
        }
        Object value = resolve(path);
        if (!expected.accepts(value)) {
            throw new NodeExecutionException(nodeId, String.format("Variable '%s' holds %s but %s was expected",
                    path, VariableDataType.infer(value), expected), false);
        }
        return value;
    }

    /**
     * Reads an ARRAY reference as a list.
     */
    default List<Object> requireList(String nodeId, String path) throws NodeExecutionException {
        Object value = require(nodeId, path, VariableDataType.ARRAY);
        return toList(value);
    }

    static List<Object> toList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        List<Object> list = new ArrayList<>();
        for (int i = 0; i < Array.getLength(value); i++) {
            list.add(Array.get(value, i));
        }
        return list;
    }
}
