package dev.mars.autoflow.workflow.execution;

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

import java.util.Objects;

/**
 * A caller-supplied variable bound when an execution is created.
 *
 * @param name     variable name
 * @param value    initial value
 * @param dataType declared type, or null to infer it from the value
 */
public record VariableInput(String name, Object value, VariableDataType dataType) {

    public VariableInput {
        Objects.requireNonNull(name, "Variable name cannot be null");
    }

    public static VariableInput of(String name, Object value) {
        return new VariableInput(name, value, null);
    }
}
