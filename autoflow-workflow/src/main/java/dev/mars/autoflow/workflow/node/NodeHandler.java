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

import dev.mars.autoflow.core.NodeType;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.ValidationException;
import dev.mars.autoflow.workflow.validation.ValidationResult;

import java.util.Map;

/**
 * Behaviour of one node type.
 *
 * <p>Handlers must be idempotent under re-invocation with the same node execution:
 * the orchestrator never re-invokes a completed node, and side-effecting handlers
 * additionally guard on {@link NodeContext#idempotencyKey()}.
 *
 * @param <C> the typed configuration of the node type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface NodeHandler<C> {

    NodeType getType();

    /**
     * Checks raw configuration field by field without throwing.
     */
    ValidationResult validate(Map<String, Object> rawConfig);

    /**
     * Validates and converts raw configuration into the typed form.
     *
     * @throws ValidationException listing every configuration error
     */
    C parseConfig(Map<String, Object> rawConfig) throws ValidationException;

    /**
     * Executes the node.
     *
     * @return the node's result
     * @throws AutoflowException if the node failed; retryability is decided by the exception
     */
    NodeResult execute(C config, NodeContext context) throws AutoflowException;
}
