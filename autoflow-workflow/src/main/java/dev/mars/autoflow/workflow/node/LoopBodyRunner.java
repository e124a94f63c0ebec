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

import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.workflow.variable.VariableScope;

import java.util.Map;

/**
 * Runs a LOOP node's body once. Supplied to the LOOP handler by the orchestrator.
 */
@FunctionalInterface
public interface LoopBodyRunner {

    /**
     * @param index the zero-based iteration
     * @param scope the iteration's variable scope, with the item and index already bound
     * @return outputs of the body nodes that ran, keyed by node id
     * @throws AutoflowException if a required body node failed
     */
    Map<String, Object> runIteration(int index, VariableScope scope) throws AutoflowException;
}
