package dev.mars.autoflow.core.exceptions;

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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Thrown when an invalid state transition is attempted on a status enum.
 *
 * <p>This exception captures the current state, the requested target state,
 * and the set of valid transitions from the current state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class InvalidTransitionException extends AutoflowException {

    private final String entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;
    private final Enum<?>[] validTransitions;

    /**
     * @param entityId         the identifier of the entity whose transition was rejected
     * @param currentState     the current state of the entity
     * @param requestedState   the state that was requested but is not valid
     * @param validTransitions the states that are valid targets from the current state
     */
    public InvalidTransitionException(String entityId, Enum<?> currentState,
                                      Enum<?> requestedState, Enum<?>[] validTransitions) {
        super(String.format("Invalid transition for '%s': %s -> %s. Valid targets: %s",
                entityId, currentState, requestedState, formatTransitions(validTransitions)));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.validTransitions = validTransitions;
    }

    public String getEntityId() {
        return entityId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    public Enum<?>[] getValidTransitions() {
        return validTransitions.clone();
    }

    @Override
    public String getErrorCode() {
        return "INVALID_TRANSITION";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

    private static String formatTransitions(Enum<?>[] transitions) {
        if (transitions == null || transitions.length == 0) {
            return "[] (terminal state)";
        }
        return Arrays.stream(transitions)
                .map(Enum::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
