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

import dev.mars.autoflow.core.ExecutionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InvalidTransitionExceptionTest {

    @Test
    void messageListsValidTargets() {
        InvalidTransitionException exception = new InvalidTransitionException("exec-1",
                ExecutionStatus.PENDING, ExecutionStatus.COMPLETED, ExecutionStatus.PENDING.getValidTransitions());

        assertEquals("Invalid transition for 'exec-1': PENDING -> COMPLETED. Valid targets: [RUNNING, CANCELLED]",
                exception.getMessage());
        assertEquals(ExecutionStatus.PENDING, exception.getCurrentState());
        assertEquals(ExecutionStatus.COMPLETED, exception.getRequestedState());
        assertFalse(exception.isRetryable());
    }

    @Test
    void terminalStateIsCalledOut() {
        InvalidTransitionException exception = new InvalidTransitionException("exec-1",
                ExecutionStatus.COMPLETED, ExecutionStatus.CANCELLED, ExecutionStatus.COMPLETED.getValidTransitions());

        assertTrue(exception.getMessage().endsWith("[] (terminal state)"));
        assertEquals("INVALID_TRANSITION", exception.getErrorCode());
    }

    @Test
    void retryabilityFollowsTheFailureKind() {
        assertFalse(new ValidationException("bad config").isRetryable());
        assertFalse(new DeliveryException("rejected", false).isRetryable());
        assertTrue(new DeliveryException("throttled").isRetryable());
        assertTrue(new ExecutionTimeoutException("n1", Duration.ofSeconds(1)).isRetryable());
        assertFalse(new NodeExecutionException("n1", "wrapped", new ValidationException("x")).isRetryable());
    }
}
