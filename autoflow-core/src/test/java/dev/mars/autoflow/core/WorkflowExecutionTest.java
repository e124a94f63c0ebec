package dev.mars.autoflow.core;

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

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowExecutionTest {

    private WorkflowExecution.Builder base() {
        return WorkflowExecution.builder()
                .id("exec-1")
                .workflowId("wf-1")
                .organizationId("org-1")
                .maxRetries(2)
                .createdAt(Instant.parse("2025-11-03T10:00:00Z"));
    }

    @Test
    void defaultsToPendingWithNormalPriority() {
        WorkflowExecution execution = base().build();

        assertEquals(ExecutionStatus.PENDING, execution.getStatus());
        assertEquals(ExecutionPriority.NORMAL, execution.getPriority());
        assertEquals("exec-1", execution.getExecutionId());
        assertEquals(0.0, execution.getProgress());
        assertTrue(execution.getSnapshot().nodes().isEmpty());
    }

    @Test
    void retryCountCannotExceedMaxRetries() {
        assertThrows(IllegalArgumentException.class, () -> base().retryCount(3).build());
    }

    @Test
    void progressIsClampedToPercentageRange() {
        assertEquals(100.0, base().progress(140).build().getProgress());
        assertEquals(0.0, base().progress(-5).build().getProgress());
    }

    @Test
    void canRetryOnlyWhenFailedWithBudgetLeft() {
        assertFalse(base().build().canRetry());
        assertTrue(base().status(ExecutionStatus.FAILED).retryCount(1).build().canRetry());
        assertFalse(base().status(ExecutionStatus.FAILED).retryCount(2).build().canRetry());
    }

    @Test
    void toBuilderPreservesState() {
        WorkflowExecution original = base()
                .status(ExecutionStatus.FAILED)
                .error("boom")
                .errorDetails(Map.of("nodeId", "send"))
                .triggerData(Map.of("dealId", "d-1"))
                .build();

        WorkflowExecution copy = original.toBuilder().build();

        assertEquals(original.getError(), copy.getError());
        assertEquals(original.getErrorDetails(), copy.getErrorDetails());
        assertEquals(original.getTriggerData(), copy.getTriggerData());
        assertEquals(original, copy);
    }

    @Test
    void elapsedIsNullUntilStarted() {
        Instant end = Instant.parse("2025-11-03T10:00:05Z");
        assertNull(base().build().elapsedMs(end));
        assertEquals(5000L, base().startedAt(Instant.parse("2025-11-03T10:00:00Z")).build().elapsedMs(end));
    }
}
