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

import static org.junit.jupiter.api.Assertions.*;

class WorkflowTest {

    private final Instant now = Instant.parse("2025-11-03T10:00:00Z");

    private Workflow workflow() {
        return Workflow.builder().id("wf-1").organizationId("org-1").name("Follow up").build();
    }

    @Test
    void newWorkflowIsDraft() {
        Workflow workflow = workflow();
        assertEquals(WorkflowStatus.DRAFT, workflow.getStatus());
        assertFalse(workflow.getStatus().acceptsExecutions());
    }

    @Test
    void countersOnlyMoveForward() {
        Workflow started = workflow().recordStart(now).recordStart(now);
        Workflow finished = started
                .recordOutcome(ExecutionStatus.COMPLETED, now)
                .recordOutcome(ExecutionStatus.FAILED, now)
                .recordOutcome(ExecutionStatus.CANCELLED, now);

        assertEquals(2, finished.getTotalExecutions());
        assertEquals(1, finished.getSuccessfulExecutions());
        assertEquals(1, finished.getFailedExecutions());
        assertEquals(now, finished.getLastExecutedAt());
    }

    @Test
    void requiresOrganization() {
        assertThrows(NullPointerException.class,
                () -> Workflow.builder().id("wf-1").name("No org").build());
    }
}
