package dev.mars.autoflow.workflow.trigger;

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

import dev.mars.autoflow.config.AutoflowConfiguration;
import dev.mars.autoflow.core.ScheduleSpec;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowTrigger;
import dev.mars.autoflow.storage.memory.InMemoryWorkflowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ScheduleTickerTest {

    private static final Instant NOW = Instant.parse("2025-11-10T09:00:00Z");

    @Mock
    private TriggerEvaluator evaluator;

    private InMemoryWorkflowRepository workflows;
    private ScheduleTicker ticker;

    @BeforeEach
    void setUp() {
        workflows = new InMemoryWorkflowRepository();
        ticker = new ScheduleTicker(workflows, evaluator, new AutoflowConfiguration(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private WorkflowTrigger stored(String id) {
        return workflows.findTrigger(id).orElseThrow();
    }

    @Test
    void firstTickArmsWithoutFiring() {
        workflows.saveTrigger(WorkflowTrigger.onSchedule("s1", "wf-1", ScheduleSpec.every("hourly")));

        assertEquals(0, ticker.tick());

        assertEquals(NOW.plusSeconds(3600), stored("s1").nextFireAt());
        verify(evaluator, never()).fireSchedule(any(), any());
    }

    @Test
    void dueTriggerFiresOnceForMissedPeriods() {
        Instant missed = NOW.minusSeconds(3 * 3600);
        WorkflowTrigger trigger = WorkflowTrigger.onSchedule("s1", "wf-1", ScheduleSpec.every("hourly"))
                .withFiring(null, missed);
        workflows.saveTrigger(trigger);

        assertEquals(1, ticker.tick());

        verify(evaluator).fireSchedule(trigger, missed);
        assertEquals(NOW, stored("s1").lastFiredAt());
        assertEquals(NOW.plusSeconds(3600), stored("s1").nextFireAt());
    }

    @Test
    void triggerThatIsNotDueIsLeftAlone() {
        workflows.saveTrigger(WorkflowTrigger.onSchedule("s1", "wf-1", ScheduleSpec.every("hourly"))
                .withFiring(null, NOW.plusSeconds(60)));

        assertEquals(0, ticker.tick());
        verify(evaluator, never()).fireSchedule(any(), any());
    }

    @Test
    void endedScheduleIsDeactivatedAfterItsLastFiring() {
        ScheduleSpec spec = new ScheduleSpec(null, "hourly", null, null, NOW.plusSeconds(60));
        workflows.saveTrigger(WorkflowTrigger.onSchedule("s1", "wf-1", spec).withFiring(null, NOW.minusSeconds(60)));

        assertEquals(1, ticker.tick());

        assertFalse(stored("s1").active());
        assertThat(stored("s1").nextFireAt()).isNull();
        assertThat(workflows.findActiveTriggers(TriggerType.SCHEDULE)).isEmpty();
    }

    @Test
    void scheduleThatNeverFiresIsDeactivatedWhenArmed() {
        ScheduleSpec spec = new ScheduleSpec("0 9 * * *", null, null, null, NOW.minusSeconds(1));
        workflows.saveTrigger(WorkflowTrigger.onSchedule("s1", "wf-1", spec));

        assertEquals(0, ticker.tick());

        assertFalse(stored("s1").active());
        verify(evaluator, never()).fireSchedule(any(), any());
    }
}
