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
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowTrigger;
import dev.mars.autoflow.storage.WorkflowRepository;
import dev.mars.autoflow.workflow.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically fires due SCHEDULE triggers.
 *
 * <p>A trigger without a {@code nextFireAt} is armed on its first tick without firing.
 * A due trigger fires once, however many periods were missed, and {@code nextFireAt}
 * moves to the first fire time after now. A schedule with no further fire time is
 * deactivated.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class ScheduleTicker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleTicker.class);

    private final WorkflowRepository workflows;
    private final TriggerEvaluator evaluator;
    private final Clock clock;
    private final Duration interval;
    private ScheduledExecutorService timer;

    public ScheduleTicker(WorkflowRepository workflows, TriggerEvaluator evaluator,
                          AutoflowConfiguration config, Clock clock) {
        this.workflows = Objects.requireNonNull(workflows, "Workflow repository cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Trigger evaluator cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.interval = config.getSchedulerTickInterval();
    }

    public synchronized void start() {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "autoflow-schedule-ticker");
            thread.setDaemon(true);
            return thread;
        });
        timer.scheduleAtFixedRate(this::safeTick, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Schedule ticker started, interval {} ms", interval.toMillis());
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            logger.error("Schedule tick failed", e);
        }
    }

    /**
     * Fires every due schedule trigger once.
     *
     * @return the number of triggers fired
     */
    public int tick() {
        Instant now = clock.instant();
        int fired = 0;
        for (WorkflowTrigger trigger : workflows.findActiveTriggers(TriggerType.SCHEDULE)) {
            if (trigger.nextFireAt() == null) {
                arm(trigger, now);
                continue;
            }
            if (trigger.nextFireAt().isAfter(now)) {
                continue;
            }
            evaluator.fireSchedule(trigger, trigger.nextFireAt());
            fired++;
            Optional<Instant> next = ScheduleCalculator.nextFireTime(trigger.schedule(), now);
            WorkflowTrigger updated = trigger.withFiring(now, next.orElse(null));
            if (next.isEmpty()) {
                logger.info("Schedule of trigger {} has no further fire times, deactivating", trigger.id());
                updated = updated.withActive(false);
            }
            workflows.saveTrigger(updated);
        }
        return fired;
    }

    private void arm(WorkflowTrigger trigger, Instant now) {
        Optional<Instant> next = ScheduleCalculator.nextFireTime(trigger.schedule(), now);
        if (next.isPresent()) {
            workflows.saveTrigger(trigger.withFiring(trigger.lastFiredAt(), next.get()));
            logger.debug("Armed schedule trigger {} for {}", trigger.id(), next.get());
        } else {
            workflows.saveTrigger(trigger.withActive(false));
            logger.info("Schedule of trigger {} never fires, deactivating", trigger.id());
        }
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }
}
