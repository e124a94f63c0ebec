package dev.mars.autoflow.workflow.node.handlers;

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
import dev.mars.autoflow.core.ScheduleSpec;
import dev.mars.autoflow.workflow.node.AbstractNodeHandler;
import dev.mars.autoflow.workflow.node.ConfigFields;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.node.config.ScheduleConfig;
import dev.mars.autoflow.workflow.schedule.ScheduleCalculator;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Suspends the execution until the schedule next fires.
 *
 * <p>An inactive schedule, or one whose {@code endAt} has passed, completes at once
 * with {@code fired=false}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public class ScheduleNodeHandler extends AbstractNodeHandler<ScheduleConfig> {

    public ScheduleNodeHandler() {
        super(NodeType.SCHEDULE, ScheduleConfig.class);
    }

    @Override
    protected void validateFields(ConfigFields fields) {
        String cron = fields.string("cron");
        String frequency = fields.string("frequency");
        String timezone = fields.string("timezone");
        Instant startAt = fields.instant("startAt");
        Instant endAt = fields.instant("endAt");
        fields.bool("isActive");
        fields.string("resultKey");
        fields.map("metadata");
        ScheduleCalculator.validate(new ScheduleSpec(cron, frequency, timezone, startAt, endAt), fields.result());
    }

    @Override
    public NodeResult execute(ScheduleConfig config, NodeContext context) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("metadata", config.getMetadata());
        if (!config.isActive()) {
            output.put("fired", false);
            output.put("reason", "inactive");
            return NodeResult.completed(output, config.getResultKey(), output);
        }

        ScheduleSpec schedule = config.getSchedule();
        Optional<Instant> next = ScheduleCalculator.nextFireTime(schedule, context.now());
        if (next.isEmpty()) {
            output.put("fired", false);
            output.put("reason", "expired");
            return NodeResult.completed(output, config.getResultKey(), output);
        }
        output.put("fired", true);
        output.put("scheduledFor", next.get().toString());
        output.put("timezone", schedule.timezone());
        NodeResult waiting = NodeResult.waiting(next.get(), output);
        return config.getResultKey() == null || config.getResultKey().isBlank()
                ? waiting
                : waiting.withVariable(config.getResultKey(), output);
    }
}
