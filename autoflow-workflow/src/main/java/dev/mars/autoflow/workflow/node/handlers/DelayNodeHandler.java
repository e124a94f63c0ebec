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
import dev.mars.autoflow.workflow.node.AbstractNodeHandler;
import dev.mars.autoflow.workflow.node.ConfigFields;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.node.config.DelayConfig;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Suspends the execution for {@code delayMs}. A zero delay completes immediately.
 */
public class DelayNodeHandler extends AbstractNodeHandler<DelayConfig> {

    public DelayNodeHandler() {
        super(NodeType.DELAY, DelayConfig.class);
    }

    @Override
    protected void validateFields(ConfigFields fields) {
        fields.number("delayMs", 0, DelayConfig.MAX_DELAY_MS);
    }

    @Override
    public NodeResult execute(DelayConfig config, NodeContext context) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("delayMs", config.getDelayMs());
        if (config.getDelayMs() == 0) {
            return NodeResult.completed(output);
        }
        Instant resumeAt = context.now().plusMillis(config.getDelayMs());
        output.put("resumeAt", resumeAt.toString());
        return NodeResult.waiting(resumeAt, output);
    }
}
