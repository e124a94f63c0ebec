package dev.mars.autoflow.workflow.node.config;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.autoflow.core.condition.ConditionGroup;
import dev.mars.autoflow.workflow.condition.ConditionParser;

/**
 * Configuration of a CONDITION node. {@code trueBranch} and {@code falseBranch}
 * name target nodes for editors that do not label edge handles.
 */
public final class ConditionConfig {

    public static final String DEFAULT_RESULT_KEY = "conditionResult";

    private final ConditionGroup conditions;
    private final String resultKey;
    private final String trueBranch;
    private final String falseBranch;

    @JsonCreator
    public ConditionConfig(@JsonProperty("conditions") Object conditions,
                           @JsonProperty("logicalOperator") String logicalOperator,
                           @JsonProperty("resultKey") String resultKey,
                           @JsonProperty("trueBranch") String trueBranch,
                           @JsonProperty("falseBranch") String falseBranch) {
        this.conditions = ConditionParser.parse(conditions, logicalOperator);
        this.resultKey = resultKey != null && !resultKey.isBlank() ? resultKey : DEFAULT_RESULT_KEY;
        this.trueBranch = trueBranch;
        this.falseBranch = falseBranch;
    }

    public ConditionGroup getConditions() {
        return conditions;
    }

    public String getResultKey() {
        return resultKey;
    }

    public String getTrueBranch() {
        return trueBranch;
    }

    public String getFalseBranch() {
        return falseBranch;
    }
}
