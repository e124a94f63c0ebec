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
 * Configuration of a FILTER node.
 */
public final class FilterConfig {

    public static final String DEFAULT_RESULT_KEY = "filteredItems";

    private final String sourceKey;
    private final ConditionGroup conditions;
    private final String resultKey;
    private final String fallbackKey;

    @JsonCreator
    public FilterConfig(@JsonProperty("sourceKey") String sourceKey,
                        @JsonProperty("conditions") Object conditions,
                        @JsonProperty("logicalOperator") String logicalOperator,
                        @JsonProperty("resultKey") String resultKey,
                        @JsonProperty("fallbackKey") String fallbackKey) {
        this.sourceKey = sourceKey;
        this.conditions = ConditionParser.parse(conditions, logicalOperator);
        this.resultKey = resultKey != null && !resultKey.isBlank() ? resultKey : DEFAULT_RESULT_KEY;
        this.fallbackKey = fallbackKey;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public ConditionGroup getConditions() {
        return conditions;
    }

    public String getResultKey() {
        return resultKey;
    }

    public String getFallbackKey() {
        return fallbackKey;
    }
}
