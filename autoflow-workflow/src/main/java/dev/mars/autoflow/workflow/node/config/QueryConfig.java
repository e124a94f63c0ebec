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
import dev.mars.autoflow.workflow.query.SortOrder;

import java.util.List;

/**
 * Configuration of a QUERY node. Filter values may reference variables; they are
 * resolved when the node runs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class QueryConfig {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;
    public static final String DEFAULT_RESULT_KEY = "queryResults";

    private final String model;
    private final ConditionGroup filters;
    private final List<SortOrder> orderBy;
    private final int limit;
    private final int offset;
    private final List<String> select;
    private final List<String> include;
    private final String resultKey;
    private final String fallbackKey;

    @JsonCreator
    public QueryConfig(@JsonProperty("model") String model,
                       @JsonProperty("filters") Object filters,
                       @JsonProperty("logicalOperator") String logicalOperator,
                       @JsonProperty("orderBy") Object orderBy,
                       @JsonProperty("limit") Integer limit,
                       @JsonProperty("offset") Integer offset,
                       @JsonProperty("select") List<String> select,
                       @JsonProperty("include") List<String> include,
                       @JsonProperty("resultKey") String resultKey,
                       @JsonProperty("fallbackKey") String fallbackKey) {
        this.model = model;
        this.filters = filters == null ? ConditionGroup.EMPTY : ConditionParser.parse(filters, logicalOperator);
        this.orderBy = SortOrder.parse(orderBy);
        this.limit = limit != null ? limit : DEFAULT_LIMIT;
        this.offset = offset != null ? offset : 0;
        this.select = select == null ? List.of() : List.copyOf(select);
        this.include = include == null ? List.of() : List.copyOf(include);
        this.resultKey = resultKey != null && !resultKey.isBlank() ? resultKey : DEFAULT_RESULT_KEY;
        this.fallbackKey = fallbackKey;
    }

    public String getModel() {
        return model;
    }

    public ConditionGroup getFilters() {
        return filters;
    }

    public List<SortOrder> getOrderBy() {
        return orderBy;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public List<String> getSelect() {
        return select;
    }

    public List<String> getInclude() {
        return include;
    }

    public String getResultKey() {
        return resultKey;
    }

    public String getFallbackKey() {
        return fallbackKey;
    }
}
