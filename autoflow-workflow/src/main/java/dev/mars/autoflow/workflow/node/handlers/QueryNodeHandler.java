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
import dev.mars.autoflow.core.condition.ConditionGroup;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.workflow.node.AbstractNodeHandler;
import dev.mars.autoflow.workflow.node.ConfigFields;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.node.config.QueryConfig;
import dev.mars.autoflow.workflow.query.RecordQuery;
import dev.mars.autoflow.workflow.query.RecordQueryService;
import dev.mars.autoflow.workflow.variable.TemplateInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads business records through the {@link RecordQueryService}.
 *
 * <p>Records are written to {@code resultKey}. When nothing matched and a
 * {@code fallbackKey} is configured, an empty list is written there instead.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class QueryNodeHandler extends AbstractNodeHandler<QueryConfig> {

    private static final Logger logger = LoggerFactory.getLogger(QueryNodeHandler.class);

    private final RecordQueryService queryService;

    public QueryNodeHandler(RecordQueryService queryService) {
        super(NodeType.QUERY, QueryConfig.class);
        this.queryService = Objects.requireNonNull(queryService, "Query service cannot be null");
    }

    @Override
    protected void validateFields(ConfigFields fields) {
        fields.requiredString("model");
        fields.conditions("filters", false);
        fields.number("limit", 1, QueryConfig.MAX_LIMIT);
        fields.number("offset", 0, Integer.MAX_VALUE);
        fields.list("select");
        fields.list("include");
        fields.string("resultKey");
        fields.string("fallbackKey");
    }

    @Override
    public NodeResult execute(QueryConfig config, NodeContext context) throws AutoflowException {
        ConditionGroup filters = (ConditionGroup) TemplateInterpolator.interpolateConditions(
                config.getFilters(), context.getVariables());
        RecordQuery query = new RecordQuery(config.getModel(), filters, config.getOrderBy(),
                config.getLimit(), config.getOffset(), config.getSelect(), config.getInclude());

        List<Map<String, Object>> records = queryService.findRecords(context.getOrganizationId(), query);
        logger.debug("Node {} queried {}: {} records", context.getNodeId(), config.getModel(), records.size());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("model", config.getModel());
        output.put("count", records.size());
        if (records.isEmpty() && config.getFallbackKey() != null && !config.getFallbackKey().isBlank()) {
            output.put("resultKey", config.getFallbackKey());
            return NodeResult.completed(output, config.getFallbackKey(), List.of());
        }
        output.put("resultKey", config.getResultKey());
        return NodeResult.completed(output, config.getResultKey(), records);
    }
}
