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
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.exceptions.NotFoundException;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.node.config.QueryConfig;
import dev.mars.autoflow.workflow.query.InMemoryRecordQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dev.mars.autoflow.workflow.WorkflowTestSupport.ORGANIZATION_ID;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.contextFor;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.node;
import static dev.mars.autoflow.workflow.WorkflowTestSupport.variables;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueryNodeHandlerTest {

    private InMemoryRecordQueryService records;
    private QueryNodeHandler handler;

    @BeforeEach
    void setUp() {
        records = new InMemoryRecordQueryService();
        records.addRecords(ORGANIZATION_ID, "deals", List.of(
                Map.of("id", "d1", "name", "Acme", "amount", 5000, "contactId", "c1"),
                Map.of("id", "d2", "name", "Globex", "amount", 800, "contactId", "c2"),
                Map.of("id", "d3", "name", "Initech", "amount", 12000, "contactId", "c1")));
        records.addRecords(ORGANIZATION_ID, "contacts", List.of(Map.of("id", "c1", "email", "ann@example.com")));
        records.addRecords("org-2", "deals", List.of(Map.of("id", "x1", "name", "Other tenant", "amount", 99999)));
        handler = new QueryNodeHandler(records);
    }

    private NodeResult run(Map<String, Object> config) throws Exception {
        WorkflowNode node = node("q", NodeType.QUERY, config);
        return handler.execute(handler.parseConfig(config),
                contextFor(node, variables(Map.of("minimum", 1000)), List.of()).build());
    }

    @Test
    @SuppressWarnings("unchecked")
    void filtersSortsAndLimitsWithinTheOrganization() throws Exception {
        NodeResult result = run(Map.of(
                "model", "deals",
                "filters", List.of(Map.of("field", "amount", "operator", "gte", "value", "{{minimum}}")),
                "orderBy", Map.of("amount", "desc"),
                "limit", 5,
                "include", List.of("contacts"),
                "resultKey", "bigDeals"));

        List<Map<String, Object>> deals = (List<Map<String, Object>>) result.getVariables().get("bigDeals");
        assertThat(deals).extracting(deal -> deal.get("name")).containsExactly("Initech", "Acme");
        assertThat(deals.get(0).get("contacts")).isEqualTo(Map.of("id", "c1", "email", "ann@example.com"));
        assertEquals(Map.of("model", "deals", "count", 2, "resultKey", "bigDeals"), result.getOutput());
    }

    @Test
    void emptyResultWritesTheFallbackKey() throws Exception {
        NodeResult result = run(Map.of(
                "model", "deals",
                "filters", List.of(Map.of("field", "amount", "operator", "gt", "value", 1_000_000)),
                "fallbackKey", "noDeals"));

        assertThat(result.getVariables()).containsEntry("noDeals", List.of());
        assertFalse(result.getVariables().containsKey(QueryConfig.DEFAULT_RESULT_KEY));
    }

    @Test
    void unknownModelIsNotFound() {
        assertThrows(NotFoundException.class, () -> run(Map.of("model", "invoices")));
    }

    @Test
    void limitIsBounded() {
        assertThat(handler.validate(Map.of("model", "deals", "limit", 0)).isValid()).isFalse();
        assertThat(handler.validate(Map.of("model", "deals", "limit", QueryConfig.MAX_LIMIT + 1)).isValid()).isFalse();
        assertThat(handler.validate(Map.of("limit", 10)).getErrors()).hasSize(1);
    }
}
