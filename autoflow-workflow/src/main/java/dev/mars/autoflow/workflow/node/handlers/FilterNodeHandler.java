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
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.condition.ConditionNode;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.workflow.condition.ConditionEvaluator;
import dev.mars.autoflow.workflow.condition.FieldPaths;
import dev.mars.autoflow.workflow.node.AbstractNodeHandler;
import dev.mars.autoflow.workflow.node.ConfigFields;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.node.config.FilterConfig;
import dev.mars.autoflow.workflow.variable.TemplateInterpolator;
import dev.mars.autoflow.workflow.variable.VariableScope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the elements of an array variable that satisfy a condition tree.
 *
 * <p>Condition fields are looked up on each element first and then among the
 * execution's variables. Outgoing edges with handle {@code matched} are taken only
 * when something survived, edges with handle {@code empty} only when nothing did.
 */
public class FilterNodeHandler extends AbstractNodeHandler<FilterConfig> {

    public static final String MATCHED_HANDLE = "matched";
    public static final String EMPTY_HANDLE = "empty";

    public FilterNodeHandler() {
        super(NodeType.FILTER, FilterConfig.class);
    }

    @Override
    protected void validateFields(ConfigFields fields) {
        fields.requiredString("sourceKey");
        fields.conditions("conditions", true);
        fields.string("resultKey");
        fields.string("fallbackKey");
    }

    @Override
    public NodeResult execute(FilterConfig config, NodeContext context) throws AutoflowException {
        VariableScope variables = context.getVariables();
        List<Object> items = variables.requireList(context.getNodeId(),
                TemplateInterpolator.unwrapReference(config.getSourceKey()));
        ConditionNode conditions = TemplateInterpolator.interpolateConditions(config.getConditions(), variables);

        List<Object> survivors = new ArrayList<>();
        for (Object item : items) {
            boolean kept = ConditionEvaluator.evaluate(conditions, path -> FieldPaths.exists(item, path)
                    ? FieldPaths.resolve(item, path)
                    : variables.resolve(path));
            if (kept) {
                survivors.add(item);
            }
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("inputCount", items.size());
        output.put("matchedCount", survivors.size());

        boolean empty = survivors.isEmpty();
        String key = empty && config.getFallbackKey() != null && !config.getFallbackKey().isBlank()
                ? config.getFallbackKey()
                : config.getResultKey();
        return NodeResult.completed(output, key, survivors)
                .withActiveEdges(selectEdges(context.getOutgoing(), empty));
    }

    private static Set<String> selectEdges(List<WorkflowConnection> outgoing, boolean empty) {
        Set<String> active = new LinkedHashSet<>();
        for (WorkflowConnection connection : outgoing) {
            if (connection.hasHandle(MATCHED_HANDLE)) {
                if (!empty) {
                    active.add(connection.edgeId());
                }
            } else if (connection.hasHandle(EMPTY_HANDLE)) {
                if (empty) {
                    active.add(connection.edgeId());
                }
            } else {
                active.add(connection.edgeId());
            }
        }
        return active;
    }
}
