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
import dev.mars.autoflow.workflow.node.AbstractNodeHandler;
import dev.mars.autoflow.workflow.node.ConfigFields;
import dev.mars.autoflow.workflow.node.NodeContext;
import dev.mars.autoflow.workflow.node.NodeResult;
import dev.mars.autoflow.workflow.node.config.ConditionConfig;
import dev.mars.autoflow.workflow.variable.TemplateInterpolator;
import dev.mars.autoflow.workflow.variable.VariableScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates a condition tree against the execution's variables and selects a branch.
 *
 * <p>Edges with handle {@code true} or {@code false} follow the outcome. An unlabelled
 * edge leading to the configured {@code trueBranch} or {@code falseBranch} node counts
 * as that branch; any other unlabelled edge is always followed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class ConditionNodeHandler extends AbstractNodeHandler<ConditionConfig> {

    private static final Logger logger = LoggerFactory.getLogger(ConditionNodeHandler.class);

    public static final String TRUE_HANDLE = "true";
    public static final String FALSE_HANDLE = "false";

    public ConditionNodeHandler() {
        super(NodeType.CONDITION, ConditionConfig.class);
    }

    @Override
    protected void validateFields(ConfigFields fields) {
        fields.conditions("conditions", true);
        fields.string("resultKey");
        fields.string("trueBranch");
        fields.string("falseBranch");
    }

    @Override
    public NodeResult execute(ConditionConfig config, NodeContext context) throws AutoflowException {
        VariableScope variables = context.getVariables();
        ConditionNode conditions = TemplateInterpolator.interpolateConditions(config.getConditions(), variables);
        boolean outcome = ConditionEvaluator.evaluate(conditions,
                path -> variables.resolve(TemplateInterpolator.unwrapReference(path)));
        logger.debug("Condition node {} evaluated to {}", context.getNodeId(), outcome);

        return NodeResult.completed(Map.of("result", outcome), config.getResultKey(), outcome)
                .withActiveEdges(selectEdges(config, context.getOutgoing(), outcome));
    }

    private static Set<String> selectEdges(ConditionConfig config, List<WorkflowConnection> outgoing, boolean outcome) {
        Set<String> active = new LinkedHashSet<>();
        for (WorkflowConnection connection : outgoing) {
            Boolean branch = branchOf(config, connection);
            if (branch == null || branch == outcome) {
                active.add(connection.edgeId());
            }
        }
        return active;
    }

    /**
     * @return the outcome the edge belongs to, or null for an edge that is always followed
     */
    private static Boolean branchOf(ConditionConfig config, WorkflowConnection connection) {
        if (connection.hasHandle(TRUE_HANDLE)) {
            return Boolean.TRUE;
        }
        if (connection.hasHandle(FALSE_HANDLE)) {
            return Boolean.FALSE;
        }
        if (connection.sourceHandle() == null || connection.sourceHandle().isBlank()) {
            if (connection.targetNodeId().equals(config.getTrueBranch())) {
                return Boolean.TRUE;
            }
            if (connection.targetNodeId().equals(config.getFalseBranch())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }
}
