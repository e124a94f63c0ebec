package dev.mars.autoflow.storage;

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

import dev.mars.autoflow.core.GraphSnapshot;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.Workflow;
import dev.mars.autoflow.core.WorkflowConnection;
import dev.mars.autoflow.core.WorkflowNode;
import dev.mars.autoflow.core.WorkflowTrigger;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage of workflow definitions: the workflow row, its nodes, connections and triggers.
 *
 * <p>Nodes are keyed by (workflowId, nodeId) and connections by (workflowId, edgeId).
 * The {@code replace*} operations swap the whole set for a workflow atomically.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface WorkflowRepository {

    Workflow saveWorkflow(Workflow workflow);

    Optional<Workflow> findWorkflow(String workflowId);

    List<Workflow> findWorkflowsByOrganization(String organizationId);

    /**
     * Atomically applies {@code update} to the stored workflow.
     *
     * @return the updated workflow, or empty if it does not exist
     */
    Optional<Workflow> updateWorkflow(String workflowId, UnaryOperator<Workflow> update);

    WorkflowNode saveNode(WorkflowNode node);

    Optional<WorkflowNode> findNode(String workflowId, String nodeId);

    /**
     * @return the workflow's nodes ordered by execution order, then node id
     */
    List<WorkflowNode> findNodes(String workflowId);

    /**
     * Deletes the node together with every connection attached to it.
     */
    boolean deleteNode(String workflowId, String nodeId);

    void replaceNodes(String workflowId, List<WorkflowNode> nodes);

    WorkflowConnection saveConnection(WorkflowConnection connection);

    Optional<WorkflowConnection> findConnection(String workflowId, String edgeId);

    List<WorkflowConnection> findConnections(String workflowId);

    boolean deleteConnection(String workflowId, String edgeId);

    void replaceConnections(String workflowId, List<WorkflowConnection> connections);

    /**
     * Replaces the workflow's nodes and connections in one step. A concurrent
     * {@link #findGraph} sees either the old graph or the new one.
     */
    void replaceGraph(String workflowId, GraphSnapshot graph);

    /**
     * @return a consistent view of the workflow's nodes and connections
     */
    GraphSnapshot findGraph(String workflowId);

    WorkflowTrigger saveTrigger(WorkflowTrigger trigger);

    Optional<WorkflowTrigger> findTrigger(String triggerId);

    List<WorkflowTrigger> findTriggers(String workflowId);

    List<WorkflowTrigger> findActiveTriggers(TriggerType type);

    boolean deleteTrigger(String triggerId);
}
