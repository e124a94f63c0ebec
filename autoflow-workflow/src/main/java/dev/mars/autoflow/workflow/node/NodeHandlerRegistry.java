package dev.mars.autoflow.workflow.node;

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
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.NodeExecutionException;
import dev.mars.autoflow.workflow.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Handlers by node type. TRIGGER nodes have no handler: they mark where an execution
 * starts and complete without running anything.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class NodeHandlerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(NodeHandlerRegistry.class);

    private final Map<NodeType, NodeHandler<?>> handlers = new EnumMap<>(NodeType.class);

    public NodeHandlerRegistry(Collection<? extends NodeHandler<?>> handlers) {
        for (NodeHandler<?> handler : handlers) {
            NodeHandler<?> previous = this.handlers.put(handler.getType(), handler);
            if (previous != null) {
                logger.warn("Handler {} replaces {} for node type {}",
                        handler.getClass().getSimpleName(), previous.getClass().getSimpleName(), handler.getType());
            }
        }
    }

    public Optional<NodeHandler<?>> find(NodeType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    /**
     * Checks raw configuration of one node without throwing.
     */
    public ValidationResult validate(NodeType type, Map<String, Object> rawConfig) {
        switch (type) {
            case TRIGGER:
                return new ValidationResult();
            case ACTION:
            case QUERY:
            case LOOP:
            case FILTER:
            case CONDITION:
            case DELAY:
            case SCHEDULE:
                NodeHandler<?> handler = handlers.get(type);
                if (handler == null) {
                    ValidationResult missing = new ValidationResult();
                    missing.addError("type", "no handler is registered for node type " + type);
                    return missing;
                }
                return handler.validate(rawConfig);
            default:
                throw new IllegalStateException("Unhandled node type " + type);
        }
    }

    /**
     * Parses the configuration and runs the handler for the context's node.
     *
     * @throws AutoflowException if the configuration is invalid or the handler failed
     */
    public NodeResult execute(NodeContext context) throws AutoflowException {
        NodeType type = context.getNode().type();
        if (type == NodeType.TRIGGER) {
            return NodeResult.completed(Map.of("triggered", true));
        }
        NodeHandler<?> handler = handlers.get(type);
        if (handler == null) {
            throw new NodeExecutionException(context.getNodeId(),
                    "No handler registered for node type " + type, false);
        }
        return invoke(handler, context.getNode().config(), context);
    }

    private static <C> NodeResult invoke(NodeHandler<C> handler, Map<String, Object> rawConfig, NodeContext context)
            throws AutoflowException {
        C config = handler.parseConfig(rawConfig);
        return handler.execute(config, context);
    }
}
