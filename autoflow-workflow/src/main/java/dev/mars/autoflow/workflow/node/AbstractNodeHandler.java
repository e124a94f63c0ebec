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
import dev.mars.autoflow.core.exceptions.ValidationException;
import dev.mars.autoflow.workflow.validation.ValidationResult;

import java.util.Map;
import java.util.Objects;

/**
 * Base class wiring field validation to Jackson conversion of the typed configuration.
 */
public abstract class AbstractNodeHandler<C> implements NodeHandler<C> {

    private final NodeType type;
    private final Class<C> configType;

    protected AbstractNodeHandler(NodeType type, Class<C> configType) {
        this.type = Objects.requireNonNull(type, "Node type cannot be null");
        this.configType = Objects.requireNonNull(configType, "Config type cannot be null");
    }

    @Override
    public NodeType getType() {
        return type;
    }

    @Override
    public ValidationResult validate(Map<String, Object> rawConfig) {
        ValidationResult result = new ValidationResult();
        validateFields(new ConfigFields(rawConfig == null ? Map.of() : rawConfig, result));
        return result;
    }

    @Override
    public C parseConfig(Map<String, Object> rawConfig) throws ValidationException {
        validate(rawConfig).throwIfInvalid("Invalid " + type + " node configuration");
        return NodeConfigMapper.convert(rawConfig == null ? Map.of() : rawConfig, configType);
    }

    /**
     * Records every problem with the raw configuration.
     */
    protected abstract void validateFields(ConfigFields fields);
}
