package dev.mars.autoflow.workflow.definition;

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
import dev.mars.autoflow.core.Position;
import dev.mars.autoflow.core.ScheduleSpec;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.condition.ConditionGroup;
import dev.mars.autoflow.workflow.condition.ConditionParser;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.ConnectionDefinition;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.NodeDefinition;
import dev.mars.autoflow.workflow.definition.WorkflowDefinition.TriggerDefinition;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads workflow definitions written in YAML:
 * <pre>
 * name: Deal follow-up
 * nodes:
 *   - id: start
 *     type: TRIGGER
 *   - id: wait
 *     type: DELAY
 *     config: { delayMs: 60000 }
 * connections:
 *   - source: start
 *     target: wait
 * triggers:
 *   - type: EVENT
 *     module: crm
 *     eventType: created
 * </pre>
 * Only the syntax and the shape of each entry are checked here; graph and node
 * configuration validation happen when the definition is imported.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-12
 * @version 1.0
 */
public class YamlWorkflowDefinitionParser {

    private final Yaml yaml;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    public WorkflowDefinition parse(Path yamlFile) throws WorkflowParseException {
        try {
            return parseFromString(Files.readString(yamlFile));
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    public WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException {
        Object loaded;
        try {
            loaded = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        return parseWorkflowDefinition(asMap(loaded));
    }

    private WorkflowDefinition parseWorkflowDefinition(Map<String, Object> data) throws WorkflowParseException {
        String name = getStringValue(data, "name");
        if (name == null || name.isBlank()) {
            throw new WorkflowParseException("name", "Workflow name is required");
        }
        String description = getStringValue(data, "description");

        List<NodeDefinition> nodes = new ArrayList<>();
        List<Map<String, Object>> nodeList = getListValue(data, "nodes", "nodes");
        for (int i = 0; i < nodeList.size(); i++) {
            nodes.add(parseNode(nodeList.get(i), "nodes[" + i + "]", i));
        }

        List<ConnectionDefinition> connections = new ArrayList<>();
        List<Map<String, Object>> connectionList = getListValue(data, "connections", "connections");
        for (int i = 0; i < connectionList.size(); i++) {
            connections.add(parseConnection(connectionList.get(i), "connections[" + i + "]", i));
        }

        List<TriggerDefinition> triggers = new ArrayList<>();
        List<Map<String, Object>> triggerList = getListValue(data, "triggers", "triggers");
        for (int i = 0; i < triggerList.size(); i++) {
            triggers.add(parseTrigger(triggerList.get(i), "triggers[" + i + "]"));
        }
        return new WorkflowDefinition(name.trim(), description, nodes, connections, triggers);
    }

    private NodeDefinition parseNode(Map<String, Object> data, String path, int index) throws WorkflowParseException {
        String nodeId = requireString(data, "id", path);
        NodeType type;
        try {
            type = NodeType.fromString(getStringValue(data, "type"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".type", "unknown node type '" + getStringValue(data, "type") + "'");
        }
        Map<String, Object> positionMap = getMapValue(data, "position");
        Position position = positionMap == null ? null
                : new Position(getDoubleValue(positionMap, "x"), getDoubleValue(positionMap, "y"));
        Map<String, Object> config = getMapValue(data, "config");

        int retryLimit = getIntValue(data, "retryLimit", 0);
        if (retryLimit < 0) {
            throw new WorkflowParseException(path + ".retryLimit", "cannot be negative");
        }
        Duration timeout = null;
        String timeoutText = getStringValue(data, "timeout");
        if (timeoutText != null) {
            timeout = parseDuration(timeoutText, path + ".timeout");
        }
        return new NodeDefinition(nodeId, type, getStringValue(data, "name"), position,
                config == null ? Map.of() : config, getIntValue(data, "executionOrder", index),
                getBooleanValue(data, "optional", false), retryLimit, timeout);
    }

    private ConnectionDefinition parseConnection(Map<String, Object> data, String path, int index)
            throws WorkflowParseException {
        String source = requireString(data, "source", path);
        String target = requireString(data, "target", path);
        String handle = getStringValue(data, "sourceHandle", getStringValue(data, "handle"));
        String edgeId = getStringValue(data, "id",
                source + "->" + target + (handle == null ? "" : ":" + handle));
        return new ConnectionDefinition(edgeId, source, target, handle, getStringValue(data, "targetHandle"),
                getStringValue(data, "label"), parseConditions(data, path),
                getIntValue(data, "executionOrder", index));
    }

    private TriggerDefinition parseTrigger(Map<String, Object> data, String path) throws WorkflowParseException {
        TriggerType type;
        try {
            type = TriggerType.valueOf(getStringValue(data, "type", "EVENT").trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".type", "unknown trigger type '" + getStringValue(data, "type") + "'");
        }
        long delayMs = getIntValue(data, "delayMs", 0);
        if (delayMs < 0) {
            throw new WorkflowParseException(path + ".delayMs", "cannot be negative");
        }

        ScheduleSpec schedule = null;
        if (type == TriggerType.SCHEDULE) {
            String cron = getStringValue(data, "cron");
            String frequency = getStringValue(data, "frequency");
            if ((cron == null) == (frequency == null)) {
                throw new WorkflowParseException(path, "a schedule trigger needs exactly one of 'cron' or 'frequency'");
            }
            schedule = new ScheduleSpec(cron, frequency, getStringValue(data, "timezone"),
                    getInstantValue(data, "startAt", path), getInstantValue(data, "endAt", path));
        } else if (type == TriggerType.EVENT && getStringValue(data, "eventType") == null) {
            throw new WorkflowParseException(path + ".eventType", "is required for event triggers");
        }

        return new TriggerDefinition(type, getStringValue(data, "nodeId"), getStringValue(data, "module"),
                getStringValue(data, "eventType"), getStringValue(data, "entityType"),
                parseConditions(data, path), delayMs, getBooleanValue(data, "active", true), schedule);
    }

    private ConditionGroup parseConditions(Map<String, Object> data, String path) throws WorkflowParseException {
        try {
            return ConditionParser.parse(data.get("conditions"), getStringValue(data, "logicalOperator"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".conditions", e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- value helpers

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        return copy;
    }

    private String requireString(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        String value = getStringValue(data, key);
        if (value == null || value.isBlank()) {
            throw new WorkflowParseException(path + "." + key, "is required");
        }
        return value.trim();
    }

    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? asMap(value) : null;
    }

    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new WorkflowParseException(path, "must be a list");
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof Map)) {
                throw new WorkflowParseException(path + "[" + i + "]", "must be a mapping");
            }
            entries.add(asMap(items.get(i)));
        }
        return entries;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    private double getDoubleValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }

    private Instant getInstantValue(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        try {
            return Instant.parse(value.toString().trim());
        } catch (DateTimeParseException e) {
            throw new WorkflowParseException(path + "." + key, "is not an ISO-8601 timestamp", e);
        }
    }

    /**
     * Accepts "30s", "5m", "2h", plain seconds or an ISO-8601 duration.
     */
    private Duration parseDuration(String text, String path) throws WorkflowParseException {
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        try {
            if (trimmed.startsWith("p")) {
                return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
            }
            if (trimmed.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2)));
            } else if (trimmed.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(trimmed));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new WorkflowParseException(path, "invalid duration '" + text + "'", e);
        }
    }
}
