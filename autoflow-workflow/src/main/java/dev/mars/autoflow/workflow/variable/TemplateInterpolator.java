package dev.mars.autoflow.workflow.variable;

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

import dev.mars.autoflow.core.condition.Condition;
import dev.mars.autoflow.core.condition.ConditionGroup;
import dev.mars.autoflow.core.condition.ConditionNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes variable references in the format {{variableName}} or {{path.to.value}}.
 *
 * <p>A string that consists of exactly one reference resolves to the referenced value
 * itself, keeping its type; references embedded in longer text are rendered as text.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class TemplateInterpolator {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private TemplateInterpolator() {
    }

    /**
     * Resolves variables in a string template.
     *
     * @throws VariableResolutionException if a variable cannot be resolved
     */
    public static String interpolate(String template, VariableScope scope) throws VariableResolutionException {
        if (template == null) {
            return null;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String reference = matcher.group(1).trim();
            Object value = lookup(reference, scope);
            matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(value)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves references anywhere inside a value: strings, and maps and lists nested to any depth.
     */
    public static Object interpolateValue(Object value, VariableScope scope) throws VariableResolutionException {
        if (value instanceof String text) {
            Matcher whole = VARIABLE_PATTERN.matcher(text.trim());
            if (whole.matches()) {
                return lookup(whole.group(1).trim(), scope);
            }
            return interpolate(text, scope);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), interpolateValue(entry.getValue(), scope));
            }
            return resolved;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> resolved = new ArrayList<>();
            for (Object element : collection) {
                resolved.add(interpolateValue(element, scope));
            }
            return resolved;
        }
        return value;
    }

    /**
     * Checks if a string contains variable references.
     */
    public static boolean hasVariables(String text) {
        return text != null && VARIABLE_PATTERN.matcher(text).find();
    }

    /**
     * Extracts all variable references from a string template.
     */
    public static Set<String> extractReferences(String template) {
        Set<String> references = new TreeSet<>();
        if (template == null) {
            return references;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        while (matcher.find()) {
            references.add(matcher.group(1).trim());
        }
        return references;
    }

    /**
     * Resolves references in condition values, leaving fields and operators untouched.
     */
    public static ConditionNode interpolateConditions(ConditionNode node, VariableScope scope)
            throws VariableResolutionException {
        if (node instanceof ConditionGroup group) {
            List<ConditionNode> children = new ArrayList<>();
            for (ConditionNode child : group.conditions()) {
                children.add(interpolateConditions(child, scope));
            }
            return new ConditionGroup(group.operator(), children);
        }
        Condition condition = (Condition) node;
        List<Object> values = null;
        if (condition.values() != null) {
            values = new ArrayList<>();
            for (Object value : condition.values()) {
                values.add(interpolateValue(value, scope));
            }
        }
        return new Condition(condition.field(), condition.operator(), interpolateValue(condition.value(), scope),
                interpolateValue(condition.valueTo(), scope), values, condition.negate());
    }

    /**
     * Turns {@code "{{deals}}"} into {@code "deals"}; plain references are returned trimmed.
     */
    public static String unwrapReference(String reference) {
        if (reference == null) {
            return null;
        }
        Matcher whole = VARIABLE_PATTERN.matcher(reference.trim());
        return whole.matches() ? whole.group(1).trim() : reference.trim();
    }

    private static Object lookup(String reference, VariableScope scope) throws VariableResolutionException {
        if (!scope.contains(reference)) {
            throw new VariableResolutionException("Variable not found: " + reference);
        }
        return scope.resolve(reference);
    }
}
