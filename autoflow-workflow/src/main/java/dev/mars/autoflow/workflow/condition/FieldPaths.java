package dev.mars.autoflow.workflow.condition;

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

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Dot-path navigation over nested maps, lists and arrays. {@code a.b[0].c} and
 * {@code a.b.0.c} address the same value.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class FieldPaths {

    private static final Object MISSING = new Object();

    private FieldPaths() {
    }

    public static String[] split(String path) {
        return path.replace("[", ".").replace("]", "").split("\\.");
    }

    /**
     * @return the value at the path, or null if any segment is missing
     */
    public static Object resolve(Object root, String path) {
        Object value = walk(root, path);
        return value == MISSING ? null : value;
    }

    public static boolean exists(Object root, String path) {
        return walk(root, path) != MISSING;
    }

    /**
     * The first segment of a path, which names the variable it starts from.
     */
    public static String head(String path) {
        return split(path)[0];
    }

    /**
     * Everything after the first segment, or null for a single-segment path.
     */
    public static String tail(String path) {
        String[] segments = split(path);
        if (segments.length < 2) {
            return null;
        }
        return String.join(".", Arrays.copyOfRange(segments, 1, segments.length));
    }

    private static Object walk(Object root, String path) {
        if (path == null || path.isBlank()) {
            return root;
        }
        Object current = root;
        for (String segment : split(path.trim())) {
            if (segment.isEmpty()) {
                continue;
            }
            current = step(current, segment);
            if (current == MISSING) {
                return MISSING;
            }
        }
        return current;
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.containsKey(segment) ? map.get(segment) : MISSING;
        }
        if (current instanceof List<?> list) {
            int index = parseIndex(segment);
            return index >= 0 && index < list.size() ? list.get(index) : MISSING;
        }
        if (current != null && current.getClass().isArray()) {
            int index = parseIndex(segment);
            return index >= 0 && index < Array.getLength(current) ? Array.get(current, index) : MISSING;
        }
        return MISSING;
    }

    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
