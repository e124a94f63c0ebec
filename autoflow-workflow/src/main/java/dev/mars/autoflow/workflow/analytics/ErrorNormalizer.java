package dev.mars.autoflow.workflow.analytics;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Groups error messages that differ only in identifiers, numbers or whitespace, so
 * that "Execution 3f2a... timed out after 30000 ms" and the same message for another
 * execution count as one error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public final class ErrorNormalizer {

    static final int MAX_LENGTH = 200;

    private static final Pattern UUID = Pattern.compile(
            "\\b[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\b");
    private static final Pattern QUOTED = Pattern.compile("'[^']*'|\"[^\"]*\"");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+(\\.\\d+)?\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ErrorNormalizer() {
    }

    public static String normalize(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String normalized = UUID.matcher(message).replaceAll("<id>");
        normalized = QUOTED.matcher(normalized).replaceAll("'<value>'");
        normalized = NUMBER.matcher(normalized).replaceAll("<n>");
        normalized = WHITESPACE.matcher(normalized.trim()).replaceAll(" ");
        return normalized.length() > MAX_LENGTH ? normalized.substring(0, MAX_LENGTH) : normalized;
    }

    /**
     * The {@code limit} most frequent normalized messages, most frequent first; ties keep
     * the order in which the messages were first seen.
     */
    public static List<ErrorCount> topErrors(Collection<String> messages, int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String message : messages) {
            String normalized = normalize(message);
            if (normalized != null) {
                counts.merge(normalized, 1L, Long::sum);
            }
        }
        List<ErrorCount> ranked = new ArrayList<>();
        counts.forEach((message, count) -> ranked.add(new ErrorCount(message, count)));
        ranked.sort(Comparator.comparingLong(ErrorCount::count).reversed());
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
    }

    public record ErrorCount(String message, long count) {
    }
}
