package dev.mars.autoflow.workflow.query;

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

import dev.mars.autoflow.core.exceptions.NotFoundException;
import dev.mars.autoflow.workflow.condition.ConditionEvaluator;
import dev.mars.autoflow.workflow.condition.FieldPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Record store held in memory, keyed by organization and model.
 *
 * <p>Includes are resolved by joining {@code <model>Id} of the record against the
 * {@code id} of the included model.
 */
public class InMemoryRecordQueryService implements RecordQueryService {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRecordQueryService.class);

    private final Map<String, List<Map<String, Object>>> records = new ConcurrentHashMap<>();

    public void addRecords(String organizationId, String model, List<Map<String, Object>> newRecords) {
        records.computeIfAbsent(key(organizationId, model), k -> new CopyOnWriteArrayList<>()).addAll(newRecords);
    }

    @Override
    public List<Map<String, Object>> findRecords(String organizationId, RecordQuery query) throws NotFoundException {
        List<Map<String, Object>> source = records.get(key(organizationId, query.model()));
        if (source == null) {
            throw new NotFoundException("Model", query.model());
        }

        List<Map<String, Object>> matched = source.stream()
                .filter(record -> ConditionEvaluator.evaluate(query.filters(), record))
                .collect(Collectors.toCollection(ArrayList::new));
        if (!query.orderBy().isEmpty()) {
            matched.sort(comparator(query.orderBy()));
        }

        List<Map<String, Object>> page = matched.stream()
                .skip(query.offset())
                .limit(query.limit())
                .map(record -> shape(organizationId, record, query))
                .collect(Collectors.toList());
        logger.debug("Query on {} for organization {} matched {} records, returning {}",
                query.model(), organizationId, matched.size(), page.size());
        return page;
    }

    private Map<String, Object> shape(String organizationId, Map<String, Object> record, RecordQuery query) {
        Map<String, Object> shaped = new LinkedHashMap<>();
        if (query.select().isEmpty()) {
            shaped.putAll(record);
        } else {
            for (String field : query.select()) {
                shaped.put(field, FieldPaths.resolve(record, field));
            }
        }
        for (String relation : query.include()) {
            shaped.put(relation, related(organizationId, record, relation));
        }
        return Collections.unmodifiableMap(shaped);
    }

    private Object related(String organizationId, Map<String, Object> record, String relation) {
        List<Map<String, Object>> candidates = records.getOrDefault(key(organizationId, relation), List.of());
        Object foreignKey = record.get(singular(relation) + "Id");
        if (foreignKey == null) {
            return null;
        }
        return candidates.stream()
                .filter(candidate -> foreignKey.equals(candidate.get("id")))
                .findFirst()
                .orElse(null);
    }

    private static Comparator<Map<String, Object>> comparator(List<SortOrder> orderBy) {
        Comparator<Map<String, Object>> comparator = null;
        for (SortOrder order : orderBy) {
            Comparator<Map<String, Object>> next = (left, right) -> ConditionEvaluator.compareForSort(
                    FieldPaths.resolve(left, order.field()), FieldPaths.resolve(right, order.field()));
            if (order.descending()) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator;
    }

    private static String singular(String relation) {
        return relation.endsWith("s") ? relation.substring(0, relation.length() - 1) : relation;
    }

    private static String key(String organizationId, String model) {
        return organizationId + "/" + model.toLowerCase(Locale.ROOT);
    }
}
