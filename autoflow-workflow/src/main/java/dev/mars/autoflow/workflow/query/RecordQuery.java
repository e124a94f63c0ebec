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

import dev.mars.autoflow.core.condition.ConditionGroup;

import java.util.List;
import java.util.Objects;

/**
 * Declarative read issued by a QUERY node. Filters are already interpolated.
 *
 * @param model   name of the record collection, for example {@code contacts}
 * @param filters predicate every returned record satisfies
 * @param orderBy sort keys, applied in order
 * @param limit   maximum number of records, 1 to 1000
 * @param offset  records skipped after sorting
 * @param select  fields to keep, all fields when empty
 * @param include related collections to attach, resolved by the query service
 */
public record RecordQuery(String model, ConditionGroup filters, List<SortOrder> orderBy, int limit, int offset,
                          List<String> select, List<String> include) {

    public RecordQuery {
        Objects.requireNonNull(model, "Model cannot be null");
        filters = filters == null ? ConditionGroup.EMPTY : filters;
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        select = select == null ? List.of() : List.copyOf(select);
        include = include == null ? List.of() : List.copyOf(include);
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
    }
}
