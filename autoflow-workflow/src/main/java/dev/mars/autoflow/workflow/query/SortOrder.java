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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One sort key of a record query.
 *
 * @param field      dot path into the record
 * @param descending true for descending order
 */
public record SortOrder(String field, boolean descending) {

    /**
     * Reads {@code "field"}, {@code {"field": "desc"}} or
     * {@code {"field": "name", "direction": "desc"}}, alone or in a list.
     */
    public static List<SortOrder> parse(Object raw) {
        List<SortOrder> orders = new ArrayList<>();
        if (raw instanceof Collection<?> items) {
            for (Object item : items) {
                orders.addAll(parse(item));
            }
        } else if (raw instanceof Map<?, ?> map) {
            if (map.containsKey("field")) {
                orders.add(new SortOrder(String.valueOf(map.get("field")), isDescending(map.get("direction"))));
            } else {
                map.forEach((field, direction) -> orders.add(new SortOrder(String.valueOf(field), isDescending(direction))));
            }
        } else if (raw != null && !raw.toString().isBlank()) {
            orders.add(new SortOrder(raw.toString().trim(), false));
        }
        return List.copyOf(orders);
    }

    private static boolean isDescending(Object direction) {
        return direction != null && direction.toString().toLowerCase(Locale.ROOT).startsWith("desc");
    }
}
