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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregates over a set of durations in milliseconds. Null durations are ignored, so
 * {@code count} may be smaller than the number of executions considered. All aggregates
 * are null when no duration is known.
 *
 * @param count     number of non-null durations
 * @param averageMs mean, rounded to 2 decimals
 * @param minMs     shortest
 * @param maxMs     longest
 * @param p95Ms     95th percentile by the nearest-rank method
 */
public record DurationStats(long count, Double averageMs, Long minMs, Long maxMs, Long p95Ms) {

    public static final DurationStats EMPTY = new DurationStats(0, null, null, null, null);

    public static DurationStats of(Collection<Long> durations) {
        List<Long> known = new ArrayList<>();
        for (Long duration : durations) {
            if (duration != null) {
                known.add(duration);
            }
        }
        if (known.isEmpty()) {
            return EMPTY;
        }
        Collections.sort(known);
        long sum = 0;
        for (long duration : known) {
            sum += duration;
        }
        return new DurationStats(known.size(),
                Percentages.round((double) sum / known.size()),
                known.get(0),
                known.get(known.size() - 1),
                percentile(known, 95));
    }

    /**
     * Nearest-rank percentile of an ascending list.
     */
    static Long percentile(List<Long> sorted, int percentile) {
        Objects.requireNonNull(sorted, "sorted");
        if (sorted.isEmpty()) {
            return null;
        }
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.size());
        return sorted.get(Math.max(rank, 1) - 1);
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
