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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;

class DurationStatsTest {

    @Test
    void ignoresUnknownDurations() {
        DurationStats stats = DurationStats.of(Arrays.asList(10L, 20L, 30L, null, 40L));

        assertThat(stats.count()).isEqualTo(4);
        assertThat(stats.averageMs()).isEqualTo(25.0);
        assertThat(stats.minMs()).isEqualTo(10L);
        assertThat(stats.maxMs()).isEqualTo(40L);
        assertThat(stats.p95Ms()).isEqualTo(40L);
    }

    @Test
    void emptyWhenNothingIsKnown() {
        assertThat(DurationStats.of(List.of())).isSameAs(DurationStats.EMPTY);
        assertThat(DurationStats.of(Arrays.asList(null, null)).isEmpty()).isTrue();
        assertThat(DurationStats.EMPTY.averageMs()).isNull();
    }

    @Test
    void averageIsRoundedToTwoDecimals() {
        assertThat(DurationStats.of(List.of(1L, 2L, 2L)).averageMs()).isEqualTo(1.67);
    }

    @Test
    void p95UsesNearestRank() {
        List<Long> hundred = LongStream.rangeClosed(1, 100).boxed().collect(Collectors.toList());

        assertThat(DurationStats.percentile(hundred, 95)).isEqualTo(95L);
        assertThat(DurationStats.percentile(List.of(7L), 95)).isEqualTo(7L);
        assertThat(DurationStats.percentile(List.of(), 95)).isNull();
    }
}
