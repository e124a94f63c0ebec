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

import dev.mars.autoflow.workflow.analytics.ErrorNormalizer.ErrorCount;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorNormalizerTest {

    @Test
    void replacesVolatileParts() {
        assertThat(ErrorNormalizer.normalize(
                "Contact 3f2b8c1e-9d4a-4b7e-8f00-123456789abc not found after 3 attempts"))
                .isEqualTo("Contact <id> not found after <n> attempts");
        assertThat(ErrorNormalizer.normalize("Template 'welcome-email' is locked"))
                .isEqualTo("Template '<value>' is locked");
    }

    @Test
    void collapsesWhitespaceAndTruncates() {
        assertThat(ErrorNormalizer.normalize("  SMTP   server\n unavailable ")).isEqualTo("SMTP server unavailable");
        assertThat(ErrorNormalizer.normalize("x".repeat(500))).hasSize(ErrorNormalizer.MAX_LENGTH);
    }

    @Test
    void blankMessagesHaveNoNormalForm() {
        assertThat(ErrorNormalizer.normalize(null)).isNull();
        assertThat(ErrorNormalizer.normalize("   ")).isNull();
    }

    @Test
    void topErrorsGroupsByNormalizedMessage() {
        List<ErrorCount> top = ErrorNormalizer.topErrors(Arrays.asList(
                "Timeout after 3000 ms",
                "Bounce for 'a@example.com'",
                "Timeout after 5000 ms",
                null,
                "Bounce for 'b@example.com'",
                "Timeout after 100 ms",
                "Rate limited"), 2);

        assertThat(top).containsExactly(
                new ErrorCount("Timeout after <n> ms", 3),
                new ErrorCount("Bounce for '<value>'", 2));
    }

    @Test
    void tiesKeepFirstSeenOrder() {
        List<ErrorCount> top = ErrorNormalizer.topErrors(List.of("b", "a", "c"), 5);

        assertThat(top).extracting(ErrorCount::message).containsExactly("b", "a", "c");
    }
}
