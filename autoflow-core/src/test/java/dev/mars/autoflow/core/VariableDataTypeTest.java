package dev.mars.autoflow.core;

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

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VariableDataTypeTest {

    @Test
    void infersStructuralTypes() {
        assertThat(VariableDataType.infer(42)).isEqualTo(VariableDataType.NUMBER);
        assertThat(VariableDataType.infer(true)).isEqualTo(VariableDataType.BOOLEAN);
        assertThat(VariableDataType.infer(List.of(1, 2))).isEqualTo(VariableDataType.ARRAY);
        assertThat(VariableDataType.infer(Map.of("a", 1))).isEqualTo(VariableDataType.JSON);
        assertThat(VariableDataType.infer(LocalDate.of(2025, 1, 1))).isEqualTo(VariableDataType.DATE);
        assertThat(VariableDataType.infer(Instant.EPOCH)).isEqualTo(VariableDataType.DATETIME);
        assertThat(VariableDataType.infer("hello")).isEqualTo(VariableDataType.STRING);
    }

    @Test
    void semanticStringTypesAreChecked() {
        assertThat(VariableDataType.EMAIL.accepts("ops@example.com")).isTrue();
        assertThat(VariableDataType.EMAIL.accepts("not-an-email")).isFalse();
        assertThat(VariableDataType.PHONE.accepts("+44 20 7946 0958")).isTrue();
        assertThat(VariableDataType.URL.accepts("https://example.com/hook")).isTrue();
        assertThat(VariableDataType.URL.accepts("ftp://example.com")).isFalse();
    }

    @Test
    void numbersAndBooleansAcceptTheirTextForms() {
        assertThat(VariableDataType.NUMBER.accepts("12.5")).isTrue();
        assertThat(VariableDataType.NUMBER.accepts("twelve")).isFalse();
        assertThat(VariableDataType.BOOLEAN.accepts("TRUE")).isTrue();
        assertThat(VariableDataType.ARRAY.accepts(Map.of())).isFalse();
        assertThat(VariableDataType.DATETIME.accepts("2025-11-03T10:15:30Z")).isTrue();
        assertThat(VariableDataType.DATE.accepts("2025-11-03")).isTrue();
    }

    @Test
    void nullIsAcceptedByEveryType() {
        for (VariableDataType type : VariableDataType.values()) {
            assertThat(type.accepts(null)).as(type.name()).isTrue();
        }
    }
}
