package dev.mars.autoflow.workflow.node.config;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Configuration of a LOOP node.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class LoopConfig {

    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final int MAX_ITERATIONS = 10000;
    public static final String DEFAULT_RESULT_KEY = "loopResults";

    /**
     * What a failed iteration does to the loop.
     */
    public enum FailurePolicy {
        /** Stop at the first failed iteration and fail the LOOP node. */
        FAIL_FAST,
        /** Record the failure in the results and carry on. */
        CONTINUE;

        public static FailurePolicy fromString(String value) {
            return value == null || value.isBlank() ? FAIL_FAST
                    : FailurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }

    private final String sourceReference;
    private final List<Object> literalItems;
    private final String itemVariable;
    private final String indexVariable;
    private final int maxIterations;
    private final String resultKey;
    private final FailurePolicy failurePolicy;
    private final int concurrency;

    @JsonCreator
    public LoopConfig(@JsonProperty("dataSource") Object dataSource,
                      @JsonProperty("sourceKey") String sourceKey,
                      @JsonProperty("itemVariable") String itemVariable,
                      @JsonProperty("indexVariable") String indexVariable,
                      @JsonProperty("maxIterations") Integer maxIterations,
                      @JsonProperty("resultKey") String resultKey,
                      @JsonProperty("failurePolicy") String failurePolicy,
                      @JsonProperty("concurrency") Integer concurrency) {
        if (dataSource instanceof Collection<?> items) {
            this.sourceReference = null;
            this.literalItems = Collections.unmodifiableList(new ArrayList<>(items));
        } else {
            this.sourceReference = dataSource != null && !dataSource.toString().isBlank() ? dataSource.toString() : sourceKey;
            this.literalItems = null;
        }
        this.itemVariable = itemVariable != null && !itemVariable.isBlank() ? itemVariable : "item";
        this.indexVariable = indexVariable != null && !indexVariable.isBlank() ? indexVariable : "index";
        this.maxIterations = maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
        this.resultKey = resultKey != null && !resultKey.isBlank() ? resultKey : DEFAULT_RESULT_KEY;
        this.failurePolicy = FailurePolicy.fromString(failurePolicy);
        this.concurrency = concurrency != null ? concurrency : 1;
    }

    /**
     * Variable reference of the array iterated over, null when the items are given inline.
     */
    public String getSourceReference() {
        return sourceReference;
    }

    public List<Object> getLiteralItems() {
        return literalItems;
    }

    public boolean hasLiteralItems() {
        return literalItems != null;
    }

    public String getItemVariable() {
        return itemVariable;
    }

    public String getIndexVariable() {
        return indexVariable;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public String getResultKey() {
        return resultKey;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public int getConcurrency() {
        return concurrency;
    }
}
