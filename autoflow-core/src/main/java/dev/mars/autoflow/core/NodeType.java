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

import java.util.Locale;

/**
 * The kinds of node a workflow graph may contain.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum NodeType {
    TRIGGER,
    ACTION,
    QUERY,
    LOOP,
    FILTER,
    CONDITION,
    DELAY,
    SCHEDULE;

    /**
     * Nodes of these types may suspend an execution until a later point in time.
     */
    public boolean canSuspend() {
        return this == DELAY || this == SCHEDULE;
    }

    /**
     * Nodes of these types decide at runtime which of their outgoing edges are followed.
     */
    public boolean isBranching() {
        return this == CONDITION || this == FILTER || this == LOOP;
    }

    public static NodeType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node type cannot be blank");
        }
        return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
