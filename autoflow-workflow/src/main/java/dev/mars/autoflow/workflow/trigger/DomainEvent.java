package dev.mars.autoflow.workflow.trigger;

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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Something that happened in a business module, e.g. module {@code crm}, event type
 * {@code created}, entity type {@code deal}. The payload becomes the trigger data of
 * every execution the event starts.
 *
 * @param organizationId tenant that owns the entity
 * @param module         originating module
 * @param eventType      what happened
 * @param entityType     kind of entity affected, may be null
 * @param payload        event data, matched against trigger conditions
 * @param occurredAt     when it happened, may be null
 */
public record DomainEvent(String organizationId, String module, String eventType, String entityType,
                          Map<String, Object> payload, Instant occurredAt) {

    public DomainEvent {
        Objects.requireNonNull(organizationId, "Organization ID cannot be null");
        Objects.requireNonNull(eventType, "Event type cannot be null");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static DomainEvent of(String organizationId, String module, String eventType, String entityType,
                                 Map<String, Object> payload) {
        return new DomainEvent(organizationId, module, eventType, entityType, payload, null);
    }
}
