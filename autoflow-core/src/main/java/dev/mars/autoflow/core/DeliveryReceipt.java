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

import java.time.Instant;
import java.util.Objects;

/**
 * Proof that a delivery adapter accepted a payload. Recorded once per idempotency key.
 *
 * @param idempotencyKey key derived from the node execution (and loop iteration)
 * @param actionType     the action that was delivered
 * @param providerId     identifier assigned by the provider, if any
 * @param deliveredAt    when the adapter accepted the payload
 */
public record DeliveryReceipt(String idempotencyKey, ActionType actionType, String providerId,
                              Instant deliveredAt) {

    public DeliveryReceipt {
        Objects.requireNonNull(idempotencyKey, "idempotencyKey");
        Objects.requireNonNull(actionType, "actionType");
    }
}
