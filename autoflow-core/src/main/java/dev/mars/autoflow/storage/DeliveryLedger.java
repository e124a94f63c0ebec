package dev.mars.autoflow.storage;

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

import dev.mars.autoflow.core.DeliveryReceipt;

import java.util.Optional;

/**
 * Record of side effects already performed, keyed by idempotency key. ACTION nodes
 * consult it before calling a delivery adapter so a re-invocation never resends.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface DeliveryLedger {

    Optional<DeliveryReceipt> find(String idempotencyKey);

    /**
     * Records the receipt unless one already exists for its key.
     *
     * @return true if the receipt was recorded, false if the key was already present
     */
    boolean record(DeliveryReceipt receipt);

    /**
     * Claims a key for a delivery that is about to be attempted. A claim ends when a receipt is
     * recorded for the key or when it is released.
     *
     * @return true if the caller now holds the claim, false if the key is claimed or delivered
     */
    boolean reserve(String idempotencyKey);

    /**
     * Drops the claim on a key whose delivery did not go through.
     */
    void release(String idempotencyKey);
}
