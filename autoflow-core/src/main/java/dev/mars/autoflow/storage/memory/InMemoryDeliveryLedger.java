package dev.mars.autoflow.storage.memory;

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
import dev.mars.autoflow.storage.DeliveryLedger;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDeliveryLedger implements DeliveryLedger {

    private final Map<String, DeliveryReceipt> receipts = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Override
    public Optional<DeliveryReceipt> find(String idempotencyKey) {
        return Optional.ofNullable(receipts.get(idempotencyKey));
    }

    @Override
    public synchronized boolean record(DeliveryReceipt receipt) {
        boolean recorded = receipts.putIfAbsent(receipt.idempotencyKey(), receipt) == null;
        inFlight.remove(receipt.idempotencyKey());
        return recorded;
    }

    @Override
    public synchronized boolean reserve(String idempotencyKey) {
        if (receipts.containsKey(idempotencyKey)) {
            return false;
        }
        return inFlight.add(idempotencyKey);
    }

    @Override
    public void release(String idempotencyKey) {
        inFlight.remove(idempotencyKey);
    }

    public int size() {
        return receipts.size();
    }
}
