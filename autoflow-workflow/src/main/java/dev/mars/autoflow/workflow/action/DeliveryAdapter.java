package dev.mars.autoflow.workflow.action;

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

import dev.mars.autoflow.core.ActionType;
import dev.mars.autoflow.core.DeliveryReceipt;
import dev.mars.autoflow.core.exceptions.DeliveryException;

/**
 * Delivers payloads of one action type to an external provider.
 *
 * <p>Adapters are only called once per idempotency key that succeeded; a failed call
 * may be repeated when the node is retried.
 */
public interface DeliveryAdapter {

    ActionType getActionType();

    /**
     * @return receipt proving the provider accepted the payload
     * @throws DeliveryException if the provider rejected the payload; retryable failures are retried by the node
     */
    DeliveryReceipt send(ActionPayload payload) throws DeliveryException;
}
