package dev.mars.autoflow.workflow.service;

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
import dev.mars.autoflow.workflow.action.ActionPayload;
import dev.mars.autoflow.workflow.action.DeliveryAdapter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Accepts every payload and keeps it for inspection.
 */
class RecordingDeliveryAdapter implements DeliveryAdapter {

    private final ActionType actionType;
    private final List<ActionPayload> sent = new CopyOnWriteArrayList<>();

    RecordingDeliveryAdapter(ActionType actionType) {
        this.actionType = actionType;
    }

    @Override
    public ActionType getActionType() {
        return actionType;
    }

    @Override
    public DeliveryReceipt send(ActionPayload payload) {
        sent.add(payload);
        return new DeliveryReceipt(payload.idempotencyKey(), actionType,
                actionType.name().toLowerCase() + "-" + sent.size(), Instant.now());
    }

    List<ActionPayload> sent() {
        return sent;
    }
}
