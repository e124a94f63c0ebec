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
 * Side-effecting actions an ACTION node can perform through a delivery adapter.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum ActionType {
    EMAIL(true),
    SMS(true),
    WHATSAPP(true),
    SLACK(false),
    CALENDAR_EVENT(false);

    private final boolean recipientsRequired;

    ActionType(boolean recipientsRequired) {
        this.recipientsRequired = recipientsRequired;
    }

    public boolean isRecipientsRequired() {
        return recipientsRequired;
    }

    public static ActionType fromString(String value) {
        return ActionType.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
