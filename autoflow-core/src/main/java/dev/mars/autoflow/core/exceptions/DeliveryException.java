package dev.mars.autoflow.core.exceptions;

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

/**
 * Thrown by a delivery adapter when a provider rejects or cannot accept a payload.
 */
public class DeliveryException extends AutoflowException {

    private final boolean retryable;

    public DeliveryException(String message) {
        this(message, true);
    }

    public DeliveryException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    @Override
    public String getErrorCode() {
        return "DELIVERY_FAILED";
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
