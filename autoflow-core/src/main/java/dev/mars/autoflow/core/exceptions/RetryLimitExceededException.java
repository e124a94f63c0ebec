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

public class RetryLimitExceededException extends AutoflowException {

    private final String executionId;
    private final int retryCount;
    private final int maxRetries;

    public RetryLimitExceededException(String executionId, int retryCount, int maxRetries) {
        super(String.format("Execution '%s' has already been retried %d of %d times",
                executionId, retryCount, maxRetries));
        this.executionId = executionId;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
    }

    public String getExecutionId() {
        return executionId;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public String getErrorCode() {
        return "RETRY_LIMIT_EXCEEDED";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
