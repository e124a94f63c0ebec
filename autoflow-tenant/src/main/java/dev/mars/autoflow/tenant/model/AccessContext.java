package dev.mars.autoflow.tenant.model;

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

import java.util.Objects;

/**
 * Identity of the caller of a service operation.
 *
 * @param userId         the calling user
 * @param organizationId the organization the caller is acting for
 */
public record AccessContext(String userId, String organizationId) {

    public AccessContext {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(organizationId, "organizationId");
    }

    /**
     * Context used by internal callers such as the trigger evaluator and the schedule ticker.
     */
    public static AccessContext system(String organizationId) {
        return new AccessContext(SYSTEM_USER, organizationId);
    }

    public boolean isSystem() {
        return SYSTEM_USER.equals(userId);
    }

    public static final String SYSTEM_USER = "system";
}
