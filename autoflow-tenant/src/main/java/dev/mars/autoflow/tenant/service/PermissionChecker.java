package dev.mars.autoflow.tenant.service;

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

import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.tenant.model.AccessContext;
import dev.mars.autoflow.tenant.model.OrganizationRole;

/**
 * Tenant boundary check consulted by every workflow service operation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface PermissionChecker {

    /**
     * Resolve the caller's role in the organization.
     *
     * @param context        the caller
     * @param organizationId the organization that owns the resource being accessed
     * @return the caller's role
     * @throws ForbiddenException if the caller is not a member of the organization
     */
    OrganizationRole requirePermission(AccessContext context, String organizationId) throws ForbiddenException;

    /**
     * As {@link #requirePermission} but additionally requires a role that may manage workflows.
     */
    default OrganizationRole requireManagePermission(AccessContext context, String organizationId)
            throws ForbiddenException {
        OrganizationRole role = requirePermission(context, organizationId);
        if (!role.canManageWorkflows()) {
            throw new ForbiddenException(String.format("User '%s' has role %s in organization '%s' and cannot manage workflows",
                    context.userId(), role, organizationId));
        }
        return role;
    }

    /**
     * Thrown when the caller may not access an organization's resources.
     */
    class ForbiddenException extends AutoflowException {
        public ForbiddenException(String message) {
            super(message);
        }

        @Override
        public String getErrorCode() {
            return "FORBIDDEN";
        }

        @Override
        public boolean isRetryable() {
            return false;
        }
    }
}
