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

import dev.mars.autoflow.tenant.model.AccessContext;
import dev.mars.autoflow.tenant.model.OrganizationRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory membership table implementing {@link PermissionChecker}.
 *
 * <p>The {@link AccessContext#SYSTEM_USER} is treated as an owner of every
 * organization, so trigger and scheduler callbacks pass the boundary check.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class SimplePermissionChecker implements PermissionChecker {

    private static final Logger logger = LoggerFactory.getLogger(SimplePermissionChecker.class);

    private final Map<String, Map<String, OrganizationRole>> memberships = new ConcurrentHashMap<>();

    public void grant(String organizationId, String userId, OrganizationRole role) {
        Objects.requireNonNull(organizationId, "Organization ID cannot be null");
        Objects.requireNonNull(userId, "User ID cannot be null");
        Objects.requireNonNull(role, "Role cannot be null");
        memberships.computeIfAbsent(organizationId, id -> new ConcurrentHashMap<>()).put(userId, role);
        logger.debug("Granted {} to user {} in organization {}", role, userId, organizationId);
    }

    public void revoke(String organizationId, String userId) {
        Map<String, OrganizationRole> members = memberships.get(organizationId);
        if (members != null && members.remove(userId) != null) {
            logger.debug("Revoked membership of user {} in organization {}", userId, organizationId);
        }
    }

    public Optional<OrganizationRole> getRole(String organizationId, String userId) {
        return Optional.ofNullable(memberships.getOrDefault(organizationId, Map.of()).get(userId));
    }

    @Override
    public OrganizationRole requirePermission(AccessContext context, String organizationId) throws ForbiddenException {
        Objects.requireNonNull(context, "Access context cannot be null");
        if (context.isSystem()) {
            return OrganizationRole.OWNER;
        }
        if (!context.organizationId().equals(organizationId)) {
            logger.warn("User {} acting for {} attempted to access organization {}",
                    context.userId(), context.organizationId(), organizationId);
            throw new ForbiddenException("Resource belongs to a different organization");
        }
        return getRole(organizationId, context.userId())
                .orElseThrow(() -> new ForbiddenException(String.format("User '%s' is not a member of organization '%s'",
                        context.userId(), organizationId)));
    }
}
