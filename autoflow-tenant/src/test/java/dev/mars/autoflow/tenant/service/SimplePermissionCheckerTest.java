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
import dev.mars.autoflow.tenant.service.PermissionChecker.ForbiddenException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimplePermissionCheckerTest {

    private SimplePermissionChecker checker;

    @BeforeEach
    void setUp() {
        checker = new SimplePermissionChecker();
        checker.grant("org-1", "alice", OrganizationRole.ADMIN);
        checker.grant("org-1", "victor", OrganizationRole.VIEWER);
    }

    @Test
    @DisplayName("Members receive their granted role")
    void memberReceivesRole() throws Exception {
        assertEquals(OrganizationRole.ADMIN,
                checker.requirePermission(new AccessContext("alice", "org-1"), "org-1"));
    }

    @Test
    @DisplayName("Resources of another organization are forbidden")
    void crossOrganizationAccessIsForbidden() {
        checker.grant("org-2", "alice", OrganizationRole.OWNER);

        ForbiddenException exception = assertThrows(ForbiddenException.class,
                () -> checker.requirePermission(new AccessContext("alice", "org-1"), "org-2"));
        assertEquals("FORBIDDEN", exception.getErrorCode());
    }

    @Test
    void nonMemberIsForbidden() {
        assertThrows(ForbiddenException.class,
                () -> checker.requirePermission(new AccessContext("mallory", "org-1"), "org-1"));
    }

    @Test
    void viewerCannotManageWorkflows() throws Exception {
        AccessContext viewer = new AccessContext("victor", "org-1");

        assertEquals(OrganizationRole.VIEWER, checker.requirePermission(viewer, "org-1"));
        assertThrows(ForbiddenException.class, () -> checker.requireManagePermission(viewer, "org-1"));
    }

    @Test
    void systemContextPassesEveryOrganization() throws Exception {
        assertEquals(OrganizationRole.OWNER,
                checker.requireManagePermission(AccessContext.system("org-9"), "org-9"));
    }

    @Test
    void revokedMemberLosesAccess() {
        checker.revoke("org-1", "alice");

        assertThrows(ForbiddenException.class,
                () -> checker.requirePermission(new AccessContext("alice", "org-1"), "org-1"));
    }
}
