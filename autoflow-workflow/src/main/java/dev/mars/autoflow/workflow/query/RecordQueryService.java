package dev.mars.autoflow.workflow.query;

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

import java.util.List;
import java.util.Map;

/**
 * Read access to an organization's business records, used by QUERY nodes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface RecordQueryService {

    /**
     * Runs a query scoped to one organization.
     *
     * @return matching records, never null
     * @throws AutoflowException if the model is unknown or the store is unavailable
     */
    List<Map<String, Object>> findRecords(String organizationId, RecordQuery query) throws AutoflowException;
}
