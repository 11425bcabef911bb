/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.onboarding.engine.step;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepKind;

import java.util.Map;
import java.util.Objects;

/**
 * Shared conversion between collaborator handles and the JSON-compatible maps kept in the record context.
 */
public abstract class AbstractStepHandler implements StepHandler {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    protected final ObjectMapper objectMapper;

    protected AbstractStepHandler(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    protected Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }

    /**
     * Reads the handle an earlier step recorded, or {@code null} if that step never completed.
     */
    protected <T> T handleOf(OrchestrationRecord record, StepKind step, Class<T> type) {
        Map<String, Object> entry = record.contextEntry(step);
        return entry != null ? objectMapper.convertValue(entry, type) : null;
    }
}
