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

package org.fireflyframework.onboarding.persistence.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON implementation of {@link OrchestrationSerializer} using Jackson.
 * <p>
 * Timestamps are written as ISO-8601 strings and unknown properties are ignored on read.
 */
public class JsonOrchestrationSerializer implements OrchestrationSerializer {

    private static final Logger log = LoggerFactory.getLogger(JsonOrchestrationSerializer.class);

    private static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    public JsonOrchestrationSerializer() {
        this(createDefaultObjectMapper());
    }

    public JsonOrchestrationSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String serializeRecord(OrchestrationRecord record) throws SerializationException {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            String message = String.format("Failed to serialize orchestration %s", record.id());
            log.error(message, e);
            throw new SerializationException(message, e);
        }
    }

    @Override
    public OrchestrationRecord deserializeRecord(String data) throws SerializationException {
        try {
            return objectMapper.readValue(data, OrchestrationRecord.class);
        } catch (JsonProcessingException e) {
            String message = "Failed to deserialize orchestration record from JSON";
            log.error(message, e);
            throw new SerializationException(message, e);
        }
    }

    @Override
    public String serializeStep(StepRecord step) throws SerializationException {
        try {
            return objectMapper.writeValueAsString(step);
        } catch (JsonProcessingException e) {
            String message = String.format("Failed to serialize %s step row for orchestration %s",
                    step.step().key(), step.orchestrationId());
            log.error(message, e);
            throw new SerializationException(message, e);
        }
    }

    @Override
    public StepRecord deserializeStep(String data) throws SerializationException {
        try {
            return objectMapper.readValue(data, StepRecord.class);
        } catch (JsonProcessingException e) {
            String message = "Failed to deserialize step record from JSON";
            log.error(message, e);
            throw new SerializationException(message, e);
        }
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    /**
     * Creates the ObjectMapper used when none is supplied.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
