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

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepRecord;

/**
 * Converts orchestration records and step rows to and from their stored text form.
 * <p>
 * Implementations must round-trip every field, including {@code null} context values and timestamps,
 * and must tolerate fields they do not know so that older instances can read records written by newer ones.
 */
public interface OrchestrationSerializer {

    String serializeRecord(OrchestrationRecord record) throws SerializationException;

    OrchestrationRecord deserializeRecord(String data) throws SerializationException;

    String serializeStep(StepRecord step) throws SerializationException;

    StepRecord deserializeStep(String data) throws SerializationException;

    /**
     * Content type identifier, e.g. {@code application/json}.
     */
    String getContentType();

    /**
     * Exception thrown when serialization or deserialization fails.
     */
    class SerializationException extends Exception {
        public SerializationException(String message) {
            super(message);
        }

        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
