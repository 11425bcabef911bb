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

package org.fireflyframework.onboarding.persistence;

/**
 * The record changed since the committing worker read it (version mismatch), or it no longer exists.
 */
public class StaleTransitionException extends OrchestrationStoreException {

    private final String orchestrationId;
    private final long expectedVersion;

    public StaleTransitionException(String orchestrationId, long expectedVersion) {
        super("Orchestration " + orchestrationId + " is not at expected version " + expectedVersion);
        this.orchestrationId = orchestrationId;
        this.expectedVersion = expectedVersion;
    }

    public String getOrchestrationId() { return orchestrationId; }
    public long getExpectedVersion() { return expectedVersion; }
}
