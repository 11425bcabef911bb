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

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepRecord;

import java.time.Duration;
import java.util.Objects;

/**
 * One atomic state change: the new record, at most one appended step row and the lease extension.
 * Transitions that call no collaborator carry no step row; the only one is entering the first
 * compensating state from a failed state, and the rows of the compensation calls follow it.
 * The store applies it only if {@code owner} still holds the lease and the stored version equals
 * {@code expectedVersion}; the persisted record gets version {@code expectedVersion + 1}.
 */
public record Transition(
        String orchestrationId,
        long expectedVersion,
        String owner,
        OrchestrationRecord next,
        StepRecord stepRecord,
        Duration leaseExtension
) {
    public Transition {
        Objects.requireNonNull(orchestrationId, "orchestrationId");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(leaseExtension, "leaseExtension");
        if (!orchestrationId.equals(next.id())) {
            throw new IllegalArgumentException("Transition for " + orchestrationId + " carries record " + next.id());
        }
        if (stepRecord != null && !orchestrationId.equals(stepRecord.orchestrationId())) {
            throw new IllegalArgumentException("Step record belongs to " + stepRecord.orchestrationId());
        }
    }
}
