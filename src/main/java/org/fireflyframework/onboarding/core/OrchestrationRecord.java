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

package org.fireflyframework.onboarding.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Durable state of one orchestration.
 * <p>
 * Instances are immutable; every transition produces a new value that the store commits atomically
 * together with at most one {@link StepRecord}. {@code payload} never changes after creation and
 * {@code context} only grows: each successful forward step merges its output under its step key.
 * Compensation does not remove context entries; it is recorded in the step log instead.
 *
 * @param id             unique identifier, generated at creation
 * @param type           workflow kind
 * @param idempotencyKey key duplicate triggers are matched on
 * @param state          current state
 * @param payload        the onboarding request
 * @param context        outputs of completed steps keyed by {@link StepKind#key()}
 * @param createdAt      creation time
 * @param updatedAt      time of the last committed transition
 * @param completedAt    set once, on reaching a terminal state
 * @param error          last failure description
 * @param failedStep     forward step whose failure started the rollback
 * @param version        optimistic concurrency counter maintained by the store
 */
public record OrchestrationRecord(String id,
                                  WorkflowType type,
                                  String idempotencyKey,
                                  OrchestrationState state,
                                  OnboardingRequest payload,
                                  Map<String, Object> context,
                                  Instant createdAt,
                                  Instant updatedAt,
                                  Instant completedAt,
                                  String error,
                                  StepKind failedStep,
                                  long version) {

    public OrchestrationRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(idempotencyKey, "idempotencyKey");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * A freshly created record in {@link OrchestrationState#PENDING}.
     */
    public static OrchestrationRecord pending(String id, OnboardingRequest request, Instant now) {
        return new OrchestrationRecord(id, WorkflowType.CUSTOMER_ONBOARDING, request.resolveIdempotencyKey(),
                OrchestrationState.PENDING, request, Map.of(), now, now, null, null, null, 0L);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Output recorded by a completed forward step, or {@code null} if the step has not completed.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> contextEntry(StepKind step) {
        Object value = context.get(step.key());
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    public OrchestrationRecord withState(OrchestrationState next, Instant now) {
        Instant completed = completedAt;
        if (completed == null && next.isTerminal()) {
            completed = now;
        }
        return new OrchestrationRecord(id, type, idempotencyKey, next, payload, context,
                createdAt, now, completed, error, failedStep, version);
    }

    public OrchestrationRecord withContextEntry(StepKind step, Map<String, Object> output) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        merged.put(step.key(), output == null ? Map.of() : output);
        return new OrchestrationRecord(id, type, idempotencyKey, state, payload, merged,
                createdAt, updatedAt, completedAt, error, failedStep, version);
    }

    public OrchestrationRecord withError(String description) {
        return new OrchestrationRecord(id, type, idempotencyKey, state, payload, context,
                createdAt, updatedAt, completedAt, description, failedStep, version);
    }

    public OrchestrationRecord withFailure(StepKind step, String description) {
        return new OrchestrationRecord(id, type, idempotencyKey, state, payload, context,
                createdAt, updatedAt, completedAt, description, step, version);
    }

    public OrchestrationRecord withVersion(long newVersion) {
        return new OrchestrationRecord(id, type, idempotencyKey, state, payload, context,
                createdAt, updatedAt, completedAt, error, failedStep, newVersion);
    }
}
