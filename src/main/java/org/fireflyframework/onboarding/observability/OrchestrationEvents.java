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

package org.fireflyframework.onboarding.observability;

import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepDirection;
import org.fireflyframework.onboarding.core.StepKind;

/**
 * Listener for orchestration lifecycle events. All methods default to no-ops so implementations
 * override only what they need.
 */
public interface OrchestrationEvents {

    default void onCreated(String orchestrationId, String idempotencyKey) {}

    default void onDuplicateSuppressed(String orchestrationId, String idempotencyKey, OrchestrationState currentState) {}

    default void onTransition(String orchestrationId, OrchestrationState from, OrchestrationState to) {}

    default void onStepStarted(String orchestrationId, StepKind step, StepDirection direction) {}

    default void onStepRetry(String orchestrationId, StepKind step, StepDirection direction, int attempt, Throwable error) {}

    default void onStepSucceeded(String orchestrationId, StepKind step, StepDirection direction, int attempts, long latencyMs) {}

    default void onStepFailed(String orchestrationId, StepKind step, StepDirection direction, Throwable error, int attempts, long latencyMs) {}

    /**
     * An inverse operation failed after its retry budget; the record stays in its compensating state
     * and needs operator attention.
     */
    default void onCompensationStuck(String orchestrationId, StepKind step, String error) {}

    default void onClaimLost(String orchestrationId) {}

    default void onFinished(String orchestrationId, OrchestrationState terminalState, long durationMs) {}

    default void onPollCompleted(int found, int dispatched, int failed) {}
}
