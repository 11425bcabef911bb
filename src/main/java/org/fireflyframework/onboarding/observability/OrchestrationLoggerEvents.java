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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.fireflyframework.onboarding.util.JsonUtils.describe;
import static org.fireflyframework.onboarding.util.JsonUtils.json;

/**
 * Default logger-based implementation of {@link OrchestrationEvents}.
 * <p>
 * Every event is one JSON line so that log aggregation can index it. Levels:
 * <ul>
 *   <li>INFO - lifecycle (created, transitions, step success, finished)</li>
 *   <li>WARN - retries, claim losses, suppressed duplicates</li>
 *   <li>ERROR - step failures and stuck compensation</li>
 * </ul>
 */
public class OrchestrationLoggerEvents implements OrchestrationEvents {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoggerEvents.class);

    @Override
    public void onCreated(String orchestrationId, String idempotencyKey) {
        log.info(json("orchestration_event", "created",
                "orchestration_id", orchestrationId,
                "idempotency_key", idempotencyKey));
    }

    @Override
    public void onDuplicateSuppressed(String orchestrationId, String idempotencyKey, OrchestrationState currentState) {
        log.warn(json("orchestration_event", "duplicate_suppressed",
                "orchestration_id", orchestrationId,
                "idempotency_key", idempotencyKey,
                "state", currentState));
    }

    @Override
    public void onTransition(String orchestrationId, OrchestrationState from, OrchestrationState to) {
        log.info(json("orchestration_event", "transition",
                "orchestration_id", orchestrationId,
                "from", from,
                "to", to));
    }

    @Override
    public void onStepStarted(String orchestrationId, StepKind step, StepDirection direction) {
        log.info(json("orchestration_event", "step_started",
                "orchestration_id", orchestrationId,
                "step", step.key(),
                "direction", direction));
    }

    @Override
    public void onStepRetry(String orchestrationId, StepKind step, StepDirection direction, int attempt, Throwable error) {
        log.warn(json("orchestration_event", "step_retry",
                "orchestration_id", orchestrationId,
                "step", step.key(),
                "direction", direction,
                "attempt", attempt,
                "error", describe(error)));
    }

    @Override
    public void onStepSucceeded(String orchestrationId, StepKind step, StepDirection direction, int attempts, long latencyMs) {
        log.info(json("orchestration_event", "step_succeeded",
                "orchestration_id", orchestrationId,
                "step", step.key(),
                "direction", direction,
                "attempts", attempts,
                "latency_ms", latencyMs));
    }

    @Override
    public void onStepFailed(String orchestrationId, StepKind step, StepDirection direction, Throwable error, int attempts, long latencyMs) {
        log.error(json("orchestration_event", "step_failed",
                "orchestration_id", orchestrationId,
                "step", step.key(),
                "direction", direction,
                "error_class", error.getClass().getSimpleName(),
                "error_message", error.getMessage(),
                "attempts", attempts,
                "latency_ms", latencyMs));
    }

    @Override
    public void onCompensationStuck(String orchestrationId, StepKind step, String error) {
        log.error(json("orchestration_event", "compensation_stuck",
                "orchestration_id", orchestrationId,
                "step", step.key(),
                "error", error,
                "action", "operator_intervention_required"));
    }

    @Override
    public void onClaimLost(String orchestrationId) {
        log.warn(json("orchestration_event", "claim_lost",
                "orchestration_id", orchestrationId));
    }

    @Override
    public void onFinished(String orchestrationId, OrchestrationState terminalState, long durationMs) {
        log.info(json("orchestration_event", "finished",
                "orchestration_id", orchestrationId,
                "state", terminalState,
                "duration_ms", durationMs));
    }

    @Override
    public void onPollCompleted(int found, int dispatched, int failed) {
        if (found == 0) {
            log.debug(json("orchestration_event", "poll_completed", "found", 0));
            return;
        }
        log.info(json("orchestration_event", "poll_completed",
                "found", found,
                "dispatched", dispatched,
                "failed", failed));
    }
}
