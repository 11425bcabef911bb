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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fan-out implementation of OrchestrationEvents that delegates to multiple sinks
 * (logs and metrics). A failing sink is logged and does not stop the others.
 */
public class CompositeOrchestrationEvents implements OrchestrationEvents {

    private static final Logger log = LoggerFactory.getLogger(CompositeOrchestrationEvents.class);

    private final List<OrchestrationEvents> delegates;

    public CompositeOrchestrationEvents(Collection<OrchestrationEvents> delegates) {
        this.delegates = new ArrayList<>(Objects.requireNonNull(delegates, "delegates"));
    }

    @Override
    public void onCreated(String orchestrationId, String idempotencyKey) {
        each(d -> d.onCreated(orchestrationId, idempotencyKey));
    }

    @Override
    public void onDuplicateSuppressed(String orchestrationId, String idempotencyKey, OrchestrationState currentState) {
        each(d -> d.onDuplicateSuppressed(orchestrationId, idempotencyKey, currentState));
    }

    @Override
    public void onTransition(String orchestrationId, OrchestrationState from, OrchestrationState to) {
        each(d -> d.onTransition(orchestrationId, from, to));
    }

    @Override
    public void onStepStarted(String orchestrationId, StepKind step, StepDirection direction) {
        each(d -> d.onStepStarted(orchestrationId, step, direction));
    }

    @Override
    public void onStepRetry(String orchestrationId, StepKind step, StepDirection direction, int attempt, Throwable error) {
        each(d -> d.onStepRetry(orchestrationId, step, direction, attempt, error));
    }

    @Override
    public void onStepSucceeded(String orchestrationId, StepKind step, StepDirection direction, int attempts, long latencyMs) {
        each(d -> d.onStepSucceeded(orchestrationId, step, direction, attempts, latencyMs));
    }

    @Override
    public void onStepFailed(String orchestrationId, StepKind step, StepDirection direction, Throwable error, int attempts, long latencyMs) {
        each(d -> d.onStepFailed(orchestrationId, step, direction, error, attempts, latencyMs));
    }

    @Override
    public void onCompensationStuck(String orchestrationId, StepKind step, String error) {
        each(d -> d.onCompensationStuck(orchestrationId, step, error));
    }

    @Override
    public void onClaimLost(String orchestrationId) {
        each(d -> d.onClaimLost(orchestrationId));
    }

    @Override
    public void onFinished(String orchestrationId, OrchestrationState terminalState, long durationMs) {
        each(d -> d.onFinished(orchestrationId, terminalState, durationMs));
    }

    @Override
    public void onPollCompleted(int found, int dispatched, int failed) {
        each(d -> d.onPollCompleted(found, dispatched, failed));
    }

    private void each(Consumer<OrchestrationEvents> event) {
        for (OrchestrationEvents d : delegates) {
            try {
                event.accept(d);
            } catch (RuntimeException e) {
                log.warn("Orchestration event sink {} failed", d.getClass().getSimpleName(), e);
            }
        }
    }
}
