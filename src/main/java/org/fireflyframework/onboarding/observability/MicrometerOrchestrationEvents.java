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

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepDirection;
import org.fireflyframework.onboarding.core.StepKind;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link OrchestrationEvents}.
 * <p>
 * Publishes counters, timers and an attempts distribution per step and direction.
 */
public class MicrometerOrchestrationEvents implements OrchestrationEvents {

    private final MeterRegistry registry;

    public MicrometerOrchestrationEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onCreated(String orchestrationId, String idempotencyKey) {
        registry.counter("onboarding.orchestration.created").increment();
    }

    @Override
    public void onDuplicateSuppressed(String orchestrationId, String idempotencyKey, OrchestrationState currentState) {
        registry.counter("onboarding.orchestration.duplicates").increment();
    }

    @Override
    public void onTransition(String orchestrationId, OrchestrationState from, OrchestrationState to) {
        registry.counter("onboarding.orchestration.transitions", Tags.of(Tag.of("to", to.name()))).increment();
    }

    @Override
    public void onStepRetry(String orchestrationId, StepKind step, StepDirection direction, int attempt, Throwable error) {
        registry.counter("onboarding.step.retries", stepTags(step, direction)
                .and(Tag.of("error.type", error.getClass().getSimpleName()))).increment();
    }

    @Override
    public void onStepSucceeded(String orchestrationId, StepKind step, StepDirection direction, int attempts, long latencyMs) {
        Tags tags = stepTags(step, direction).and(Tag.of("outcome", "success"));
        recordStep(tags, attempts, latencyMs);
    }

    @Override
    public void onStepFailed(String orchestrationId, StepKind step, StepDirection direction, Throwable error, int attempts, long latencyMs) {
        Tags tags = stepTags(step, direction)
                .and(Tag.of("outcome", "failure"))
                .and(Tag.of("error.type", error.getClass().getSimpleName()));
        recordStep(tags, attempts, latencyMs);
    }

    @Override
    public void onCompensationStuck(String orchestrationId, StepKind step, String error) {
        registry.counter("onboarding.compensation.stuck", Tags.of(Tag.of("step", step.key()))).increment();
    }

    @Override
    public void onClaimLost(String orchestrationId) {
        registry.counter("onboarding.orchestration.claim.lost").increment();
    }

    @Override
    public void onFinished(String orchestrationId, OrchestrationState terminalState, long durationMs) {
        Tags tags = Tags.of(Tag.of("state", terminalState.name()));
        registry.counter("onboarding.orchestration.finished", tags).increment();
        if (durationMs > 0) {
            registry.timer("onboarding.orchestration.duration", tags).record(Duration.ofMillis(durationMs));
        }
    }

    @Override
    public void onPollCompleted(int found, int dispatched, int failed) {
        registry.counter("onboarding.poller.found").increment(found);
        registry.counter("onboarding.poller.failed").increment(failed);
    }

    private void recordStep(Tags tags, int attempts, long latencyMs) {
        registry.counter("onboarding.step.completed", tags).increment();
        if (latencyMs > 0) {
            registry.timer("onboarding.step.duration", tags).record(Duration.ofMillis(latencyMs));
        }
        DistributionSummary.builder("onboarding.step.attempts")
                .baseUnit("attempts")
                .tags(tags)
                .register(registry)
                .record(attempts);
    }

    private static Tags stepTags(StepKind step, StepDirection direction) {
        return Tags.of(
                Tag.of("step", step.key()),
                Tag.of("direction", direction.name().toLowerCase())
        );
    }
}
