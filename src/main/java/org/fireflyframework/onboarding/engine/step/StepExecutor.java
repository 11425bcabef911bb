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

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepDirection;
import org.fireflyframework.onboarding.core.StepKind;
import org.fireflyframework.onboarding.engine.compensation.CompensationRegistry;
import org.fireflyframework.onboarding.engine.retry.RetryPolicy;
import org.fireflyframework.onboarding.observability.OrchestrationEvents;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Invokes one step, forward or compensating, with per-call timeout, retry/backoff and an overall deadline.
 * <p>
 * The returned Mono never errors: exhausting the retry budget, a non-retryable failure or the deadline
 * expiring all produce a failed {@link StepOutcome}. Backoff waits are timers, so cancelling the
 * subscription or hitting the deadline aborts them immediately.
 */
public class StepExecutor {

    private final Map<StepKind, StepHandler> handlers = new EnumMap<>(StepKind.class);
    private final CompensationRegistry compensations;
    private final RetryPolicy retryPolicy;
    private final Duration callTimeout;
    private final Duration deadline;
    private final OrchestrationEvents events;

    public StepExecutor(Collection<? extends StepHandler> handlers,
                        CompensationRegistry compensations,
                        RetryPolicy retryPolicy,
                        Duration callTimeout,
                        Duration deadline,
                        OrchestrationEvents events) {
        for (StepHandler handler : handlers) {
            this.handlers.put(handler.kind(), handler);
        }
        for (StepKind kind : StepKind.values()) {
            if (!this.handlers.containsKey(kind)) {
                throw new IllegalStateException("No step handler registered for " + kind.key());
            }
        }
        this.compensations = Objects.requireNonNull(compensations, "compensations");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.callTimeout = callTimeout;
        this.deadline = deadline;
        this.events = Objects.requireNonNull(events, "events");
    }

    public Mono<StepOutcome> execute(StepKind step, StepDirection direction, OrchestrationRecord record) {
        StepHandler handler = handlers.get(step);
        Supplier<Mono<Map<String, Object>>> call = direction == StepDirection.FORWARD
                ? () -> handler.performForward(record).defaultIfEmpty(Map.of())
                : () -> compensations.compensate(step, record).thenReturn(Map.<String, Object>of());

        return Mono.defer(() -> {
            AtomicInteger attempts = new AtomicInteger();
            long start = System.nanoTime();
            events.onStepStarted(record.id(), step, direction);

            Mono<Map<String, Object>> attempted = attempt(call, record.id(), step, direction, attempts);
            if (isPositive(deadline)) {
                attempted = attempted.timeout(deadline);
            }
            return attempted
                    .map(output -> {
                        long latency = elapsedMillis(start);
                        events.onStepSucceeded(record.id(), step, direction, attempts.get(), latency);
                        return StepOutcome.success(step, direction, output, attempts.get(), latency);
                    })
                    .onErrorResume(err -> {
                        long latency = elapsedMillis(start);
                        events.onStepFailed(record.id(), step, direction, err, attempts.get(), latency);
                        return Mono.just(StepOutcome.failure(step, direction, err, attempts.get(), latency));
                    });
        });
    }

    private Mono<Map<String, Object>> attempt(Supplier<Mono<Map<String, Object>>> call, String orchestrationId,
                                              StepKind step, StepDirection direction, AtomicInteger attempts) {
        return Mono.defer(call)
                .transform(m -> isPositive(callTimeout) ? m.timeout(callTimeout) : m)
                .onErrorResume(err -> {
                    int made = attempts.get();
                    if (retryPolicy.shouldRetry(err, made)) {
                        events.onStepRetry(orchestrationId, step, direction, made, err);
                        return Mono.delay(retryPolicy.delayAfter(made))
                                .then(attempt(call, orchestrationId, step, direction, attempts));
                    }
                    return Mono.error(err);
                })
                .doFirst(attempts::incrementAndGet);
    }

    /**
     * The collaborator input recorded in the step log for this call.
     */
    public Map<String, Object> describeInput(StepKind step, StepDirection direction, OrchestrationRecord record) {
        StepHandler handler = handlers.get(step);
        return direction == StepDirection.FORWARD
                ? handler.describeForwardInput(record)
                : handler.describeCompensationInput(record);
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
