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

package org.fireflyframework.onboarding.dispatch;

import org.fireflyframework.onboarding.core.OnboardingRequest;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepRecord;
import org.fireflyframework.onboarding.engine.DispatchResult;
import org.fireflyframework.onboarding.engine.SagaEngine;
import org.fireflyframework.onboarding.observability.OrchestrationEvents;
import org.fireflyframework.onboarding.persistence.CreateResult;
import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for onboarding triggers and re-dispatches.
 * <p>
 * Intake validates the request, creates the orchestration record exactly once per idempotency key and
 * hands new records to the {@link SagaEngine}. A repeated trigger returns the existing record's current
 * state without dispatching anything. Whenever a dispatch run by this class commits a terminal
 * transition, the completion callback is invoked.
 */
public class OnboardingDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OnboardingDispatcher.class);

    private final OrchestrationStore store;
    private final SagaEngine engine;
    private final OnboardingRequestValidator validator;
    private final OrchestrationCompletionCallback callback;
    private final OrchestrationEvents events;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final Scheduler backgroundScheduler;

    public OnboardingDispatcher(OrchestrationStore store,
                                SagaEngine engine,
                                OnboardingRequestValidator validator,
                                OrchestrationCompletionCallback callback,
                                OrchestrationEvents events,
                                Clock clock) {
        this(store, engine, validator, callback, events, clock, () -> UUID.randomUUID().toString(),
                Schedulers.boundedElastic());
    }

    public OnboardingDispatcher(OrchestrationStore store,
                                SagaEngine engine,
                                OnboardingRequestValidator validator,
                                OrchestrationCompletionCallback callback,
                                OrchestrationEvents events,
                                Clock clock,
                                Supplier<String> idGenerator,
                                Scheduler backgroundScheduler) {
        this.store = Objects.requireNonNull(store, "store");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.backgroundScheduler = Objects.requireNonNull(backgroundScheduler, "backgroundScheduler");
    }

    /**
     * Accepts a trigger and drives the new orchestration until it is terminal or halts.
     * <p>
     * Errors with {@link org.fireflyframework.onboarding.exception.OnboardingValidationException} for a
     * malformed request. A dispatch that fails after the record was created is logged and left to the
     * poller; the result then carries the record as created and no dispatch result.
     */
    public Mono<IntakeResult> submit(OnboardingRequest request) {
        return intake(request).flatMap(created -> {
            if (!created.created()) {
                return Mono.just(duplicate(created.record()));
            }
            OrchestrationRecord record = created.record();
            return dispatchAndNotify(record.id())
                    .map(result -> IntakeResult.accepted(result.record() != null ? result.record() : record, result))
                    .onErrorResume(error -> {
                        log.error("Dispatch of new orchestration {} failed; the poller will resume it", record.id(), error);
                        return Mono.just(IntakeResult.accepted(record, null));
                    });
        });
    }

    /**
     * Accepts a trigger and returns as soon as the record exists; the dispatch continues in the background.
     * Suited to webhook receivers that must acknowledge quickly.
     */
    public Mono<IntakeResult> accept(OnboardingRequest request) {
        return intake(request).map(created -> {
            if (!created.created()) {
                return duplicate(created.record());
            }
            String id = created.record().id();
            dispatchAndNotify(id)
                    .subscribeOn(backgroundScheduler)
                    .subscribe(
                            result -> log.debug("Background dispatch of {} ended with {}", id, result.outcome()),
                            error -> log.error("Background dispatch of {} failed; the poller will resume it", id, error));
            return IntakeResult.accepted(created.record(), null);
        });
    }

    /**
     * Drives an existing orchestration. Terminal records are left untouched and the callback is not re-invoked.
     */
    public Mono<DispatchResult> redispatch(String orchestrationId) {
        return dispatchAndNotify(orchestrationId);
    }

    public Mono<OrchestrationRecord> find(String orchestrationId) {
        return store.findById(orchestrationId);
    }

    public Mono<OrchestrationRecord> findByIdempotencyKey(String idempotencyKey) {
        return store.findByIdempotencyKey(idempotencyKey);
    }

    /**
     * The step log of an orchestration, in commit order.
     */
    public Flux<StepRecord> history(String orchestrationId) {
        return store.findStepRecords(orchestrationId);
    }

    private Mono<CreateResult> intake(OnboardingRequest request) {
        return Mono.fromCallable(() -> {
                    validator.validate(request);
                    return OrchestrationRecord.pending(idGenerator.get(), request, clock.instant());
                })
                .flatMap(store::createIfAbsent)
                .doOnNext(created -> {
                    if (created.created()) {
                        events.onCreated(created.record().id(), created.record().idempotencyKey());
                    }
                });
    }

    private IntakeResult duplicate(OrchestrationRecord existing) {
        events.onDuplicateSuppressed(existing.id(), existing.idempotencyKey(), existing.state());
        return IntakeResult.duplicate(existing);
    }

    private Mono<DispatchResult> dispatchAndNotify(String orchestrationId) {
        return engine.dispatch(orchestrationId)
                .doOnNext(result -> {
                    if (result.reachedTerminal()) {
                        notifyCallback(result.record());
                    }
                });
    }

    private void notifyCallback(OrchestrationRecord record) {
        try {
            if (record.state() == OrchestrationState.COMPLETED) {
                callback.onCompleted(record);
            } else {
                callback.onRolledBack(record, record.failedStep(), record.error());
            }
        } catch (RuntimeException e) {
            log.error("Completion callback failed for orchestration {} in state {}", record.id(), record.state(), e);
        }
    }
}
