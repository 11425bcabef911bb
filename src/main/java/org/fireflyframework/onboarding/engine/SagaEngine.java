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

package org.fireflyframework.onboarding.engine;

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepDirection;
import org.fireflyframework.onboarding.core.StepRecord;
import org.fireflyframework.onboarding.engine.step.StepExecutor;
import org.fireflyframework.onboarding.engine.step.StepOutcome;
import org.fireflyframework.onboarding.observability.OrchestrationEvents;
import org.fireflyframework.onboarding.persistence.ClaimResult;
import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.fireflyframework.onboarding.persistence.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The onboarding state machine.
 * <p>
 * {@link #dispatch} claims a record, then repeatedly looks up the action for the committed state in the
 * {@link TransitionTable}, performs it and commits the resulting transition, until the record is terminal
 * or progress halts. Nothing is kept in memory between commits: every decision is made from the last
 * committed record, and a failed commit aborts the dispatch without any local state to undo.
 * Each dispatch claims under its own lease token ({@code workerId:uuid}), so two dispatches of the same
 * record on one worker exclude each other just as dispatches on different workers do. The claim is
 * released when the dispatch ends, whether it completes, errors or is cancelled.
 */
public class SagaEngine {

    private static final Logger log = LoggerFactory.getLogger(SagaEngine.class);

    private final OrchestrationStore store;
    private final StepExecutor executor;
    private final TransitionTable table;
    private final OrchestrationEvents events;
    private final String workerId;
    private final Duration leaseDuration;
    private final Clock clock;

    public SagaEngine(OrchestrationStore store,
                      StepExecutor executor,
                      TransitionTable table,
                      OrchestrationEvents events,
                      String workerId,
                      Duration leaseDuration,
                      Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.table = Objects.requireNonNull(table, "table");
        this.events = Objects.requireNonNull(events, "events");
        this.workerId = Objects.requireNonNull(workerId, "workerId");
        this.leaseDuration = Objects.requireNonNull(leaseDuration, "leaseDuration");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Drives an orchestration as far as it can go.
     * <p>
     * Dispatching a terminal record is a no-op returning {@link DispatchResult.Outcome#ALREADY_TERMINAL}.
     * If another worker holds the record the result is {@link DispatchResult.Outcome#CLAIM_LOST} and the
     * caller should try again later. Store failures surface as an error signal.
     */
    public Mono<DispatchResult> dispatch(String orchestrationId) {
        return Mono.defer(() -> {
            String leaseToken = workerId + ":" + UUID.randomUUID();
            return store.claim(orchestrationId, leaseToken, leaseDuration)
                    .flatMap(claim -> handleClaim(orchestrationId, leaseToken, claim));
        });
    }

    private Mono<DispatchResult> handleClaim(String orchestrationId, String leaseToken, ClaimResult claim) {
        return switch (claim.status()) {
            case NOT_FOUND -> Mono.just(DispatchResult.notFound(orchestrationId));
            case TERMINAL -> Mono.just(DispatchResult.of(DispatchResult.Outcome.ALREADY_TERMINAL, claim.record()));
            case HELD -> {
                events.onClaimLost(orchestrationId);
                yield Mono.just(DispatchResult.of(DispatchResult.Outcome.CLAIM_LOST, claim.record()));
            }
            case CLAIMED -> drive(claim, leaseToken);
        };
    }

    private Mono<DispatchResult> drive(ClaimResult claim, String leaseToken) {
        String id = claim.record().id();
        return Mono.usingWhen(
                Mono.just(claim.record()),
                record -> advance(record, leaseToken),
                record -> release(id, leaseToken),
                (record, error) -> release(id, leaseToken),
                record -> release(id, leaseToken));
    }

    private Mono<DispatchResult> advance(OrchestrationRecord record, String leaseToken) {
        if (record.isTerminal()) {
            return Mono.just(DispatchResult.of(DispatchResult.Outcome.REACHED_TERMINAL, record));
        }
        return table.actionFor(record.state())
                .map(action -> perform(record, action, leaseToken))
                .orElseGet(() -> Mono.just(new Progress(record, true)))
                .flatMap(progress -> progress.halted()
                        ? Mono.just(DispatchResult.of(DispatchResult.Outcome.HALTED, progress.record()))
                        : advance(progress.record(), leaseToken));
    }

    private Mono<Progress> perform(OrchestrationRecord record, SagaAction action, String leaseToken) {
        return switch (action.type()) {
            case BEGIN_STEP -> {
                Instant now = clock.instant();
                Map<String, Object> input = executor.describeInput(action.step(), StepDirection.FORWARD, record);
                StepRecord started = StepRecord.started(record.id(), action.step(), StepDirection.FORWARD, input, now);
                yield commit(record, record.withState(action.onSuccess(), now), started, leaseToken)
                        .map(Progress::advanced);
            }
            case EXECUTE_FORWARD -> executeForward(record, action, leaseToken);
            // no step is called here; the rows of the compensation itself follow
            case BEGIN_COMPENSATION -> commit(record, record.withState(action.onSuccess(), clock.instant()), null,
                    leaseToken).map(Progress::advanced);
            case EXECUTE_COMPENSATION -> executeCompensation(record, action, leaseToken);
        };
    }

    private Mono<Progress> executeForward(OrchestrationRecord record, SagaAction action, String leaseToken) {
        Instant startedAt = clock.instant();
        Map<String, Object> input = executor.describeInput(action.step(), StepDirection.FORWARD, record);
        return executor.execute(action.step(), StepDirection.FORWARD, record)
                .flatMap(outcome -> {
                    Instant now = clock.instant();
                    if (outcome.success()) {
                        OrchestrationRecord next = record
                                .withContextEntry(action.step(), outcome.output())
                                .withState(action.onSuccess(), now);
                        StepRecord row = StepRecord.completed(record.id(), action.step(), input,
                                outcome.output(), outcome.attempts(), startedAt, now);
                        return commit(record, next, row, leaseToken);
                    }
                    String error = outcome.errorDescription();
                    OrchestrationRecord next = record
                            .withFailure(action.step(), error)
                            .withState(action.onFailure(), now);
                    StepRecord row = StepRecord.failed(record.id(), action.step(), StepDirection.FORWARD, input,
                            error, outcome.attempts(), startedAt, now);
                    return commit(record, next, row, leaseToken);
                })
                .map(Progress::advanced);
    }

    private Mono<Progress> executeCompensation(OrchestrationRecord record, SagaAction action, String leaseToken) {
        Instant startedAt = clock.instant();
        Map<String, Object> input = executor.describeInput(action.step(), StepDirection.COMPENSATION, record);
        return executor.execute(action.step(), StepDirection.COMPENSATION, record)
                .flatMap(outcome -> {
                    Instant now = clock.instant();
                    if (outcome.success()) {
                        StepRecord row = StepRecord.compensated(record.id(), action.step(), input,
                                outcome.attempts(), startedAt, now);
                        return commit(record, record.withState(action.onSuccess(), now), row, leaseToken)
                                .map(Progress::advanced);
                    }
                    return compensationStuck(record, action, outcome, input, startedAt, now, leaseToken);
                });
    }

    /**
     * The record stays in its compensating state; the failed row keeps the step, the attempt count and
     * the remote handle an operator needs. The poller retries it once it goes stale.
     */
    private Mono<Progress> compensationStuck(OrchestrationRecord record, SagaAction action, StepOutcome outcome,
                                             Map<String, Object> input, Instant startedAt, Instant now,
                                             String leaseToken) {
        String error = outcome.errorDescription();
        StepRecord row = StepRecord.failed(record.id(), action.step(), StepDirection.COMPENSATION, input,
                error, outcome.attempts(), startedAt, now);
        return commit(record, record.withState(record.state(), now), row, leaseToken)
                .doOnNext(committed -> events.onCompensationStuck(record.id(), action.step(), error))
                .map(Progress::halted);
    }

    private Mono<OrchestrationRecord> commit(OrchestrationRecord current, OrchestrationRecord next, StepRecord row,
                                             String leaseToken) {
        Transition transition = new Transition(current.id(), current.version(), leaseToken, next, row, leaseDuration);
        return store.commit(transition)
                .doOnNext(committed -> {
                    if (committed.state() != current.state()) {
                        events.onTransition(committed.id(), current.state(), committed.state());
                    }
                    if (committed.isTerminal()) {
                        long duration = Duration.between(committed.createdAt(), committed.completedAt()).toMillis();
                        events.onFinished(committed.id(), committed.state(), duration);
                    }
                });
    }

    private Mono<Void> release(String orchestrationId, String leaseToken) {
        return store.release(orchestrationId, leaseToken)
                .onErrorResume(error -> {
                    log.warn("Failed to release lease on orchestration {}; it expires after {}",
                            orchestrationId, leaseDuration, error);
                    return Mono.empty();
                });
    }

    public String getWorkerId() {
        return workerId;
    }

    private record Progress(OrchestrationRecord record, boolean halted) {
        static Progress advanced(OrchestrationRecord record) {
            return new Progress(record, false);
        }

        static Progress halted(OrchestrationRecord record) {
            return new Progress(record, true);
        }
    }
}
