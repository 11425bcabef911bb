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

package org.fireflyframework.onboarding.persistence.impl;

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepRecord;
import org.fireflyframework.onboarding.persistence.ClaimResult;
import org.fireflyframework.onboarding.persistence.CreateResult;
import org.fireflyframework.onboarding.persistence.LeaseLostException;
import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.fireflyframework.onboarding.persistence.OrchestrationStoreException;
import org.fireflyframework.onboarding.persistence.StaleTransitionException;
import org.fireflyframework.onboarding.persistence.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link OrchestrationStore}.
 * <p>
 * Each orchestration is held as an immutable {@link Entry} (record, step rows, lease) that is replaced
 * through {@link ConcurrentHashMap#compute}, so a commit swaps record, step log and lease in one step
 * and readers never see half of a transition.
 * <p>
 * Key characteristics:
 * <ul>
 *   <li>Zero external dependencies</li>
 *   <li>Claims are only exclusive within this JVM</li>
 *   <li>No persistence across application restarts</li>
 * </ul>
 * Suitable for development, tests and single-instance deployments where losing in-flight
 * onboardings on restart is acceptable.
 */
public class InMemoryOrchestrationStore implements OrchestrationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOrchestrationStore.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idempotencyIndex = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryOrchestrationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryOrchestrationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<CreateResult> createIfAbsent(OrchestrationRecord record) {
        return Mono.fromCallable(() -> {
            String id = idempotencyIndex.computeIfAbsent(record.idempotencyKey(), key -> {
                entries.put(record.id(), new Entry(record, List.of(), null, null));
                return record.id();
            });
            if (id.equals(record.id())) {
                log.debug("Created orchestration {} for idempotency key {}", id, record.idempotencyKey());
                return new CreateResult(record, true);
            }
            Entry existing = entries.get(id);
            if (existing == null) {
                throw new OrchestrationStoreException("Idempotency key " + record.idempotencyKey()
                        + " points at missing orchestration " + id);
            }
            log.debug("Idempotency key {} already maps to orchestration {}", record.idempotencyKey(), id);
            return new CreateResult(existing.record(), false);
        });
    }

    @Override
    public Mono<OrchestrationRecord> findById(String orchestrationId) {
        return Mono.fromCallable(() -> {
            Entry entry = entries.get(orchestrationId);
            return entry != null ? entry.record() : null;
        });
    }

    @Override
    public Mono<OrchestrationRecord> findByIdempotencyKey(String idempotencyKey) {
        return Mono.justOrEmpty(idempotencyIndex.get(idempotencyKey))
                .flatMap(this::findById);
    }

    @Override
    public Mono<ClaimResult> claim(String orchestrationId, String owner, Duration leaseDuration) {
        return Mono.fromCallable(() -> {
            AtomicReference<ClaimResult> result = new AtomicReference<>(ClaimResult.notFound());
            entries.computeIfPresent(orchestrationId, (id, entry) -> {
                if (entry.record().isTerminal()) {
                    result.set(ClaimResult.terminal(entry.record()));
                    return entry;
                }
                Instant now = clock.instant();
                if (entry.leaseOwner() != null && !entry.leaseOwner().equals(owner)
                        && entry.leaseUntil().isAfter(now)) {
                    result.set(ClaimResult.held(entry.record()));
                    return entry;
                }
                result.set(ClaimResult.claimed(entry.record()));
                return new Entry(entry.record(), entry.steps(), owner, now.plus(leaseDuration));
            });
            log.debug("Claim on orchestration {} by {}: {}", orchestrationId, owner, result.get().status());
            return result.get();
        });
    }

    @Override
    public Mono<OrchestrationRecord> commit(Transition transition) {
        return Mono.fromCallable(() -> {
            String id = transition.orchestrationId();
            Entry updated = entries.compute(id, (key, entry) -> {
                if (entry == null) {
                    throw new OrchestrationStoreException("Orchestration " + id + " does not exist");
                }
                if (!transition.owner().equals(entry.leaseOwner())) {
                    throw new LeaseLostException(id, transition.owner());
                }
                if (entry.record().version() != transition.expectedVersion()) {
                    throw new StaleTransitionException(id, transition.expectedVersion());
                }
                List<StepRecord> steps = entry.steps();
                if (transition.stepRecord() != null) {
                    steps = new ArrayList<>(steps);
                    steps.add(transition.stepRecord());
                    steps = List.copyOf(steps);
                }
                OrchestrationRecord next = transition.next().withVersion(transition.expectedVersion() + 1);
                return new Entry(next, steps, entry.leaseOwner(),
                        clock.instant().plus(transition.leaseExtension()));
            });
            log.debug("Committed orchestration {} at version {} in state {}", id,
                    updated.record().version(), updated.record().state());
            return updated.record();
        });
    }

    @Override
    public Mono<Void> release(String orchestrationId, String owner) {
        return Mono.fromRunnable(() -> entries.computeIfPresent(orchestrationId, (id, entry) ->
                owner.equals(entry.leaseOwner()) ? new Entry(entry.record(), entry.steps(), null, null) : entry));
    }

    @Override
    public Flux<StepRecord> findStepRecords(String orchestrationId) {
        return Mono.justOrEmpty(entries.get(orchestrationId))
                .flatMapIterable(Entry::steps);
    }

    @Override
    public Flux<OrchestrationRecord> findByState(OrchestrationState state) {
        return Flux.defer(() -> Flux.fromIterable(entries.values()))
                .map(Entry::record)
                .filter(record -> record.state() == state);
    }

    @Override
    public Flux<OrchestrationRecord> findStale(Instant updatedBefore) {
        return Flux.defer(() -> Flux.fromIterable(entries.values()))
                .map(Entry::record)
                .filter(record -> !record.isTerminal() && record.updatedAt().isBefore(updatedBefore))
                .sort(Comparator.comparing(OrchestrationRecord::updatedAt))
                .doOnSubscribe(subscription ->
                        log.debug("Scanning {} in-memory orchestrations for updates before {}", entries.size(), updatedBefore));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    @Override
    public StoreType getStoreType() {
        return StoreType.IN_MEMORY;
    }

    /**
     * Number of orchestrations currently held. Useful for tests and diagnostics.
     */
    public int size() {
        return entries.size();
    }

    private record Entry(OrchestrationRecord record, List<StepRecord> steps, String leaseOwner, Instant leaseUntil) {
    }
}
