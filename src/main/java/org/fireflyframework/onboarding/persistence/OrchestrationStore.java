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
import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.core.StepRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Durable storage for orchestration records and their step history.
 * <p>
 * Key responsibilities:
 * <ul>
 *   <li>Create records exactly once per idempotency key</li>
 *   <li>Grant exclusive, expiring claims so only one worker advances a record</li>
 *   <li>Apply each transition (record + step row + index update) atomically</li>
 *   <li>Find records that stopped making progress so they can be resumed</li>
 * </ul>
 * <p>
 * Thread-safety: all implementations must be safe for concurrent use across threads and processes
 * sharing the same backing store.
 */
public interface OrchestrationStore {

    /**
     * Stores {@code record} unless a record with the same idempotency key exists.
     *
     * @param record a fresh {@code PENDING} record with version 0
     * @return the stored record; {@code created} is false when an existing record was returned
     */
    Mono<CreateResult> createIfAbsent(OrchestrationRecord record);

    /**
     * @return the committed record, or empty when unknown
     */
    Mono<OrchestrationRecord> findById(String orchestrationId);

    Mono<OrchestrationRecord> findByIdempotencyKey(String idempotencyKey);

    /**
     * Attempts to take the lease on a record. An expired lease held by another owner can be taken over;
     * the same owner may re-claim its own lease, so callers that must exclude each other pass distinct
     * owners (the engine uses one lease token per dispatch).
     *
     * @param orchestrationId the record to claim
     * @param owner the claiming worker
     * @param leaseDuration how long the lease lasts without further commits
     * @return the claim outcome together with the current committed record
     */
    Mono<ClaimResult> claim(String orchestrationId, String owner, Duration leaseDuration);

    /**
     * Applies a transition atomically. The lease counts as held while {@code owner} is still the recorded
     * owner, even past its expiry, since any takeover replaces the owner.
     *
     * @return the committed record (with its new version)
     * @throws LeaseLostException signalled when {@code owner} no longer holds the lease
     * @throws StaleTransitionException signalled when the stored version moved on
     */
    Mono<OrchestrationRecord> commit(Transition transition);

    /**
     * Releases the lease if {@code owner} holds it. Releasing a lease held by someone else is a no-op.
     */
    Mono<Void> release(String orchestrationId, String owner);

    /**
     * @return the step rows for an orchestration in insertion order
     */
    Flux<StepRecord> findStepRecords(String orchestrationId);

    Flux<OrchestrationRecord> findByState(OrchestrationState state);

    /**
     * @return non-terminal records whose last update is before {@code updatedBefore}, oldest first
     */
    Flux<OrchestrationRecord> findStale(Instant updatedBefore);

    Mono<Boolean> isHealthy();

    StoreType getStoreType();

    /**
     * Supported store implementations.
     */
    enum StoreType {
        /**
         * In-process maps. State is lost on restart.
         */
        IN_MEMORY,

        /**
         * Redis, shared between instances.
         */
        REDIS
    }
}
