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

package org.fireflyframework.onboarding.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.onboarding.core.OnboardingRequest;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepRecord;
import org.fireflyframework.onboarding.dispatch.OnboardingDispatcher;
import org.fireflyframework.onboarding.dispatch.OnboardingRequestValidator;
import org.fireflyframework.onboarding.engine.SagaEngine;
import org.fireflyframework.onboarding.engine.TransitionTable;
import org.fireflyframework.onboarding.engine.compensation.CompensationRegistry;
import org.fireflyframework.onboarding.engine.retry.RetryPolicy;
import org.fireflyframework.onboarding.engine.retry.RetryPredicates;
import org.fireflyframework.onboarding.engine.step.AuthStepHandler;
import org.fireflyframework.onboarding.engine.step.DisasterRecoveryStepHandler;
import org.fireflyframework.onboarding.engine.step.ProvisioningStepHandler;
import org.fireflyframework.onboarding.engine.step.StepExecutor;
import org.fireflyframework.onboarding.engine.step.StepHandler;
import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.fireflyframework.onboarding.persistence.impl.InMemoryOrchestrationStore;
import org.fireflyframework.onboarding.persistence.serialization.JsonOrchestrationSerializer;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Wires the orchestrator against fake collaborators and an in-memory store with fast retries.
 */
public class OrchestratorHarness {

    public static final Duration LEASE = Duration.ofSeconds(30);

    public final FakeCollaborators collaborators = new FakeCollaborators();
    public final TickingClock clock = new TickingClock(Instant.parse("2026-01-05T09:00:00Z"));
    public final RecordingEvents events = new RecordingEvents();
    public final RecordingCallback callback = new RecordingCallback();
    public final OrchestrationStore store;
    public final List<StepHandler> handlers;
    public final CompensationRegistry compensations;
    public final StepExecutor executor;
    public final SagaEngine engine;
    public final OnboardingDispatcher dispatcher;

    private final AtomicInteger ids = new AtomicInteger();

    public OrchestratorHarness() {
        this(InMemoryOrchestrationStore::new);
    }

    /**
     * @param storeFactory builds the store from the harness clock
     */
    public OrchestratorHarness(Function<Clock, OrchestrationStore> storeFactory) {
        this.store = storeFactory.apply(clock);
        ObjectMapper mapper = JsonOrchestrationSerializer.createDefaultObjectMapper();
        this.handlers = List.of(
                new AuthStepHandler(collaborators.identity(), mapper),
                new ProvisioningStepHandler(collaborators.provisioning(), mapper),
                new DisasterRecoveryStepHandler(collaborators.disasterRecovery(), mapper));
        this.compensations = new CompensationRegistry(handlers);
        this.executor = new StepExecutor(handlers, compensations, fastRetry(3),
                Duration.ofSeconds(1), Duration.ofSeconds(5), events);
        this.engine = engine("worker-a");
        this.dispatcher = new OnboardingDispatcher(this.store, engine, new OnboardingRequestValidator(), callback,
                events, clock, () -> "orch-" + ids.incrementAndGet(), Schedulers.immediate());
    }

    public static RetryPolicy fastRetry(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(1), Duration.ofMillis(5), 2.0d, 0.0d, RetryPredicates.DEFAULT);
    }

    /**
     * Another engine instance sharing this harness's store and collaborators.
     */
    public SagaEngine engine(String workerId) {
        return new SagaEngine(store, executor, TransitionTable.standard(), events, workerId, LEASE, clock);
    }

    /**
     * Stores a fresh PENDING record without dispatching it.
     */
    public OrchestrationRecord createPending(String id, OnboardingRequest request) {
        return store.createIfAbsent(OrchestrationRecord.pending(id, request, clock.instant())).block().record();
    }

    public OrchestrationRecord record(String id) {
        return store.findById(id).block();
    }

    public List<StepRecord> steps(String id) {
        return store.findStepRecords(id).collectList().block();
    }
}
