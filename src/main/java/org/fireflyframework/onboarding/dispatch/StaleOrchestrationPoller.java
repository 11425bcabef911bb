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

import org.fireflyframework.onboarding.engine.DispatchResult;
import org.fireflyframework.onboarding.observability.OrchestrationEvents;
import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically re-dispatches orchestrations that stopped making progress, typically because the worker
 * driving them crashed. Any non-terminal record not updated within the stale threshold is picked up; the
 * engine then continues from its committed state under the usual claim discipline.
 * <p>
 * Started and stopped with the application context. {@link #pollOnce()} can also be called directly.
 */
public class StaleOrchestrationPoller implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StaleOrchestrationPoller.class);

    private final OrchestrationStore store;
    private final OnboardingDispatcher dispatcher;
    private final OrchestrationEvents events;
    private final Duration interval;
    private final Duration staleThreshold;
    private final int batchSize;
    private final int maxConcurrency;
    private final Clock clock;

    private volatile Disposable loop;

    public StaleOrchestrationPoller(OrchestrationStore store,
                                    OnboardingDispatcher dispatcher,
                                    OrchestrationEvents events,
                                    Duration interval,
                                    Duration staleThreshold,
                                    int batchSize,
                                    int maxConcurrency,
                                    Clock clock) {
        if (batchSize < 1 || maxConcurrency < 1) {
            throw new IllegalArgumentException("batchSize and maxConcurrency must be positive");
        }
        this.store = Objects.requireNonNull(store, "store");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.events = Objects.requireNonNull(events, "events");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.staleThreshold = Objects.requireNonNull(staleThreshold, "staleThreshold");
        this.batchSize = batchSize;
        this.maxConcurrency = maxConcurrency;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs one scan-and-redispatch pass.
     */
    public Mono<PollReport> pollOnce() {
        return Mono.defer(() -> {
            Instant cutoff = clock.instant().minus(staleThreshold);
            AtomicInteger failed = new AtomicInteger();
            return store.findStale(cutoff)
                    .take(batchSize)
                    .flatMap(record -> dispatcher.redispatch(record.id())
                            .onErrorResume(error -> {
                                failed.incrementAndGet();
                                log.warn("Re-dispatch of stale orchestration {} in state {} failed",
                                        record.id(), record.state(), error);
                                return Mono.empty();
                            }), maxConcurrency)
                    .collectList()
                    .map(results -> report(results, failed.get()))
                    .doOnNext(report -> events.onPollCompleted(report.found(), report.dispatched(), report.failed()));
        });
    }

    private static PollReport report(List<DispatchResult> results, int failed) {
        int terminal = 0;
        int halted = 0;
        int skipped = 0;
        for (DispatchResult result : results) {
            switch (result.outcome()) {
                case REACHED_TERMINAL -> terminal++;
                case HALTED -> halted++;
                default -> skipped++;
            }
        }
        return new PollReport(results.size() + failed, terminal, halted, skipped, failed);
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        loop = Flux.interval(interval, interval)
                .onBackpressureDrop(tick -> log.debug("Previous poll still running; skipping tick {}", tick))
                .concatMap(tick -> pollOnce().onErrorResume(error -> {
                    log.error("Stale orchestration poll failed", error);
                    return Mono.empty();
                }), 1)
                .subscribe();
        log.info("Stale orchestration poller started: interval={}, staleThreshold={}, batchSize={}, maxConcurrency={}",
                interval, staleThreshold, batchSize, maxConcurrency);
    }

    @Override
    public synchronized void stop() {
        Disposable current = loop;
        if (current != null) {
            current.dispose();
            loop = null;
            log.info("Stale orchestration poller stopped");
        }
    }

    @Override
    public boolean isRunning() {
        Disposable current = loop;
        return current != null && !current.isDisposed();
    }
}
