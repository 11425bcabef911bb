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

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.OrchestrationState;
import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.springframework.boot.actuate.health.AbstractReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Spring Boot Actuator health indicator for the onboarding orchestrator.
 * <p>
 * DOWN when the store is unreachable. {@code COMPENSATION_STUCK} when any orchestration has sat in a
 * compensating state longer than the stale threshold: the system is neither completed nor rolled back
 * for those tenants and an operator has to look at them.
 */
public class OrchestrationHealthIndicator extends AbstractReactiveHealthIndicator {

    public static final Status COMPENSATION_STUCK = new Status("COMPENSATION_STUCK",
            "Orchestrations are stuck while compensating");

    private static final int MAX_REPORTED_IDS = 20;

    private final OrchestrationStore store;
    private final Duration staleThreshold;
    private final Clock clock;

    public OrchestrationHealthIndicator(OrchestrationStore store, Duration staleThreshold, Clock clock) {
        super("Onboarding orchestrator health check failed");
        this.store = store;
        this.staleThreshold = staleThreshold;
        this.clock = clock;
    }

    @Override
    protected Mono<Health> doHealthCheck(Health.Builder builder) {
        return store.isHealthy().flatMap(healthy -> {
            builder.withDetail("store", store.getStoreType().name());
            if (!healthy) {
                return Mono.just(builder.down().withDetail("reason", "store unavailable").build());
            }
            Instant cutoff = clock.instant().minus(staleThreshold);
            return Flux.fromIterable(compensatingStates())
                    .flatMap(store::findByState)
                    .filter(record -> record.updatedAt().isBefore(cutoff))
                    .map(OrchestrationRecord::id)
                    .collectList()
                    .map(stuck -> {
                        if (stuck.isEmpty()) {
                            return builder.up().build();
                        }
                        return builder.status(COMPENSATION_STUCK)
                                .withDetail("stuck.count", stuck.size())
                                .withDetail("stuck.ids", stuck.subList(0, Math.min(stuck.size(), MAX_REPORTED_IDS)))
                                .build();
                    });
        });
    }

    private static List<OrchestrationState> compensatingStates() {
        return Arrays.stream(OrchestrationState.values())
                .filter(OrchestrationState::isCompensating)
                .toList();
    }
}
