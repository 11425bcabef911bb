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
import org.fireflyframework.onboarding.persistence.Transition;
import org.fireflyframework.onboarding.persistence.impl.InMemoryOrchestrationStore;
import org.fireflyframework.onboarding.support.FakeCollaborators;
import org.fireflyframework.onboarding.support.TickingClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OrchestrationHealthIndicatorTest {

    private TickingClock clock;
    private InMemoryOrchestrationStore store;
    private OrchestrationHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        clock = new TickingClock(Instant.parse("2026-04-01T00:00:00Z"));
        store = new InMemoryOrchestrationStore(clock);
        indicator = new OrchestrationHealthIndicator(store, Duration.ofMinutes(5), clock);
    }

    @Test
    void upWhenNothingIsStuck() {
        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("store", "IN_MEMORY");
                })
                .verifyComplete();
    }

    @Test
    void reportsCompensationThatStoppedMakingProgress() {
        OrchestrationRecord pending = OrchestrationRecord.pending("o-1", FakeCollaborators.request("acme"), clock.instant());
        store.createIfAbsent(pending).block();
        store.claim("o-1", "w", Duration.ofSeconds(30)).block();
        store.commit(new Transition("o-1", 0, "w",
                pending.withState(OrchestrationState.AUTH_COMPENSATING, clock.instant()), null, Duration.ofSeconds(30))).block();

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.UP))
                .verifyComplete();

        clock.advance(Duration.ofMinutes(10));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(OrchestrationHealthIndicator.COMPENSATION_STUCK);
                    assertThat(health.getDetails()).containsEntry("stuck.count", 1);
                    assertThat(health.getDetails()).containsEntry("stuck.ids", List.of("o-1"));
                })
                .verifyComplete();
    }

    @Test
    void downWhenTheStoreIsUnavailable() {
        OrchestrationStore broken = mock(OrchestrationStore.class);
        when(broken.isHealthy()).thenReturn(Mono.just(false));
        when(broken.getStoreType()).thenReturn(OrchestrationStore.StoreType.REDIS);

        Health health = new OrchestrationHealthIndicator(broken, Duration.ofMinutes(5), clock).health().block();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("store", "REDIS");
    }

    @Test
    void downWhenTheHealthCheckErrors() {
        OrchestrationStore broken = mock(OrchestrationStore.class);
        when(broken.isHealthy()).thenReturn(Mono.error(new IllegalStateException("connection refused")));

        Health health = new OrchestrationHealthIndicator(broken, Duration.ofMinutes(5), clock).health().block();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
