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

import org.fireflyframework.onboarding.client.DisasterRecoveryClient;
import org.fireflyframework.onboarding.client.IdentityFederationClient;
import org.fireflyframework.onboarding.client.ProvisioningClient;
import org.fireflyframework.onboarding.client.ReplicationHandle;
import org.fireflyframework.onboarding.client.ResourceHandle;
import org.fireflyframework.onboarding.client.TenantHandle;
import org.fireflyframework.onboarding.core.OnboardingRequest;
import org.fireflyframework.onboarding.core.ProvisioningSpec;
import org.fireflyframework.onboarding.core.ReplicationSpec;
import org.fireflyframework.onboarding.core.TenantSpec;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scripted in-memory collaborators. Every operation is recorded in {@link #calls} and can be told to fail
 * a number of times, fail on every call, or respond after a delay.
 */
public class FakeCollaborators {

    public static final String CREATE_TENANT = "createTenant";
    public static final String DELETE_TENANT = "deleteTenant";
    public static final String PROVISION = "provision";
    public static final String DEPROVISION = "deprovision";
    public static final String CONFIGURE_REPLICATION = "configureReplication";
    public static final String TEARDOWN_REPLICATION = "teardownReplication";

    public final List<String> calls = new CopyOnWriteArrayList<>();

    private final Map<String, Deque<Throwable>> scriptedFailures = new ConcurrentHashMap<>();
    private final Map<String, Throwable> permanentFailures = new ConcurrentHashMap<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();

    public static OnboardingRequest request(String tenantId) {
        return new OnboardingRequest(
                new TenantSpec(tenantId, "Tenant " + tenantId, "admin@" + tenantId + ".example.com", tenantId + ".example.com"),
                new ProvisioningSpec("enterprise", "eu-west-1", 25),
                new ReplicationSpec("eu-central-1", 15));
    }

    /**
     * The next {@code errors.length} calls of {@code operation} fail with these errors, in order.
     */
    public synchronized FakeCollaborators failNext(String operation, Throwable... errors) {
        scriptedFailures.computeIfAbsent(operation, op -> new ArrayDeque<>()).addAll(Arrays.asList(errors));
        return this;
    }

    public FakeCollaborators failAlways(String operation, Throwable error) {
        permanentFailures.put(operation, error);
        return this;
    }

    public FakeCollaborators delay(String operation, Duration delay) {
        delays.put(operation, delay);
        return this;
    }

    public synchronized FakeCollaborators clearFailures(String operation) {
        scriptedFailures.remove(operation);
        permanentFailures.remove(operation);
        return this;
    }

    public int invocations(String operation) {
        AtomicInteger count = invocations.get(operation);
        return count != null ? count.get() : 0;
    }

    public IdentityFederationClient identity() {
        return new IdentityFederationClient() {
            @Override
            public Mono<TenantHandle> createTenant(TenantSpec spec) {
                return invoke(CREATE_TENANT, () ->
                        new TenantHandle(spec.tenantId(), "ext-" + spec.tenantId(), "realm-" + spec.tenantId()));
            }

            @Override
            public Mono<Void> deleteTenant(TenantHandle handle) {
                return invoke(DELETE_TENANT, () -> null);
            }
        };
    }

    public ProvisioningClient provisioning() {
        return new ProvisioningClient() {
            @Override
            public Mono<ResourceHandle> provision(String tenantId, ProvisioningSpec spec) {
                return invoke(PROVISION, () -> new ResourceHandle("res-" + tenantId, spec.region()));
            }

            @Override
            public Mono<Void> deprovision(ResourceHandle handle) {
                return invoke(DEPROVISION, () -> null);
            }
        };
    }

    public DisasterRecoveryClient disasterRecovery() {
        return new DisasterRecoveryClient() {
            @Override
            public Mono<ReplicationHandle> configureReplication(String tenantId, ResourceHandle resource, ReplicationSpec spec) {
                return invoke(CONFIGURE_REPLICATION, () -> new ReplicationHandle("rep-" + resource.resourceId(), spec.targetRegion()));
            }

            @Override
            public Mono<Void> teardownReplication(ReplicationHandle handle) {
                return invoke(TEARDOWN_REPLICATION, () -> null);
            }
        };
    }

    private <T> Mono<T> invoke(String operation, Supplier<T> result) {
        Mono<T> call = Mono.defer(() -> {
            calls.add(operation);
            invocations.computeIfAbsent(operation, op -> new AtomicInteger()).incrementAndGet();
            Throwable error = nextFailure(operation);
            if (error != null) {
                return Mono.<T>error(error);
            }
            return Mono.fromSupplier(result);
        });
        Duration delay = delays.get(operation);
        return delay != null ? Mono.delay(delay).then(call) : call;
    }

    private synchronized Throwable nextFailure(String operation) {
        Throwable always = permanentFailures.get(operation);
        if (always != null) {
            return always;
        }
        Deque<Throwable> scripted = scriptedFailures.get(operation);
        return scripted != null ? scripted.poll() : null;
    }
}
