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

package org.fireflyframework.onboarding.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.onboarding.client.DisasterRecoveryClient;
import org.fireflyframework.onboarding.client.IdentityFederationClient;
import org.fireflyframework.onboarding.client.ProvisioningClient;
import org.fireflyframework.onboarding.dispatch.LoggingCompletionCallback;
import org.fireflyframework.onboarding.dispatch.OnboardingDispatcher;
import org.fireflyframework.onboarding.dispatch.OnboardingRequestValidator;
import org.fireflyframework.onboarding.dispatch.OrchestrationCompletionCallback;
import org.fireflyframework.onboarding.dispatch.StaleOrchestrationPoller;
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
import org.fireflyframework.onboarding.observability.CompositeOrchestrationEvents;
import org.fireflyframework.onboarding.observability.MicrometerOrchestrationEvents;
import org.fireflyframework.onboarding.observability.OrchestrationEvents;
import org.fireflyframework.onboarding.observability.OrchestrationHealthIndicator;
import org.fireflyframework.onboarding.observability.OrchestrationLoggerEvents;
import org.fireflyframework.onboarding.persistence.OrchestrationStore;
import org.fireflyframework.onboarding.persistence.impl.InMemoryOrchestrationStore;
import org.fireflyframework.onboarding.persistence.serialization.JsonOrchestrationSerializer;
import org.fireflyframework.onboarding.persistence.serialization.OrchestrationSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Spring configuration that wires the onboarding orchestrator.
 * Users typically activate it via {@link org.fireflyframework.onboarding.annotations.EnableOnboardingOrchestrator}
 * and supply the three collaborator clients as beans.
 * <p>
 * Properties live under {@code firefly.onboarding.*}. Redis persistence is contributed separately by
 * {@link OnboardingRedisAutoConfiguration}.
 */
@Configuration
@EnableConfigurationProperties(OnboardingOrchestratorProperties.class)
public class OnboardingOrchestratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OnboardingOrchestratorConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock onboardingClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationSerializer orchestrationSerializer() {
        return new JsonOrchestrationSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.onboarding.persistence.enabled", havingValue = "false", matchIfMissing = true)
    public OrchestrationStore orchestrationStore(Clock clock) {
        log.info("Using in-memory orchestration store; in-flight onboardings do not survive a restart");
        return new InMemoryOrchestrationStore(clock);
    }

    @Bean
    public AuthStepHandler authStepHandler(IdentityFederationClient client) {
        return new AuthStepHandler(client, handlerObjectMapper());
    }

    @Bean
    public ProvisioningStepHandler provisioningStepHandler(ProvisioningClient client) {
        return new ProvisioningStepHandler(client, handlerObjectMapper());
    }

    @Bean
    public DisasterRecoveryStepHandler disasterRecoveryStepHandler(DisasterRecoveryClient client) {
        return new DisasterRecoveryStepHandler(client, handlerObjectMapper());
    }

    @Bean
    public CompensationRegistry compensationRegistry(List<StepHandler> handlers) {
        return new CompensationRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy onboardingRetryPolicy(OnboardingOrchestratorProperties properties) {
        OnboardingOrchestratorProperties.RetryProperties retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMaxBackoff(),
                retry.getMultiplier(), retry.getJitterFactor(), RetryPredicates.DEFAULT);
    }

    @Bean
    public StepExecutor stepExecutor(List<StepHandler> handlers,
                                     CompensationRegistry compensationRegistry,
                                     RetryPolicy retryPolicy,
                                     OrchestrationEvents events,
                                     OnboardingOrchestratorProperties properties) {
        return new StepExecutor(handlers, compensationRegistry, retryPolicy,
                properties.getStep().getCallTimeout(), properties.getStep().getDeadline(), events);
    }

    @Bean
    public SagaEngine onboardingSagaEngine(OrchestrationStore store,
                                           StepExecutor executor,
                                           OrchestrationEvents events,
                                           OnboardingOrchestratorProperties properties,
                                           Clock clock) {
        String workerId = resolveWorkerId(properties.getWorkerId());
        log.info("Onboarding saga engine worker {} using {} store, lease {}, retry {}",
                workerId, store.getStoreType(), properties.getLeaseDuration(), executor.getRetryPolicy());
        return new SagaEngine(store, executor, TransitionTable.standard(), events, workerId,
                properties.getLeaseDuration(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public OnboardingRequestValidator onboardingRequestValidator() {
        return new OnboardingRequestValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationCompletionCallback orchestrationCompletionCallback() {
        return new LoggingCompletionCallback();
    }

    @Bean
    public OnboardingDispatcher onboardingDispatcher(OrchestrationStore store,
                                                     SagaEngine engine,
                                                     OnboardingRequestValidator validator,
                                                     OrchestrationCompletionCallback callback,
                                                     OrchestrationEvents events,
                                                     Clock clock) {
        return new OnboardingDispatcher(store, engine, validator, callback, events, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.onboarding.poller.enabled", havingValue = "true", matchIfMissing = true)
    public StaleOrchestrationPoller staleOrchestrationPoller(OrchestrationStore store,
                                                             OnboardingDispatcher dispatcher,
                                                             OrchestrationEvents events,
                                                             OnboardingOrchestratorProperties properties,
                                                             Clock clock) {
        OnboardingOrchestratorProperties.PollerProperties poller = properties.getPoller();
        return new StaleOrchestrationPoller(store, dispatcher, events, poller.getInterval(),
                poller.getStaleThreshold(), poller.getBatchSize(), poller.getMaxConcurrency(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "firefly.onboarding.observability.event-logging-enabled", havingValue = "true", matchIfMissing = true)
    public OrchestrationLoggerEvents orchestrationLoggerEvents() {
        return new OrchestrationLoggerEvents();
    }

    @Bean
    @Primary
    public OrchestrationEvents orchestrationEvents(ApplicationContext applicationContext) {
        List<OrchestrationEvents> sinks = new ArrayList<>();

        // every other OrchestrationEvents bean, including application-defined ones
        Map<String, OrchestrationEvents> allEvents = applicationContext.getBeansOfType(OrchestrationEvents.class);
        for (Map.Entry<String, OrchestrationEvents> entry : allEvents.entrySet()) {
            if (!"orchestrationEvents".equals(entry.getKey())) {
                sinks.add(entry.getValue());
            }
        }
        return new CompositeOrchestrationEvents(sinks);
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnProperty(name = "firefly.onboarding.observability.metrics-enabled", havingValue = "true", matchIfMissing = true)
    static class MicrometerConfig {
        @Bean
        public MicrometerOrchestrationEvents micrometerOrchestrationEvents(io.micrometer.core.instrument.MeterRegistry registry) {
            return new MicrometerOrchestrationEvents(registry);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    static class HealthConfig {
        @Bean
        @ConditionalOnMissingBean(name = "onboardingHealthIndicator")
        public OrchestrationHealthIndicator onboardingHealthIndicator(OrchestrationStore store,
                                                                      OnboardingOrchestratorProperties properties,
                                                                      Clock clock) {
            return new OrchestrationHealthIndicator(store, properties.getPoller().getStaleThreshold(), clock);
        }
    }

    private static ObjectMapper handlerObjectMapper() {
        return JsonOrchestrationSerializer.createDefaultObjectMapper();
    }

    private static String resolveWorkerId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + suffix;
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name for worker id", e);
            return "onboarding-" + suffix;
        }
    }
}
