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

package org.fireflyframework.onboarding.annotations;

import org.fireflyframework.onboarding.config.OnboardingOrchestratorConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the onboarding orchestrator in a Spring application.
 * <p>
 * Imports {@link OnboardingOrchestratorConfiguration} directly so it works in both Spring Boot and plain
 * Spring contexts. Redis persistence is registered via
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports} and activates
 * automatically in Spring Boot applications.
 * <p>
 * Components wired by this annotation:
 * - {@code OnboardingDispatcher}: intake, re-dispatch and queries
 * - {@code SagaEngine}: the onboarding state machine
 * - {@code StaleOrchestrationPoller}: resumes orchestrations left behind by a crash
 * - {@code OrchestrationStore}: in-memory unless Redis persistence is enabled
 * - {@code OrchestrationEvents}: composite of logging, metrics and application listeners
 * <p>
 * The application must provide {@code IdentityFederationClient}, {@code ProvisioningClient} and
 * {@code DisasterRecoveryClient} beans.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(OnboardingOrchestratorConfiguration.class)
public @interface EnableOnboardingOrchestrator {
}
