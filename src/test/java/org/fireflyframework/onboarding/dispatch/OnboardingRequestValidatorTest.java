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

import org.fireflyframework.onboarding.core.OnboardingRequest;
import org.fireflyframework.onboarding.core.ProvisioningSpec;
import org.fireflyframework.onboarding.core.ReplicationSpec;
import org.fireflyframework.onboarding.core.TenantSpec;
import org.fireflyframework.onboarding.exception.OnboardingValidationException;
import org.fireflyframework.onboarding.support.FakeCollaborators;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class OnboardingRequestValidatorTest {

    private final OnboardingRequestValidator validator = new OnboardingRequestValidator();

    @Test
    void acceptsAWellFormedRequest() {
        assertThatCode(() -> validator.validate(FakeCollaborators.request("acme-corp_01")))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsAMissingRequest() {
        OnboardingValidationException error = catchThrowableOfType(() -> validator.validate(null),
                OnboardingValidationException.class);

        assertThat(error.getViolations()).containsExactly("request is required");
    }

    @Test
    void collectsEveryViolation() {
        OnboardingRequest request = new OnboardingRequest(
                new TenantSpec("-bad id", " ", "admin@", "acme.example.com"),
                new ProvisioningSpec(null, "eu-west-1", 0),
                new ReplicationSpec("eu-west-1", 0));

        OnboardingValidationException error = catchThrowableOfType(() -> validator.validate(request),
                OnboardingValidationException.class);

        assertThat(error.getViolations()).containsExactlyInAnyOrder(
                "tenant.tenantId must be alphanumeric with '.', '_' or '-' (max 128 characters)",
                "tenant.displayName is required",
                "tenant.adminEmail must be a valid email address",
                "provisioning.plan is required",
                "provisioning.seats must be at least 1",
                "disasterRecovery.targetRegion must differ from provisioning.region",
                "disasterRecovery.recoveryPointObjectiveMinutes must be at least 1");
    }

    @Test
    void reportsMissingSections() {
        OnboardingValidationException error = catchThrowableOfType(
                () -> validator.validate(new OnboardingRequest(null, null, null)),
                OnboardingValidationException.class);

        assertThat(error.getViolations()).containsExactly(
                "tenant is required", "provisioning is required", "disasterRecovery is required");
    }
}
