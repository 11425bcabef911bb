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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks an onboarding request before a record is created for it. All violations are collected
 * and reported together.
 */
public class OnboardingRequestValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern TENANT_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,127}$");

    public void validate(OnboardingRequest request) {
        List<String> violations = new ArrayList<>();
        if (request == null) {
            throw new OnboardingValidationException(List.of("request is required"));
        }
        validateTenant(request.tenant(), violations);
        validateProvisioning(request.provisioning(), violations);
        validateReplication(request.disasterRecovery(), request.provisioning(), violations);
        if (!violations.isEmpty()) {
            throw new OnboardingValidationException(violations);
        }
    }

    private void validateTenant(TenantSpec tenant, List<String> violations) {
        if (tenant == null) {
            violations.add("tenant is required");
            return;
        }
        if (isBlank(tenant.tenantId())) {
            violations.add("tenant.tenantId is required");
        } else if (!TENANT_ID.matcher(tenant.tenantId()).matches()) {
            violations.add("tenant.tenantId must be alphanumeric with '.', '_' or '-' (max 128 characters)");
        }
        if (isBlank(tenant.displayName())) {
            violations.add("tenant.displayName is required");
        }
        if (isBlank(tenant.adminEmail()) || !EMAIL.matcher(tenant.adminEmail()).matches()) {
            violations.add("tenant.adminEmail must be a valid email address");
        }
    }

    private void validateProvisioning(ProvisioningSpec provisioning, List<String> violations) {
        if (provisioning == null) {
            violations.add("provisioning is required");
            return;
        }
        if (isBlank(provisioning.plan())) {
            violations.add("provisioning.plan is required");
        }
        if (isBlank(provisioning.region())) {
            violations.add("provisioning.region is required");
        }
        if (provisioning.seats() < 1) {
            violations.add("provisioning.seats must be at least 1");
        }
    }

    private void validateReplication(ReplicationSpec replication, ProvisioningSpec provisioning, List<String> violations) {
        if (replication == null) {
            violations.add("disasterRecovery is required");
            return;
        }
        if (isBlank(replication.targetRegion())) {
            violations.add("disasterRecovery.targetRegion is required");
        } else if (provisioning != null && replication.targetRegion().equals(provisioning.region())) {
            violations.add("disasterRecovery.targetRegion must differ from provisioning.region");
        }
        if (replication.recoveryPointObjectiveMinutes() < 1) {
            violations.add("disasterRecovery.recoveryPointObjectiveMinutes must be at least 1");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
