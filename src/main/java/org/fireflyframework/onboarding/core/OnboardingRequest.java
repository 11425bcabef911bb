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

package org.fireflyframework.onboarding.core;

/**
 * A validated onboarding request handed over by the inbound trigger (webhook receiver).
 *
 * @param tenant           identity of the tenant
 * @param provisioning     resources to provision
 * @param disasterRecovery replication to configure
 * @param idempotencyKey   optional caller-supplied key; derived from the tenant id when absent
 */
public record OnboardingRequest(TenantSpec tenant,
                                ProvisioningSpec provisioning,
                                ReplicationSpec disasterRecovery,
                                String idempotencyKey) {

    public OnboardingRequest(TenantSpec tenant, ProvisioningSpec provisioning, ReplicationSpec disasterRecovery) {
        this(tenant, provisioning, disasterRecovery, null);
    }

    /**
     * The key duplicate deliveries are detected by.
     */
    public String resolveIdempotencyKey() {
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            return idempotencyKey;
        }
        return WorkflowType.CUSTOMER_ONBOARDING.value() + ":" + tenant.tenantId();
    }
}
