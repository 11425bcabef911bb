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

package org.fireflyframework.onboarding.engine.step;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.onboarding.client.ProvisioningClient;
import org.fireflyframework.onboarding.client.ResourceHandle;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepKind;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provisions the tenant's cloud resources; compensation deprovisions them.
 */
public class ProvisioningStepHandler extends AbstractStepHandler {

    private final ProvisioningClient client;

    public ProvisioningStepHandler(ProvisioningClient client, ObjectMapper objectMapper) {
        super(objectMapper);
        this.client = client;
    }

    @Override
    public StepKind kind() {
        return StepKind.PROVISIONING;
    }

    @Override
    public Mono<Map<String, Object>> performForward(OrchestrationRecord record) {
        String tenantId = record.payload().tenant().tenantId();
        return client.provision(tenantId, record.payload().provisioning()).map(this::toMap);
    }

    @Override
    public Mono<Void> performCompensation(OrchestrationRecord record) {
        ResourceHandle handle = handleOf(record, StepKind.PROVISIONING, ResourceHandle.class);
        return handle != null ? client.deprovision(handle) : Mono.empty();
    }

    @Override
    public Map<String, Object> describeForwardInput(OrchestrationRecord record) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("tenantId", record.payload().tenant().tenantId());
        input.put("spec", toMap(record.payload().provisioning()));
        return input;
    }
}
