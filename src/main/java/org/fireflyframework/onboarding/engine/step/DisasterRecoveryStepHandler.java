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
import org.fireflyframework.onboarding.client.DisasterRecoveryClient;
import org.fireflyframework.onboarding.client.ReplicationHandle;
import org.fireflyframework.onboarding.client.ResourceHandle;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepKind;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configures replication of the provisioned resources; compensation tears it down.
 * Requires the provisioning step's output in the record context.
 */
public class DisasterRecoveryStepHandler extends AbstractStepHandler {

    private final DisasterRecoveryClient client;

    public DisasterRecoveryStepHandler(DisasterRecoveryClient client, ObjectMapper objectMapper) {
        super(objectMapper);
        this.client = client;
    }

    @Override
    public StepKind kind() {
        return StepKind.DR;
    }

    @Override
    public Mono<Map<String, Object>> performForward(OrchestrationRecord record) {
        ResourceHandle resource = handleOf(record, StepKind.PROVISIONING, ResourceHandle.class);
        if (resource == null) {
            return Mono.error(new IllegalStateException(
                    "Orchestration " + record.id() + " has no provisioning output to replicate"));
        }
        String tenantId = record.payload().tenant().tenantId();
        return client.configureReplication(tenantId, resource, record.payload().disasterRecovery()).map(this::toMap);
    }

    @Override
    public Mono<Void> performCompensation(OrchestrationRecord record) {
        ReplicationHandle handle = handleOf(record, StepKind.DR, ReplicationHandle.class);
        return handle != null ? client.teardownReplication(handle) : Mono.empty();
    }

    @Override
    public Map<String, Object> describeForwardInput(OrchestrationRecord record) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("tenantId", record.payload().tenant().tenantId());
        input.put("resource", record.contextEntry(StepKind.PROVISIONING));
        input.put("spec", toMap(record.payload().disasterRecovery()));
        return input;
    }
}
