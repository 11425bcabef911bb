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
import org.fireflyframework.onboarding.client.IdentityFederationClient;
import org.fireflyframework.onboarding.client.TenantHandle;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepKind;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Creates the tenant in the identity federation backend; compensation deletes it.
 */
public class AuthStepHandler extends AbstractStepHandler {

    private final IdentityFederationClient client;

    public AuthStepHandler(IdentityFederationClient client, ObjectMapper objectMapper) {
        super(objectMapper);
        this.client = client;
    }

    @Override
    public StepKind kind() {
        return StepKind.AUTH;
    }

    @Override
    public Mono<Map<String, Object>> performForward(OrchestrationRecord record) {
        return client.createTenant(record.payload().tenant()).map(this::toMap);
    }

    @Override
    public Mono<Void> performCompensation(OrchestrationRecord record) {
        TenantHandle handle = handleOf(record, StepKind.AUTH, TenantHandle.class);
        return handle != null ? client.deleteTenant(handle) : Mono.empty();
    }

    @Override
    public Map<String, Object> describeForwardInput(OrchestrationRecord record) {
        return toMap(record.payload().tenant());
    }
}
