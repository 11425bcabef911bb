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

import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.fireflyframework.onboarding.util.JsonUtils.json;

/**
 * Default callback: logs the final outcome.
 */
public class LoggingCompletionCallback implements OrchestrationCompletionCallback {

    private static final Logger log = LoggerFactory.getLogger(LoggingCompletionCallback.class);

    @Override
    public void onCompleted(OrchestrationRecord record) {
        log.info(json("orchestration_event", "onboarding_completed",
                "orchestration_id", record.id(),
                "tenant_id", record.payload().tenant().tenantId(),
                "steps", String.join(",", record.context().keySet())));
    }

    @Override
    public void onRolledBack(OrchestrationRecord record, StepKind failedStep, String error) {
        log.warn(json("orchestration_event", "onboarding_rolled_back",
                "orchestration_id", record.id(),
                "tenant_id", record.payload().tenant().tenantId(),
                "failed_step", failedStep != null ? failedStep.key() : null,
                "error", error));
    }
}
