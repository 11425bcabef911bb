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
import org.fireflyframework.onboarding.engine.DispatchResult;

/**
 * Answer to an onboarding trigger.
 *
 * @param record    the orchestration the trigger maps to, as last seen
 * @param duplicate true when a record already existed for the idempotency key; nothing was dispatched
 * @param dispatch  result of the dispatch started by this intake; {@code null} for duplicates, for
 *                  asynchronous intake and when the dispatch failed and was left to the poller
 */
public record IntakeResult(OrchestrationRecord record, boolean duplicate, DispatchResult dispatch) {

    public static IntakeResult duplicate(OrchestrationRecord existing) {
        return new IntakeResult(existing, true, null);
    }

    public static IntakeResult accepted(OrchestrationRecord record, DispatchResult dispatch) {
        return new IntakeResult(record, false, dispatch);
    }

    public String orchestrationId() {
        return record.id();
    }
}
