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

package org.fireflyframework.onboarding.engine;

import org.fireflyframework.onboarding.core.OrchestrationRecord;

/**
 * Result of one {@link SagaEngine#dispatch} call.
 *
 * @param orchestrationId the dispatched id
 * @param outcome         what the dispatch achieved
 * @param record          the last committed record seen by the dispatch, {@code null} if not found
 */
public record DispatchResult(String orchestrationId, Outcome outcome, OrchestrationRecord record) {

    public enum Outcome {
        /** This dispatch committed the transition into COMPLETED or ROLLED_BACK. */
        REACHED_TERMINAL,
        /** Progress stopped in a non-terminal state, e.g. a compensation that keeps failing. */
        HALTED,
        /** The record was already terminal; nothing was done. */
        ALREADY_TERMINAL,
        /** Another worker holds the record. */
        CLAIM_LOST,
        /** No such orchestration. */
        NOT_FOUND
    }

    public static DispatchResult of(Outcome outcome, OrchestrationRecord record) {
        return new DispatchResult(record.id(), outcome, record);
    }

    public static DispatchResult notFound(String orchestrationId) {
        return new DispatchResult(orchestrationId, Outcome.NOT_FOUND, null);
    }

    public boolean reachedTerminal() {
        return outcome == Outcome.REACHED_TERMINAL;
    }
}
