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

package org.fireflyframework.onboarding.persistence;

import org.fireflyframework.onboarding.core.OrchestrationRecord;

/**
 * Result of {@link OrchestrationStore#claim}.
 *
 * @param status what happened
 * @param record the current committed record, {@code null} when not found
 */
public record ClaimResult(Status status, OrchestrationRecord record) {

    public enum Status {
        /** The caller now holds the lease. */
        CLAIMED,
        /** Another owner holds a live lease. */
        HELD,
        /** The record is terminal; nothing to claim. */
        TERMINAL,
        /** No record with that id. */
        NOT_FOUND
    }

    public static ClaimResult claimed(OrchestrationRecord record) {
        return new ClaimResult(Status.CLAIMED, record);
    }

    public static ClaimResult held(OrchestrationRecord record) {
        return new ClaimResult(Status.HELD, record);
    }

    public static ClaimResult terminal(OrchestrationRecord record) {
        return new ClaimResult(Status.TERMINAL, record);
    }

    public static ClaimResult notFound() {
        return new ClaimResult(Status.NOT_FOUND, null);
    }

    public boolean isClaimed() {
        return status == Status.CLAIMED;
    }
}
