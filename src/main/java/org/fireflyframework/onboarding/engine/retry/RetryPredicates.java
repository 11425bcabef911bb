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

package org.fireflyframework.onboarding.engine.retry;

import org.fireflyframework.onboarding.client.CollaboratorException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Stock retryability predicates.
 */
public final class RetryPredicates {

    private RetryPredicates() {
    }

    /**
     * Retries collaborator errors flagged retryable, timeouts and I/O failures. Anything else
     * (validation errors, programming errors) fails immediately.
     */
    public static final Predicate<Throwable> DEFAULT = RetryPredicates::isTransient;

    public static final Predicate<Throwable> NEVER = error -> false;

    private static boolean isTransient(Throwable error) {
        if (error instanceof CollaboratorException collaborator) {
            return collaborator.isRetryable();
        }
        return error instanceof TimeoutException || error instanceof IOException;
    }
}
