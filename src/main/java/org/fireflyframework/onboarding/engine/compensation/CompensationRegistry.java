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

package org.fireflyframework.onboarding.engine.compensation;

import org.fireflyframework.onboarding.client.ResourceNotFoundException;
import org.fireflyframework.onboarding.core.OrchestrationRecord;
import org.fireflyframework.onboarding.core.StepKind;
import org.fireflyframework.onboarding.engine.step.StepHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each forward step to its inverse operation.
 * <p>
 * Inverses are idempotent: a collaborator reporting the resource as already absent counts as success,
 * because an earlier attempt may have removed it before a crash lost the bookkeeping. A step with no
 * recorded output has nothing to undo and completes immediately.
 */
public class CompensationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CompensationRegistry.class);

    private final Map<StepKind, StepHandler> inverses = new EnumMap<>(StepKind.class);

    public CompensationRegistry(Collection<? extends StepHandler> handlers) {
        for (StepHandler handler : handlers) {
            StepHandler previous = inverses.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate step handler for " + handler.kind().key()
                        + ": " + previous.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
    }

    public boolean hasInverse(StepKind step) {
        return inverses.containsKey(step);
    }

    /**
     * Runs the inverse of {@code step} for {@code record}. One invocation, no retries.
     */
    public Mono<Void> compensate(StepKind step, OrchestrationRecord record) {
        StepHandler handler = inverses.get(step);
        if (handler == null) {
            return Mono.error(new IllegalStateException("No compensation registered for step " + step.key()));
        }
        if (record.contextEntry(step) == null) {
            log.debug("Orchestration {} has no output for step {}; nothing to compensate", record.id(), step.key());
            return Mono.empty();
        }
        return Mono.defer(() -> handler.performCompensation(record))
                .onErrorResume(ResourceNotFoundException.class, notFound -> {
                    log.info("Compensation of {} for orchestration {} found the resource already gone: {}",
                            step.key(), record.id(), notFound.getMessage());
                    return Mono.empty();
                });
    }
}
