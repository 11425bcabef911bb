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

/**
 * Summary of one poller pass.
 *
 * @param found           stale records picked up
 * @param reachedTerminal dispatches that finished the orchestration
 * @param halted          dispatches that stopped in a non-terminal state
 * @param skipped         records that were terminal or claimed by another worker by the time they were dispatched
 * @param failed          dispatches that errored
 */
public record PollReport(int found, int reachedTerminal, int halted, int skipped, int failed) {

    public static PollReport empty() {
        return new PollReport(0, 0, 0, 0, 0);
    }

    public int dispatched() {
        return reachedTerminal + halted;
    }
}
