package me.golemcore.runtime.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Outcome of one pass over the heartbeat checklist.
 *
 * @param executed
 *            unchecked items whose action was attempted
 * @param completed
 *            items that succeeded and were checked off
 * @param failed
 *            items that failed and stay unchecked
 * @param skipped
 *            items already checked before the pass
 */
public record HeartbeatReport(int executed, int completed, int failed, int skipped) {

    public static HeartbeatReport empty() {
        return new HeartbeatReport(0, 0, 0, 0);
    }

    @Override
    public String toString() {
        return "executed=" + executed + ", completed=" + completed + ", failed=" + failed + ", skipped=" + skipped;
    }
}
