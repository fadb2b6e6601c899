/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
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

package com.palantir.genai.tracing;

/** What {@link ExportBuffer#submit} does when the buffer is at capacity. */
public enum QueueFullPolicy {
    /** Evict the oldest queued trace to make room for the new one. Never waits. */
    DROP_OLDEST,

    /** Reject the new trace. Never waits. */
    DROP_NEWEST,

    /**
     * Wait up to {@link TracingConfig#enqueueTimeout()} for room, then reject the new trace. This is the only policy
     * under which sealing a trace may delay the thread which ended its last span.
     */
    BLOCK_WITH_TIMEOUT
}
