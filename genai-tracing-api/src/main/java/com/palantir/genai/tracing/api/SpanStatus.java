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

package com.palantir.genai.tracing.api;

/** Outcome of a span, or the aggregate outcome of a trace. */
public enum SpanStatus {
    OK,

    ERROR,

    /** Only observable on spans which have not been finalized yet. */
    IN_PROGRESS;

    /** Status message recorded on spans finalized because their task was cancelled. */
    public static final String CANCELLED = "cancelled";

    /** Status message recorded on spans finalized by forced trace closure. */
    public static final String TIMEOUT = "timeout";
}
