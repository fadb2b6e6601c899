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

/**
 * Receives sealed traces, typically to persist them or to feed a UI. Sinks are invoked from a dedicated background
 * worker per sink, never on the traced application's threads; a sink may block, and may fail by throwing a runtime
 * exception such as {@link SinkWriteException}, in which case delivery of the same trace is retried.
 */
@FunctionalInterface
public interface TraceSink {

    void write(Trace trace);
}
