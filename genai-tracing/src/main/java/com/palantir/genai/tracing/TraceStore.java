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

import com.palantir.genai.tracing.api.NotFoundException;
import com.palantir.genai.tracing.api.Trace;
import com.palantir.genai.tracing.api.TraceSink;
import com.palantir.genai.tracing.query.TracePage;
import com.palantir.genai.tracing.query.TraceSearchRequest;
import java.util.Map;

/**
 * A sink which retains sealed traces and makes them searchable. Span data is immutable once stored; only tags may be
 * edited afterwards.
 */
public interface TraceStore extends TraceSink {

    /** @throws NotFoundException if no trace with this id is stored */
    Trace get(String traceId);

    TracePage search(TraceSearchRequest request);

    /**
     * Merges tags into a stored trace.
     *
     * @throws NotFoundException if no trace with this id is stored
     */
    void setTags(String traceId, Map<String, String> tags);

    /** @throws NotFoundException if no trace with this id is stored */
    void deleteTag(String traceId, String key);

    int size();
}
