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

package com.palantir.genai.tracing.query;

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.palantir.logsafe.SafeArg;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/** Parameters of a trace search. See {@link FilterExpression#parse} and {@link OrderBy#parse} for the syntax. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class TraceSearchRequest {
    public static final int DEFAULT_MAX_RESULTS = 100;
    public static final int MAX_RESULTS_LIMIT = 50_000;

    public abstract Optional<String> filter();

    @Value.Default
    public int maxResults() {
        return DEFAULT_MAX_RESULTS;
    }

    public abstract List<String> orderBy();

    /** Token from a previous {@link TracePage}, resuming the search after that page. */
    public abstract Optional<String> pageToken();

    @Value.Check
    protected void check() {
        checkArgument(
                maxResults() > 0 && maxResults() <= MAX_RESULTS_LIMIT,
                "maxResults out of range",
                SafeArg.of("maxResults", maxResults()),
                SafeArg.of("limit", MAX_RESULTS_LIMIT));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableTraceSearchRequest.Builder {}
}
