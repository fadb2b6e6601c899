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

import com.google.common.base.Ticker;
import com.palantir.logsafe.Preconditions;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/** Pairs a monotonic {@link Ticker} for durations with a wall {@link Clock} for timestamps. */
final class TimeSource {
    private final Ticker ticker;
    private final Clock clock;

    TimeSource(Ticker ticker, Clock clock) {
        this.ticker = Preconditions.checkNotNull(ticker, "ticker");
        this.clock = Preconditions.checkNotNull(clock, "clock");
    }

    static TimeSource system() {
        return new TimeSource(Ticker.systemTicker(), Clock.systemUTC());
    }

    long nanoTime() {
        return ticker.read();
    }

    long epochMicros() {
        Instant now = clock.instant();
        return TimeUnit.SECONDS.toMicros(now.getEpochSecond()) + TimeUnit.NANOSECONDS.toMicros(now.getNano());
    }
}
