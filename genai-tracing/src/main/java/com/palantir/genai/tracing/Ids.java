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

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/** Identifier generation for traces and spans. */
final class Ids {
    private static final char[] HEX_DIGITS =
            {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'};

    // Odd multiplier, so consecutive sequence numbers map to distinct, well spread ids for the whole long range.
    private static final long SPREAD = 0x9E3779B97F4A7C15L;
    private static final AtomicLong spanSequence =
            new AtomicLong(ThreadLocalRandom.current().nextLong());

    private Ids() {}

    /** Returns a span id which is unique within this process. */
    static String nextSpanId() {
        return longToPaddedHex(spanSequence.getAndIncrement() * SPREAD);
    }

    /** Returns a random 128 bit trace id. */
    static String randomTraceId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return longToPaddedHex(random.nextLong()) + longToPaddedHex(random.nextLong());
    }

    /** Convert a long to a big-endian, zero padded hex string of 16 characters. */
    static String longToPaddedHex(long number) {
        char[] data = new char[16];
        for (int i = 15; i >= 0; i--) {
            data[i] = HEX_DIGITS[(int) (number & 0xF)];
            number >>>= 4;
        }
        return new String(data);
    }
}
