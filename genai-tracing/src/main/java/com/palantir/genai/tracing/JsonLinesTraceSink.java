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

import com.palantir.genai.tracing.api.Serialization;
import com.palantir.genai.tracing.api.Trace;
import com.palantir.genai.tracing.api.TraceSink;
import com.palantir.logsafe.Preconditions;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** Appends each trace as one JSON line to a file. Failed writes surface to the dispatcher, which retries them. */
public final class JsonLinesTraceSink implements TraceSink {
    private final Path file;

    public JsonLinesTraceSink(Path file) {
        this.file = Preconditions.checkNotNull(file, "file");
    }

    @Override
    public synchronized void write(Trace trace) {
        try {
            Serialization.append(file, trace);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Path file() {
        return file;
    }
}
