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

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Arg;
import com.palantir.logsafe.SafeLoggable;
import com.palantir.logsafe.exceptions.SafeExceptions;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Failure of a {@link TraceSink} to accept a trace. Sinks may throw it (or any other runtime exception) from
 * {@link TraceSink#write}; the dispatcher retries, then logs it. It never reaches the traced application.
 */
public final class SinkWriteException extends RuntimeException implements SafeLoggable {
    private static final long serialVersionUID = 1L;

    private final String logMessage;
    private final List<Arg<?>> arguments;

    public SinkWriteException(String message, Arg<?>... arguments) {
        this(message, null, arguments);
    }

    public SinkWriteException(String message, @Nullable Throwable cause, Arg<?>... arguments) {
        super(SafeExceptions.renderMessage(message, arguments), cause);
        this.logMessage = message;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public String getLogMessage() {
        return logMessage;
    }

    @Override
    public List<Arg<?>> getArgs() {
        return arguments;
    }
}
