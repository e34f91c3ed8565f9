/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.sessionstore.core.errors;

import lombok.Getter;
import lombok.NonNull;

import java.util.Objects;

/**
 * Failure raised by a session store. Carries the {@link ErrorType} so that callers can tell an unreachable backend
 * apart from a record that exists but cannot be read.
 */
@Getter
public class SessionStoreException extends RuntimeException {
    private final ErrorType errorType;

    public SessionStoreException(@NonNull ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public static SessionStoreException error(ErrorType errorType, Object... args) {
        return new SessionStoreException(errorType, String.format(errorType.getMessage(), args), null);
    }

    /**
     * Builds an error whose message is taken from the innermost cause of the throwable
     */
    public static SessionStoreException error(ErrorType errorType, @NonNull Throwable throwable) {
        var root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        final var description = Objects.requireNonNullElse(root.getMessage(), root.getClass().getSimpleName());
        return new SessionStoreException(errorType, String.format(errorType.getMessage(), description), throwable);
    }
}
