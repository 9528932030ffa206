/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
package org.tarik.retry.error;

import org.jetbrains.annotations.Nullable;

import java.util.OptionalInt;

/**
 * Failure of a call to a remote service, optionally carrying the HTTP-like status the service responded with.
 */
public class ServiceCallException extends RuntimeException implements StatusAware {
    private final Integer status;

    public ServiceCallException(String message) {
        this(message, null, null);
    }

    public ServiceCallException(String message, int status) {
        this(message, status, null);
    }

    public ServiceCallException(String message, @Nullable Integer status, @Nullable Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    @Override
    public OptionalInt getStatus() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }

    @Override
    public String toString() {
        return status == null ? super.toString() : "%s (status %d)".formatted(super.toString(), status);
    }
}
