/*
 * Copyright 2021-present StarRocks, Inc. All rights reserved.
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.starrocks.data.load.backend.exception;

/**
 * Failure reported by a backend or by the engine lifecycle layer.
 *
 * <p>A backend that knows whether its failure is transient marks it with {@code retryable}.
 * When the flag is left unset, {@link ErrorUtils#isRetryable(Throwable)} classifies the
 * exception by its cause.
 */
public class EngineBackendException extends RuntimeException {

    private final Boolean retryable;

    public EngineBackendException(String message) {
        super(message);
        this.retryable = null;
    }

    public EngineBackendException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = null;
    }

    public EngineBackendException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public EngineBackendException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * @return the backend's own classification, or {@code null} if the backend did not decide
     */
    public Boolean getRetryable() {
        return retryable;
    }
}
