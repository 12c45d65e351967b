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

import org.apache.http.NoHttpResponseException;

import java.io.EOFException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.List;

public class ErrorUtils {

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final List<String> RETRYABLE_MESSAGE_KEY_WORDS = Arrays.asList(
                "server is busy",
                "not leader",
                "region not found",
                "epoch not match",
                "deadline exceeded",
                "unavailable",
                "connection reset"
            );

    /**
     * Decides whether an operation that failed with {@code e} may be attempted again.
     * Cancellation and interruption are never retryable.
     */
    public static boolean isRetryable(Throwable e) {
        Throwable current = e;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof LoadCancelledException || current instanceof InterruptedException) {
                return false;
            }

            if (current instanceof EngineBackendException) {
                Boolean retryable = ((EngineBackendException) current).getRetryable();
                if (retryable != null) {
                    return retryable;
                }
            } else if (current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof NoHttpResponseException
                    || current instanceof EOFException) {
                return true;
            } else if (current instanceof InterruptedIOException) {
                return false;
            }

            if (containsRetryableKeyword(current.getMessage())) {
                return true;
            }

            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    public static EngineBackendException annotate(Throwable e, String message) {
        return new EngineBackendException(message + ": " + e.getMessage(), e, false);
    }

    private static boolean containsRetryableKeyword(String message) {
        if (message == null) {
            return false;
        }
        String lowerMessage = message.toLowerCase();
        for (String keyword : RETRYABLE_MESSAGE_KEY_WORDS) {
            if (lowerMessage.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
