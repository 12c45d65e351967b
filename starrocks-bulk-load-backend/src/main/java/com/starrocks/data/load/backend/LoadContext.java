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

package com.starrocks.data.load.backend;

import com.starrocks.data.load.backend.exception.LoadCancelledException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation token shared by the calls belonging to one load. Backends are expected to
 * poll {@link #isCancelled()} or {@link #checkCancelled()} around blocking I/O, and retry
 * sleeps go through {@link #sleep(long)} so that a cancelled load stops waiting promptly.
 */
public class LoadContext {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;

    public static LoadContext create() {
        return new LoadContext();
    }

    public void cancel(String reason) {
        if (cancelled.getCount() > 0) {
            this.reason = reason;
            cancelled.countDown();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void checkCancelled() {
        if (isCancelled()) {
            throw new LoadCancelledException("load context cancelled, reason: " + reason);
        }
    }

    /**
     * Sleeps for {@code millis} or until this context is cancelled, whichever comes first.
     *
     * @throws LoadCancelledException if the context is cancelled before or during the sleep,
     *         or the calling thread is interrupted
     */
    public void sleep(long millis) {
        checkCancelled();
        if (millis <= 0) {
            return;
        }
        try {
            if (cancelled.await(millis, TimeUnit.MILLISECONDS)) {
                checkCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadCancelledException("interrupted while waiting", e);
        }
    }
}
