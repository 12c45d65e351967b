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
import org.junit.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LoadContextTest {

    @Test
    public void testSleepWithoutCancel() {
        LoadContext ctx = LoadContext.create();
        long start = System.nanoTime();
        ctx.sleep(50);
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 50);
        assertFalse(ctx.isCancelled());
    }

    @Test
    public void testCancelledBeforeSleep() {
        LoadContext ctx = LoadContext.create();
        ctx.cancel("stop");
        ctx.cancel("ignored");
        assertTrue(ctx.isCancelled());
        try {
            ctx.sleep(0);
            fail();
        } catch (LoadCancelledException e) {
            assertTrue(e.getMessage().contains("stop"));
        }
    }

    @Test
    public void testInterruptedSleep() {
        LoadContext ctx = LoadContext.create();
        Thread.currentThread().interrupt();
        try {
            ctx.sleep(TimeUnit.MINUTES.toMillis(1));
            fail();
        } catch (LoadCancelledException e) {
            assertTrue(Thread.interrupted());
        }
    }
}
