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

import com.starrocks.data.load.backend.exception.EngineBackendException;
import com.starrocks.data.load.backend.exception.LoadCancelledException;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ClosedEngineTest {

    private LoadContext ctx;
    private MockBackend mockBackend;
    private Backend backend;

    @Before
    public void setUp() {
        ctx = LoadContext.create();
        mockBackend = new MockBackend();
        backend = Backend.of(mockBackend);
    }

    private ClosedEngine openAndClose() {
        OpenedEngine engine = backend.openEngine(ctx, "tbl", 0);
        engine.writeRows(ctx, null, BackendTest.rows("k1", "v1"));
        return engine.close(ctx);
    }

    @Test
    public void testImportRetriesRetryableErrors() {
        mockBackend.retryImportDelayMs(10);
        ClosedEngine engine = openAndClose();
        mockBackend.failImport(new EngineBackendException("not leader", true));
        mockBackend.failImport(new EngineBackendException("region not found"));

        engine.importEngine(ctx);

        assertEquals(3, mockBackend.importCalls.get());
        assertEquals(1, mockBackend.getImported(engine.getUuid()).size());
        assertEquals(2, backend.getMetrics().getImportRetries());
        assertEquals(1, backend.getMetrics().getImported());
    }

    @Test
    public void testImportStopsOnNonRetryableErrorWithoutSleeping() {
        mockBackend.retryImportDelayMs(TimeUnit.MINUTES.toMillis(10));
        ClosedEngine engine = openAndClose();
        EngineBackendException error = new EngineBackendException("checksum mismatched", false);
        mockBackend.failImport(error);

        long start = System.nanoTime();
        try {
            engine.importEngine(ctx);
            fail();
        } catch (EngineBackendException e) {
            assertSame(error, e);
        }
        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 60);
        assertEquals(1, mockBackend.importCalls.get());
        assertEquals(0, backend.getMetrics().getImported());
    }

    @Test
    public void testImportReachMaxRetry() {
        ClosedEngine engine = openAndClose();
        for (int i = 0; i < 5; i++) {
            mockBackend.failImport(new EngineBackendException("server is busy", true));
        }

        try {
            engine.importEngine(ctx);
            fail();
        } catch (EngineBackendException e) {
            assertTrue(e.getMessage().startsWith("[" + engine.getUuid() + "] import reach max retry 3 and still failed"));
        }
        assertEquals(3, mockBackend.importCalls.get());
    }

    @Test
    public void testImportIsRepeatable() {
        ClosedEngine engine = openAndClose();
        engine.importEngine(ctx);
        engine.importEngine(ctx);
        assertEquals(1, mockBackend.getImported(engine.getUuid()).size());
    }

    @Test
    public void testImportCancelledWhileWaitingForRetry() {
        mockBackend.retryImportDelayMs(TimeUnit.MINUTES.toMillis(10));
        ClosedEngine engine = openAndClose();
        mockBackend.failImport(new EngineBackendException("server is busy", true));

        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            executor.schedule(() -> ctx.cancel("user abort"), 200, TimeUnit.MILLISECONDS);
            long start = System.nanoTime();
            try {
                engine.importEngine(ctx);
                fail();
            } catch (LoadCancelledException e) {
                assertTrue(e.getMessage().contains("user abort"));
            }
            assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 60);
            assertEquals(1, mockBackend.importCalls.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testCleanup() {
        ClosedEngine engine = openAndClose();
        engine.importEngine(ctx);
        engine.cleanup(ctx);
        assertEquals(null, mockBackend.getEngine(engine.getUuid()));
        assertEquals(1, mockBackend.getImported(engine.getUuid()).size());
    }

    @Test
    public void testCleanupFailureIsReturned() {
        ClosedEngine engine = openAndClose();
        mockBackend.failCleanup(new EngineBackendException("directory not empty", false));
        try {
            engine.cleanup(ctx);
            fail();
        } catch (EngineBackendException e) {
            assertEquals("directory not empty", e.getMessage());
        }
        assertEquals(1, mockBackend.cleanupCalls.get());
    }
}
