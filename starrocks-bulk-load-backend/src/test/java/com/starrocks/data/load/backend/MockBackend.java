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

import com.starrocks.data.load.backend.kv.Encoder;
import com.starrocks.data.load.backend.kv.KvPair;
import com.starrocks.data.load.backend.kv.KvPairs;
import com.starrocks.data.load.backend.kv.Rows;
import com.starrocks.data.load.backend.kv.SessionOptions;
import com.starrocks.data.load.backend.model.TableInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory backend for tests. Written chunks are kept per engine. Importing replaces the
 * target content of the engine with everything written since it was opened, so importing
 * again is idempotent while a chunk delivered twice shows up twice. Failures can be scripted
 * per operation and are consumed one per call.
 */
public class MockBackend implements AbstractBackend {

    public static class MockEngine {
        final List<KvPair> pairs = new CopyOnWriteArrayList<>();
        // imported before the last reset
        volatile List<KvPair> committed = Collections.emptyList();
        volatile boolean closed;
        volatile boolean flushed;
    }

    private final Map<UUID, MockEngine> engines = new ConcurrentHashMap<>();
    private final Map<UUID, List<KvPair>> target = new ConcurrentHashMap<>();
    private final List<Rows> writtenChunks = new CopyOnWriteArrayList<>();

    private final Queue<RuntimeException> writeFailures = new ConcurrentLinkedQueue<>();
    private final Queue<RuntimeException> importFailures = new ConcurrentLinkedQueue<>();
    private final Queue<RuntimeException> closeFailures = new ConcurrentLinkedQueue<>();
    private final Queue<RuntimeException> cleanupFailures = new ConcurrentLinkedQueue<>();

    final AtomicInteger openCalls = new AtomicInteger();
    final AtomicInteger writeCalls = new AtomicInteger();
    final AtomicInteger closeCalls = new AtomicInteger();
    final AtomicInteger importCalls = new AtomicInteger();
    final AtomicInteger cleanupCalls = new AtomicInteger();
    final AtomicInteger resetCalls = new AtomicInteger();
    final AtomicInteger flushAllCalls = new AtomicInteger();

    private volatile int maxChunkSize = 1024;
    private volatile long retryImportDelayMs = 0;
    private volatile List<EngineFileSize> fileSizes = Collections.emptyList();

    public MockBackend maxChunkSize(int maxChunkSize) {
        this.maxChunkSize = maxChunkSize;
        return this;
    }

    public MockBackend retryImportDelayMs(long retryImportDelayMs) {
        this.retryImportDelayMs = retryImportDelayMs;
        return this;
    }

    public MockBackend fileSizes(List<EngineFileSize> fileSizes) {
        this.fileSizes = fileSizes;
        return this;
    }

    public MockBackend failWrite(RuntimeException e) {
        writeFailures.add(e);
        return this;
    }

    public MockBackend failImport(RuntimeException e) {
        importFailures.add(e);
        return this;
    }

    public MockBackend failClose(RuntimeException e) {
        closeFailures.add(e);
        return this;
    }

    public MockBackend failCleanup(RuntimeException e) {
        cleanupFailures.add(e);
        return this;
    }

    public MockEngine getEngine(UUID uuid) {
        return engines.get(uuid);
    }

    public List<KvPair> getImported(UUID uuid) {
        return target.getOrDefault(uuid, Collections.emptyList());
    }

    public List<Rows> getWrittenChunks() {
        return writtenChunks;
    }

    @Override
    public void close() {
    }

    @Override
    public Rows makeEmptyRows() {
        return new KvPairs();
    }

    @Override
    public long retryImportDelayMs() {
        return retryImportDelayMs;
    }

    @Override
    public int maxChunkSize() {
        return maxChunkSize;
    }

    @Override
    public boolean shouldPostProcess() {
        return true;
    }

    @Override
    public Encoder newEncoder(TableInfo table, SessionOptions options) {
        return new MockEncoder();
    }

    @Override
    public void openEngine(LoadContext ctx, UUID engineUuid) {
        ctx.checkCancelled();
        openCalls.incrementAndGet();
        engines.computeIfAbsent(engineUuid, uuid -> new MockEngine());
    }

    @Override
    public void writeRows(LoadContext ctx, UUID engineUuid, String tableName, List<String> columnNames,
                          long commitTs, Rows rows) {
        ctx.checkCancelled();
        writeCalls.incrementAndGet();
        RuntimeException failure = writeFailures.poll();
        if (failure != null) {
            throw failure;
        }
        MockEngine engine = requireEngine(engineUuid);
        if (engine.closed) {
            throw new IllegalStateException("engine " + engineUuid + " is closed");
        }
        engine.pairs.addAll(((KvPairs) rows).getPairs());
        writtenChunks.add(rows);
    }

    @Override
    public void closeEngine(LoadContext ctx, UUID engineUuid) {
        ctx.checkCancelled();
        closeCalls.incrementAndGet();
        RuntimeException failure = closeFailures.poll();
        if (failure != null) {
            throw failure;
        }
        // closing an engine which was opened by an earlier process
        engines.computeIfAbsent(engineUuid, uuid -> new MockEngine()).closed = true;
    }

    @Override
    public void importEngine(LoadContext ctx, UUID engineUuid) {
        ctx.checkCancelled();
        importCalls.incrementAndGet();
        RuntimeException failure = importFailures.poll();
        if (failure != null) {
            throw failure;
        }
        MockEngine engine = requireEngine(engineUuid);
        List<KvPair> imported = new ArrayList<>(engine.committed);
        imported.addAll(engine.pairs);
        target.put(engineUuid, imported);
    }

    @Override
    public void cleanupEngine(LoadContext ctx, UUID engineUuid) {
        cleanupCalls.incrementAndGet();
        RuntimeException failure = cleanupFailures.poll();
        if (failure != null) {
            throw failure;
        }
        engines.remove(engineUuid);
    }

    @Override
    public void checkRequirements(LoadContext ctx) {
    }

    @Override
    public List<TableInfo> fetchRemoteTableModels(LoadContext ctx, String schemaName) {
        return Collections.emptyList();
    }

    @Override
    public void flushEngine(UUID engineUuid) {
        requireEngine(engineUuid).flushed = true;
    }

    @Override
    public void flushAllEngines() {
        flushAllCalls.incrementAndGet();
        for (MockEngine engine : engines.values()) {
            engine.flushed = true;
        }
    }

    @Override
    public List<EngineFileSize> engineFileSizes() {
        return new ArrayList<>(fileSizes);
    }

    @Override
    public void resetEngine(LoadContext ctx, UUID engineUuid) {
        resetCalls.incrementAndGet();
        MockEngine engine = requireEngine(engineUuid);
        engine.committed = new ArrayList<>(target.getOrDefault(engineUuid, engine.committed));
        engine.pairs.clear();
    }

    private MockEngine requireEngine(UUID engineUuid) {
        MockEngine engine = engines.get(engineUuid);
        if (engine == null) {
            throw new IllegalStateException("engine " + engineUuid + " is not opened");
        }
        return engine;
    }
}
