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
import com.starrocks.data.load.backend.exception.ErrorUtils;
import com.starrocks.data.load.backend.kv.Rows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * An opened engine, allowing data to be written via {@link #writeRows}.
 * Thread safe: an instance can be shared and any method executed anywhere.
 */
public class OpenedEngine extends Engine {

    private static final Logger LOG = LoggerFactory.getLogger(OpenedEngine.class);

    private static final int PHYSICAL_SHIFT_BITS = 18;

    private final String tableName;
    private final long ts;

    OpenedEngine(AbstractBackend backend, EngineMetrics metrics, int maxRetryTimes, String tag, UUID uuid,
                 String tableName, long ts) {
        super(backend, metrics, maxRetryTimes, tag, uuid);
        this.tableName = tableName;
        this.ts = ts;
    }

    /**
     * Close the opened engine to prepare it for importing. On failure the engine stays open.
     */
    public ClosedEngine close(LoadContext ctx) {
        ClosedEngine closedEngine = unsafeClose(ctx);
        metrics.incrementClosed();
        return closedEngine;
    }

    /**
     * Flush the data written so far, only meaningful for backends keeping data locally.
     */
    public void flush() {
        backend.flushEngine(uuid);
    }

    /**
     * Writes a collection of encoded rows into the engine. The rows are split into chunks of at
     * most {@link AbstractBackend#maxChunkSize()} and written one after another; a chunk
     * failing with a retryable error is written again, up to the retry limit.
     */
    public void writeRows(LoadContext ctx, List<String> columnNames, Rows rows) {
        for (Rows chunk : rows.splitIntoChunks(backend.maxChunkSize())) {
            RuntimeException lastError = null;
            boolean written = false;
            for (int i = 0; i < maxRetryTimes; i++) {
                ctx.checkCancelled();
                try {
                    backend.writeRows(ctx, uuid, tableName, columnNames, ts, chunk);
                    written = true;
                    break;
                } catch (RuntimeException e) {
                    if (!ErrorUtils.isRetryable(e)) {
                        throw e;
                    }
                    lastError = e;
                    metrics.incrementWriteRetries();
                    LOG.warn("write rows failed and will retry, engineTag: {}, engineUuid: {}, retryCnt: {}",
                            tag, uuid, i, e);
                }
            }
            if (!written) {
                throw new EngineBackendException(String.format("[%s] write rows reach max retry %d and still failed",
                        tableName, maxRetryTimes), lastError, false);
            }
        }
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * Commit timestamp of all rows written through this handle, fixed when the engine was
     * opened.
     */
    public long getTs() {
        return ts;
    }

    static long composeTs(long physicalMillis, long logical) {
        return (physicalMillis << PHYSICAL_SHIFT_BITS) + logical;
    }
}
