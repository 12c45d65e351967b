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
import com.starrocks.data.load.backend.kv.Rows;
import com.starrocks.data.load.backend.kv.SessionOptions;
import com.starrocks.data.load.backend.model.TableInfo;

import java.util.List;
import java.util.UUID;

/**
 * The storage technology behind a {@link Backend}.
 *
 * <p>Implementations must be thread safe: one instance is shared by all loading workers and
 * any method may be called from any thread. Failures are reported as unchecked exceptions
 * and classified by {@link com.starrocks.data.load.backend.exception.ErrorUtils#isRetryable}.
 */
public interface AbstractBackend extends AutoCloseable {

    /**
     * Close the connection to the backend.
     */
    @Override
    void close();

    /**
     * Creates an empty collection of encoded rows.
     */
    Rows makeEmptyRows();

    /**
     * Time to sleep between two attempts to import an engine.
     */
    long retryImportDelayMs();

    /**
     * The maximum size of rows accepted by one {@link #writeRows} call, used to split the rows
     * with {@link Rows#splitIntoChunks(int)}.
     */
    int maxChunkSize();

    /**
     * Whether KV specific post-processing (checksum, analyze) should be done after import.
     */
    boolean shouldPostProcess();

    Encoder newEncoder(TableInfo table, SessionOptions options);

    void openEngine(LoadContext ctx, UUID engineUuid);

    /**
     * Writes one chunk. Each call must either accept the whole chunk or nothing of it, so
     * that a failed call can be repeated.
     */
    void writeRows(LoadContext ctx, UUID engineUuid, String tableName, List<String> columnNames,
                   long commitTs, Rows rows);

    void closeEngine(LoadContext ctx, UUID engineUuid);

    /**
     * Imports a closed engine into the target. Must give the same result when called again
     * on the same engine.
     */
    void importEngine(LoadContext ctx, UUID engineUuid);

    void cleanupEngine(LoadContext ctx, UUID engineUuid);

    /**
     * Checks whether the target satisfies the version requirements of this backend.
     */
    void checkRequirements(LoadContext ctx);

    /**
     * Obtains the models of all tables of the given schema. The result does not need to be
     * precise as long as these fields are filled in: name, state (public), id, columns (name,
     * public state, offsets 0, 1, 2, ...) and whether the primary key is the handle.
     */
    List<TableInfo> fetchRemoteTableModels(LoadContext ctx, String schemaName);

    /**
     * Ensures all KV pairs written to an open engine have been synchronized, such that killing
     * the process afterwards and resuming from checkpoint recovers the exact same content.
     * Only relevant for backends keeping data locally, a no-op for the others.
     */
    void flushEngine(UUID engineUuid);

    /**
     * Performs {@link #flushEngine} on all opened engines. This is a very expensive operation,
     * only used before resolving a disk quota violation.
     */
    void flushAllEngines();

    /**
     * Size occupied locally by every engine managed by this backend. Empty, or {@code null},
     * when all content is stored remotely.
     */
    List<EngineFileSize> engineFileSizes();

    /**
     * Clears all KV pairs written to this opened engine.
     */
    void resetEngine(LoadContext ctx, UUID engineUuid);
}
