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

package com.starrocks.data.load.backend.noop;

import com.starrocks.data.load.backend.AbstractBackend;
import com.starrocks.data.load.backend.EngineFileSize;
import com.starrocks.data.load.backend.LoadContext;
import com.starrocks.data.load.backend.kv.Encoder;
import com.starrocks.data.load.backend.kv.KvPairs;
import com.starrocks.data.load.backend.kv.Row;
import com.starrocks.data.load.backend.kv.Rows;
import com.starrocks.data.load.backend.kv.SessionOptions;
import com.starrocks.data.load.backend.model.TableInfo;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A backend which accepts everything and delivers nothing. Useful to measure the cost of
 * reading and encoding a dump on its own.
 */
public class NoopBackend implements AbstractBackend {

    private static final Row NOOP_ROW = (data, dataChecksum, indices, indexChecksum) -> { };

    @Override
    public void close() {
    }

    @Override
    public Rows makeEmptyRows() {
        return new KvPairs();
    }

    @Override
    public long retryImportDelayMs() {
        return 0;
    }

    @Override
    public int maxChunkSize() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean shouldPostProcess() {
        return false;
    }

    @Override
    public Encoder newEncoder(TableInfo table, SessionOptions options) {
        return new Encoder() {
            @Override
            public Row encode(List<Object> row, long rowId, int[] columnPermutation) {
                return NOOP_ROW;
            }

            @Override
            public void close() {
            }
        };
    }

    @Override
    public void openEngine(LoadContext ctx, UUID engineUuid) {
    }

    @Override
    public void writeRows(LoadContext ctx, UUID engineUuid, String tableName, List<String> columnNames,
                          long commitTs, Rows rows) {
    }

    @Override
    public void closeEngine(LoadContext ctx, UUID engineUuid) {
    }

    @Override
    public void importEngine(LoadContext ctx, UUID engineUuid) {
    }

    @Override
    public void cleanupEngine(LoadContext ctx, UUID engineUuid) {
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
    }

    @Override
    public void flushAllEngines() {
    }

    @Override
    public List<EngineFileSize> engineFileSizes() {
        return Collections.emptyList();
    }

    @Override
    public void resetEngine(LoadContext ctx, UUID engineUuid) {
    }
}
