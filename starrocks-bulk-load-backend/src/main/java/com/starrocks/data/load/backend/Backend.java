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
import com.starrocks.data.load.backend.properties.BackendProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The delivery target of a load. One instance wraps one {@link AbstractBackend} for the whole
 * process and can be shared by all loading workers.
 *
 * <p>Usual workflow:
 * <ol>
 *     <li>Create a {@code Backend} for the whole process.</li>
 *     <li>For each table, split the data files into batches of roughly equal size, and for each
 *     batch:
 *     <ol>
 *         <li>open an engine with {@link #openEngine},</li>
 *         <li>deliver every chunk of data with {@link OpenedEngine#writeRows},</li>
 *         <li>when all chunks are written, obtain a {@link ClosedEngine} with
 *         {@link OpenedEngine#close},</li>
 *         <li>import the data with {@link ClosedEngine#importEngine},</li>
 *         <li>clean up with {@link ClosedEngine#cleanup}.</li>
 *     </ol></li>
 *     <li>Close the connection with {@link #close()}.</li>
 * </ol>
 */
public class Backend implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Backend.class);

    static final String IMPORT_AND_RESET_TAG = "<import-and-reset>";

    private static final Comparator<EngineFileSize> QUOTA_ORDER = Comparator
            .comparing(EngineFileSize::isImporting)
            .thenComparingLong(EngineFileSize::getSize);

    private final AbstractBackend abstractBackend;
    private final BackendProperties properties;
    private final EngineMetrics metrics;
    private final EngineCountGuard engineCountGuard;
    private final Clock clock;
    private final EngineRecovery recovery;

    private Backend(Builder builder) {
        this.abstractBackend = Objects.requireNonNull(builder.abstractBackend, "abstractBackend");
        this.properties = builder.properties != null ? builder.properties : BackendProperties.builder().build();
        this.metrics = builder.metrics != null ? builder.metrics : new EngineMetrics();
        if (builder.engineCountGuard != null) {
            this.engineCountGuard = builder.engineCountGuard;
        } else if (properties.isEngineCountCheckEnabled()) {
            this.engineCountGuard = new MaxOpenEngineGuard(properties.getMaxOpenEngines());
        } else {
            this.engineCountGuard = EngineCountGuard.NOOP;
        }
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.recovery = new Recovery();
    }

    public static Backend of(AbstractBackend abstractBackend) {
        return builder().abstractBackend(abstractBackend).build();
    }

    @Override
    public void close() {
        abstractBackend.close();
        LOG.info("Backend closed, metrics: {}", metrics);
    }

    public Rows makeEmptyRows() {
        return abstractBackend.makeEmptyRows();
    }

    public Encoder newEncoder(TableInfo table, SessionOptions options) {
        return abstractBackend.newEncoder(table, options);
    }

    public boolean shouldPostProcess() {
        return abstractBackend.shouldPostProcess();
    }

    public void checkRequirements(LoadContext ctx) {
        abstractBackend.checkRequirements(ctx);
    }

    public List<TableInfo> fetchRemoteTableModels(LoadContext ctx, String schemaName) {
        return abstractBackend.fetchRemoteTableModels(ctx, schemaName);
    }

    /**
     * Flushes every opened engine. Expensive, only call it before resolving a disk quota
     * violation.
     */
    public void flushAll() {
        abstractBackend.flushAllEngines();
    }

    /**
     * Verifies whether the total engine file size is below the given quota. If the quota is
     * exceeded, returns the engines which, once imported, bring the total size back below it.
     *
     * <p>Engines are visited smallest first, with engines already being imported placed after
     * all the others. Every engine visited after the running total exceeds the quota is over
     * the quota: it is returned in {@link DiskQuotaCheckResult#getLargeEngines()} unless it is
     * already importing, in which case it is only counted.
     */
    public DiskQuotaCheckResult checkDiskQuota(long quota) {
        List<EngineFileSize> fileSizes = abstractBackend.engineFileSizes();
        List<EngineFileSize> sizes = fileSizes == null ? new ArrayList<>() : new ArrayList<>(fileSizes);
        sizes.sort(QUOTA_ORDER);

        List<UUID> largeEngines = new ArrayList<>();
        int inProgressLargeEngines = 0;
        long totalSize = 0;
        for (EngineFileSize size : sizes) {
            totalSize += size.getSize();
            if (totalSize > quota) {
                if (size.isImporting()) {
                    inProgressLargeEngines++;
                } else {
                    largeEngines.add(size.getUuid());
                }
            }
        }
        return new DiskQuotaCheckResult(largeEngines, inProgressLargeEngines, totalSize);
    }

    /**
     * Forces the backend to import the content of an engine into the target and then resets
     * the engine to empty. The engine is not closed and remains writable. Make sure the engine
     * has been flushed before calling this method.
     */
    public void unsafeImportAndReset(LoadContext ctx, UUID engineUuid) {
        // never close the engine here, writers still append to it afterwards
        ClosedEngine closedEngine = new ClosedEngine(abstractBackend, metrics, properties.getMaxRetryTimes(),
                IMPORT_AND_RESET_TAG, engineUuid);
        closedEngine.importEngine(ctx);
        abstractBackend.resetEngine(ctx, engineUuid);
    }

    /**
     * Opens an engine with the given table name and engine id.
     */
    public OpenedEngine openEngine(LoadContext ctx, String tableName, int engineId) {
        String tag = EngineIdentity.makeTag(tableName, engineId);
        UUID engineUuid = EngineIdentity.makeUuid(tableName, engineId);

        abstractBackend.openEngine(ctx, engineUuid);
        metrics.incrementOpened();
        LOG.info("open engine, engineTag: {}, engineUuid: {}", tag, engineUuid);

        engineCountGuard.onEngineOpened(metrics);

        return new OpenedEngine(abstractBackend, metrics, properties.getMaxRetryTimes(), tag, engineUuid,
                tableName, OpenedEngine.composeTs(clock.millis(), 0));
    }

    /**
     * Operations for resuming from a checkpoint, see {@link EngineRecovery}.
     */
    public EngineRecovery recovery() {
        return recovery;
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }

    public BackendProperties getProperties() {
        return properties;
    }

    private class Recovery implements EngineRecovery {

        @Override
        public ClosedEngine unsafeCloseEngine(LoadContext ctx, String tableName, int engineId) {
            return unsafeCloseEngineWithUuid(ctx, EngineIdentity.makeTag(tableName, engineId),
                    EngineIdentity.makeUuid(tableName, engineId));
        }

        @Override
        public ClosedEngine unsafeCloseEngineWithUuid(LoadContext ctx, String tag, UUID engineUuid) {
            return new Engine(abstractBackend, metrics, properties.getMaxRetryTimes(), tag, engineUuid)
                    .unsafeClose(ctx);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AbstractBackend abstractBackend;
        private BackendProperties properties;
        private EngineMetrics metrics;
        private EngineCountGuard engineCountGuard;
        private Clock clock;

        public Builder abstractBackend(AbstractBackend abstractBackend) {
            this.abstractBackend = abstractBackend;
            return this;
        }

        public Builder properties(BackendProperties properties) {
            this.properties = properties;
            return this;
        }

        public Builder metrics(EngineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder engineCountGuard(EngineCountGuard engineCountGuard) {
            this.engineCountGuard = engineCountGuard;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Backend build() {
            return new Backend(this);
        }
    }
}
