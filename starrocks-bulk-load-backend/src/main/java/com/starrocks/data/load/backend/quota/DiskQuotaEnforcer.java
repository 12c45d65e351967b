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

package com.starrocks.data.load.backend.quota;

import com.starrocks.data.load.backend.Backend;
import com.starrocks.data.load.backend.DiskQuotaCheckResult;
import com.starrocks.data.load.backend.LoadContext;
import com.starrocks.data.load.backend.exception.LoadCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps the local size of the engines of a {@link Backend} under a quota by importing the
 * largest engines early.
 *
 * <p>Writers hold {@link #acquireWriteLock()} while writing rows. Once the quota is exceeded
 * all writers are blocked until the large engines have been flushed, imported and reset.
 * A writer that wants a check while holding that lock uses {@link #triggerCheck()}, which
 * runs the round on the enforcer thread.
 */
public class DiskQuotaEnforcer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(DiskQuotaEnforcer.class);

    static final int STATE_IDLE = 0;
    static final int STATE_CHECKING = 1;
    static final int STATE_IMPORTING = 2;

    private final Backend backend;
    private final long quota;
    private final long checkIntervalMs;
    private final LoadContext ctx;

    private final AtomicInteger state = new AtomicInteger(STATE_IDLE);
    private final ReentrantReadWriteLock diskQuotaLock = new ReentrantReadWriteLock();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ScheduledExecutorService executorService;

    public DiskQuotaEnforcer(Backend backend, LoadContext ctx) {
        this(backend, backend.getProperties().getDiskQuotaBytes(),
                backend.getProperties().getCheckDiskQuotaIntervalMs(), ctx);
    }

    public DiskQuotaEnforcer(Backend backend, long quota, long checkIntervalMs, LoadContext ctx) {
        this.backend = backend;
        this.quota = quota;
        this.checkIntervalMs = checkIntervalMs;
        this.ctx = ctx;
    }

    public void start() {
        if (started.compareAndSet(false, true)) {
            executorService = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "disk-quota-enforcer");
                thread.setDaemon(true);
                return thread;
            });
            executorService.scheduleWithFixedDelay(this::checkQuietly, checkIntervalMs, checkIntervalMs,
                    TimeUnit.MILLISECONDS);
            LOG.info("Disk quota enforcer started, quota: {}, checkIntervalMs: {}", quota, checkIntervalMs);
        }
    }

    @Override
    public void close() {
        if (started.compareAndSet(true, false)) {
            executorService.shutdownNow();
            LOG.info("Disk quota enforcer closed");
        }
    }

    /**
     * Lock to hold while writing rows into engines, blocks while large engines are imported.
     */
    public Lock acquireWriteLock() {
        Lock lock = diskQuotaLock.readLock();
        lock.lock();
        return lock;
    }

    /**
     * Schedules one round of disk quota enforcement on the enforcer thread right away.
     *
     * @return {@code false} if the enforcer is not started
     */
    public boolean triggerCheck() {
        ScheduledExecutorService executor = executorService;
        if (!started.get() || executor == null) {
            return false;
        }
        try {
            executor.execute(this::checkQuietly);
            return true;
        } catch (RejectedExecutionException e) {
            LOG.warn("Disk quota enforcer closed, skip triggered check");
            return false;
        }
    }

    /**
     * Runs one round of disk quota enforcement on the calling thread. Returns immediately if
     * another round is already running.
     *
     * @return {@code false} if the round was skipped
     * @throws IllegalStateException if the calling thread holds {@link #acquireWriteLock()},
     *         use {@link #triggerCheck()} from writers instead
     */
    public boolean checkOnce() {
        // the read lock of a writer cannot be upgraded, the round would wait for itself
        if (diskQuotaLock.getReadHoldCount() > 0) {
            throw new IllegalStateException("cannot check disk quota on a thread holding the write lock " +
                    "of this enforcer, use triggerCheck() instead");
        }
        if (!state.compareAndSet(STATE_IDLE, STATE_CHECKING)) {
            return false;
        }

        Lock locker = null;
        try {
            boolean isRetrying = false;
            while (true) {
                // nothing new to import yet, wait for a cycle
                if (isRetrying) {
                    ctx.sleep(checkIntervalMs);
                } else {
                    isRetrying = true;
                }

                DiskQuotaCheckResult result = backend.checkDiskQuota(quota);
                if (result.isQuotaRespected()) {
                    LOG.debug("disk quota respected, quota: {}, totalSize: {}", quota, result.getTotalSize());
                    return true;
                }

                if (locker == null) {
                    locker = diskQuotaLock.writeLock();
                    locker.lock();
                }

                LOG.warn("disk quota exceeded, quota: {}, totalSize: {}, largeEngines: {}, inProgressLargeEngines: {}",
                        quota, result.getTotalSize(), result.getLargeEngines().size(),
                        result.getInProgressLargeEngines());
                if (result.getLargeEngines().isEmpty()) {
                    LOG.warn("all large engines are already importing, keep blocking all writes");
                    continue;
                }

                // flush all engines so that checkpoints can be updated
                try {
                    backend.flushAll();
                } catch (RuntimeException e) {
                    LOG.error("flush engine for disk quota failed, check again later", e);
                    return true;
                }

                // a failed import keeps the data intact, it is tried again next round
                state.set(STATE_IMPORTING);
                long startNanoTime = System.nanoTime();
                int failed = 0;
                for (UUID engine : result.getLargeEngines()) {
                    try {
                        backend.unsafeImportAndReset(ctx, engine);
                    } catch (LoadCancelledException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        failed++;
                        LOG.error("import large engine for disk quota failed, engineUuid: {}", engine, e);
                    }
                }
                LOG.warn("importing large engines for disk quota finished, engines: {}, failed: {}, cost: {}ms",
                        result.getLargeEngines().size(), failed,
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanoTime));
                return true;
            }
        } finally {
            state.set(STATE_IDLE);
            if (locker != null) {
                locker.unlock();
            }
        }
    }

    int getState() {
        return state.get();
    }

    private void checkQuietly() {
        try {
            checkOnce();
        } catch (LoadCancelledException e) {
            LOG.info("Disk quota check cancelled: {}", e.getMessage());
        } catch (Throwable e) {
            LOG.error("Disk quota check failed", e);
        }
    }
}
