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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * A closed engine, allowing ingestion into the target.
 * Thread safe: an instance can be shared and any method executed anywhere.
 */
public class ClosedEngine extends Engine {

    private static final Logger LOG = LoggerFactory.getLogger(ClosedEngine.class);

    ClosedEngine(AbstractBackend backend, EngineMetrics metrics, int maxRetryTimes, String tag, UUID uuid) {
        super(backend, metrics, maxRetryTimes, tag, uuid);
    }

    /**
     * Import the data written to the engine into the target. Retryable failures are retried
     * after {@link AbstractBackend#retryImportDelayMs()}, the sleep being cut short if
     * {@code ctx} is cancelled.
     */
    public void importEngine(LoadContext ctx) {
        RuntimeException lastError = null;
        for (int i = 0; i < maxRetryTimes; i++) {
            if (i > 0) {
                ctx.sleep(backend.retryImportDelayMs());
            }
            long startNanoTime = System.nanoTime();
            LOG.info("import start, engineTag: {}, engineUuid: {}, retryCnt: {}", tag, uuid, i);
            try {
                backend.importEngine(ctx, uuid);
                metrics.incrementImported();
                LOG.info("import completed, engineTag: {}, engineUuid: {}, retryCnt: {}, cost: {}ms",
                        tag, uuid, i, costMillis(startNanoTime));
                return;
            } catch (RuntimeException e) {
                if (!ErrorUtils.isRetryable(e)) {
                    LOG.error("import failed, engineTag: {}, engineUuid: {}, retryCnt: {}, cost: {}ms",
                            tag, uuid, i, costMillis(startNanoTime), e);
                    throw e;
                }
                lastError = e;
                metrics.incrementImportRetries();
                LOG.warn("import spuriously failed, going to retry again, engineTag: {}, engineUuid: {}, " +
                        "retryCnt: {}, error: {}", tag, uuid, i, e.getMessage());
            }
        }

        throw new EngineBackendException(String.format("[%s] import reach max retry %d and still failed",
                uuid, maxRetryTimes), lastError, false);
    }

    /**
     * Deletes the intermediate data from the target. Failures are logged as warnings and
     * rethrown, the caller decides how severe they are.
     */
    public void cleanup(LoadContext ctx) {
        long startNanoTime = System.nanoTime();
        LOG.info("cleanup start, engineTag: {}, engineUuid: {}", tag, uuid);
        try {
            backend.cleanupEngine(ctx, uuid);
        } catch (RuntimeException e) {
            LOG.warn("cleanup failed, engineTag: {}, engineUuid: {}, cost: {}ms", tag, uuid, costMillis(startNanoTime), e);
            throw e;
        }
        LOG.info("cleanup completed, engineTag: {}, engineUuid: {}, cost: {}ms", tag, uuid, costMillis(startNanoTime));
    }
}
