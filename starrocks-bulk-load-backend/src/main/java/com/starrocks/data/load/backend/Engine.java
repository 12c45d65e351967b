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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * State shared by {@link OpenedEngine} and {@link ClosedEngine}.
 */
class Engine {

    private static final Logger LOG = LoggerFactory.getLogger(Engine.class);

    protected final AbstractBackend backend;
    protected final EngineMetrics metrics;
    protected final int maxRetryTimes;
    protected final String tag;
    protected final UUID uuid;

    Engine(AbstractBackend backend, EngineMetrics metrics, int maxRetryTimes, String tag, UUID uuid) {
        this.backend = backend;
        this.metrics = metrics;
        this.maxRetryTimes = maxRetryTimes;
        this.tag = tag;
        this.uuid = uuid;
    }

    ClosedEngine unsafeClose(LoadContext ctx) {
        long startNanoTime = System.nanoTime();
        LOG.info("engine close start, engineTag: {}, engineUuid: {}", tag, uuid);
        try {
            backend.closeEngine(ctx, uuid);
        } catch (RuntimeException e) {
            LOG.error("engine close failed, engineTag: {}, engineUuid: {}, cost: {}ms",
                    tag, uuid, costMillis(startNanoTime), e);
            throw e;
        }
        LOG.info("engine close completed, engineTag: {}, engineUuid: {}, cost: {}ms", tag, uuid, costMillis(startNanoTime));
        return new ClosedEngine(backend, metrics, maxRetryTimes, tag, uuid);
    }

    public String getTag() {
        return tag;
    }

    public UUID getUuid() {
        return uuid;
    }

    static long costMillis(long startNanoTime) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanoTime);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "tag='" + tag + '\'' +
                ", uuid=" + uuid +
                '}';
    }
}
