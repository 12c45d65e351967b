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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of engines opened and closed through one {@link Backend}.
 */
public class EngineMetrics {

    private final AtomicLong numberOfOpenedEngines = new AtomicLong();
    private final AtomicLong numberOfClosedEngines = new AtomicLong();
    private final AtomicLong numberOfImportedEngines = new AtomicLong();
    private final AtomicLong numberOfWriteRetries = new AtomicLong();
    private final AtomicLong numberOfImportRetries = new AtomicLong();

    public long incrementOpened() {
        return numberOfOpenedEngines.incrementAndGet();
    }

    public long incrementClosed() {
        return numberOfClosedEngines.incrementAndGet();
    }

    public void incrementImported() {
        numberOfImportedEngines.incrementAndGet();
    }

    public void incrementWriteRetries() {
        numberOfWriteRetries.incrementAndGet();
    }

    public void incrementImportRetries() {
        numberOfImportRetries.incrementAndGet();
    }

    public long getOpened() {
        return numberOfOpenedEngines.get();
    }

    public long getClosed() {
        return numberOfClosedEngines.get();
    }

    public long getImported() {
        return numberOfImportedEngines.get();
    }

    public long getWriteRetries() {
        return numberOfWriteRetries.get();
    }

    public long getImportRetries() {
        return numberOfImportRetries.get();
    }

    @Override
    public String toString() {
        return "EngineMetrics{" +
                "numberOfOpenedEngines=" + numberOfOpenedEngines +
                ", numberOfClosedEngines=" + numberOfClosedEngines +
                ", numberOfImportedEngines=" + numberOfImportedEngines +
                ", numberOfWriteRetries=" + numberOfWriteRetries +
                ", numberOfImportRetries=" + numberOfImportRetries +
                '}';
    }
}
