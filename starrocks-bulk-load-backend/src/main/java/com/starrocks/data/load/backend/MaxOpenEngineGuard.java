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

import com.starrocks.data.load.backend.exception.EngineCountExceededError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MaxOpenEngineGuard implements EngineCountGuard {

    private static final Logger LOG = LoggerFactory.getLogger(MaxOpenEngineGuard.class);

    private final long maxOpenEngines;

    public MaxOpenEngineGuard(long maxOpenEngines) {
        if (maxOpenEngines < 0) {
            throw new IllegalArgumentException("maxOpenEngines must be non-negative, but is " + maxOpenEngines);
        }
        this.maxOpenEngines = maxOpenEngines;
    }

    @Override
    public void onEngineOpened(EngineMetrics metrics) {
        long opened = metrics.getOpened();
        long closed = metrics.getClosed();
        if (opened - closed > maxOpenEngines) {
            String message = String.format("forcing failure because too many engines are open: %d - %d > %d",
                    opened, closed, maxOpenEngines);
            LOG.error(message);
            throw new EngineCountExceededError(message);
        }
    }

    public long getMaxOpenEngines() {
        return maxOpenEngines;
    }
}
