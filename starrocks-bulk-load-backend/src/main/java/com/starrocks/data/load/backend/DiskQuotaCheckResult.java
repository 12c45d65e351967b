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

import java.util.Collections;
import java.util.List;
import java.util.UUID;

public class DiskQuotaCheckResult {

    private final List<UUID> largeEngines;
    private final int inProgressLargeEngines;
    private final long totalSize;

    public DiskQuotaCheckResult(List<UUID> largeEngines, int inProgressLargeEngines, long totalSize) {
        this.largeEngines = Collections.unmodifiableList(largeEngines);
        this.inProgressLargeEngines = inProgressLargeEngines;
        this.totalSize = totalSize;
    }

    /**
     * Engines which are not importing yet and, once imported, bring the total size back under
     * the quota. Ordered by ascending size.
     */
    public List<UUID> getLargeEngines() {
        return largeEngines;
    }

    /**
     * Number of engines beyond the quota which are already being imported.
     */
    public int getInProgressLargeEngines() {
        return inProgressLargeEngines;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public boolean isQuotaRespected() {
        return largeEngines.isEmpty() && inProgressLargeEngines == 0;
    }

    @Override
    public String toString() {
        return "DiskQuotaCheckResult{" +
                "largeEngines=" + largeEngines +
                ", inProgressLargeEngines=" + inProgressLargeEngines +
                ", totalSize=" + totalSize +
                '}';
    }
}
