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

import java.util.UUID;

/**
 * Local disk footprint of one engine, as reported by {@link AbstractBackend#engineFileSizes()}.
 */
public class EngineFileSize {

    private final UUID uuid;
    private final long size;
    private final boolean importing;

    public EngineFileSize(UUID uuid, long size, boolean importing) {
        this.uuid = uuid;
        this.size = size;
        this.importing = importing;
    }

    public UUID getUuid() {
        return uuid;
    }

    public long getSize() {
        return size;
    }

    public boolean isImporting() {
        return importing;
    }

    @Override
    public String toString() {
        return "EngineFileSize{" +
                "uuid=" + uuid +
                ", size=" + size +
                ", importing=" + importing +
                '}';
    }
}
