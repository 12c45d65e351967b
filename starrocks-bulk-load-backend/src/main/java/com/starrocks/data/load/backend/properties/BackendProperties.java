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

package com.starrocks.data.load.backend.properties;

public class BackendProperties {

    public static final int DEFAULT_MAX_RETRY_TIMES = 3;
    public static final long DISABLED = -1L;

    // the importer retries internally, so do not retry many times here
    private final int maxRetryTimes;

    /**
     * Ceiling of (opened - closed) engines, {@link #DISABLED} to turn the check off.
     */
    private final long maxOpenEngines;

    // disk quota settings
    /**
     * bytes
     */
    private final long diskQuotaBytes;
    /**
     * ms
     */
    private final long checkDiskQuotaIntervalMs;

    // http client settings
    private final String statusUrl;
    /**
     * ms
     */
    private final int connectTimeoutMs;
    private final int socketTimeoutMs;

    private BackendProperties(Builder builder) {
        this.maxRetryTimes = builder.maxRetryTimes;
        this.maxOpenEngines = builder.maxOpenEngines;
        this.diskQuotaBytes = builder.diskQuotaBytes;
        this.checkDiskQuotaIntervalMs = builder.checkDiskQuotaIntervalMs;
        this.statusUrl = builder.statusUrl;
        this.connectTimeoutMs = builder.connectTimeoutMs;
        this.socketTimeoutMs = builder.socketTimeoutMs;
    }

    public int getMaxRetryTimes() {
        return maxRetryTimes;
    }

    public long getMaxOpenEngines() {
        return maxOpenEngines;
    }

    public boolean isEngineCountCheckEnabled() {
        return maxOpenEngines != DISABLED;
    }

    public long getDiskQuotaBytes() {
        return diskQuotaBytes;
    }

    public long getCheckDiskQuotaIntervalMs() {
        return checkDiskQuotaIntervalMs;
    }

    public String getStatusUrl() {
        return statusUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getSocketTimeoutMs() {
        return socketTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetryTimes = DEFAULT_MAX_RETRY_TIMES;
        private long maxOpenEngines = DISABLED;
        private long diskQuotaBytes = Long.MAX_VALUE;
        private long checkDiskQuotaIntervalMs = 60000L;
        private String statusUrl;
        private int connectTimeoutMs = 30000;
        private int socketTimeoutMs = 60000;

        public Builder maxRetryTimes(int maxRetryTimes) {
            this.maxRetryTimes = maxRetryTimes;
            return this;
        }

        public Builder maxOpenEngines(long maxOpenEngines) {
            this.maxOpenEngines = maxOpenEngines;
            return this;
        }

        public Builder diskQuotaBytes(long diskQuotaBytes) {
            this.diskQuotaBytes = diskQuotaBytes;
            return this;
        }

        public Builder checkDiskQuotaIntervalMs(long checkDiskQuotaIntervalMs) {
            this.checkDiskQuotaIntervalMs = checkDiskQuotaIntervalMs;
            return this;
        }

        public Builder statusUrl(String statusUrl) {
            this.statusUrl = statusUrl;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder socketTimeoutMs(int socketTimeoutMs) {
            this.socketTimeoutMs = socketTimeoutMs;
            return this;
        }

        public BackendProperties build() {
            if (maxRetryTimes < 1) {
                throw new IllegalArgumentException("maxRetryTimes must be at least 1, but is " + maxRetryTimes);
            }
            if (maxOpenEngines < 0 && maxOpenEngines != DISABLED) {
                throw new IllegalArgumentException("maxOpenEngines must be non-negative or -1, but is " + maxOpenEngines);
            }
            if (diskQuotaBytes < 0) {
                throw new IllegalArgumentException("diskQuotaBytes must be non-negative, but is " + diskQuotaBytes);
            }
            if (checkDiskQuotaIntervalMs <= 0) {
                throw new IllegalArgumentException("checkDiskQuotaIntervalMs must be positive, but is "
                        + checkDiskQuotaIntervalMs);
            }
            if (statusUrl != null && !statusUrl.startsWith("http://") && !statusUrl.startsWith("https://")) {
                throw new IllegalArgumentException("statusUrl must start with http:// or https://, but is " + statusUrl);
            }
            return new BackendProperties(this);
        }
    }

    @Override
    public String toString() {
        return "BackendProperties{" +
                "maxRetryTimes=" + maxRetryTimes +
                ", maxOpenEngines=" + maxOpenEngines +
                ", diskQuotaBytes=" + diskQuotaBytes +
                ", checkDiskQuotaIntervalMs=" + checkDiskQuotaIntervalMs +
                ", statusUrl='" + statusUrl + '\'' +
                ", connectTimeoutMs=" + connectTimeoutMs +
                ", socketTimeoutMs=" + socketTimeoutMs +
                '}';
    }
}
