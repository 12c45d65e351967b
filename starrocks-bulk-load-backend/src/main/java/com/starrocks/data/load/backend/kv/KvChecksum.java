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

package com.starrocks.data.load.backend.kv;

/**
 * Order independent checksum over a set of key-value pairs: the XOR of the CRC-64 (ECMA-182,
 * reflected) of every {@code key ++ value}, together with the pair and byte counts. Not thread
 * safe, each producer keeps its own instance and merges with {@link #add(KvChecksum)}.
 */
public class KvChecksum {

    private static final long ECMA_POLY = 0xC96C5795D7870F42L;
    private static final long[] CRC_TABLE = new long[256];

    static {
        for (int i = 0; i < 256; i++) {
            long crc = i;
            for (int j = 0; j < 8; j++) {
                if ((crc & 1) == 1) {
                    crc = (crc >>> 1) ^ ECMA_POLY;
                } else {
                    crc >>>= 1;
                }
            }
            CRC_TABLE[i] = crc;
        }
    }

    private long checksum;
    private long kvs;
    private long bytes;

    public KvChecksum() {
    }

    public KvChecksum(long checksum, long kvs, long bytes) {
        this.checksum = checksum;
        this.kvs = kvs;
        this.bytes = bytes;
    }

    public void update(KvPair pair) {
        long sum = crc64(0, pair.getKey());
        sum = crc64(sum, pair.getValue());
        checksum ^= sum;
        kvs++;
        bytes += pair.byteSize();
    }

    public void update(Iterable<KvPair> pairs) {
        for (KvPair pair : pairs) {
            update(pair);
        }
    }

    public void add(KvChecksum other) {
        checksum ^= other.checksum;
        kvs += other.kvs;
        bytes += other.bytes;
    }

    public long getChecksum() {
        return checksum;
    }

    public long getKvs() {
        return kvs;
    }

    public long getBytes() {
        return bytes;
    }

    static long crc64(long crc, byte[] data) {
        crc = ~crc;
        for (byte b : data) {
            crc = CRC_TABLE[(int) ((crc ^ b) & 0xff)] ^ (crc >>> 8);
        }
        return ~crc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KvChecksum that = (KvChecksum) o;
        return checksum == that.checksum && kvs == that.kvs && bytes == that.bytes;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(checksum) * 31 * 31 + Long.hashCode(kvs) * 31 + Long.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "KvChecksum{" +
                "checksum=" + Long.toUnsignedString(checksum) +
                ", kvs=" + kvs +
                ", bytes=" + bytes +
                '}';
    }
}
