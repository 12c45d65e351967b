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

import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;

public class KvChecksumTest {

    private static KvPair pair(String key, String value) {
        return new KvPair(key.getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testCrc64Ecma() {
        assertEquals(0x995dc9bbdf1939faL, KvChecksum.crc64(0, "123456789".getBytes(StandardCharsets.UTF_8)));
        assertEquals(0L, KvChecksum.crc64(0, new byte[0]));
    }

    @Test
    public void testUpdate() {
        KvChecksum checksum = new KvChecksum();
        checksum.update(pair("key1", "value1"));
        assertEquals(0xdf66d8757271b20dL, checksum.getChecksum());
        assertEquals(1, checksum.getKvs());
        assertEquals(10, checksum.getBytes());

        checksum.update(pair("key2", "value2"));
        assertEquals(0x209b6d02f6ec5200L, checksum.getChecksum());
        assertEquals(2, checksum.getKvs());
        assertEquals(20, checksum.getBytes());
    }

    @Test
    public void testAddIsOrderIndependent() {
        KvChecksum first = new KvChecksum();
        first.update(pair("key2", "value2"));
        KvChecksum second = new KvChecksum();
        second.update(pair("key1", "value1"));
        first.add(second);

        assertEquals(new KvChecksum(0x209b6d02f6ec5200L, 2, 20), first);
    }
}
