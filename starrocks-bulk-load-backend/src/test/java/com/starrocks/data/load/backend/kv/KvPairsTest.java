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

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class KvPairsTest {

    private static KvPair pair(int keySize, int valueSize) {
        return new KvPair(new byte[keySize], new byte[valueSize]);
    }

    @Test
    public void testSplitIntoChunks() {
        KvPairs rows = new KvPairs();
        rows.add(pair(1, 2));
        rows.add(pair(3, 4));
        rows.add(pair(5, 6));
        rows.add(pair(7, 8));
        rows.add(pair(9, 10));

        List<Rows> chunks = rows.splitIntoChunks(20);
        assertEquals(4, chunks.size());
        assertEquals(2, chunks.get(0).size());
        // 10 + 11 > 20, so the third pair starts a new chunk
        assertEquals(10, ((KvPairs) chunks.get(0)).byteSize());
        assertEquals(11, ((KvPairs) chunks.get(1)).byteSize());
        assertEquals(15, ((KvPairs) chunks.get(2)).byteSize());
        assertEquals(19, ((KvPairs) chunks.get(3)).byteSize());

        chunks = rows.splitIntoChunks(26);
        assertEquals(3, chunks.size());
        assertEquals(21, ((KvPairs) chunks.get(0)).byteSize());
        assertEquals(15, ((KvPairs) chunks.get(1)).byteSize());
        assertEquals(19, ((KvPairs) chunks.get(2)).byteSize());

        chunks = rows.splitIntoChunks(100);
        assertEquals(1, chunks.size());
        assertEquals(rows.getPairs(), ((KvPairs) chunks.get(0)).getPairs());
    }

    @Test
    public void testOversizedPairFormsItsOwnChunk() {
        KvPairs rows = new KvPairs();
        rows.add(pair(1, 1));
        rows.add(pair(50, 50));
        rows.add(pair(1, 1));

        List<Rows> chunks = rows.splitIntoChunks(10);
        assertEquals(3, chunks.size());
        assertEquals(100, ((KvPairs) chunks.get(1)).byteSize());
        for (Rows chunk : chunks) {
            assertEquals(1, chunk.size());
        }
    }

    @Test
    public void testSplitKeepsOrder() {
        KvPairs rows = new KvPairs();
        for (int i = 0; i < 20; i++) {
            rows.add(new KvPair(new byte[] {(byte) i}, new byte[i % 5]));
        }
        int next = 0;
        for (Rows chunk : rows.splitIntoChunks(7)) {
            assertTrue(((KvPairs) chunk).byteSize() <= 7);
            for (KvPair pair : ((KvPairs) chunk).getPairs()) {
                assertEquals(next++, pair.getKey()[0]);
            }
        }
        assertEquals(20, next);
    }

    @Test
    public void testEmptyAndClear() {
        KvPairs rows = new KvPairs();
        assertTrue(rows.splitIntoChunks(10).isEmpty());

        rows.add(pair(1, 1));
        Rows cleared = rows.clear();
        assertNotSame(rows, cleared);
        assertEquals(0, cleared.size());
        assertEquals(1, rows.size());
    }
}
