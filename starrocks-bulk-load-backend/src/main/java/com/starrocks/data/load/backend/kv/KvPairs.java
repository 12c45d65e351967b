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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link Rows} made of raw key-value pairs, the representation used by KV based backends.
 */
public class KvPairs implements Rows {

    private final List<KvPair> pairs;

    public KvPairs() {
        this(new ArrayList<>());
    }

    public KvPairs(List<KvPair> pairs) {
        this.pairs = pairs;
    }

    public void add(KvPair pair) {
        pairs.add(pair);
    }

    public List<KvPair> getPairs() {
        return Collections.unmodifiableList(pairs);
    }

    public long byteSize() {
        long size = 0;
        for (KvPair pair : pairs) {
            size += pair.byteSize();
        }
        return size;
    }

    /**
     * A pair larger than {@code splitSize} on its own is put into a chunk by itself.
     */
    @Override
    public List<Rows> splitIntoChunks(int splitSize) {
        if (pairs.isEmpty()) {
            return Collections.emptyList();
        }

        List<Rows> chunks = new ArrayList<>();
        int start = 0;
        long cumSize = 0;
        for (int i = 0; i < pairs.size(); i++) {
            int size = pairs.get(i).byteSize();
            if (i > start && cumSize + size > splitSize) {
                chunks.add(new KvPairs(new ArrayList<>(pairs.subList(start, i))));
                start = i;
                cumSize = 0;
            }
            cumSize += size;
        }
        chunks.add(new KvPairs(new ArrayList<>(pairs.subList(start, pairs.size()))));
        return chunks;
    }

    @Override
    public Rows clear() {
        return new KvPairs();
    }

    @Override
    public int size() {
        return pairs.size();
    }

    @Override
    public String toString() {
        return "KvPairs{size=" + pairs.size() + ", bytes=" + byteSize() + '}';
    }
}
