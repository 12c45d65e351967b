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

import java.util.List;

/**
 * Encodes a row of SQL values into a backend specific {@link Row}.
 */
public interface Encoder extends AutoCloseable {

    /**
     * @param row values of one row in the order they appear in the source file
     * @param rowId row id used when the table has no integer primary key as handle
     * @param columnPermutation for each table column, the index into {@code row}, or -1
     */
    Row encode(List<Object> row, long rowId, int[] columnPermutation);

    @Override
    void close();
}
