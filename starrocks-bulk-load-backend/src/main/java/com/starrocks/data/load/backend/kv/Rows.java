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
 * A collection of encoded rows. The concrete type is chosen by the backend through
 * {@code AbstractBackend#makeEmptyRows()}.
 */
public interface Rows {

    /**
     * Splits the rows into consecutive parts, each having a total byte size no larger than
     * {@code splitSize}. The meaning of "byte size" must be consistent with the one used by
     * {@link Row#classifyAndAppend}.
     */
    List<Rows> splitIntoChunks(int splitSize);

    /**
     * Returns a collection with empty content. It may share capacity with this instance, so the
     * typical usage is {@code rows = rows.clear()}.
     */
    Rows clear();

    int size();
}
