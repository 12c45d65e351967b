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

package com.starrocks.data.load.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Online schema change state of a table or column, encoded as an integer on the wire. Codes
 * this client does not know are read as {@link #UNKNOWN}, which never passes
 * {@link TableInfo#validate()}.
 */
public enum SchemaState {

    NONE(0),
    DELETE_ONLY(1),
    WRITE_ONLY(2),
    WRITE_REORGANIZATION(3),
    DELETE_REORGANIZATION(4),
    PUBLIC(5),
    REPLICA_ONLY(6),
    GLOBAL_TXN_ONLY(7),
    UNKNOWN(-1);

    private final int code;

    SchemaState(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    @JsonCreator
    public static SchemaState of(int code) {
        for (SchemaState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        return UNKNOWN;
    }
}
