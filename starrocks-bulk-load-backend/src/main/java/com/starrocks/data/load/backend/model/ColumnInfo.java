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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnInfo {

    private final ModelName name;
    private final int offset;
    private final SchemaState state;

    @JsonCreator
    public ColumnInfo(@JsonProperty("name") ModelName name,
                      @JsonProperty("offset") int offset,
                      @JsonProperty("state") SchemaState state) {
        this.name = name;
        this.offset = offset;
        this.state = state;
    }

    @JsonProperty("name")
    public ModelName getName() {
        return name;
    }

    @JsonProperty("offset")
    public int getOffset() {
        return offset;
    }

    @JsonProperty("state")
    public SchemaState getState() {
        return state;
    }

    @Override
    public String toString() {
        return "ColumnInfo{" +
                "name=" + name +
                ", offset=" + offset +
                ", state=" + state +
                '}';
    }
}
