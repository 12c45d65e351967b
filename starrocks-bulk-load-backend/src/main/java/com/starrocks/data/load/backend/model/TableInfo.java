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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Table layout returned by {@code AbstractBackend#fetchRemoteTableModels}. Only the fields
 * needed to rebuild the column layout are kept.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableInfo {

    private final long id;
    private final ModelName name;
    private final SchemaState state;
    private final List<ColumnInfo> columns;
    private final boolean pkIsHandle;

    @JsonCreator
    public TableInfo(@JsonProperty("id") long id,
                     @JsonProperty("name") ModelName name,
                     @JsonProperty("state") SchemaState state,
                     @JsonProperty("cols") List<ColumnInfo> columns,
                     @JsonProperty("pk_is_handle") boolean pkIsHandle) {
        this.id = id;
        this.name = name;
        this.state = state;
        this.columns = columns == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(columns));
        this.pkIsHandle = pkIsHandle;
    }

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("name")
    public ModelName getName() {
        return name;
    }

    @JsonProperty("state")
    public SchemaState getState() {
        return state;
    }

    @JsonProperty("cols")
    public List<ColumnInfo> getColumns() {
        return columns;
    }

    /**
     * Whether the integer primary key is the row handle, in which case no hidden row id
     * column needs to be generated.
     */
    @JsonProperty("pk_is_handle")
    public boolean isPkIsHandle() {
        return pkIsHandle;
    }

    /**
     * Checks the table is public, every column is public and the column offsets are
     * {@code 0, 1, 2, ...} in order.
     *
     * @throws IllegalStateException if any of these does not hold
     */
    public void validate() {
        if (name == null || name.getOriginal() == null) {
            throw new IllegalStateException("table " + id + " has no name");
        }
        if (state != SchemaState.PUBLIC) {
            throw new IllegalStateException("table " + name + " is not public, state: " + state);
        }
        for (int i = 0; i < columns.size(); i++) {
            ColumnInfo column = columns.get(i);
            if (column.getState() != SchemaState.PUBLIC) {
                throw new IllegalStateException(String.format("column %s of table %s is not public, state: %s",
                        column.getName(), name, column.getState()));
            }
            if (column.getOffset() != i) {
                throw new IllegalStateException(String.format("column %s of table %s has offset %d, expected %d",
                        column.getName(), name, column.getOffset(), i));
            }
        }
    }

    @Override
    public String toString() {
        return "TableInfo{" +
                "id=" + id +
                ", name=" + name +
                ", state=" + state +
                ", columns=" + columns +
                ", pkIsHandle=" + pkIsHandle +
                '}';
    }
}
