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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * An identifier as the server reports it: original spelling plus lower-cased form.
 */
public class ModelName {

    private final String original;
    private final String lower;

    @JsonCreator
    public ModelName(@JsonProperty("O") String original, @JsonProperty("L") String lower) {
        this.original = original;
        this.lower = lower != null ? lower : (original == null ? null : original.toLowerCase(Locale.ROOT));
    }

    public static ModelName of(String name) {
        return new ModelName(name, null);
    }

    @JsonProperty("O")
    public String getOriginal() {
        return original;
    }

    @JsonProperty("L")
    public String getLower() {
        return lower;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(lower, ((ModelName) o).lower);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(lower);
    }

    @Override
    public String toString() {
        return original;
    }
}
