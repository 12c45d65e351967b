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

package com.starrocks.data.load.backend;

import java.util.UUID;

/**
 * Operations which skip the normal Open -> Write -> Close -> Import sequence. Only use them
 * when it is known by other means that the engine has already been opened, e.g. when
 * resuming from a checkpoint. Nothing checks that the engine really is open.
 */
public interface EngineRecovery {

    ClosedEngine unsafeCloseEngine(LoadContext ctx, String tableName, int engineId);

    ClosedEngine unsafeCloseEngineWithUuid(LoadContext ctx, String tag, UUID engineUuid);
}
