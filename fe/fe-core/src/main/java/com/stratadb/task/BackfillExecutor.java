// Copyright 2021-present StarRocks, Inc. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     https://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.stratadb.task;

import java.util.function.BooleanSupplier;

/**
 * The storage side of a reorg task. Implementations must be idempotent: the same task may be executed again from
 * the start after an owner change, with the same snapshot version.
 */
public interface BackfillExecutor {

    /**
     * @param stopped polled by the executor, true once the task was stopped
     * @return the number of rows processed
     */
    long execute(ReorgTask task, BooleanSupplier stopped) throws ReorgException;

    void cleanup(ReorgTask task) throws ReorgException;
}
