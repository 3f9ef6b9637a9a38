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

package com.stratadb.alter;

import com.google.common.collect.ImmutableMap;
import com.stratadb.common.DdlException;
import com.stratadb.common.ErrorCode;

import java.util.Map;

/**
 * The named callbacks a node can be configured with through ddl_callback_hook.
 */
public class AlterJobCallbackRegistry {
    private final Map<String, AlterJobCallback> callbacks;

    public AlterJobCallbackRegistry() {
        this(new DefaultAlterJobCallback(), new ColumnTypeChangeCallback());
    }

    public AlterJobCallbackRegistry(AlterJobCallback... callbacks) {
        ImmutableMap.Builder<String, AlterJobCallback> builder = ImmutableMap.builder();
        for (AlterJobCallback callback : callbacks) {
            builder.put(callback.getName(), callback);
        }
        this.callbacks = builder.build();
    }

    public AlterJobCallback get(String name) throws DdlException {
        AlterJobCallback callback = callbacks.get(name);
        if (callback == null) {
            throw new DdlException(ErrorCode.ERR_DDL_HOOK_NOT_FOUND, name);
        }
        return callback;
    }
}
