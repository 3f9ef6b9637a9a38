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

package com.stratadb.alter.action;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.stratadb.alter.ActionType;

import java.util.Map;

/**
 * The handler of every {@link ActionType}.
 */
public class ActionHandlers {
    private final Map<ActionType, ActionHandler> handlers = Maps.newEnumMap(ActionType.class);

    public ActionHandlers() {
        register(new CreateTableHandler());
        register(new DropTableHandler());
        register(new TruncateTableHandler());
        register(new RenameTableHandler());
        register(new AddColumnHandler());
        register(new DropColumnHandler());
        register(new ModifyColumnHandler());
        register(new AddIndexHandler(ActionType.ADD_INDEX));
        register(new AddIndexHandler(ActionType.ADD_PRIMARY_KEY));
        register(new DropIndexHandler(ActionType.DROP_INDEX));
        register(new DropIndexHandler(ActionType.DROP_PRIMARY_KEY));
        register(new RenameIndexHandler());
        register(new IndexVisibilityHandler());
        register(new AddPartitionHandler());
        register(new DropPartitionHandler());
        register(new TruncatePartitionHandler());
        register(new ReorganizePartitionHandler());
        register(new AddCheckConstraintHandler());
        register(new DropCheckConstraintHandler());
        register(new AlterCheckConstraintHandler());
        register(new RebaseAutoIdHandler());
        register(new ModifyCharsetHandler());
        register(new MultiSchemaChangeHandler(this));

        for (ActionType type : ActionType.values()) {
            Preconditions.checkState(handlers.containsKey(type), "no handler for %s", type);
        }
    }

    private void register(ActionHandler handler) {
        Preconditions.checkState(handlers.put(handler.getType(), handler) == null,
                "duplicated handler for %s", handler.getType());
    }

    public ActionHandler get(ActionType type) {
        return handlers.get(type);
    }
}
