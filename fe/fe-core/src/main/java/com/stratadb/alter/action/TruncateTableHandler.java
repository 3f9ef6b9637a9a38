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

import com.google.common.collect.Lists;
import com.stratadb.alter.ActionType;
import com.stratadb.alter.AlterCancelException;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.TableMeta;
import com.stratadb.task.ReorgTask;

public class TruncateTableHandler extends SingleStepHandler {

    public TruncateTableHandler() {
        super(ActionType.TRUNCATE_TABLE);
    }

    @Override
    protected void apply(StepContext ctx) throws AlterCancelException {
        TableMeta table = ctx.requireTable();
        ctx.scheduleCleanup(ctx.newReorgTask(ReorgTask.Kind.CLEANUP_TABLE, table.getDataGeneration(),
                Lists.newArrayList(table.getName())));
        table.increaseDataGeneration();
        table.setAutoIncrementBase(0);
    }
}
