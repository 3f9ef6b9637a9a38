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
import com.stratadb.alter.AlterJob;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.task.ReorgTask;

/**
 * PUBLIC -> WRITE_ONLY -> DELETE_ONLY -> NONE, the table record is removed by the last step and its data is
 * handed to the reorg pool for cleanup.
 */
public class DropTableHandler extends BaseActionHandler {

    public DropTableHandler() {
        super(ActionType.DROP_TABLE, SchemaState.PUBLIC, SchemaState.WRITE_ONLY, SchemaState.DELETE_ONLY,
                SchemaState.NONE);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        switch (table.getState()) {
            case PUBLIC:
                table.setState(SchemaState.WRITE_ONLY);
                job.setSchemaState(SchemaState.WRITE_ONLY);
                return StepResult.advance();
            case WRITE_ONLY:
                table.setState(SchemaState.DELETE_ONLY);
                job.setSchemaState(SchemaState.DELETE_ONLY);
                return StepResult.advance();
            case DELETE_ONLY:
                ctx.dropTable();
                ctx.scheduleCleanup(ctx.newReorgTask(ReorgTask.Kind.CLEANUP_TABLE, table.getId(),
                        Lists.newArrayList(table.getName())));
                return finish(job, SchemaState.NONE);
            default:
                throw invalidState("table", table.getState());
        }
    }
}
