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
import com.stratadb.alter.AlterJobArgs.DropIndexArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.IndexMeta;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.task.ReorgTask;

public class DropIndexHandler extends BaseActionHandler {

    public DropIndexHandler(ActionType type) {
        super(type, SchemaState.PUBLIC, SchemaState.WRITE_ONLY, SchemaState.DELETE_ONLY,
                SchemaState.DELETE_REORGANIZATION, SchemaState.NONE);
    }

    public static IndexMeta findTarget(TableMeta table, DropIndexArgs args) {
        return args.isPrimary() ? table.getPrimaryKey() : table.findIndex(args.getIndexName());
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        DropIndexArgs args = job.getArgs(DropIndexArgs.class);
        IndexMeta index = findTarget(table, args);
        if (index == null) {
            throw new AlterCancelException(ErrorCode.ERR_CANT_DROP_FIELD_OR_KEY, args.getIndexName());
        }
        switch (index.getState()) {
            case PUBLIC:
                if (stopAtPointOfNoReturn(job)) {
                    return StepResult.persist();
                }
                return moveTo(job, index, SchemaState.WRITE_ONLY);
            case WRITE_ONLY:
                return moveTo(job, index, SchemaState.DELETE_ONLY);
            case DELETE_ONLY:
                return moveTo(job, index, SchemaState.DELETE_REORGANIZATION);
            case DELETE_REORGANIZATION:
                table.removeIndex(index.getName());
                ctx.scheduleCleanup(ctx.newReorgTask(ReorgTask.Kind.CLEANUP_INDEX, index.getId(),
                        Lists.newArrayList(index.getName())));
                return finish(job, SchemaState.NONE);
            default:
                throw invalidState("index", index.getState());
        }
    }

    private static StepResult moveTo(AlterJob job, IndexMeta index, SchemaState state) {
        index.setState(state);
        job.setSchemaState(state);
        return StepResult.advance();
    }
}
