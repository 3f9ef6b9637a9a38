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

import com.stratadb.alter.ActionType;
import com.stratadb.alter.AlterCancelException;
import com.stratadb.alter.AlterJob;
import com.stratadb.alter.AlterJobArgs.AddColumnArgs;
import com.stratadb.alter.AlterJobArgs.DropColumnArgs;
import com.stratadb.alter.JobState;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;

public class AddColumnHandler extends BaseActionHandler {

    public AddColumnHandler() {
        super(ActionType.ADD_COLUMN, SchemaState.NONE, SchemaState.DELETE_ONLY, SchemaState.WRITE_ONLY,
                SchemaState.WRITE_REORGANIZATION, SchemaState.PUBLIC);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        AddColumnArgs args = job.getArgs(AddColumnArgs.class);
        String name = args.getColumn().getName();
        if (job.getSchemaState() == SchemaState.NONE) {
            if (table.findColumn(name) != null) {
                throw new AlterCancelException(ErrorCode.ERR_DUP_FIELDNAME, name);
            }
            if (args.getAfterColumn() != null && table.findColumn(args.getAfterColumn()) == null) {
                throw new AlterCancelException(ErrorCode.ERR_BAD_FIELD_ERROR, args.getAfterColumn(), table.getName());
            }
            ColumnMeta column = args.getColumn();
            column.setState(SchemaState.DELETE_ONLY);
            table.addColumn(column, args.getAfterColumn());
            job.setSchemaState(SchemaState.DELETE_ONLY);
            return StepResult.advance();
        }

        ColumnMeta column = table.findColumn(name);
        if (column == null) {
            throw new AlterCancelException(ErrorCode.ERR_BAD_FIELD_ERROR, name, table.getName());
        }
        switch (column.getState()) {
            case DELETE_ONLY:
                column.setState(SchemaState.WRITE_ONLY);
                job.setSchemaState(SchemaState.WRITE_ONLY);
                return StepResult.advance();
            case WRITE_ONLY:
                column.setState(SchemaState.WRITE_REORGANIZATION);
                job.setSchemaState(SchemaState.WRITE_REORGANIZATION);
                return StepResult.advance();
            case WRITE_REORGANIZATION:
                if (stopAtPointOfNoReturn(job)) {
                    return StepResult.persist();
                }
                column.setState(SchemaState.PUBLIC);
                return finish(job, SchemaState.PUBLIC);
            default:
                throw invalidState("column", column.getState());
        }
    }

    /**
     * The rollback converter rewrote the job into a drop of the column, regressed to DELETE_ONLY.
     */
    @Override
    public StepResult rollbackStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        DropColumnArgs args = job.getArgs(DropColumnArgs.class);
        ColumnMeta column = table.findColumn(args.getColumnName());
        if (column == null) {
            return finishRollback(job);
        }
        return DropColumnHandler.stepDrop(ctx, table, column, args.getIndexNames(), JobState.ROLLBACK_DONE);
    }
}
