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
import com.stratadb.alter.AlterJobArgs.DropColumnArgs;
import com.stratadb.alter.JobState;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.IndexMeta;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.task.ReorgTask;

import java.util.List;

/**
 * PUBLIC -> WRITE_ONLY -> DELETE_ONLY -> DELETE_REORGANIZATION -> NONE.
 * Single column indexes on the column are dropped together with it, an index covering other columns as well
 * blocks the drop.
 */
public class DropColumnHandler extends BaseActionHandler {

    public DropColumnHandler() {
        super(ActionType.DROP_COLUMN, SchemaState.PUBLIC, SchemaState.WRITE_ONLY, SchemaState.DELETE_ONLY,
                SchemaState.DELETE_REORGANIZATION, SchemaState.NONE);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        DropColumnArgs args = job.getArgs(DropColumnArgs.class);
        ColumnMeta column = table.findColumn(args.getColumnName());
        if (column == null) {
            throw new AlterCancelException(ErrorCode.ERR_CANT_DROP_FIELD_OR_KEY, args.getColumnName());
        }
        if (column.getState() == SchemaState.PUBLIC) {
            checkDroppable(table, column, args);
            job.updateArgs(args);
            if (stopAtPointOfNoReturn(job)) {
                return StepResult.persist();
            }
        }
        return stepDrop(ctx, table, column, args.getIndexNames(), JobState.DONE);
    }

    private static void checkDroppable(TableMeta table, ColumnMeta column, DropColumnArgs args)
            throws AlterCancelException {
        long visibleColumns = table.getColumns().stream().filter(c -> !c.isHidden()).count();
        if (visibleColumns <= 1) {
            throw new AlterCancelException(ErrorCode.ERR_CANT_REMOVE_ALL_FIELDS);
        }
        List<String> indexNames = Lists.newArrayList();
        for (IndexMeta index : table.getIndexes()) {
            if (!index.coversColumn(column.getName())) {
                continue;
            }
            if (index.isPrimary() || index.getColumns().size() > 1) {
                throw new AlterCancelException(ErrorCode.ERR_CANT_DROP_COLUMN_WITH_INDEX, column.getName());
            }
            indexNames.add(index.getName());
        }
        args.setIndexNames(indexNames);
    }

    /**
     * Moves the column and its indexes one state down, removing them after DELETE_REORGANIZATION.
     * Also drives the rollback of an added column, which enters here at DELETE_ONLY.
     */
    static StepResult stepDrop(StepContext ctx, TableMeta table, ColumnMeta column, List<String> indexNames,
                               JobState finalState) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        SchemaState next;
        switch (column.getState()) {
            case PUBLIC:
                next = SchemaState.WRITE_ONLY;
                break;
            case WRITE_ONLY:
            case WRITE_REORGANIZATION:
                next = SchemaState.DELETE_ONLY;
                break;
            case DELETE_ONLY:
                next = SchemaState.DELETE_REORGANIZATION;
                break;
            case DELETE_REORGANIZATION:
                table.removeColumn(column.getName());
                List<String> names = Lists.newArrayList(column.getName());
                for (String indexName : indexNames) {
                    if (table.removeIndex(indexName) != null) {
                        names.add(indexName);
                    }
                }
                ctx.scheduleCleanup(ctx.newReorgTask(ReorgTask.Kind.CLEANUP_COLUMN, column.getId(), names));
                job.setSchemaState(SchemaState.NONE);
                job.finish(finalState);
                return StepResult.advance();
            default:
                throw invalidState("column", column.getState());
        }
        column.setState(next);
        for (String indexName : indexNames) {
            IndexMeta index = table.findIndex(indexName);
            if (index != null) {
                index.setState(next);
            }
        }
        job.setSchemaState(next);
        return StepResult.advance();
    }
}
