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
import com.stratadb.alter.AlterJobArgs.ModifyColumnArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.IndexMeta;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.task.ReorgException;
import com.stratadb.task.ReorgTask;

import java.util.List;

/**
 * Changes the definition of a column.
 * <p>
 * A change that keeps the column type only rewrites metadata. Tightening nullability first sets the
 * prevent-null-insert flag on the column and publishes that in its own version, so no node inserts NULL while the
 * NOT NULL definition is published.
 * <p>
 * A type change adds a hidden changing column next to the old one, backfills it and swaps it in when the data
 * is complete.
 */
public class ModifyColumnHandler extends BaseActionHandler {
    public static final String CHANGING_COLUMN_PREFIX = "_Col$_";

    public ModifyColumnHandler() {
        super(ActionType.MODIFY_COLUMN, SchemaState.NONE, SchemaState.DELETE_ONLY, SchemaState.WRITE_ONLY,
                SchemaState.WRITE_REORGANIZATION, SchemaState.PUBLIC);
    }

    public static boolean isDataChange(ColumnMeta oldColumn, ColumnMeta newColumn) {
        return !oldColumn.getType().equalsIgnoreCase(newColumn.getType());
    }

    public static boolean isTighteningNullability(ColumnMeta oldColumn, ColumnMeta newColumn) {
        return oldColumn.isNullable() && !newColumn.isNullable();
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException, ReorgException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        ModifyColumnArgs args = job.getArgs(ModifyColumnArgs.class);
        ColumnMeta oldColumn = table.findColumn(args.getColumnName());
        if (oldColumn == null) {
            throw new AlterCancelException(ErrorCode.ERR_BAD_FIELD_ERROR, args.getColumnName(), table.getName());
        }
        ColumnMeta newColumn = args.getNewColumn();

        if (job.getSchemaState() == SchemaState.NONE) {
            if (!oldColumn.nameEquals(newColumn.getName()) && table.findColumn(newColumn.getName()) != null) {
                throw new AlterCancelException(ErrorCode.ERR_DUP_FIELDNAME, newColumn.getName());
            }
            if (isDataChange(oldColumn, newColumn)) {
                return addChangingColumn(job, table, args, oldColumn);
            }
            if (stopAtPointOfNoReturn(job)) {
                return StepResult.persist();
            }
            if (isTighteningNullability(oldColumn, newColumn) && !oldColumn.isPreventNullInsert()) {
                oldColumn.setPreventNullInsert(true);
                return StepResult.advance();
            }
            oldColumn.setName(newColumn.getName());
            oldColumn.setNullable(newColumn.isNullable());
            oldColumn.setDefaultValue(newColumn.getDefaultValue());
            oldColumn.setComment(newColumn.getComment());
            oldColumn.setPreventNullInsert(false);
            renameInIndexes(table, args.getColumnName(), newColumn.getName());
            return finish(job, SchemaState.PUBLIC);
        }

        ColumnMeta changing = args.getChangingColumnName() == null
                ? null : table.findColumn(args.getChangingColumnName());
        if (changing == null) {
            throw new AlterCancelException(ErrorCode.ERR_BAD_FIELD_ERROR, args.getChangingColumnName(),
                    table.getName());
        }
        switch (changing.getState()) {
            case DELETE_ONLY:
                changing.setState(SchemaState.WRITE_ONLY);
                job.setSchemaState(SchemaState.WRITE_ONLY);
                return StepResult.advance();
            case WRITE_ONLY:
                changing.setState(SchemaState.WRITE_REORGANIZATION);
                job.setSchemaState(SchemaState.WRITE_REORGANIZATION);
                return StepResult.advance();
            case WRITE_REORGANIZATION:
                StepResult pending = awaitReorg(ctx, ReorgTask.Kind.BACKFILL_COLUMN, changing.getId(),
                        Lists.newArrayList(oldColumn.getName(), changing.getName()));
                if (pending != null) {
                    return pending;
                }
                if (stopAtPointOfNoReturn(job)) {
                    return StepResult.persist();
                }
                swapChangingColumn(ctx, table, oldColumn, changing, newColumn);
                return finish(job, SchemaState.PUBLIC);
            default:
                throw invalidState("changing column", changing.getState());
        }
    }

    private static StepResult addChangingColumn(AlterJob job, TableMeta table, ModifyColumnArgs args,
                                                ColumnMeta oldColumn) {
        ColumnMeta newColumn = args.getNewColumn();
        ColumnMeta changing = new ColumnMeta(CHANGING_COLUMN_PREFIX + oldColumn.getName(), newColumn.getType(),
                newColumn.isNullable());
        changing.setDefaultValue(newColumn.getDefaultValue());
        changing.setComment(newColumn.getComment());
        changing.setHidden(true);
        changing.setChangingFrom(oldColumn.getName());
        changing.setState(SchemaState.DELETE_ONLY);
        table.addColumn(changing, oldColumn.getName());
        args.setChangingColumnName(changing.getName());
        job.updateArgs(args);
        job.setSchemaState(SchemaState.DELETE_ONLY);
        return StepResult.advance();
    }

    private static void swapChangingColumn(StepContext ctx, TableMeta table, ColumnMeta oldColumn,
                                           ColumnMeta changing, ColumnMeta newColumn) {
        table.removeColumn(changing.getName());
        int pos = table.indexOfColumn(oldColumn.getName());
        table.getColumns().set(pos, changing);
        changing.setName(newColumn.getName());
        changing.setHidden(false);
        changing.setChangingFrom(null);
        changing.setState(SchemaState.PUBLIC);
        renameInIndexes(table, oldColumn.getName(), newColumn.getName());
        ctx.scheduleCleanup(ctx.newReorgTask(ReorgTask.Kind.CLEANUP_COLUMN, oldColumn.getId(),
                Lists.newArrayList(oldColumn.getName())));
    }

    private static void renameInIndexes(TableMeta table, String from, String to) {
        if (from.equalsIgnoreCase(to)) {
            return;
        }
        for (IndexMeta index : table.getIndexes()) {
            List<String> columns = index.getColumns();
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).equalsIgnoreCase(from)) {
                    columns.set(i, to);
                }
            }
        }
    }

    @Override
    public StepResult rollbackStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        ModifyColumnArgs args = job.getArgs(ModifyColumnArgs.class);
        ColumnMeta changing = args.getChangingColumnName() == null
                ? null : table.findColumn(args.getChangingColumnName());
        if (changing != null) {
            table.removeColumn(changing.getName());
            ctx.scheduleCleanup(ctx.newReorgTask(ReorgTask.Kind.CLEANUP_COLUMN, changing.getId(),
                    Lists.newArrayList(changing.getName())));
        } else {
            ColumnMeta oldColumn = table.findColumn(args.getColumnName());
            if (oldColumn != null) {
                oldColumn.setPreventNullInsert(false);
            }
        }
        return finishRollback(job);
    }
}
