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
import com.stratadb.alter.AlterJobArgs.AddIndexArgs;
import com.stratadb.alter.AlterJobArgs.DropIndexArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.IndexMeta;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.task.ReorgException;
import com.stratadb.task.ReorgTask;

/**
 * Adds a secondary index or the primary key: NONE -> DELETE_ONLY -> WRITE_ONLY -> WRITE_REORGANIZATION -> PUBLIC.
 * <p>
 * The backfill of existing rows runs in WRITE_REORGANIZATION. For a primary key the nullable key columns refuse
 * NULL inserts from DELETE_ONLY on and become NOT NULL when the key is published.
 */
public class AddIndexHandler extends BaseActionHandler {

    public AddIndexHandler(ActionType type) {
        super(type, SchemaState.NONE, SchemaState.DELETE_ONLY, SchemaState.WRITE_ONLY,
                SchemaState.WRITE_REORGANIZATION, SchemaState.PUBLIC);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException, ReorgException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        AddIndexArgs args = job.getArgs(AddIndexArgs.class);
        if (job.getSchemaState() == SchemaState.NONE) {
            checkIndex(table, args);
            IndexMeta index = new IndexMeta(args.getIndexName(), args.getColumns(), args.isUnique(),
                    args.isPrimary());
            index.setState(SchemaState.DELETE_ONLY);
            table.addIndex(index);
            if (args.isPrimary()) {
                setPreventNullInsert(table, index, true);
            }
            job.setSchemaState(SchemaState.DELETE_ONLY);
            return StepResult.advance();
        }

        IndexMeta index = table.findIndex(args.getIndexName());
        if (index == null) {
            throw new AlterCancelException(ErrorCode.ERR_KEY_DOES_NOT_EXIST, args.getIndexName(), table.getName());
        }
        switch (index.getState()) {
            case DELETE_ONLY:
                index.setState(SchemaState.WRITE_ONLY);
                job.setSchemaState(SchemaState.WRITE_ONLY);
                return StepResult.advance();
            case WRITE_ONLY:
                index.setState(SchemaState.WRITE_REORGANIZATION);
                job.setSchemaState(SchemaState.WRITE_REORGANIZATION);
                return StepResult.advance();
            case WRITE_REORGANIZATION:
                StepResult pending = awaitReorg(ctx, ReorgTask.Kind.BACKFILL_INDEX, index.getId(),
                        Lists.newArrayList(index.getName()));
                if (pending != null) {
                    return pending;
                }
                if (stopAtPointOfNoReturn(job)) {
                    return StepResult.persist();
                }
                index.setState(SchemaState.PUBLIC);
                if (index.isPrimary()) {
                    for (String name : index.getColumns()) {
                        ColumnMeta column = table.findColumn(name);
                        column.setNullable(false);
                        column.setPreventNullInsert(false);
                    }
                }
                return finish(job, SchemaState.PUBLIC);
            default:
                throw invalidState("index", index.getState());
        }
    }

    private static void checkIndex(TableMeta table, AddIndexArgs args) throws AlterCancelException {
        if (table.findIndex(args.getIndexName()) != null) {
            throw new AlterCancelException(ErrorCode.ERR_DUP_KEYNAME, args.getIndexName());
        }
        if (args.isPrimary() && table.getPrimaryKey() != null) {
            throw new AlterCancelException(ErrorCode.ERR_MULTIPLE_PRI_KEY);
        }
        for (String name : args.getColumns()) {
            ColumnMeta column = table.findColumn(name);
            if (column == null || column.getState() != SchemaState.PUBLIC) {
                throw new AlterCancelException(ErrorCode.ERR_KEY_COLUMN_DOES_NOT_EXIST, name);
            }
        }
    }

    /**
     * @return true if a flag changed
     */
    public static boolean setPreventNullInsert(TableMeta table, IndexMeta index, boolean prevent) {
        boolean changed = false;
        for (String name : index.getColumns()) {
            ColumnMeta column = table.findColumn(name);
            if (column != null && column.isNullable() && column.isPreventNullInsert() != prevent) {
                column.setPreventNullInsert(prevent);
                changed = true;
            }
        }
        return changed;
    }

    /**
     * The rollback converter regressed the index to DELETE_ONLY, the index is removed in one step.
     */
    @Override
    public StepResult rollbackStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        DropIndexArgs args = job.getArgs(DropIndexArgs.class);
        IndexMeta index = table.findIndex(args.getIndexName());
        if (index != null) {
            if (index.isPrimary()) {
                setPreventNullInsert(table, index, false);
            }
            table.removeIndex(index.getName());
            ctx.scheduleCleanup(ctx.newReorgTask(ReorgTask.Kind.CLEANUP_INDEX, index.getId(),
                    Lists.newArrayList(index.getName())));
        }
        return finishRollback(job);
    }
}
