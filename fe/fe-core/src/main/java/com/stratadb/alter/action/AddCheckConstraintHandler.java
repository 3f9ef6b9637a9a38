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
import com.stratadb.alter.AlterJobArgs.AddCheckConstraintArgs;
import com.stratadb.alter.AlterJobArgs.CheckConstraintArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.CheckConstraint;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.task.ReorgException;
import com.stratadb.task.ReorgTask;

/**
 * NONE -> WRITE_ONLY -> WRITE_REORGANIZATION -> PUBLIC. New writes are checked from WRITE_ONLY on, existing
 * rows are validated in WRITE_REORGANIZATION when the constraint is enforced.
 */
public class AddCheckConstraintHandler extends BaseActionHandler {

    public AddCheckConstraintHandler() {
        super(ActionType.ADD_CHECK_CONSTRAINT, SchemaState.NONE, SchemaState.WRITE_ONLY,
                SchemaState.WRITE_REORGANIZATION, SchemaState.PUBLIC);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException, ReorgException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        CheckConstraint argConstraint = job.getArgs(AddCheckConstraintArgs.class).getConstraint();
        if (job.getSchemaState() == SchemaState.NONE) {
            if (table.findConstraint(argConstraint.getName()) != null) {
                throw new AlterCancelException(ErrorCode.ERR_CHECK_CONSTRAINT_DUP_NAME, argConstraint.getName());
            }
            for (String column : argConstraint.getColumns()) {
                if (table.findColumn(column) == null) {
                    throw new AlterCancelException(ErrorCode.ERR_BAD_FIELD_ERROR, column, "check constraint");
                }
            }
            argConstraint.setState(SchemaState.WRITE_ONLY);
            table.addConstraint(argConstraint);
            job.setSchemaState(SchemaState.WRITE_ONLY);
            return StepResult.advance();
        }

        CheckConstraint constraint = table.findConstraint(argConstraint.getName());
        if (constraint == null) {
            throw new AlterCancelException(ErrorCode.ERR_CHECK_CONSTRAINT_NOT_FOUND, argConstraint.getName());
        }
        switch (constraint.getState()) {
            case WRITE_ONLY:
                constraint.setState(SchemaState.WRITE_REORGANIZATION);
                job.setSchemaState(SchemaState.WRITE_REORGANIZATION);
                return StepResult.advance();
            case WRITE_REORGANIZATION:
                if (constraint.isEnforced()) {
                    StepResult pending = awaitReorg(ctx, ReorgTask.Kind.VALIDATE_CONSTRAINT, constraint.getId(),
                            Lists.newArrayList(constraint.getName()));
                    if (pending != null) {
                        return pending;
                    }
                }
                constraint.setState(SchemaState.PUBLIC);
                return finish(job, SchemaState.PUBLIC);
            default:
                throw invalidState("constraint", constraint.getState());
        }
    }

    @Override
    public StepResult rollbackStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        table.removeConstraint(job.getArgs(CheckConstraintArgs.class).getName());
        return finishRollback(job);
    }
}
