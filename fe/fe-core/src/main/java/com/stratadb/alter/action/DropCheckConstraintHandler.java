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
import com.stratadb.alter.AlterJobArgs.CheckConstraintArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.CheckConstraint;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;

public class DropCheckConstraintHandler extends BaseActionHandler {

    public DropCheckConstraintHandler() {
        super(ActionType.DROP_CHECK_CONSTRAINT, SchemaState.PUBLIC, SchemaState.WRITE_ONLY, SchemaState.NONE);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        String name = job.getArgs(CheckConstraintArgs.class).getName();
        CheckConstraint constraint = table.findConstraint(name);
        if (constraint == null) {
            throw new AlterCancelException(ErrorCode.ERR_CHECK_CONSTRAINT_NOT_FOUND, name);
        }
        switch (constraint.getState()) {
            case PUBLIC:
                constraint.setState(SchemaState.WRITE_ONLY);
                job.setSchemaState(SchemaState.WRITE_ONLY);
                return StepResult.advance();
            case WRITE_ONLY:
                table.removeConstraint(name);
                return finish(job, SchemaState.NONE);
            default:
                throw invalidState("constraint", constraint.getState());
        }
    }
}
