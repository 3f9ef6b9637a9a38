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
import com.stratadb.alter.AlterJobArgs.CheckConstraintArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.CheckConstraint;
import com.stratadb.common.ErrorCode;

public class AlterCheckConstraintHandler extends SingleStepHandler {

    public AlterCheckConstraintHandler() {
        super(ActionType.ALTER_CHECK_CONSTRAINT);
    }

    @Override
    protected void apply(StepContext ctx) throws AlterCancelException {
        CheckConstraintArgs args = ctx.getJob().getArgs(CheckConstraintArgs.class);
        CheckConstraint constraint = ctx.requireTable().findConstraint(args.getName());
        if (constraint == null) {
            throw new AlterCancelException(ErrorCode.ERR_CHECK_CONSTRAINT_NOT_FOUND, args.getName());
        }
        constraint.setEnforced(args.isEnforced());
    }
}
