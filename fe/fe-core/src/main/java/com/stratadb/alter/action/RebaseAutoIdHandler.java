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
import com.stratadb.alter.AlterJobArgs.RebaseAutoIdArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;

public class RebaseAutoIdHandler extends SingleStepHandler {

    public RebaseAutoIdHandler() {
        super(ActionType.REBASE_AUTO_ID);
    }

    @Override
    protected void apply(StepContext ctx) throws AlterCancelException {
        TableMeta table = ctx.requireTable();
        RebaseAutoIdArgs args = ctx.getJob().getArgs(RebaseAutoIdArgs.class);
        // a smaller base would hand out ids again, only a forced rebase may do that
        if (args.getNewBase() < table.getAutoIncrementBase() && !args.isForce()) {
            throw new AlterCancelException(ErrorCode.ERR_AUTO_ID_REBASE_TOO_SMALL, args.getNewBase(),
                    table.getAutoIncrementBase());
        }
        table.setAutoIncrementBase(args.getNewBase());
    }
}
