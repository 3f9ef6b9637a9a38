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
import com.stratadb.alter.AlterJobArgs.RenameIndexArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.IndexMeta;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;

public class RenameIndexHandler extends SingleStepHandler {

    public RenameIndexHandler() {
        super(ActionType.RENAME_INDEX);
    }

    @Override
    protected void apply(StepContext ctx) throws AlterCancelException {
        TableMeta table = ctx.requireTable();
        RenameIndexArgs args = ctx.getJob().getArgs(RenameIndexArgs.class);
        IndexMeta index = table.findIndex(args.getFromName());
        if (index == null) {
            throw new AlterCancelException(ErrorCode.ERR_KEY_DOES_NOT_EXIST, args.getFromName(), table.getName());
        }
        if (index.nameEquals(args.getToName())) {
            return;
        }
        if (table.findIndex(args.getToName()) != null) {
            throw new AlterCancelException(ErrorCode.ERR_DUP_KEYNAME, args.getToName());
        }
        index.setName(args.getToName());
    }
}
