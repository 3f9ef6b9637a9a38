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
import com.stratadb.alter.AlterJobArgs.IndexVisibilityArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.IndexMeta;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;

public class IndexVisibilityHandler extends SingleStepHandler {

    public IndexVisibilityHandler() {
        super(ActionType.ALTER_INDEX_VISIBILITY);
    }

    @Override
    protected void apply(StepContext ctx) throws AlterCancelException {
        TableMeta table = ctx.requireTable();
        IndexVisibilityArgs args = ctx.getJob().getArgs(IndexVisibilityArgs.class);
        IndexMeta index = table.findIndex(args.getIndexName());
        if (index == null) {
            throw new AlterCancelException(ErrorCode.ERR_KEY_DOES_NOT_EXIST, args.getIndexName(), table.getName());
        }
        if (index.isPrimary() && !args.isVisible()) {
            throw new AlterCancelException(ErrorCode.ERR_INVISIBLE_PRIMARY_KEY);
        }
        index.setVisible(args.isVisible());
    }
}
