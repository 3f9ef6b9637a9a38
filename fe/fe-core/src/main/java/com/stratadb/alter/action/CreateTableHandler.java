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
import com.stratadb.alter.AlterJobArgs.CreateTableArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.meta.Versioned;

public class CreateTableHandler extends SingleStepHandler {

    public CreateTableHandler() {
        super(ActionType.CREATE_TABLE);
    }

    @Override
    protected void apply(StepContext ctx) throws AlterCancelException, MetaStoreException {
        AlterJob job = ctx.getJob();
        if (ctx.getTable() != null) {
            throw new AlterCancelException(ErrorCode.ERR_TABLE_EXISTS_ERROR, job.getTableName());
        }
        TableMeta table = job.getArgs(CreateTableArgs.class).getTable();
        for (Versioned<TableMeta> other : ctx.getStore().listTables(job.getDbId())) {
            if (other.getValue().getName().equalsIgnoreCase(table.getName())) {
                throw new AlterCancelException(ErrorCode.ERR_TABLE_EXISTS_ERROR, table.getName());
            }
        }
        table.setDbId(job.getDbId());
        table.setId(job.getTableId());
        table.setState(SchemaState.PUBLIC);
        ctx.createTable(table);
    }
}
