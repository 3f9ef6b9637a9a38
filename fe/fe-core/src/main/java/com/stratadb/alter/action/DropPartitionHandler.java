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
import com.stratadb.alter.AlterJobArgs.PartitionArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.PartitionDef;
import com.stratadb.catalog.PartitionInfo;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;

import java.util.List;

public class DropPartitionHandler extends BaseActionHandler {

    public DropPartitionHandler() {
        super(ActionType.DROP_TABLE_PARTITION, SchemaState.PUBLIC, SchemaState.DELETE_ONLY,
                SchemaState.DELETE_REORGANIZATION, SchemaState.NONE);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        PartitionInfo info = PartitionHandlers.requirePartitionInfo(table);
        switch (job.getSchemaState()) {
            case PUBLIC:
                List<String> names = job.getArgs(PartitionArgs.class).getNames();
                PartitionHandlers.checkExist(info, names, "DROP");
                if (names.size() >= info.getDefinitions().size()) {
                    throw new AlterCancelException(ErrorCode.ERR_DROP_LAST_PARTITION);
                }
                for (String name : names) {
                    PartitionDef def = info.findDefinition(name);
                    info.getDefinitions().remove(def);
                    info.getDroppingDefinitions().add(def);
                }
                job.setSchemaState(SchemaState.DELETE_ONLY);
                return StepResult.advance();
            case DELETE_ONLY:
                job.setSchemaState(SchemaState.DELETE_REORGANIZATION);
                return StepResult.advance();
            case DELETE_REORGANIZATION:
                for (PartitionDef def : info.getDroppingDefinitions()) {
                    PartitionHandlers.scheduleCleanup(ctx, def);
                }
                info.getDroppingDefinitions().clear();
                return finish(job, SchemaState.NONE);
            default:
                throw invalidState("partition", job.getSchemaState());
        }
    }
}
