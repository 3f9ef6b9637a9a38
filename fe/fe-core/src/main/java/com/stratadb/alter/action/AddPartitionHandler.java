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

import com.google.common.collect.ImmutableList;
import com.stratadb.alter.ActionType;
import com.stratadb.alter.AlterCancelException;
import com.stratadb.alter.AlterJob;
import com.stratadb.alter.AlterJobArgs.PartitionArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.PartitionInfo;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.meta.MetaStoreException;

/**
 * NONE -> REPLICA_ONLY -> PUBLIC. In REPLICA_ONLY the new partitions exist in the adding definitions, their
 * replicas are created but queries do not see them.
 */
public class AddPartitionHandler extends BaseActionHandler {

    public AddPartitionHandler() {
        super(ActionType.ADD_TABLE_PARTITION, SchemaState.NONE, SchemaState.REPLICA_ONLY, SchemaState.PUBLIC);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException, MetaStoreException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        PartitionInfo info = PartitionHandlers.requirePartitionInfo(table);
        switch (job.getSchemaState()) {
            case NONE:
                PartitionArgs args = job.getArgs(PartitionArgs.class);
                PartitionHandlers.addDefinitions(ctx, info, args.getPartitions(), ImmutableList.of());
                job.setSchemaState(SchemaState.REPLICA_ONLY);
                return StepResult.advance();
            case REPLICA_ONLY:
                info.getDefinitions().addAll(info.getAddingDefinitions());
                info.getAddingDefinitions().clear();
                return finish(job, SchemaState.PUBLIC);
            default:
                throw invalidState("partition", job.getSchemaState());
        }
    }

    @Override
    public StepResult rollbackStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        PartitionInfo info = PartitionHandlers.requirePartitionInfo(table);
        PartitionArgs args = job.getArgs(PartitionArgs.class);
        PartitionHandlers.removeDefinitions(ctx, info.getAddingDefinitions(), args.getNames());
        return finishRollback(job);
    }
}
