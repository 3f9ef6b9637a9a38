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
import com.stratadb.meta.MetaStoreException;
import com.stratadb.task.ReorgException;
import com.stratadb.task.ReorgTask;

import java.util.List;

/**
 * Replaces the partitions named in the args by the new definitions.
 * <p>
 * The new partitions are written to from WRITE_ONLY on and filled from the old ones in WRITE_REORGANIZATION. The
 * definitions are swapped in DELETE_REORGANIZATION, after which the old partitions are only waiting for cleanup
 * and the job can no longer be rolled back.
 */
public class ReorganizePartitionHandler extends BaseActionHandler {

    public ReorganizePartitionHandler() {
        super(ActionType.REORGANIZE_PARTITION, SchemaState.NONE, SchemaState.DELETE_ONLY, SchemaState.WRITE_ONLY,
                SchemaState.WRITE_REORGANIZATION, SchemaState.DELETE_REORGANIZATION, SchemaState.PUBLIC);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException, ReorgException, MetaStoreException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.requireTable();
        PartitionInfo info = PartitionHandlers.requirePartitionInfo(table);
        switch (job.getSchemaState()) {
            case NONE:
                PartitionArgs args = job.getArgs(PartitionArgs.class);
                PartitionHandlers.checkExist(info, args.getNames(), "REORGANIZE");
                PartitionHandlers.addDefinitions(ctx, info, args.getPartitions(), args.getNames());
                job.setSchemaState(SchemaState.DELETE_ONLY);
                return StepResult.advance();
            case DELETE_ONLY:
                job.setSchemaState(SchemaState.WRITE_ONLY);
                return StepResult.advance();
            case WRITE_ONLY:
                job.setSchemaState(SchemaState.WRITE_REORGANIZATION);
                return StepResult.advance();
            case WRITE_REORGANIZATION:
                StepResult pending = awaitReorg(ctx, ReorgTask.Kind.REORGANIZE_PARTITION, table.getId(),
                        PartitionInfo.namesOf(info.getAddingDefinitions()));
                if (pending != null) {
                    return pending;
                }
                swapDefinitions(info, job.getArgs(PartitionArgs.class).getNames());
                job.setSchemaState(SchemaState.DELETE_REORGANIZATION);
                return StepResult.advance();
            case DELETE_REORGANIZATION:
                for (PartitionDef def : info.getDroppingDefinitions()) {
                    PartitionHandlers.scheduleCleanup(ctx, def);
                }
                info.getDroppingDefinitions().clear();
                return finish(job, SchemaState.PUBLIC);
            default:
                throw invalidState("partition", job.getSchemaState());
        }
    }

    private static void swapDefinitions(PartitionInfo info, List<String> oldNames) throws AlterCancelException {
        List<PartitionDef> definitions = info.getDefinitions();
        int pos = -1;
        for (String name : oldNames) {
            PartitionDef def = info.findDefinition(name);
            if (def == null) {
                throw invalidState("partition " + name, "missing");
            }
            int idx = definitions.indexOf(def);
            pos = pos < 0 ? idx : Math.min(pos, idx);
            definitions.remove(def);
            info.getDroppingDefinitions().add(def);
        }
        definitions.addAll(pos, info.getAddingDefinitions());
        info.getAddingDefinitions().clear();
    }

    /**
     * The rollback converter rewrote the args to the names of the adding partitions.
     */
    @Override
    public StepResult rollbackStep(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        PartitionInfo info = PartitionHandlers.requirePartitionInfo(ctx.requireTable());
        PartitionHandlers.removeDefinitions(ctx, info.getAddingDefinitions(),
                job.getArgs(PartitionArgs.class).getNames());
        return finishRollback(job);
    }
}
