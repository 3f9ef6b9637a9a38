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
import com.stratadb.alter.JobState;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.SchemaState;
import com.stratadb.common.ErrorCode;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.task.ReorgContextManager;
import com.stratadb.task.ReorgContextManager.ReorgContext;
import com.stratadb.task.ReorgException;
import com.stratadb.task.ReorgTask;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

public abstract class BaseActionHandler implements ActionHandler {
    private static final Logger LOG = LogManager.getLogger(BaseActionHandler.class);

    private final ActionType type;
    private final List<SchemaState> phases;

    protected BaseActionHandler(ActionType type, SchemaState... phases) {
        this.type = type;
        this.phases = ImmutableList.copyOf(phases);
    }

    @Override
    public ActionType getType() {
        return type;
    }

    @Override
    public List<SchemaState> getPhases() {
        return phases;
    }

    @Override
    public StepResult rollbackStep(StepContext ctx) throws AlterCancelException, ReorgException, MetaStoreException {
        throw new AlterCancelException(ErrorCode.ERR_INVALID_DDL_STATE, type + " rollback",
                ctx.getJob().getSchemaState());
    }

    /**
     * Inside a composite job that can still be reverted, a sub-job stops right before its point of no return and
     * marks itself non-revertible.
     *
     * @return true if the job stopped there
     */
    protected static boolean stopAtPointOfNoReturn(AlterJob job) {
        if (job.inRevertibleCompositePhase()) {
            job.markNonRevertible();
            LOG.info("sub-job {} of job {} becomes non-revertible", job.getSubJobSeq(), job.getId());
            return true;
        }
        return false;
    }

    /**
     * Drives the reorg task of a job in WRITE_REORGANIZATION.
     * The first call persists the snapshot version and starts the task only after that commit. A job whose
     * snapshot is persisted but whose task is unknown on this node (after an owner change) starts it again with
     * the same snapshot.
     *
     * @return null once the task completed, otherwise the result the step has to return
     */
    protected static StepResult awaitReorg(StepContext ctx, ReorgTask.Kind kind, long elementId,
                                           List<String> elementNames) throws ReorgException {
        AlterJob job = ctx.getJob();
        if (job.isReorgDone()) {
            return null;
        }
        if (job.getSnapshotVer() == 0) {
            job.setSnapshotVer(Math.max(1, ctx.getSchemaVersion()));
            return StepResult.startReorg(ctx.newReorgTask(kind, elementId, elementNames));
        }
        ReorgContextManager reorgContexts = ctx.getReorgContexts();
        ReorgContext reorgCtx = reorgContexts.get(ctx.getReorgKey());
        if (reorgCtx == null) {
            LOG.info("restart reorg task of job {} with snapshot version {}", job.getId(), job.getSnapshotVer());
            return StepResult.resumeReorg(ctx.newReorgTask(kind, elementId, elementNames));
        }
        switch (reorgCtx.getStatus()) {
            case RUNNING:
                return StepResult.waitReorg();
            case FAILED:
                throw new ReorgException(reorgCtx.getResult().getErrMsg());
            default:
                reorgContexts.remove(ctx.getReorgKey());
                job.setRowCount(reorgCtx.getResult().getRowCount());
                job.setReorgDone(true);
                return null;
        }
    }

    protected static StepResult finish(AlterJob job, SchemaState finalSchemaState) {
        job.setSchemaState(finalSchemaState);
        job.finish(JobState.DONE);
        return StepResult.advance();
    }

    protected static StepResult finishRollback(AlterJob job) {
        job.setSchemaState(SchemaState.NONE);
        job.finish(JobState.ROLLBACK_DONE);
        return StepResult.advance();
    }

    protected static AlterCancelException invalidState(String what, Object state) {
        return new AlterCancelException(ErrorCode.ERR_INVALID_DDL_STATE, what, state);
    }
}
