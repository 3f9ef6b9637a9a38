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
import com.stratadb.alter.JobState;
import com.stratadb.alter.MultiSchemaInfo;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.alter.SubJob;
import com.stratadb.catalog.SchemaState;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.task.ReorgException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Drives the sub-jobs of a composite job.
 * <p>
 * While the job is revertible, the first revertible sub-job is stepped until it reaches its point of no return.
 * Once none is left the revertible flag is cleared and each sub-job is run to completion in order. A rollback
 * drives the rolling back sub-jobs in reverse order.
 */
public class MultiSchemaChangeHandler extends BaseActionHandler {
    private static final Logger LOG = LogManager.getLogger(MultiSchemaChangeHandler.class);

    private final ActionHandlers handlers;

    public MultiSchemaChangeHandler(ActionHandlers handlers) {
        super(ActionType.MULTI_SCHEMA_CHANGE);
        this.handlers = handlers;
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException, ReorgException, MetaStoreException {
        AlterJob job = ctx.getJob();
        MultiSchemaInfo info = requireInfo(job);
        List<SubJob> subJobs = info.getSubJobs();
        if (info.isRevertible()) {
            for (int i = 0; i < subJobs.size(); i++) {
                SubJob subJob = subJobs.get(i);
                if (subJob.isRevertible() && !subJob.getState().isFinished()) {
                    return runSubJob(ctx, subJob, i);
                }
            }
            info.setRevertible(false);
            LOG.info("all sub-jobs of job {} passed their point of no return", job.getId());
            return StepResult.persist();
        }
        for (int i = 0; i < subJobs.size(); i++) {
            SubJob subJob = subJobs.get(i);
            if (subJob.getState() != JobState.DONE) {
                return runSubJob(ctx, subJob, i);
            }
        }
        return finish(job, SchemaState.PUBLIC);
    }

    private StepResult runSubJob(StepContext ctx, SubJob subJob, int seq)
            throws AlterCancelException, ReorgException, MetaStoreException {
        AlterJob job = ctx.getJob();
        AlterJob proxy = subJob.toProxyJob(job, seq);
        if (proxy.getState() == JobState.QUEUEING) {
            proxy.setState(JobState.RUNNING);
            proxy.setStartTimeMs(job.getStartTimeMs());
        }
        StepResult result = handlers.get(subJob.getType()).runStep(ctx.forSubJob(proxy));
        subJob.fromProxyJob(proxy);
        job.setSchemaState(proxy.getSchemaState());
        return result;
    }

    @Override
    public StepResult rollbackStep(StepContext ctx) throws AlterCancelException, ReorgException, MetaStoreException {
        AlterJob job = ctx.getJob();
        List<SubJob> subJobs = requireInfo(job).getSubJobs();
        for (int i = subJobs.size() - 1; i >= 0; i--) {
            SubJob subJob = subJobs.get(i);
            if (subJob.getState() == JobState.ROLLINGBACK) {
                AlterJob proxy = subJob.toProxyJob(job, i);
                StepResult result = handlers.get(subJob.getType()).rollbackStep(ctx.forSubJob(proxy));
                subJob.fromProxyJob(proxy);
                return result;
            }
        }
        job.setSchemaState(SchemaState.NONE);
        job.finish(JobState.ROLLBACK_DONE);
        return StepResult.persist();
    }

    private static MultiSchemaInfo requireInfo(AlterJob job) throws AlterCancelException {
        if (job.getMultiSchemaInfo() == null) {
            throw new AlterCancelException("job " + job.getId() + " has no sub-jobs");
        }
        return job.getMultiSchemaInfo();
    }
}
