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

package com.stratadb.alter;

import com.google.common.base.Preconditions;
import com.stratadb.alter.action.ActionHandler;
import com.stratadb.alter.action.ActionHandlers;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.Config;
import com.stratadb.leader.OwnerElection;
import com.stratadb.leader.OwnerLostException;
import com.stratadb.meta.CommitResult;
import com.stratadb.meta.MetaConflictException;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.meta.MetaTxn;
import com.stratadb.meta.MetadataStore;
import com.stratadb.meta.SchemaVersionPublisher;
import com.stratadb.meta.SchemaVersionSyncer;
import com.stratadb.meta.Versioned;
import com.stratadb.persist.gson.GsonUtils;
import com.stratadb.task.ReorgContextManager;
import com.stratadb.task.ReorgException;
import com.stratadb.task.ReorgTask;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Executes the steps of DDL jobs on the owner.
 * <p>
 * Each step re-reads the job and its table, lets the action handler (or the rollback converter) change private
 * copies of them and commits table, job and schema version bump in one {@link MetaTxn} conditioned on the versions
 * read. A bumped version is published and the owner waits, bounded by schema_version_sync_timeout_ms, for the live
 * nodes to load it before the next step: two consecutive versions are then never both in use.
 */
public class AlterJobRunner {
    private static final Logger LOG = LogManager.getLogger(AlterJobRunner.class);

    private final MetadataStore store;
    private final ActionHandlers handlers;
    private final RollbackConverter converter;
    private final ReorgContextManager reorgContexts;
    private final SchemaVersionPublisher publisher;
    private final SchemaVersionSyncer syncer;
    private final OwnerElection election;
    private volatile AlterJobCallback callback;

    public AlterJobRunner(MetadataStore store, ActionHandlers handlers, RollbackConverter converter,
                          ReorgContextManager reorgContexts, SchemaVersionPublisher publisher,
                          SchemaVersionSyncer syncer, OwnerElection election, AlterJobCallback callback) {
        this.store = store;
        this.handlers = handlers;
        this.converter = converter;
        this.reorgContexts = reorgContexts;
        this.publisher = publisher;
        this.syncer = syncer;
        this.election = election;
        this.callback = callback;
    }

    public AlterJobCallback getCallback() {
        return callback;
    }

    public void setCallback(AlterJobCallback callback) {
        this.callback = callback;
    }

    /**
     * Steps the job until it has to wait (for reorg workers, a retry or a user request) or is finished.
     *
     * @return the last step result, idle if the job is not active
     */
    public StepResult runJob(long jobId) throws InterruptedException {
        StepResult last = StepResult.idle();
        int conflicts = 0;
        while (true) {
            StepResult result;
            try {
                result = runOneStep(jobId);
            } catch (MetaConflictException e) {
                if (++conflicts > Config.ddl_meta_conflict_retry_times) {
                    LOG.warn("job {} keeps conflicting with concurrent writes, retry later", jobId, e);
                    return StepResult.retry(e);
                }
                LOG.info("job {} conflicts with a concurrent write, retry: {}", jobId, e.getMessage());
                continue;
            }
            if (result == null) {
                return last;
            }
            last = result;
            if (result.isYield()) {
                return result;
            }
        }
    }

    /**
     * @return null if the job is not active any more
     */
    StepResult runOneStep(long jobId) throws MetaConflictException, InterruptedException {
        try {
            return doStep(jobId);
        } catch (MetaConflictException e) {
            throw e;
        } catch (OwnerLostException e) {
            LOG.warn("stop running job {}: {}", jobId, e.getMessage());
            return StepResult.idle();
        } catch (MetaStoreException | RuntimeException e) {
            return recordError(jobId, e);
        }
    }

    private StepResult doStep(long jobId) throws MetaStoreException, OwnerLostException, InterruptedException {
        checkOwner();
        Versioned<AlterJob> versionedJob = store.getJob(jobId);
        if (versionedJob == null) {
            return null;
        }
        AlterJob job = versionedJob.getValue();
        if (job.getType() == null) {
            LOG.warn("skip job {} of a type unknown to this node", jobId);
            return StepResult.idle();
        }
        StepContext ctx = newContext(job);
        String tableJson = ctx.getTable() == null ? null : GsonUtils.GSON.toJson(ctx.getTable());
        callback.onJobRunBefore(job);

        StepResult result;
        switch (job.getState()) {
            case QUEUEING:
                List<SchemaState> phases = handlers.get(job.getType()).getPhases();
                if (job.isNeverStarted()) {
                    job.setStartTimeMs(System.currentTimeMillis());
                    if (!phases.isEmpty()) {
                        job.setSchemaState(phases.get(0));
                    }
                }
                job.setState(JobState.RUNNING);
                LOG.info("job {} starts running", job);
                result = StepResult.persist();
                break;
            case PAUSING:
                reorgContexts.stopJob(jobId);
                job.setState(JobState.PAUSED);
                LOG.info("job {} is paused", job);
                result = StepResult.suspend();
                break;
            case PAUSED:
                return StepResult.idle();
            case CANCELLING:
                return convert(ctx, versionedJob.getVersion());
            case RUNNING:
                try {
                    result = runHandlerStep(ctx);
                } catch (AlterCancelException | ReorgException e) {
                    return cancelOnError(jobId, e);
                }
                break;
            case ROLLINGBACK:
                try {
                    result = rollbackHandlerStep(ctx);
                } catch (AlterCancelException | ReorgException e) {
                    return recordError(jobId, e);
                }
                break;
            default:
                // finished but still active, only move it to history
                result = StepResult.persist();
                break;
        }

        if (result.isCommit()) {
            commit(ctx, versionedJob.getVersion(), isTableChanged(ctx, tableJson), result.isBumpVersion());
        }
        if (result.getReorgTask() != null) {
            reorgContexts.start(result.getReorgTask());
        }
        callback.onJobRunAfter(job);
        callback.onChanged(null);
        return result;
    }

    private StepResult runHandlerStep(StepContext ctx) throws AlterCancelException, ReorgException, MetaStoreException {
        AlterJob job = ctx.getJob();
        ActionHandler handler = handlers.get(job.getType());
        SchemaState before = job.getSchemaState();
        StepResult result = handler.runStep(ctx);
        List<SchemaState> phases = handler.getPhases();
        int from = phases.indexOf(before);
        int to = phases.indexOf(job.getSchemaState());
        Preconditions.checkState(from < 0 || to < 0 || to >= from,
                "job %s moved its schema state back from %s to %s", job.getId(), before, job.getSchemaState());
        return result;
    }

    private StepResult rollbackHandlerStep(StepContext ctx)
            throws AlterCancelException, ReorgException, MetaStoreException {
        AlterJob job = ctx.getJob();
        ActionHandler handler = handlers.get(job.getType());
        SchemaState before = job.getSchemaState();
        StepResult result = handler.rollbackStep(ctx);
        Preconditions.checkState(handler.getPhases().isEmpty()
                        || job.getSchemaState().getVisibility() <= before.getVisibility(),
                "rollback of job %s made %s more visible than %s", job.getId(), job.getSchemaState(), before);
        return result;
    }

    /**
     * The step found the job can not go on: record the cause and hand the job, as persisted, to the converter.
     */
    private StepResult cancelOnError(long jobId, Exception cause)
            throws MetaStoreException, OwnerLostException, InterruptedException {
        LOG.warn("job {} can not continue, convert it to rollback: {}", jobId, cause.getMessage());
        callback.onChanged(cause);
        Versioned<AlterJob> versionedJob = store.getJob(jobId);
        if (versionedJob == null) {
            return null;
        }
        AlterJob job = versionedJob.getValue();
        job.setErrMsg(cause.getMessage());
        job.setState(JobState.CANCELLING);
        StepResult converted = convert(newContext(job), versionedJob.getVersion());
        if (converted.isYield()) {
            return converted;
        }
        if (job.isRunning()) {
            // refused, the failed step is tried again on a later tick
            return StepResult.retry(cause);
        }
        return StepResult.cancelled(cause.getMessage(), cause);
    }

    private StepResult convert(StepContext ctx, long jobVersion)
            throws MetaStoreException, OwnerLostException, InterruptedException {
        AlterJob job = ctx.getJob();
        RollbackDecision decision = converter.convert(ctx);
        LOG.info("rollback decision of job {}: {}", job.getId(), decision);
        commit(ctx, jobVersion, decision.getOutcome() == RollbackDecision.Outcome.CONVERT,
                decision.isBumpVersion());
        callback.onJobRunAfter(job);
        callback.onChanged(null);
        if (decision.getOutcome() == RollbackDecision.Outcome.FAILED) {
            return StepResult.retry(new AlterCancelException(job.getErrMsg()));
        }
        return StepResult.persist();
    }

    /**
     * Counts a failed step on the job. A running job past ddl_error_count_limit is turned into a cancelling one,
     * a rolling back job is forced to CANCELLED.
     */
    private StepResult recordError(long jobId, Exception error) {
        LOG.warn("step of job {} failed, will retry", jobId, error);
        callback.onChanged(error);
        try {
            Versioned<AlterJob> versionedJob = store.getJob(jobId);
            if (versionedJob == null) {
                return null;
            }
            AlterJob job = versionedJob.getValue();
            job.increaseErrorCount();
            job.setErrMsg(error.getMessage());
            if (job.isErrorCountExceeded()) {
                if (job.isRollingback()) {
                    converter.forceCancel(job);
                } else if (job.isRunning()) {
                    LOG.warn("job {} failed too often, cancel it", job);
                    job.setState(JobState.CANCELLING);
                }
            }
            MetaTxn txn = new MetaTxn();
            if (job.isDone()) {
                txn.finishJob(job, versionedJob.getVersion());
            } else {
                txn.putJob(job, versionedJob.getVersion());
            }
            checkOwner();
            store.commit(txn);
            callback.onJobUpdated(job);
            return job.isDone() ? null : StepResult.retry(error);
        } catch (MetaStoreException | OwnerLostException e) {
            LOG.warn("failed to record the error of job {}", jobId, e);
            return StepResult.retry(error);
        }
    }

    private StepContext newContext(AlterJob job) throws MetaStoreException {
        Versioned<TableMeta> versionedTable = store.getTable(job.getDbId(), job.getTableId());
        TableMeta table = versionedTable == null ? null : versionedTable.getValue();
        long tableVersion = versionedTable == null ? 0 : versionedTable.getVersion();
        return new StepContext(job, table, tableVersion, store.getSchemaVersion(), store, reorgContexts);
    }

    private static boolean isTableChanged(StepContext ctx, String tableJson) {
        if (ctx.isTableDropped()) {
            return true;
        }
        return ctx.getTable() != null && !GsonUtils.GSON.toJson(ctx.getTable()).equals(tableJson);
    }

    private void checkOwner() throws OwnerLostException {
        if (!election.isOwner()) {
            throw new OwnerLostException(election.getNodeId());
        }
    }

    private void commit(StepContext ctx, long jobVersion, boolean writeTable, boolean bumpVersion)
            throws MetaStoreException, OwnerLostException, InterruptedException {
        AlterJob job = ctx.getJob();
        MetaTxn txn = new MetaTxn();
        if (writeTable) {
            if (ctx.isTableDropped()) {
                txn.dropTable(job.getDbId(), job.getTableId(), ctx.getTableVersion());
            } else if (ctx.getTable() != null) {
                txn.putTable(ctx.getTable(), ctx.getTableVersion());
            }
        }
        if (job.isDone()) {
            txn.finishJob(job, jobVersion);
        } else {
            txn.putJob(job, jobVersion);
        }
        if (bumpVersion) {
            txn.bumpSchemaVersion(job.getId());
        }

        checkOwner();
        CommitResult result = store.commit(txn);
        callback.onJobUpdated(job);
        if (job.isDone()) {
            reorgContexts.stopJob(job.getId());
            LOG.info("job {} is finished, error: {}", job, job.getErrMsg());
        }
        for (ReorgTask task : ctx.getCleanupTasks()) {
            reorgContexts.getPool().scheduleCleanup(task);
        }
        if (result.isVersionBumped()) {
            waitSchemaSynced(job, result.getSchemaVersion());
        }
    }

    private void waitSchemaSynced(AlterJob job, long version) throws InterruptedException {
        LOG.info("job {} bumped schema version to {}", job.getId(), version);
        publisher.advanceTo(version);
        if (!syncer.waitVersionSynced(version, Config.schema_version_sync_timeout_ms)) {
            LOG.warn("wait for schema version {} timed out, lagging nodes: {}", version,
                    syncer.getLaggingNodes(version));
        }
        callback.onSchemaStateChanged(version);
    }
}
