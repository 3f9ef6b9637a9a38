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

import com.google.common.collect.Lists;
import com.stratadb.alter.AlterJobArgs.CreateTableArgs;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.DdlException;
import com.stratadb.common.ErrorCode;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.meta.MetadataStore;
import com.stratadb.meta.Versioned;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * The control surface of DDL jobs. Every node serves it; requests are written to the job records and picked up
 * by the owner on its next step of the job.
 */
public class AlterJobMgr {
    private static final Logger LOG = LogManager.getLogger(AlterJobMgr.class);

    private final MetadataStore store;
    private final AlterJobQueue queue;
    private final AlterJobCallback callback;

    public AlterJobMgr(MetadataStore store, AlterJobQueue queue, AlterJobCallback callback) {
        this.store = store;
        this.queue = queue;
        this.callback = callback;
    }

    /**
     * Adds a job to the queue and returns its id without waiting for it to run.
     * A CREATE_TABLE job given table id 0 gets a newly allocated one.
     */
    public long submitJob(ActionType type, long dbId, long tableId, String tableName, Object args)
            throws DdlException {
        if (type == ActionType.MULTI_SCHEMA_CHANGE) {
            throw new DdlException(ErrorCode.ERR_INVALID_DDL_JOB, -1L, "composite jobs are made of sub-jobs");
        }
        try {
            if (type == ActionType.CREATE_TABLE) {
                if (tableId == 0) {
                    tableId = store.allocateId();
                }
                if (args instanceof CreateTableArgs && tableName == null) {
                    tableName = ((CreateTableArgs) args).getTable().getName();
                }
            } else {
                tableName = checkTableExists(dbId, tableId, tableName);
            }
            AlterJob job = new AlterJob(store.allocateId(), type, dbId, tableId, tableName, args);
            queue.enqueue(job);
            return job.getId();
        } catch (MetaStoreException e) {
            throw new DdlException("failed to submit " + type + " job: " + e.getMessage(), e);
        }
    }

    /**
     * Submits several changes of one table as a single job that is applied or rolled back as a whole.
     */
    public long submitMultiSchemaChange(long dbId, long tableId, String tableName, List<SubJob> subJobs)
            throws DdlException {
        if (subJobs.isEmpty()) {
            throw new DdlException(ErrorCode.ERR_UNSUPPORTED_MULTI_SCHEMA_CHANGE, "an empty change list");
        }
        for (SubJob subJob : subJobs) {
            if (!subJob.getType().isComposable()) {
                throw new DdlException(ErrorCode.ERR_UNSUPPORTED_MULTI_SCHEMA_CHANGE, subJob.getType());
            }
        }
        try {
            tableName = checkTableExists(dbId, tableId, tableName);
            AlterJob job = new AlterJob(store.allocateId(), ActionType.MULTI_SCHEMA_CHANGE, dbId, tableId,
                    tableName, null);
            job.setMultiSchemaInfo(new MultiSchemaInfo(subJobs));
            queue.enqueue(job);
            return job.getId();
        } catch (MetaStoreException e) {
            throw new DdlException("failed to submit multi schema change: " + e.getMessage(), e);
        }
    }

    private String checkTableExists(long dbId, long tableId, String tableName)
            throws DdlException, MetaStoreException {
        Versioned<TableMeta> table = store.getTable(dbId, tableId);
        if (table == null) {
            throw new DdlException(ErrorCode.ERR_BAD_TABLE_ERROR, tableName == null ? tableId : tableName);
        }
        return table.getValue().getName();
    }

    public AlterJobStatus getJob(long jobId) throws DdlException {
        callback.onGetJobBefore(jobId);
        AlterJob job;
        try {
            job = queue.getJob(jobId);
        } catch (MetaStoreException e) {
            throw new DdlException("failed to get job " + jobId + ": " + e.getMessage(), e);
        }
        callback.onGetJobAfter(jobId, job);
        if (job == null) {
            throw new DdlException(ErrorCode.ERR_DDL_JOB_NOT_FOUND, jobId);
        }
        return new AlterJobStatus(job);
    }

    /**
     * Requests the cancellation of a job. The owner decides on its next step whether the job is cancelled, rolled
     * back or, past its point of no return, kept running.
     */
    public void cancelJob(long jobId) throws DdlException {
        updateJob(jobId, job -> {
            if (job.isCancelling() || job.isRollingback()) {
                throw new DdlException(ErrorCode.ERR_DDL_JOB_ALREADY_CANCELLING, jobId);
            }
            if (job.isDone()) {
                throw new DdlException(ErrorCode.ERR_CANCEL_FINISHED_DDL_JOB, jobId);
            }
            job.setState(JobState.CANCELLING);
        });
        LOG.info("job {} is requested to cancel", jobId);
    }

    public void pauseJob(long jobId) throws DdlException {
        updateJob(jobId, job -> {
            if (job.getState() != JobState.QUEUEING && job.getState() != JobState.RUNNING) {
                throw new DdlException(ErrorCode.ERR_PAUSE_DDL_JOB, jobId, job.getState());
            }
            job.setState(JobState.PAUSING);
        });
        LOG.info("job {} is requested to pause", jobId);
    }

    public void resumeJob(long jobId) throws DdlException {
        updateJob(jobId, job -> {
            if (job.getState() != JobState.PAUSED) {
                throw new DdlException(ErrorCode.ERR_RESUME_DDL_JOB, jobId, job.getState());
            }
            job.setState(JobState.QUEUEING);
        });
        LOG.info("job {} is resumed", jobId);
    }

    private void updateJob(long jobId, AlterJobQueue.JobUpdater updater) throws DdlException {
        try {
            if (queue.updateJob(jobId, updater) == null) {
                AlterJob finished = queue.getHistoryJob(jobId);
                if (finished != null) {
                    // rejects the request with the error matching the final state
                    updater.update(finished);
                    throw new DdlException(ErrorCode.ERR_INVALID_DDL_JOB, jobId, "job is finished");
                }
                throw new DdlException(ErrorCode.ERR_DDL_JOB_NOT_FOUND, jobId);
            }
        } catch (MetaStoreException e) {
            throw new DdlException("failed to update job " + jobId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Rows of {@link AlterJobStatus#TITLE_NAMES}: active jobs in id order, then the most recently finished ones.
     */
    public List<List<String>> listJobs(int limit) throws DdlException {
        List<List<String>> rows = Lists.newArrayList();
        try {
            for (AlterJob job : queue.listActiveJobs()) {
                if (rows.size() >= limit) {
                    return rows;
                }
                rows.add(new AlterJobStatus(job).toRow());
            }
            List<AlterJob> history = queue.listHistoryJobs();
            for (int i = history.size() - 1; i >= 0 && rows.size() < limit; i--) {
                rows.add(new AlterJobStatus(history.get(i)).toRow());
            }
        } catch (MetaStoreException e) {
            throw new DdlException("failed to list jobs: " + e.getMessage(), e);
        }
        return rows;
    }
}
