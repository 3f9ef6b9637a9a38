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
import com.google.common.collect.Sets;
import com.stratadb.common.Config;
import com.stratadb.common.DdlException;
import com.stratadb.common.util.TimeUtils;
import com.stratadb.meta.MetaConflictException;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.meta.MetaTxn;
import com.stratadb.meta.MetadataStore;
import com.stratadb.meta.Versioned;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;

/**
 * The durable queue of DDL jobs, kept in the metadata store. Active jobs are ordered by id, finished jobs are
 * moved to the history by the step that finishes them.
 */
public class AlterJobQueue {
    private static final Logger LOG = LogManager.getLogger(AlterJobQueue.class);

    public interface JobUpdater {
        /**
         * Changes the job in place, or throws if the change is not allowed in the state of the job.
         */
        void update(AlterJob job) throws DdlException;
    }

    private final MetadataStore store;

    public AlterJobQueue(MetadataStore store) {
        this.store = store;
    }

    public void enqueue(AlterJob job) throws MetaStoreException {
        store.commit(new MetaTxn().putJob(job, 0));
        LOG.info("add {} job {}", job.getType(), job.getId());
    }

    public Versioned<AlterJob> getActiveJob(long jobId) throws MetaStoreException {
        return store.getJob(jobId);
    }

    public AlterJob getHistoryJob(long jobId) throws MetaStoreException {
        return store.getHistoryJob(jobId);
    }

    /**
     * @return the active job, else the finished one, else null
     */
    public AlterJob getJob(long jobId) throws MetaStoreException {
        Versioned<AlterJob> active = store.getJob(jobId);
        return active != null ? active.getValue() : store.getHistoryJob(jobId);
    }

    public List<AlterJob> listActiveJobs() throws MetaStoreException {
        List<AlterJob> jobs = Lists.newArrayList();
        for (Versioned<AlterJob> job : store.listJobs()) {
            jobs.add(job.getValue());
        }
        return jobs;
    }

    public List<AlterJob> listHistoryJobs() throws MetaStoreException {
        return store.listHistoryJobs();
    }

    /**
     * Jobs on one table run one at a time in id order: only the earliest active job of each table is runnable,
     * and not while it is paused or of a type this node does not know.
     */
    public List<AlterJob> listRunnableJobs() throws MetaStoreException {
        List<AlterJob> runnable = Lists.newArrayList();
        Set<Long> busyTables = Sets.newHashSet();
        for (Versioned<AlterJob> versionedJob : store.listJobs()) {
            AlterJob job = versionedJob.getValue();
            if (!busyTables.add(job.getTableId())) {
                continue;
            }
            if (job.getType() == null || job.getState() == JobState.PAUSED) {
                continue;
            }
            runnable.add(job);
        }
        return runnable;
    }

    /**
     * Applies the updater to the active job with an optimistic write, retried on conflicts.
     *
     * @return the job as committed, null if the job is not active
     */
    public AlterJob updateJob(long jobId, JobUpdater updater) throws DdlException, MetaStoreException {
        MetaConflictException lastConflict = null;
        for (int i = 0; i <= Config.ddl_meta_conflict_retry_times; i++) {
            Versioned<AlterJob> versionedJob = store.getJob(jobId);
            if (versionedJob == null) {
                return null;
            }
            AlterJob job = versionedJob.getValue();
            updater.update(job);
            try {
                store.commit(new MetaTxn().putJob(job, versionedJob.getVersion()));
                return job;
            } catch (MetaConflictException e) {
                LOG.info("update of job {} conflicts, retry: {}", jobId, e.getMessage());
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    public void clearExpiredHistory() throws MetaStoreException {
        for (AlterJob job : store.listHistoryJobs()) {
            if (job.isExpire()) {
                store.removeHistoryJob(job.getId());
                LOG.info("remove expired {} job {}. finish at {}", job.getType(), job.getId(),
                        TimeUtils.longToTimeString(job.getFinishedTimeMs()));
            }
        }
    }
}
