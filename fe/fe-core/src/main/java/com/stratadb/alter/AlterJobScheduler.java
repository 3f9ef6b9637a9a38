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

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.stratadb.common.Config;
import com.stratadb.common.ThreadPoolManager;
import com.stratadb.common.util.Daemon;
import com.stratadb.leader.OwnerElection;
import com.stratadb.leader.OwnerLossListener;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.task.ReorgContextManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Runs on every node. On the owner each cycle dispatches the runnable jobs to the alter workers, at most one worker
 * per job. A job waiting for its reorg task is skipped until the task wakes it, or until alter_reorg_wait_timeout_ms
 * passed and it is dispatched again to check on the task.
 */
public class AlterJobScheduler extends Daemon implements OwnerLossListener {
    private static final Logger LOG = LogManager.getLogger(AlterJobScheduler.class);

    private final OwnerElection election;
    private final AlterJobQueue queue;
    private final AlterJobRunner runner;
    private final ReorgContextManager reorgContexts;
    private final ThreadPoolExecutor executor;

    private final Set<Long> inFlight = Sets.newConcurrentHashSet();
    private final Set<Long> pendingWakeUps = Sets.newConcurrentHashSet();
    // job id -> time it started waiting for its reorg task
    private final Map<Long, Long> waitingReorg = Maps.newConcurrentMap();

    public AlterJobScheduler(OwnerElection election, AlterJobQueue queue, AlterJobRunner runner,
                             ReorgContextManager reorgContexts) {
        super("alter-job-scheduler-" + election.getNodeId(), Config.alter_scheduler_interval_millisecond);
        this.election = election;
        this.queue = queue;
        this.runner = runner;
        this.reorgContexts = reorgContexts;
        this.executor = ThreadPoolManager.newDaemonCacheThreadPool(Config.alter_max_worker_threads,
                Config.alter_max_worker_queue_size, "alter-worker-" + election.getNodeId());
        reorgContexts.setJobWaker(this::wake);
        election.watchLoss(this);
    }

    @Override
    protected void runOneCycle() {
        setInterval(Config.alter_scheduler_interval_millisecond);
        if (!election.isOwner()) {
            return;
        }
        try {
            queue.clearExpiredHistory();
        } catch (MetaStoreException e) {
            LOG.warn("failed to clear expired jobs", e);
        }
        dispatch();
    }

    public void dispatch() {
        List<AlterJob> jobs;
        try {
            jobs = queue.listRunnableJobs();
        } catch (MetaStoreException e) {
            LOG.warn("failed to list runnable jobs", e);
            return;
        }
        long now = System.currentTimeMillis();
        for (AlterJob job : jobs) {
            Long waitingSince = waitingReorg.get(job.getId());
            if (waitingSince != null && now - waitingSince < Config.alter_reorg_wait_timeout_ms) {
                continue;
            }
            submit(job.getId());
        }
    }

    /**
     * Dispatches the job right away, used when its reorg task finished.
     */
    public void wake(long jobId) {
        pendingWakeUps.add(jobId);
        waitingReorg.remove(jobId);
        if (election.isOwner()) {
            submit(jobId);
        }
    }

    private void submit(long jobId) {
        if (!inFlight.add(jobId)) {
            return;
        }
        waitingReorg.remove(jobId);
        try {
            executor.submit(() -> runJob(jobId));
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobId);
            LOG.warn("alter workers are busy, job {} is dispatched on a later cycle", jobId);
        }
    }

    private void runJob(long jobId) {
        pendingWakeUps.remove(jobId);
        try {
            StepResult result = runner.runJob(jobId);
            if (result.isWaitingReorg() && !pendingWakeUps.contains(jobId)) {
                waitingReorg.put(jobId, System.currentTimeMillis());
            }
        } catch (InterruptedException e) {
            LOG.warn("alter worker running job {} is interrupted", jobId);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOG.warn("failed to run job {}", jobId, e);
        } finally {
            inFlight.remove(jobId);
        }
        // woken up while running, the result it waited for may be there already
        if (pendingWakeUps.contains(jobId) && election.isOwner()) {
            submit(jobId);
        }
    }

    public boolean isInFlight(long jobId) {
        return inFlight.contains(jobId);
    }

    public boolean isWaitingReorg(long jobId) {
        return waitingReorg.containsKey(jobId);
    }

    @Override
    public void onOwnerLost(String nodeId) {
        LOG.warn("node {} lost the DDL owner role, stop local reorg work", nodeId);
        reorgContexts.clear();
        reorgContexts.getPool().stopAll();
        waitingReorg.clear();
        pendingWakeUps.clear();
    }

    public void shutdown() {
        setStop();
        executor.shutdownNow();
    }
}
