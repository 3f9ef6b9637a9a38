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
import com.google.common.util.concurrent.Uninterruptibles;
import com.stratadb.alter.AlterJobArgs.AddColumnArgs;
import com.stratadb.alter.AlterJobArgs.AddIndexArgs;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.SchemaState;
import com.stratadb.common.Config;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.task.ReorgResult;
import com.stratadb.task.ReorgTask;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.stratadb.alter.AlterJobTestEnv.DB_ID;
import static com.stratadb.alter.AlterJobTestEnv.TABLE_ID;

public class AlterJobSchedulerTest {
    private static final long WAIT_TIMEOUT_MS = 10_000L;

    private AlterJobTestEnv env;
    private AlterJobScheduler scheduler;

    @BeforeEach
    public void setUp() throws Exception {
        env = new AlterJobTestEnv();
        env.createDefaultTable();
        scheduler = new AlterJobScheduler(env.election, env.queue, env.runner, env.reorgContexts);
    }

    @AfterEach
    public void tearDown() {
        scheduler.shutdown();
    }

    private interface Condition {
        boolean check() throws Exception;
    }

    /**
     * Dispatches on every poll when asked to, like the daemon cycle does.
     */
    private void waitUntil(Condition condition, boolean dispatch) throws Exception {
        long deadline = System.currentTimeMillis() + WAIT_TIMEOUT_MS;
        while (!condition.check()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("condition not met in " + WAIT_TIMEOUT_MS + "ms");
            }
            if (dispatch) {
                scheduler.dispatch();
            }
            Thread.sleep(10);
        }
    }

    private boolean isFinished(long jobId) throws MetaStoreException {
        AlterJob job = env.getJob(jobId);
        return job != null && job.isDone();
    }

    private long submitAddColumn(long tableId, String name) throws Exception {
        return env.mgr.submitJob(ActionType.ADD_COLUMN, DB_ID, tableId, null,
                new AddColumnArgs(new ColumnMeta(name, "INT", true), null));
    }

    private long submitAddIndex(long tableId) throws Exception {
        return env.mgr.submitJob(ActionType.ADD_INDEX, DB_ID, tableId, null,
                new AddIndexArgs("idx_name", Lists.newArrayList("name"), false, false));
    }

    private ReorgTask getStartedTask(long jobId) {
        return env.pool.getStarted().stream().filter(t -> t.getJobId() == jobId).findFirst().orElse(null);
    }

    @Test
    public void testJobsOnDifferentTablesAllFinish() throws Exception {
        env.createTable(AlterJobTestEnv.newTable(200L, "t2"));
        long first = submitAddColumn(TABLE_ID, "c3");
        long second = submitAddColumn(200L, "c3");

        waitUntil(() -> isFinished(first) && isFinished(second), true);

        Assertions.assertEquals(JobState.DONE, env.getJob(first).getState());
        Assertions.assertEquals(JobState.DONE, env.getJob(second).getState());
        Assertions.assertEquals(SchemaState.PUBLIC, env.getTable(200L).findColumn("c3").getState());
        Assertions.assertEquals(8, env.getSchemaVersion());
    }

    @Test
    public void testJobsOnDifferentTablesWaitForReorgTogether() throws Exception {
        env.createTable(AlterJobTestEnv.newTable(200L, "t2"));
        long first = submitAddIndex(TABLE_ID);
        long second = submitAddIndex(200L);

        scheduler.dispatch();
        waitUntil(() -> scheduler.isWaitingReorg(first) && scheduler.isWaitingReorg(second), false);

        // both backfills run at the same time, none of them finished yet
        Assertions.assertEquals(2, env.pool.getStarted().size());
        Assertions.assertTrue(env.pool.isRunning(first));
        Assertions.assertTrue(env.pool.isRunning(second));
        Assertions.assertEquals(SchemaState.WRITE_REORGANIZATION, env.getJob(first).getSchemaState());
        Assertions.assertEquals(SchemaState.WRITE_REORGANIZATION, env.getJob(second).getSchemaState());

        env.pool.finish(getStartedTask(second).getKey(), ReorgResult.completed(2));
        waitUntil(() -> isFinished(second), false);
        Assertions.assertEquals(JobState.DONE, env.getJob(second).getState());
        Assertions.assertEquals(JobState.RUNNING, env.getJob(first).getState());

        env.pool.finish(getStartedTask(first).getKey(), ReorgResult.completed(1));
        waitUntil(() -> isFinished(first), false);
        Assertions.assertEquals(JobState.DONE, env.getJob(first).getState());
    }

    @Test
    public void testWorkerPoolSizeBoundsRunningJobs() throws Exception {
        int oldWorkerThreads = Config.alter_max_worker_threads;
        Config.alter_max_worker_threads = 1;
        try {
            scheduler.shutdown();
            scheduler = new AlterJobScheduler(env.election, env.queue, env.runner, env.reorgContexts);
            env.createTable(AlterJobTestEnv.newTable(200L, "t2"));
            long first = submitAddColumn(TABLE_ID, "c3");
            long second = submitAddColumn(200L, "c3");

            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            env.runner.setCallback(new DefaultAlterJobCallback() {
                @Override
                public void onJobRunBefore(AlterJob job) {
                    if (job.getId() == first) {
                        entered.countDown();
                        Uninterruptibles.awaitUninterruptibly(release);
                    }
                }
            });

            scheduler.dispatch();
            Assertions.assertTrue(entered.await(WAIT_TIMEOUT_MS, TimeUnit.MILLISECONDS));
            Thread.sleep(100);

            // the only worker is busy with the first job, the second one waits in the worker queue
            Assertions.assertTrue(scheduler.isInFlight(second));
            Assertions.assertEquals(JobState.QUEUEING, env.getJob(second).getState());
            Assertions.assertEquals(0, env.getSchemaVersion());

            release.countDown();
            waitUntil(() -> isFinished(first) && isFinished(second), true);
            Assertions.assertEquals(JobState.DONE, env.getJob(first).getState());
            Assertions.assertEquals(JobState.DONE, env.getJob(second).getState());
            Assertions.assertTrue(env.getJob(second).getStartTimeMs() >= env.getJob(first).getFinishedTimeMs());
        } finally {
            Config.alter_max_worker_threads = oldWorkerThreads;
        }
    }

    @Test
    public void testJobsOnOneTableRunInIdOrder() throws Exception {
        long first = submitAddColumn(TABLE_ID, "c3");
        long second = submitAddColumn(TABLE_ID, "c4");

        waitUntil(() -> isFinished(first) && isFinished(second), true);

        AlterJob firstJob = env.getJob(first);
        AlterJob secondJob = env.getJob(second);
        Assertions.assertTrue(secondJob.getStartTimeMs() >= firstJob.getFinishedTimeMs());
        for (long version = 1; version <= 4; version++) {
            Assertions.assertEquals(first, env.store.getJobIdOfVersion(version));
        }
        for (long version = 5; version <= 8; version++) {
            Assertions.assertEquals(second, env.store.getJobIdOfVersion(version));
        }
    }

    @Test
    public void testFinishedReorgWakesTheJob() throws Exception {
        long jobId = env.mgr.submitJob(ActionType.ADD_INDEX, DB_ID, TABLE_ID, null,
                new AddIndexArgs("idx_name", Lists.newArrayList("name"), false, false));
        scheduler.dispatch();
        waitUntil(() -> scheduler.isWaitingReorg(jobId) && !scheduler.isInFlight(jobId), false);

        // a waiting job is not dispatched again before its task finishes
        scheduler.dispatch();
        Assertions.assertFalse(scheduler.isInFlight(jobId));
        Assertions.assertEquals(1, env.pool.getStarted().size());

        ReorgTask task = env.pool.getLastStarted();
        env.pool.finish(task.getKey(), ReorgResult.completed(11));
        waitUntil(() -> isFinished(jobId), false);

        Assertions.assertEquals(JobState.DONE, env.getJob(jobId).getState());
        Assertions.assertEquals(11, env.getJob(jobId).getRowCount());
        Assertions.assertFalse(scheduler.isWaitingReorg(jobId));
    }

    @Test
    public void testNothingRunsWithoutOwnership() throws Exception {
        long jobId = submitAddColumn(TABLE_ID, "c3");
        env.election.resign();

        scheduler.runOneCycle();
        Thread.sleep(100);

        Assertions.assertFalse(scheduler.isInFlight(jobId));
        Assertions.assertEquals(JobState.QUEUEING, env.getJob(jobId).getState());
        Assertions.assertEquals(0, env.getSchemaVersion());
    }

    @Test
    public void testOwnerLossStopsLocalReorgWork() throws Exception {
        long jobId = env.mgr.submitJob(ActionType.ADD_INDEX, DB_ID, TABLE_ID, null,
                new AddIndexArgs("idx_name", Lists.newArrayList("name"), false, false));
        scheduler.dispatch();
        waitUntil(() -> scheduler.isWaitingReorg(jobId), false);
        ReorgTask task = env.pool.getLastStarted();

        env.election.resign();

        Assertions.assertFalse(scheduler.isWaitingReorg(jobId));
        Assertions.assertNull(env.reorgContexts.get(task.getKey()));
        Assertions.assertFalse(env.pool.isRunning(jobId));
        // the snapshot stays with the job for the next owner
        Assertions.assertEquals(task.getSnapshotVer(), env.getJob(jobId).getSnapshotVer());
    }
}
