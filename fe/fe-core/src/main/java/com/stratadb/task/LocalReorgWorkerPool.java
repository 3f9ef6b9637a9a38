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

package com.stratadb.task;

import com.google.common.collect.Maps;
import com.stratadb.common.ThreadPoolManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ReorgWorkerPool} running tasks on local daemon threads through a {@link BackfillExecutor}.
 */
public class LocalReorgWorkerPool implements ReorgWorkerPool {
    private static final Logger LOG = LogManager.getLogger(LocalReorgWorkerPool.class);

    private static class RunningTask {
        private final ReorgTask task;
        private final AtomicBoolean stopped = new AtomicBoolean(false);
        private volatile Future<?> future;

        RunningTask(ReorgTask task) {
            this.task = task;
        }
    }

    private final BackfillExecutor executor;
    private final ThreadPoolExecutor pool;
    private final ConcurrentMap<String, RunningTask> running = Maps.newConcurrentMap();

    public LocalReorgWorkerPool(String name, int numThreads, BackfillExecutor executor) {
        this.executor = executor;
        this.pool = ThreadPoolManager.newDaemonFixedThreadPool(numThreads, 1024, name);
    }

    @Override
    public void startBackfill(ReorgTask task, ReorgListener listener) {
        RunningTask runningTask = new RunningTask(task);
        if (running.putIfAbsent(task.getKey(), runningTask) != null) {
            LOG.info("reorg task {} is already running", task);
            return;
        }

        LOG.info("start reorg task {}", task);
        try {
            runningTask.future = pool.submit(() -> runTask(runningTask, listener));
        } catch (RejectedExecutionException e) {
            running.remove(task.getKey(), runningTask);
            listener.onReorgFinished(task, ReorgResult.failed("reorg worker pool rejected task " + task.getKey()));
        }
    }

    private void runTask(RunningTask runningTask, ReorgListener listener) {
        ReorgTask task = runningTask.task;
        ReorgResult result;
        try {
            long rows = executor.execute(task, runningTask.stopped::get);
            result = ReorgResult.completed(rows);
        } catch (ReorgException e) {
            result = ReorgResult.failed(e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("reorg task {} failed unexpectedly", task, e);
            result = ReorgResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            running.remove(task.getKey(), runningTask);
        }

        if (runningTask.stopped.get()) {
            LOG.info("reorg task {} was stopped, drop its result {}", task, result);
            return;
        }
        LOG.info("reorg task {} finished: {}", task, result);
        listener.onReorgFinished(task, result);
    }

    @Override
    public void stop(long jobId) {
        for (Map.Entry<String, RunningTask> entry : running.entrySet()) {
            RunningTask runningTask = entry.getValue();
            if (runningTask.task.getJobId() != jobId) {
                continue;
            }
            stopTask(entry.getKey(), runningTask);
        }
    }

    private void stopTask(String key, RunningTask runningTask) {
        runningTask.stopped.set(true);
        Future<?> future = runningTask.future;
        if (future != null) {
            future.cancel(true);
        }
        running.remove(key, runningTask);
        LOG.info("stop reorg task {}", runningTask.task);
    }

    @Override
    public void scheduleCleanup(ReorgTask task) {
        try {
            pool.submit(() -> {
                try {
                    executor.cleanup(task);
                    LOG.info("reorg cleanup {} finished", task);
                } catch (ReorgException e) {
                    LOG.warn("reorg cleanup {} failed, the data is left to the storage garbage collector", task, e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("reorg cleanup {} rejected, the data is left to the storage garbage collector", task);
        }
    }

    @Override
    public boolean isRunning(long jobId) {
        return running.values().stream().anyMatch(t -> t.task.getJobId() == jobId);
    }

    @Override
    public void stopAll() {
        for (Map.Entry<String, RunningTask> entry : running.entrySet()) {
            stopTask(entry.getKey(), entry.getValue());
        }
    }

    public void shutdown() {
        stopAll();
        pool.shutdownNow();
    }
}
