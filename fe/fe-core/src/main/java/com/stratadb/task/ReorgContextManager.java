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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentMap;
import java.util.function.LongConsumer;

/**
 * Owner side bookkeeping of the reorg tasks started for jobs. A job step looks up the context of its task to
 * know whether the backfill is still running, done or failed. Contexts only live in memory: after an owner change
 * a job finds no context and starts its task again with the persisted snapshot version.
 */
public class ReorgContextManager implements ReorgListener {
    private static final Logger LOG = LogManager.getLogger(ReorgContextManager.class);

    public enum Status {
        RUNNING,
        DONE,
        FAILED
    }

    public static class ReorgContext {
        private final ReorgTask task;
        private volatile Status status = Status.RUNNING;
        private volatile ReorgResult result;

        ReorgContext(ReorgTask task) {
            this.task = task;
        }

        public ReorgTask getTask() {
            return task;
        }

        public Status getStatus() {
            return status;
        }

        public ReorgResult getResult() {
            return result;
        }
    }

    private final ReorgWorkerPool pool;
    private final ConcurrentMap<String, ReorgContext> contexts = Maps.newConcurrentMap();
    private volatile LongConsumer jobWaker = jobId -> { };

    public ReorgContextManager(ReorgWorkerPool pool) {
        this.pool = pool;
    }

    public ReorgWorkerPool getPool() {
        return pool;
    }

    /**
     * @param jobWaker called with the job id when a task of the job finishes
     */
    public void setJobWaker(LongConsumer jobWaker) {
        this.jobWaker = jobWaker;
    }

    public void start(ReorgTask task) {
        ReorgContext context = new ReorgContext(task);
        contexts.put(task.getKey(), context);
        pool.startBackfill(task, this);
    }

    public ReorgContext get(String key) {
        return contexts.get(key);
    }

    public void remove(String key) {
        contexts.remove(key);
    }

    /**
     * Stops the running tasks of the job and forgets their contexts.
     */
    public void stopJob(long jobId) {
        pool.stop(jobId);
        contexts.values().removeIf(c -> c.task.getJobId() == jobId);
    }

    public boolean isRunning(long jobId) {
        return contexts.values().stream().anyMatch(c -> c.task.getJobId() == jobId && c.status == Status.RUNNING);
    }

    public void clear() {
        contexts.clear();
    }

    @Override
    public void onReorgFinished(ReorgTask task, ReorgResult result) {
        ReorgContext context = contexts.get(task.getKey());
        if (context == null || !context.task.equals(task)) {
            LOG.info("ignore result {} of stale reorg task {}", result, task);
            return;
        }
        context.result = result;
        context.status = result.isSuccess() ? Status.DONE : Status.FAILED;
        jobWaker.accept(task.getJobId());
    }
}
