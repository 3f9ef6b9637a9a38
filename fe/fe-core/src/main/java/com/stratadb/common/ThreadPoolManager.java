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

package com.stratadb.common;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * ThreadPoolManager is a helper class for constructing daemon thread pools with a bounded queue.
 * A rejected task is logged, the caller that submitted it sees a RejectedExecutionException.
 * <p>
 * All threads created here are daemon threads named after the pool, e.g. alter_pool-3.
 */
public class ThreadPoolManager {
    private static final Logger LOG = LogManager.getLogger(ThreadPoolManager.class);

    private static final long KEEP_ALIVE_TIME = 60L;

    /**
     * Threads are created on demand up to maxNumThread and exit after staying idle for a minute.
     */
    public static ThreadPoolExecutor newDaemonCacheThreadPool(int maxNumThread, int queueSize, String poolName) {
        ThreadPoolExecutor executor = newDaemonThreadPool(maxNumThread, maxNumThread, KEEP_ALIVE_TIME,
                TimeUnit.SECONDS, new LinkedBlockingQueue<>(queueSize), new LogAbortPolicy(poolName), poolName);
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    public static ThreadPoolExecutor newDaemonFixedThreadPool(int numThread, int queueSize, String poolName) {
        return newDaemonThreadPool(numThread, numThread, 0, TimeUnit.SECONDS, new LinkedBlockingQueue<>(queueSize),
                new LogAbortPolicy(poolName), poolName);
    }

    public static ThreadPoolExecutor newDaemonThreadPool(int corePoolSize,
                                                         int maximumPoolSize,
                                                         long keepAliveTime,
                                                         TimeUnit unit,
                                                         BlockingQueue<Runnable> workQueue,
                                                         RejectedExecutionHandler handler,
                                                         String poolName) {
        ThreadFactory threadFactory = namedThreadFactory(poolName);
        return new ThreadPoolExecutor(corePoolSize, maximumPoolSize, keepAliveTime, unit, workQueue, threadFactory,
                handler);
    }

    /**
     * Create a thread factory that names threads with a prefix and also sets the threads to daemon.
     */
    private static ThreadFactory namedThreadFactory(String poolName) {
        return new ThreadFactoryBuilder().setDaemon(true).setNameFormat(poolName + "-%d").build();
    }

    static class LogAbortPolicy extends ThreadPoolExecutor.AbortPolicy {
        private final String threadPoolName;

        LogAbortPolicy(String threadPoolName) {
            this.threadPoolName = threadPoolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            LOG.warn("Task {} is rejected by the thread pool {}, active threads: {}, queue size: {}",
                    r.toString(), threadPoolName, executor.getActiveCount(), executor.getQueue().size());
            super.rejectedExecution(r, executor);
        }
    }
}
