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

/**
 * Runs the long data migrations of DDL jobs in the background.
 */
public interface ReorgWorkerPool {

    /**
     * Starts the task asynchronously. The listener is called once with the outcome, unless the task is stopped.
     * Starting a task whose key is already running is a no-op.
     */
    void startBackfill(ReorgTask task, ReorgListener listener);

    /**
     * Stops every running task of the job. The listeners of stopped tasks are not called.
     */
    void stop(long jobId);

    /**
     * Schedules the removal of data left behind by a dropped or rolled back element. Fire and forget.
     */
    void scheduleCleanup(ReorgTask task);

    boolean isRunning(long jobId);

    void stopAll();
}
