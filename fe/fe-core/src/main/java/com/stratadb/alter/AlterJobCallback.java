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

/**
 * Hook points around the execution of DDL jobs, used by tests and diagnostics to observe or slow down the state
 * machine. Implementations must be thread safe, they are called from the alter workers.
 */
public interface AlterJobCallback {

    String getName();

    /**
     * Called before a step of the job, with the job as read from the store.
     */
    default void onJobRunBefore(AlterJob job) {
    }

    /**
     * Called after a step of the job, with the job as committed.
     */
    default void onJobRunAfter(AlterJob job) {
    }

    /**
     * Called after a changed job record was committed.
     */
    default void onJobUpdated(AlterJob job) {
    }

    /**
     * Called on the owner once a step bumped the schema version and the nodes had the chance to load it.
     */
    default void onSchemaStateChanged(long schemaVersion) {
    }

    /**
     * Called at the end of each step, with the error of the step if any.
     */
    default void onChanged(Throwable error) {
    }

    /**
     * Called on every node each time it loaded a new schema version.
     */
    default void onWatched(long schemaVersion) {
    }

    default void onGetJobBefore(long jobId) {
    }

    default void onGetJobAfter(long jobId, AlterJob job) {
    }
}
