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

public class Config extends ConfigBase {

    /**
     * The interval of the alter job scheduler. Each cycle the owner dispatches runnable DDL jobs to the worker pool.
     */
    @ConfField(mutable = true)
    public static int alter_scheduler_interval_millisecond = 1000;

    /**
     * Max number of threads executing DDL job steps on the owner.
     * Jobs on distinct tables run concurrently up to this bound.
     */
    @ConfField
    public static int alter_max_worker_threads = 4;

    @ConfField
    public static int alter_max_worker_queue_size = 4096;

    /**
     * A job whose errors (failed steps, failed rollback attempts) exceed this limit is cancelled:
     * a running job is turned into a cancelling one, a rolling back job is forced to CANCELLED.
     */
    @ConfField(mutable = true, aliases = {"alter_job_error_count_limit"})
    public static long ddl_error_count_limit = 512;

    @ConfField(mutable = true, comment = "lease of the DDL owner, in milliseconds")
    public static long ddl_owner_lease_ms = 5000;

    /**
     * How long the owner waits for live nodes to acknowledge a new schema version before moving on.
     * On timeout the owner proceeds, the lagging nodes converge eventually.
     */
    @ConfField(mutable = true)
    public static long schema_version_sync_timeout_ms = 3000;

    @ConfField(mutable = true)
    public static long schema_version_watch_interval_ms = 200;

    /**
     * A job waiting for its reorg workers is re-checked after this timeout even without a completion signal.
     */
    @ConfField(mutable = true)
    public static long alter_reorg_wait_timeout_ms = 5000;

    /**
     * Finished DDL jobs are kept in history for this many seconds.
     */
    @ConfField(mutable = true)
    public static int history_job_keep_max_second = 7 * 24 * 3600;

    @ConfField(comment = "name of the registered DDL callback hook, default_hook or ctc_hook")
    public static String ddl_callback_hook = "default_hook";

    @ConfField(mutable = true)
    public static int ddl_meta_conflict_retry_times = 10;

    @ConfField
    public static int reorg_worker_threads = 4;
}
