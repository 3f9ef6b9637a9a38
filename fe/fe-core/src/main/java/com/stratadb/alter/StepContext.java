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
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.meta.MetadataStore;
import com.stratadb.task.ReorgContextManager;
import com.stratadb.task.ReorgTask;

import java.util.List;

/**
 * What one step of a job works on: the job, a private copy of its table and the collaborators it may call.
 * Handlers mutate the job and the table in place; the runner commits both when the step succeeds and throws
 * them away otherwise.
 */
public class StepContext {
    private final AlterJob job;
    private TableMeta table;
    private final long tableVersion;
    private boolean tableDropped;
    private final long schemaVersion;
    private final MetadataStore store;
    private final ReorgContextManager reorgContexts;
    private final List<ReorgTask> cleanupTasks;

    public StepContext(AlterJob job, TableMeta table, long tableVersion, long schemaVersion, MetadataStore store,
                       ReorgContextManager reorgContexts) {
        this(job, table, tableVersion, schemaVersion, store, reorgContexts, Lists.newArrayList());
    }

    private StepContext(AlterJob job, TableMeta table, long tableVersion, long schemaVersion, MetadataStore store,
                        ReorgContextManager reorgContexts, List<ReorgTask> cleanupTasks) {
        this.job = job;
        this.table = table;
        this.tableVersion = tableVersion;
        this.schemaVersion = schemaVersion;
        this.store = store;
        this.reorgContexts = reorgContexts;
        this.cleanupTasks = cleanupTasks;
    }

    /**
     * A context for a sub-job proxy, sharing the table and the pending cleanups of this one.
     */
    public StepContext forSubJob(AlterJob proxy) {
        return new StepContext(proxy, table, tableVersion, schemaVersion, store, reorgContexts, cleanupTasks);
    }

    public AlterJob getJob() {
        return job;
    }

    public TableMeta getTable() {
        return table;
    }

    public TableMeta requireTable() throws AlterCancelException {
        if (table == null) {
            throw new AlterCancelException(ErrorCode.ERR_BAD_TABLE_ERROR, job.getTableName());
        }
        return table;
    }

    public void createTable(TableMeta table) {
        this.table = table;
    }

    public void dropTable() {
        this.tableDropped = true;
    }

    public boolean isTableDropped() {
        return tableDropped;
    }

    public long getTableVersion() {
        return tableVersion;
    }

    public long getSchemaVersion() {
        return schemaVersion;
    }

    public MetadataStore getStore() {
        return store;
    }

    public long allocateId() throws MetaStoreException {
        return store.allocateId();
    }

    public ReorgContextManager getReorgContexts() {
        return reorgContexts;
    }

    public String getReorgKey() {
        return ReorgTask.keyOf(job.getId(), job.getSubJobSeq());
    }

    public ReorgTask newReorgTask(ReorgTask.Kind kind, long elementId, List<String> elementNames) {
        return new ReorgTask(job.getId(), job.getSubJobSeq(), kind, job.getDbId(), job.getTableId(), elementId,
                elementNames, job.getSnapshotVer());
    }

    /**
     * Schedules a cleanup to run once this step is committed.
     */
    public void scheduleCleanup(ReorgTask task) {
        cleanupTasks.add(task);
    }

    public List<ReorgTask> getCleanupTasks() {
        return cleanupTasks;
    }
}
