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

package com.stratadb.meta;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.stratadb.alter.AlterJob;
import com.stratadb.catalog.TableMeta;

import java.util.List;

/**
 * A set of writes committed atomically by {@link MetadataStore#commit(MetaTxn)}.
 * <p>
 * Each write names the record version it expects, 0 meaning the record must not exist yet.
 * If any expectation fails nothing is applied and the commit throws {@link MetaConflictException}.
 * At most one schema version bump is done per transaction.
 */
public class MetaTxn {

    public static class TableWrite {
        private final long dbId;
        private final long tableId;
        // null drops the table
        private final TableMeta table;
        private final long expectedVersion;

        TableWrite(long dbId, long tableId, TableMeta table, long expectedVersion) {
            this.dbId = dbId;
            this.tableId = tableId;
            this.table = table;
            this.expectedVersion = expectedVersion;
        }

        public long getDbId() {
            return dbId;
        }

        public long getTableId() {
            return tableId;
        }

        public TableMeta getTable() {
            return table;
        }

        public long getExpectedVersion() {
            return expectedVersion;
        }
    }

    public static class JobWrite {
        private final AlterJob job;
        private final long expectedVersion;
        private final boolean moveToHistory;

        JobWrite(AlterJob job, long expectedVersion, boolean moveToHistory) {
            this.job = job;
            this.expectedVersion = expectedVersion;
            this.moveToHistory = moveToHistory;
        }

        public AlterJob getJob() {
            return job;
        }

        public long getExpectedVersion() {
            return expectedVersion;
        }

        public boolean isMoveToHistory() {
            return moveToHistory;
        }
    }

    private final List<TableWrite> tableWrites = Lists.newArrayList();
    private final List<JobWrite> jobWrites = Lists.newArrayList();
    private long bumpForJobId = -1;

    public MetaTxn putTable(TableMeta table, long expectedVersion) {
        tableWrites.add(new TableWrite(table.getDbId(), table.getId(), table, expectedVersion));
        return this;
    }

    public MetaTxn dropTable(long dbId, long tableId, long expectedVersion) {
        Preconditions.checkArgument(expectedVersion > 0, "can not drop a table that was never read");
        tableWrites.add(new TableWrite(dbId, tableId, null, expectedVersion));
        return this;
    }

    public MetaTxn putJob(AlterJob job, long expectedVersion) {
        jobWrites.add(new JobWrite(job, expectedVersion, false));
        return this;
    }

    public MetaTxn finishJob(AlterJob job, long expectedVersion) {
        Preconditions.checkArgument(job.isDone(), "job %s is not finished", job.getId());
        jobWrites.add(new JobWrite(job, expectedVersion, true));
        return this;
    }

    public MetaTxn bumpSchemaVersion(long jobId) {
        this.bumpForJobId = jobId;
        return this;
    }

    public boolean isBumpSchemaVersion() {
        return bumpForJobId >= 0;
    }

    public long getBumpForJobId() {
        return bumpForJobId;
    }

    public List<TableWrite> getTableWrites() {
        return tableWrites;
    }

    public List<JobWrite> getJobWrites() {
        return jobWrites;
    }

    public boolean isEmpty() {
        return tableWrites.isEmpty() && jobWrites.isEmpty() && !isBumpSchemaVersion();
    }
}
