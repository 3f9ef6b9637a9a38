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

import com.google.common.collect.Lists;
import com.stratadb.alter.ActionType;
import com.stratadb.alter.AlterJob;
import com.stratadb.alter.JobState;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.TableMeta;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LocalMetadataStoreTest {
    private LocalMetadataStore store;

    @BeforeEach
    public void setUp() {
        store = new LocalMetadataStore();
    }

    private static TableMeta newTable(long id, String name) {
        return new TableMeta(1L, id, name, Lists.newArrayList(new ColumnMeta("id", "BIGINT", false)));
    }

    @Test
    public void testAllocateIdIsMonotonic() throws Exception {
        long first = store.allocateId();
        Assertions.assertEquals(1000L, first);
        Assertions.assertEquals(first + 1, store.allocateId());
        Assertions.assertEquals(7L, new LocalMetadataStore(7L).allocateId());
    }

    @Test
    public void testTableVersionIncreasesOnEveryWrite() throws Exception {
        TableMeta table = newTable(10L, "t1");
        store.commit(new MetaTxn().putTable(table, 0));
        Versioned<TableMeta> loaded = store.getTable(1L, 10L);
        Assertions.assertEquals(1, loaded.getVersion());
        Assertions.assertEquals("t1", loaded.getValue().getName());

        table.setName("t2");
        store.commit(new MetaTxn().putTable(table, 1));
        Assertions.assertEquals(2, store.getTable(1L, 10L).getVersion());
        Assertions.assertNull(store.getTable(2L, 10L));
        Assertions.assertEquals(1, store.listTables(1L).size());
        Assertions.assertTrue(store.listTables(2L).isEmpty());
    }

    @Test
    public void testStaleWriteConflictsAndAppliesNothing() throws Exception {
        store.commit(new MetaTxn().putTable(newTable(10L, "t1"), 0));
        AlterJob job = new AlterJob(100L, ActionType.RENAME_TABLE, 1L, 10L, "t1", null);
        store.commit(new MetaTxn().putJob(job, 0));

        job.setState(JobState.RUNNING);
        MetaTxn stale = new MetaTxn()
                .putJob(job, 1)
                .putTable(newTable(10L, "renamed"), 0)
                .bumpSchemaVersion(job.getId());
        Assertions.assertThrows(MetaConflictException.class, () -> store.commit(stale));

        Assertions.assertEquals("t1", store.getTable(1L, 10L).getValue().getName());
        Assertions.assertEquals(JobState.QUEUEING, store.getJob(100L).getValue().getState());
        Assertions.assertEquals(1, store.getJob(100L).getVersion());
        Assertions.assertEquals(0, store.getSchemaVersion());
    }

    @Test
    public void testBumpRecordsTheJobOfEachVersion() throws Exception {
        AlterJob job = new AlterJob(100L, ActionType.ADD_COLUMN, 1L, 10L, "t1", null);
        CommitResult result = store.commit(new MetaTxn().putJob(job, 0));
        Assertions.assertFalse(result.isVersionBumped());
        Assertions.assertEquals(0, result.getSchemaVersion());

        result = store.commit(new MetaTxn().putJob(job, 1).bumpSchemaVersion(100L));
        Assertions.assertTrue(result.isVersionBumped());
        Assertions.assertEquals(1, result.getSchemaVersion());
        Assertions.assertEquals(100L, store.getJobIdOfVersion(1));
        Assertions.assertEquals(-1L, store.getJobIdOfVersion(2));
    }

    @Test
    public void testFinishedJobMovesToHistory() throws Exception {
        AlterJob job = new AlterJob(100L, ActionType.ADD_COLUMN, 1L, 10L, "t1", null);
        store.commit(new MetaTxn().putJob(job, 0));
        job.finish(JobState.DONE);
        store.commit(new MetaTxn().finishJob(job, 1));

        Assertions.assertNull(store.getJob(100L));
        Assertions.assertTrue(store.listJobs().isEmpty());
        Assertions.assertEquals(JobState.DONE, store.getHistoryJob(100L).getState());
        Assertions.assertEquals(1, store.listHistoryJobs().size());

        // a finished job can not be written back as active
        Assertions.assertThrows(MetaConflictException.class, () -> store.commit(new MetaTxn().putJob(job, 0)));

        store.removeHistoryJob(100L);
        Assertions.assertNull(store.getHistoryJob(100L));
    }

    @Test
    public void testDropTable() throws Exception {
        store.commit(new MetaTxn().putTable(newTable(10L, "t1"), 0));
        Assertions.assertThrows(MetaConflictException.class,
                () -> store.commit(new MetaTxn().dropTable(1L, 10L, 5)));
        store.commit(new MetaTxn().dropTable(1L, 10L, 1));
        Assertions.assertNull(store.getTable(1L, 10L));
        Assertions.assertNull(store.getRawTable(10L));
    }

    @Test
    public void testActiveJobsAreListedInIdOrder() throws Exception {
        store.commit(new MetaTxn().putJob(new AlterJob(300L, ActionType.ADD_COLUMN, 1L, 10L, "t1", null), 0));
        store.commit(new MetaTxn().putJob(new AlterJob(100L, ActionType.ADD_COLUMN, 1L, 10L, "t1", null), 0));
        store.commit(new MetaTxn().putJob(new AlterJob(200L, ActionType.ADD_COLUMN, 1L, 11L, "t2", null), 0));

        Assertions.assertEquals(Lists.newArrayList(100L, 200L, 300L),
                Lists.transform(store.listJobs(), v -> v.getValue().getId()));
    }
}
