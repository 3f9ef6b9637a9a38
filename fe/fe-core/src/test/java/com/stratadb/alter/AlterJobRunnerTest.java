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
import com.stratadb.alter.AlterJobArgs.AddCheckConstraintArgs;
import com.stratadb.alter.AlterJobArgs.AddColumnArgs;
import com.stratadb.alter.AlterJobArgs.AddIndexArgs;
import com.stratadb.alter.AlterJobArgs.CreateTableArgs;
import com.stratadb.alter.AlterJobArgs.DropColumnArgs;
import com.stratadb.alter.AlterJobArgs.DropIndexArgs;
import com.stratadb.alter.AlterJobArgs.ModifyColumnArgs;
import com.stratadb.alter.AlterJobArgs.PartitionArgs;
import com.stratadb.alter.AlterJobArgs.RenameTableArgs;
import com.stratadb.alter.action.ModifyColumnHandler;
import com.stratadb.catalog.CheckConstraint;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.IndexMeta;
import com.stratadb.catalog.PartitionDef;
import com.stratadb.catalog.PartitionInfo;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.Config;
import com.stratadb.meta.LocalMetadataStore;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.meta.MetaTxn;
import com.stratadb.meta.Versioned;
import com.stratadb.task.ReorgResult;
import com.stratadb.task.ReorgTask;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.stratadb.alter.AlterJobTestEnv.DB_ID;
import static com.stratadb.alter.AlterJobTestEnv.TABLE_ID;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

public class AlterJobRunnerTest {
    private long oldErrorCountLimit;
    private AlterJobTestEnv env;

    @BeforeEach
    public void setUp() throws Exception {
        oldErrorCountLimit = Config.ddl_error_count_limit;
        env = new AlterJobTestEnv();
    }

    @AfterEach
    public void tearDown() {
        Config.ddl_error_count_limit = oldErrorCountLimit;
    }

    private long submitAddIndex(String indexName, String column) throws Exception {
        return env.mgr.submitJob(ActionType.ADD_INDEX, DB_ID, TABLE_ID, null,
                new AddIndexArgs(indexName, Lists.newArrayList(column), false, false));
    }

    private void assertConsecutiveVersions() throws MetaStoreException {
        List<Long> versions = env.publishedVersions;
        for (int i = 0; i < versions.size(); i++) {
            Assertions.assertEquals(i + 1, (long) versions.get(i));
        }
        Assertions.assertEquals(env.getSchemaVersion(), versions.size());
    }

    @Test
    public void testAddIndex() throws Exception {
        env.createDefaultTable();
        long jobId = submitAddIndex("idx_name", "name");

        StepResult result = env.runner.runJob(jobId);
        Assertions.assertTrue(result.isWaitingReorg());
        Assertions.assertEquals(3, env.getSchemaVersion());
        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.RUNNING, job.getState());
        Assertions.assertEquals(SchemaState.WRITE_REORGANIZATION, job.getSchemaState());
        Assertions.assertEquals(3, job.getSnapshotVer());
        Assertions.assertEquals(SchemaState.WRITE_REORGANIZATION,
                env.getTable().findIndex("idx_name").getState());

        ReorgTask task = env.pool.getLastStarted();
        Assertions.assertEquals(ReorgTask.Kind.BACKFILL_INDEX, task.getKind());
        Assertions.assertEquals(3, task.getSnapshotVer());
        Assertions.assertEquals(Lists.newArrayList("idx_name"), task.getElementNames());

        // the task is still running, nothing to commit
        Assertions.assertTrue(env.runner.runJob(jobId).isWaitingReorg());
        Assertions.assertEquals(3, env.getSchemaVersion());

        env.pool.finish(task.getKey(), ReorgResult.completed(42));
        env.runner.runJob(jobId);

        job = env.getJob(jobId);
        Assertions.assertEquals(JobState.DONE, job.getState());
        Assertions.assertEquals(SchemaState.PUBLIC, job.getSchemaState());
        Assertions.assertEquals(42, job.getRowCount());
        Assertions.assertNull(env.queue.getActiveJob(jobId));
        Assertions.assertEquals(SchemaState.PUBLIC, env.getTable().findIndex("idx_name").getState());
        Assertions.assertEquals(4, env.getSchemaVersion());
        Assertions.assertEquals(jobId, env.store.getJobIdOfVersion(4));
        assertConsecutiveVersions();
    }

    @Test
    public void testBackfillFailureRollsBackAddIndex() throws Exception {
        env.createDefaultTable();
        long jobId = submitAddIndex("idx_name", "name");
        env.runner.runJob(jobId);
        long versionBeforeFailure = env.getSchemaVersion();

        env.pool.finish(env.pool.getLastStarted().getKey(), ReorgResult.failed("Duplicate entry 'a'"));
        env.runner.runJob(jobId);

        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.ROLLBACK_DONE, job.getState());
        Assertions.assertEquals(SchemaState.NONE, job.getSchemaState());
        Assertions.assertEquals(RollbackConverter.ROLLBACK_MSG_PREFIX + "Duplicate entry 'a'", job.getErrMsg());
        Assertions.assertEquals(1, job.getErrorCount());
        Assertions.assertNull(env.getTable().findIndex("idx_name"));
        // one bump to regress the index, one to remove it
        Assertions.assertEquals(versionBeforeFailure + 2, env.getSchemaVersion());
        Assertions.assertTrue(env.pool.getStopped().contains(jobId));
        Assertions.assertTrue(env.pool.getCleanups().stream()
                .anyMatch(t -> t.getKind() == ReorgTask.Kind.CLEANUP_INDEX && t.getJobId() == jobId));
        assertConsecutiveVersions();
    }

    @Test
    public void testRollbackGivesUpAfterErrorLimit() throws Exception {
        Config.ddl_error_count_limit = 2;
        LocalMetadataStore store = spy(new LocalMetadataStore());
        boolean[] failBumps = {false};
        doAnswer(invocation -> {
            MetaTxn txn = invocation.getArgument(0);
            if (failBumps[0] && txn.isBumpSchemaVersion()) {
                throw new MetaStoreException("injected bump failure");
            }
            return invocation.callRealMethod();
        }).when(store).commit(any(MetaTxn.class));
        env = new AlterJobTestEnv(store);
        env.createDefaultTable();

        long jobId = submitAddIndex("idx_name", "name");
        env.runner.runJob(jobId);
        env.mgr.cancelJob(jobId);

        // the conversion itself goes through
        env.runner.runOneStep(jobId);
        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.ROLLINGBACK, job.getState());
        Assertions.assertEquals(1, job.getErrorCount());
        Assertions.assertEquals(SchemaState.DELETE_ONLY, env.getTable().findIndex("idx_name").getState());

        failBumps[0] = true;
        StepResult result = env.runner.runOneStep(jobId);
        Assertions.assertEquals(StepResult.Kind.RETRY, result.getKind());
        job = env.getJob(jobId);
        Assertions.assertEquals(JobState.ROLLINGBACK, job.getState());
        Assertions.assertEquals(2, job.getErrorCount());
        Assertions.assertEquals("injected bump failure", job.getErrMsg());

        Assertions.assertNull(env.runner.runOneStep(jobId));
        job = env.getJob(jobId);
        Assertions.assertEquals(JobState.CANCELLED, job.getState());
        Assertions.assertEquals(3, job.getErrorCount());
        Assertions.assertTrue(job.getErrMsg().contains("exceed the limit 2"), job.getErrMsg());
        Assertions.assertNull(env.queue.getActiveJob(jobId));
        // the failed rollback step never reached the table
        Assertions.assertEquals(SchemaState.DELETE_ONLY, env.getTable().findIndex("idx_name").getState());
        Assertions.assertTrue(env.pool.getStopped().stream().filter(id -> id == jobId).count() >= 2);
    }

    @Test
    public void testCancelBeforeFirstStepLeavesMetadataUntouched() throws Exception {
        env.createDefaultTable();
        String tableBefore = env.store.getRawTable(TABLE_ID);
        long jobId = env.mgr.submitJob(ActionType.ADD_COLUMN, DB_ID, TABLE_ID, null,
                new AddColumnArgs(new ColumnMeta("c3", "INT", true), null));
        env.mgr.cancelJob(jobId);

        env.runToEnd(jobId);

        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.CANCELLED, job.getState());
        Assertions.assertEquals("Cancelled DDL job", job.getErrMsg());
        Assertions.assertEquals(0, env.getSchemaVersion());
        Assertions.assertEquals(tableBefore, env.store.getRawTable(TABLE_ID));
    }

    @Test
    public void testCancelAddColumnInWriteOnly() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.ADD_COLUMN, DB_ID, TABLE_ID, null,
                new AddColumnArgs(new ColumnMeta("c3", "INT", true), "id"));
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        TableMeta table = env.getTable();
        Assertions.assertEquals(1, table.indexOfColumn("c3"));
        Assertions.assertEquals(SchemaState.WRITE_ONLY, table.findColumn("c3").getState());

        env.mgr.cancelJob(jobId);
        env.runner.runOneStep(jobId);
        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.ROLLINGBACK, job.getState());
        Assertions.assertEquals(SchemaState.DELETE_ONLY, env.getTable().findColumn("c3").getState());
        Assertions.assertEquals("c3", job.getArgs(DropColumnArgs.class).getColumnName());

        job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.ROLLBACK_DONE, job.getState());
        Assertions.assertNull(env.getTable().findColumn("c3"));
        assertConsecutiveVersions();
    }

    @Test
    public void testAddColumnRunsThroughAllStates() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.ADD_COLUMN, DB_ID, TABLE_ID, null,
                new AddColumnArgs(new ColumnMeta("c3", "INT", true), null));
        List<SchemaState> seen = Lists.newArrayList();
        for (int i = 0; i < 10; i++) {
            if (env.runner.runOneStep(jobId) == null) {
                break;
            }
            seen.add(env.getJob(jobId).getSchemaState());
        }
        Assertions.assertEquals(Lists.newArrayList(SchemaState.NONE, SchemaState.DELETE_ONLY, SchemaState.WRITE_ONLY,
                SchemaState.WRITE_REORGANIZATION, SchemaState.PUBLIC), seen);
        Assertions.assertEquals(JobState.DONE, env.getJob(jobId).getState());
        Assertions.assertEquals(4, env.getSchemaVersion());
    }

    @Test
    public void testAddDuplicatedColumnIsCancelled() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.ADD_COLUMN, DB_ID, TABLE_ID, null,
                new AddColumnArgs(new ColumnMeta("NAME", "INT", true), null));
        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.CANCELLED, job.getState());
        Assertions.assertEquals(RollbackConverter.ROLLBACK_MSG_PREFIX + "Duplicate column name 'NAME'",
                job.getErrMsg());
        Assertions.assertEquals(0, env.getSchemaVersion());
    }

    @Test
    public void testCancelRefusedPastPointOfNoReturn() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.DROP_COLUMN, DB_ID, TABLE_ID, null, new DropColumnArgs("name"));
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        Assertions.assertEquals(SchemaState.WRITE_ONLY, env.getTable().findColumn("name").getState());

        env.mgr.cancelJob(jobId);
        env.runner.runOneStep(jobId);
        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.RUNNING, job.getState());
        Assertions.assertEquals("This job:" + jobId + " is almost finished, can't be cancelled now",
                job.getWarning());

        job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.DONE, job.getState());
        Assertions.assertEquals(SchemaState.NONE, job.getSchemaState());
        Assertions.assertNull(env.getTable().findColumn("name"));
        Assertions.assertTrue(env.pool.getCleanups().stream()
                .anyMatch(t -> t.getKind() == ReorgTask.Kind.CLEANUP_COLUMN));
    }

    @Test
    public void testRefusedErrorWaitsForNextTick() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.DROP_COLUMN, DB_ID, TABLE_ID, null, new DropColumnArgs("name"));
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        Assertions.assertEquals(SchemaState.WRITE_ONLY, env.getTable().findColumn("name").getState());

        // the column disappears behind the job's back
        Versioned<TableMeta> stored = env.store.getTable(DB_ID, TABLE_ID);
        TableMeta table = stored.getValue();
        table.removeColumn("name");
        env.store.commit(new MetaTxn().putTable(table, stored.getVersion()));

        StepResult result = env.runner.runJob(jobId);
        Assertions.assertEquals(StepResult.Kind.RETRY, result.getKind());
        Assertions.assertTrue(result.isYield());
        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.RUNNING, job.getState());
        Assertions.assertEquals(1, job.getErrorCount());
        Assertions.assertEquals("Can't DROP 'name'; check that column/key exists", job.getErrMsg());

        env.runner.runJob(jobId);
        Assertions.assertEquals(2, env.getJob(jobId).getErrorCount());
        Assertions.assertEquals(JobState.RUNNING, env.getJob(jobId).getState());
    }

    @Test
    public void testDropColumnDropsItsSingleColumnIndex() throws Exception {
        TableMeta table = AlterJobTestEnv.newTable(TABLE_ID, "t1");
        table.addIndex(new IndexMeta("idx_name", Lists.newArrayList("name"), false, false));
        env.createTable(table);

        long jobId = env.mgr.submitJob(ActionType.DROP_COLUMN, DB_ID, TABLE_ID, null, new DropColumnArgs("name"));
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        Assertions.assertEquals(SchemaState.WRITE_ONLY, env.getTable().findIndex("idx_name").getState());

        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.DONE, job.getState());
        Assertions.assertNull(env.getTable().findIndex("idx_name"));
        Assertions.assertEquals(Lists.newArrayList("idx_name"), job.getArgs(DropColumnArgs.class).getIndexNames());
    }

    @Test
    public void testDropColumnCoveredByCompositeIndexIsCancelled() throws Exception {
        TableMeta table = AlterJobTestEnv.newTable(TABLE_ID, "t1");
        table.addIndex(new IndexMeta("idx_id_name", Lists.newArrayList("id", "name"), false, false));
        env.createTable(table);

        long jobId = env.mgr.submitJob(ActionType.DROP_COLUMN, DB_ID, TABLE_ID, null, new DropColumnArgs("name"));
        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.CANCELLED, job.getState());
        Assertions.assertNotNull(env.getTable().findColumn("name"));
        Assertions.assertEquals(0, env.getSchemaVersion());
    }

    @Test
    public void testAddPrimaryKeyPreventsNullInsertUntilPublic() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.ADD_PRIMARY_KEY, DB_ID, TABLE_ID, null,
                new AddIndexArgs("PRIMARY", Lists.newArrayList("name"), true, true));
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        ColumnMeta column = env.getTable().findColumn("name");
        Assertions.assertTrue(column.isNullable());
        Assertions.assertTrue(column.isPreventNullInsert());

        env.runner.runJob(jobId);
        env.pool.finish(env.pool.getLastStarted().getKey(), ReorgResult.completed(0));
        env.runner.runJob(jobId);

        Assertions.assertEquals(JobState.DONE, env.getJob(jobId).getState());
        column = env.getTable().findColumn("name");
        Assertions.assertFalse(column.isNullable());
        Assertions.assertFalse(column.isPreventNullInsert());
        Assertions.assertTrue(env.getTable().getPrimaryKey().isPrimary());
    }

    @Test
    public void testCancelAddPrimaryKeyClearsNullFlag() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.ADD_PRIMARY_KEY, DB_ID, TABLE_ID, null,
                new AddIndexArgs("PRIMARY", Lists.newArrayList("name"), true, true));
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        env.mgr.cancelJob(jobId);

        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.ROLLBACK_DONE, job.getState());
        Assertions.assertEquals("PRIMARY", job.getArgs(DropIndexArgs.class).getIndexName());
        Assertions.assertNull(env.getTable().getPrimaryKey());
        Assertions.assertFalse(env.getTable().findColumn("name").isPreventNullInsert());
    }

    @Test
    public void testDropIndex() throws Exception {
        TableMeta table = AlterJobTestEnv.newTable(TABLE_ID, "t1");
        table.addIndex(new IndexMeta("idx_name", Lists.newArrayList("name"), false, false));
        env.createTable(table);

        long jobId = env.mgr.submitJob(ActionType.DROP_INDEX, DB_ID, TABLE_ID, null,
                new DropIndexArgs("idx_name", false));
        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.DONE, job.getState());
        Assertions.assertEquals(SchemaState.NONE, job.getSchemaState());
        Assertions.assertNull(env.getTable().findIndex("idx_name"));
        Assertions.assertEquals(4, env.getSchemaVersion());
    }

    @Test
    public void testModifyColumnTypeBackfillsChangingColumn() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.MODIFY_COLUMN, DB_ID, TABLE_ID, null,
                new ModifyColumnArgs("name", new ColumnMeta("name", "VARCHAR(64)", true)));
        env.runner.runJob(jobId);

        String changingName = ModifyColumnHandler.CHANGING_COLUMN_PREFIX + "name";
        TableMeta table = env.getTable();
        ColumnMeta changing = table.findColumn(changingName);
        Assertions.assertTrue(changing.isHidden());
        Assertions.assertEquals(2, table.indexOfColumn(changingName));
        Assertions.assertEquals(SchemaState.WRITE_REORGANIZATION, changing.getState());
        ReorgTask task = env.pool.getLastStarted();
        Assertions.assertEquals(ReorgTask.Kind.BACKFILL_COLUMN, task.getKind());

        env.pool.finish(task.getKey(), ReorgResult.completed(7));
        env.runner.runJob(jobId);

        Assertions.assertEquals(JobState.DONE, env.getJob(jobId).getState());
        table = env.getTable();
        Assertions.assertNull(table.findColumn(changingName));
        ColumnMeta column = table.findColumn("name");
        Assertions.assertEquals("VARCHAR(64)", column.getType());
        Assertions.assertFalse(column.isHidden());
        Assertions.assertEquals(SchemaState.PUBLIC, column.getState());
        Assertions.assertEquals(1, table.indexOfColumn("name"));
        Assertions.assertEquals(2, table.getColumns().size());
    }

    @Test
    public void testModifyColumnToNotNullTakesTwoVersions() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.MODIFY_COLUMN, DB_ID, TABLE_ID, null,
                new ModifyColumnArgs("name", new ColumnMeta("name", "VARCHAR(32)", false)));
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        Assertions.assertTrue(env.getTable().findColumn("name").isPreventNullInsert());
        Assertions.assertEquals(1, env.getSchemaVersion());

        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.DONE, job.getState());
        ColumnMeta column = env.getTable().findColumn("name");
        Assertions.assertFalse(column.isNullable());
        Assertions.assertFalse(column.isPreventNullInsert());
        Assertions.assertEquals(2, env.getSchemaVersion());
    }

    @Test
    public void testCancelModifyColumnRemovesChangingColumn() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.MODIFY_COLUMN, DB_ID, TABLE_ID, null,
                new ModifyColumnArgs("name", new ColumnMeta("name", "BIGINT", true)));
        env.runner.runJob(jobId);
        env.mgr.cancelJob(jobId);

        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.ROLLBACK_DONE, job.getState());
        TableMeta table = env.getTable();
        Assertions.assertEquals(2, table.getColumns().size());
        Assertions.assertEquals("VARCHAR(32)", table.findColumn("name").getType());
        Assertions.assertTrue(env.pool.getStopped().contains(jobId));
    }

    @Test
    public void testCreateAndDropTable() throws Exception {
        TableMeta newTable = AlterJobTestEnv.newTable(0, "t2");
        long createJobId = env.mgr.submitJob(ActionType.CREATE_TABLE, DB_ID, 0, null, new CreateTableArgs(newTable));
        AlterJob createJob = env.runToEnd(createJobId);
        Assertions.assertEquals(JobState.DONE, createJob.getState());
        long tableId = createJob.getTableId();
        Assertions.assertTrue(tableId > 0);
        TableMeta created = env.getTable(tableId);
        Assertions.assertEquals("t2", created.getName());
        Assertions.assertEquals(SchemaState.PUBLIC, created.getState());

        long dropJobId = env.mgr.submitJob(ActionType.DROP_TABLE, DB_ID, tableId, null, null);
        env.runner.runOneStep(dropJobId);
        env.runner.runOneStep(dropJobId);
        Assertions.assertEquals(SchemaState.WRITE_ONLY, env.getTable(tableId).getState());
        AlterJob dropJob = env.runToEnd(dropJobId);
        Assertions.assertEquals(JobState.DONE, dropJob.getState());
        Assertions.assertNull(env.getTable(tableId));
        Assertions.assertTrue(env.pool.getCleanups().stream()
                .anyMatch(t -> t.getKind() == ReorgTask.Kind.CLEANUP_TABLE && t.getElementId() == tableId));
    }

    @Test
    public void testCreateTableWithExistingNameIsCancelled() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.CREATE_TABLE, DB_ID, 0, null,
                new CreateTableArgs(AlterJobTestEnv.newTable(0, "T1")));
        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.CANCELLED, job.getState());
        Assertions.assertEquals(RollbackConverter.ROLLBACK_MSG_PREFIX + "Table 'T1' already exists", job.getErrMsg());
        Assertions.assertNull(env.getTable(job.getTableId()));
    }

    @Test
    public void testRenameTable() throws Exception {
        env.createDefaultTable();
        long jobId = env.mgr.submitJob(ActionType.RENAME_TABLE, DB_ID, TABLE_ID, null, new RenameTableArgs("t9"));
        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.DONE, job.getState());
        Assertions.assertEquals("t9", job.getTableName());
        Assertions.assertEquals("t9", env.getTable().getName());
        Assertions.assertEquals(1, env.getSchemaVersion());
    }

    @Test
    public void testAddAndDropPartition() throws Exception {
        env.createPartitionedTable();
        long addJobId = env.mgr.submitJob(ActionType.ADD_TABLE_PARTITION, DB_ID, TABLE_ID, null,
                PartitionArgs.ofDefinitions(Lists.newArrayList(new PartitionDef("p2", "VALUES LESS THAN (300)"))));
        env.runner.runOneStep(addJobId);
        env.runner.runOneStep(addJobId);
        PartitionInfo info = env.getTable().getPartitionInfo();
        Assertions.assertEquals(Lists.newArrayList("p2"), PartitionInfo.namesOf(info.getAddingDefinitions()));
        Assertions.assertEquals(SchemaState.REPLICA_ONLY, env.getJob(addJobId).getSchemaState());

        Assertions.assertEquals(JobState.DONE, env.runToEnd(addJobId).getState());
        info = env.getTable().getPartitionInfo();
        Assertions.assertEquals(Lists.newArrayList("p0", "p1", "p2"), PartitionInfo.namesOf(info.getDefinitions()));
        Assertions.assertTrue(info.getAddingDefinitions().isEmpty());

        long dropJobId = env.mgr.submitJob(ActionType.DROP_TABLE_PARTITION, DB_ID, TABLE_ID, null,
                PartitionArgs.ofNames(Lists.newArrayList("p0")));
        Assertions.assertEquals(JobState.DONE, env.runToEnd(dropJobId).getState());
        info = env.getTable().getPartitionInfo();
        Assertions.assertEquals(Lists.newArrayList("p1", "p2"), PartitionInfo.namesOf(info.getDefinitions()));
        Assertions.assertTrue(info.getDroppingDefinitions().isEmpty());
        Assertions.assertTrue(env.pool.getCleanups().stream()
                .anyMatch(t -> t.getKind() == ReorgTask.Kind.CLEANUP_PARTITION && t.getElementId() == 10));
    }

    @Test
    public void testDropEveryPartitionIsCancelled() throws Exception {
        env.createPartitionedTable();
        long jobId = env.mgr.submitJob(ActionType.DROP_TABLE_PARTITION, DB_ID, TABLE_ID, null,
                PartitionArgs.ofNames(Lists.newArrayList("p0", "p1")));
        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.CANCELLED, job.getState());
        Assertions.assertEquals(2, env.getTable().getPartitionInfo().getDefinitions().size());
    }

    @Test
    public void testCancelAddPartitionRemovesAddingDefinitions() throws Exception {
        env.createPartitionedTable();
        long jobId = env.mgr.submitJob(ActionType.ADD_TABLE_PARTITION, DB_ID, TABLE_ID, null,
                PartitionArgs.ofDefinitions(Lists.newArrayList(new PartitionDef("p2", "VALUES LESS THAN (300)"))));
        env.runner.runOneStep(jobId);
        env.runner.runOneStep(jobId);
        env.mgr.cancelJob(jobId);

        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.ROLLBACK_DONE, job.getState());
        PartitionInfo info = env.getTable().getPartitionInfo();
        Assertions.assertTrue(info.getAddingDefinitions().isEmpty());
        Assertions.assertFalse(info.hasName("p2"));
    }

    @Test
    public void testReorganizePartition() throws Exception {
        env.createPartitionedTable();
        long jobId = env.mgr.submitJob(ActionType.REORGANIZE_PARTITION, DB_ID, TABLE_ID, null,
                new PartitionArgs(Lists.newArrayList("p0", "p1"),
                        Lists.newArrayList(new PartitionDef("p0", "VALUES LESS THAN (50)"),
                                new PartitionDef("p1", "VALUES LESS THAN (200)"))));
        env.runner.runJob(jobId);
        ReorgTask task = env.pool.getLastStarted();
        Assertions.assertEquals(ReorgTask.Kind.REORGANIZE_PARTITION, task.getKind());

        env.pool.finish(task.getKey(), ReorgResult.completed(100));
        env.runner.runJob(jobId);

        Assertions.assertEquals(JobState.DONE, env.getJob(jobId).getState());
        PartitionInfo info = env.getTable().getPartitionInfo();
        Assertions.assertEquals(Lists.newArrayList("p0", "p1"), PartitionInfo.namesOf(info.getDefinitions()));
        Assertions.assertEquals("VALUES LESS THAN (50)", info.findDefinition("p0").getBound());
        Assertions.assertNotEquals(10, info.findDefinition("p0").getId());
        Assertions.assertEquals(2, env.pool.getCleanups().stream()
                .filter(t -> t.getKind() == ReorgTask.Kind.CLEANUP_PARTITION).count());
    }

    @Test
    public void testCancelReorganizePartitionDuringBackfill() throws Exception {
        env.createPartitionedTable();
        long jobId = env.mgr.submitJob(ActionType.REORGANIZE_PARTITION, DB_ID, TABLE_ID, null,
                new PartitionArgs(Lists.newArrayList("p1"),
                        Lists.newArrayList(new PartitionDef("p1a", "VALUES LESS THAN (150)"),
                                new PartitionDef("p1b", "VALUES LESS THAN (200)"))));
        env.runner.runJob(jobId);
        env.mgr.cancelJob(jobId);

        AlterJob job = env.runToEnd(jobId);
        Assertions.assertEquals(JobState.ROLLBACK_DONE, job.getState());
        PartitionInfo info = env.getTable().getPartitionInfo();
        Assertions.assertEquals(Lists.newArrayList("p0", "p1"), PartitionInfo.namesOf(info.getDefinitions()));
        Assertions.assertTrue(info.getAddingDefinitions().isEmpty());
        Assertions.assertTrue(env.pool.getStopped().contains(jobId));
    }

    @Test
    public void testAddEnforcedCheckConstraint() throws Exception {
        env.createDefaultTable();
        CheckConstraint constraint = new CheckConstraint("chk_id", "id > 0", Lists.newArrayList("id"), true);
        long jobId = env.mgr.submitJob(ActionType.ADD_CHECK_CONSTRAINT, DB_ID, TABLE_ID, null,
                new AddCheckConstraintArgs(constraint));
        env.runner.runJob(jobId);
        ReorgTask task = env.pool.getLastStarted();
        Assertions.assertEquals(ReorgTask.Kind.VALIDATE_CONSTRAINT, task.getKind());

        env.pool.finish(task.getKey(), ReorgResult.completed(5));
        env.runner.runJob(jobId);
        Assertions.assertEquals(JobState.DONE, env.getJob(jobId).getState());
        Assertions.assertEquals(SchemaState.PUBLIC, env.getTable().findConstraint("chk_id").getState());
    }

    @Test
    public void testCheckConstraintViolationRollsBack() throws Exception {
        env.createDefaultTable();
        CheckConstraint constraint = new CheckConstraint("chk_id", "id > 0", Lists.newArrayList("id"), true);
        long jobId = env.mgr.submitJob(ActionType.ADD_CHECK_CONSTRAINT, DB_ID, TABLE_ID, null,
                new AddCheckConstraintArgs(constraint));
        env.runner.runJob(jobId);
        env.pool.finish(env.pool.getLastStarted().getKey(), ReorgResult.failed("Check constraint 'chk_id' is violated"));
        env.runner.runJob(jobId);

        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.ROLLBACK_DONE, job.getState());
        Assertions.assertNull(env.getTable().findConstraint("chk_id"));
    }

    @Test
    public void testEveryVersionIsBumpedByTheJob() throws Exception {
        env.createDefaultTable();
        long jobId = submitAddIndex("idx_name", "name");
        env.runner.runJob(jobId);
        env.pool.finish(env.pool.getLastStarted().getKey(), ReorgResult.completed(1));
        env.runner.runJob(jobId);

        List<Long> versions = env.publishedVersions;
        Assertions.assertEquals(Lists.newArrayList(1L, 2L, 3L, 4L), versions);
        for (long version = 1; version <= 4; version++) {
            Assertions.assertEquals(jobId, env.store.getJobIdOfVersion(version));
        }
    }

    @Test
    public void testPausedJobRestartsItsReorgTask() throws Exception {
        env.createDefaultTable();
        long jobId = submitAddIndex("idx_name", "name");
        env.runner.runJob(jobId);
        ReorgTask first = env.pool.getLastStarted();

        env.mgr.pauseJob(jobId);
        env.runner.runJob(jobId);
        Assertions.assertEquals(JobState.PAUSED, env.getJob(jobId).getState());
        Assertions.assertTrue(env.pool.getStopped().contains(jobId));
        Assertions.assertTrue(env.queue.listRunnableJobs().isEmpty());

        env.mgr.resumeJob(jobId);
        env.runner.runJob(jobId);
        ReorgTask second = env.pool.getLastStarted();
        Assertions.assertEquals(2, env.pool.getStarted().size());
        Assertions.assertEquals(first.getSnapshotVer(), second.getSnapshotVer());
        Assertions.assertEquals(first.getKey(), second.getKey());

        env.pool.finish(second.getKey(), ReorgResult.completed(3));
        env.runner.runJob(jobId);
        Assertions.assertEquals(JobState.DONE, env.getJob(jobId).getState());
    }

    @Test
    public void testLostOwnerDoesNotStep() throws Exception {
        env.createDefaultTable();
        long jobId = submitAddIndex("idx_name", "name");
        env.election.resign();

        Assertions.assertTrue(env.runner.runJob(jobId).isYield());
        AlterJob job = env.getJob(jobId);
        Assertions.assertEquals(JobState.QUEUEING, job.getState());
        Assertions.assertEquals(0, env.getSchemaVersion());
    }
}
