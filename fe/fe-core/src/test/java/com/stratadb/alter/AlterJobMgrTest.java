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
import com.stratadb.alter.AlterJobArgs.AddColumnArgs;
import com.stratadb.alter.AlterJobArgs.RenameTableArgs;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.SchemaState;
import com.stratadb.common.DdlException;
import com.stratadb.common.ErrorCode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.stratadb.alter.AlterJobTestEnv.DB_ID;
import static com.stratadb.alter.AlterJobTestEnv.TABLE_ID;

public class AlterJobMgrTest {
    private AlterJobTestEnv env;

    @BeforeEach
    public void setUp() throws Exception {
        env = new AlterJobTestEnv();
        env.createDefaultTable();
    }

    private long submitAddColumn(long tableId, String name) throws DdlException {
        return env.mgr.submitJob(ActionType.ADD_COLUMN, DB_ID, tableId, null,
                new AddColumnArgs(new ColumnMeta(name, "INT", true), null));
    }

    @Test
    public void testSubmitOnUnknownTable() {
        DdlException e = Assertions.assertThrows(DdlException.class, () -> submitAddColumn(999L, "c3"));
        Assertions.assertEquals(ErrorCode.ERR_BAD_TABLE_ERROR, e.getErrorCode());
        Assertions.assertEquals("Unknown table '999'", e.getMessage());
    }

    @Test
    public void testSubmitAssignsIdAndTableName() throws Exception {
        long jobId = submitAddColumn(TABLE_ID, "c3");
        AlterJobStatus status = env.mgr.getJob(jobId);
        Assertions.assertEquals(jobId, status.getJobId());
        Assertions.assertEquals(ActionType.ADD_COLUMN, status.getType());
        Assertions.assertEquals(JobState.QUEUEING, status.getState());
        Assertions.assertEquals(SchemaState.NONE, status.getSchemaState());
        Assertions.assertEquals("t1", env.getJob(jobId).getTableName());
        Assertions.assertTrue(submitAddColumn(TABLE_ID, "c4") > jobId);
    }

    @Test
    public void testCompositeTypeNeedsSubJobs() {
        DdlException e = Assertions.assertThrows(DdlException.class,
                () -> env.mgr.submitJob(ActionType.MULTI_SCHEMA_CHANGE, DB_ID, TABLE_ID, null, null));
        Assertions.assertEquals(ErrorCode.ERR_INVALID_DDL_JOB, e.getErrorCode());

        e = Assertions.assertThrows(DdlException.class,
                () -> env.mgr.submitMultiSchemaChange(DB_ID, TABLE_ID, null, Lists.newArrayList()));
        Assertions.assertEquals(ErrorCode.ERR_UNSUPPORTED_MULTI_SCHEMA_CHANGE, e.getErrorCode());
    }

    @Test
    public void testGetUnknownJob() {
        DdlException e = Assertions.assertThrows(DdlException.class, () -> env.mgr.getJob(12345L));
        Assertions.assertEquals(ErrorCode.ERR_DDL_JOB_NOT_FOUND, e.getErrorCode());
        Assertions.assertEquals("DDL Job:12345 not found", e.getMessage());

        e = Assertions.assertThrows(DdlException.class, () -> env.mgr.cancelJob(12345L));
        Assertions.assertEquals(ErrorCode.ERR_DDL_JOB_NOT_FOUND, e.getErrorCode());
    }

    @Test
    public void testCancelTwice() throws Exception {
        long jobId = submitAddColumn(TABLE_ID, "c3");
        env.mgr.cancelJob(jobId);
        Assertions.assertEquals(JobState.CANCELLING, env.mgr.getJob(jobId).getState());

        DdlException e = Assertions.assertThrows(DdlException.class, () -> env.mgr.cancelJob(jobId));
        Assertions.assertEquals(ErrorCode.ERR_DDL_JOB_ALREADY_CANCELLING, e.getErrorCode());
    }

    @Test
    public void testCancelFinishedJob() throws Exception {
        long jobId = env.mgr.submitJob(ActionType.RENAME_TABLE, DB_ID, TABLE_ID, null, new RenameTableArgs("t2"));
        env.runToEnd(jobId);
        Assertions.assertEquals(JobState.DONE, env.mgr.getJob(jobId).getState());

        DdlException e = Assertions.assertThrows(DdlException.class, () -> env.mgr.cancelJob(jobId));
        Assertions.assertEquals(ErrorCode.ERR_CANCEL_FINISHED_DDL_JOB, e.getErrorCode());
        Assertions.assertEquals("This job:" + jobId + " is finished, so can't be cancelled", e.getMessage());
    }

    @Test
    public void testPauseAndResumeChecks() throws Exception {
        long jobId = submitAddColumn(TABLE_ID, "c3");
        DdlException e = Assertions.assertThrows(DdlException.class, () -> env.mgr.resumeJob(jobId));
        Assertions.assertEquals(ErrorCode.ERR_RESUME_DDL_JOB, e.getErrorCode());

        env.mgr.pauseJob(jobId);
        e = Assertions.assertThrows(DdlException.class, () -> env.mgr.pauseJob(jobId));
        Assertions.assertEquals(ErrorCode.ERR_PAUSE_DDL_JOB, e.getErrorCode());

        env.runner.runJob(jobId);
        Assertions.assertEquals(JobState.PAUSED, env.mgr.getJob(jobId).getState());
        env.mgr.resumeJob(jobId);
        Assertions.assertEquals(JobState.QUEUEING, env.mgr.getJob(jobId).getState());
        Assertions.assertEquals(JobState.DONE, env.runToEnd(jobId).getState());
    }

    @Test
    public void testOneRunnableJobPerTable() throws Exception {
        env.createTable(AlterJobTestEnv.newTable(200L, "t2"));
        long first = submitAddColumn(TABLE_ID, "c3");
        long second = submitAddColumn(TABLE_ID, "c4");
        long other = submitAddColumn(200L, "c3");

        List<Long> runnable = env.queue.listRunnableJobs().stream().map(AlterJob::getId)
                .collect(Collectors.toList());
        Assertions.assertEquals(Lists.newArrayList(first, other), runnable);

        env.runToEnd(first);
        runnable = env.queue.listRunnableJobs().stream().map(AlterJob::getId).collect(Collectors.toList());
        Assertions.assertEquals(Lists.newArrayList(second, other), runnable);
    }

    @Test
    public void testListJobs() throws Exception {
        long done = env.mgr.submitJob(ActionType.RENAME_TABLE, DB_ID, TABLE_ID, null, new RenameTableArgs("t2"));
        env.runToEnd(done);
        long active = submitAddColumn(TABLE_ID, "c3");

        List<List<String>> rows = env.mgr.listJobs(10);
        Assertions.assertEquals(2, rows.size());
        Assertions.assertEquals(String.valueOf(active), rows.get(0).get(0));
        Assertions.assertEquals("QUEUEING", rows.get(0).get(4));
        Assertions.assertEquals(String.valueOf(done), rows.get(1).get(0));
        Assertions.assertEquals("DONE", rows.get(1).get(4));
        Assertions.assertEquals(AlterJobStatus.TITLE_NAMES.size(), rows.get(1).size());

        Assertions.assertEquals(1, env.mgr.listJobs(1).size());
    }
}
