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

import com.stratadb.alter.AlterJobArgs.AddColumnArgs;
import com.stratadb.alter.AlterJobArgs.ModifyColumnArgs;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.SchemaState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static com.stratadb.alter.AlterJobTestEnv.DB_ID;
import static com.stratadb.alter.AlterJobTestEnv.TABLE_ID;

public class ColumnTypeChangeCallbackTest {
    private static final long DELAY_MS = 100;
    // long enough that an unexpected delay fails the test
    private static final long NEVER_MS = 60_000;

    private static AlterJob newJob(ActionType type, SchemaState state) {
        Object args = type == ActionType.MODIFY_COLUMN
                ? new ModifyColumnArgs("name", new ColumnMeta("name", "BIGINT", true))
                : new AddColumnArgs(new ColumnMeta("c3", "INT", true), null);
        AlterJob job = new AlterJob(1L, type, DB_ID, TABLE_ID, "t1", args);
        job.setSchemaState(state);
        return job;
    }

    private static long timeRunBefore(AlterJobCallback callback, AlterJob job) {
        long start = System.nanoTime();
        callback.onJobRunBefore(job);
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

    @Test
    public void testIntermediateStatesOfModifyColumnAreDelayed() {
        ColumnTypeChangeCallback callback = new ColumnTypeChangeCallback(DELAY_MS);
        for (SchemaState state : new SchemaState[] {SchemaState.DELETE_ONLY, SchemaState.WRITE_ONLY,
                SchemaState.WRITE_REORGANIZATION}) {
            long elapsed = timeRunBefore(callback, newJob(ActionType.MODIFY_COLUMN, state));
            Assertions.assertTrue(elapsed >= DELAY_MS, state + " was delayed only " + elapsed + "ms");
        }
    }

    @Test
    public void testOtherStepsAreNotDelayed() {
        ColumnTypeChangeCallback callback = new ColumnTypeChangeCallback(NEVER_MS);
        Assertions.assertTrue(timeRunBefore(callback, newJob(ActionType.MODIFY_COLUMN, SchemaState.NONE))
                < NEVER_MS / 2);
        Assertions.assertTrue(timeRunBefore(callback, newJob(ActionType.MODIFY_COLUMN, SchemaState.PUBLIC))
                < NEVER_MS / 2);
        Assertions.assertTrue(timeRunBefore(callback, newJob(ActionType.ADD_COLUMN, SchemaState.WRITE_ONLY))
                < NEVER_MS / 2);
    }

    @Test
    public void testRunnerWaitsInEachIntermediateState() throws Exception {
        AlterJobTestEnv env = new AlterJobTestEnv();
        env.createDefaultTable();
        env.runner.setCallback(new ColumnTypeChangeCallback(DELAY_MS));
        long jobId = env.mgr.submitJob(ActionType.MODIFY_COLUMN, DB_ID, TABLE_ID, null,
                new ModifyColumnArgs("name", new ColumnMeta("name", "VARCHAR(64)", true)));

        long start = System.nanoTime();
        StepResult result = env.runner.runJob(jobId);
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        Assertions.assertTrue(result.isWaitingReorg());
        Assertions.assertEquals(SchemaState.WRITE_REORGANIZATION, env.getJob(jobId).getSchemaState());
        // the steps leaving DELETE_ONLY and WRITE_ONLY and the one starting the backfill are held back
        Assertions.assertTrue(elapsed >= 3 * DELAY_MS, "job ran through in " + elapsed + "ms");
    }
}
