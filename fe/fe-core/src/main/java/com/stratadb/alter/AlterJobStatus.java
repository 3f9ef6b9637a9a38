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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.stratadb.catalog.SchemaState;
import com.stratadb.common.util.TimeUtils;

import java.util.List;

/**
 * A read-only view of a job for the control surface.
 */
public class AlterJobStatus {
    public static final ImmutableList<String> TITLE_NAMES = new ImmutableList.Builder<String>()
            .add("JobId").add("Type").add("TableName").add("SchemaState").add("State").add("ErrorCount")
            .add("RowCount").add("CreateTime").add("StartTime").add("FinishTime").add("ErrMsg").add("Warning")
            .build();

    private final long jobId;
    private final ActionType type;
    private final String tableName;
    private final JobState state;
    private final SchemaState schemaState;
    private final String errMsg;
    private final long errorCount;
    private final String warning;
    private final long rowCount;
    private final long createTimeMs;
    private final long startTimeMs;
    private final long finishedTimeMs;
    private final List<JobState> subJobStates;

    public AlterJobStatus(AlterJob job) {
        this.jobId = job.getId();
        this.type = job.getType();
        this.tableName = job.getTableName();
        this.state = job.getState();
        this.schemaState = job.getSchemaState();
        this.errMsg = job.getErrMsg();
        this.errorCount = job.getErrorCount();
        this.warning = job.getWarning();
        this.rowCount = job.getRowCount();
        this.createTimeMs = job.getCreateTimeMs();
        this.startTimeMs = job.getStartTimeMs();
        this.finishedTimeMs = job.getFinishedTimeMs();
        List<JobState> states = Lists.newArrayList();
        if (job.getMultiSchemaInfo() != null) {
            for (SubJob subJob : job.getMultiSchemaInfo().getSubJobs()) {
                states.add(subJob.getState());
            }
        }
        this.subJobStates = ImmutableList.copyOf(states);
    }

    public long getJobId() {
        return jobId;
    }

    public ActionType getType() {
        return type;
    }

    public JobState getState() {
        return state;
    }

    public SchemaState getSchemaState() {
        return schemaState;
    }

    public String getErrMsg() {
        return errMsg;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public String getWarning() {
        return warning;
    }

    public long getRowCount() {
        return rowCount;
    }

    public List<JobState> getSubJobStates() {
        return subJobStates;
    }

    public List<String> toRow() {
        List<String> row = Lists.newArrayList();
        row.add(String.valueOf(jobId));
        row.add(String.valueOf(type));
        row.add(tableName);
        row.add(String.valueOf(schemaState));
        row.add(String.valueOf(state));
        row.add(String.valueOf(errorCount));
        row.add(String.valueOf(rowCount));
        row.add(TimeUtils.longToTimeString(createTimeMs));
        row.add(TimeUtils.longToTimeString(startTimeMs));
        row.add(TimeUtils.longToTimeString(finishedTimeMs));
        row.add(errMsg);
        row.add(warning);
        return row;
    }
}
