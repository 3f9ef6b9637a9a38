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

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Objects;

/**
 * A unit of background data work handed to the {@link ReorgWorkerPool}.
 * The task describes what to migrate, it never carries the rows themselves.
 */
public class ReorgTask {

    public enum Kind {
        BACKFILL_INDEX,
        BACKFILL_COLUMN,
        REORGANIZE_PARTITION,
        VALIDATE_CONSTRAINT,
        CLEANUP_INDEX,
        CLEANUP_COLUMN,
        CLEANUP_PARTITION,
        CLEANUP_TABLE;

        public boolean isCleanup() {
            return name().startsWith("CLEANUP");
        }
    }

    private final long jobId;
    // position of the sub-job in a composite job, -1 for a plain job
    private final int subJobSeq;
    private final Kind kind;
    private final long dbId;
    private final long tableId;
    private final long elementId;
    private final List<String> elementNames;
    private final long snapshotVer;

    public ReorgTask(long jobId, int subJobSeq, Kind kind, long dbId, long tableId, long elementId,
                     List<String> elementNames, long snapshotVer) {
        this.jobId = jobId;
        this.subJobSeq = subJobSeq;
        this.kind = kind;
        this.dbId = dbId;
        this.tableId = tableId;
        this.elementId = elementId;
        this.elementNames = Lists.newArrayList(elementNames);
        this.snapshotVer = snapshotVer;
    }

    public static String keyOf(long jobId, int subJobSeq) {
        return jobId + "-" + subJobSeq;
    }

    public String getKey() {
        return keyOf(jobId, subJobSeq);
    }

    public long getJobId() {
        return jobId;
    }

    public int getSubJobSeq() {
        return subJobSeq;
    }

    public Kind getKind() {
        return kind;
    }

    public long getDbId() {
        return dbId;
    }

    public long getTableId() {
        return tableId;
    }

    public long getElementId() {
        return elementId;
    }

    public List<String> getElementNames() {
        return elementNames;
    }

    public long getSnapshotVer() {
        return snapshotVer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReorgTask)) {
            return false;
        }
        ReorgTask that = (ReorgTask) o;
        return jobId == that.jobId && subJobSeq == that.subJobSeq && kind == that.kind
                && elementId == that.elementId && snapshotVer == that.snapshotVer;
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, subJobSeq, kind, elementId, snapshotVer);
    }

    @Override
    public String toString() {
        return kind + "[job=" + getKey() + ", table=" + tableId + ", element=" + elementId + "("
                + Joiner.on(",").join(elementNames) + "), snapshot=" + snapshotVer + "]";
    }
}
