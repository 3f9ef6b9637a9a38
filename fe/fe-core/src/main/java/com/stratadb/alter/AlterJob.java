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

import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.annotations.SerializedName;
import com.stratadb.catalog.SchemaState;
import com.stratadb.common.Config;
import com.stratadb.persist.gson.GsonUtils;
import com.stratadb.persist.gson.IForwardCompatibleObject;

import java.util.Map;

/**
 * The persisted record of a schema change and of its execution.
 * <p>
 * schemaState is the visibility phase the job moved its schema object to, state is the lifecycle of the record.
 * A non-zero snapshotVer means the reorg workers were launched: from then on the job can only be completed or
 * rolled back, never cancelled outright.
 * <p>
 * A sub-job of a composite job is stepped through a proxy AlterJob built by {@link SubJob#toProxyJob}, so the same
 * action handlers drive plain jobs and sub-jobs.
 */
public class AlterJob implements IForwardCompatibleObject {

    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "type")
    private ActionType type;
    @SerializedName(value = "dbId")
    private long dbId;
    @SerializedName(value = "tableId")
    private long tableId;
    @SerializedName(value = "tableName")
    private String tableName;
    @SerializedName(value = "schemaState")
    private SchemaState schemaState = SchemaState.NONE;
    @SerializedName(value = "state")
    private JobState state = JobState.QUEUEING;
    @SerializedName(value = "rawArgs")
    private String rawArgs;
    @SerializedName(value = "snapshotVer")
    private long snapshotVer;
    @SerializedName(value = "reorgDone")
    private boolean reorgDone;
    @SerializedName(value = "rowCount")
    private long rowCount;
    @SerializedName(value = "errMsg")
    private String errMsg = "";
    @SerializedName(value = "errorCount")
    private long errorCount;
    @SerializedName(value = "warning")
    private String warning = "";
    @SerializedName(value = "multiSchemaInfo")
    private MultiSchemaInfo multiSchemaInfo;
    @SerializedName(value = "createTimeMs")
    private long createTimeMs = -1;
    @SerializedName(value = "startTimeMs")
    private long startTimeMs = -1;
    @SerializedName(value = "finishedTimeMs")
    private long finishedTimeMs = -1;

    // only set on the proxy of a sub-job
    private transient SubJob subJob;
    private transient int subJobSeq = -1;

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private AlterJob() {
    }

    public AlterJob(long id, ActionType type, long dbId, long tableId, String tableName, Object args) {
        this.id = id;
        this.type = type;
        this.dbId = dbId;
        this.tableId = tableId;
        this.tableName = tableName;
        this.rawArgs = args == null ? null : GsonUtils.GSON.toJson(args);
        this.createTimeMs = System.currentTimeMillis();
    }

    public AlterJob copy() {
        AlterJob copy = GsonUtils.copy(this, AlterJob.class);
        copy.subJob = subJob;
        copy.subJobSeq = subJobSeq;
        return copy;
    }

    public long getId() {
        return id;
    }

    public ActionType getType() {
        return type;
    }

    public long getDbId() {
        return dbId;
    }

    public long getTableId() {
        return tableId;
    }

    public void setTableId(long tableId) {
        this.tableId = tableId;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public SchemaState getSchemaState() {
        return schemaState;
    }

    public void setSchemaState(SchemaState schemaState) {
        this.schemaState = schemaState;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    public String getRawArgs() {
        return rawArgs;
    }

    public <T> T getArgs(Class<T> clazz) throws AlterCancelException {
        T args = rawArgs == null ? null : GsonUtils.GSON.fromJson(rawArgs, clazz);
        if (args == null) {
            throw new AlterCancelException("job " + id + " has no " + clazz.getSimpleName());
        }
        return args;
    }

    /**
     * Replaces the arguments, for a job converted to the reverse change.
     */
    public void setArgs(Object args) {
        this.rawArgs = GsonUtils.GSON.toJson(args);
    }

    /**
     * Writes back arguments read with {@link #getArgs}. Properties of the stored arguments that the class of
     * {@code args} does not map are kept.
     */
    public void updateArgs(Object args) {
        JsonElement updated = GsonUtils.GSON.toJsonTree(args);
        if (rawArgs != null && updated.isJsonObject()) {
            JsonElement stored = JsonParser.parseString(rawArgs);
            if (stored.isJsonObject()) {
                JsonElement known = GsonUtils.GSON.toJsonTree(GsonUtils.GSON.fromJson(stored, args.getClass()));
                JsonObject updatedObject = updated.getAsJsonObject();
                for (Map.Entry<String, JsonElement> entry : stored.getAsJsonObject().entrySet()) {
                    if (entry.getValue().isJsonNull() || updatedObject.has(entry.getKey())
                            || (known.isJsonObject() && known.getAsJsonObject().has(entry.getKey()))) {
                        continue;
                    }
                    updatedObject.add(entry.getKey(), entry.getValue());
                }
            }
        }
        this.rawArgs = GsonUtils.GSON.toJson(updated);
    }

    void setRawArgs(String rawArgs) {
        this.rawArgs = rawArgs;
    }

    public long getSnapshotVer() {
        return snapshotVer;
    }

    public void setSnapshotVer(long snapshotVer) {
        this.snapshotVer = snapshotVer;
    }

    public boolean isReorgDone() {
        return reorgDone;
    }

    public void setReorgDone(boolean reorgDone) {
        this.reorgDone = reorgDone;
    }

    public long getRowCount() {
        return rowCount;
    }

    public void setRowCount(long rowCount) {
        this.rowCount = rowCount;
    }

    public String getErrMsg() {
        return errMsg;
    }

    public void setErrMsg(String errMsg) {
        this.errMsg = Strings.nullToEmpty(errMsg);
    }

    public boolean hasError() {
        return !Strings.isNullOrEmpty(errMsg);
    }

    public long getErrorCount() {
        return errorCount;
    }

    public void increaseErrorCount() {
        this.errorCount++;
    }

    public boolean isErrorCountExceeded() {
        return errorCount > Config.ddl_error_count_limit;
    }

    public String getWarning() {
        return warning;
    }

    public void setWarning(String warning) {
        this.warning = Strings.nullToEmpty(warning);
    }

    public MultiSchemaInfo getMultiSchemaInfo() {
        return multiSchemaInfo;
    }

    public void setMultiSchemaInfo(MultiSchemaInfo multiSchemaInfo) {
        this.multiSchemaInfo = multiSchemaInfo;
    }

    public long getCreateTimeMs() {
        return createTimeMs;
    }

    public long getStartTimeMs() {
        return startTimeMs;
    }

    public void setStartTimeMs(long startTimeMs) {
        this.startTimeMs = startTimeMs;
    }

    public long getFinishedTimeMs() {
        return finishedTimeMs;
    }

    public void setFinishedTimeMs(long finishedTimeMs) {
        this.finishedTimeMs = finishedTimeMs;
    }

    public int getSubJobSeq() {
        return subJobSeq;
    }

    public boolean isSubJob() {
        return subJob != null;
    }

    void attachSubJob(SubJob subJob, int seq) {
        this.subJob = subJob;
        this.subJobSeq = seq;
    }

    /**
     * @return true while the job belongs to a composite job that can still be reverted as a whole
     */
    public boolean inRevertibleCompositePhase() {
        return multiSchemaInfo != null && multiSchemaInfo.isRevertible();
    }

    /**
     * Marks the sub-job behind this proxy as past its point of no return.
     */
    public void markNonRevertible() {
        if (subJob != null) {
            subJob.setRevertible(false);
        }
    }

    public boolean isDone() {
        return state != null && state.isFinished();
    }

    public boolean isRunning() {
        return state == JobState.RUNNING;
    }

    public boolean isRollingback() {
        return state == JobState.ROLLINGBACK;
    }

    public boolean isCancelling() {
        return state == JobState.CANCELLING;
    }

    /**
     * @return true if no step of the job was ever committed
     */
    public boolean isNeverStarted() {
        return startTimeMs <= 0;
    }

    public void finish(JobState finalState) {
        this.state = finalState;
        this.finishedTimeMs = System.currentTimeMillis();
    }

    public boolean isExpire() {
        return isDone() && (System.currentTimeMillis() - finishedTimeMs) / 1000 > Config.history_job_keep_max_second;
    }

    @Override
    public Map<String, JsonElement> getRetainedProperties() {
        if (retainedProperties == null) {
            retainedProperties = Maps.newHashMap();
        }
        return retainedProperties;
    }

    @Override
    public String toString() {
        return "ID:" + id + ", Type:" + type + ", State:" + state + ", SchemaState:" + schemaState
                + ", SchemaID:" + dbId + ", TableID:" + tableId + ", RowCount:" + rowCount
                + ", SnapshotVersion:" + snapshotVer + ", ErrorCount:" + errorCount
                + (subJobSeq >= 0 ? ", SubJob:" + subJobSeq : "");
    }
}
