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
import com.google.gson.annotations.SerializedName;
import com.stratadb.catalog.SchemaState;
import com.stratadb.persist.gson.GsonUtils;
import com.stratadb.persist.gson.IForwardCompatibleObject;

import java.util.Map;

public class SubJob implements IForwardCompatibleObject {
    @SerializedName(value = "type")
    private ActionType type;
    @SerializedName(value = "rawArgs")
    private String rawArgs;
    @SerializedName(value = "schemaState")
    private SchemaState schemaState = SchemaState.NONE;
    @SerializedName(value = "state")
    private JobState state = JobState.QUEUEING;
    @SerializedName(value = "snapshotVer")
    private long snapshotVer;
    @SerializedName(value = "reorgDone")
    private boolean reorgDone;
    @SerializedName(value = "rowCount")
    private long rowCount;
    @SerializedName(value = "revertible")
    private boolean revertible = true;
    @SerializedName(value = "errMsg")
    private String errMsg = "";

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private SubJob() {
    }

    public SubJob(ActionType type, Object args) {
        this.type = type;
        this.rawArgs = GsonUtils.GSON.toJson(args);
    }

    public AlterJob toProxyJob(AlterJob parent, int seq) {
        AlterJob proxy = new AlterJob(parent.getId(), type, parent.getDbId(), parent.getTableId(),
                parent.getTableName(), null);
        proxy.setRawArgs(rawArgs);
        proxy.setSchemaState(schemaState);
        proxy.setState(state);
        proxy.setSnapshotVer(snapshotVer);
        proxy.setReorgDone(reorgDone);
        proxy.setRowCount(rowCount);
        proxy.setErrMsg(errMsg);
        proxy.setStartTimeMs(state == JobState.QUEUEING ? -1 : parent.getStartTimeMs());
        proxy.setMultiSchemaInfo(parent.getMultiSchemaInfo());
        proxy.attachSubJob(this, seq);
        return proxy;
    }

    public void fromProxyJob(AlterJob proxy) {
        this.rawArgs = proxy.getRawArgs();
        this.schemaState = proxy.getSchemaState();
        this.state = proxy.getState();
        this.snapshotVer = proxy.getSnapshotVer();
        this.reorgDone = proxy.isReorgDone();
        this.rowCount = proxy.getRowCount();
        this.errMsg = proxy.getErrMsg();
    }

    public ActionType getType() {
        return type;
    }

    public String getRawArgs() {
        return rawArgs;
    }

    public SchemaState getSchemaState() {
        return schemaState;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    public long getSnapshotVer() {
        return snapshotVer;
    }

    public boolean isRevertible() {
        return revertible;
    }

    public void setRevertible(boolean revertible) {
        this.revertible = revertible;
    }

    public String getErrMsg() {
        return errMsg;
    }

    public void setErrMsg(String errMsg) {
        this.errMsg = Strings.nullToEmpty(errMsg);
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
        return type + "[" + state + ", " + schemaState + (revertible ? "" : ", non-revertible") + "]";
    }
}
