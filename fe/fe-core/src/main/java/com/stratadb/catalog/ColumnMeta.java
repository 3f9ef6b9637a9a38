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

package com.stratadb.catalog;

import com.google.common.collect.Maps;
import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;
import com.stratadb.persist.gson.IForwardCompatibleObject;

import java.util.Map;
import java.util.Objects;

public class ColumnMeta implements IForwardCompatibleObject {
    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "name")
    private String name;
    @SerializedName(value = "type")
    private String type;
    @SerializedName(value = "nullable")
    private boolean nullable = true;
    @SerializedName(value = "defaultValue")
    private String defaultValue;
    @SerializedName(value = "comment")
    private String comment = "";
    @SerializedName(value = "state")
    private SchemaState state = SchemaState.PUBLIC;
    // set while a job checks that no NULL is left before the column becomes NOT NULL
    @SerializedName(value = "preventNullInsert")
    private boolean preventNullInsert;
    @SerializedName(value = "hidden")
    private boolean hidden;
    // name of the column this one replaces when it becomes public, for a column type change
    @SerializedName(value = "changingFrom")
    private String changingFrom;

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private ColumnMeta() {
    }

    public ColumnMeta(String name, String type, boolean nullable) {
        this.name = name;
        this.type = type;
        this.nullable = nullable;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public void setNullable(boolean nullable) {
        this.nullable = nullable;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public SchemaState getState() {
        return state;
    }

    public void setState(SchemaState state) {
        this.state = state;
    }

    public boolean isPreventNullInsert() {
        return preventNullInsert;
    }

    public void setPreventNullInsert(boolean preventNullInsert) {
        this.preventNullInsert = preventNullInsert;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    public String getChangingFrom() {
        return changingFrom;
    }

    public void setChangingFrom(String changingFrom) {
        this.changingFrom = changingFrom;
    }

    public boolean nameEquals(String other) {
        return name.equalsIgnoreCase(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnMeta)) {
            return false;
        }
        ColumnMeta that = (ColumnMeta) o;
        return id == that.id && nullable == that.nullable && preventNullInsert == that.preventNullInsert
                && hidden == that.hidden && Objects.equals(name, that.name) && Objects.equals(type, that.type)
                && Objects.equals(defaultValue, that.defaultValue) && Objects.equals(comment, that.comment)
                && state == that.state && Objects.equals(changingFrom, that.changingFrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, nullable, state);
    }

    @Override
    public String toString() {
        return name + " " + type + (nullable ? "" : " NOT NULL") + " [" + state + "]";
    }

    @Override
    public Map<String, JsonElement> getRetainedProperties() {
        if (retainedProperties == null) {
            retainedProperties = Maps.newHashMap();
        }
        return retainedProperties;
    }
}
