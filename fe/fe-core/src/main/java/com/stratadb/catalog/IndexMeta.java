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

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;
import com.stratadb.persist.gson.IForwardCompatibleObject;

import java.util.List;
import java.util.Map;

public class IndexMeta implements IForwardCompatibleObject {
    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "name")
    private String name;
    @SerializedName(value = "columns")
    private List<String> columns = Lists.newArrayList();
    @SerializedName(value = "unique")
    private boolean unique;
    @SerializedName(value = "primary")
    private boolean primary;
    @SerializedName(value = "visible")
    private boolean visible = true;
    @SerializedName(value = "state")
    private SchemaState state = SchemaState.PUBLIC;

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private IndexMeta() {
    }

    public IndexMeta(String name, List<String> columns, boolean unique, boolean primary) {
        this.name = name;
        this.columns = Lists.newArrayList(columns);
        this.unique = unique || primary;
        this.primary = primary;
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

    public List<String> getColumns() {
        return columns;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isPrimary() {
        return primary;
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    public SchemaState getState() {
        return state;
    }

    public void setState(SchemaState state) {
        this.state = state;
    }

    public boolean nameEquals(String other) {
        return name.equalsIgnoreCase(other);
    }

    public boolean coversColumn(String columnName) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(columnName));
    }

    @Override
    public String toString() {
        return (primary ? "PRIMARY KEY " : unique ? "UNIQUE " : "INDEX ") + name + columns + " [" + state + "]";
    }

    @Override
    public Map<String, JsonElement> getRetainedProperties() {
        if (retainedProperties == null) {
            retainedProperties = Maps.newHashMap();
        }
        return retainedProperties;
    }
}
