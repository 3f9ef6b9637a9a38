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

public class CheckConstraint implements IForwardCompatibleObject {
    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "name")
    private String name;
    @SerializedName(value = "expression")
    private String expression;
    // columns the expression refers to
    @SerializedName(value = "columns")
    private List<String> columns = Lists.newArrayList();
    @SerializedName(value = "enforced")
    private boolean enforced = true;
    @SerializedName(value = "state")
    private SchemaState state = SchemaState.PUBLIC;

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private CheckConstraint() {
    }

    public CheckConstraint(String name, String expression, List<String> columns, boolean enforced) {
        this.name = name;
        this.expression = expression;
        this.columns = Lists.newArrayList(columns);
        this.enforced = enforced;
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

    public String getExpression() {
        return expression;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isEnforced() {
        return enforced;
    }

    public void setEnforced(boolean enforced) {
        this.enforced = enforced;
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

    @Override
    public Map<String, JsonElement> getRetainedProperties() {
        if (retainedProperties == null) {
            retainedProperties = Maps.newHashMap();
        }
        return retainedProperties;
    }
}
