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

public class PartitionDef implements IForwardCompatibleObject {
    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "name")
    private String name;
    // the "VALUES LESS THAN" or "VALUES IN" text of the definition, interpreted by the planner
    @SerializedName(value = "bound")
    private String bound;

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private PartitionDef() {
    }

    public PartitionDef(String name, String bound) {
        this.name = name;
        this.bound = bound;
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

    public String getBound() {
        return bound;
    }

    public boolean nameEquals(String other) {
        return name.equalsIgnoreCase(other);
    }

    @Override
    public String toString() {
        return name + "(" + id + ")";
    }

    @Override
    public Map<String, JsonElement> getRetainedProperties() {
        if (retainedProperties == null) {
            retainedProperties = Maps.newHashMap();
        }
        return retainedProperties;
    }
}
