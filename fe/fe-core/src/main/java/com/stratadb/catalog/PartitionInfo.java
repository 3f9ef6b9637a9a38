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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Partition layout of a table. Partitions being added or dropped by a running job are kept apart from the
 * public definitions until the job publishes or removes them.
 */
public class PartitionInfo implements IForwardCompatibleObject {
    @SerializedName(value = "type")
    private String type;
    @SerializedName(value = "expr")
    private String expr;
    @SerializedName(value = "definitions")
    private List<PartitionDef> definitions = Lists.newArrayList();
    @SerializedName(value = "addingDefinitions")
    private List<PartitionDef> addingDefinitions = Lists.newArrayList();
    @SerializedName(value = "droppingDefinitions")
    private List<PartitionDef> droppingDefinitions = Lists.newArrayList();

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private PartitionInfo() {
    }

    public PartitionInfo(String type, String expr, List<PartitionDef> definitions) {
        this.type = type;
        this.expr = expr;
        this.definitions = Lists.newArrayList(definitions);
    }

    public String getType() {
        return type;
    }

    public String getExpr() {
        return expr;
    }

    public List<PartitionDef> getDefinitions() {
        return definitions;
    }

    public List<PartitionDef> getAddingDefinitions() {
        return addingDefinitions;
    }

    public List<PartitionDef> getDroppingDefinitions() {
        return droppingDefinitions;
    }

    public PartitionDef findDefinition(String name) {
        return find(definitions, name);
    }

    public boolean hasName(String name) {
        return find(definitions, name) != null || find(addingDefinitions, name) != null
                || find(droppingDefinitions, name) != null;
    }

    public static List<String> namesOf(Collection<PartitionDef> defs) {
        return defs.stream().map(PartitionDef::getName).collect(Collectors.toList());
    }

    private static PartitionDef find(List<PartitionDef> defs, String name) {
        for (PartitionDef def : defs) {
            if (def.nameEquals(name)) {
                return def;
            }
        }
        return null;
    }

    @Override
    public Map<String, JsonElement> getRetainedProperties() {
        if (retainedProperties == null) {
            retainedProperties = Maps.newHashMap();
        }
        return retainedProperties;
    }
}
