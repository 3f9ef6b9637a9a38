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

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;
import com.stratadb.persist.gson.GsonPostProcessable;
import com.stratadb.persist.gson.GsonUtils;
import com.stratadb.persist.gson.IForwardCompatibleObject;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persisted definition of a table. Every column, index and constraint carries its own {@link SchemaState},
 * which only the DDL job changing that object moves.
 */
public class TableMeta implements IForwardCompatibleObject, GsonPostProcessable {
    public static final String DEFAULT_CHARSET = "utf8mb4";
    public static final String DEFAULT_COLLATION = "utf8mb4_bin";

    @SerializedName(value = "id")
    private long id;
    @SerializedName(value = "dbId")
    private long dbId;
    @SerializedName(value = "name")
    private String name;
    @SerializedName(value = "state")
    private SchemaState state = SchemaState.PUBLIC;
    @SerializedName(value = "columns")
    private List<ColumnMeta> columns = Lists.newArrayList();
    @SerializedName(value = "indexes")
    private List<IndexMeta> indexes = Lists.newArrayList();
    @SerializedName(value = "partitionInfo")
    private PartitionInfo partitionInfo;
    @SerializedName(value = "constraints")
    private List<CheckConstraint> constraints = Lists.newArrayList();
    @SerializedName(value = "charset")
    private String charset = DEFAULT_CHARSET;
    @SerializedName(value = "collation")
    private String collation = DEFAULT_COLLATION;
    @SerializedName(value = "autoIncrementBase")
    private long autoIncrementBase;
    // increased every time the table data is truncated
    @SerializedName(value = "dataGeneration")
    private long dataGeneration;
    @SerializedName(value = "maxColumnId")
    private long maxColumnId;
    @SerializedName(value = "maxIndexId")
    private long maxIndexId;
    @SerializedName(value = "maxConstraintId")
    private long maxConstraintId;

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private TableMeta() {
    }

    public TableMeta(long dbId, long id, String name, List<ColumnMeta> columns) {
        this.dbId = dbId;
        this.id = id;
        this.name = name;
        for (ColumnMeta column : columns) {
            addColumn(column, null);
        }
    }

    public TableMeta copy() {
        return GsonUtils.copy(this, TableMeta.class);
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public long getDbId() {
        return dbId;
    }

    public void setDbId(long dbId) {
        this.dbId = dbId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public SchemaState getState() {
        return state;
    }

    public void setState(SchemaState state) {
        this.state = state;
    }

    public List<ColumnMeta> getColumns() {
        return columns;
    }

    public List<ColumnMeta> getPublicColumns() {
        return columns.stream().filter(c -> c.getState() == SchemaState.PUBLIC).collect(Collectors.toList());
    }

    public List<IndexMeta> getIndexes() {
        return indexes;
    }

    public List<CheckConstraint> getConstraints() {
        return constraints;
    }

    public PartitionInfo getPartitionInfo() {
        return partitionInfo;
    }

    public void setPartitionInfo(PartitionInfo partitionInfo) {
        this.partitionInfo = partitionInfo;
    }

    public String getCharset() {
        return charset;
    }

    public String getCollation() {
        return collation;
    }

    public void setCharsetAndCollation(String charset, String collation) {
        this.charset = charset;
        this.collation = collation;
    }

    public long getAutoIncrementBase() {
        return autoIncrementBase;
    }

    public void setAutoIncrementBase(long autoIncrementBase) {
        this.autoIncrementBase = autoIncrementBase;
    }

    public long getDataGeneration() {
        return dataGeneration;
    }

    public void increaseDataGeneration() {
        this.dataGeneration++;
    }

    public ColumnMeta findColumn(String columnName) {
        for (ColumnMeta column : columns) {
            if (column.nameEquals(columnName)) {
                return column;
            }
        }
        return null;
    }

    public int indexOfColumn(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).nameEquals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Adds the column after the given one, or at the end when afterColumn is null or unknown.
     * The column gets a fresh id.
     */
    public void addColumn(ColumnMeta column, String afterColumn) {
        Preconditions.checkState(findColumn(column.getName()) == null, "column %s exists", column.getName());
        column.setId(++maxColumnId);
        int pos = afterColumn == null ? -1 : indexOfColumn(afterColumn);
        if (pos < 0) {
            columns.add(column);
        } else {
            columns.add(pos + 1, column);
        }
    }

    public ColumnMeta removeColumn(String columnName) {
        int pos = indexOfColumn(columnName);
        return pos < 0 ? null : columns.remove(pos);
    }

    public IndexMeta findIndex(String indexName) {
        for (IndexMeta index : indexes) {
            if (index.nameEquals(indexName)) {
                return index;
            }
        }
        return null;
    }

    public IndexMeta findIndex(long indexId) {
        for (IndexMeta index : indexes) {
            if (index.getId() == indexId) {
                return index;
            }
        }
        return null;
    }

    public IndexMeta getPrimaryKey() {
        for (IndexMeta index : indexes) {
            if (index.isPrimary()) {
                return index;
            }
        }
        return null;
    }

    public void addIndex(IndexMeta index) {
        Preconditions.checkState(findIndex(index.getName()) == null, "index %s exists", index.getName());
        index.setId(++maxIndexId);
        indexes.add(index);
    }

    public IndexMeta removeIndex(String indexName) {
        IndexMeta index = findIndex(indexName);
        if (index != null) {
            indexes.remove(index);
        }
        return index;
    }

    public CheckConstraint findConstraint(String constraintName) {
        for (CheckConstraint constraint : constraints) {
            if (constraint.nameEquals(constraintName)) {
                return constraint;
            }
        }
        return null;
    }

    public void addConstraint(CheckConstraint constraint) {
        Preconditions.checkState(findConstraint(constraint.getName()) == null,
                "constraint %s exists", constraint.getName());
        constraint.setId(++maxConstraintId);
        constraints.add(constraint);
    }

    public CheckConstraint removeConstraint(String constraintName) {
        CheckConstraint constraint = findConstraint(constraintName);
        if (constraint != null) {
            constraints.remove(constraint);
        }
        return constraint;
    }

    @Override
    public Map<String, JsonElement> getRetainedProperties() {
        if (retainedProperties == null) {
            retainedProperties = Maps.newHashMap();
        }
        return retainedProperties;
    }

    @Override
    public void gsonPostProcess() {
        // records written before a list existed do not carry it
        if (columns == null) {
            columns = Lists.newArrayList();
        }
        if (indexes == null) {
            indexes = Lists.newArrayList();
        }
        if (constraints == null) {
            constraints = Lists.newArrayList();
        }
    }

    @Override
    public String toString() {
        return "table " + name + "(" + id + ") in db " + dbId;
    }
}
