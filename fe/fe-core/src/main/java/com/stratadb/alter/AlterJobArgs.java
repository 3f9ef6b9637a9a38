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

import com.google.common.collect.Lists;
import com.google.gson.annotations.SerializedName;
import com.stratadb.catalog.CheckConstraint;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.PartitionDef;
import com.stratadb.catalog.TableMeta;

import java.util.List;

/**
 * Arguments of the DDL jobs, persisted as the raw args of the job record. Each action type decodes the class it
 * needs. A rolled back job carries the arguments of the inverse change.
 */
public class AlterJobArgs {

    public static class CreateTableArgs {
        @SerializedName(value = "table")
        private TableMeta table;

        public CreateTableArgs(TableMeta table) {
            this.table = table;
        }

        public TableMeta getTable() {
            return table;
        }
    }

    public static class RenameTableArgs {
        @SerializedName(value = "newName")
        private String newName;

        public RenameTableArgs(String newName) {
            this.newName = newName;
        }

        public String getNewName() {
            return newName;
        }
    }

    public static class AddColumnArgs {
        @SerializedName(value = "column")
        private ColumnMeta column;
        @SerializedName(value = "afterColumn")
        private String afterColumn;

        public AddColumnArgs(ColumnMeta column, String afterColumn) {
            this.column = column;
            this.afterColumn = afterColumn;
        }

        public ColumnMeta getColumn() {
            return column;
        }

        public String getAfterColumn() {
            return afterColumn;
        }
    }

    public static class DropColumnArgs {
        @SerializedName(value = "columnName")
        private String columnName;
        // single column indexes dropped together with the column
        @SerializedName(value = "indexNames")
        private List<String> indexNames = Lists.newArrayList();

        public DropColumnArgs(String columnName) {
            this.columnName = columnName;
        }

        public String getColumnName() {
            return columnName;
        }

        public List<String> getIndexNames() {
            return indexNames;
        }

        public void setIndexNames(List<String> indexNames) {
            this.indexNames = Lists.newArrayList(indexNames);
        }
    }

    public static class ModifyColumnArgs {
        @SerializedName(value = "columnName")
        private String columnName;
        @SerializedName(value = "newColumn")
        private ColumnMeta newColumn;
        // hidden column holding the converted data, only for a change that rewrites the data
        @SerializedName(value = "changingColumnName")
        private String changingColumnName;

        public ModifyColumnArgs(String columnName, ColumnMeta newColumn) {
            this.columnName = columnName;
            this.newColumn = newColumn;
        }

        public String getColumnName() {
            return columnName;
        }

        public ColumnMeta getNewColumn() {
            return newColumn;
        }

        public String getChangingColumnName() {
            return changingColumnName;
        }

        public void setChangingColumnName(String changingColumnName) {
            this.changingColumnName = changingColumnName;
        }
    }

    public static class AddIndexArgs {
        @SerializedName(value = "indexName")
        private String indexName;
        @SerializedName(value = "columns")
        private List<String> columns;
        @SerializedName(value = "unique")
        private boolean unique;
        @SerializedName(value = "primary")
        private boolean primary;

        public AddIndexArgs(String indexName, List<String> columns, boolean unique, boolean primary) {
            this.indexName = indexName;
            this.columns = Lists.newArrayList(columns);
            this.unique = unique;
            this.primary = primary;
        }

        public String getIndexName() {
            return indexName;
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
    }

    public static class DropIndexArgs {
        @SerializedName(value = "indexName")
        private String indexName;
        @SerializedName(value = "primary")
        private boolean primary;

        public DropIndexArgs(String indexName, boolean primary) {
            this.indexName = indexName;
            this.primary = primary;
        }

        public String getIndexName() {
            return indexName;
        }

        public boolean isPrimary() {
            return primary;
        }
    }

    public static class RenameIndexArgs {
        @SerializedName(value = "fromName")
        private String fromName;
        @SerializedName(value = "toName")
        private String toName;

        public RenameIndexArgs(String fromName, String toName) {
            this.fromName = fromName;
            this.toName = toName;
        }

        public String getFromName() {
            return fromName;
        }

        public String getToName() {
            return toName;
        }
    }

    public static class IndexVisibilityArgs {
        @SerializedName(value = "indexName")
        private String indexName;
        @SerializedName(value = "visible")
        private boolean visible;

        public IndexVisibilityArgs(String indexName, boolean visible) {
            this.indexName = indexName;
            this.visible = visible;
        }

        public String getIndexName() {
            return indexName;
        }

        public boolean isVisible() {
            return visible;
        }
    }

    /**
     * Add partition uses the definitions, drop and truncate use the names,
     * reorganize replaces the named partitions with the definitions.
     */
    public static class PartitionArgs {
        @SerializedName(value = "names")
        private List<String> names = Lists.newArrayList();
        @SerializedName(value = "partitions")
        private List<PartitionDef> partitions = Lists.newArrayList();

        public PartitionArgs(List<String> names, List<PartitionDef> partitions) {
            this.names = Lists.newArrayList(names);
            this.partitions = Lists.newArrayList(partitions);
        }

        public static PartitionArgs ofNames(List<String> names) {
            return new PartitionArgs(names, Lists.newArrayList());
        }

        public static PartitionArgs ofDefinitions(List<PartitionDef> partitions) {
            return new PartitionArgs(Lists.newArrayList(), partitions);
        }

        public List<String> getNames() {
            return names;
        }

        public List<PartitionDef> getPartitions() {
            return partitions;
        }
    }

    public static class AddCheckConstraintArgs {
        @SerializedName(value = "constraint")
        private CheckConstraint constraint;

        public AddCheckConstraintArgs(CheckConstraint constraint) {
            this.constraint = constraint;
        }

        public CheckConstraint getConstraint() {
            return constraint;
        }
    }

    public static class CheckConstraintArgs {
        @SerializedName(value = "name")
        private String name;
        @SerializedName(value = "enforced")
        private boolean enforced;

        public CheckConstraintArgs(String name, boolean enforced) {
            this.name = name;
            this.enforced = enforced;
        }

        public String getName() {
            return name;
        }

        public boolean isEnforced() {
            return enforced;
        }
    }

    public static class RebaseAutoIdArgs {
        @SerializedName(value = "newBase")
        private long newBase;
        @SerializedName(value = "force")
        private boolean force;

        public RebaseAutoIdArgs(long newBase, boolean force) {
            this.newBase = newBase;
            this.force = force;
        }

        public long getNewBase() {
            return newBase;
        }

        public boolean isForce() {
            return force;
        }
    }

    public static class CharsetArgs {
        @SerializedName(value = "charset")
        private String charset;
        @SerializedName(value = "collation")
        private String collation;

        public CharsetArgs(String charset, String collation) {
            this.charset = charset;
            this.collation = collation;
        }

        public String getCharset() {
            return charset;
        }

        public String getCollation() {
            return collation;
        }
    }
}
