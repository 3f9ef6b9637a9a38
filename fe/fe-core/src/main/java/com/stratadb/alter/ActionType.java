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

/**
 * The kinds of schema change a DDL job performs.
 */
public enum ActionType {
    CREATE_TABLE,
    DROP_TABLE,
    TRUNCATE_TABLE,
    RENAME_TABLE,
    ADD_COLUMN,
    DROP_COLUMN,
    MODIFY_COLUMN,
    ADD_INDEX,
    DROP_INDEX,
    ADD_PRIMARY_KEY,
    DROP_PRIMARY_KEY,
    RENAME_INDEX,
    ALTER_INDEX_VISIBILITY,
    ADD_TABLE_PARTITION,
    DROP_TABLE_PARTITION,
    TRUNCATE_TABLE_PARTITION,
    REORGANIZE_PARTITION,
    ADD_CHECK_CONSTRAINT,
    DROP_CHECK_CONSTRAINT,
    ALTER_CHECK_CONSTRAINT,
    REBASE_AUTO_ID,
    MODIFY_TABLE_CHARSET_AND_COLLATE,
    MULTI_SCHEMA_CHANGE;

    /**
     * @return whether the change can be a sub-job of a MULTI_SCHEMA_CHANGE job
     */
    public boolean isComposable() {
        switch (this) {
            case ADD_COLUMN:
            case DROP_COLUMN:
            case ADD_INDEX:
            case DROP_INDEX:
            case MODIFY_COLUMN:
            case RENAME_INDEX:
            case ALTER_INDEX_VISIBILITY:
                return true;
            default:
                return false;
        }
    }

    public boolean needsExistingTable() {
        return this != CREATE_TABLE;
    }
}
