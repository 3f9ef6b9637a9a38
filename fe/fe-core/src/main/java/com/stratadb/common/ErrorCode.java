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

package com.stratadb.common;

import java.util.MissingFormatArgumentException;

/**
 * Error codes reported to clients of the DDL control surface.
 * The numbers and SQLSTATE values follow the MySQL protocol so that existing drivers can map them.
 */
public enum ErrorCode {
    ERR_TABLE_EXISTS_ERROR(1050, new byte[] {'4', '2', 'S', '0', '1'}, "Table '%s' already exists"),
    ERR_BAD_TABLE_ERROR(1051, new byte[] {'4', '2', 'S', '0', '2'}, "Unknown table '%s'"),
    ERR_BAD_FIELD_ERROR(1054, new byte[] {'4', '2', 'S', '2', '2'}, "Unknown column '%s' in '%s'"),
    ERR_DUP_FIELDNAME(1060, new byte[] {'4', '2', 'S', '2', '1'}, "Duplicate column name '%s'"),
    ERR_DUP_KEYNAME(1061, new byte[] {'4', '2', '0', '0', '0'}, "Duplicate key name '%s'"),
    ERR_MULTIPLE_PRI_KEY(1068, new byte[] {'4', '2', '0', '0', '0'}, "Multiple primary key defined"),
    ERR_KEY_COLUMN_DOES_NOT_EXIST(1072, new byte[] {'4', '2', '0', '0', '0'},
            "Key column '%s' doesn't exist in table"),
    ERR_CANT_REMOVE_ALL_FIELDS(1090, new byte[] {'4', '2', '0', '0', '0'},
            "You can't delete all columns with ALTER TABLE; use DROP TABLE instead"),
    ERR_CANT_DROP_FIELD_OR_KEY(1091, new byte[] {'4', '2', '0', '0', '0'},
            "Can't DROP '%s'; check that column/key exists"),
    ERR_UNKNOWN_ERROR(1105, new byte[] {'H', 'Y', '0', '0', '0'}, "Unknown error"),
    ERR_UNKNOWN_CHARACTER_SET(1115, new byte[] {'4', '2', '0', '0', '0'}, "Unknown character set: '%s'"),
    ERR_KEY_DOES_NOT_EXIST(1176, new byte[] {'4', '2', '0', '0', '0'}, "Key '%s' doesn't exist in table '%s'"),
    ERR_UNKNOWN_COLLATION(1273, new byte[] {'H', 'Y', '0', '0', '0'}, "Unknown collation: '%s'"),
    ERR_COLLATION_CHARSET_MISMATCH(1253, new byte[] {'4', '2', '0', '0', '0'},
            "COLLATION '%s' is not valid for CHARACTER SET '%s'"),
    ERR_DROP_PARTITION_NON_EXISTENT(1507, new byte[] {'H', 'Y', '0', '0', '0'},
            "Error in list of partitions to %s"),
    ERR_DROP_LAST_PARTITION(1508, new byte[] {'H', 'Y', '0', '0', '0'},
            "Cannot remove all partitions, use DROP TABLE instead"),
    ERR_PARTITION_MGMT_ON_NONPARTITIONED(1505, new byte[] {'H', 'Y', '0', '0', '0'},
            "Partition management on a not partitioned table is not possible"),
    ERR_SAME_NAME_PARTITION(1517, new byte[] {'H', 'Y', '0', '0', '0'}, "Duplicate partition name %s"),
    ERR_CHECK_CONSTRAINT_NOT_FOUND(3821, new byte[] {'H', 'Y', '0', '0', '0'},
            "Check constraint '%s' is not found in the table."),
    ERR_CHECK_CONSTRAINT_DUP_NAME(3822, new byte[] {'H', 'Y', '0', '0', '0'},
            "Duplicate check constraint name '%s'."),
    ERR_CANT_DROP_COLUMN_WITH_INDEX(8200, new byte[] {'H', 'Y', '0', '0', '0'},
            "can't drop column %s with composite index covered or primary key covered now"),
    ERR_INVISIBLE_PRIMARY_KEY(3522, new byte[] {'H', 'Y', '0', '0', '0'}, "A primary key index cannot be invisible"),
    ERR_AUTO_ID_REBASE_TOO_SMALL(8201, new byte[] {'H', 'Y', '0', '0', '0'},
            "Auto increment base %d is smaller than the current base %d"),

    ERR_INVALID_DDL_STATE(8202, new byte[] {'H', 'Y', '0', '0', '0'}, "invalid %s state: %s"),
    ERR_INVALID_DDL_JOB(8203, new byte[] {'H', 'Y', '0', '0', '0'}, "DDL job with ID %d is invalid: %s"),
    ERR_DDL_JOB_NOT_FOUND(8147, new byte[] {'H', 'Y', '0', '0', '0'}, "DDL Job:%d not found"),
    ERR_CANCEL_FINISHED_DDL_JOB(8148, new byte[] {'H', 'Y', '0', '0', '0'},
            "This job:%d is finished, so can't be cancelled"),
    ERR_CANNOT_CANCEL_DDL_JOB(8149, new byte[] {'H', 'Y', '0', '0', '0'},
            "This job:%d is almost finished, can't be cancelled now"),
    ERR_CANCELLED_DDL_JOB(8214, new byte[] {'H', 'Y', '0', '0', '0'}, "Cancelled DDL job"),
    ERR_DDL_JOB_ALREADY_CANCELLING(8215, new byte[] {'H', 'Y', '0', '0', '0'},
            "This job:%d is already being cancelled"),
    ERR_PAUSE_DDL_JOB(8260, new byte[] {'H', 'Y', '0', '0', '0'},
            "Job %d can't be paused now, it is in state %s"),
    ERR_RESUME_DDL_JOB(8261, new byte[] {'H', 'Y', '0', '0', '0'},
            "Job %d can't be resumed, it is in state %s"),
    ERR_UNSUPPORTED_MULTI_SCHEMA_CHANGE(8216, new byte[] {'H', 'Y', '0', '0', '0'},
            "Unsupported multi schema change for %s"),
    ERR_DDL_ERROR_COUNT_LIMIT(8217, new byte[] {'H', 'Y', '0', '0', '0'},
            "rollback DDL job error count exceed the limit %d, cancelled it now"),
    ERR_NOT_OWNER(8218, new byte[] {'H', 'Y', '0', '0', '0'}, "Node %s is not the DDL owner"),
    ERR_DDL_HOOK_NOT_FOUND(8219, new byte[] {'H', 'Y', '0', '0', '0'},
            "ddl hook `%s` is not found in hook registered map"),

    ERROR_CONFIG_NOT_EXIST(5058, new byte[] {'F', '0', '0', '0', '0'}, "Config '%s' does not exist or is not mutable");

    ErrorCode(int code, byte[] sqlState, String errorMsg) {
        this.code = code;
        this.sqlState = sqlState;
        this.errorMsg = errorMsg;
    }

    // This is error code
    private final int code;
    // This sql state is compatible with ANSI SQL
    private final byte[] sqlState;
    // Error message format
    private final String errorMsg;

    public int getCode() {
        return code;
    }

    public byte[] getSqlState() {
        return sqlState;
    }

    public String formatErrorMsg(Object... args) {
        try {
            return String.format(errorMsg, args);
        } catch (MissingFormatArgumentException e) {
            return errorMsg;
        }
    }
}
