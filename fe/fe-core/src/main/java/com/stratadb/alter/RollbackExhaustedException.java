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

import com.stratadb.common.Config;
import com.stratadb.common.ErrorCode;
import com.stratadb.common.StrataException;

/**
 * Rolling a job back failed more often than ddl_error_count_limit allows. The job is forced to CANCELLED.
 */
public class RollbackExhaustedException extends StrataException {
    public RollbackExhaustedException() {
        super(ErrorCode.ERR_DDL_ERROR_COUNT_LIMIT, Config.ddl_error_count_limit);
    }
}
