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

package com.stratadb.task;

public class ReorgResult {
    private final boolean success;
    private final long rowCount;
    private final String errMsg;

    private ReorgResult(boolean success, long rowCount, String errMsg) {
        this.success = success;
        this.rowCount = rowCount;
        this.errMsg = errMsg;
    }

    public static ReorgResult completed(long rowCount) {
        return new ReorgResult(true, rowCount, "");
    }

    public static ReorgResult failed(String errMsg) {
        return new ReorgResult(false, 0, errMsg);
    }

    public boolean isSuccess() {
        return success;
    }

    public long getRowCount() {
        return rowCount;
    }

    public String getErrMsg() {
        return errMsg;
    }

    @Override
    public String toString() {
        return success ? "completed(" + rowCount + " rows)" : "failed(" + errMsg + ")";
    }
}
