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

import com.stratadb.catalog.SchemaState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Slows down the intermediate states of column type changes so concurrent DML can be run against each of them.
 */
public class ColumnTypeChangeCallback implements AlterJobCallback {
    private static final Logger LOG = LogManager.getLogger(ColumnTypeChangeCallback.class);

    public static final String NAME = "ctc_hook";
    public static final long DELAY_MS = 500;

    private final long delayMs;

    public ColumnTypeChangeCallback() {
        this(DELAY_MS);
    }

    ColumnTypeChangeCallback(long delayMs) {
        this.delayMs = delayMs;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void onJobRunBefore(AlterJob job) {
        if (job.getType() != ActionType.MODIFY_COLUMN) {
            return;
        }
        SchemaState state = job.getSchemaState();
        if (state == SchemaState.DELETE_ONLY || state == SchemaState.WRITE_ONLY
                || state == SchemaState.WRITE_REORGANIZATION) {
            LOG.info("delay job {} in {} for {} ms", job.getId(), state, delayMs);
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
