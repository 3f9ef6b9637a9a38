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

package com.stratadb.alter.action;

import com.stratadb.alter.ActionType;
import com.stratadb.alter.AlterCancelException;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.SchemaState;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.task.ReorgException;

import java.util.List;

/**
 * The state machine of one kind of schema change.
 * <p>
 * A step reads the job and its table from the context, checks they still agree, moves the job and the changed
 * object to the next {@link SchemaState} and tells the runner what to commit. Steps must be idempotent with respect
 * to the persisted state: a new owner re-enters a job at whatever state was last committed.
 */
public interface ActionHandler {

    ActionType getType();

    /**
     * @return the schema states a running job of this kind goes through, in order, or an empty list when the
     *         progress is not a single sequence
     */
    List<SchemaState> getPhases();

    StepResult runStep(StepContext ctx) throws AlterCancelException, ReorgException, MetaStoreException;

    /**
     * Drives a job the rollback converter turned into ROLLINGBACK back to its state before the job.
     */
    StepResult rollbackStep(StepContext ctx) throws AlterCancelException, ReorgException, MetaStoreException;
}
