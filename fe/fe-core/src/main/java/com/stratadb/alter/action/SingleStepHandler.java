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
import com.stratadb.alter.AlterJob;
import com.stratadb.alter.StepContext;
import com.stratadb.alter.StepResult;
import com.stratadb.catalog.SchemaState;
import com.stratadb.meta.MetaStoreException;

/**
 * A change that becomes public in one step: NONE to PUBLIC.
 */
public abstract class SingleStepHandler extends BaseActionHandler {

    protected SingleStepHandler(ActionType type) {
        super(type, SchemaState.NONE, SchemaState.PUBLIC);
    }

    @Override
    public StepResult runStep(StepContext ctx) throws AlterCancelException, MetaStoreException {
        AlterJob job = ctx.getJob();
        if (job.getSchemaState() != SchemaState.NONE) {
            throw invalidState(getType().name().toLowerCase(), job.getSchemaState());
        }
        if (stopAtPointOfNoReturn(job)) {
            return StepResult.persist();
        }
        apply(ctx);
        return finish(job, SchemaState.PUBLIC);
    }

    /**
     * Validates the change against the table of the context and applies it.
     */
    protected abstract void apply(StepContext ctx) throws AlterCancelException, MetaStoreException;
}
