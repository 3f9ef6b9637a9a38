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
import com.stratadb.alter.AlterJobArgs.PartitionArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.PartitionDef;
import com.stratadb.catalog.PartitionInfo;
import com.stratadb.catalog.TableMeta;
import com.stratadb.meta.MetaStoreException;

import java.util.List;

/**
 * Gives the partitions new ids, the data under the old ids is cleaned up once the new ids are published.
 */
public class TruncatePartitionHandler extends SingleStepHandler {

    public TruncatePartitionHandler() {
        super(ActionType.TRUNCATE_TABLE_PARTITION);
    }

    @Override
    protected void apply(StepContext ctx) throws AlterCancelException, MetaStoreException {
        TableMeta table = ctx.requireTable();
        PartitionInfo info = PartitionHandlers.requirePartitionInfo(table);
        List<String> names = ctx.getJob().getArgs(PartitionArgs.class).getNames();
        PartitionHandlers.checkExist(info, names, "TRUNCATE");
        for (String name : names) {
            PartitionDef def = info.findDefinition(name);
            PartitionHandlers.scheduleCleanup(ctx, def);
            def.setId(ctx.allocateId());
        }
    }
}
