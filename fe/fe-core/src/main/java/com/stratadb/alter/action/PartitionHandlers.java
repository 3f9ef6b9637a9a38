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

import com.google.common.collect.Lists;
import com.stratadb.alter.AlterCancelException;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.PartitionDef;
import com.stratadb.catalog.PartitionInfo;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.task.ReorgTask;

import java.util.Iterator;
import java.util.List;

/**
 * Checks and helpers shared by the partition handlers.
 */
final class PartitionHandlers {

    private PartitionHandlers() {
    }

    static PartitionInfo requirePartitionInfo(TableMeta table) throws AlterCancelException {
        if (table.getPartitionInfo() == null) {
            throw new AlterCancelException(ErrorCode.ERR_PARTITION_MGMT_ON_NONPARTITIONED);
        }
        return table.getPartitionInfo();
    }

    static void checkExist(PartitionInfo info, List<String> names, String operation) throws AlterCancelException {
        if (names.isEmpty()) {
            throw new AlterCancelException(ErrorCode.ERR_DROP_PARTITION_NON_EXISTENT, operation);
        }
        for (String name : names) {
            if (info.findDefinition(name) == null) {
                throw new AlterCancelException(ErrorCode.ERR_DROP_PARTITION_NON_EXISTENT, operation);
            }
        }
    }

    /**
     * Gives the new definitions fresh ids and appends them to the adding definitions of the table.
     *
     * @param replaced names that may be reused because the partitions carrying them are replaced
     */
    static void addDefinitions(StepContext ctx, PartitionInfo info, List<PartitionDef> defs, List<String> replaced)
            throws AlterCancelException, MetaStoreException {
        for (int i = 0; i < defs.size(); i++) {
            String name = defs.get(i).getName();
            boolean replacing = replaced.stream().anyMatch(name::equalsIgnoreCase);
            if ((info.hasName(name) && !replacing) || PartitionInfo.namesOf(defs.subList(0, i)).stream()
                    .anyMatch(name::equalsIgnoreCase)) {
                throw new AlterCancelException(ErrorCode.ERR_SAME_NAME_PARTITION, name);
            }
        }
        for (PartitionDef def : defs) {
            def.setId(ctx.allocateId());
            info.getAddingDefinitions().add(def);
        }
    }

    /**
     * Removes the named definitions from the list and schedules the cleanup of their data.
     */
    static void removeDefinitions(StepContext ctx, List<PartitionDef> defs, List<String> names) {
        Iterator<PartitionDef> it = defs.iterator();
        while (it.hasNext()) {
            PartitionDef def = it.next();
            if (names.stream().anyMatch(def::nameEquals)) {
                it.remove();
                scheduleCleanup(ctx, def);
            }
        }
    }

    static void scheduleCleanup(StepContext ctx, PartitionDef def) {
        ctx.scheduleCleanup(ctx.newReorgTask(ReorgTask.Kind.CLEANUP_PARTITION, def.getId(),
                Lists.newArrayList(def.getName())));
    }
}
