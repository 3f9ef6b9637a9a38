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

package com.stratadb.meta;

import com.google.common.collect.Maps;
import com.stratadb.catalog.TableMeta;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * The schema snapshot a node serves statements with. It reloads the tables of one db on every schema version,
 * so a statement admitted after version v sees the metadata of v or later.
 */
public class SchemaCache implements SchemaVersionListener {
    private static final Logger LOG = LogManager.getLogger(SchemaCache.class);

    private final MetadataStore store;
    private final long dbId;
    private volatile Map<Long, TableMeta> tables = Maps.newHashMap();
    private volatile long loadedVersion;

    public SchemaCache(MetadataStore store, long dbId) {
        this.store = store;
        this.dbId = dbId;
    }

    @Override
    public void onSchemaVersionChanged(long version) throws MetaStoreException {
        Map<Long, TableMeta> reloaded = Maps.newHashMap();
        for (Versioned<TableMeta> table : store.listTables(dbId)) {
            reloaded.put(table.getValue().getId(), table.getValue());
        }
        tables = reloaded;
        loadedVersion = version;
        LOG.debug("loaded schema of db {} at version {}", dbId, version);
    }

    public TableMeta getTable(long tableId) {
        return tables.get(tableId);
    }

    public long getLoadedVersion() {
        return loadedVersion;
    }
}
