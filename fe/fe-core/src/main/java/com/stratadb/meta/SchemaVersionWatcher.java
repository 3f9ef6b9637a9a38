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

import com.stratadb.common.Config;
import com.stratadb.common.util.Daemon;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Polls the store for the current schema version and hands it to the local publisher.
 * Runs on every node, the owner included, so a node that just became owner has seen every version.
 */
public class SchemaVersionWatcher extends Daemon {
    private static final Logger LOG = LogManager.getLogger(SchemaVersionWatcher.class);

    private final MetadataStore store;
    private final SchemaVersionPublisher publisher;

    public SchemaVersionWatcher(String nodeId, MetadataStore store, SchemaVersionPublisher publisher) {
        super("schema-version-watcher-" + nodeId, Config.schema_version_watch_interval_ms);
        this.store = store;
        this.publisher = publisher;
    }

    @Override
    protected void runOneCycle() {
        try {
            publisher.advanceTo(store.getSchemaVersion());
        } catch (MetaStoreException e) {
            LOG.warn("failed to read schema version, will retry in {} ms", getInterval(), e);
        }
    }
}
