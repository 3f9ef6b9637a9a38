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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Delivers schema versions to the listeners of one node.
 * <p>
 * Versions are consecutive, so when the node learns about version v it delivers every version between the last
 * delivered one and v. Each version reaches each listener exactly once and in order, whether the node learned
 * about it by committing the bump itself or by watching the store. A listener failing with a
 * {@link MetaStoreException} stays at its last handled version and gets the failed one again on the next advance.
 */
public class SchemaVersionPublisher {
    private static final Logger LOG = LogManager.getLogger(SchemaVersionPublisher.class);

    // listener -> last version it handled, guarded by this
    private final Map<SchemaVersionListener, Long> listeners = Maps.newLinkedHashMap();
    // guarded by this
    private long latestVersion;

    public SchemaVersionPublisher(long startVersion) {
        this.latestVersion = startVersion;
    }

    /**
     * The listener gets the versions after the latest one this publisher knows about.
     */
    public synchronized void addListener(SchemaVersionListener listener) {
        listeners.put(listener, latestVersion);
    }

    public synchronized void removeListener(SchemaVersionListener listener) {
        listeners.remove(listener);
    }

    /**
     * @return the highest version every listener has handled
     */
    public synchronized long getDeliveredVersion() {
        long delivered = latestVersion;
        for (long version : listeners.values()) {
            delivered = Math.min(delivered, version);
        }
        return delivered;
    }

    public synchronized long getLatestVersion() {
        return latestVersion;
    }

    public synchronized void advanceTo(long version) {
        latestVersion = Math.max(latestVersion, version);
        for (long next = getDeliveredVersion() + 1; next <= latestVersion; next++) {
            for (Map.Entry<SchemaVersionListener, Long> entry : listeners.entrySet()) {
                if (entry.getValue() == next - 1 && deliver(entry.getKey(), next)) {
                    entry.setValue(next);
                }
            }
        }
    }

    /**
     * @return false if the listener has to see the version again
     */
    private static boolean deliver(SchemaVersionListener listener, long version) {
        try {
            listener.onSchemaVersionChanged(version);
        } catch (MetaStoreException e) {
            LOG.warn("schema version listener {} failed on version {}, retry on the next advance",
                    listener, version, e);
            return false;
        } catch (RuntimeException e) {
            LOG.warn("schema version listener {} failed on version {}", listener, version, e);
        }
        return true;
    }
}
