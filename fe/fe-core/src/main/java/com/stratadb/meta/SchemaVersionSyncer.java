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

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * Tracks the schema version each live node has loaded. The owner waits, for a bounded time, until every live node
 * has acknowledged a version it just published.
 */
public class SchemaVersionSyncer {
    private final Map<String, Long> nodeVersions = Maps.newHashMap();

    public synchronized void register(String nodeId, long version) {
        nodeVersions.put(nodeId, version);
        notifyAll();
    }

    public synchronized void unregister(String nodeId) {
        nodeVersions.remove(nodeId);
        notifyAll();
    }

    public synchronized void ack(String nodeId, long version) {
        Long current = nodeVersions.get(nodeId);
        if (current != null && current < version) {
            nodeVersions.put(nodeId, version);
            notifyAll();
        }
    }

    public synchronized long getNodeVersion(String nodeId) {
        Long version = nodeVersions.get(nodeId);
        return version == null ? -1 : version;
    }

    /**
     * @return true if all live nodes reached the version in time, false on timeout
     */
    public synchronized boolean waitVersionSynced(long version, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!getLaggingNodes(version).isEmpty()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }

    public synchronized List<String> getLaggingNodes(long version) {
        List<String> lagging = Lists.newArrayList();
        for (Map.Entry<String, Long> entry : nodeVersions.entrySet()) {
            if (entry.getValue() < version) {
                lagging.add(entry.getKey());
            }
        }
        return lagging;
    }
}
