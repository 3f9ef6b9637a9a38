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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class SchemaVersionSyncerTest {

    @Test
    public void testNoLiveNodeIsAlwaysSynced() throws Exception {
        SchemaVersionSyncer syncer = new SchemaVersionSyncer();
        Assertions.assertTrue(syncer.waitVersionSynced(100, 10));
        Assertions.assertEquals(-1, syncer.getNodeVersion("node-1"));
    }

    @Test
    public void testLaggingNodeTimesOut() throws Exception {
        SchemaVersionSyncer syncer = new SchemaVersionSyncer();
        syncer.register("node-1", 3);
        syncer.register("node-2", 5);

        Assertions.assertEquals(Lists.newArrayList("node-1"), syncer.getLaggingNodes(5));
        Assertions.assertFalse(syncer.waitVersionSynced(5, 20));

        // acks never move a node back
        syncer.ack("node-2", 4);
        Assertions.assertEquals(5, syncer.getNodeVersion("node-2"));
        // unknown nodes are ignored
        syncer.ack("node-3", 9);
        Assertions.assertEquals(-1, syncer.getNodeVersion("node-3"));

        syncer.unregister("node-1");
        Assertions.assertTrue(syncer.waitVersionSynced(5, 20));
    }

    @Test
    public void testAckReleasesTheWaiter() throws Exception {
        SchemaVersionSyncer syncer = new SchemaVersionSyncer();
        syncer.register("node-1", 0);
        AtomicBoolean synced = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                synced.set(syncer.waitVersionSynced(1, 10_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        waiter.start();

        syncer.ack("node-1", 1);

        Assertions.assertTrue(done.await(10, TimeUnit.SECONDS));
        Assertions.assertTrue(synced.get());
    }
}
