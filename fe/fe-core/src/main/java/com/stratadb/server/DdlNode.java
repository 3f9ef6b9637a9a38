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

package com.stratadb.server;

import com.google.common.collect.Maps;
import com.stratadb.alter.AlterJobCallback;
import com.stratadb.alter.AlterJobCallbackRegistry;
import com.stratadb.alter.AlterJobMgr;
import com.stratadb.alter.AlterJobQueue;
import com.stratadb.alter.AlterJobRunner;
import com.stratadb.alter.AlterJobScheduler;
import com.stratadb.alter.RollbackConverter;
import com.stratadb.alter.action.ActionHandlers;
import com.stratadb.common.Config;
import com.stratadb.common.DdlException;
import com.stratadb.leader.OwnerElection;
import com.stratadb.leader.OwnerElectionDaemon;
import com.stratadb.meta.MetaStoreException;
import com.stratadb.meta.MetadataStore;
import com.stratadb.meta.SchemaCache;
import com.stratadb.meta.SchemaVersionPublisher;
import com.stratadb.meta.SchemaVersionSyncer;
import com.stratadb.meta.SchemaVersionWatcher;
import com.stratadb.task.ReorgContextManager;
import com.stratadb.task.ReorgWorkerPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * One node of the cluster taking part in DDL: it serves the job control surface, watches schema versions and,
 * while it holds the owner role, runs the jobs.
 */
public class DdlNode {
    private static final Logger LOG = LogManager.getLogger(DdlNode.class);

    private final String nodeId;
    private final MetadataStore store;
    private final OwnerElection election;
    private final SchemaVersionSyncer syncer;
    private final ReorgWorkerPool reorgPool;
    private final SchemaVersionPublisher publisher;
    private final ReorgContextManager reorgContexts;
    private final AlterJobRunner runner;
    private final AlterJobScheduler scheduler;
    private final AlterJobMgr jobMgr;
    private final SchemaVersionWatcher watcher;
    private final OwnerElectionDaemon electionDaemon;
    // dbId -> schema served by this node, guarded by this
    private final Map<Long, SchemaCache> schemaCaches = Maps.newHashMap();
    // last version every cache of this node loaded, guarded by this
    private long loadedVersion;

    public DdlNode(MetadataStore store, OwnerElection election, SchemaVersionSyncer syncer,
                   ReorgWorkerPool reorgPool, AlterJobCallback callback) throws MetaStoreException {
        this.nodeId = election.getNodeId();
        this.store = store;
        this.election = election;
        this.syncer = syncer;
        this.reorgPool = reorgPool;

        long version = store.getSchemaVersion();
        this.publisher = new SchemaVersionPublisher(version);
        this.reorgContexts = new ReorgContextManager(reorgPool);
        this.runner = new AlterJobRunner(store, new ActionHandlers(), new RollbackConverter(reorgContexts),
                reorgContexts, publisher, syncer, election, callback);
        AlterJobQueue queue = new AlterJobQueue(store);
        this.scheduler = new AlterJobScheduler(election, queue, runner, reorgContexts);
        this.jobMgr = new AlterJobMgr(store, queue, callback);
        this.watcher = new SchemaVersionWatcher(nodeId, store, publisher);
        this.electionDaemon = new OwnerElectionDaemon(election, Math.max(1, Config.ddl_owner_lease_ms / 3));

        this.loadedVersion = version;
        syncer.register(nodeId, version);
        publisher.addListener(this::onSchemaVersionChanged);
    }

    /**
     * A version is acknowledged to the owner only after every schema cache of the node loaded it. A failed reload
     * leaves the version unacknowledged, the publisher delivers it again on the next watcher cycle.
     */
    private void onSchemaVersionChanged(long version) throws MetaStoreException {
        reloadSchemaCaches(version);
        syncer.ack(nodeId, version);
        runner.getCallback().onWatched(version);
    }

    private synchronized void reloadSchemaCaches(long version) throws MetaStoreException {
        for (SchemaCache cache : schemaCaches.values()) {
            if (cache.getLoadedVersion() < version) {
                cache.onSchemaVersionChanged(version);
            }
        }
        loadedVersion = version;
    }

    /**
     * A node using the callback named by ddl_callback_hook.
     */
    public static DdlNode create(MetadataStore store, OwnerElection election, SchemaVersionSyncer syncer,
                                 ReorgWorkerPool reorgPool, AlterJobCallbackRegistry callbacks)
            throws DdlException, MetaStoreException {
        return new DdlNode(store, election, syncer, reorgPool, callbacks.get(Config.ddl_callback_hook));
    }

    public void start() {
        electionDaemon.start();
        watcher.start();
        scheduler.start();
        LOG.info("ddl node {} started", nodeId);
    }

    /**
     * Leaves the cluster, handing the owner role over right away.
     */
    public void stop() {
        scheduler.shutdown();
        watcher.setStop();
        electionDaemon.setStop();
        election.resign();
        reorgPool.stopAll();
        syncer.unregister(nodeId);
        LOG.info("ddl node {} stopped", nodeId);
    }

    /**
     * Stops the node without giving the owner role up. Another node takes over once the lease expired.
     */
    public void crash() {
        scheduler.shutdown();
        watcher.setStop();
        electionDaemon.setStop();
        reorgContexts.clear();
        reorgPool.stopAll();
        syncer.unregister(nodeId);
        LOG.warn("ddl node {} crashed", nodeId);
    }

    /**
     * The schema of the db as of the last version this node loaded. The cache follows every later version.
     */
    public synchronized SchemaCache getSchemaCache(long dbId) throws MetaStoreException {
        SchemaCache cache = schemaCaches.get(dbId);
        if (cache == null) {
            cache = new SchemaCache(store, dbId);
            cache.onSchemaVersionChanged(loadedVersion);
            schemaCaches.put(dbId, cache);
        }
        return cache;
    }

    public String getNodeId() {
        return nodeId;
    }

    public OwnerElection getElection() {
        return election;
    }

    public SchemaVersionPublisher getPublisher() {
        return publisher;
    }

    public ReorgContextManager getReorgContexts() {
        return reorgContexts;
    }

    public AlterJobRunner getRunner() {
        return runner;
    }

    public AlterJobScheduler getScheduler() {
        return scheduler;
    }

    public AlterJobMgr getJobMgr() {
        return jobMgr;
    }
}
