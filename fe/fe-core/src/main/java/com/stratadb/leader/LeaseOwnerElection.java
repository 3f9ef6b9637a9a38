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

package com.stratadb.leader;

import com.stratadb.common.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link OwnerElection} over an {@link OwnerLease}. Ownership is only reported while the lease is live,
 * so a node that stopped renewing stops acting as owner once the lease runs out even before it notices.
 */
public class LeaseOwnerElection implements OwnerElection {
    private static final Logger LOG = LogManager.getLogger(LeaseOwnerElection.class);

    private final String nodeId;
    private final OwnerLease lease;
    private final List<OwnerLossListener> lossListeners = new CopyOnWriteArrayList<>();
    private volatile boolean owner;

    public LeaseOwnerElection(String nodeId, OwnerLease lease) {
        this.nodeId = nodeId;
        this.lease = lease;
    }

    @Override
    public String getNodeId() {
        return nodeId;
    }

    @Override
    public synchronized boolean tryAcquire() {
        if (lease.tryAcquire(nodeId, Config.ddl_owner_lease_ms)) {
            if (!owner) {
                owner = true;
                LOG.info("node {} becomes the DDL owner, term {}", nodeId, lease.getTerm());
            }
            return true;
        }
        return false;
    }

    @Override
    public synchronized boolean renew() {
        if (!owner) {
            return false;
        }
        if (lease.renew(nodeId, Config.ddl_owner_lease_ms)) {
            return true;
        }
        LOG.warn("node {} lost the DDL owner lease", nodeId);
        markLost();
        return false;
    }

    @Override
    public void watchLoss(OwnerLossListener listener) {
        lossListeners.add(listener);
    }

    @Override
    public boolean isOwner() {
        return owner && lease.isHeldBy(nodeId);
    }

    @Override
    public synchronized void resign() {
        if (owner) {
            lease.release(nodeId);
            LOG.info("node {} resigns the DDL owner", nodeId);
            markLost();
        }
    }

    private void markLost() {
        owner = false;
        for (OwnerLossListener listener : lossListeners) {
            listener.onOwnerLost(nodeId);
        }
    }
}
