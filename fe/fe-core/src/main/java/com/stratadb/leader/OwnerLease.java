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

import com.google.common.base.Ticker;

import java.util.concurrent.TimeUnit;

/**
 * The shared lease record nodes compete for. A lease is held by one node until it expires or is released.
 */
public class OwnerLease {
    private final Ticker ticker;
    // guarded by this
    private String holder;
    private long expireAtNanos;
    private long term;

    public OwnerLease() {
        this(Ticker.systemTicker());
    }

    public OwnerLease(Ticker ticker) {
        this.ticker = ticker;
    }

    public synchronized boolean tryAcquire(String nodeId, long leaseMs) {
        long now = ticker.read();
        if (holder != null && !holder.equals(nodeId) && now < expireAtNanos) {
            return false;
        }
        if (!nodeId.equals(holder) || now >= expireAtNanos) {
            term++;
        }
        holder = nodeId;
        expireAtNanos = now + TimeUnit.MILLISECONDS.toNanos(leaseMs);
        return true;
    }

    public synchronized boolean renew(String nodeId, long leaseMs) {
        long now = ticker.read();
        if (!nodeId.equals(holder) || now >= expireAtNanos) {
            return false;
        }
        expireAtNanos = now + TimeUnit.MILLISECONDS.toNanos(leaseMs);
        return true;
    }

    public synchronized void release(String nodeId) {
        if (nodeId.equals(holder)) {
            holder = null;
            expireAtNanos = 0;
        }
    }

    /**
     * @return the node holding a live lease, or null
     */
    public synchronized String getHolder() {
        return holder != null && ticker.read() < expireAtNanos ? holder : null;
    }

    public synchronized boolean isHeldBy(String nodeId) {
        return nodeId.equals(getHolder());
    }

    public synchronized long getTerm() {
        return term;
    }
}
