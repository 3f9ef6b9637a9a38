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

/**
 * Grants the DDL owner role to at most one node at a time.
 */
public interface OwnerElection {

    String getNodeId();

    /**
     * Tries to become the owner.
     *
     * @return true if this node is the owner when the call returns
     */
    boolean tryAcquire();

    /**
     * Extends the lease of the current owner. When the lease is found lost, the loss listeners are notified.
     *
     * @return false if this node is no longer the owner
     */
    boolean renew();

    /**
     * Registers a listener called once every time this node stops being the owner.
     */
    void watchLoss(OwnerLossListener listener);

    boolean isOwner();

    /**
     * Gives the role up so another node can take it without waiting for the lease to expire.
     */
    void resign();
}
