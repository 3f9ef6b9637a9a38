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

import com.stratadb.common.util.Daemon;

/**
 * Keeps competing for the owner role and renews the lease while this node holds it.
 */
public class OwnerElectionDaemon extends Daemon {
    private final OwnerElection election;

    public OwnerElectionDaemon(OwnerElection election, long intervalMs) {
        super("owner-election-" + election.getNodeId(), intervalMs);
        this.election = election;
    }

    @Override
    protected void runOneCycle() {
        if (election.isOwner()) {
            election.renew();
        } else {
            // covers a lease that expired before the renew noticed it
            election.renew();
            election.tryAcquire();
        }
    }
}
