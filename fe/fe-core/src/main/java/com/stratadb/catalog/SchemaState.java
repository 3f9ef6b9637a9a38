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

package com.stratadb.catalog;

/**
 * Visibility phase of a schema object that a DDL job is changing.
 * <p>
 * The rank orders the phases by how much of the object concurrent statements can see:
 * an object in DELETE_ONLY only receives deletes, WRITE_ONLY also receives writes, PUBLIC is readable.
 */
public enum SchemaState {
    NONE(0),
    DELETE_REORGANIZATION(1),
    DELETE_ONLY(2),
    // partition variant: replicas are being prepared, the new partitions are not readable yet
    REPLICA_ONLY(2),
    WRITE_ONLY(3),
    WRITE_REORGANIZATION(4),
    PUBLIC(5);

    private final int visibility;

    SchemaState(int visibility) {
        this.visibility = visibility;
    }

    public int getVisibility() {
        return visibility;
    }

    public boolean isPublic() {
        return this == PUBLIC;
    }
}
