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

package com.stratadb.alter;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;
import com.stratadb.persist.gson.IForwardCompatibleObject;

import java.util.List;
import java.util.Map;

/**
 * Sub-jobs of a composite job.
 * While revertible is set the sub-jobs are stepped to their point of no return one by one, and the whole job can
 * still be rolled back. Once every sub-job is non-revertible the flag is cleared and the sub-jobs are finished.
 */
public class MultiSchemaInfo implements IForwardCompatibleObject {
    @SerializedName(value = "subJobs")
    private List<SubJob> subJobs = Lists.newArrayList();
    @SerializedName(value = "revertible")
    private boolean revertible = true;

    private transient Map<String, JsonElement> retainedProperties = Maps.newHashMap();

    private MultiSchemaInfo() {
    }

    public MultiSchemaInfo(List<SubJob> subJobs) {
        this.subJobs = Lists.newArrayList(subJobs);
    }

    public List<SubJob> getSubJobs() {
        return subJobs;
    }

    public boolean isRevertible() {
        return revertible;
    }

    public void setRevertible(boolean revertible) {
        this.revertible = revertible;
    }

    public boolean hasNonRevertibleSubJob() {
        return subJobs.stream().anyMatch(s -> !s.isRevertible());
    }

    @Override
    public Map<String, JsonElement> getRetainedProperties() {
        if (retainedProperties == null) {
            retainedProperties = Maps.newHashMap();
        }
        return retainedProperties;
    }
}
