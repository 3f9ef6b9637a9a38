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

package com.stratadb.persist.gson;

import com.google.gson.JsonElement;

import java.util.Map;

/**
 * A persisted object that may be read by a node older than the one that wrote it.
 * Properties the reader does not understand are kept aside on load and written back on save,
 * so a mixed-version cluster never loses what a newer node recorded.
 */
public interface IForwardCompatibleObject {

    /**
     * @return the properties that were present in the JSON but could not be mapped, never null
     */
    Map<String, JsonElement> getRetainedProperties();
}
