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

/**
 * A value read from the metadata store together with the record version it was read at.
 * The version is what an optimistic write of the same record must present.
 */
public class Versioned<T> {
    private final T value;
    private final long version;

    public Versioned(T value, long version) {
        this.value = value;
        this.version = version;
    }

    public T getValue() {
        return value;
    }

    public long getVersion() {
        return version;
    }
}
