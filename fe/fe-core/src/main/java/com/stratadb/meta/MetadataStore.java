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

import com.stratadb.alter.AlterJob;
import com.stratadb.catalog.TableMeta;

import java.util.List;

/**
 * Transactional, versioned access to table definitions and DDL job records, shared by every node of the cluster.
 * Reads return private copies. All writes go through {@link #commit(MetaTxn)}.
 */
public interface MetadataStore {

    /**
     * Allocates a cluster-wide unique id, strictly greater than any id allocated before.
     */
    long allocateId() throws MetaStoreException;

    /**
     * @return the table with the record version it was read at, or null if the table does not exist in the db
     */
    Versioned<TableMeta> getTable(long dbId, long tableId) throws MetaStoreException;

    List<Versioned<TableMeta>> listTables(long dbId) throws MetaStoreException;

    /**
     * @return the active job, or null if there is no such active job
     */
    Versioned<AlterJob> getJob(long jobId) throws MetaStoreException;

    /**
     * @return active jobs ordered by id
     */
    List<Versioned<AlterJob>> listJobs() throws MetaStoreException;

    AlterJob getHistoryJob(long jobId) throws MetaStoreException;

    /**
     * @return finished jobs ordered by id
     */
    List<AlterJob> listHistoryJobs() throws MetaStoreException;

    void removeHistoryJob(long jobId) throws MetaStoreException;

    long getSchemaVersion() throws MetaStoreException;

    /**
     * @return the id of the job whose step produced the version, -1 if unknown
     */
    long getJobIdOfVersion(long version) throws MetaStoreException;

    CommitResult commit(MetaTxn txn) throws MetaStoreException;
}
