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

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stratadb.alter.AlterJob;
import com.stratadb.catalog.TableMeta;
import com.stratadb.persist.gson.GsonUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-process {@link MetadataStore}. Records are kept in their persisted JSON form, so every read goes through the
 * same deserialization a remote reader would do and unknown properties survive a read-modify-write cycle.
 */
public class LocalMetadataStore implements MetadataStore {
    private static final Logger LOG = LogManager.getLogger(LocalMetadataStore.class);

    private static class Record {
        private final long dbId;
        private final String json;
        private final long version;

        Record(long dbId, String json, long version) {
            this.dbId = dbId;
            this.json = json;
            this.version = version;
        }
    }

    private final Map<Long, Record> tables = Maps.newHashMap();
    private final TreeMap<Long, Record> activeJobs = Maps.newTreeMap();
    private final TreeMap<Long, String> historyJobs = Maps.newTreeMap();
    private final TreeMap<Long, Long> versionToJob = Maps.newTreeMap();

    private long nextId;
    private long schemaVersion;

    public LocalMetadataStore() {
        this(1000L);
    }

    public LocalMetadataStore(long firstId) {
        this.nextId = firstId;
    }

    @Override
    public synchronized long allocateId() throws MetaStoreException {
        return nextId++;
    }

    @Override
    public synchronized Versioned<TableMeta> getTable(long dbId, long tableId) throws MetaStoreException {
        Record record = tables.get(tableId);
        if (record == null || record.dbId != dbId) {
            return null;
        }
        return new Versioned<>(GsonUtils.GSON.fromJson(record.json, TableMeta.class), record.version);
    }

    /**
     * @return the persisted form of the table, or null if it does not exist
     */
    public synchronized String getRawTable(long tableId) {
        Record record = tables.get(tableId);
        return record == null ? null : record.json;
    }

    public synchronized String getRawJob(long jobId) {
        Record record = activeJobs.get(jobId);
        return record != null ? record.json : historyJobs.get(jobId);
    }

    /**
     * Writes a raw job record as is, the way a newer node would have persisted it.
     */
    public synchronized void putRawJob(long jobId, String json) {
        Record old = activeJobs.get(jobId);
        activeJobs.put(jobId, new Record(0, json, old == null ? 1 : old.version + 1));
    }

    @Override
    public synchronized List<Versioned<TableMeta>> listTables(long dbId) throws MetaStoreException {
        List<Versioned<TableMeta>> result = Lists.newArrayList();
        for (Record record : tables.values()) {
            if (record.dbId == dbId) {
                result.add(new Versioned<>(GsonUtils.GSON.fromJson(record.json, TableMeta.class), record.version));
            }
        }
        return result;
    }

    @Override
    public synchronized Versioned<AlterJob> getJob(long jobId) throws MetaStoreException {
        Record record = activeJobs.get(jobId);
        if (record == null) {
            return null;
        }
        return new Versioned<>(GsonUtils.GSON.fromJson(record.json, AlterJob.class), record.version);
    }

    @Override
    public synchronized List<Versioned<AlterJob>> listJobs() throws MetaStoreException {
        List<Versioned<AlterJob>> result = Lists.newArrayList();
        for (Record record : activeJobs.values()) {
            result.add(new Versioned<>(GsonUtils.GSON.fromJson(record.json, AlterJob.class), record.version));
        }
        return result;
    }

    @Override
    public synchronized AlterJob getHistoryJob(long jobId) throws MetaStoreException {
        String json = historyJobs.get(jobId);
        return json == null ? null : GsonUtils.GSON.fromJson(json, AlterJob.class);
    }

    @Override
    public synchronized List<AlterJob> listHistoryJobs() throws MetaStoreException {
        List<AlterJob> result = Lists.newArrayList();
        for (String json : historyJobs.values()) {
            result.add(GsonUtils.GSON.fromJson(json, AlterJob.class));
        }
        return result;
    }

    @Override
    public synchronized void removeHistoryJob(long jobId) throws MetaStoreException {
        historyJobs.remove(jobId);
    }

    @Override
    public synchronized long getSchemaVersion() throws MetaStoreException {
        return schemaVersion;
    }

    @Override
    public synchronized long getJobIdOfVersion(long version) throws MetaStoreException {
        Long jobId = versionToJob.get(version);
        return jobId == null ? -1 : jobId;
    }

    @Override
    public synchronized CommitResult commit(MetaTxn txn) throws MetaStoreException {
        // check every expectation before applying anything
        for (MetaTxn.TableWrite write : txn.getTableWrites()) {
            Record current = tables.get(write.getTableId());
            long currentVersion = current == null ? 0 : current.version;
            if (currentVersion != write.getExpectedVersion()) {
                throw new MetaConflictException("table " + write.getTableId() + " is at version " + currentVersion
                        + ", expected " + write.getExpectedVersion());
            }
        }
        for (MetaTxn.JobWrite write : txn.getJobWrites()) {
            Record current = activeJobs.get(write.getJob().getId());
            long currentVersion = current == null ? 0 : current.version;
            if (currentVersion != write.getExpectedVersion()) {
                throw new MetaConflictException("job " + write.getJob().getId() + " is at version " + currentVersion
                        + ", expected " + write.getExpectedVersion());
            }
            if (current == null && historyJobs.containsKey(write.getJob().getId())) {
                throw new MetaConflictException("job " + write.getJob().getId() + " is already finished");
            }
        }

        for (MetaTxn.TableWrite write : txn.getTableWrites()) {
            if (write.getTable() == null) {
                tables.remove(write.getTableId());
            } else {
                tables.put(write.getTableId(), new Record(write.getDbId(), GsonUtils.GSON.toJson(write.getTable()),
                        write.getExpectedVersion() + 1));
            }
        }
        for (MetaTxn.JobWrite write : txn.getJobWrites()) {
            AlterJob job = write.getJob();
            String json = GsonUtils.GSON.toJson(job);
            if (write.isMoveToHistory()) {
                activeJobs.remove(job.getId());
                historyJobs.put(job.getId(), json);
            } else {
                activeJobs.put(job.getId(), new Record(job.getDbId(), json, write.getExpectedVersion() + 1));
            }
        }

        boolean bumped = false;
        if (txn.isBumpSchemaVersion()) {
            schemaVersion++;
            versionToJob.put(schemaVersion, txn.getBumpForJobId());
            bumped = true;
            LOG.debug("schema version is bumped to {} by job {}", schemaVersion, txn.getBumpForJobId());
        }
        return new CommitResult(schemaVersion, bumped);
    }
}
