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

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.stratadb.alter.AlterJobArgs.AddCheckConstraintArgs;
import com.stratadb.alter.AlterJobArgs.AddColumnArgs;
import com.stratadb.alter.AlterJobArgs.AddIndexArgs;
import com.stratadb.alter.AlterJobArgs.CheckConstraintArgs;
import com.stratadb.alter.AlterJobArgs.DropColumnArgs;
import com.stratadb.alter.AlterJobArgs.DropIndexArgs;
import com.stratadb.alter.AlterJobArgs.ModifyColumnArgs;
import com.stratadb.alter.AlterJobArgs.PartitionArgs;
import com.stratadb.alter.AlterJobArgs.RenameIndexArgs;
import com.stratadb.alter.action.AddIndexHandler;
import com.stratadb.alter.action.DropIndexHandler;
import com.stratadb.alter.action.ModifyColumnHandler;
import com.stratadb.catalog.CheckConstraint;
import com.stratadb.catalog.ColumnMeta;
import com.stratadb.catalog.IndexMeta;
import com.stratadb.catalog.PartitionInfo;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import com.stratadb.task.ReorgContextManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Turns a CANCELLING job into either a cancelled job, a rolling back job or, when the job is past its point of no
 * return, back into a running one.
 * <p>
 * The decision is made per {@link ActionType} by the policies registered here, every type must have one.
 * Cancelling a job that never made a visible change leaves the metadata untouched. A job that did is rewritten
 * into its inverse: the schema object is regressed to the state the inverse change starts from and the args are
 * replaced by the args of the inverse, the action handler then drives it back in ROLLINGBACK.
 */
public class RollbackConverter {
    private static final Logger LOG = LogManager.getLogger(RollbackConverter.class);

    public static final String ROLLBACK_MSG_PREFIX = "DDL job rollback, error msg: ";

    private final ReorgContextManager reorgContexts;
    private final Map<ActionType, RollbackPolicy> policies = Maps.newEnumMap(ActionType.class);

    public RollbackConverter(ReorgContextManager reorgContexts) {
        this.reorgContexts = reorgContexts;

        policies.put(ActionType.CREATE_TABLE, ctx -> RollbackDecision.cancel());
        policies.put(ActionType.DROP_TABLE, this::rollbackDropTable);
        policies.put(ActionType.ADD_COLUMN, this::rollbackAddColumn);
        policies.put(ActionType.DROP_COLUMN, this::rollbackDropColumn);
        policies.put(ActionType.MODIFY_COLUMN, this::rollbackModifyColumn);
        policies.put(ActionType.ADD_INDEX, this::rollbackAddIndex);
        policies.put(ActionType.ADD_PRIMARY_KEY, this::rollbackAddIndex);
        policies.put(ActionType.DROP_INDEX, this::rollbackDropIndex);
        policies.put(ActionType.DROP_PRIMARY_KEY, this::rollbackDropIndex);
        policies.put(ActionType.RENAME_INDEX, this::rollbackRenameIndex);
        policies.put(ActionType.ADD_TABLE_PARTITION, this::rollbackAddPartition);
        policies.put(ActionType.DROP_TABLE_PARTITION, this::rollbackDropPartition);
        policies.put(ActionType.REORGANIZE_PARTITION, this::rollbackReorganizePartition);
        policies.put(ActionType.ADD_CHECK_CONSTRAINT, this::rollbackAddCheckConstraint);
        policies.put(ActionType.DROP_CHECK_CONSTRAINT, this::rollbackDropCheckConstraint);
        policies.put(ActionType.MULTI_SCHEMA_CHANGE, this::rollbackMultiSchemaChange);
        // single step changes can only be cancelled before their step
        for (ActionType type : new ActionType[] {ActionType.TRUNCATE_TABLE, ActionType.RENAME_TABLE,
                ActionType.TRUNCATE_TABLE_PARTITION, ActionType.ALTER_INDEX_VISIBILITY,
                ActionType.ALTER_CHECK_CONSTRAINT, ActionType.REBASE_AUTO_ID,
                ActionType.MODIFY_TABLE_CHARSET_AND_COLLATE}) {
            policies.put(type, RollbackConverter::rollbackSingleStep);
        }

        for (ActionType type : ActionType.values()) {
            Preconditions.checkState(policies.containsKey(type), "no rollback policy for %s", type);
        }
    }

    /**
     * Converts the CANCELLING job of the context and does the error bookkeeping on it.
     * Never throws: a failed attempt is recorded on the job and retried on the next step, until the error count
     * exceeds ddl_error_count_limit and the job is forced to CANCELLED.
     */
    public RollbackDecision convert(StepContext ctx) {
        AlterJob job = ctx.getJob();
        String cause = job.getErrMsg();
        boolean causedByError = job.hasError();
        RollbackDecision decision;
        try {
            decision = decide(ctx);
        } catch (AlterCancelException | RuntimeException e) {
            LOG.warn("failed to convert job {} to rollback", job, e);
            job.increaseErrorCount();
            if (job.isErrorCountExceeded()) {
                forceCancel(job);
                return RollbackDecision.cancel();
            }
            job.setErrMsg(e.getMessage());
            return RollbackDecision.failed();
        }

        switch (decision.getOutcome()) {
            case CANCEL:
                job.increaseErrorCount();
                job.setErrMsg(rollbackMessage(cause, causedByError));
                job.finish(JobState.CANCELLED);
                LOG.info("job {} is cancelled", job);
                break;
            case CONVERT:
                job.increaseErrorCount();
                job.setErrMsg(rollbackMessage(cause, causedByError));
                job.setState(JobState.ROLLINGBACK);
                LOG.info("job {} is converted to rollback", job);
                break;
            case REFUSE:
                job.setWarning(ErrorCode.ERR_CANNOT_CANCEL_DDL_JOB.formatErrorMsg(job.getId()));
                job.setState(JobState.RUNNING);
                if (causedByError) {
                    job.increaseErrorCount();
                    if (job.isErrorCountExceeded()) {
                        forceCancel(job);
                        return RollbackDecision.cancel();
                    }
                }
                LOG.warn("job {} can not be cancelled now, it keeps running", job);
                break;
            default:
                break;
        }
        return decision;
    }

    private static String rollbackMessage(String cause, boolean causedByError) {
        return causedByError ? ROLLBACK_MSG_PREFIX + cause : ErrorCode.ERR_CANCELLED_DDL_JOB.formatErrorMsg();
    }

    /**
     * Ends a job whose errors exceeded the limit. Reorg workers of the job are stopped whatever their progress.
     */
    public void forceCancel(AlterJob job) {
        reorgContexts.stopJob(job.getId());
        job.setErrMsg(new RollbackExhaustedException().getMessage());
        job.finish(JobState.CANCELLED);
        LOG.error("job {} is forced to cancelled: {}", job, job.getErrMsg());
    }

    /**
     * The decision for the job of the context without the bookkeeping.
     */
    RollbackDecision decide(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        if (job.isNeverStarted()) {
            return RollbackDecision.cancel();
        }
        if (job.getType().needsExistingTable() && ctx.getTable() == null) {
            return RollbackDecision.cancel();
        }
        return policies.get(job.getType()).decide(ctx);
    }

    private static RollbackDecision rollbackSingleStep(StepContext ctx) {
        return ctx.getJob().getSchemaState() == SchemaState.NONE
                ? RollbackDecision.cancel() : RollbackDecision.refuse();
    }

    private RollbackDecision rollbackDropTable(StepContext ctx) {
        return ctx.getTable().getState() == SchemaState.PUBLIC ? RollbackDecision.cancel() : RollbackDecision.refuse();
    }

    private RollbackDecision rollbackAddColumn(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        String name = job.getArgs(AddColumnArgs.class).getColumn().getName();
        ColumnMeta column = ctx.getTable().findColumn(name);
        if (job.getSchemaState() == SchemaState.NONE || column == null) {
            return RollbackDecision.cancel();
        }
        if (column.getState() == SchemaState.PUBLIC) {
            throw new AlterCancelException(ErrorCode.ERR_INVALID_DDL_STATE, "column", column.getState());
        }
        boolean changed = column.getState() != SchemaState.DELETE_ONLY;
        column.setState(SchemaState.DELETE_ONLY);
        job.setSchemaState(SchemaState.DELETE_ONLY);
        job.setArgs(new DropColumnArgs(name));
        return RollbackDecision.convert(changed);
    }

    private RollbackDecision rollbackDropColumn(StepContext ctx) throws AlterCancelException {
        TableMeta table = ctx.getTable();
        DropColumnArgs args = ctx.getJob().getArgs(DropColumnArgs.class);
        for (String indexName : args.getIndexNames()) {
            IndexMeta index = table.findIndex(indexName);
            if (index != null && index.getState() != SchemaState.PUBLIC) {
                return RollbackDecision.refuse();
            }
        }
        ColumnMeta column = table.findColumn(args.getColumnName());
        if (column != null && column.getState() == SchemaState.PUBLIC) {
            return RollbackDecision.cancel();
        }
        return RollbackDecision.refuse();
    }

    private RollbackDecision rollbackModifyColumn(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.getTable();
        if (reorgContexts.isRunning(job.getId())) {
            reorgContexts.stopJob(job.getId());
        }
        ModifyColumnArgs args = job.getArgs(ModifyColumnArgs.class);
        ColumnMeta oldColumn = table.findColumn(args.getColumnName());
        boolean dataChange = args.getChangingColumnName() != null
                || (oldColumn != null && ModifyColumnHandler.isDataChange(oldColumn, args.getNewColumn()));
        if (dataChange) {
            if (args.getChangingColumnName() == null || table.findColumn(args.getChangingColumnName()) == null) {
                return RollbackDecision.cancel();
            }
            return RollbackDecision.convert(false);
        }
        if (job.getSchemaState() != SchemaState.NONE) {
            return RollbackDecision.refuse();
        }
        if (oldColumn != null && oldColumn.isPreventNullInsert()
                && ModifyColumnHandler.isTighteningNullability(oldColumn, args.getNewColumn())) {
            return RollbackDecision.convert(false);
        }
        return RollbackDecision.cancel();
    }

    private RollbackDecision rollbackAddIndex(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        TableMeta table = ctx.getTable();
        AddIndexArgs args = job.getArgs(AddIndexArgs.class);
        if (job.getSchemaState() == SchemaState.WRITE_REORGANIZATION && job.getSnapshotVer() != 0
                && (!job.isSubJob() || job.inRevertibleCompositePhase())) {
            reorgContexts.stopJob(job.getId());
        }
        IndexMeta index = table.findIndex(args.getIndexName());
        if (job.getSchemaState() == SchemaState.NONE || index == null) {
            return RollbackDecision.cancel();
        }
        if (index.getState() == SchemaState.PUBLIC) {
            throw new AlterCancelException(ErrorCode.ERR_INVALID_DDL_STATE, "index", index.getState());
        }
        boolean changed = index.isPrimary() && AddIndexHandler.setPreventNullInsert(table, index, false);
        changed |= index.getState() != SchemaState.DELETE_ONLY;
        index.setState(SchemaState.DELETE_ONLY);
        job.setSchemaState(SchemaState.DELETE_ONLY);
        job.setArgs(new DropIndexArgs(args.getIndexName(), args.isPrimary()));
        return RollbackDecision.convert(changed);
    }

    private RollbackDecision rollbackDropIndex(StepContext ctx) throws AlterCancelException {
        IndexMeta index = DropIndexHandler.findTarget(ctx.getTable(), ctx.getJob().getArgs(DropIndexArgs.class));
        if (index == null) {
            return RollbackDecision.refuse();
        }
        switch (index.getState()) {
            case PUBLIC:
                return RollbackDecision.cancel();
            case WRITE_ONLY:
            case DELETE_ONLY:
            case DELETE_REORGANIZATION:
            case NONE:
                return RollbackDecision.refuse();
            default:
                throw new AlterCancelException(ErrorCode.ERR_INVALID_DDL_STATE, "index", index.getState());
        }
    }

    private RollbackDecision rollbackRenameIndex(StepContext ctx) throws AlterCancelException {
        IndexMeta index = ctx.getTable().findIndex(ctx.getJob().getArgs(RenameIndexArgs.class).getFromName());
        return index != null && index.getState() == SchemaState.PUBLIC
                ? RollbackDecision.cancel() : RollbackDecision.refuse();
    }

    private RollbackDecision rollbackAddPartition(StepContext ctx) {
        PartitionInfo info = ctx.getTable().getPartitionInfo();
        if (info == null || info.getAddingDefinitions().isEmpty()) {
            return RollbackDecision.cancel();
        }
        ctx.getJob().setArgs(PartitionArgs.ofNames(PartitionInfo.namesOf(info.getAddingDefinitions())));
        return RollbackDecision.convert(true);
    }

    private RollbackDecision rollbackDropPartition(StepContext ctx) {
        return ctx.getJob().getSchemaState() == SchemaState.PUBLIC
                ? RollbackDecision.cancel() : RollbackDecision.refuse();
    }

    private RollbackDecision rollbackReorganizePartition(StepContext ctx) {
        AlterJob job = ctx.getJob();
        PartitionInfo info = ctx.getTable().getPartitionInfo();
        if (job.getSchemaState() == SchemaState.NONE || info == null) {
            return RollbackDecision.cancel();
        }
        // the old partitions are already swapped out
        if (job.getSchemaState() == SchemaState.DELETE_REORGANIZATION) {
            return RollbackDecision.refuse();
        }
        reorgContexts.stopJob(job.getId());
        job.setArgs(PartitionArgs.ofNames(PartitionInfo.namesOf(info.getAddingDefinitions())));
        return RollbackDecision.convert(true);
    }

    private RollbackDecision rollbackAddCheckConstraint(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        CheckConstraint argConstraint = job.getArgs(AddCheckConstraintArgs.class).getConstraint();
        CheckConstraint constraint = ctx.getTable().findConstraint(argConstraint.getName());
        if (job.getSchemaState() == SchemaState.NONE || constraint == null) {
            return RollbackDecision.cancel();
        }
        if (constraint.getState() == SchemaState.PUBLIC) {
            throw new AlterCancelException(ErrorCode.ERR_INVALID_DDL_STATE, "constraint", constraint.getState());
        }
        reorgContexts.stopJob(job.getId());
        boolean changed = constraint.getState() != SchemaState.WRITE_ONLY;
        constraint.setState(SchemaState.WRITE_ONLY);
        job.setSchemaState(SchemaState.WRITE_ONLY);
        job.setArgs(new CheckConstraintArgs(constraint.getName(), constraint.isEnforced()));
        return RollbackDecision.convert(changed);
    }

    private RollbackDecision rollbackDropCheckConstraint(StepContext ctx) throws AlterCancelException {
        CheckConstraint constraint = ctx.getTable().findConstraint(
                ctx.getJob().getArgs(CheckConstraintArgs.class).getName());
        return constraint != null && constraint.getState() == SchemaState.PUBLIC
                ? RollbackDecision.cancel() : RollbackDecision.refuse();
    }

    /**
     * A composite job is rolled back as a whole only while every sub-job is revertible. Sub-jobs that never ran
     * are cancelled, the others are converted through their own policy in reverse order. A sub-job whose policy
     * refuses is treated as cancelled, it did nothing visible yet.
     */
    private RollbackDecision rollbackMultiSchemaChange(StepContext ctx) throws AlterCancelException {
        AlterJob job = ctx.getJob();
        MultiSchemaInfo info = job.getMultiSchemaInfo();
        if (info == null) {
            return RollbackDecision.cancel();
        }
        if (!info.isRevertible() || info.hasNonRevertibleSubJob()) {
            return RollbackDecision.refuse();
        }
        List<SubJob> subJobs = info.getSubJobs();
        boolean allCancelled = true;
        boolean bump = false;
        for (int i = subJobs.size() - 1; i >= 0; i--) {
            SubJob subJob = subJobs.get(i);
            if (subJob.getState() == JobState.QUEUEING) {
                subJob.setState(JobState.CANCELLED);
                continue;
            }
            if (subJob.getState().isFinished()) {
                allCancelled &= subJob.getState() == JobState.CANCELLED;
                continue;
            }
            AlterJob proxy = subJob.toProxyJob(job, i);
            proxy.setState(JobState.CANCELLING);
            RollbackDecision decision = decide(ctx.forSubJob(proxy));
            if (decision.getOutcome() == RollbackDecision.Outcome.CONVERT) {
                proxy.setState(JobState.ROLLINGBACK);
                bump |= decision.isBumpVersion();
                allCancelled = false;
            } else {
                proxy.setState(JobState.CANCELLED);
            }
            subJob.fromProxyJob(proxy);
        }
        return allCancelled ? RollbackDecision.cancel() : RollbackDecision.convert(bump);
    }
}
