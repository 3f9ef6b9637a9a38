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

import com.stratadb.task.ReorgTask;

/**
 * Outcome of one step of a DDL job.
 * <ul>
 *     <li>CONTINUE: the step went through. It may have changes to commit, a schema version to bump and a reorg task
 *     to start once the commit succeeded. A yielding result gives the worker back until the job is woken up.</li>
 *     <li>CANCELLED: the step found the job can not go on, the job is handed to the rollback converter.</li>
 *     <li>RETRY: the step failed with a retryable error and will be tried again on a later tick.</li>
 * </ul>
 */
public final class StepResult {

    public enum Kind {
        CONTINUE,
        CANCELLED,
        RETRY
    }

    private final Kind kind;
    private final boolean commit;
    private final boolean bumpVersion;
    private final boolean yield;
    private final boolean waitingReorg;
    private final ReorgTask reorgTask;
    private final String reason;
    private final Throwable error;

    private StepResult(Kind kind, boolean commit, boolean bumpVersion, boolean yield, boolean waitingReorg,
                       ReorgTask reorgTask, String reason, Throwable error) {
        this.kind = kind;
        this.commit = commit;
        this.bumpVersion = bumpVersion;
        this.yield = yield;
        this.waitingReorg = waitingReorg;
        this.reorgTask = reorgTask;
        this.reason = reason;
        this.error = error;
    }

    /**
     * The step changed visible metadata: commit and bump the schema version.
     */
    public static StepResult advance() {
        return new StepResult(Kind.CONTINUE, true, true, false, false, null, null, null);
    }

    /**
     * The step only changed the job record or invisible metadata: commit without a version bump.
     */
    public static StepResult persist() {
        return new StepResult(Kind.CONTINUE, true, false, false, false, null, null, null);
    }

    /**
     * Commit the snapshot version, then start the reorg task and wait for it.
     */
    public static StepResult startReorg(ReorgTask task) {
        return new StepResult(Kind.CONTINUE, true, false, true, true, task, null, null);
    }

    /**
     * The snapshot version is already persisted but no worker runs the task: start it again and wait.
     */
    public static StepResult resumeReorg(ReorgTask task) {
        return new StepResult(Kind.CONTINUE, false, false, true, true, task, null, null);
    }

    public static StepResult waitReorg() {
        return new StepResult(Kind.CONTINUE, false, false, true, true, null, null, null);
    }

    /**
     * Commit the job record, then give the worker back until someone changes the job.
     */
    public static StepResult suspend() {
        return new StepResult(Kind.CONTINUE, true, false, true, false, null, null, null);
    }

    /**
     * Nothing to do until someone changes the job.
     */
    public static StepResult idle() {
        return new StepResult(Kind.CONTINUE, false, false, true, false, null, null, null);
    }

    public static StepResult cancelled(String reason, Throwable cause) {
        return new StepResult(Kind.CANCELLED, false, false, false, false, null, reason, cause);
    }

    public static StepResult retry(Throwable error) {
        return new StepResult(Kind.RETRY, false, false, true, false, null, error.getMessage(), error);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isCommit() {
        return commit;
    }

    public boolean isBumpVersion() {
        return bumpVersion;
    }

    public boolean isYield() {
        return yield;
    }

    public boolean isWaitingReorg() {
        return waitingReorg;
    }

    public ReorgTask getReorgTask() {
        return reorgTask;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        switch (kind) {
            case CANCELLED:
                return "CANCELLED(" + reason + ")";
            case RETRY:
                return "RETRY(" + reason + ")";
            default:
                return "CONTINUE" + (bumpVersion ? "(bump)" : "") + (waitingReorg ? "(wait reorg)" : "")
                        + (yield ? "(yield)" : "");
        }
    }
}
