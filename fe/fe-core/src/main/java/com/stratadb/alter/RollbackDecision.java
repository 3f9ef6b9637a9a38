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

/**
 * What the rollback converter decided for a job that has to stop.
 */
public final class RollbackDecision {

    public enum Outcome {
        // nothing visible was done yet, the job is cancelled and metadata is left untouched
        CANCEL,
        // the job is rewritten into its inverse and driven back
        CONVERT,
        // the job is past its point of no return and keeps running
        REFUSE,
        // the conversion itself failed, only the job record is written
        FAILED
    }

    private static final RollbackDecision CANCEL = new RollbackDecision(Outcome.CANCEL, false);
    private static final RollbackDecision REFUSE = new RollbackDecision(Outcome.REFUSE, false);
    private static final RollbackDecision FAILED = new RollbackDecision(Outcome.FAILED, false);

    private final Outcome outcome;
    private final boolean bumpVersion;

    private RollbackDecision(Outcome outcome, boolean bumpVersion) {
        this.outcome = outcome;
        this.bumpVersion = bumpVersion;
    }

    public static RollbackDecision cancel() {
        return CANCEL;
    }

    public static RollbackDecision convert(boolean bumpVersion) {
        return new RollbackDecision(Outcome.CONVERT, bumpVersion);
    }

    public static RollbackDecision refuse() {
        return REFUSE;
    }

    public static RollbackDecision failed() {
        return FAILED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isBumpVersion() {
        return bumpVersion;
    }

    @Override
    public String toString() {
        return outcome + (bumpVersion ? "(bump)" : "");
    }
}
