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
 * Decides how a job of one {@link ActionType} that has to stop is handled.
 * A policy may rewrite the job args and regress the schema object in the context, the converter commits those
 * changes only for a {@link RollbackDecision.Outcome#CONVERT} decision.
 */
@FunctionalInterface
public interface RollbackPolicy {
    RollbackDecision decide(StepContext ctx) throws AlterCancelException;
}
