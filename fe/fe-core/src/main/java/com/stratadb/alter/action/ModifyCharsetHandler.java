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

package com.stratadb.alter.action;

import com.google.common.collect.ImmutableMap;
import com.stratadb.alter.ActionType;
import com.stratadb.alter.AlterCancelException;
import com.stratadb.alter.AlterJobArgs.CharsetArgs;
import com.stratadb.alter.StepContext;
import com.stratadb.catalog.TableMeta;
import com.stratadb.common.ErrorCode;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

public class ModifyCharsetHandler extends SingleStepHandler {
    // charset -> default collation
    private static final Map<String, String> CHARSETS = ImmutableMap.<String, String>builder()
            .put("utf8mb4", "utf8mb4_bin")
            .put("utf8", "utf8_bin")
            .put("latin1", "latin1_bin")
            .put("ascii", "ascii_bin")
            .put("gbk", "gbk_bin")
            .put("binary", "binary")
            .build();

    public ModifyCharsetHandler() {
        super(ActionType.MODIFY_TABLE_CHARSET_AND_COLLATE);
    }

    @Override
    protected void apply(StepContext ctx) throws AlterCancelException {
        TableMeta table = ctx.requireTable();
        CharsetArgs args = ctx.getJob().getArgs(CharsetArgs.class);
        String charset = StringUtils.lowerCase(args.getCharset());
        if (!CHARSETS.containsKey(charset)) {
            throw new AlterCancelException(ErrorCode.ERR_UNKNOWN_CHARACTER_SET, args.getCharset());
        }
        String collation = StringUtils.isEmpty(args.getCollation())
                ? CHARSETS.get(charset) : args.getCollation().toLowerCase();
        if (!collation.equals(charset) && !collation.startsWith(charset + "_")) {
            throw new AlterCancelException(ErrorCode.ERR_COLLATION_CHARSET_MISMATCH, collation, charset);
        }
        if (!collation.equals(CHARSETS.get(charset)) && !collation.equals(charset + "_general_ci")) {
            throw new AlterCancelException(ErrorCode.ERR_UNKNOWN_COLLATION, args.getCollation());
        }
        table.setCharsetAndCollation(charset, collation);
    }
}
