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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.stratadb.catalog.SchemaState;
import com.stratadb.catalog.TableMeta;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class GsonUtilsTest {

    @Test
    public void testMissingListsArePostProcessed() {
        String json = "{\"id\":10,\"dbId\":1,\"name\":\"t1\",\"state\":\"PUBLIC\","
                + "\"columns\":null,\"indexes\":null,\"constraints\":null}";
        TableMeta table = GsonUtils.GSON.fromJson(json, TableMeta.class);

        Assertions.assertEquals("t1", table.getName());
        Assertions.assertNotNull(table.getColumns());
        Assertions.assertTrue(table.getIndexes().isEmpty());
        Assertions.assertTrue(table.getConstraints().isEmpty());
        Assertions.assertTrue(table.getRetainedProperties().isEmpty());
    }

    @Test
    public void testUnknownPropertiesAreWrittenBack() {
        String json = "{\"id\":10,\"dbId\":1,\"name\":\"t1\",\"state\":\"PUBLIC\","
                + "\"ttlSeconds\":3600,\"placement\":{\"region\":\"r1\"},\"nothing\":null}";
        TableMeta table = GsonUtils.GSON.fromJson(json, TableMeta.class);
        Assertions.assertEquals(2, table.getRetainedProperties().size());

        table.setName("t2");
        JsonObject written = JsonParser.parseString(GsonUtils.GSON.toJson(table)).getAsJsonObject();

        Assertions.assertEquals("t2", written.get("name").getAsString());
        Assertions.assertEquals(3600, written.get("ttlSeconds").getAsInt());
        Assertions.assertEquals("r1", written.getAsJsonObject("placement").get("region").getAsString());
        Assertions.assertFalse(written.has("nothing"));
    }

    @Test
    public void testUnknownEnumConstantIsKept() {
        String json = "{\"id\":10,\"dbId\":1,\"name\":\"t1\",\"state\":\"SOME_FUTURE_STATE\"}";
        TableMeta table = GsonUtils.GSON.fromJson(json, TableMeta.class);
        Assertions.assertNull(table.getState());

        JsonObject written = JsonParser.parseString(GsonUtils.GSON.toJson(table)).getAsJsonObject();
        Assertions.assertEquals("SOME_FUTURE_STATE", written.get("state").getAsString());

        // a value set by this node wins over the retained one
        table.setState(SchemaState.DELETE_ONLY);
        written = JsonParser.parseString(GsonUtils.GSON.toJson(table)).getAsJsonObject();
        Assertions.assertEquals("DELETE_ONLY", written.get("state").getAsString());
    }

    @Test
    public void testNestedSchemaObjectsKeepUnknownProperties() {
        String json = "{\"id\":10,\"dbId\":1,\"name\":\"t1\",\"state\":\"PUBLIC\","
                + "\"columns\":[{\"id\":1,\"name\":\"id\",\"type\":\"BIGINT\",\"state\":\"PUBLIC\","
                + "\"collationId\":45}],"
                + "\"indexes\":[{\"id\":1,\"name\":\"idx_id\",\"columns\":[\"id\"],\"state\":\"PUBLIC\","
                + "\"algorithm\":\"HNSW\"}],"
                + "\"constraints\":[{\"id\":1,\"name\":\"chk_id\",\"expression\":\"id > 0\","
                + "\"state\":\"PUBLIC\",\"level\":2}],"
                + "\"partitionInfo\":{\"type\":\"RANGE\",\"expr\":\"id\",\"interval\":\"1 day\","
                + "\"definitions\":[{\"id\":10,\"name\":\"p0\",\"bound\":\"VALUES LESS THAN (100)\","
                + "\"storagePolicy\":\"cold\"}]}}";
        TableMeta table = GsonUtils.GSON.fromJson(json, TableMeta.class);
        Assertions.assertTrue(table.getRetainedProperties().isEmpty());

        table.findColumn("id").setComment("primary id");
        JsonObject written = JsonParser.parseString(GsonUtils.GSON.toJson(table.copy())).getAsJsonObject();

        JsonObject column = written.getAsJsonArray("columns").get(0).getAsJsonObject();
        Assertions.assertEquals("primary id", column.get("comment").getAsString());
        Assertions.assertEquals(45, column.get("collationId").getAsInt());
        Assertions.assertEquals("HNSW",
                written.getAsJsonArray("indexes").get(0).getAsJsonObject().get("algorithm").getAsString());
        Assertions.assertEquals(2,
                written.getAsJsonArray("constraints").get(0).getAsJsonObject().get("level").getAsInt());
        JsonObject partitionInfo = written.getAsJsonObject("partitionInfo");
        Assertions.assertEquals("1 day", partitionInfo.get("interval").getAsString());
        Assertions.assertEquals("cold", partitionInfo.getAsJsonArray("definitions").get(0).getAsJsonObject()
                .get("storagePolicy").getAsString());
    }
}
