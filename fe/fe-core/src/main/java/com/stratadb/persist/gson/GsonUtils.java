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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/*
 * Gson instance used to persist metadata and DDL job records.
 *
 * Only fields annotated with @SerializedName are expected to be persisted, transient fields are skipped.
 * Classes implementing GsonPostProcessable get gsonPostProcess() called after they are deserialized,
 * classes implementing IForwardCompatibleObject keep the properties they do not understand.
 */
public class GsonUtils {

    private static final GsonBuilder GSON_BUILDER = new GsonBuilder()
            .enableComplexMapKeySerialization()
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(new PostProcessTypeAdapterFactory())
            .registerTypeAdapterFactory(new ForwardCompatibleTypeAdapterFactory());

    // this instance is thread-safe.
    public static final Gson GSON = GSON_BUILDER.create();

    /**
     * Deep copy through the persisted form, so the copy is exactly what a reader of the record would get.
     */
    public static <T> T copy(T object, Class<T> clazz) {
        return GSON.fromJson(GSON.toJson(object), clazz);
    }

    public static class PostProcessTypeAdapterFactory implements TypeAdapterFactory {

        public PostProcessTypeAdapterFactory() {
        }

        @Override
        public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
            TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);

            return new TypeAdapter<T>() {
                public void write(JsonWriter out, T value) throws IOException {
                    delegate.write(out, value);
                }

                public T read(JsonReader reader) throws IOException {
                    T obj = delegate.read(reader);
                    if (obj instanceof GsonPostProcessable) {
                        ((GsonPostProcessable) obj).gsonPostProcess();
                    }
                    return obj;
                }
            };
        }
    }
}
