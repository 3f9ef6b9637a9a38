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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Map;

/**
 * Keeps the JSON properties of an {@link IForwardCompatibleObject} that the current code cannot map.
 * <p>
 * A property is retained when it is present and non-null in the input but absent from the object serialized back,
 * which covers unknown keys as well as known keys carrying an enum constant this version does not define.
 * On write a retained property is emitted only when the object does not produce the key itself.
 */
public class ForwardCompatibleTypeAdapterFactory implements TypeAdapterFactory {

    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!IForwardCompatibleObject.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);
        TypeAdapter<JsonElement> elementAdapter = gson.getAdapter(JsonElement.class);

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                JsonElement tree = delegate.toJsonTree(value);
                if (value != null && tree.isJsonObject()) {
                    JsonObject object = tree.getAsJsonObject();
                    for (Map.Entry<String, JsonElement> entry :
                            ((IForwardCompatibleObject) value).getRetainedProperties().entrySet()) {
                        if (!object.has(entry.getKey())) {
                            object.add(entry.getKey(), entry.getValue());
                        }
                    }
                }
                elementAdapter.write(out, tree);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement tree = elementAdapter.read(in);
                T value = delegate.fromJsonTree(tree);
                if (value == null || !tree.isJsonObject()) {
                    return value;
                }

                JsonElement known = delegate.toJsonTree(value);
                JsonObject knownObject = known.isJsonObject() ? known.getAsJsonObject() : new JsonObject();
                Map<String, JsonElement> retained = ((IForwardCompatibleObject) value).getRetainedProperties();
                for (Map.Entry<String, JsonElement> entry : tree.getAsJsonObject().entrySet()) {
                    if (entry.getValue().isJsonNull() || knownObject.has(entry.getKey())) {
                        continue;
                    }
                    retained.put(entry.getKey(), entry.getValue());
                }
                return value;
            }
        };
    }
}
