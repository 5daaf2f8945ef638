/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.parcel.registry.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.function.Consumer;
import org.apache.pulsar.metadata.api.MetadataSerde;
import org.apache.pulsar.metadata.api.Stat;

/**
 * JSON serde for registry records. Unknown properties are rejected and every record goes through a validator on
 * both the write and the read path, so a malformed record never leaves or enters the metadata store.
 *
 * @param <T> record type
 */
public class RecordSerde<T> implements MetadataSerde<T> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final Class<T> clazz;
    private final Consumer<T> validator;

    public RecordSerde(Class<T> clazz, Consumer<T> validator) {
        this.clazz = clazz;
        this.validator = validator;
    }

    public RecordSerde(Class<T> clazz) {
        this(clazz, __ -> {});
    }

    @Override
    public byte[] serialize(String path, T value) throws IOException {
        validate(path, value);
        return MAPPER.writeValueAsBytes(value);
    }

    @Override
    public T deserialize(String path, byte[] content, Stat stat) throws IOException {
        T value = MAPPER.readValue(content, clazz);
        validate(path, value);
        return value;
    }

    private void validate(String path, T value) throws IOException {
        if (value == null) {
            throw new IOException("Null " + clazz.getSimpleName() + " at " + path);
        }
        try {
            validator.accept(value);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid " + clazz.getSimpleName() + " at " + path + ": " + e.getMessage(), e);
        }
    }
}
