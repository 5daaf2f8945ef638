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
package org.parcel.registry.blob;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stores package artifacts. Keys are {@code name/version}; content is immutable once written.
 */
public interface BlobStore extends AutoCloseable {

    /**
     * Write an artifact. Fails with {@link BlobStoreException.AlreadyExistsException} if the key is taken, the
     * existing content is never replaced.
     *
     * @param key blob key
     * @param data artifact bytes
     * @param metadata opaque attributes stored along with the artifact
     */
    CompletableFuture<Void> write(String key, byte[] data, Map<String, String> metadata);

    /**
     * Read an artifact, failing with {@link BlobStoreException.NotFoundException} if the key is unknown.
     */
    CompletableFuture<byte[]> read(String key);

    /**
     * Stream an artifact into the given output stream.
     */
    CompletableFuture<Void> read(String key, OutputStream outputStream);

    /**
     * Read the attributes written with an artifact.
     */
    CompletableFuture<Map<String, String>> readMetadata(String key);

    CompletableFuture<Boolean> exists(String key);

    /**
     * Delete an artifact. Deleting an unknown key is a no-op.
     */
    CompletableFuture<Void> delete(String key);

    @Override
    void close() throws IOException;
}
