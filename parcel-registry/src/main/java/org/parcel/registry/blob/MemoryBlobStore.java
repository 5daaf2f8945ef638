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

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.pulsar.common.util.FutureUtil;

/**
 * Blob store keeping artifacts on the heap. Used for tests and single process deployments.
 */
public class MemoryBlobStore implements BlobStore {

    private final Map<String, StoredBlob> blobs = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> write(String key, byte[] data, Map<String, String> metadata) {
        StoredBlob blob = new StoredBlob(Arrays.copyOf(data, data.length),
                metadata == null ? ImmutableMap.of() : ImmutableMap.copyOf(metadata));
        if (blobs.putIfAbsent(key, blob) != null) {
            return FutureUtil.failedFuture(new BlobStoreException.AlreadyExistsException(key));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<byte[]> read(String key) {
        StoredBlob blob = blobs.get(key);
        if (blob == null) {
            return FutureUtil.failedFuture(new BlobStoreException.NotFoundException(key));
        }
        return CompletableFuture.completedFuture(Arrays.copyOf(blob.data, blob.data.length));
    }

    @Override
    public CompletableFuture<Void> read(String key, OutputStream outputStream) {
        return read(key).thenAccept(data -> {
            try {
                outputStream.write(data);
                outputStream.flush();
            } catch (IOException e) {
                throw FutureUtil.wrapToCompletionException(e);
            }
        });
    }

    @Override
    public CompletableFuture<Map<String, String>> readMetadata(String key) {
        StoredBlob blob = blobs.get(key);
        if (blob == null) {
            return FutureUtil.failedFuture(new BlobStoreException.NotFoundException(key));
        }
        return CompletableFuture.completedFuture(blob.metadata);
    }

    @Override
    public CompletableFuture<Boolean> exists(String key) {
        return CompletableFuture.completedFuture(blobs.containsKey(key));
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        blobs.remove(key);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        blobs.clear();
    }

    private static class StoredBlob {
        private final byte[] data;
        private final Map<String, String> metadata;

        StoredBlob(byte[] data, Map<String, String> metadata) {
            this.data = data;
            this.metadata = metadata;
        }
    }
}
