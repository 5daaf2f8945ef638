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

import com.google.common.base.Joiner;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.common.util.FutureUtil;
import org.apache.pulsar.metadata.api.MetadataCache;
import org.apache.pulsar.metadata.api.MetadataSerde;
import org.apache.pulsar.metadata.api.MetadataStore;
import org.apache.pulsar.metadata.api.MetadataStoreException;

/**
 * Base class for registry resources kept in the metadata store.
 *
 * @param <T>
 *            type of the stored records.
 */
@Slf4j
public class BaseResources<T> {

    protected static final String BASE_PATH = "/parcel";

    /**
     * Upper bound of compare-and-swap attempts for a single update. Each round lets at least one writer of the
     * node through, so this bounds the number of concurrent writers of one record that are guaranteed to land.
     */
    protected static final int MAX_UPDATE_ATTEMPTS = 128;

    @Getter
    private final MetadataStore store;
    @Getter
    private final MetadataCache<T> cache;

    public BaseResources(MetadataStore store, MetadataSerde<T> serde) {
        this.store = store;
        this.cache = store.getMetadataCache(serde);
    }

    protected CompletableFuture<List<String>> getChildrenAsync(String path) {
        return cache.getChildren(path);
    }

    protected CompletableFuture<Optional<T>> getAsync(String path) {
        return cache.get(path);
    }

    protected CompletableFuture<Boolean> existsAsync(String path) {
        return cache.exists(path);
    }

    protected CompletableFuture<Void> createAsync(String path, T data) {
        return cache.create(path, data);
    }

    /**
     * Compare-and-swap update of an existing record, re-applying the function on concurrent modification.
     * The function may run more than once and must not have side effects beyond building the new value.
     */
    protected CompletableFuture<T> updateAsync(String path, Function<T, T> modifyFunction) {
        return executeWithRetry(() -> cache.readModifyUpdate(path, modifyFunction), path, MAX_UPDATE_ATTEMPTS);
    }

    protected CompletableFuture<T> updateOrCreateAsync(String path, Function<Optional<T>, T> createFunction) {
        return executeWithRetry(() -> cache.readModifyUpdateOrCreate(path, createFunction), path,
                MAX_UPDATE_ATTEMPTS);
    }

    private CompletableFuture<T> executeWithRetry(Supplier<CompletableFuture<T>> op, String path, int attempts) {
        return op.get().handle((result, ex) -> {
            if (ex == null) {
                return CompletableFuture.completedFuture(result);
            }
            Throwable cause = FutureUtil.unwrapCompletionException(ex);
            boolean lostRace = cause instanceof MetadataStoreException.BadVersionException
                    || cause instanceof MetadataStoreException.AlreadyExistsException;
            if (lostRace && attempts > 1) {
                if (log.isDebugEnabled()) {
                    log.debug("[{}] Concurrent modification, retrying ({} attempts left)", path, attempts - 1);
                }
                cache.invalidate(path);
                return executeWithRetry(op, path, attempts - 1);
            }
            return FutureUtil.<T>failedFuture(cause);
        }).thenCompose(Function.identity());
    }

    protected static String joinPath(String... parts) {
        StringBuilder sb = new StringBuilder();
        Joiner.on('/').appendTo(sb, parts);
        return sb.toString();
    }
}
