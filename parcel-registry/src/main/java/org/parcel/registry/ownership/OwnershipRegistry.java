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
package org.parcel.registry.ownership;

import static org.apache.pulsar.common.util.FutureUtil.wrapToCompletionException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.pulsar.common.util.FutureUtil;
import org.apache.pulsar.metadata.api.MetadataStore;
import org.apache.pulsar.metadata.api.MetadataStoreException;
import org.parcel.common.naming.PackageName;
import org.parcel.registry.exception.RegistryException.StorageException;
import org.parcel.registry.store.BaseResources;
import org.parcel.registry.store.RecordSerde;

/**
 * Owner to package relation, stored as one node per pair at {@code /parcel/owners/<ownerId>/<name>}.
 */
@Slf4j
public class OwnershipRegistry extends BaseResources<OwnershipRecord> {

    static final String OWNERS_PATH = BASE_PATH + "/owners";

    private final Clock clock;

    public OwnershipRegistry(MetadataStore store, Clock clock) {
        super(store, new RecordSerde<>(OwnershipRecord.class, OwnershipRegistry::validate));
        this.clock = clock;
    }

    /**
     * Grant ownership of a package. Granting an existing ownership is a no-op.
     */
    public CompletableFuture<Void> grant(String ownerId, String name) {
        OwnershipRecord record = new OwnershipRecord(ownerId, name, clock.millis());
        return createAsync(ownershipPath(ownerId, name), record).handle((__, ex) -> {
            if (ex == null) {
                log.info("[{}] Granted ownership to {}", name, ownerId);
                return null;
            }
            Throwable cause = FutureUtil.unwrapCompletionException(ex);
            if (cause instanceof MetadataStoreException.AlreadyExistsException) {
                return null;
            }
            log.warn("[{}] Failed to grant ownership to {}", name, ownerId, cause);
            throw wrapToCompletionException(new StorageException(cause));
        });
    }

    public CompletableFuture<Boolean> ownsAny(String ownerId, String name) {
        if (StringUtils.isBlank(ownerId)) {
            return CompletableFuture.completedFuture(false);
        }
        return existsAsync(ownershipPath(ownerId, name)).exceptionally(ex -> {
            throw wrapToCompletionException(new StorageException(FutureUtil.unwrapCompletionException(ex)));
        });
    }

    /**
     * @return names of the packages owned by {@code ownerId}, sorted
     */
    public CompletableFuture<List<String>> packagesOwnedBy(String ownerId) {
        return getChildrenAsync(joinPath(OWNERS_PATH, ownerId))
                .thenApply(names -> names.stream().sorted().collect(Collectors.toList()))
                .exceptionally(ex -> {
                    throw wrapToCompletionException(new StorageException(FutureUtil.unwrapCompletionException(ex)));
                });
    }

    static String ownershipPath(String ownerId, String name) {
        return joinPath(OWNERS_PATH, ownerId, name);
    }

    static void validate(OwnershipRecord record) {
        if (StringUtils.isBlank(record.getOwnerId()) || record.getOwnerId().contains("/")) {
            throw new IllegalArgumentException("Invalid owner id '" + record.getOwnerId() + "'");
        }
        PackageName.validateName(record.getPackageName());
    }
}
