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
package org.parcel.registry;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.metadata.api.MetadataStore;
import org.apache.pulsar.metadata.api.MetadataStoreConfig;
import org.apache.pulsar.metadata.api.MetadataStoreException;
import org.apache.pulsar.metadata.api.MetadataStoreFactory;
import org.parcel.common.configuration.ConfigurationLoader;
import org.parcel.registry.authentication.IdentityRegistry;
import org.parcel.registry.authentication.TokenAuthenticator;
import org.parcel.registry.authorization.AuthorizationService;
import org.parcel.registry.blob.BlobStore;
import org.parcel.registry.blob.FileSystemBlobStore;
import org.parcel.registry.blob.MemoryBlobStore;
import org.parcel.registry.impl.DownloadCounter;
import org.parcel.registry.impl.PackagesImpl;
import org.parcel.registry.ownership.OwnershipRegistry;
import org.parcel.registry.publish.PublishPipeline;
import org.parcel.registry.search.SearchIndex;
import org.parcel.registry.store.MetadataPackageStore;
import org.parcel.registry.store.PackageStore;

/**
 * Wires the registry components together from a {@link RegistryConfiguration}.
 */
@Slf4j
@Getter
public class RegistryService implements AutoCloseable {

    public enum State {
        Init, Started, Closed
    }

    private final RegistryConfiguration config;
    private final Clock clock;
    private volatile State state = State.Init;

    private MetadataStore metadataStore;
    private BlobStore blobStore;
    private PackageStore packageStore;
    private OwnershipRegistry ownershipRegistry;
    private IdentityRegistry identityRegistry;
    private TokenAuthenticator authenticator;
    private AuthorizationService authorizationService;
    private SearchIndex searchIndex;
    private PublishPipeline publishPipeline;
    private DownloadCounter downloadCounter;
    private Packages packages;

    public RegistryService(RegistryConfiguration config) {
        this(config, Clock.systemUTC());
    }

    public RegistryService(RegistryConfiguration config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Start the registry: validate the configuration, connect to the metadata store and build the components.
     *
     * @throws IllegalArgumentException if the configuration is invalid
     * @throws IOException if a store cannot be opened
     */
    public synchronized void start() throws IOException {
        if (state != State.Init) {
            throw new IllegalStateException("Registry service cannot be started in state " + state);
        }
        ConfigurationLoader.isComplete(config);
        log.info("Starting registry service, metadata store: {}, blob store: {}", config.getMetadataStoreUrl(),
                config.getBlobStoreType());
        try {
            metadataStore = createMetadataStore();
            blobStore = createBlobStore();

            packageStore = new MetadataPackageStore(metadataStore, clock);
            ownershipRegistry = new OwnershipRegistry(metadataStore, clock);
            identityRegistry = new IdentityRegistry(metadataStore, clock);
            authenticator = new TokenAuthenticator(identityRegistry, config.getSuperUserRoles());
            authorizationService = new AuthorizationService(ownershipRegistry);
            searchIndex = new SearchIndex(packageStore);
            DownloadLocator downloadLocator = new DownloadLocator(config.getDownloadPathPrefix());
            publishPipeline = new PublishPipeline(packageStore, blobStore, ownershipRegistry, authorizationService,
                    authenticator, downloadLocator, config, clock);
            downloadCounter = new DownloadCounter(packageStore, config.getDownloadCounterMaxRetries());
            packages = new PackagesImpl(packageStore, blobStore, ownershipRegistry, authorizationService,
                    authenticator, publishPipeline, searchIndex, downloadCounter, downloadLocator);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to start registry service", e);
            closeResources();
            throw e;
        }
        state = State.Started;
        log.info("Registry service started");
    }

    private MetadataStore createMetadataStore() throws MetadataStoreException {
        return MetadataStoreFactory.create(config.getMetadataStoreUrl(),
                MetadataStoreConfig.builder()
                        .sessionTimeoutMillis(config.getMetadataStoreSessionTimeoutMillis())
                        .build());
    }

    private BlobStore createBlobStore() throws IOException {
        switch (config.getBlobStoreType()) {
            case RegistryConfiguration.BLOB_STORE_MEMORY:
                return new MemoryBlobStore();
            case RegistryConfiguration.BLOB_STORE_FILESYSTEM:
                return new FileSystemBlobStore(Paths.get(config.getBlobStoreDirectory()),
                        config.getBlobStoreIoThreads());
            default:
                throw new IllegalArgumentException("Unknown blob store type: " + config.getBlobStoreType());
        }
    }

    @Override
    public synchronized void close() throws Exception {
        if (state == State.Closed) {
            return;
        }
        log.info("Closing registry service");
        state = State.Closed;
        closeResources();
    }

    private void closeResources() {
        if (downloadCounter != null) {
            downloadCounter.close();
            downloadCounter = null;
        }
        if (blobStore != null) {
            try {
                blobStore.close();
            } catch (IOException e) {
                log.warn("Failed to close blob store", e);
            }
            blobStore = null;
        }
        if (metadataStore != null) {
            try {
                metadataStore.close();
            } catch (Exception e) {
                log.warn("Failed to close metadata store", e);
            }
            metadataStore = null;
        }
    }
}
