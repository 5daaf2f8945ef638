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
package org.parcel.registry.impl;

import static org.apache.pulsar.common.util.FutureUtil.wrapToCompletionException;
import java.io.OutputStream;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.common.util.FutureUtil;
import org.parcel.common.checksum.ChecksumEngine;
import org.parcel.common.naming.PackageName;
import org.parcel.registry.DownloadLocator;
import org.parcel.registry.Packages;
import org.parcel.registry.authentication.Authenticator;
import org.parcel.registry.authentication.Identity;
import org.parcel.registry.authorization.AuthorizationService;
import org.parcel.registry.blob.BlobStore;
import org.parcel.registry.blob.BlobStoreException;
import org.parcel.registry.data.DescriptiveUpdate;
import org.parcel.registry.data.DownloadResult;
import org.parcel.registry.data.PackageInfo;
import org.parcel.registry.data.PackageRecord;
import org.parcel.registry.data.PackageSummary;
import org.parcel.registry.data.PublishRequest;
import org.parcel.registry.data.PublishResult;
import org.parcel.registry.data.RegistryStats;
import org.parcel.registry.data.VersionRecord;
import org.parcel.registry.exception.RegistryException;
import org.parcel.registry.exception.RegistryException.ArtifactMissingException;
import org.parcel.registry.exception.RegistryException.GoneException;
import org.parcel.registry.exception.RegistryException.InvalidInputException;
import org.parcel.registry.exception.RegistryException.StorageException;
import org.parcel.registry.exception.RegistryException.UnauthenticatedException;
import org.parcel.registry.exception.RegistryException.VersionNotFoundException;
import org.parcel.registry.ownership.OwnershipRegistry;
import org.parcel.registry.publish.PublishPipeline;
import org.parcel.registry.search.SearchIndex;
import org.parcel.registry.store.PackageStore;

// The implementation of the registry surface.
@Slf4j
public class PackagesImpl implements Packages {

    private final PackageStore packageStore;
    private final BlobStore blobStore;
    private final OwnershipRegistry ownershipRegistry;
    private final AuthorizationService authorizationService;
    private final Authenticator authenticator;
    private final PublishPipeline publishPipeline;
    private final SearchIndex searchIndex;
    private final DownloadCounter downloadCounter;
    private final DownloadLocator downloadLocator;

    public PackagesImpl(PackageStore packageStore, BlobStore blobStore, OwnershipRegistry ownershipRegistry,
                        AuthorizationService authorizationService, Authenticator authenticator,
                        PublishPipeline publishPipeline, SearchIndex searchIndex, DownloadCounter downloadCounter,
                        DownloadLocator downloadLocator) {
        this.packageStore = packageStore;
        this.blobStore = blobStore;
        this.ownershipRegistry = ownershipRegistry;
        this.authorizationService = authorizationService;
        this.authenticator = authenticator;
        this.publishPipeline = publishPipeline;
        this.searchIndex = searchIndex;
        this.downloadCounter = downloadCounter;
        this.downloadLocator = downloadLocator;
    }

    @Override
    public CompletableFuture<PackageInfo> getPackage(String name) {
        return checkName(name)
                .thenCompose(__ -> packageStore.get(name))
                .thenApply(record -> {
                    List<PackageInfo.VersionInfo> versions = record.getVersions().stream()
                            .map(v -> new PackageInfo.VersionInfo(v, downloadLocator.url(name, v.getVersion())))
                            .collect(Collectors.toList());
                    PackageInfo info = new PackageInfo(record, versions);
                    downloadCounter.record(name);
                    return info;
                });
    }

    @Override
    public CompletableFuture<VersionRecord> getVersion(String name, String version) {
        return checkName(name)
                .thenCompose(__ -> packageStore.get(name))
                .thenApply(record -> record.findVersion(version).orElseThrow(
                        () -> wrapToCompletionException(new VersionNotFoundException(name, version))));
    }

    @Override
    public CompletableFuture<Optional<VersionRecord>> latestVersion(String name) {
        return checkName(name)
                .thenCompose(__ -> packageStore.get(name))
                .thenApply(PackageRecord::latestVersion);
    }

    @Override
    public CompletableFuture<DownloadResult> download(String name, String version) {
        return downloadableVersion(name, version).thenCompose(v -> blobStore.read(blobKey(name, version))
                .handle((data, ex) -> {
                    if (ex != null) {
                        throw wrapToCompletionException(translateBlobFailure(name, version, ex));
                    }
                    String checksum = ChecksumEngine.digest(data);
                    if (!checksum.equals(v.getChecksum())) {
                        log.error("[{}@{}] Artifact checksum {} does not match recorded checksum {}", name, version,
                                checksum, v.getChecksum());
                        throw wrapToCompletionException(
                                new StorageException("Package artifact for '" + name + "@" + version
                                        + "' is corrupted"));
                    }
                    return new DownloadResult(name, version, data, v.getChecksum());
                }));
    }

    @Override
    public CompletableFuture<VersionRecord> download(String name, String version, OutputStream outputStream) {
        return downloadableVersion(name, version).thenCompose(v -> blobStore.read(blobKey(name, version),
                        outputStream)
                .handle((__, ex) -> {
                    if (ex != null) {
                        throw wrapToCompletionException(translateBlobFailure(name, version, ex));
                    }
                    return v;
                }));
    }

    private CompletableFuture<VersionRecord> downloadableVersion(String name, String version) {
        return getVersion(name, version).thenApply(v -> {
            if (v.isYanked()) {
                throw wrapToCompletionException(new GoneException(name, version));
            }
            return v;
        });
    }

    private static RegistryException translateBlobFailure(String name, String version, Throwable ex) {
        Throwable cause = FutureUtil.unwrapCompletionException(ex);
        if (cause instanceof BlobStoreException.NotFoundException) {
            log.error("[{}@{}] Version is recorded but its artifact is missing", name, version);
            return new ArtifactMissingException(name, version);
        }
        log.warn("[{}@{}] Failed to read artifact", name, version, cause);
        return new StorageException(cause);
    }

    @Override
    public CompletableFuture<PublishResult> publish(String credential, PublishRequest request) {
        return publishPipeline.publish(credential, request);
    }

    @Override
    public CompletableFuture<PublishResult> publish(Identity identity, PublishRequest request) {
        return publishPipeline.publish(identity, request);
    }

    @Override
    public CompletableFuture<VersionRecord> yank(String credential, String name, String version) {
        return authenticator.authenticateAsync(credential).thenCompose(identity -> yank(identity, name, version));
    }

    @Override
    public CompletableFuture<VersionRecord> yank(Identity identity, String name, String version) {
        return setYanked(identity, name, version, true);
    }

    @Override
    public CompletableFuture<VersionRecord> unyank(String credential, String name, String version) {
        return authenticator.authenticateAsync(credential).thenCompose(identity -> unyank(identity, name, version));
    }

    @Override
    public CompletableFuture<VersionRecord> unyank(Identity identity, String name, String version) {
        return setYanked(identity, name, version, false);
    }

    private CompletableFuture<VersionRecord> setYanked(Identity identity, String name, String version,
                                                       boolean yanked) {
        if (identity == null) {
            return FutureUtil.failedFuture(new UnauthenticatedException("Authentication required"));
        }
        return checkName(name)
                .thenCompose(__ -> packageStore.get(name))
                .thenCompose(record -> {
                    if (!record.hasVersion(version)) {
                        return FutureUtil.<Void>failedFuture(new VersionNotFoundException(name, version));
                    }
                    return authorizationService.checkCanMutateAsync(identity, record);
                })
                .thenCompose(__ -> packageStore.setYanked(name, version, yanked))
                .thenApply(v -> {
                    log.info("[{}@{}] {} by {}", name, version, yanked ? "Yanked" : "Unyanked",
                            identity.getOwnerId());
                    return v;
                });
    }

    @Override
    public CompletableFuture<PackageRecord> updateMetadata(Identity identity, String name, DescriptiveUpdate update) {
        if (identity == null) {
            return FutureUtil.failedFuture(new UnauthenticatedException("Authentication required"));
        }
        return checkName(name)
                .thenCompose(__ -> packageStore.get(name))
                .thenCompose(record -> authorizationService.checkCanMutateAsync(identity, record))
                .thenCompose(__ -> packageStore.updateDescriptiveFields(name, update));
    }

    @Override
    public CompletableFuture<List<PackageSummary>> list() {
        return packageStore.list().thenApply(records -> records.stream()
                .map(PackageSummary::of)
                .collect(Collectors.toList()));
    }

    @Override
    public CompletableFuture<List<PackageRecord>> search(String query) {
        return searchIndex.search(query);
    }

    @Override
    public CompletableFuture<List<String>> ownedPackages(Identity identity) {
        if (identity == null) {
            return FutureUtil.failedFuture(new UnauthenticatedException("Authentication required"));
        }
        return ownershipRegistry.packagesOwnedBy(identity.getOwnerId());
    }

    @Override
    public CompletableFuture<RegistryStats> stats() {
        return packageStore.list().thenApply(records -> new RegistryStats(
                records.size(),
                records.stream().mapToLong(PackageRecord::getDownloads).sum(),
                records.stream().mapToLong(r -> r.getVersions().size()).sum()));
    }

    private static CompletableFuture<Void> checkName(String name) {
        if (!PackageName.isValidName(name)) {
            return FutureUtil.failedFuture(new InvalidInputException("Invalid package name '" + name + "'"));
        }
        return CompletableFuture.completedFuture(null);
    }

    private static String blobKey(String name, String version) {
        return PackageName.get(name, version).getBlobPath();
    }
}
