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

import static org.apache.pulsar.common.util.FutureUtil.wrapToCompletionException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.common.util.FutureUtil;
import org.apache.pulsar.metadata.api.MetadataStore;
import org.apache.pulsar.metadata.api.MetadataStoreException;
import org.parcel.common.checksum.ChecksumEngine;
import org.parcel.common.naming.PackageName;
import org.parcel.common.version.Version;
import org.parcel.registry.data.DescriptiveUpdate;
import org.parcel.registry.data.PackageDefaults;
import org.parcel.registry.data.PackageRecord;
import org.parcel.registry.data.Reservation;
import org.parcel.registry.data.VersionRecord;
import org.parcel.registry.exception.RegistryException;
import org.parcel.registry.exception.RegistryException.InvalidInputException;
import org.parcel.registry.exception.RegistryException.PackageNotFoundException;
import org.parcel.registry.exception.RegistryException.StorageException;
import org.parcel.registry.exception.RegistryException.VersionAlreadyExistsException;
import org.parcel.registry.exception.RegistryException.VersionNotFoundException;

/**
 * {@link PackageStore} on top of a Pulsar {@link MetadataStore}, one node per package at
 * {@code /parcel/packages/<name>}.
 *
 * <p>Records are cached by the metadata store, so every record handed to a caller is a copy.
 *
 * <p>Every mutation is a read-modify-write with an expected node version; a concurrent writer of the same package
 * makes the write fail with a bad version and the modification is re-applied to the fresh record. Packages never
 * share a node, so writers of different packages never contend.
 */
@Slf4j
public class MetadataPackageStore extends BaseResources<PackageRecord> implements PackageStore {

    static final String PACKAGES_PATH = BASE_PATH + "/packages";

    private static final Comparator<PackageRecord> MOST_RECENTLY_UPDATED =
            Comparator.comparingLong(PackageRecord::getUpdatedAt).reversed()
                    .thenComparing(PackageRecord::getName);

    private static final Comparator<VersionRecord> NEWEST_FIRST =
            Comparator.comparing(VersionRecord::getVersion, Version.NEWEST_FIRST);

    private final Clock clock;

    public MetadataPackageStore(MetadataStore store, Clock clock) {
        super(store, new RecordSerde<>(PackageRecord.class, MetadataPackageStore::validate));
        this.clock = clock;
    }

    @Override
    public CompletableFuture<PackageRecord> get(String name) {
        return find(name).thenApply(record -> record.orElseThrow(
                () -> wrapToCompletionException(new PackageNotFoundException(name))));
    }

    @Override
    public CompletableFuture<Optional<PackageRecord>> find(String name) {
        return getAsync(packagePath(name))
                .thenApply(record -> record.map(PackageRecord::copy))
                .exceptionally(ex -> {
                    throw wrapToCompletionException(translate(name, ex));
                });
    }

    @Override
    public CompletableFuture<List<PackageRecord>> list() {
        return getChildrenAsync(PACKAGES_PATH).thenCompose(names -> {
            List<CompletableFuture<Optional<PackageRecord>>> futures = names.stream()
                    .map(name -> getAsync(packagePath(name)))
                    .collect(Collectors.toList());
            return FutureUtil.waitForAll(futures).thenApply(__ -> futures.stream()
                    .map(CompletableFuture::join)
                    // a package can disappear between listing and reading when its only reservation is undone
                    .flatMap(Optional::stream)
                    .map(PackageRecord::copy)
                    .sorted(MOST_RECENTLY_UPDATED)
                    .collect(Collectors.toList()));
        }).exceptionally(ex -> {
            throw wrapToCompletionException(new StorageException(FutureUtil.unwrapCompletionException(ex)));
        });
    }

    @Override
    public CompletableFuture<Reservation> createOrAppendVersion(String name, VersionRecord version,
                                                                PackageDefaults defaults) {
        if (!PackageName.isValidName(name)) {
            return FutureUtil.failedFuture(new InvalidInputException("Invalid package name '" + name + "'"));
        }
        if (version == null || !Version.isValid(version.getVersion())) {
            return FutureUtil.failedFuture(new InvalidInputException("Invalid version format. Expected semver"
                    + " (e.g., 1.0.0)"));
        }
        AtomicBoolean created = new AtomicBoolean();
        return updateOrCreateAsync(packagePath(name), existing -> {
            long now = clock.millis();
            PackageRecord record;
            if (existing.isPresent()) {
                record = existing.get().copy();
                if (record.hasVersion(version.getVersion())) {
                    throw wrapToCompletionException(new VersionAlreadyExistsException(name, version.getVersion()));
                }
                created.set(false);
            } else {
                record = newPackage(name, defaults, now);
                created.set(true);
            }
            record.getVersions().add(version.copy());
            record.getVersions().sort(NEWEST_FIRST);
            record.setUpdatedAt(now);
            return record;
        }).thenApply(record -> {
            if (log.isDebugEnabled()) {
                log.debug("[{}@{}] Reserved version slot, created package: {}", name, version.getVersion(),
                        created.get());
            }
            return new Reservation(record.copy(), created.get());
        }).exceptionally(ex -> {
            throw wrapToCompletionException(translate(name, ex));
        });
    }

    @Override
    public CompletableFuture<VersionRecord> setYanked(String name, String version, boolean yanked) {
        return get(name).thenCompose(record -> {
            VersionRecord current = record.findVersion(version).orElseThrow(
                    () -> wrapToCompletionException(new VersionNotFoundException(name, version)));
            if (current.isYanked() == yanked) {
                return CompletableFuture.completedFuture(current);
            }
            return updateAsync(packagePath(name), existing -> {
                PackageRecord copy = existing.copy();
                VersionRecord target = copy.findVersion(version).orElseThrow(
                        () -> wrapToCompletionException(new VersionNotFoundException(name, version)));
                target.setYanked(yanked);
                copy.setUpdatedAt(clock.millis());
                return copy;
            }).thenApply(updated -> updated.findVersion(version).get().copy());
        }).exceptionally(ex -> {
            throw wrapToCompletionException(translate(name, ex));
        });
    }

    @Override
    public CompletableFuture<Void> incrementDownloads(String name) {
        return updateAsync(packagePath(name), existing -> {
            PackageRecord copy = existing.copy();
            copy.setDownloads(copy.getDownloads() + 1);
            return copy;
        }).<Void>thenApply(__ -> null).exceptionally(ex -> {
            throw wrapToCompletionException(translate(name, ex));
        });
    }

    @Override
    public CompletableFuture<PackageRecord> updateDescriptiveFields(String name, DescriptiveUpdate update) {
        if (update == null || !update.hasChanges()) {
            return get(name);
        }
        return updateAsync(packagePath(name), existing -> {
            PackageRecord copy = existing.copy();
            if (update.getDescription() != null) {
                copy.setDescription(update.getDescription());
            }
            if (update.getAuthors() != null) {
                copy.setAuthors(new ArrayList<>(update.getAuthors()));
            }
            if (update.getLicense() != null) {
                copy.setLicense(update.getLicense());
            }
            if (update.getRepository() != null) {
                copy.setRepository(update.getRepository());
            }
            if (update.getHomepage() != null) {
                copy.setHomepage(update.getHomepage());
            }
            if (update.getKeywords() != null) {
                copy.setKeywords(new ArrayList<>(update.getKeywords()));
            }
            copy.setUpdatedAt(clock.millis());
            return copy;
        }).thenApply(PackageRecord::copy).exceptionally(ex -> {
            throw wrapToCompletionException(translate(name, ex));
        });
    }

    @Override
    public CompletableFuture<Void> removeVersion(String name, String version) {
        String path = packagePath(name);
        return getCache().getWithStats(path).thenCompose(result -> {
            if (result.isEmpty() || !result.get().getValue().hasVersion(version)) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            if (result.get().getValue().getVersions().size() == 1) {
                long expectedVersion = result.get().getStat().getVersion();
                return getStore().delete(path, Optional.of(expectedVersion))
                        .thenRun(() -> getCache().invalidate(path))
                        .handle((__, ex) -> {
                            if (ex == null) {
                                log.info("[{}@{}] Removed package record with its only version", name, version);
                                return CompletableFuture.<Void>completedFuture(null);
                            }
                            Throwable cause = FutureUtil.unwrapCompletionException(ex);
                            if (cause instanceof MetadataStoreException.BadVersionException) {
                                // another version was added meanwhile, start over
                                return removeVersion(name, version);
                            } else if (cause instanceof MetadataStoreException.NotFoundException) {
                                return CompletableFuture.<Void>completedFuture(null);
                            }
                            return FutureUtil.<Void>failedFuture(cause);
                        }).thenCompose(Function.identity());
            }
            return updateAsync(path, existing -> {
                PackageRecord copy = existing.copy();
                copy.getVersions().removeIf(v -> v.getVersion().equals(version));
                if (copy.getVersions().isEmpty()) {
                    throw wrapToCompletionException(new LastVersionRemovalException());
                }
                return copy;
            }).handle((__, ex) -> {
                if (ex == null) {
                    log.info("[{}@{}] Removed version", name, version);
                    return CompletableFuture.<Void>completedFuture(null);
                }
                Throwable cause = FutureUtil.unwrapCompletionException(ex);
                if (cause instanceof LastVersionRemovalException) {
                    return removeVersion(name, version);
                }
                return FutureUtil.<Void>failedFuture(cause);
            }).thenCompose(Function.identity());
        }).exceptionally(ex -> {
            throw wrapToCompletionException(translate(name, ex));
        });
    }

    private PackageRecord newPackage(String name, PackageDefaults defaults, long now) {
        PackageDefaults d = defaults != null ? defaults : new PackageDefaults();
        return PackageRecord.builder()
                .name(name)
                .owner(d.getOwner())
                .description(d.getDescription() != null ? d.getDescription() : "")
                .authors(d.getAuthors() != null ? new ArrayList<>(d.getAuthors()) : new ArrayList<>())
                .license(d.getLicense())
                .repository(d.getRepository())
                .homepage(d.getHomepage())
                .keywords(d.getKeywords() != null ? new ArrayList<>(d.getKeywords()) : new ArrayList<>())
                .downloads(0)
                .versions(new ArrayList<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    static String packagePath(String name) {
        return joinPath(PACKAGES_PATH, name);
    }

    private static RegistryException translate(String name, Throwable ex) {
        Throwable cause = FutureUtil.unwrapCompletionException(ex);
        if (cause instanceof RegistryException) {
            return (RegistryException) cause;
        } else if (cause instanceof MetadataStoreException.NotFoundException) {
            return new PackageNotFoundException(name);
        }
        log.warn("[{}] Metadata store operation failed", name, cause);
        return new StorageException(cause);
    }

    /**
     * Checks the invariants of a package record. Used on every read and write of the metadata store.
     */
    static void validate(PackageRecord record) {
        PackageName.validateName(record.getName());
        if (record.getVersions() == null || record.getVersions().isEmpty()) {
            throw new IllegalArgumentException("Package '" + record.getName() + "' has no versions");
        }
        if (record.getDownloads() < 0) {
            throw new IllegalArgumentException("Negative download count for '" + record.getName() + "'");
        }
        Set<String> seen = new HashSet<>();
        for (VersionRecord version : record.getVersions()) {
            Version.parse(version.getVersion());
            if (!seen.add(version.getVersion())) {
                throw new IllegalArgumentException("Duplicate version " + version.getVersion());
            }
            if (!ChecksumEngine.isChecksum(version.getChecksum())) {
                throw new IllegalArgumentException("Invalid checksum for version " + version.getVersion());
            }
            if (version.getSize() <= 0) {
                throw new IllegalArgumentException("Invalid size for version " + version.getVersion());
            }
        }
    }

    @SuppressWarnings("serial")
    private static class LastVersionRemovalException extends RuntimeException {
        LastVersionRemovalException() {
            super(null, null, false, false);
        }
    }
}
