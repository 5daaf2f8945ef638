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
package org.parcel.registry.publish;

import static org.apache.pulsar.common.util.FutureUtil.wrapToCompletionException;
import com.google.common.collect.ImmutableMap;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.pulsar.common.util.FutureUtil;
import org.parcel.common.checksum.ChecksumEngine;
import org.parcel.common.naming.PackageName;
import org.parcel.common.version.Version;
import org.parcel.registry.DownloadLocator;
import org.parcel.registry.RegistryConfiguration;
import org.parcel.registry.authentication.Authenticator;
import org.parcel.registry.authentication.Identity;
import org.parcel.registry.authorization.AuthorizationService;
import org.parcel.registry.blob.BlobStore;
import org.parcel.registry.data.PackageDefaults;
import org.parcel.registry.data.PublishRequest;
import org.parcel.registry.data.PublishResult;
import org.parcel.registry.data.Reservation;
import org.parcel.registry.data.VersionRecord;
import org.parcel.registry.exception.RegistryException;
import org.parcel.registry.exception.RegistryException.ForbiddenException;
import org.parcel.registry.exception.RegistryException.InvalidInputException;
import org.parcel.registry.exception.RegistryException.StorageException;
import org.parcel.registry.exception.RegistryException.UnauthenticatedException;
import org.parcel.registry.exception.RegistryException.VersionAlreadyExistsException;
import org.parcel.registry.ownership.OwnershipRegistry;
import org.parcel.registry.store.PackageStore;

/**
 * Turns a publish request into a committed version.
 *
 * <p>The version slot is reserved in the {@link PackageStore} before the artifact is written, so a duplicate never
 * touches the blob store. A failure after the reservation removes the reserved version and deletes the artifact
 * again, leaving no trace of the failed publish.
 */
@Slf4j
public class PublishPipeline {

    static final String METADATA_CHECKSUM = "checksum";
    static final String METADATA_PUBLISHER = "publisher";
    static final String METADATA_PUBLISHED_AT = "published_at";

    private final PackageStore packageStore;
    private final BlobStore blobStore;
    private final OwnershipRegistry ownershipRegistry;
    private final AuthorizationService authorizationService;
    private final Authenticator authenticator;
    private final DownloadLocator downloadLocator;
    private final RegistryConfiguration config;
    private final Clock clock;

    public PublishPipeline(PackageStore packageStore, BlobStore blobStore, OwnershipRegistry ownershipRegistry,
                           AuthorizationService authorizationService, Authenticator authenticator,
                           DownloadLocator downloadLocator, RegistryConfiguration config, Clock clock) {
        this.packageStore = packageStore;
        this.blobStore = blobStore;
        this.ownershipRegistry = ownershipRegistry;
        this.authorizationService = authorizationService;
        this.authenticator = authenticator;
        this.downloadLocator = downloadLocator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Authenticate the credential, then publish.
     */
    public CompletableFuture<PublishResult> publish(String credential, PublishRequest request) {
        return authenticator.authenticateAsync(credential).thenCompose(identity -> publish(identity, request));
    }

    /**
     * Publish on behalf of an already authenticated identity.
     *
     * @return the result, or a future failed with a {@link RegistryException}
     */
    public CompletableFuture<PublishResult> publish(Identity identity, PublishRequest request) {
        if (request == null) {
            return FutureUtil.failedFuture(new InvalidInputException("Missing publish request"));
        }
        PublishContext ctx = new PublishContext(request);
        if (identity == null) {
            return FutureUtil.failedFuture(new UnauthenticatedException("Authentication required"));
        }
        ctx.setIdentity(identity);
        ctx.transition(PublishState.AUTHENTICATED);

        try {
            validate(request);
        } catch (InvalidInputException e) {
            if (log.isDebugEnabled()) {
                log.debug("[{}] Rejected publish: {}", ctx, e.getMessage());
            }
            return FutureUtil.failedFuture(e);
        }
        ctx.transition(PublishState.VALIDATED);

        return packageStore.find(ctx.getName())
                .thenCompose(existing -> {
                    ctx.setPackageExisted(existing.isPresent());
                    if (existing.isPresent() && existing.get().hasVersion(ctx.getVersion())) {
                        return FutureUtil.<Void>failedFuture(
                                new VersionAlreadyExistsException(ctx.getName(), ctx.getVersion()));
                    }
                    if (existing.isPresent()) {
                        return authorizationService.checkCanMutateAsync(identity, existing.get());
                    }
                    return CompletableFuture.<Void>completedFuture(null);
                })
                .thenCompose(__ -> {
                    ctx.setVersionRecord(newVersionRecord(request));
                    ctx.transition(PublishState.CHECKSUM_COMPUTED);
                    return packageStore.createOrAppendVersion(ctx.getName(), ctx.getVersionRecord(),
                            packageDefaults(request, identity));
                })
                .thenCompose(reservation -> {
                    ctx.setPackageCreated(reservation.isCreated());
                    ctx.setPackageOwner(reservation.getRecord().getOwner());
                    ctx.transition(PublishState.SLOT_RESERVED);
                    return authorizeLateArrival(ctx, reservation);
                })
                .thenCompose(__ -> writeArtifact(ctx))
                .thenCompose(__ -> {
                    ctx.transition(PublishState.BLOB_WRITTEN);
                    return commit(ctx);
                })
                .thenApply(__ -> {
                    ctx.transition(PublishState.COMMITTED);
                    VersionRecord version = ctx.getVersionRecord();
                    log.info("[{}] Published {} bytes, checksum {}", ctx, version.getSize(), version.getChecksum());
                    return new PublishResult(ctx.getName(), ctx.getVersion(), version.getChecksum(),
                            version.getSize(), downloadLocator.url(ctx.getName(), ctx.getVersion()));
                })
                .exceptionally(ex -> {
                    RegistryException e = RegistryException.unwrap(ex);
                    if (e instanceof StorageException) {
                        log.error("[{}] Publish failed after {}", ctx, ctx.getState(), e);
                    } else if (log.isDebugEnabled()) {
                        log.debug("[{}] Publish failed after {}: {}", ctx, ctx.getState(), e.getMessage());
                    }
                    throw wrapToCompletionException(e);
                });
    }

    /**
     * The package may have been created by a concurrent publish between the authorization check and the
     * reservation. The appended version is only kept if the identity may mutate that package, which includes being
     * its recorded creator while the creating publish is still in flight.
     */
    private CompletableFuture<Void> authorizeLateArrival(PublishContext ctx, Reservation reservation) {
        if (reservation.isCreated() || ctx.isPackageExisted()) {
            return CompletableFuture.completedFuture(null);
        }
        return authorizationService.canMutateAsync(ctx.getIdentity(), reservation.getRecord())
                .thenCompose(allowed -> {
                    if (allowed) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    log.info("[{}] Package was created concurrently by another owner, undoing reservation", ctx);
                    return packageStore.removeVersion(ctx.getName(), ctx.getVersion())
                            .thenCompose(__ -> FutureUtil.<Void>failedFuture(
                                    new ForbiddenException("Not authorized to modify this package")));
                });
    }

    private CompletableFuture<Void> writeArtifact(PublishContext ctx) {
        VersionRecord version = ctx.getVersionRecord();
        Map<String, String> metadata = ImmutableMap.of(
                METADATA_CHECKSUM, version.getChecksum(),
                METADATA_PUBLISHER, ctx.getIdentity().getOwnerId(),
                METADATA_PUBLISHED_AT, Long.toString(version.getPublishedAt()));
        return blobStore.write(ctx.getBlobKey(), ctx.getRequest().getBody(), metadata)
                .handle((__, ex) -> {
                    if (ex == null) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    Throwable cause = FutureUtil.unwrapCompletionException(ex);
                    log.warn("[{}] Failed to write artifact, removing reserved version", ctx, cause);
                    return compensate(ctx, false).thenCompose(___ -> FutureUtil.<Void>failedFuture(
                            new StorageException("Failed to store package artifact", cause)));
                })
                .thenCompose(Function.identity());
    }

    /**
     * Grant ownership to the recorded creator. Every publish of the creator grants again, so a grant lost with a
     * failed first publish is restored by a later one.
     */
    private CompletableFuture<Void> commit(PublishContext ctx) {
        if (!ctx.isPackageCreated() && !ctx.getIdentity().getOwnerId().equals(ctx.getPackageOwner())) {
            return CompletableFuture.completedFuture(null);
        }
        return ownershipRegistry.grant(ctx.getIdentity().getOwnerId(), ctx.getName())
                .handle((__, ex) -> {
                    if (ex == null) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    Throwable cause = FutureUtil.unwrapCompletionException(ex);
                    log.warn("[{}] Failed to grant ownership, rolling back publish", ctx, cause);
                    return compensate(ctx, true).thenCompose(___ -> FutureUtil.<Void>failedFuture(
                            new StorageException("Failed to record package ownership", cause)));
                })
                .thenCompose(Function.identity());
    }

    /**
     * Delete the artifact, then remove the reserved version. The slot stays reserved until the delete is done, so a
     * retried publish of the same version cannot write an artifact the delete would remove. Failures are logged and
     * do not replace the original error.
     */
    private CompletableFuture<Void> compensate(PublishContext ctx, boolean artifactWritten) {
        // a failed write may still have left content behind
        return blobStore.delete(ctx.getBlobKey())
                .exceptionally(ex -> {
                    if (artifactWritten) {
                        log.error("[{}] Failed to delete artifact of rolled back publish", ctx,
                                FutureUtil.unwrapCompletionException(ex));
                    } else {
                        log.warn("[{}] Failed to delete partial artifact", ctx,
                                FutureUtil.unwrapCompletionException(ex));
                    }
                    return null;
                })
                .thenCompose(__ -> packageStore.removeVersion(ctx.getName(), ctx.getVersion()))
                .exceptionally(ex -> {
                    log.error("[{}] Failed to remove reserved version, the package record needs manual cleanup",
                            ctx, FutureUtil.unwrapCompletionException(ex));
                    return null;
                });
    }

    private VersionRecord newVersionRecord(PublishRequest request) {
        byte[] body = request.getBody();
        return VersionRecord.builder()
                .version(request.getVersion())
                .publishedAt(clock.millis())
                .yanked(false)
                .checksum(ChecksumEngine.digest(body))
                .size(body.length)
                .signature(StringUtils.defaultIfBlank(request.getSignature(), null))
                .publisherFingerprint(StringUtils.defaultIfBlank(request.getFingerprint(), null))
                .build();
    }

    private PackageDefaults packageDefaults(PublishRequest request, Identity identity) {
        List<String> authors = request.getAuthors() != null && !request.getAuthors().isEmpty()
                ? new ArrayList<>(request.getAuthors())
                : new ArrayList<>(List.of(identity.getDisplayName()));
        return PackageDefaults.builder()
                .owner(identity.getOwnerId())
                .description(StringUtils.defaultString(request.getDescription()))
                .authors(authors)
                .license(StringUtils.defaultIfBlank(request.getLicense(), config.getDefaultLicense()))
                .repository(StringUtils.defaultIfBlank(request.getRepository(), null))
                .homepage(StringUtils.defaultIfBlank(request.getHomepage(), null))
                .keywords(request.getKeywords() != null ? new ArrayList<>(request.getKeywords()) : new ArrayList<>())
                .build();
    }

    void validate(PublishRequest request) throws InvalidInputException {
        if (request.getBody() == null || request.getBody().length == 0) {
            throw new InvalidInputException("Empty package tarball");
        }
        if (request.getBody().length > config.getMaxPackageSizeBytes()) {
            throw new InvalidInputException("Package tarball exceeds the maximum size of "
                    + config.getMaxPackageSizeBytes() + " bytes");
        }
        if (StringUtils.isBlank(request.getName()) || StringUtils.isBlank(request.getVersion())) {
            throw new InvalidInputException("Missing package name or version");
        }
        if (!PackageName.isValidName(request.getName())) {
            throw new InvalidInputException("Invalid package name. Must start with lowercase letter and contain"
                    + " only lowercase letters, numbers, underscores, and hyphens.");
        }
        if (!Version.isValid(request.getVersion())) {
            throw new InvalidInputException("Invalid version format. Expected semver (e.g., 1.0.0)");
        }
        if (request.getKeywords() != null && request.getKeywords().stream().anyMatch(StringUtils::isBlank)) {
            throw new InvalidInputException("Keywords must not be blank");
        }
        if (request.getAuthors() != null && request.getAuthors().stream().anyMatch(StringUtils::isBlank)) {
            throw new InvalidInputException("Authors must not be blank");
        }
    }
}
